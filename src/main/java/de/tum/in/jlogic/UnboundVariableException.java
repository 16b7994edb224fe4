/*
 * This file is part of JLogic.
 * Copyright (c) 2026 (See AUTHORS).
 *
 * JLogic is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JLogic is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JLogic. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jlogic;

/**
 * Thrown when an expression is evaluated under an assignment which does not bind one of its
 * variables. Assignments handed to the evaluator must always be total, so this indicates a bug in
 * the caller rather than bad user input.
 */
public final class UnboundVariableException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final String name;

    public UnboundVariableException(String name) {
        super("No value assigned to variable " + name);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
