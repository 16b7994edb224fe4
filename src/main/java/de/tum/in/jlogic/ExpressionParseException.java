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
 * Signals that a textual expression could not be turned into an {@link Expression}. No partial
 * result is ever produced when this is thrown.
 */
public abstract class ExpressionParseException extends Exception {
    private static final long serialVersionUID = 1L;

    private final int position;

    ExpressionParseException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Returns the zero-based character offset in the input at which the problem was detected.
     */
    public int position() {
        return position;
    }
}
