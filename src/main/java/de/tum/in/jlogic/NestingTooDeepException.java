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
 * Thrown when parentheses and negations are nested deeper than allowed.
 *
 * @see LogicConfiguration#maximumExpressionDepth()
 */
public final class NestingTooDeepException extends ExpressionParseException {
    private static final long serialVersionUID = 1L;

    private final int limit;

    public NestingTooDeepException(int position, int limit) {
        super(String.format("Nesting exceeds %d levels at position %d", limit, position), position);
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
