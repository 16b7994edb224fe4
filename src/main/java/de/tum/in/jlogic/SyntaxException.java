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

public final class SyntaxException extends ExpressionParseException {
    static final String END_OF_INPUT = "end of input";

    private static final long serialVersionUID = 1L;

    private final String expected;
    private final String found;

    public SyntaxException(int position, String expected, String found) {
        super(String.format("Expected %s at position %d, found %s", expected, position, found), position);
        this.expected = expected;
        this.found = found;
    }

    /**
     * Describes what the grammar allowed at {@link #position()}, e.g. {@code "operand"} or
     * {@code "')'"}.
     */
    public String expected() {
        return expected;
    }

    /**
     * The offending token text, or {@code "end of input"}.
     */
    public String found() {
        return found;
    }
}
