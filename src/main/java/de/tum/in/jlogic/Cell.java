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
 * The value of a truth table entry.
 */
public enum Cell {
    LOW('0'),
    HIGH('1'),
    /** The output is irrelevant and may be chosen freely by a minimizer. */
    DONT_CARE('*'),
    /** No value was given; must be resolved before minimization. */
    UNSPECIFIED('?');

    private final char symbol;

    Cell(char symbol) {
        this.symbol = symbol;
    }

    public static Cell of(boolean value) {
        return value ? HIGH : LOW;
    }

    public static Cell fromSymbol(char symbol) {
        for (Cell cell : values()) {
            if (cell.symbol == symbol) {
                return cell;
            }
        }
        throw new IllegalArgumentException("Unknown cell symbol " + symbol);
    }

    public char symbol() {
        return symbol;
    }

    public boolean isDefined() {
        return this == LOW || this == HIGH;
    }
}
