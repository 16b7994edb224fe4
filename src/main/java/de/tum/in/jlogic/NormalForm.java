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
 * The shape of a minimized expression.
 */
public enum NormalForm {
    /** Sum of products, covering the {@link Cell#HIGH} rows. */
    DNF(Cell.HIGH),
    /** Product of sums, covering the {@link Cell#LOW} rows. */
    CNF(Cell.LOW);

    private final Cell target;

    NormalForm(Cell target) {
        this.target = target;
    }

    /**
     * The cell value whose rows the terms of this form must cover.
     */
    public Cell target() {
        return target;
    }
}
