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
 * The operators of the expression language.
 *
 * <p>The binding strength is a number where smaller values bind tighter, i.e. {@code A + B C}
 * groups as {@code A + (B C)} since {@link #AND} has a smaller value than {@link #OR}. Leaves and
 * parenthesized groups use {@link #ATOM_BINDING}.</p>
 */
public enum Operator {
    OR('+', 12, true),
    AND('*', 10, true),
    XOR('^', 12, true),
    NAND('@', 11, false),
    NOR('%', 12, false),
    NOT('!', 9, true);

    static final int ATOM_BINDING = 5;

    private final char symbol;
    private final int binding;
    private final boolean associative;

    Operator(char symbol, int binding, boolean associative) {
        this.symbol = symbol;
        this.binding = binding;
        this.associative = associative;
    }

    /**
     * The canonical ASCII spelling of this operator.
     */
    public char symbol() {
        return symbol;
    }

    public int binding() {
        return binding;
    }

    /**
     * Whether {@code (a op b) op c} and {@code a op (b op c)} denote the same function. This is
     * false for NAND and NOR, chains of which must never be regrouped.
     */
    public boolean isAssociative() {
        return associative;
    }

    public boolean isBinary() {
        return this != NOT;
    }

    boolean apply(boolean left, boolean right) {
        switch (this) {
            case OR:
                return left || right;
            case AND:
                return left && right;
            case XOR:
                return left ^ right;
            case NAND:
                return !(left && right);
            case NOR:
                return !(left || right);
            default:
                throw new IllegalStateException("Not a binary operator: " + this);
        }
    }
}
