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

import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A lexical token together with its literal text and its position in the source string.
 */
public final class Token {
    private final Kind kind;
    private final String text;
    private final int position;

    public Token(Kind kind, String text, int position) {
        this.kind = Objects.requireNonNull(kind);
        this.text = Objects.requireNonNull(text);
        this.position = position;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * The literal source text, e.g. {@code "|"} for an {@link Kind#OR} written with a bar.
     */
    public String text() {
        return text;
    }

    public int position() {
        return position;
    }

    /**
     * Returns the end offset (exclusive) of this token in the source string.
     */
    public int end() {
        return position + text.length();
    }

    /**
     * Whether this token may start an operand. A token for which this holds directly following a
     * token which {@link #endsOperand() ends an operand} is an implicit AND.
     */
    public boolean startsOperand() {
        return kind == Kind.IDENTIFIER || kind == Kind.CONSTANT || kind == Kind.NOT || kind == Kind.OPEN_PAREN;
    }

    public boolean endsOperand() {
        return kind == Kind.IDENTIFIER || kind == Kind.CONSTANT || kind == Kind.CLOSE_PAREN;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Token)) {
            return false;
        }
        Token that = (Token) object;
        return position == that.position && kind == that.kind && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, position);
    }

    @Override
    public String toString() {
        return kind + "[" + text + "]@" + position;
    }

    public enum Kind {
        IDENTIFIER(null),
        CONSTANT(null),
        OR(Operator.OR),
        AND(Operator.AND),
        XOR(Operator.XOR),
        NAND(Operator.NAND),
        NOR(Operator.NOR),
        NOT(Operator.NOT),
        OPEN_PAREN(null),
        CLOSE_PAREN(null);

        @Nullable
        private final Operator operator;

        Kind(@Nullable Operator operator) {
            this.operator = operator;
        }

        /**
         * Returns the operator denoted by tokens of this kind or {@code null} for operands and
         * parentheses.
         */
        @Nullable
        public Operator operator() {
            return operator;
        }
    }
}
