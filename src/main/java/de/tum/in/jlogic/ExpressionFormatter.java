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

import java.util.Deque;

/**
 * Renders expressions as text which the {@link Parser} reads back into the same tree.
 *
 * <p>Parentheses are only added where binding strength requires them, and {@link Expression.Group}
 * nodes always print theirs. Expressions produced by the parser therefore survive a
 * format-then-parse cycle unchanged.</p>
 */
public final class ExpressionFormatter {
    private static final ExpressionFormatter IMPLICIT = new ExpressionFormatter(true);
    private static final ExpressionFormatter EXPLICIT = new ExpressionFormatter(false);

    private final boolean implicitAnd;
    private final Printer printer = new Printer();

    private ExpressionFormatter(boolean implicitAnd) {
        this.implicitAnd = implicitAnd;
    }

    /**
     * Writes AND as juxtaposition, e.g. {@code A !B}.
     */
    public static ExpressionFormatter implicit() {
        return IMPLICIT;
    }

    /**
     * Writes AND as {@code A * !B}.
     */
    public static ExpressionFormatter explicit() {
        return EXPLICIT;
    }

    public static ExpressionFormatter of(LogicConfiguration configuration) {
        return configuration.implicitAnd() ? IMPLICIT : EXPLICIT;
    }

    public String format(Expression expression) {
        return expression.accept(printer);
    }

    private static int binding(Expression expression) {
        switch (expression.kind()) {
            case BINARY:
                return ((Expression.Binary) expression).operator().binding();
            case NOT:
                return Operator.NOT.binding();
            default:
                return Operator.ATOM_BINDING;
        }
    }

    private static String parenthesize(String text) {
        return "(" + text + ")";
    }

    private final class Printer implements ExpressionVisitor<String> {
        @Override
        public String visit(Expression.Constant constant) {
            return constant.value() ? "1" : "0";
        }

        @Override
        public String visit(Expression.Variable variable) {
            return variable.name();
        }

        @Override
        public String visit(Expression.Not not) {
            Expression operand = not.operand();
            String text = operand.accept(this);
            return operand.kind() == Expression.Kind.BINARY ? "!" + parenthesize(text) : "!" + text;
        }

        @Override
        public String visit(Expression.Binary binary) {
            Deque<Expression.Binary> spine = binary.leftSpine();
            Expression left = spine.peek().left();
            StringBuilder text = new StringBuilder(left.accept(this));
            while (!spine.isEmpty()) {
                Expression.Binary node = spine.pop();
                Operator operator = node.operator();
                int binding = operator.binding();
                if (binding(left) > binding) {
                    text.insert(0, '(').append(')');
                }

                Expression right = node.right();
                String rightText = right.accept(this);
                int rightBinding = binding(right);
                if (rightBinding > binding || (rightBinding == binding
                    && (!operator.isAssociative() || ((Expression.Binary) right).operator() != operator))) {
                    rightText = parenthesize(rightText);
                }

                if (operator == Operator.AND && implicitAnd) {
                    text.append(' ');
                } else {
                    text.append(' ').append(operator.symbol()).append(' ');
                }
                text.append(rightText);
                left = node;
            }
            return text.toString();
        }

        @Override
        public String visit(Expression.Group group) {
            return parenthesize(group.inner().accept(this));
        }
    }
}
