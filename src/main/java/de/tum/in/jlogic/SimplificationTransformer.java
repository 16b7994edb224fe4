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
 * Bottom-up constant folding and idempotence: {@code x 0 = 0}, {@code x 1 = x}, {@code x + 1 = 1},
 * {@code x + 0 = x}, {@code x x = x}, {@code x + x = x}, {@code !0 = 1} and {@code !1 = 0}.
 * Operators with two constant operands are evaluated. Redundant parentheses around atoms and groups
 * are dropped.
 */
public final class SimplificationTransformer extends ExpressionTransformer {
    @Override
    public Expression visit(Expression.Not not) {
        Expression operand = not.operand().accept(this);
        if (operand.kind() == Expression.Kind.CONSTANT) {
            return Expression.constant(!((Expression.Constant) operand).value());
        }
        return Expression.not(operand);
    }

    @Override
    protected Expression combine(Expression.Binary binary, Expression left, Expression right) {
        Operator operator = binary.operator();

        boolean leftConstant = left.kind() == Expression.Kind.CONSTANT;
        boolean rightConstant = right.kind() == Expression.Kind.CONSTANT;
        if (leftConstant && rightConstant) {
            return Expression.constant(operator.apply(((Expression.Constant) left).value(),
                ((Expression.Constant) right).value()));
        }

        switch (operator) {
            case AND:
            case OR:
                // AND absorbs into 0 and is neutral on 1, OR the other way round
                boolean absorbing = operator == Operator.OR;
                if (leftConstant) {
                    return ((Expression.Constant) left).value() == absorbing ? left : right;
                }
                if (rightConstant) {
                    return ((Expression.Constant) right).value() == absorbing ? right : left;
                }
                if (left.equals(right)) {
                    return left;
                }
                return Expression.binary(operator, left, right);
            default:
                return Expression.binary(operator, left, right);
        }
    }

    @Override
    public Expression visit(Expression.Group group) {
        Expression inner = group.inner().accept(this);
        switch (inner.kind()) {
            case CONSTANT:
            case VARIABLE:
            case GROUP:
                return inner;
            default:
                return Expression.group(inner);
        }
    }
}
