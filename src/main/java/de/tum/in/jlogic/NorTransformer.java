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
 * Rewrites an expression into one using only NOR gates and the constant 0.
 */
public final class NorTransformer extends ExpressionTransformer {
    private static final Expression ZERO = Expression.constant(false);

    @Override
    public Expression visit(Expression.Constant constant) {
        return constant.value() ? Expression.nor(ZERO, ZERO) : constant;
    }

    @Override
    public Expression visit(Expression.Not not) {
        return negate(not.operand().accept(this));
    }

    @Override
    protected Expression combine(Expression.Binary binary, Expression left, Expression right) {
        switch (binary.operator()) {
            case NOR:
                return Expression.nor(left, right);
            case OR:
                return negate(Expression.group(Expression.nor(left, right)));
            case AND:
                return and(left, right);
            case NAND:
                return negate(Expression.group(and(left, right)));
            case XOR:
                Expression equivalence = Expression.nor(
                    Expression.group(Expression.nor(negate(left), right)),
                    Expression.group(Expression.nor(left, negate(right))));
                return negate(Expression.group(equivalence));
            default:
                throw new IllegalStateException("Unexpected operator " + binary.operator());
        }
    }

    private static Expression negate(Expression operand) {
        return Expression.nor(operand, ZERO);
    }

    private static Expression and(Expression left, Expression right) {
        return Expression.nor(Expression.group(negate(left)), Expression.group(negate(right)));
    }
}
