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
 * Rewrites an expression into one using only NAND gates and the constant 1.
 */
public final class NandTransformer extends ExpressionTransformer {
    private static final Expression ONE = Expression.constant(true);

    @Override
    public Expression visit(Expression.Constant constant) {
        return constant.value() ? constant : Expression.nand(ONE, ONE);
    }

    @Override
    public Expression visit(Expression.Not not) {
        return negate(not.operand().accept(this));
    }

    @Override
    protected Expression combine(Expression.Binary binary, Expression left, Expression right) {
        switch (binary.operator()) {
            case NAND:
                return Expression.nand(left, right);
            case AND:
                return negate(Expression.group(Expression.nand(left, right)));
            case OR:
                return or(left, right);
            case NOR:
                return negate(Expression.group(or(left, right)));
            case XOR:
                return Expression.nand(
                    Expression.group(Expression.nand(negate(left), right)),
                    Expression.group(Expression.nand(left, negate(right))));
            default:
                throw new IllegalStateException("Unexpected operator " + binary.operator());
        }
    }

    private static Expression negate(Expression operand) {
        return Expression.nand(operand, ONE);
    }

    private static Expression or(Expression left, Expression right) {
        return Expression.nand(Expression.group(negate(left)), Expression.group(negate(right)));
    }
}
