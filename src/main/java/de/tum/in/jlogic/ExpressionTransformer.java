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
 * A rewriting pass over expression trees. The default implementation rebuilds every node from its
 * transformed children; subclasses override the node kinds they rewrite. Binary nodes are rewritten
 * through {@link #combine(Expression.Binary, Expression, Expression)}, which receives the already
 * transformed operands.
 *
 * <p>Passes never flatten or regroup chains of non-associative operators.</p>
 */
public abstract class ExpressionTransformer implements ExpressionVisitor<Expression> {
    public Expression apply(Expression expression) {
        return expression.accept(this);
    }

    @Override
    public Expression visit(Expression.Constant constant) {
        return constant;
    }

    @Override
    public Expression visit(Expression.Variable variable) {
        return variable;
    }

    @Override
    public Expression visit(Expression.Not not) {
        return Expression.not(not.operand().accept(this));
    }

    @Override
    public Expression visit(Expression.Binary binary) {
        Deque<Expression.Binary> spine = binary.leftSpine();
        Expression result = spine.peek().left().accept(this);
        while (!spine.isEmpty()) {
            Expression.Binary node = spine.pop();
            result = combine(node, result, node.right().accept(this));
        }
        return result;
    }

    /**
     * Builds the replacement of {@code binary} from its transformed operands.
     */
    protected Expression combine(Expression.Binary binary, Expression left, Expression right) {
        return Expression.binary(binary.operator(), left, right);
    }

    @Override
    public Expression visit(Expression.Group group) {
        return Expression.group(group.inner().accept(this));
    }
}
