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
 * Computes the truth value of an expression under an assignment.
 */
public final class Evaluator implements ExpressionVisitor<Boolean> {
    private final Assignment assignment;

    private Evaluator(Assignment assignment) {
        this.assignment = assignment;
    }

    /**
     * Evaluates the expression.
     *
     * @throws UnboundVariableException
     *     if the expression references a variable the assignment does not bind
     */
    public static boolean evaluate(Expression expression, Assignment assignment) {
        return expression.accept(new Evaluator(assignment));
    }

    @Override
    public Boolean visit(Expression.Constant constant) {
        return constant.value();
    }

    @Override
    public Boolean visit(Expression.Variable variable) {
        return assignment.get(variable.name());
    }

    @Override
    public Boolean visit(Expression.Not not) {
        return !not.operand().accept(this);
    }

    @Override
    public Boolean visit(Expression.Binary binary) {
        Deque<Expression.Binary> spine = binary.leftSpine();
        boolean value = spine.peek().left().accept(this);
        while (!spine.isEmpty()) {
            Expression.Binary node = spine.pop();
            value = node.operator().apply(value, node.right().accept(this));
        }
        return value;
    }

    @Override
    public Boolean visit(Expression.Group group) {
        return group.inner().accept(this);
    }
}
