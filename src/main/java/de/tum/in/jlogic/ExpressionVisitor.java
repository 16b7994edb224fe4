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
 * Dispatch over the closed set of {@link Expression} node kinds. Every consumer of expression trees
 * implements all five methods.
 *
 * @param <T> the result type
 */
public interface ExpressionVisitor<T> {
    T visit(Expression.Constant constant);

    T visit(Expression.Variable variable);

    T visit(Expression.Not not);

    T visit(Expression.Binary binary);

    T visit(Expression.Group group);
}
