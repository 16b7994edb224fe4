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

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides semantic equivalence by exhaustive enumeration over the union of both variable sets.
 */
public final class EquivalenceChecker {
    private static final Logger logger = Logger.getLogger(EquivalenceChecker.class.getName());

    private final int maximumVariableCount;

    public EquivalenceChecker(LogicConfiguration configuration) {
        this.maximumVariableCount = configuration.maximumVariableCount();
    }

    public EquivalenceResult check(Expression left, Expression right) {
        SortedSet<String> variables = new TreeSet<>(left.variables());
        variables.addAll(right.variables());
        Util.checkVariableCount(variables.size(), maximumVariableCount);

        AssignmentIterator iterator = new AssignmentIterator(List.copyOf(variables));
        while (iterator.hasNext()) {
            Assignment assignment = iterator.next();
            boolean leftValue = Evaluator.evaluate(left, assignment);
            boolean rightValue = Evaluator.evaluate(right, assignment);
            if (leftValue != rightValue) {
                logger.log(Level.FINE, "Found counterexample {0}", assignment);
                return EquivalenceResult.different(assignment, leftValue, rightValue);
            }
        }
        return EquivalenceResult.equal();
    }
}
