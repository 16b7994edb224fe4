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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import javax.annotation.Nullable;

/**
 * Evaluates an expression on every assignment of its variables.
 */
public final class TruthTableBuilder {
    private final int maximumVariableCount;

    public TruthTableBuilder(LogicConfiguration configuration) {
        this.maximumVariableCount = configuration.maximumVariableCount();
    }

    public TruthTable build(Expression expression) {
        return build(expression, null);
    }

    /**
     * Builds the table of {@code expression} over the variables of both expressions. Rows on which
     * {@code dontCare} holds become {@link Cell#DONT_CARE}.
     */
    public TruthTable build(Expression expression, @Nullable Expression dontCare) {
        SortedSet<String> variables = new TreeSet<>(expression.variables());
        if (dontCare != null) {
            variables.addAll(dontCare.variables());
        }
        return build(expression, dontCare, variables);
    }

    /**
     * Builds the table over an explicit set of columns, which must include every variable referenced
     * by the expressions. Additional columns are allowed. Columns are always in natural order,
     * regardless of the comparator of the given set.
     */
    public TruthTable build(Expression expression, @Nullable Expression dontCare, SortedSet<String> variables) {
        Objects.requireNonNull(expression);
        checkBound(expression, variables);
        if (dontCare != null) {
            checkBound(dontCare, variables);
        }
        Util.checkVariableCount(variables.size(), maximumVariableCount);

        List<String> sorted = new ArrayList<>(variables);
        Collections.sort(sorted);
        List<String> columns = List.copyOf(sorted);
        Cell[] cells = new Cell[1 << columns.size()];
        AssignmentIterator iterator = new AssignmentIterator(columns);
        int index = 0;
        while (iterator.hasNext()) {
            Assignment assignment = iterator.next();
            if (dontCare != null && Evaluator.evaluate(dontCare, assignment)) {
                cells[index] = Cell.DONT_CARE;
            } else {
                cells[index] = Cell.of(Evaluator.evaluate(expression, assignment));
            }
            index += 1;
        }
        return TruthTable.ofTrusted(columns, cells);
    }

    private static void checkBound(Expression expression, SortedSet<String> variables) {
        for (String variable : expression.variables()) {
            if (!variables.contains(variable)) {
                throw new UnboundVariableException(variable);
            }
        }
    }
}
