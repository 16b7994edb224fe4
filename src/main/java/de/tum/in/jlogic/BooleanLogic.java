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
import javax.annotation.Nullable;

/**
 * Entry point to parsing, tabulating, minimizing and comparing Boolean expressions.
 *
 * <p>All operations are pure: they neither modify their arguments nor keep state between calls,
 * and every returned value is immutable. Operations which enumerate assignments check the
 * configured variable ceiling before doing any work and throw {@link TooManyVariablesException}
 * if it is exceeded.</p>
 */
public interface BooleanLogic {
    LogicConfiguration configuration();

    Expression parse(String text) throws ExpressionParseException;

    /**
     * Renders the expression in the configured style. The result parses back to the same tree.
     */
    String format(Expression expression);

    default TruthTable buildTable(Expression expression) {
        return buildTable(expression, null);
    }

    /**
     * Builds the truth table over the variables of both expressions. Rows on which {@code dontCare}
     * evaluates to 1 are marked {@link Cell#DONT_CARE}.
     */
    TruthTable buildTable(Expression expression, @Nullable Expression dontCare);

    TruthTable buildTable(Expression expression, @Nullable Expression dontCare, SortedSet<String> variables);

    Expression toCdnf(TruthTable table);

    Expression toCcnf(TruthTable table);

    MinimizationResult minimize(TruthTable table, NormalForm form);

    default Expression minimizeDnf(TruthTable table) {
        return minimize(table, NormalForm.DNF).expression();
    }

    default Expression minimizeCnf(TruthTable table) {
        return minimize(table, NormalForm.CNF).expression();
    }

    EquivalenceResult checkEquivalent(Expression left, Expression right);

    default EquivalenceResult checkEquivalent(String left, String right) throws ExpressionParseException {
        return checkEquivalent(parse(left), parse(right));
    }

    /**
     * Returns the defined rows of the table which the expression gets wrong.
     *
     * @see TruthTable#violations(Expression)
     */
    default List<TruthTable.Row> violations(TruthTable table, Expression expression) {
        return table.violations(expression);
    }

    default Expression toNand(Expression expression) {
        return new NandTransformer().apply(expression);
    }

    default Expression toNor(Expression expression) {
        return new NorTransformer().apply(expression);
    }

    default Expression simplify(Expression expression) {
        return new SimplificationTransformer().apply(expression);
    }
}
