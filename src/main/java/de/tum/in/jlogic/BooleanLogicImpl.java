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

import java.util.SortedSet;
import javax.annotation.Nullable;

final class BooleanLogicImpl implements BooleanLogic {
    private final LogicConfiguration configuration;
    private final ExpressionFormatter formatter;
    private final TruthTableBuilder tableBuilder;
    private final QuineMcCluskey minimizer;
    private final EquivalenceChecker equivalenceChecker;

    BooleanLogicImpl(LogicConfiguration configuration) {
        this.configuration = configuration;
        this.formatter = ExpressionFormatter.of(configuration);
        this.tableBuilder = new TruthTableBuilder(configuration);
        this.minimizer = new QuineMcCluskey(configuration);
        this.equivalenceChecker = new EquivalenceChecker(configuration);
    }

    @Override
    public LogicConfiguration configuration() {
        return configuration;
    }

    @Override
    public Expression parse(String text) throws ExpressionParseException {
        return Parser.parse(text, configuration.maximumExpressionDepth());
    }

    @Override
    public String format(Expression expression) {
        return formatter.format(expression);
    }

    @Override
    public TruthTable buildTable(Expression expression, @Nullable Expression dontCare) {
        return tableBuilder.build(expression, dontCare);
    }

    @Override
    public TruthTable buildTable(Expression expression, @Nullable Expression dontCare, SortedSet<String> variables) {
        return tableBuilder.build(expression, dontCare, variables);
    }

    @Override
    public Expression toCdnf(TruthTable table) {
        return CanonicalForms.cdnf(table);
    }

    @Override
    public Expression toCcnf(TruthTable table) {
        return CanonicalForms.ccnf(table);
    }

    @Override
    public MinimizationResult minimize(TruthTable table, NormalForm form) {
        return minimizer.minimize(table, form);
    }

    @Override
    public EquivalenceResult checkEquivalent(Expression left, Expression right) {
        return equivalenceChecker.check(left, right);
    }

    @Override
    public String toString() {
        return "BooleanLogic" + configuration;
    }
}
