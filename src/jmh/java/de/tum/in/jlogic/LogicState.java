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
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

@State(Scope.Benchmark)
public class LogicState {
    @Param({"6", "8", "10"})
    private int variableCount;

    @Param({"true", "false"})
    private boolean dontCares;

    private BooleanLogic logic;
    private TruthTable table;
    private Expression expression;

    @Setup(Level.Trial)
    public void setUp() {
        logic = LogicFactory.buildLogic();
        List<String> variables = ExpressionGenerator.variables(variableCount);
        ExpressionGenerator generator = new ExpressionGenerator(variableCount, variables);
        table = generator.table(dontCares);
        expression = generator.expression(2 * variableCount);
    }

    public BooleanLogic logic() {
        return logic;
    }

    public TruthTable table() {
        return table;
    }

    public Expression expression() {
        return expression;
    }
}
