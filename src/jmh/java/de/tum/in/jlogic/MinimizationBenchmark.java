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

import org.openjdk.jmh.annotations.Benchmark;

public class MinimizationBenchmark extends BaseLogicBenchmark {
    @Benchmark
    public MinimizationResult minimizeDnf(LogicState state) {
        return state.logic().minimize(state.table(), NormalForm.DNF);
    }

    @Benchmark
    public MinimizationResult minimizeCnf(LogicState state) {
        return state.logic().minimize(state.table(), NormalForm.CNF);
    }

    @Benchmark
    public TruthTable buildTable(LogicState state) {
        return state.logic().buildTable(state.expression());
    }

    @Benchmark
    public Expression canonicalForm(LogicState state) {
        return state.logic().toCdnf(state.table());
    }
}
