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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class TruthTableBuilderTest {
    private final TruthTableBuilder builder =
        new TruthTableBuilder(ImmutableLogicConfiguration.builder().build());

    static List<Cell> cells(String symbols) {
        List<Cell> cells = new ArrayList<>(symbols.length());
        for (char symbol : symbols.toCharArray()) {
            cells.add(Cell.fromSymbol(symbol));
        }
        return cells;
    }

    @Test
    public void testRowOrder() throws ExpressionParseException {
        TruthTable table = builder.build(Parser.parse("A B C + A !B C + C !A"));
        assertThat(table.variables(), contains("A", "B", "C"));
        assertThat(table.cells(), is(cells("01010101")));
        assertThat(table.row(3).assignment().toString(), is("{A:0, B:1, C:1}"));
        assertThat(table.rows().size(), is(8));
    }

    @Test
    public void testDontCare() throws ExpressionParseException {
        TruthTable table = builder.build(Parser.parse("A"), Parser.parse("A B"));
        assertThat(table.variables(), contains("A", "B"));
        assertThat(table.cells(), is(cells("001*")));
    }

    @Test
    public void testExplicitVariables() throws ExpressionParseException {
        TruthTable table = builder.build(Parser.parse("B"), null, ImmutableSortedSet.of("A", "B", "C"));
        assertThat(table.cells(), is(cells("00110011")));

        assertThrows(UnboundVariableException.class,
            () -> builder.build(Parser.parse("D"), null, ImmutableSortedSet.of("A")));
    }

    @Test
    public void testConstantExpression() throws ExpressionParseException {
        TruthTable table = builder.build(Parser.parse("1 @ 1"));
        assertThat(table.variableCount(), is(0));
        assertThat(table.cells(), is(cells("0")));
    }

    @Test
    public void testVariableCeiling() throws ExpressionParseException {
        TruthTableBuilder small = new TruthTableBuilder(
            ImmutableLogicConfiguration.builder().maximumVariableCount(2).build());
        TooManyVariablesException exception = assertThrows(TooManyVariablesException.class,
            () -> small.build(Parser.parse("A B C")));
        assertThat(exception.variableCount(), is(3));
        assertThat(exception.limit(), is(2));
    }

    @Test
    public void testOfValidates() {
        assertThrows(IllegalArgumentException.class, () -> TruthTable.of(ImmutableList.of("A"), cells("010")));
        assertThrows(IllegalArgumentException.class, () -> TruthTable.of(ImmutableList.of("B", "A"), cells("0101")));
        assertThrows(IllegalArgumentException.class, () -> TruthTable.of(ImmutableList.of("A", "A"), cells("0101")));
    }

    @Test
    public void testWithUnspecifiedAs() {
        TruthTable table = TruthTable.of(ImmutableList.of("A", "B"), cells("0?1*"));
        assertThat(table.contains(Cell.UNSPECIFIED), is(true));
        assertThat(table.withUnspecifiedAs(Cell.DONT_CARE).cells(), is(cells("0*1*")));
        assertThat(table.withUnspecifiedAs(Cell.HIGH).cells(), is(cells("011*")));
        assertThrows(IllegalArgumentException.class, () -> table.withUnspecifiedAs(Cell.UNSPECIFIED));
    }

    @Test
    public void testViolations() throws ExpressionParseException {
        TruthTable table = TruthTable.of(ImmutableList.of("A", "B"), cells("01?*"));
        assertThat(table.isSatisfiedBy(Parser.parse("B")), is(true));
        assertThat(table.isSatisfiedBy(Parser.parse("!A B")), is(true));

        List<TruthTable.Row> violations = table.violations(Parser.parse("A"));
        assertThat(violations.size(), is(1));
        assertThat(violations.get(0).index(), is(1));
        assertThat(violations.get(0).cell(), is(Cell.HIGH));

        assertThrows(UnboundVariableException.class, () -> table.violations(Parser.parse("C")));
    }

    @Test
    public void testToString() {
        TruthTable table = TruthTable.of(ImmutableList.of("A"), cells("1*"));
        assertThat(table.toString(), is("A | Y\n0 | 1\n1 | *\n"));
    }
}
