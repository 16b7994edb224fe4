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

import static de.tum.in.jlogic.TruthTableBuilderTest.cells;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

public class CanonicalFormsTest {
    private static final TruthTable ONLY_C = TruthTable.of(ImmutableList.of("A", "B", "C"), cells("01010101"));

    private static String format(Expression expression) {
        return ExpressionFormatter.implicit().format(expression);
    }

    @Test
    public void testCdnf() {
        assertThat(format(CanonicalForms.cdnf(ONLY_C)), is("!A !B C + !A B C + A !B C + A B C"));
    }

    @Test
    public void testCcnf() {
        assertThat(format(CanonicalForms.ccnf(ONLY_C)), is("(A + B + C) (A + !B + C) (!A + B + C) (!A + !B + C)"));
        assertThat(ExpressionFormatter.explicit().format(CanonicalForms.ccnf(ONLY_C)),
            is("(A + B + C) * (A + !B + C) * (!A + B + C) * (!A + !B + C)"));
    }

    @Test
    public void testTermsAreLeftNested() {
        Expression cdnf = CanonicalForms.cdnf(ONLY_C);
        assertThat(cdnf.kind(), is(Expression.Kind.BINARY));
        Expression.Binary root = (Expression.Binary) cdnf;
        assertThat(root.operator(), is(Operator.OR));
        assertThat(format(root.right()), is("A B C"));
    }

    @Test
    public void testConstantTables() {
        TruthTable tautology = TruthTable.of(ImmutableList.of("A"), cells("11"));
        assertThat(format(CanonicalForms.cdnf(tautology)), is("!A + A"));
        assertThat(CanonicalForms.ccnf(tautology), is(Expression.constant(true)));

        TruthTable contradiction = TruthTable.of(ImmutableList.of("A"), cells("00"));
        assertThat(CanonicalForms.cdnf(contradiction), is(Expression.constant(false)));
        assertThat(format(CanonicalForms.ccnf(contradiction)), is("(A) (!A)"));
    }

    @Test
    public void testNoVariables() {
        TruthTable high = TruthTable.of(ImmutableList.of(), cells("1"));
        assertThat(CanonicalForms.cdnf(high), is(Expression.constant(true)));
        assertThat(CanonicalForms.ccnf(high), is(Expression.constant(true)));

        TruthTable low = TruthTable.of(ImmutableList.of(), cells("0"));
        assertThat(CanonicalForms.cdnf(low), is(Expression.constant(false)));
        assertThat(CanonicalForms.ccnf(low), is(Expression.constant(false)));
    }

    @Test
    public void testDontCareRowsAreSkipped() {
        TruthTable table = TruthTable.of(ImmutableList.of("A", "B"), cells("0*1*"));
        assertThat(format(CanonicalForms.cdnf(table)), is("A !B"));
        assertThat(format(CanonicalForms.ccnf(table)), is("(A + B)"));
        assertThat(format(CanonicalForms.dontCareCdnf(table)), is("!A B + A B"));
    }

    @Test
    public void testFormsSatisfyTable() throws ExpressionParseException {
        TruthTable table = new TruthTableBuilder(ImmutableLogicConfiguration.builder().build())
            .build(Parser.parse("A ^ B @ !C + D"));
        assertThat(table.isSatisfiedBy(CanonicalForms.cdnf(table)), is(true));
        assertThat(table.isSatisfiedBy(CanonicalForms.ccnf(table)), is(true));
    }
}
