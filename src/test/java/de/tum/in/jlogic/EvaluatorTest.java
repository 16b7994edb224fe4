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
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import org.junit.jupiter.api.Test;

public class EvaluatorTest {
    private static final List<String> ABC = ImmutableList.of("A", "B", "C");

    private static boolean evaluate(String expression, int index) throws ExpressionParseException {
        return Evaluator.evaluate(Parser.parse(expression), Assignment.ofIndex(ABC, index));
    }

    @Test
    public void testOperators() throws ExpressionParseException {
        // index 6 = A:1, B:1, C:0
        assertThat(evaluate("A B", 6), is(true));
        assertThat(evaluate("A C", 6), is(false));
        assertThat(evaluate("A + C", 6), is(true));
        assertThat(evaluate("A ^ B", 6), is(false));
        assertThat(evaluate("A @ B", 6), is(false));
        assertThat(evaluate("A @ C", 6), is(true));
        assertThat(evaluate("C % C", 6), is(true));
        assertThat(evaluate("A % C", 6), is(false));
        assertThat(evaluate("!C", 6), is(true));
        assertThat(evaluate("(A) + 0", 6), is(true));
    }

    @Test
    public void testNandIsNotAssociative() throws ExpressionParseException {
        assertThat(evaluate("A @ B @ C", 1), is(false));
        assertThat(evaluate("A @ (B @ C)", 1), is(true));
    }

    @Test
    public void testUnboundVariable() {
        Assignment assignment = Assignment.of(ImmutableMap.of("A", true));
        UnboundVariableException exception = assertThrows(UnboundVariableException.class,
            () -> Evaluator.evaluate(Parser.parse("A B"), assignment));
        assertThat(exception.name(), is("B"));
    }

    @Test
    public void testAssignmentIndexIsMostSignificantFirst() {
        Assignment assignment = Assignment.ofIndex(ABC, 1);
        assertThat(assignment.get("A"), is(false));
        assertThat(assignment.get("C"), is(true));
        assertThat(assignment.toString(), is("{A:0, B:0, C:1}"));
        assertThat(assignment.index(), is(1L));
        assertThat(Assignment.ofIndex(ABC, 4).get("A"), is(true));
    }

    @Test
    public void testAssignmentOfMap() {
        Assignment assignment = Assignment.of(ImmutableMap.of("C", true, "A", false, "B", true));
        assertThat(assignment.variables(), is(ABC));
        assertThat(assignment.index(), is(3L));
        assertThat(assignment, is(Assignment.ofIndex(ABC, 3)));
        assertThat(assignment.asMap(), is(ImmutableMap.of("A", false, "B", true, "C", true)));
    }

    @Test
    public void testAssignmentRejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> Assignment.ofIndex(ABC, 8));
        assertThrows(IllegalArgumentException.class, () -> Assignment.ofIndex(ImmutableList.of("A", "A"), 0));
    }
}
