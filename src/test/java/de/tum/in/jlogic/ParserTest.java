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

import static de.tum.in.jlogic.Expression.and;
import static de.tum.in.jlogic.Expression.constant;
import static de.tum.in.jlogic.Expression.group;
import static de.tum.in.jlogic.Expression.nand;
import static de.tum.in.jlogic.Expression.nor;
import static de.tum.in.jlogic.Expression.or;
import static de.tum.in.jlogic.Expression.variable;
import static de.tum.in.jlogic.Expression.xor;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.base.Strings;
import java.util.Collections;
import org.junit.jupiter.api.Test;

public class ParserTest {
    private static final Expression A = variable("A");
    private static final Expression B = variable("B");
    private static final Expression C = variable("C");

    @Test
    public void testNandBindsWeakerThanAnd() throws ExpressionParseException {
        assertThat(Parser.parse("A @ B C"), is(nand(A, and(B, C))));
        assertThat(Parser.parse("A B @ C"), is(nand(and(A, B), C)));
    }

    @Test
    public void testNonAssociativeChainsNestLeft() throws ExpressionParseException {
        assertThat(Parser.parse("A @ B @ C"), is(nand(nand(A, B), C)));
        assertThat(Parser.parse("A % B % C"), is(nor(nor(A, B), C)));
        assertThat(Parser.parse("A @ (B @ C)"), is(nand(A, group(nand(B, C)))));
    }

    @Test
    public void testWeakestLevelIsShared() throws ExpressionParseException {
        assertThat(Parser.parse("A + B ^ C"), is(xor(or(A, B), C)));
        assertThat(Parser.parse("A ^ B % C + A"), is(or(nor(xor(A, B), C), A)));
        assertThat(Parser.parse("A + B @ C"), is(or(A, nand(B, C))));
    }

    @Test
    public void testImplicitAnd() throws ExpressionParseException {
        assertThat(Parser.parse("A B"), is(and(A, B)));
        assertThat(Parser.parse("A * B"), is(Parser.parse("A B")));
        assertThat(Parser.parse("A !B"), is(and(A, Expression.not(B))));
        assertThat(Parser.parse("A(B)"), is(and(A, group(B))));
        assertThat(Parser.parse("(A)(B) C"), is(and(and(group(A), group(B)), C)));
        assertThat(Parser.parse("A 1"), is(and(A, constant(true))));
    }

    @Test
    public void testNegation() throws ExpressionParseException {
        assertThat(Parser.parse("!A B"), is(and(Expression.not(A), B)));
        assertThat(Parser.parse("~-!A"), is(Expression.not(Expression.not(Expression.not(A)))));
        assertThat(Parser.parse("!(A + B)"), is(Expression.not(group(or(A, B)))));
    }

    @Test
    public void testGroupsAreKept() throws ExpressionParseException {
        Expression grouped = Parser.parse("((A))");
        assertThat(grouped, is(group(group(A))));
        assertThat(grouped, is(not(A)));
        assertThat(grouped.kind(), is(Expression.Kind.GROUP));
    }

    @Test
    public void testVariables() throws ExpressionParseException {
        assertThat(Parser.parse("c + B a + B + 0").variables(), contains("B", "a", "c"));
        assertThat(Parser.parse("1 @ 0").variables().isEmpty(), is(true));
    }

    @Test
    public void testEmptyInput() {
        SyntaxException exception = assertThrows(SyntaxException.class, () -> Parser.parse("  "));
        assertThat(exception.expected(), is("operand"));
        assertThat(exception.found(), is(SyntaxException.END_OF_INPUT));
    }

    @Test
    public void testMissingOperand() {
        SyntaxException exception = assertThrows(SyntaxException.class, () -> Parser.parse("A + "));
        assertThat(exception.expected(), is("operand"));
        assertThat(exception.position(), is(3));

        exception = assertThrows(SyntaxException.class, () -> Parser.parse("A + * B"));
        assertThat(exception.found(), is("'*'"));
        assertThat(exception.position(), is(4));
    }

    @Test
    public void testUnbalancedParentheses() {
        SyntaxException unclosed = assertThrows(SyntaxException.class, () -> Parser.parse("(A + B"));
        assertThat(unclosed.expected(), is("')'"));
        assertThat(unclosed.found(), is(SyntaxException.END_OF_INPUT));

        SyntaxException unopened = assertThrows(SyntaxException.class, () -> Parser.parse("A + B)"));
        assertThat(unopened.expected(), is(SyntaxException.END_OF_INPUT));
        assertThat(unopened.position(), is(5));
    }

    @Test
    public void testLexErrorsPropagate() {
        ExpressionParseException exception = assertThrows(ExpressionParseException.class, () -> Parser.parse("A # B"));
        assertThat(exception instanceof LexException, is(true));
        assertThat(exception.position(), is(2));
    }

    @Test
    public void testDeepNestingIsRejected() {
        int depth = LogicConfiguration.DEFAULT_MAXIMUM_EXPRESSION_DEPTH;
        String parentheses = Strings.repeat("(", 3000) + "A" + Strings.repeat(")", 3000);
        NestingTooDeepException nested = assertThrows(NestingTooDeepException.class,
            () -> Parser.parse(parentheses));
        assertThat(nested.limit(), is(depth));
        assertThat(nested.position(), is(depth));

        NestingTooDeepException negated = assertThrows(NestingTooDeepException.class,
            () -> Parser.parse(Strings.repeat("!", 3000) + "A"));
        assertThat(negated.position(), is(depth));

        assertThrows(NestingTooDeepException.class, () -> Parser.parse("((A))", 1));
    }

    @Test
    public void testNestingUpToLimitIsAccepted() throws ExpressionParseException {
        int depth = LogicConfiguration.DEFAULT_MAXIMUM_EXPRESSION_DEPTH;
        Expression nested = Parser.parse(Strings.repeat("(", depth) + "A" + Strings.repeat(")", depth));
        assertThat(nested.variables(), contains("A"));
        assertThat(Parser.parse("!(!A)", 3), is(Expression.not(group(Expression.not(A)))));
    }

    @Test
    public void testLongChains() throws ExpressionParseException {
        String text = String.join(" + ", Collections.nCopies(5000, "A"));
        Expression chain = Parser.parse(text);
        assertThat(chain.variables(), contains("A"));
        assertThat(chain, is(Parser.parse(text)));
        assertThat(Parser.parse(ExpressionFormatter.explicit().format(chain)), is(chain));

        EquivalenceChecker checker = new EquivalenceChecker(ImmutableLogicConfiguration.builder().build());
        assertThat(checker.check(chain, A).isEqual(), is(true));
        assertThat(new SimplificationTransformer().apply(chain), is(A));

        Expression mixed = Parser.parse(String.join(" ^ ", Collections.nCopies(5001, "A B")));
        assertThat(checker.check(mixed, and(A, B)).isEqual(), is(true));
    }
}
