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
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.oneOf;
import static org.hamcrest.Matchers.sameInstance;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

public class ExpressionTransformerTest {
    private final EquivalenceChecker checker = new EquivalenceChecker(ImmutableLogicConfiguration.builder().build());

    static List<String> expressions() {
        return ImmutableList.of("!A", "A B", "A + B", "A ^ B", "A @ B", "A % B", "A @ B @ C",
            "A ^ B % !C @ D", "(A + 1) !(B 0)", "A B C + C !D B + B C");
    }

    // Operators and constants occurring in the expression, NOT as "!"
    private static List<String> gates(Expression expression) {
        List<String> gates = new ArrayList<>();
        expression.accept(new ExpressionTransformer() {
            @Override
            public Expression visit(Expression.Constant constant) {
                gates.add(constant.value() ? "1" : "0");
                return constant;
            }

            @Override
            public Expression visit(Expression.Not not) {
                gates.add("!");
                return super.visit(not);
            }

            @Override
            protected Expression combine(Expression.Binary binary, Expression left, Expression right) {
                gates.add(String.valueOf(binary.operator().symbol()));
                return super.combine(binary, left, right);
            }
        });
        return gates;
    }

    @ParameterizedTest
    @MethodSource("expressions")
    public void testNand(String text) throws ExpressionParseException {
        Expression expression = Parser.parse(text);
        Expression nand = new NandTransformer().apply(expression);
        assertThat(checker.check(expression, nand).isEqual(), is(true));
        assertThat(gates(nand), everyItem(oneOf("@", "1")));
    }

    @ParameterizedTest
    @MethodSource("expressions")
    public void testNor(String text) throws ExpressionParseException {
        Expression expression = Parser.parse(text);
        Expression nor = new NorTransformer().apply(expression);
        assertThat(checker.check(expression, nor).isEqual(), is(true));
        assertThat(gates(nor), everyItem(oneOf("%", "0")));
    }

    @ParameterizedTest
    @MethodSource("expressions")
    public void testSimplify(String text) throws ExpressionParseException {
        Expression expression = Parser.parse(text);
        assertThat(checker.check(expression, new SimplificationTransformer().apply(expression)).isEqual(), is(true));
    }

    @Test
    public void testNandShapes() throws ExpressionParseException {
        NandTransformer transformer = new NandTransformer();
        assertThat(transformer.apply(Parser.parse("!A")).toString(), is("A @ 1"));
        assertThat(transformer.apply(Parser.parse("A B")).toString(), is("(A @ B) @ 1"));
        assertThat(transformer.apply(Parser.parse("A + B")).toString(), is("(A @ 1) @ (B @ 1)"));
        assertThat(transformer.apply(Parser.parse("A @ B @ C")), is(Parser.parse("A @ B @ C")));
    }

    @Test
    public void testNorShapes() throws ExpressionParseException {
        NorTransformer transformer = new NorTransformer();
        assertThat(transformer.apply(Parser.parse("!A")).toString(), is("A % 0"));
        assertThat(transformer.apply(Parser.parse("A + B")).toString(), is("(A % B) % 0"));
        assertThat(transformer.apply(Parser.parse("A B")).toString(), is("(A % 0) % (B % 0)"));
    }

    @Test
    public void testSimplificationRules() throws ExpressionParseException {
        SimplificationTransformer transformer = new SimplificationTransformer();
        assertThat(transformer.apply(Parser.parse("A 0")).toString(), is("0"));
        assertThat(transformer.apply(Parser.parse("A 1")).toString(), is("A"));
        assertThat(transformer.apply(Parser.parse("1 + A")).toString(), is("1"));
        assertThat(transformer.apply(Parser.parse("A + 0")).toString(), is("A"));
        assertThat(transformer.apply(Parser.parse("A + A")).toString(), is("A"));
        assertThat(transformer.apply(Parser.parse("A A")).toString(), is("A"));
        assertThat(transformer.apply(Parser.parse("!0")).toString(), is("1"));
        assertThat(transformer.apply(Parser.parse("!1")).toString(), is("0"));
        assertThat(transformer.apply(Parser.parse("1 @ 1")).toString(), is("0"));
        assertThat(transformer.apply(Parser.parse("((A + B))")).toString(), is("(A + B)"));
        assertThat(transformer.apply(Parser.parse("(A B) + (A B)")).toString(), is("(A B)"));
        assertThat(transformer.apply(Parser.parse("B (A + 0)")).toString(), is("B A"));
        assertThat(transformer.apply(Parser.parse("A @ 1")).toString(), is("A @ 1"));
    }

    @Test
    public void testIdentityTransformerRebuildsEqualTree() throws ExpressionParseException {
        Expression expression = Parser.parse("A @ (B % !C) ^ (1)");
        assertThat(new ExpressionTransformer() {}.apply(expression), is(expression));
    }

    private static Expression innerOf(Expression group) {
        return ((Expression.Group) group).inner();
    }

    @Test
    public void testXorOperandsAreTransformedOnce() throws ExpressionParseException {
        Expression.Binary nand = (Expression.Binary) new NandTransformer().apply(Parser.parse("A B ^ (C + D)"));
        Expression.Binary first = (Expression.Binary) innerOf(nand.left());
        Expression.Binary second = (Expression.Binary) innerOf(nand.right());
        assertThat(((Expression.Binary) first.left()).left(), sameInstance(second.left()));
        assertThat(first.right(), sameInstance(((Expression.Binary) second.right()).left()));

        Expression.Binary nor = (Expression.Binary) new NorTransformer().apply(Parser.parse("A B ^ (C + D)"));
        Expression.Binary equivalence = (Expression.Binary) innerOf(nor.left());
        first = (Expression.Binary) innerOf(equivalence.left());
        second = (Expression.Binary) innerOf(equivalence.right());
        assertThat(((Expression.Binary) first.left()).left(), sameInstance(second.left()));
    }

    @Test
    public void testXorChains() throws ExpressionParseException {
        Expression chain = Parser.parse(String.join(" ^ ", Collections.nCopies(3, "A ^ B !C ^ D")));
        assertThat(checker.check(chain, new NandTransformer().apply(chain)).isEqual(), is(true));
        assertThat(checker.check(chain, new NorTransformer().apply(chain)).isEqual(), is(true));
    }
}
