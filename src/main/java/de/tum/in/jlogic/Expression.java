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

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * An immutable Boolean expression tree.
 *
 * <p>The node kinds are exactly the nested classes {@link Constant}, {@link Variable}, {@link Not},
 * {@link Binary} and {@link Group}; no other subclasses can exist. Consumers dispatch through
 * {@link #accept(ExpressionVisitor)}. Equality is structural, and a {@link Group} is never equal to
 * the expression it wraps.</p>
 *
 * <p>Nodes are values: the same instance may appear at several places of a tree or in several trees,
 * e.g. the two constants or operands reused by a rewrite. Trees are acyclic by construction.
 * Traversals of this package walk the left operands of binary chains iteratively, so left-nested
 * chains may be arbitrarily long.</p>
 */
public abstract class Expression {
    private static final Constant FALSE = new Constant(false);
    private static final Constant TRUE = new Constant(true);

    private Expression() {}

    public static Constant constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Variable variable(String name) {
        return new Variable(name);
    }

    public static Not not(Expression operand) {
        return new Not(operand);
    }

    public static Group group(Expression inner) {
        return new Group(inner);
    }

    public static Binary binary(Operator operator, Expression left, Expression right) {
        return new Binary(operator, left, right);
    }

    public static Binary and(Expression left, Expression right) {
        return new Binary(Operator.AND, left, right);
    }

    public static Binary or(Expression left, Expression right) {
        return new Binary(Operator.OR, left, right);
    }

    public static Binary xor(Expression left, Expression right) {
        return new Binary(Operator.XOR, left, right);
    }

    public static Binary nand(Expression left, Expression right) {
        return new Binary(Operator.NAND, left, right);
    }

    public static Binary nor(Expression left, Expression right) {
        return new Binary(Operator.NOR, left, right);
    }

    /**
     * Joins the given operands left-nested, i.e. {@code ((e1 op e2) op e3) ...}. A single operand is
     * returned as is.
     */
    public static Expression join(Operator operator, List<? extends Expression> operands) {
        Util.checkArgument(operator.isBinary(), "Cannot join with %s", operator);
        Util.checkArgument(!operands.isEmpty(), "No operands to join");
        Expression result = operands.get(0);
        for (int i = 1; i < operands.size(); i++) {
            result = new Binary(operator, result, operands.get(i));
        }
        return result;
    }

    public abstract Kind kind();

    public abstract <T> T accept(ExpressionVisitor<T> visitor);

    /**
     * Returns the variables referenced by this expression in canonical (natural string) order.
     */
    public SortedSet<String> variables() {
        SortedSet<String> variables = new TreeSet<>();
        collectVariables(variables);
        return Collections.unmodifiableSortedSet(variables);
    }

    abstract void collectVariables(SortedSet<String> variables);

    @Override
    public String toString() {
        return ExpressionFormatter.implicit().format(this);
    }

    public enum Kind {
        CONSTANT, VARIABLE, NOT, BINARY, GROUP
    }

    public static final class Constant extends Expression {
        private final boolean value;

        private Constant(boolean value) {
            this.value = value;
        }

        public boolean value() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.CONSTANT;
        }

        @Override
        public <T> T accept(ExpressionVisitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        void collectVariables(SortedSet<String> variables) {
            // none
        }

        @Override
        public boolean equals(Object object) {
            return this == object || (object instanceof Constant && ((Constant) object).value == value);
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }
    }

    public static final class Variable extends Expression {
        private final String name;

        private Variable(String name) {
            Util.checkArgument(!name.isEmpty(), "Empty variable name");
            this.name = name;
        }

        public String name() {
            return name;
        }

        @Override
        public Kind kind() {
            return Kind.VARIABLE;
        }

        @Override
        public <T> T accept(ExpressionVisitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        void collectVariables(SortedSet<String> variables) {
            variables.add(name);
        }

        @Override
        public boolean equals(Object object) {
            return this == object || (object instanceof Variable && ((Variable) object).name.equals(name));
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }
    }

    public static final class Not extends Expression {
        private final Expression operand;

        private Not(Expression operand) {
            this.operand = Objects.requireNonNull(operand);
        }

        public Expression operand() {
            return operand;
        }

        @Override
        public Kind kind() {
            return Kind.NOT;
        }

        @Override
        public <T> T accept(ExpressionVisitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        void collectVariables(SortedSet<String> variables) {
            operand.collectVariables(variables);
        }

        @Override
        public boolean equals(Object object) {
            return this == object || (object instanceof Not && ((Not) object).operand.equals(operand));
        }

        @Override
        public int hashCode() {
            return 31 * operand.hashCode() + 7;
        }
    }

    /**
     * A binary operator node. Chains of non-associative operators are kept exactly as written: the
     * parser nests them to the left and no rewriting pass regroups them.
     */
    public static final class Binary extends Expression {
        private final Operator operator;
        private final Expression left;
        private final Expression right;
        private final int hashCode;

        private Binary(Operator operator, Expression left, Expression right) {
            Util.checkArgument(operator.isBinary(), "%s is not a binary operator", operator);
            this.operator = operator;
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
            this.hashCode = Objects.hash(operator, left, right);
        }

        public Operator operator() {
            return operator;
        }

        public Expression left() {
            return left;
        }

        public Expression right() {
            return right;
        }

        @Override
        public Kind kind() {
            return Kind.BINARY;
        }

        @Override
        public <T> T accept(ExpressionVisitor<T> visitor) {
            return visitor.visit(this);
        }

        /**
         * Returns the binary nodes reached by following left operands from this node, innermost on
         * top. The left operand of the top element is the first non-binary operand of the chain.
         */
        Deque<Binary> leftSpine() {
            Deque<Binary> spine = new ArrayDeque<>();
            Expression node = this;
            while (node instanceof Binary) {
                Binary binary = (Binary) node;
                spine.push(binary);
                node = binary.left;
            }
            return spine;
        }

        @Override
        void collectVariables(SortedSet<String> variables) {
            Deque<Binary> spine = leftSpine();
            spine.peek().left.collectVariables(variables);
            for (Binary node : spine) {
                node.right.collectVariables(variables);
            }
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Binary)) {
                return false;
            }
            Expression current = this;
            Expression other = (Binary) object;
            while (current instanceof Binary && other instanceof Binary) {
                Binary first = (Binary) current;
                Binary second = (Binary) other;
                if (first == second) {
                    return true;
                }
                if (first.hashCode != second.hashCode || first.operator != second.operator
                    || !first.right.equals(second.right)) {
                    return false;
                }
                current = first.left;
                other = second.left;
            }
            return current.equals(other);
        }

        @Override
        public int hashCode() {
            return hashCode;
        }
    }

    /**
     * An explicitly parenthesized sub-expression. Semantically transparent.
     */
    public static final class Group extends Expression {
        private final Expression inner;

        private Group(Expression inner) {
            this.inner = Objects.requireNonNull(inner);
        }

        public Expression inner() {
            return inner;
        }

        @Override
        public Kind kind() {
            return Kind.GROUP;
        }

        @Override
        public <T> T accept(ExpressionVisitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        void collectVariables(SortedSet<String> variables) {
            inner.collectVariables(variables);
        }

        @Override
        public boolean equals(Object object) {
            return this == object || (object instanceof Group && ((Group) object).inner.equals(inner));
        }

        @Override
        public int hashCode() {
            return 31 * inner.hashCode() + 11;
        }
    }
}
