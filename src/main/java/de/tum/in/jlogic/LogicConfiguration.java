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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class LogicConfiguration {
    public static final int DEFAULT_MAXIMUM_VARIABLE_COUNT = 16;
    public static final int DEFAULT_MAXIMUM_COVER_PRODUCTS = 100_000;
    public static final int DEFAULT_MAXIMUM_EXPRESSION_DEPTH = 256;
    public static final int LIMIT_MAXIMUM_EXPRESSION_DEPTH = 1024;

    /**
     * Upper bound on the number of variables of any operation which enumerates all assignments.
     * Checked before any work is done.
     */
    @Value.Default
    public int maximumVariableCount() {
        return DEFAULT_MAXIMUM_VARIABLE_COUNT;
    }

    /**
     * Upper bound on the number of intermediate products of the exact cover search. Beyond this, the
     * minimizer falls back to a greedy cover.
     */
    @Value.Default
    public int maximumCoverProducts() {
        return DEFAULT_MAXIMUM_COVER_PRODUCTS;
    }

    /**
     * Upper bound on the number of parentheses and negations the parser accepts nested inside each
     * other. Chains of binary operators do not count towards it.
     */
    @Value.Default
    public int maximumExpressionDepth() {
        return DEFAULT_MAXIMUM_EXPRESSION_DEPTH;
    }

    /**
     * Whether formatted expressions write AND as juxtaposition ({@code A B}) instead of {@code A * B}.
     */
    @Value.Default
    public boolean implicitAnd() {
        return true;
    }

    @Value.Check
    protected void check() {
        Util.checkArgument(0 <= maximumVariableCount() && maximumVariableCount() <= TruthTable.MAXIMUM_VARIABLES,
            "Maximum variable count must be between 0 and %d, got %d",
            TruthTable.MAXIMUM_VARIABLES, maximumVariableCount());
        Util.checkArgument(maximumCoverProducts() > 0, "Maximum cover products must be positive, got %d",
            maximumCoverProducts());
        Util.checkArgument(0 < maximumExpressionDepth() && maximumExpressionDepth() <= LIMIT_MAXIMUM_EXPRESSION_DEPTH,
            "Maximum expression depth must be between 1 and %d, got %d",
            LIMIT_MAXIMUM_EXPRESSION_DEPTH, maximumExpressionDepth());
    }
}
