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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * A product (or, dually, a sum) of literals, represented as a row pattern: every row index whose
 * bits agree with {@link #value()} outside of {@link #mask()} is covered.
 *
 * <p>Implicants are ordered by fewer literals first, then lowest covered row, then value, then mask.
 * </p>
 */
public final class Implicant implements Comparable<Implicant> {
    private final int variableCount;
    private final int value;
    private final int mask;

    Implicant(int variableCount, int value, int mask) {
        assert (value & mask) == 0;
        assert (value | mask) < (1 << variableCount);
        this.variableCount = variableCount;
        this.value = value;
        this.mask = mask;
    }

    static Implicant ofRow(int variableCount, int index) {
        return new Implicant(variableCount, index, 0);
    }

    public int variableCount() {
        return variableCount;
    }

    /**
     * The fixed bits of the pattern. Bits set in the mask are always zero here.
     */
    public int value() {
        return value;
    }

    /**
     * The eliminated (don't care) bit positions.
     */
    public int mask() {
        return mask;
    }

    public int literalCount() {
        return variableCount - Integer.bitCount(mask);
    }

    public boolean covers(int index) {
        return (index & ~mask) == value;
    }

    /**
     * Returns the indices of all rows this implicant covers.
     */
    public BitSet coveredRows() {
        BitSet rows = new BitSet(1 << variableCount);
        // Enumerate all sub-masks of mask
        int subset = 0;
        do {
            rows.set(value | subset);
            subset = (subset - mask) & mask;
        } while (subset != 0);
        return rows;
    }

    /**
     * Returns the implicant obtained by eliminating {@code bit}, which must not already be
     * eliminated.
     */
    Implicant eliminate(int bit) {
        assert (mask & bit) == 0;
        return new Implicant(variableCount, value & ~bit, mask | bit);
    }

    /**
     * Renders this implicant as a product of literals. A product without literals is the constant 1.
     */
    public Expression toProduct(List<String> variables) {
        return render(variables, true);
    }

    /**
     * Renders this implicant as a sum of literals which is false exactly on the covered rows. A sum
     * without literals is the constant 0; otherwise it is parenthesized.
     */
    public Expression toSum(List<String> variables) {
        Expression sum = render(variables, false);
        return sum.kind() == Expression.Kind.CONSTANT ? sum : Expression.group(sum);
    }

    private Expression render(List<String> variables, boolean product) {
        Util.checkArgument(variables.size() == variableCount, "Expected %d variables, got %s",
            variableCount, variables);
        List<Expression> literals = new ArrayList<>();
        for (int i = 0; i < variableCount; i++) {
            int bit = 1 << (variableCount - 1 - i);
            if ((mask & bit) != 0) {
                continue;
            }
            boolean set = (value & bit) != 0;
            Expression variable = Expression.variable(variables.get(i));
            literals.add(set == product ? variable : Expression.not(variable));
        }
        if (literals.isEmpty()) {
            return Expression.constant(product);
        }
        return Expression.join(product ? Operator.AND : Operator.OR, literals);
    }

    @Override
    public int compareTo(Implicant other) {
        int result = Integer.compare(literalCount(), other.literalCount());
        if (result != 0) {
            return result;
        }
        // The lowest covered row is the value itself
        result = Integer.compare(value, other.value);
        if (result != 0) {
            return result;
        }
        result = Integer.compare(mask, other.mask);
        if (result != 0) {
            return result;
        }
        return Integer.compare(variableCount, other.variableCount);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Implicant)) {
            return false;
        }
        Implicant that = (Implicant) object;
        return value == that.value && mask == that.mask && variableCount == that.variableCount;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * value + mask) + variableCount;
    }

    /**
     * Renders the pattern most significant bit first, e.g. {@code 1-0} for value {@code 100} and
     * mask {@code 010}.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(variableCount);
        for (int i = variableCount - 1; i >= 0; i--) {
            int bit = 1 << i;
            builder.append((mask & bit) != 0 ? '-' : (value & bit) != 0 ? '1' : '0');
        }
        return builder.toString();
    }
}
