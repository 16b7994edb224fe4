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

import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Whether two expressions denote the same function, with a witness if they do not.
 */
public final class EquivalenceResult {
    private static final EquivalenceResult EQUAL = new EquivalenceResult(null, false, false);

    @Nullable
    private final Assignment counterexample;
    private final boolean leftValue;
    private final boolean rightValue;

    private EquivalenceResult(@Nullable Assignment counterexample, boolean leftValue, boolean rightValue) {
        this.counterexample = counterexample;
        this.leftValue = leftValue;
        this.rightValue = rightValue;
    }

    static EquivalenceResult equal() {
        return EQUAL;
    }

    static EquivalenceResult different(Assignment counterexample, boolean leftValue, boolean rightValue) {
        assert leftValue != rightValue;
        return new EquivalenceResult(Objects.requireNonNull(counterexample), leftValue, rightValue);
    }

    public boolean isEqual() {
        return counterexample == null;
    }

    /**
     * Returns the first assignment (in row order) on which the expressions differ, or {@code null} if
     * they are equal.
     */
    @Nullable
    public Assignment counterexample() {
        return counterexample;
    }

    public boolean leftValue() {
        Util.checkState(counterexample != null, "Expressions are equal");
        return leftValue;
    }

    public boolean rightValue() {
        Util.checkState(counterexample != null, "Expressions are equal");
        return rightValue;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof EquivalenceResult)) {
            return false;
        }
        EquivalenceResult that = (EquivalenceResult) object;
        return leftValue == that.leftValue && rightValue == that.rightValue
            && Objects.equals(counterexample, that.counterexample);
    }

    @Override
    public int hashCode() {
        return Objects.hash(counterexample, leftValue, rightValue);
    }

    @Override
    public String toString() {
        if (counterexample == null) {
            return "equal";
        }
        return String.format("not equal at %s (%d vs %d)", counterexample, leftValue ? 1 : 0, rightValue ? 1 : 0);
    }
}
