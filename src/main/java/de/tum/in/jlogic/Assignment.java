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
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * An immutable total assignment of truth values to an ordered list of variables.
 *
 * <p>The position of a variable determines its weight in the {@link #index() row index}: the first
 * variable is the most significant bit, i.e. variable {@code i} of {@code n} is bit
 * {@code n - 1 - i}.</p>
 */
public final class Assignment {
    private final List<String> variables;
    // Bit i is the value of variables.get(i)
    private final BitSet values;

    private Assignment(List<String> variables, BitSet values) {
        this.variables = variables;
        this.values = values;
    }

    /**
     * Creates the assignment of the given row index over the given variables.
     */
    public static Assignment ofIndex(List<String> variables, long index) {
        int count = variables.size();
        Util.checkArgument(count < Long.SIZE - 1, "Too many variables for an index: %d", count);
        Util.checkArgument(0 <= index && index < (1L << count), "Index %d out of range for %d variables",
            index, count);
        BitSet values = new BitSet(count);
        for (int i = 0; i < count; i++) {
            if ((index & (1L << (count - 1 - i))) != 0) {
                values.set(i);
            }
        }
        return new Assignment(copyVariables(variables), values);
    }

    /**
     * Creates an assignment from a map, ordering the variables canonically.
     */
    public static Assignment of(Map<String, Boolean> values) {
        SortedMap<String, Boolean> sorted = new TreeMap<>(values);
        List<String> variables = new ArrayList<>(sorted.keySet());
        BitSet bits = new BitSet(variables.size());
        int position = 0;
        for (Boolean value : sorted.values()) {
            if (value) {
                bits.set(position);
            }
            position += 1;
        }
        return new Assignment(Collections.unmodifiableList(variables), bits);
    }

    static Assignment ofBits(List<String> variables, BitSet values) {
        return new Assignment(variables, BitSets.copyOf(values));
    }

    private static List<String> copyVariables(Collection<String> variables) {
        List<String> copy = List.copyOf(variables);
        Util.checkArgument(new HashSet<>(copy).size() == copy.size(), "Duplicate variables in %s", copy);
        return copy;
    }

    public List<String> variables() {
        return variables;
    }

    /**
     * Returns the value of the given variable.
     *
     * @throws UnboundVariableException
     *     if the variable is not part of this assignment
     */
    public boolean get(String variable) {
        int position = variables.indexOf(variable);
        if (position < 0) {
            throw new UnboundVariableException(variable);
        }
        return values.get(position);
    }

    public long index() {
        int count = variables.size();
        Util.checkState(count < Long.SIZE - 1, "Too many variables for an index: %d", count);
        long index = 0;
        for (int i = values.nextSetBit(0); i >= 0; i = values.nextSetBit(i + 1)) {
            index |= 1L << (count - 1 - i);
        }
        return index;
    }

    public Map<String, Boolean> asMap() {
        SortedMap<String, Boolean> map = new TreeMap<>();
        for (int i = 0; i < variables.size(); i++) {
            map.put(variables.get(i), values.get(i));
        }
        return Collections.unmodifiableSortedMap(map);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Assignment)) {
            return false;
        }
        Assignment that = (Assignment) object;
        return variables.equals(that.variables) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return 31 * variables.hashCode() + values.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("{");
        for (int i = 0; i < variables.size(); i++) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.append(variables.get(i)).append(':').append(values.get(i) ? '1' : '0');
        }
        return builder.append('}').toString();
    }
}
