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

import java.util.BitSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Enumerates all assignments over a variable list in increasing row index order, i.e. binary
 * counting with the last variable as the least significant bit.
 */
final class AssignmentIterator implements Iterator<Assignment> {
    private final List<String> variables;
    private final BitSet iteration;
    private int numSetBits = -1;

    AssignmentIterator(List<String> variables) {
        this.variables = List.copyOf(variables);
        this.iteration = new BitSet(variables.size());
    }

    @Override
    public boolean hasNext() {
        return numSetBits < variables.size();
    }

    @Override
    public Assignment next() {
        if (numSetBits == -1) {
            numSetBits = 0;
            return Assignment.ofBits(variables, iteration);
        }

        if (numSetBits == variables.size()) {
            throw new NoSuchElementException("No next element");
        }

        for (int position = variables.size() - 1; position >= 0; position--) {
            if (iteration.get(position)) {
                iteration.clear(position);
                numSetBits -= 1;
            } else {
                iteration.set(position);
                numSetBits += 1;
                break;
            }
        }

        return Assignment.ofBits(variables, iteration);
    }
}
