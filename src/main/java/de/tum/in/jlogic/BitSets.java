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
import java.util.Comparator;

final class BitSets {
    /**
     * Orders sets by the lowest index in which they differ; the set containing that index comes
     * first. On sets over the same universe this is the order of their sorted element lists.
     */
    static final Comparator<BitSet> LEXICOGRAPHIC = BitSets::compare;

    private BitSets() {}

    @SuppressWarnings("UseOfClone")
    static BitSet copyOf(BitSet set) {
        return (BitSet) set.clone();
    }

    static boolean isSubset(BitSet set, BitSet of) {
        if (set.cardinality() > of.cardinality()) {
            return false;
        }
        BitSet copy = copyOf(set);
        copy.andNot(of);
        return copy.isEmpty();
    }

    static int compare(BitSet first, BitSet second) {
        BitSet difference = copyOf(first);
        difference.xor(second);
        int index = difference.nextSetBit(0);
        if (index < 0) {
            return 0;
        }
        return first.get(index) ? -1 : 1;
    }
}
