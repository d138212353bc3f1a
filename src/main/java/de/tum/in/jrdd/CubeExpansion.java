/*
 * This file is part of JRDD.
 * Copyright (c) 2024 The JRDD authors.
 *
 * JRDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JRDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JRDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jrdd;

import java.util.BitSet;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterates all completions of a cube over a set of free variables, counting through them in binary. Each call to
 * {@link #next()} returns a fresh set.
 */
final class CubeExpansion implements Iterator<BitSet> {
    private final BitSet cube;
    private final int[] free;
    private final BitSet current;
    private boolean exhausted = false;

    CubeExpansion(BitSet cube, BitSet free) {
        this.cube = BitSets.copyOf(cube);
        this.free = BitSets.toArray(free);
        this.current = new BitSet();
        this.cube.andNot(free);
    }

    @Override
    public boolean hasNext() {
        return !exhausted;
    }

    @Override
    public BitSet next() {
        if (exhausted) {
            throw new NoSuchElementException("No next element");
        }
        BitSet result = BitSets.copyOf(cube);
        result.or(current);

        exhausted = true;
        for (int variable : free) {
            if (current.get(variable)) {
                current.clear(variable);
            } else {
                current.set(variable);
                exhausted = false;
                break;
            }
        }
        return result;
    }
}
