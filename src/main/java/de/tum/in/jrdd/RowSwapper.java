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

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Exchanges two adjacent rows of a {@link NodeStore} in place.
 *
 * <p>Let {@code u} be the lifted variable and {@code d} the variable directly above it. Every node on row {@code d}
 * which has a child on {@code u} (a "mover") is rewritten into a node on {@code u} whose children are new or reused
 * nodes on {@code d}. Movers keep their slot, so their parents and all held references stay untouched. Nodes of row
 * {@code u} which are only referenced by movers are freed before the new {@code d} nodes are created, so the latter
 * reuse their slots in LIFO order.</p>
 */
final class RowSwapper {
    private static final Logger logger = Logger.getLogger(RowSwapper.class.getName());

    private final NodeStore store;
    private int swaps = 0;

    RowSwapper(NodeStore store) {
        this.store = store;
    }

    void swap(int lifted) {
        VariableOrder order = store.order();
        int upper = order.above(lifted);
        if (upper == -1) {
            logger.log(Level.WARNING, "Not swapping {0}, it already is the top variable", order.name(lifted));
            return;
        }

        Movers movers = collectMovers(upper, lifted);
        order.exchange(lifted);

        for (int index = 0; index < movers.size; index++) {
            store.dropEdgeDeferred(movers.highs[index]);
            store.dropEdgeDeferred(movers.lows[index]);
        }

        // Free lifted nodes only reachable through movers. Their children stay alive until the new nodes exist.
        // Freeing in reverse makes the first created node take the slot of the first mover's high child.
        int[] pendingChildren = new int[16];
        int pending = 0;
        for (int index = movers.size - 1; index >= 0; index--) {
            for (int child : new int[] {movers.lows[index], movers.highs[index]}) {
                if (!Reference.isInternal(child)) {
                    continue;
                }
                int slot = Reference.slot(child);
                if (store.variableOfSlot(slot) != lifted || !store.isUnreferenced(child)) {
                    continue;
                }
                if (pending + 2 > pendingChildren.length) {
                    pendingChildren = Arrays.copyOf(pendingChildren, pendingChildren.length * 2);
                }
                pendingChildren[pending++] = store.highOfSlot(slot);
                pendingChildren[pending++] = store.lowOfSlot(slot);
                store.freeSlot(slot);
            }
        }

        for (int index = 0; index < movers.size; index++) {
            int high = store.makeChild(upper, movers.highHighs[index], movers.lowHighs[index]);
            int low = store.makeChild(upper, movers.highLows[index], movers.lowLows[index]);
            assert high != low && !Reference.isNegated(low);
            store.rewrite(movers.slots[index], lifted, high, low);
        }

        for (int index = 0; index < pending; index++) {
            store.dropEdge(pendingChildren[index]);
        }
        for (int index = 0; index < movers.size; index++) {
            store.reclaimIfUnreferenced(movers.highs[index]);
            store.reclaimIfUnreferenced(movers.lows[index]);
        }

        store.markStructuralModification();
        swaps += 1;
        logger.log(Level.FINE, "Swapped {0} above {1}, rewrote {2} nodes (swap #{3})",
                new Object[] {order.name(lifted), order.name(upper), movers.size, swaps});
    }

    private Movers collectMovers(int upper, int lifted) {
        int[] candidates = store.rowSlots(upper);
        Movers movers = new Movers(candidates.length);
        for (int slot : candidates) {
            int high = store.highOfSlot(slot);
            int low = store.lowOfSlot(slot);
            if (store.variableOf(high) != lifted && store.variableOf(low) != lifted) {
                continue;
            }
            int index = movers.size++;
            movers.slots[index] = slot;
            movers.highs[index] = high;
            movers.lows[index] = low;
            movers.highHighs[index] = cofactor(high, lifted, true);
            movers.highLows[index] = cofactor(high, lifted, false);
            movers.lowHighs[index] = cofactor(low, lifted, true);
            movers.lowLows[index] = cofactor(low, lifted, false);
        }
        return movers;
    }

    private int cofactor(int reference, int variable, boolean high) {
        if (store.variableOf(reference) != variable) {
            return reference;
        }
        return high ? store.high(reference) : store.low(reference);
    }

    int swaps() {
        return swaps;
    }

    private static final class Movers {
        final int[] slots;
        final int[] highs;
        final int[] lows;
        final int[] highHighs;
        final int[] highLows;
        final int[] lowHighs;
        final int[] lowLows;
        int size = 0;

        Movers(int capacity) {
            slots = new int[capacity];
            highs = new int[capacity];
            lows = new int[capacity];
            highHighs = new int[capacity];
            highLows = new int[capacity];
            lowHighs = new int[capacity];
            lowLows = new int[capacity];
        }
    }
}
