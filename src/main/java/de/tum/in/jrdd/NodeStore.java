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

import static de.tum.in.jrdd.Util.checkArgument;
import static de.tum.in.jrdd.Util.checkState;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hash-consed arena of decision node records with reference counting.
 *
 * <p>Every occupied slot carries two counts: the <i>internal</i> count of edges from other occupied slots and the
 * <i>external</i> count of holds owned by callers. A slot is reclaimed the moment both drop to zero, its index
 * going to the front of the free list. Slot 0 is the false anchor and never moves.</p>
 *
 * <p>Stored records are normalized: the low edge is never negated and {@code (v, TRUE, FALSE)} is never stored
 * (it is the literal of {@code v}).</p>
 */
@SuppressWarnings({"PMD.TooManyFields", "PMD.GodClass", "ValueOfIncrementOrDecrementUsed"})
public class NodeStore {
    private static final Logger logger = Logger.getLogger(NodeStore.class.getName());

    @SuppressWarnings("StaticCollection")
    private static final Collection<NodeStore> statisticsShutdownHook = new ConcurrentLinkedDeque<>();

    /* Marker in the variable column */
    private static final int EMPTY = -1;
    private static final int ANCHOR = -2;
    /* 0 doubles as "no slot" in all chains, as slot 0 is never part of one */
    protected static final int NOT_A_SLOT = 0;
    protected static final int FIRST_SLOT = 1;
    private static final int MINIMUM_GROWTH = 16;

    private final StoreConfiguration configuration;
    private final VariableOrder order;

    /* Node columns */
    private int[] variables;
    private int[] highs;
    private int[] lows;
    private int[] internalCounts;
    private int[] externalCounts;

    /* Hash index. For an occupied slot, chain holds the next slot in its bucket, for an empty slot the next free
     * slot. */
    private int[] hashToChainStart;
    private int[] chain;
    /* Top of the LIFO free list */
    private int firstFreeSlot = NOT_A_SLOT;
    /* Slots at or above this index have never been used */
    private int highWater = FIRST_SLOT;
    private int occupied = 0;

    /* Doubly linked row lists, indexed by variable and slot respectively */
    private int[] rowHead = new int[0];
    private int[] rowSizes = new int[0];
    private int[] rowNext;
    private int[] rowPrevious;

    /* Work stack, used for transitive reclamation */
    private int[] workStack = new int[32];
    private int workStackIndex = 0;

    /* Bumped by every operation which moves nodes between rows */
    private int structuralModifications = 0;

    // Statistics
    private long createdNodes = 0;
    private long reclaimedNodes = 0;
    private long hashLookups = 0;
    private long hashLookupLength = 0;
    private long hashLookupHits = 0;
    private long growCount = 0;

    public NodeStore(VariableOrder order, StoreConfiguration configuration) {
        this.order = order;
        this.configuration = configuration;
        int size = Math.max(configuration.initialSize(), 2);

        variables = new int[size];
        highs = new int[size];
        lows = new int[size];
        internalCounts = new int[size];
        externalCounts = new int[size];
        chain = new int[size];
        rowNext = new int[size];
        rowPrevious = new int[size];
        hashToChainStart = new int[Primes.nextPrime(size)];

        Arrays.fill(variables, EMPTY);
        variables[0] = ANCHOR;
        highs[0] = Reference.FALSE;
        lows[0] = Reference.FALSE;

        if (configuration.logStatisticsOnShutdown()) {
            logger.log(Level.FINER, "Adding {0} to shutdown hook", this);
            ShutdownHookLazyHolder.init();
            statisticsShutdownHook.add(this);
        }
    }

    public VariableOrder order() {
        return order;
    }

    public StoreConfiguration configuration() {
        return configuration;
    }

    // Lookup

    /**
     * Decomposes the given reference. Children are oriented by the reference's polarity.
     *
     * @return The record, or empty for constants and literals.
     * @throws NodeNotFoundException if the referenced slot is not occupied.
     */
    public Optional<Vhl> get(int reference) {
        if (!Reference.isInternal(reference)) {
            return Optional.empty();
        }
        int slot = checkOccupied(reference);
        boolean negated = Reference.isNegated(reference);
        return Optional.of(new Vhl(
                variables[slot], Reference.negateIf(highs[slot], negated), Reference.negateIf(lows[slot], negated)));
    }

    /**
     * Total number of edges and holds on the referenced slot, or -1 for constants and literals.
     *
     * @throws NodeNotFoundException if the referenced slot is not occupied.
     */
    public int refcount(int reference) {
        if (!Reference.isInternal(reference)) {
            return -1;
        }
        int slot = checkOccupied(reference);
        return internalCounts[slot] + externalCounts[slot];
    }

    public boolean isValid(int reference) {
        if (!Reference.isInternal(reference)) {
            return !Reference.isLiteral(reference) || order.contains(Reference.literalVariable(reference));
        }
        int slot = Reference.slot(reference);
        return slot < highWater && variables[slot] >= 0;
    }

    /**
     * Fails loudly for references which do not denote anything in this store.
     *
     * @throws NodeNotFoundException if an internal reference is stale.
     * @throws IllegalArgumentException if a literal names an unknown variable.
     */
    void checkReference(int reference) {
        if (Reference.isInternal(reference)) {
            checkOccupied(reference);
        } else if (Reference.isLiteral(reference)) {
            checkArgument(order.contains(Reference.literalVariable(reference)), "Unknown literal %s",
                    Reference.toString(reference));
        }
    }

    private int checkOccupied(int reference) {
        int slot = Reference.slot(reference);
        if (slot >= highWater || variables[slot] < 0) {
            throw new NodeNotFoundException(reference);
        }
        return slot;
    }

    /**
     * Variable of the top node, -1 for constants. Literals report their variable.
     */
    int variableOf(int reference) {
        assert isValid(reference) : "Invalid reference " + Reference.toString(reference);
        if (Reference.isLiteral(reference)) {
            return Reference.literalVariable(reference);
        }
        return Reference.isConstant(reference) ? -1 : variables[Reference.slot(reference)];
    }

    /**
     * Position of the top variable in the order, {@link Integer#MAX_VALUE} for constants.
     */
    int positionOf(int reference) {
        int variable = variableOf(reference);
        return variable == -1 ? Integer.MAX_VALUE : order.position(variable);
    }

    /**
     * High child with the reference's polarity applied. Literals behave like {@code (v, TRUE, FALSE)}.
     */
    int high(int reference) {
        assert !Reference.isConstant(reference) && isValid(reference);
        int child = Reference.isLiteral(reference) ? Reference.TRUE : highs[Reference.slot(reference)];
        return Reference.negateIf(child, Reference.isNegated(reference));
    }

    int low(int reference) {
        assert !Reference.isConstant(reference) && isValid(reference);
        int child = Reference.isLiteral(reference) ? Reference.FALSE : lows[Reference.slot(reference)];
        return Reference.negateIf(child, Reference.isNegated(reference));
    }

    // Construction

    /**
     * Inserts the record with a single hold, see {@link #insertOrReuse(int, int, int, int)}.
     */
    public int insertOrReuse(int variable, int high, int low) {
        return insertOrReuse(variable, high, low, 1);
    }

    public int insertOrReuse(Vhl vhl, int holds) {
        return insertOrReuse(vhl.variable(), vhl.high(), vhl.low(), holds);
    }

    /**
     * Returns the canonical reference for {@code (variable, high, low)}, adding {@code holds} holds on behalf of the
     * caller. If {@code high == low} the child itself is returned. An existing equal record is reused, otherwise a
     * slot is taken from the free list or the arena is extended.
     *
     * @throws IllegalArgumentException if a child is not strictly below {@code variable} in the order.
     */
    public int insertOrReuse(int variable, int high, int low, int holds) {
        checkArgument(holds >= 1, "Need at least one hold, got %d", holds);
        checkArgument(order.contains(variable), "Unknown variable %d", variable);
        checkChild(variable, high);
        checkChild(variable, low);
        return findOrCreate(variable, high, low, 0, holds);
    }

    private void checkChild(int variable, int child) {
        checkReference(child);
        int childPosition = positionOf(child);
        checkArgument(childPosition > order.position(variable),
                "Child %s of %s does not descend the order %s",
                Reference.toString(child), order.name(variable), order);
    }

    /**
     * Inserts a record which becomes the child of some node, i.e. adds one internal edge to the result.
     */
    int makeChild(int variable, int high, int low) {
        assert positionOf(high) > order.position(variable) && positionOf(low) > order.position(variable);
        return findOrCreate(variable, high, low, 1, 0);
    }

    /**
     * Inserts a record owned by the caller, i.e. adds one hold to the result.
     */
    int makeNode(int variable, int high, int low) {
        assert positionOf(high) > order.position(variable) && positionOf(low) > order.position(variable);
        return findOrCreate(variable, high, low, 0, 1);
    }

    private int findOrCreate(int variable, int high, int low, int internal, int external) {
        if (high == low) {
            addCounts(high, internal, external);
            return high;
        }
        boolean negated = Reference.isNegated(low);
        if (negated) {
            high = Reference.not(high);
            low = Reference.not(low);
        }
        if (high == Reference.TRUE && low == Reference.FALSE) {
            return Reference.negateIf(Reference.literal(variable), negated);
        }

        int slot = lookup(variable, high, low);
        if (slot == NOT_A_SLOT) {
            slot = allocateSlot();
            variables[slot] = variable;
            highs[slot] = high;
            lows[slot] = low;
            internalCounts[slot] = internal;
            externalCounts[slot] = external;
            connectHashList(slot);
            connectRow(slot);
            addCounts(high, 1, 0);
            addCounts(low, 1, 0);
            createdNodes += 1;
            occupied += 1;
        } else {
            internalCounts[slot] += internal;
            externalCounts[slot] += external;
        }
        return Reference.negateIf(Reference.internal(slot), negated);
    }

    private int lookup(int variable, int high, int low) {
        hashLookups += 1;
        int current = hashToChainStart[HashUtil.bucket(HashUtil.hash(variable, high, low), hashToChainStart.length)];
        int length = 1;
        while (current != NOT_A_SLOT) {
            if (variables[current] == variable && highs[current] == high && lows[current] == low) {
                hashLookupLength += length;
                hashLookupHits += 1;
                return current;
            }
            current = chain[current];
            length += 1;
        }
        hashLookupLength += length;
        return NOT_A_SLOT;
    }

    private int allocateSlot() {
        if (firstFreeSlot != NOT_A_SLOT) {
            int slot = firstFreeSlot;
            firstFreeSlot = chain[slot];
            assert variables[slot] == EMPTY : "Overwriting occupied slot " + slot;
            return slot;
        }
        if (highWater == variables.length) {
            grow();
        }
        int slot = highWater;
        highWater += 1;
        return slot;
    }

    private void grow() {
        int oldSize = variables.length;
        int newSize = Util.grow(oldSize, configuration.growthFactor(), MINIMUM_GROWTH);
        checkState(newSize <= Reference.MAXIMAL_PAYLOAD, "Node store exhausted at %d slots", oldSize);
        logger.log(Level.FINE, "Growing {0} from {1} to {2}", new Object[] {this, oldSize, newSize});
        growCount += 1;

        variables = Arrays.copyOf(variables, newSize);
        Arrays.fill(variables, oldSize, newSize, EMPTY);
        highs = Arrays.copyOf(highs, newSize);
        lows = Arrays.copyOf(lows, newSize);
        internalCounts = Arrays.copyOf(internalCounts, newSize);
        externalCounts = Arrays.copyOf(externalCounts, newSize);
        rowNext = Arrays.copyOf(rowNext, newSize);
        rowPrevious = Arrays.copyOf(rowPrevious, newSize);
        int[] oldChain = chain;
        chain = Arrays.copyOf(chain, newSize);

        // Bucket count changes, so all occupied slots are re-hashed. Free slots keep their chain entries.
        hashToChainStart = new int[Primes.nextPrime(newSize)];
        for (int slot = highWater - 1; slot >= FIRST_SLOT; slot--) {
            if (variables[slot] >= 0) {
                chain[slot] = NOT_A_SLOT;
                connectHashList(slot);
            } else {
                assert chain[slot] == oldChain[slot];
            }
        }
    }

    private void connectHashList(int slot) {
        int bucket = HashUtil.bucket(HashUtil.hash(variables[slot], highs[slot], lows[slot]), hashToChainStart.length);
        chain[slot] = hashToChainStart[bucket];
        hashToChainStart[bucket] = slot;
    }

    private void disconnectHashList(int slot) {
        int bucket = HashUtil.bucket(HashUtil.hash(variables[slot], highs[slot], lows[slot]), hashToChainStart.length);
        int current = hashToChainStart[bucket];
        if (current == slot) {
            hashToChainStart[bucket] = chain[slot];
            return;
        }
        while (chain[current] != slot) {
            assert chain[current] != NOT_A_SLOT : "Slot " + slot + " missing from its hash chain";
            current = chain[current];
        }
        chain[current] = chain[slot];
    }

    private void ensureRowCapacity(int variable) {
        if (variable >= rowHead.length) {
            int newSize = Math.max(variable + 1, rowHead.length * 2);
            rowHead = Arrays.copyOf(rowHead, newSize);
            rowSizes = Arrays.copyOf(rowSizes, newSize);
        }
    }

    private void connectRow(int slot) {
        int variable = variables[slot];
        ensureRowCapacity(variable);
        int head = rowHead[variable];
        rowNext[slot] = head;
        rowPrevious[slot] = NOT_A_SLOT;
        if (head != NOT_A_SLOT) {
            rowPrevious[head] = slot;
        }
        rowHead[variable] = slot;
        rowSizes[variable] += 1;
    }

    private void disconnectRow(int slot) {
        int variable = variables[slot];
        int next = rowNext[slot];
        int previous = rowPrevious[slot];
        if (previous == NOT_A_SLOT) {
            rowHead[variable] = next;
        } else {
            rowNext[previous] = next;
        }
        if (next != NOT_A_SLOT) {
            rowPrevious[next] = previous;
        }
        rowSizes[variable] -= 1;
    }

    // Reference counting

    /**
     * Adds a hold to the referenced node. No-op for constants and literals.
     *
     * @return The given reference, for chaining.
     * @throws NodeNotFoundException if the referenced slot is not occupied.
     */
    public int acquire(int reference) {
        if (Reference.isInternal(reference)) {
            externalCounts[checkOccupied(reference)] += 1;
        }
        return reference;
    }

    /**
     * Drops a hold on the referenced node, reclaiming it (and transitively its children) if nothing refers to it
     * anymore. No-op for constants and literals.
     *
     * @throws IllegalStateException if the node has no hold left, i.e. it has been released before.
     */
    public void release(int reference) {
        if (!Reference.isInternal(reference)) {
            return;
        }
        int slot = Reference.slot(reference);
        checkState(slot < highWater && variables[slot] >= 0 && externalCounts[slot] > 0,
                "Double release of %s", Reference.toString(reference));
        externalCounts[slot] -= 1;
        if (externalCounts[slot] == 0 && internalCounts[slot] == 0) {
            reclaim(slot);
        }
    }

    private void addCounts(int reference, int internal, int external) {
        if (Reference.isInternal(reference)) {
            int slot = Reference.slot(reference);
            assert variables[slot] >= 0;
            internalCounts[slot] += internal;
            externalCounts[slot] += external;
        }
    }

    /**
     * Removes one internal edge from the referenced node, reclaiming it if it becomes unreferenced.
     */
    void dropEdge(int reference) {
        if (!Reference.isInternal(reference)) {
            return;
        }
        int slot = Reference.slot(reference);
        assert variables[slot] >= 0 && internalCounts[slot] > 0 : "No edge to drop on " + slot;
        internalCounts[slot] -= 1;
        if (internalCounts[slot] == 0 && externalCounts[slot] == 0) {
            reclaim(slot);
        }
    }

    /**
     * Removes one internal edge without reclaiming. The caller must either re-add an edge or call
     * {@link #reclaimIfUnreferenced(int)} before the end of the current operation.
     */
    void dropEdgeDeferred(int reference) {
        if (Reference.isInternal(reference)) {
            int slot = Reference.slot(reference);
            assert variables[slot] >= 0 && internalCounts[slot] > 0;
            internalCounts[slot] -= 1;
        }
    }

    void addEdge(int reference) {
        addCounts(reference, 1, 0);
    }

    void reclaimIfUnreferenced(int reference) {
        if (Reference.isInternal(reference)) {
            int slot = Reference.slot(reference);
            if (variables[slot] >= 0 && internalCounts[slot] == 0 && externalCounts[slot] == 0) {
                reclaim(slot);
            }
        }
    }

    boolean isUnreferenced(int reference) {
        int slot = Reference.slot(reference);
        return internalCounts[slot] == 0 && externalCounts[slot] == 0;
    }

    private void reclaim(int slot) {
        int base = workStackIndex;
        pushToWorkStack(slot);
        while (workStackIndex > base) {
            int current = peekAndPopWorkStack();
            assert variables[current] >= 0 && internalCounts[current] == 0 && externalCounts[current] == 0;
            int high = highs[current];
            int low = lows[current];
            freeSlot(current);
            if (Reference.isInternal(high)) {
                int child = Reference.slot(high);
                if (--internalCounts[child] == 0 && externalCounts[child] == 0) {
                    pushToWorkStack(child);
                }
            }
            if (Reference.isInternal(low)) {
                int child = Reference.slot(low);
                if (--internalCounts[child] == 0 && externalCounts[child] == 0) {
                    pushToWorkStack(child);
                }
            }
        }
    }

    /**
     * Unlinks the slot and pushes it to the free list without touching its children.
     */
    void freeSlot(int slot) {
        assert slot >= FIRST_SLOT && variables[slot] >= 0;
        disconnectHashList(slot);
        disconnectRow(slot);
        variables[slot] = EMPTY;
        highs[slot] = Reference.FALSE;
        lows[slot] = Reference.FALSE;
        chain[slot] = firstFreeSlot;
        firstFreeSlot = slot;
        occupied -= 1;
        reclaimedNodes += 1;
    }

    // Structural modification, used by swapping

    /**
     * Replaces the record of an occupied slot in place, keeping its counts. Children edges are not adjusted. The
     * caller must guarantee that the new record is normalized and not present in the store.
     */
    void rewrite(int slot, int variable, int high, int low) {
        assert variables[slot] >= 0;
        assert !Reference.isNegated(low) && high != low;
        disconnectHashList(slot);
        disconnectRow(slot);
        variables[slot] = variable;
        highs[slot] = high;
        lows[slot] = low;
        assert lookup(variable, high, low) == NOT_A_SLOT : "Rewrite would duplicate " + node(slot);
        connectHashList(slot);
        connectRow(slot);
    }

    /**
     * Snapshot of the slots currently on the row of {@code variable}.
     */
    int[] rowSlots(int variable) {
        if (variable >= rowHead.length) {
            return new int[0];
        }
        int[] slots = new int[rowSizes[variable]];
        int index = 0;
        for (int slot = rowHead[variable]; slot != NOT_A_SLOT; slot = rowNext[slot]) {
            slots[index++] = slot;
        }
        assert index == slots.length;
        return slots;
    }

    int variableOfSlot(int slot) {
        return variables[slot];
    }

    int highOfSlot(int slot) {
        return highs[slot];
    }

    int lowOfSlot(int slot) {
        return lows[slot];
    }

    void markStructuralModification() {
        structuralModifications += 1;
    }

    int structuralModifications() {
        return structuralModifications;
    }

    // Work stack

    protected final void pushToWorkStack(int value) {
        if (workStackIndex == workStack.length) {
            workStack = Arrays.copyOf(workStack, workStack.length * 2);
        }
        workStack[workStackIndex++] = value;
    }

    protected final int peekAndPopWorkStack() {
        assert workStackIndex > 0;
        return workStack[--workStackIndex];
    }

    // Reading

    /**
     * References of all nodes currently on the row of {@code variable}, each with positive polarity.
     */
    public Set<Integer> row(int variable) {
        checkArgument(order.contains(variable), "Unknown variable %d", variable);
        int[] slots = rowSlots(variable);
        Set<Integer> references = new LinkedHashSet<>(slots.length * 2);
        for (int slot : slots) {
            references.add(Reference.internal(slot));
        }
        return Collections.unmodifiableSet(references);
    }

    public int rowSize(int variable) {
        return variable < rowSizes.length ? rowSizes[variable] : 0;
    }

    /**
     * Number of occupied slots, not counting the false anchor.
     */
    public int len() {
        return occupied;
    }

    /**
     * Number of distinct internal nodes reachable from {@code reference}, including itself.
     */
    public int nodeCount(int reference) {
        return reachableSlots(reference).cardinality();
    }

    BitSet reachableSlots(int reference) {
        BitSet seen = new BitSet();
        if (!Reference.isInternal(reference)) {
            return seen;
        }
        int base = workStackIndex;
        pushToWorkStack(checkOccupied(reference));
        while (workStackIndex > base) {
            int slot = peekAndPopWorkStack();
            if (seen.get(slot)) {
                continue;
            }
            seen.set(slot);
            if (Reference.isInternal(highs[slot])) {
                pushToWorkStack(Reference.slot(highs[slot]));
            }
            if (Reference.isInternal(lows[slot])) {
                pushToWorkStack(Reference.slot(lows[slot]));
            }
        }
        return seen;
    }

    // Integrity checks and utility

    /**
     * Walks the whole store and checks every structural invariant: the anchor, uniqueness, reduction,
     * normalization, order consistency, exact internal counts, hash chains, rows and the free list.
     *
     * @param label Context included in the failure message.
     * @throws IllegalStateException on the first violation found.
     */
    @SuppressWarnings("PMD.AvoidDeeplyNestedIfStmts")
    public void validate(String label) {
        logger.log(Level.FINER, "Running integrity check ({0})", label);
        checkState(variables[0] == ANCHOR && highs[0] == Reference.FALSE && lows[0] == Reference.FALSE,
                "%s: slot 0 is not the false anchor", label);

        int[] expectedInternal = new int[highWater];
        Map<Vhl, Integer> records = new HashMap<>();
        int count = 0;
        for (int slot = FIRST_SLOT; slot < highWater; slot++) {
            int variable = variables[slot];
            if (variable < 0) {
                checkState(variable == EMPTY, "%s: slot %d has marker %d", label, slot, variable);
                continue;
            }
            count += 1;
            int high = highs[slot];
            int low = lows[slot];
            checkState(order.contains(variable), "%s: %s has unknown variable", label, node(slot));
            checkState(high != low, "%s: %s is redundant", label, node(slot));
            checkState(!Reference.isNegated(low), "%s: %s has negated low edge", label, node(slot));
            checkState(!(high == Reference.TRUE && low == Reference.FALSE), "%s: %s is a stored literal", label,
                    node(slot));
            for (int child : new int[] {high, low}) {
                checkState(isValid(child), "%s: %s has invalid child %s", label, node(slot),
                        Reference.toString(child));
                checkState(positionOf(child) > order.position(variable), "%s: %s -> %s does not descend %s",
                        label, node(slot), Reference.toString(child), order);
                if (Reference.isInternal(child)) {
                    expectedInternal[Reference.slot(child)] += 1;
                }
            }
            Integer duplicate = records.put(new Vhl(variable, high, low), slot);
            checkState(duplicate == null, "%s: duplicate entries %s and %s", label, node(slot),
                    duplicate == null ? "" : node(duplicate));
            checkState(lookup(variable, high, low) == slot, "%s: %s not found in its hash chain", label,
                    node(slot));
        }
        checkState(count == occupied, "%s: counted %d occupied slots, expected %d", label, count, occupied);

        for (int slot = FIRST_SLOT; slot < highWater; slot++) {
            if (variables[slot] < 0) {
                continue;
            }
            checkState(internalCounts[slot] == expectedInternal[slot], "%s: %s has %d internal references, expected %d",
                    label, node(slot), internalCounts[slot], expectedInternal[slot]);
            checkState(externalCounts[slot] >= 0, "%s: %s has negative hold count", label, node(slot));
            checkState(internalCounts[slot] + externalCounts[slot] > 0, "%s: %s is unreferenced", label, node(slot));
        }

        int rowTotal = 0;
        for (int variable = 0; variable < rowHead.length; variable++) {
            int rowCount = 0;
            for (int slot = rowHead[variable]; slot != NOT_A_SLOT; slot = rowNext[slot]) {
                checkState(variables[slot] == variable, "%s: slot %d listed in row of %d", label, slot, variable);
                rowCount += 1;
            }
            checkState(rowCount == rowSizes[variable], "%s: row %d has %d entries, expected %d", label, variable,
                    rowCount, rowSizes[variable]);
            rowTotal += rowCount;
        }
        checkState(rowTotal == occupied, "%s: rows hold %d slots, expected %d", label, rowTotal, occupied);

        int free = 0;
        BitSet seenFree = new BitSet();
        for (int slot = firstFreeSlot; slot != NOT_A_SLOT; slot = chain[slot]) {
            checkState(slot >= FIRST_SLOT && slot < highWater, "%s: free list points to %d", label, slot);
            checkState(variables[slot] == EMPTY, "%s: free slot %d is occupied", label, slot);
            checkState(!seenFree.get(slot), "%s: free list loops at %d", label, slot);
            seenFree.set(slot);
            free += 1;
        }
        checkState(free + occupied == highWater - FIRST_SLOT, "%s: %d free and %d occupied of %d slots", label, free,
                occupied, highWater - FIRST_SLOT);
    }

    public String statistics() {
        return String.format(
                "Node store statistics:%n"
                        + "Arena: %1$d slots, %2$d used, %3$d occupied, %4$d grows%n"
                        + "%5$d created, %6$d reclaimed, %7$d structural modifications%n"
                        + "Hash index: %8$d buckets, %9$d lookups, %10$.2f avg. len, %11$.2f hit rate",
                variables.length,
                highWater,
                occupied,
                growCount,
                createdNodes,
                reclaimedNodes,
                structuralModifications,
                hashToChainStart.length,
                hashLookups,
                hashLookups == 0 ? 0.0 : hashLookupLength * 1.0 / hashLookups,
                hashLookups == 0 ? 0.0 : hashLookupHits * 1.0 / hashLookups);
    }

    public String nodeToString(int slot) {
        if (slot == 0) {
            return String.format("%5d| == ANCHOR ==", slot);
        }
        if (slot >= highWater || variables[slot] < 0) {
            return String.format("%5d| == EMPTY ==", slot);
        }
        return String.format("%5d|%5s|%3d|%3d|%s", slot, order.name(variables[slot]), internalCounts[slot],
                externalCounts[slot], node(slot));
    }

    /**
     * Lists every node below {@code reference} in the format {@code SLOT|VAR|INT|EXT|RECORD}.
     */
    public String treeToString(int reference) {
        if (!Reference.isInternal(reference)) {
            return String.format("Node %s%n", Reference.toString(reference));
        }
        StringBuilder builder = new StringBuilder(64)
                .append("Node ").append(Reference.toString(reference)).append('\n')
                .append("   SLOT|  VAR|INT|EXT|DATA\n");
        BitSet slots = reachableSlots(reference);
        for (int slot = slots.nextSetBit(0); slot >= 0; slot = slots.nextSetBit(slot + 1)) {
            builder.append("  ").append(nodeToString(slot)).append('\n');
        }
        return builder.toString();
    }

    private String node(int slot) {
        return String.format("@%d%s", slot, new Vhl(variables[slot], highs[slot], lows[slot]));
    }

    @Override
    public String toString() {
        return String.format("NodeStore@%08x(%d)", System.identityHashCode(this), occupied);
    }

    static boolean isRegisteredForShutdownStatistics(NodeStore store) {
        return statisticsShutdownHook.contains(store);
    }

    private static final class ShutdownHookLazyHolder {
        static {
            Runtime.getRuntime().addShutdownHook(new Thread(new ShutdownHookPrinter()));
        }

        static void init() {
            // forces static initialization
        }
    }

    static final class ShutdownHookPrinter implements Runnable {
        @Override
        public void run() {
            if (!logger.isLoggable(Level.INFO)) {
                return;
            }
            for (NodeStore store : statisticsShutdownHook) {
                logger.info(store.statistics());
            }
        }
    }
}
