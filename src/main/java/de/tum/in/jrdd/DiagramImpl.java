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

import java.math.BigInteger;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/* Implementation notes:
 * - Every top-level operation uses a fresh CallMemo. Each result stored in the memo owns one hold, so that
 *   intermediate nodes survive until the operation is finished. At the end, the caller's hold on the result is
 *   added and all memo holds are dropped.
 * - Recursion over the diagram is done with explicit frame stacks.
 */
@SuppressWarnings({
    "PMD.AvoidReassigningParameters",
    "PMD.GodClass",
    "ReassignedVariable",
    "AssignmentToMethodParameter",
    "ValueOfIncrementOrDecrementUsed"
})
final class DiagramImpl extends NodeStore implements Diagram {
    private static final Logger logger = Logger.getLogger(DiagramImpl.class.getName());

    private static final int NO_RESULT = -1;
    private static final int MAXIMAL_TRUTH_TABLE_VARIABLES = 30;

    /* Frame states of the iterative traversals */
    private static final int START = 0;
    private static final int AWAIT_HIGH = 1;
    private static final int AWAIT_LOW = 2;
    private static final int AWAIT_SINGLE = 3;

    private final RowSwapper swapper;

    /* Normalized ite arguments, written by iteTerminalOrNormalize */
    private int normalIf;
    private int normalThen;
    private int normalElse;
    private boolean normalNegate;

    DiagramImpl(StoreConfiguration configuration) {
        super(new VariableOrder(), configuration);
        this.swapper = new RowSwapper(this);
    }

    @Override
    public int createVariable(VariableKind kind) {
        int variable = order().createVariable(kind);
        logger.log(Level.FINEST, "Created variable {0}", order().name(variable));
        return variable;
    }

    @Override
    public int literal(int variable) {
        checkArgument(order().contains(variable), "Unknown variable %d", variable);
        return Reference.literal(variable);
    }

    // ITE

    @Override
    public int ite(int condition, int thenReference, int elseReference) {
        checkReference(condition);
        checkReference(thenReference);
        checkReference(elseReference);
        CallMemo memo = new CallMemo();
        int result = iteIterative(condition, thenReference, elseReference, memo);
        acquire(result);
        memo.forEachValue(this::release);
        return result;
    }

    /**
     * Resolves the trivial cases and memo hits. Otherwise, stores the normalized arguments (positive condition,
     * positive then branch, output polarity) in the normal* fields and returns {@link #NO_RESULT}.
     */
    private int iteTerminalOrNormalize(int condition, int thenReference, int elseReference, CallMemo memo) {
        if (condition == Reference.TRUE) {
            return thenReference;
        }
        if (condition == Reference.FALSE) {
            return elseReference;
        }
        int negatedCondition = Reference.not(condition);
        if (thenReference == condition) {
            thenReference = Reference.TRUE;
        } else if (thenReference == negatedCondition) {
            thenReference = Reference.FALSE;
        }
        if (elseReference == condition) {
            elseReference = Reference.FALSE;
        } else if (elseReference == negatedCondition) {
            elseReference = Reference.TRUE;
        }
        if (thenReference == elseReference) {
            return thenReference;
        }
        if (thenReference == Reference.TRUE && elseReference == Reference.FALSE) {
            return condition;
        }
        if (thenReference == Reference.FALSE && elseReference == Reference.TRUE) {
            return negatedCondition;
        }

        if (Reference.isNegated(condition)) {
            condition = negatedCondition;
            int swap = thenReference;
            thenReference = elseReference;
            elseReference = swap;
        }
        boolean negate = Reference.isNegated(thenReference);
        if (negate) {
            thenReference = Reference.not(thenReference);
            elseReference = Reference.not(elseReference);
        }
        int cached = memo.get(condition, thenReference, elseReference);
        if (cached != NO_RESULT) {
            return Reference.negateIf(cached, negate);
        }
        normalIf = condition;
        normalThen = thenReference;
        normalElse = elseReference;
        normalNegate = negate;
        return NO_RESULT;
    }

    private int iteIterative(int condition, int thenReference, int elseReference, CallMemo memo) {
        int result = iteTerminalOrNormalize(condition, thenReference, elseReference, memo);
        if (result != NO_RESULT) {
            return result;
        }

        IteFrames frames = new IteFrames();
        frames.push(normalIf, normalThen, normalElse, normalNegate, topVariable(normalIf, normalThen, normalElse));
        int delivered = NO_RESULT;
        while (true) {
            int frame = frames.size - 1;
            int state = frames.states[frame];
            if (state == START || state == AWAIT_HIGH) {
                boolean high = state == START;
                if (!high) {
                    frames.highResults[frame] = delivered;
                }
                frames.states[frame] = high ? AWAIT_HIGH : AWAIT_LOW;

                int variable = frames.variables[frame];
                int ifCofactor = cofactor(frames.ifs[frame], variable, high);
                int thenCofactor = cofactor(frames.thens[frame], variable, high);
                int elseCofactor = cofactor(frames.elses[frame], variable, high);
                result = iteTerminalOrNormalize(ifCofactor, thenCofactor, elseCofactor, memo);
                if (result == NO_RESULT) {
                    frames.push(normalIf, normalThen, normalElse, normalNegate,
                            topVariable(normalIf, normalThen, normalElse));
                } else {
                    delivered = result;
                }
                continue;
            }

            assert state == AWAIT_LOW;
            int node = makeNode(frames.variables[frame], frames.highResults[frame], delivered);
            memo.put(frames.ifs[frame], frames.thens[frame], frames.elses[frame], node);
            delivered = Reference.negateIf(node, frames.negates[frame]);
            frames.size -= 1;
            if (frames.size == 0) {
                return delivered;
            }
        }
    }

    private int topVariable(int first, int second, int third) {
        int position = Math.min(positionOf(first), Math.min(positionOf(second), positionOf(third)));
        assert position != Integer.MAX_VALUE;
        return order().variableAt(position);
    }

    private int cofactor(int reference, int variable, boolean high) {
        if (variableOf(reference) != variable) {
            return reference;
        }
        return high ? high(reference) : low(reference);
    }

    @Override
    public int and(int first, int second) {
        return ite(first, second, Reference.FALSE);
    }

    @Override
    public int or(int first, int second) {
        return ite(first, Reference.TRUE, second);
    }

    @Override
    public int xor(int first, int second) {
        return ite(first, Reference.not(second), second);
    }

    @Override
    public int not(int reference) {
        checkReference(reference);
        return acquire(Reference.not(reference));
    }

    @Override
    public int implication(int first, int second) {
        return ite(first, second, Reference.TRUE);
    }

    @Override
    public int equivalence(int first, int second) {
        return ite(first, second, Reference.not(second));
    }

    @Override
    public int gt(int first, int second) {
        return ite(first, Reference.not(second), Reference.FALSE);
    }

    @Override
    public int lt(int first, int second) {
        return ite(first, Reference.FALSE, second);
    }

    // Substitution

    @Override
    public int eval(int reference, Map<Integer, Integer> replacements) {
        checkReference(reference);
        int[] replacementArray = new int[order().size()];
        Arrays.fill(replacementArray, NO_RESULT);
        int lowestPosition = -1;
        for (Map.Entry<Integer, Integer> entry : replacements.entrySet()) {
            int variable = entry.getKey();
            checkArgument(order().contains(variable), "Unknown variable %d", variable);
            checkReference(entry.getValue());
            replacementArray[variable] = entry.getValue();
            lowestPosition = Math.max(lowestPosition, order().position(variable));
        }
        if (lowestPosition == -1) {
            return acquire(reference);
        }
        int limit = lowestPosition;
        return rebuild(reference, new Rebuilder() {
            @Override
            public int terminal(int node) {
                return positionOf(node) > limit ? node : NO_RESULT;
            }

            @Override
            public int select(int variable) {
                return -1;
            }

            @Override
            public int combine(int variable, int high, int low) {
                int replacement = replacementArray[variable];
                return ite(replacement == NO_RESULT ? Reference.literal(variable) : replacement, high, low);
            }
        });
    }

    @Override
    public int swapVariables(int reference, int first, int second) {
        checkArgument(order().contains(first) && order().contains(second), "Unknown variables %d, %d", first, second);
        if (first == second) {
            checkReference(reference);
            return acquire(reference);
        }
        return eval(reference, Map.of(first, Reference.literal(second), second, Reference.literal(first)));
    }

    // Cofactors and quantification

    @Override
    public int whenTrue(int reference, int variable) {
        return cofactor(reference, BitSets.of(variable), BitSets.of(variable));
    }

    @Override
    public int whenFalse(int reference, int variable) {
        return cofactor(reference, BitSets.of(variable), new BitSet());
    }

    @Override
    public int restrict(int reference, BitSet variables, BitSet values) {
        return cofactor(reference, variables, values);
    }

    private int cofactor(int reference, BitSet variables, BitSet values) {
        checkReference(reference);
        int lowestPosition = -1;
        for (int variable = variables.nextSetBit(0); variable >= 0; variable = variables.nextSetBit(variable + 1)) {
            checkArgument(order().contains(variable), "Unknown variable %d", variable);
            lowestPosition = Math.max(lowestPosition, order().position(variable));
        }
        if (lowestPosition == -1) {
            return acquire(reference);
        }
        int limit = lowestPosition;
        return rebuild(reference, new Rebuilder() {
            @Override
            public int terminal(int node) {
                return positionOf(node) > limit ? node : NO_RESULT;
            }

            @Override
            public int select(int variable) {
                if (!variables.get(variable)) {
                    return -1;
                }
                return values.get(variable) ? 1 : 0;
            }

            @Override
            public int combine(int variable, int high, int low) {
                // Cofactoring never introduces variables above the current one
                return makeNode(variable, high, low);
            }
        });
    }

    @Override
    public int quantify(int reference, BitSet variables, boolean universal) {
        checkReference(reference);
        for (int variable = variables.nextSetBit(0); variable >= 0; variable = variables.nextSetBit(variable + 1)) {
            checkArgument(order().contains(variable), "Unknown variable %d", variable);
        }
        int result = acquire(reference);
        for (int variable = variables.nextSetBit(0); variable >= 0; variable = variables.nextSetBit(variable + 1)) {
            int high = whenTrue(result, variable);
            int low = whenFalse(result, variable);
            int combined = universal ? and(high, low) : or(high, low);
            release(high);
            release(low);
            release(result);
            result = combined;
        }
        return result;
    }

    /**
     * Rebuilds the diagram below {@code root} bottom-up. Results are memoized on the positive reference, which is
     * sound as every rebuild commutes with negation.
     */
    private int rebuild(int root, Rebuilder rebuilder) {
        CallMemo memo = new CallMemo();
        RebuildFrames frames = new RebuildFrames();
        frames.push(root);
        int delivered = NO_RESULT;
        while (frames.size > 0) {
            int frame = frames.size - 1;
            int reference = frames.references[frame];
            int positive = Reference.positive(reference);
            int result;
            switch (frames.states[frame]) {
                case START:
                    if (Reference.isConstant(positive)) {
                        result = positive;
                        break;
                    }
                    result = memo.get(positive);
                    if (result != NO_RESULT) {
                        break;
                    }
                    result = rebuilder.terminal(positive);
                    if (result != NO_RESULT) {
                        memo.put(positive, acquire(result));
                        break;
                    }
                    int selection = rebuilder.select(variableOf(positive));
                    if (selection == -1) {
                        frames.states[frame] = AWAIT_HIGH;
                        frames.push(high(positive));
                    } else {
                        frames.states[frame] = AWAIT_SINGLE;
                        frames.push(selection == 1 ? high(positive) : low(positive));
                    }
                    continue;
                case AWAIT_HIGH:
                    frames.highResults[frame] = delivered;
                    frames.states[frame] = AWAIT_LOW;
                    frames.push(low(positive));
                    continue;
                case AWAIT_LOW:
                    result = rebuilder.combine(variableOf(positive), frames.highResults[frame], delivered);
                    memo.put(positive, result);
                    break;
                case AWAIT_SINGLE:
                    result = acquire(delivered);
                    memo.put(positive, result);
                    break;
                default:
                    throw new AssertionError("Unknown state " + frames.states[frame]);
            }
            delivered = Reference.negateIf(result, Reference.isNegated(reference));
            frames.size -= 1;
        }
        acquire(delivered);
        memo.forEachValue(this::release);
        return delivered;
    }

    // Inspection

    @Override
    public BitSet support(int reference) {
        checkReference(reference);
        BitSet support = new BitSet();
        if (Reference.isLiteral(reference)) {
            support.set(Reference.literalVariable(reference));
            return support;
        }
        BitSet slots = reachableSlots(reference);
        for (int slot = slots.nextSetBit(0); slot >= 0; slot = slots.nextSetBit(slot + 1)) {
            support.set(variableOfSlot(slot));
            addLiteralVariable(support, highOfSlot(slot));
            addLiteralVariable(support, lowOfSlot(slot));
        }
        return support;
    }

    private static void addLiteralVariable(BitSet support, int child) {
        if (Reference.isLiteral(child)) {
            support.set(Reference.literalVariable(child));
        }
    }

    @Override
    public boolean evaluate(int reference, BitSet assignment) {
        checkReference(reference);
        int current = reference;
        while (!Reference.isConstant(current)) {
            current = assignment.get(variableOf(current)) ? high(current) : low(current);
        }
        return current == Reference.TRUE;
    }

    @Override
    public BigInteger countSatisfyingAssignments(int reference, BitSet variables) {
        checkReference(reference);
        BitSet support = support(reference);
        checkArgument(BitSets.isSubset(support, variables), "Support %s not contained in %s", support, variables);
        for (int variable = variables.nextSetBit(0); variable >= 0; variable = variables.nextSetBit(variable + 1)) {
            checkArgument(order().contains(variable), "Unknown variable %d", variable);
        }
        int[] sorted = variables.stream()
                .boxed()
                .sorted(Comparator.comparingInt(variable -> order().position(variable)))
                .mapToInt(Integer::intValue)
                .toArray();
        int[] indexOf = new int[order().size()];
        for (int index = 0; index < sorted.length; index++) {
            indexOf[sorted[index]] = index;
        }
        SatisfactionCounter counter = new SatisfactionCounter(indexOf, sorted.length);
        if (Reference.isInternal(reference)) {
            // Children sit at larger positions, so processing bottom-up visits them first
            reachableSlots(reference).stream()
                    .boxed()
                    .sorted(Comparator.comparingInt((Integer slot) -> order().position(variableOfSlot(slot)))
                            .reversed())
                    .forEachOrdered(counter::count);
        }
        return counter.countFrom(reference, 0);
    }

    @Override
    public BitSet truthTable(int reference, int... variables) {
        checkReference(reference);
        checkArgument(variables.length <= MAXIMAL_TRUTH_TABLE_VARIABLES, "Too many variables: %d",
                variables.length);
        BitSet table = new BitSet(1 << variables.length);
        BitSet assignment = new BitSet();
        for (int row = 0; row < 1 << variables.length; row++) {
            assignment.clear();
            for (int index = 0; index < variables.length; index++) {
                if ((row & (1 << index)) != 0) {
                    assignment.set(variables[index]);
                }
            }
            if (evaluate(reference, assignment)) {
                table.set(row);
            }
        }
        return table;
    }

    // Enumeration

    @Override
    public SolutionCursor cursor(int reference, BitSet dontCares) {
        checkReference(reference);
        for (int variable = dontCares.nextSetBit(0); variable >= 0; variable = dontCares.nextSetBit(variable + 1)) {
            checkArgument(order().contains(variable), "Unknown variable %d", variable);
        }
        BitSet watched = support(reference);
        watched.or(dontCares);
        return new SolutionCursor(this, reference, watched);
    }

    // Reordering

    @Override
    public void swap(int variable) {
        checkArgument(order().contains(variable), "Unknown variable %d", variable);
        swapper.swap(variable);
        if (configuration().validateStructuralChanges()) {
            validate("swap(" + order().name(variable) + ")");
        }
    }

    @Override
    public String statistics() {
        return super.statistics() + String.format("%nSwaps: %d", swapper.swaps());
    }

    @Override
    public String toString() {
        return String.format("Diagram@%08x(%d vars, %d nodes)", System.identityHashCode(this), order().size(), len());
    }

    private interface Rebuilder {
        /**
         * Returns the unchanged result for a positive non-constant reference, or -1 to descend.
         */
        int terminal(int reference);

        /**
         * Returns 1 to follow only the high branch, 0 for only the low branch and -1 to rebuild both.
         */
        int select(int variable);

        /**
         * Combines the rebuilt children of a node on {@code variable}, returning a reference with one hold.
         */
        int combine(int variable, int high, int low);
    }

    private final class SatisfactionCounter {
        private final int[] indexOf;
        private final int variableCount;
        private final Map<Integer, BigInteger> slotCounts = new HashMap<>();

        SatisfactionCounter(int[] indexOf, int variableCount) {
            this.indexOf = indexOf;
            this.variableCount = variableCount;
        }

        private int indexOfReference(int reference) {
            return Reference.isConstant(reference) ? variableCount : indexOf[variableOf(reference)];
        }

        void count(int slot) {
            int node = Reference.internal(slot);
            int index = indexOfReference(node);
            BigInteger count = countFrom(high(node), index + 1).add(countFrom(low(node), index + 1));
            slotCounts.put(slot, count);
        }

        /**
         * Number of satisfying assignments of {@code reference} to the variables with index {@code from} and
         * above.
         */
        BigInteger countFrom(int reference, int from) {
            int index = indexOfReference(reference);
            assert index >= from;
            BigInteger own;
            if (Reference.isConstant(reference)) {
                own = reference == Reference.TRUE ? BigInteger.ONE : BigInteger.ZERO;
            } else {
                BigInteger positive = Reference.isLiteral(reference)
                        ? BigInteger.ONE.shiftLeft(variableCount - index - 1)
                        : slotCounts.get(Reference.slot(reference));
                own = Reference.isNegated(reference)
                        ? BigInteger.ONE.shiftLeft(variableCount - index).subtract(positive)
                        : positive;
            }
            return own.shiftLeft(index - from);
        }
    }

    private static final class IteFrames {
        int size = 0;
        int[] ifs = new int[16];
        int[] thens = new int[16];
        int[] elses = new int[16];
        int[] variables = new int[16];
        int[] states = new int[16];
        int[] highResults = new int[16];
        boolean[] negates = new boolean[16];

        void push(int condition, int thenReference, int elseReference, boolean negate, int variable) {
            if (size == ifs.length) {
                int newSize = size * 2;
                ifs = Arrays.copyOf(ifs, newSize);
                thens = Arrays.copyOf(thens, newSize);
                elses = Arrays.copyOf(elses, newSize);
                variables = Arrays.copyOf(variables, newSize);
                states = Arrays.copyOf(states, newSize);
                highResults = Arrays.copyOf(highResults, newSize);
                negates = Arrays.copyOf(negates, newSize);
            }
            ifs[size] = condition;
            thens[size] = thenReference;
            elses[size] = elseReference;
            negates[size] = negate;
            variables[size] = variable;
            states[size] = START;
            size += 1;
        }
    }

    private static final class RebuildFrames {
        int size = 0;
        int[] references = new int[16];
        int[] states = new int[16];
        int[] highResults = new int[16];

        void push(int reference) {
            if (size == references.length) {
                int newSize = size * 2;
                references = Arrays.copyOf(references, newSize);
                states = Arrays.copyOf(states, newSize);
                highResults = Arrays.copyOf(highResults, newSize);
            }
            references[size] = reference;
            states[size] = START;
            size += 1;
        }
    }
}
