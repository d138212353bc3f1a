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

import java.math.BigInteger;
import java.util.BitSet;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * A store of reduced ordered decision diagrams with complement edges, supporting in-place reordering of adjacent
 * variables.
 *
 * <p>References are plain {@code int}s, see {@link Reference}. Every operation which returns a reference hands one
 * hold on it to the caller, who has to {@link #release(int)} it eventually. Arguments are only borrowed. Holds on
 * constants and literals are free and releasing them is a no-op.</p>
 *
 * <p>Instances are not thread safe. All access has to be serialized externally.</p>
 */
public interface Diagram {
    VariableOrder order();

    default int createVariable() {
        return createVariable(VariableKind.ORDINARY);
    }

    /**
     * Appends a new variable at the bottom of the order. Variables are numbered sequentially, starting at 0.
     *
     * @return The number of the new variable.
     */
    int createVariable(VariableKind kind);

    default int[] createVariables(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("Count must be positive");
        }
        int[] array = new int[count];
        for (int i = 0; i < count; i++) {
            array[i] = createVariable();
        }
        return array;
    }

    /**
     * The reference representing the given variable. Literals never occupy a slot of the store.
     */
    int literal(int variable);

    // Inspection

    /**
     * Decomposes the reference into variable, high and low child, with the polarity of the reference applied to the
     * children.
     *
     * @return The record, or empty for constants and literals.
     * @throws NodeNotFoundException if the reference is stale.
     */
    Optional<Vhl> get(int reference);

    /**
     * Returns the current number of edges and holds on the referenced node, or -1 for constants and literals.
     *
     * @throws NodeNotFoundException if the reference is stale.
     */
    int refcount(int reference);

    BitSet support(int reference);

    int nodeCount(int reference);

    /**
     * Checks whether the function is true under the given assignment, where set bits are true variables.
     */
    boolean evaluate(int reference, BitSet assignment);

    // Reference management

    int acquire(int reference);

    /**
     * Drops one hold. Nodes without holds and without parents are reclaimed immediately.
     *
     * @throws IllegalStateException if the node is not held anymore.
     */
    void release(int reference);

    /**
     * Releases the given inputs and returns {@code result}, e.g. {@code x = consume(and(x, y), x, y)}.
     */
    default int consume(int result, int... inputs) {
        for (int input : inputs) {
            release(input);
        }
        return result;
    }

    /**
     * Inserts the node {@code (variable, high, low)} through the deduplicating insertion, adding {@code holds} holds.
     *
     * @throws IllegalArgumentException if a child is not strictly below {@code variable}.
     */
    int insertOrReuse(int variable, int high, int low, int holds);

    // Combinators

    /**
     * Computes "if {@code condition} then {@code thenReference} else {@code elseReference}".
     */
    int ite(int condition, int thenReference, int elseReference);

    int and(int first, int second);

    int or(int first, int second);

    int xor(int first, int second);

    int not(int reference);

    int implication(int first, int second);

    int equivalence(int first, int second);

    /**
     * {@code first} and not {@code second}.
     */
    int gt(int first, int second);

    /**
     * Not {@code first} and {@code second}.
     */
    int lt(int first, int second);

    /**
     * Simultaneously replaces each variable in {@code replacements} by the associated function. Variables not
     * mentioned are kept.
     */
    int eval(int reference, Map<Integer, Integer> replacements);

    default int substitute(int reference, int variable, int replacement) {
        return eval(reference, Map.of(variable, replacement));
    }

    /**
     * Exchanges the roles of two variables inside the given function, leaving the order unchanged.
     */
    int swapVariables(int reference, int first, int second);

    // Cofactors and quantification

    int whenTrue(int reference, int variable);

    int whenFalse(int reference, int variable);

    /**
     * Fixes every variable of {@code variables} to its value in {@code values}.
     */
    int restrict(int reference, BitSet variables, BitSet values);

    /**
     * Folds over {@code variables}, combining both cofactors with and (universal) or or (existential).
     */
    int quantify(int reference, BitSet variables, boolean universal);

    default int exists(int reference, BitSet variables) {
        return quantify(reference, variables, false);
    }

    default int forall(int reference, BitSet variables) {
        return quantify(reference, variables, true);
    }

    // Counting and enumeration

    /**
     * Number of assignments to {@code variables} satisfying the function.
     *
     * @throws IllegalArgumentException if the support is not contained in {@code variables}.
     */
    BigInteger countSatisfyingAssignments(int reference, BitSet variables);

    /**
     * Truth table over the given variables. Bit {@code i} of the result is the value under the assignment where
     * {@code variables[j]} is true iff bit {@code j} of {@code i} is set.
     */
    BitSet truthTable(int reference, int... variables);

    default SolutionCursor cursor(int reference) {
        return cursor(reference, new BitSet());
    }

    /**
     * Opens a cursor over the satisfying assignments, watching the support and {@code dontCares}. The cursor holds
     * the reference until it is closed.
     */
    SolutionCursor cursor(int reference, BitSet dontCares);

    /**
     * Iterates every satisfying assignment over the support and {@code dontCares}. The returned sets are fresh
     * copies.
     */
    default Iterator<BitSet> solutions(int reference, BitSet dontCares) {
        SolutionCursor cursor = cursor(reference, dontCares);
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                if (cursor.isAtEnd()) {
                    cursor.close();
                    return false;
                }
                return true;
            }

            @Override
            public BitSet next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                BitSet assignment = cursor.assignment();
                cursor.advance();
                return assignment;
            }
        };
    }

    // Ordering and store maintenance

    /**
     * Moves {@code variable} one position towards the root, exchanging it with the variable directly above. Every
     * held reference keeps denoting the same function. Swapping the top variable does nothing.
     */
    void swap(int variable);

    Set<Integer> row(int variable);

    int len();

    /**
     * Checks all structural invariants.
     *
     * @throws IllegalStateException on the first violation, with {@code label} in the message.
     */
    void validate(String label);

    String statistics();
}
