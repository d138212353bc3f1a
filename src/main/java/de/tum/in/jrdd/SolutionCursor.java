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
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A resumable walk over the satisfying assignments of a diagram.
 *
 * <p>The cursor assigns exactly the <em>watched</em> variables, i.e. the support of the function together with any
 * additionally requested variables. Paths to {@code TRUE} are visited depth-first, low branch first. Watched
 * variables which do not occur on the current path are counted through in binary before the walk continues, so no
 * part of the diagram is visited twice for them. Unwatched variables are never enumerated; {@link #expand(BitSet)}
 * produces their combinations on request.</p>
 *
 * <p>The cursor holds its root until {@link #close()} is called. Any swap performed on the store while the cursor is
 * open invalidates it.</p>
 */
public final class SolutionCursor implements AutoCloseable {
    private final DiagramImpl diagram;
    private final int root;
    private final BitSet watched;
    private final int expectedModifications;

    private int[] pathNodes = new int[16];
    private boolean[] pathBranches = new boolean[16];
    private int depth = 0;

    private final BitSet assignment = new BitSet();
    private final BitSet pathVariables = new BitSet();
    private int[] freeVariables = new int[0];

    private boolean atEnd;
    private boolean closed = false;

    SolutionCursor(DiagramImpl diagram, int root, BitSet watched) {
        this.diagram = diagram;
        this.root = diagram.acquire(root);
        this.watched = BitSets.copyOf(watched);
        this.expectedModifications = diagram.structuralModifications();
        this.atEnd = root == Reference.FALSE;
        if (!atEnd) {
            descend(root);
        }
    }

    public boolean isAtEnd() {
        return atEnd;
    }

    /**
     * Moves to the next satisfying assignment.
     *
     * @throws NoSuchElementException if the cursor is at its end.
     * @throws ConcurrentModificationException if the store has been restructured since the cursor was opened.
     */
    public void advance() {
        checkState(!closed, "Cursor is closed");
        if (atEnd) {
            throw new NoSuchElementException("Cursor is at its end");
        }
        checkUnmodified();

        for (int variable : freeVariables) {
            if (assignment.get(variable)) {
                assignment.clear(variable);
            } else {
                assignment.set(variable);
                return;
            }
        }

        // All free combinations seen, backtrack to the deepest node whose high branch is still open
        while (depth > 0) {
            depth -= 1;
            int node = pathNodes[depth];
            if (!pathBranches[depth]) {
                int high = diagram.high(node);
                if (high != Reference.FALSE) {
                    push(node, true);
                    descend(high);
                    return;
                }
            }
        }
        atEnd = true;
    }

    /**
     * The true variables of the current assignment. Watched variables not contained are false.
     */
    public BitSet assignment() {
        checkState(!atEnd, "Cursor is at its end");
        return BitSets.copyOf(assignment);
    }

    public boolean value(int variable) {
        checkArgument(watched.get(variable), "Variable %d is not watched", variable);
        checkState(!atEnd, "Cursor is at its end");
        return assignment.get(variable);
    }

    public BitSet watched() {
        return BitSets.copyOf(watched);
    }

    /**
     * Variables decided by the current path through the diagram.
     */
    public BitSet pathVariables() {
        return BitSets.copyOf(pathVariables);
    }

    /**
     * Watched variables not decided by the current path.
     */
    public BitSet freeVariables() {
        return BitSets.of(freeVariables);
    }

    public BitSet dontCares(BitSet universe) {
        BitSet dontCares = BitSets.copyOf(universe);
        dontCares.andNot(watched);
        return dontCares;
    }

    /**
     * Lazily lists all assignments over {@code universe} (plus the watched variables) which agree with the current
     * assignment on the watched variables.
     */
    public Iterator<BitSet> expand(BitSet universe) {
        checkState(!atEnd, "Cursor is at its end");
        return new CubeExpansion(assignment, dontCares(universe));
    }

    /**
     * Releases the root held by this cursor. Closing twice has no effect.
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            atEnd = true;
            diagram.release(root);
        }
    }

    private void checkUnmodified() {
        if (diagram.structuralModifications() != expectedModifications) {
            throw new ConcurrentModificationException("Store was reordered while enumerating");
        }
    }

    private void push(int node, boolean branch) {
        if (depth == pathNodes.length) {
            pathNodes = Arrays.copyOf(pathNodes, depth * 2);
            pathBranches = Arrays.copyOf(pathBranches, depth * 2);
        }
        pathNodes[depth] = node;
        pathBranches[depth] = branch;
        depth += 1;
    }

    private void descend(int node) {
        int current = node;
        while (!Reference.isConstant(current)) {
            int low = diagram.low(current);
            if (low == Reference.FALSE) {
                push(current, true);
                current = diagram.high(current);
            } else {
                push(current, false);
                current = low;
            }
        }
        assert current == Reference.TRUE;
        updateAssignment();
    }

    private void updateAssignment() {
        assignment.clear();
        pathVariables.clear();
        for (int index = 0; index < depth; index++) {
            int variable = diagram.variableOf(pathNodes[index]);
            pathVariables.set(variable);
            if (pathBranches[index]) {
                assignment.set(variable);
            }
        }
        BitSet free = BitSets.copyOf(watched);
        free.andNot(pathVariables);
        freeVariables = BitSets.toArray(free);
    }
}
