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

import java.util.Arrays;
import java.util.StringJoiner;

/**
 * Append-only sequence of variables. Position 0 is the variable closest to the root, new variables are appended at
 * the bottom. Children of a node always sit at strictly larger positions than the node itself.
 */
public final class VariableOrder {
    private static final int[] EMPTY_INT_ARRAY = new int[0];

    private VariableKind[] kinds = new VariableKind[0];
    /* position -> variable and variable -> position */
    private int[] variableAt = EMPTY_INT_ARRAY;
    private int[] positionOf = EMPTY_INT_ARRAY;
    private int size = 0;

    public int createVariable(VariableKind kind) {
        checkArgument(size < Reference.MAXIMAL_PAYLOAD, "Too many variables");
        if (size == variableAt.length) {
            int newSize = Math.max(8, size * 2);
            kinds = Arrays.copyOf(kinds, newSize);
            variableAt = Arrays.copyOf(variableAt, newSize);
            positionOf = Arrays.copyOf(positionOf, newSize);
        }
        int variable = size;
        kinds[variable] = kind;
        variableAt[variable] = variable;
        positionOf[variable] = variable;
        size += 1;
        return variable;
    }

    public int size() {
        return size;
    }

    public boolean contains(int variable) {
        return 0 <= variable && variable < size;
    }

    public int position(int variable) {
        assert contains(variable) : "Unknown variable " + variable;
        return positionOf[variable];
    }

    public int variableAt(int position) {
        assert 0 <= position && position < size;
        return variableAt[position];
    }

    public VariableKind kind(int variable) {
        assert contains(variable);
        return kinds[variable];
    }

    /**
     * Returns the variable immediately closer to the root, or -1 if {@code variable} is at the top.
     */
    public int above(int variable) {
        int position = position(variable);
        return position == 0 ? -1 : variableAt[position - 1];
    }

    /**
     * Returns the variable immediately closer to the leaves, or -1 if {@code variable} is at the bottom.
     */
    public int below(int variable) {
        int position = position(variable);
        return position == size - 1 ? -1 : variableAt[position + 1];
    }

    /**
     * Whether {@code first} comes strictly before (closer to the root than) {@code second}.
     */
    public boolean isBefore(int first, int second) {
        return position(first) < position(second);
    }

    /**
     * Moves {@code variable} one position up, exchanging it with {@link #above(int)}.
     */
    void exchange(int variable) {
        int position = position(variable);
        checkArgument(position > 0, "Variable %s is already at the top", name(variable));
        int upper = variableAt[position - 1];
        variableAt[position - 1] = variable;
        variableAt[position] = upper;
        positionOf[variable] = position - 1;
        positionOf[upper] = position;
    }

    public String name(int variable) {
        return kind(variable).name(variable);
    }

    /**
     * Variables from the root downwards.
     */
    public int[] toArray() {
        return Arrays.copyOf(variableAt, size);
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(" ", "[", "]");
        for (int position = 0; position < size; position++) {
            joiner.add(name(variableAt[position]));
        }
        return joiner.toString();
    }
}
