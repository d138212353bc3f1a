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

import javax.annotation.Nullable;

/**
 * A decision node record: if {@code variable} then {@code high} else {@code low}.
 */
public final class Vhl {
    private final int variable;
    private final int high;
    private final int low;

    public Vhl(int variable, int high, int low) {
        this.variable = variable;
        this.high = high;
        this.low = low;
    }

    public int variable() {
        return variable;
    }

    public int high() {
        return high;
    }

    public int low() {
        return low;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Vhl)) {
            return false;
        }
        Vhl other = (Vhl) o;
        return variable == other.variable && high == other.high && low == other.low;
    }

    @Override
    public int hashCode() {
        return HashUtil.hash(variable, high, low);
    }

    @Override
    public String toString() {
        return String.format("(%d ? %s : %s)", variable, Reference.toString(high), Reference.toString(low));
    }
}
