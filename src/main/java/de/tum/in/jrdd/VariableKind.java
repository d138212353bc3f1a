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

/**
 * Informational tag of a variable. Ordering never depends on the kind.
 */
public enum VariableKind {
    /** A regular variable of the represented functions. */
    ORDINARY('x'),
    /** A variable used only to build scaffolding diagrams, e.g. in swap fixtures. */
    SCAFFOLD('v');

    private final char prefix;

    VariableKind(char prefix) {
        this.prefix = prefix;
    }

    public String name(int variable) {
        return prefix + Integer.toString(variable);
    }
}
