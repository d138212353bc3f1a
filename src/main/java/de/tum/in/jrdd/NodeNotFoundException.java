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

import java.util.NoSuchElementException;

/**
 * Thrown when a reference points to a slot which is not occupied, i.e. it has never been allocated or has already
 * been reclaimed.
 */
public class NodeNotFoundException extends NoSuchElementException {
    private static final long serialVersionUID = 1L;

    private final int reference;

    public NodeNotFoundException(int reference) {
        super(String.format("No node for reference %s", Reference.toString(reference)));
        this.reference = reference;
    }

    public int reference() {
        return reference;
    }
}
