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

final class HashUtil {
    private static final int PRIME = 0x1000193;

    private HashUtil() {}

    static int hash(int variable, int high, int low) {
        return (variable * PRIME) ^ (high * 31 + low);
    }

    static int bucket(int hash, int size) {
        int mod = hash % size;
        return mod < 0 ? mod + size : mod;
    }
}
