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

final class Util {
    private Util() {}

    static void checkState(boolean state, String formatString, Object... format) {
        if (!state) {
            throw new IllegalStateException(String.format(formatString, format));
        }
    }

    static void checkArgument(boolean argument, String formatString, Object... format) {
        if (!argument) {
            throw new IllegalArgumentException(String.format(formatString, format));
        }
    }

    /**
     * Grows an array length by the given factor, always adding at least {@code minimumIncrease}.
     */
    @SuppressWarnings("NumericCastThatLosesPrecision")
    static int grow(int length, double growthFactor, int minimumIncrease) {
        long grown = (long) Math.ceil(length * growthFactor);
        long size = Math.max(grown, (long) length + minimumIncrease);
        checkState(size <= Integer.MAX_VALUE / 4, "Cannot grow beyond %d entries", Integer.MAX_VALUE / 4);
        return (int) size;
    }
}
