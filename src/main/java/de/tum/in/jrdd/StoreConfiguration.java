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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class StoreConfiguration {
    public static final int DEFAULT_INITIAL_SIZE = 1024;
    public static final double DEFAULT_GROWTH_FACTOR = 1.5d;

    /**
     * Number of slots allocated up front, including the reserved false anchor.
     */
    @Value.Default
    public int initialSize() {
        return DEFAULT_INITIAL_SIZE;
    }

    @Value.Default
    public double growthFactor() {
        return DEFAULT_GROWTH_FACTOR;
    }

    /**
     * Run the full integrity check after every swap. Expensive, meant for tests and debugging.
     */
    @Value.Default
    public boolean validateStructuralChanges() {
        return false;
    }

    @Value.Default
    public boolean logStatisticsOnShutdown() {
        return false;
    }

    @Value.Check
    protected void check() {
        Util.checkArgument(initialSize() > 1, "Initial size must be at least 2, got %d", initialSize());
        Util.checkArgument(growthFactor() > 1.0, "Growth factor must exceed 1, got %s", growthFactor());
    }
}
