/*
 * This file is part of JADD.
 * Copyright (c) 2024 The JADD Authors.
 *
 * JADD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JADD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JADD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jadd;

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class AddConfiguration {
    public static final int DEFAULT_CACHE_BINARY_DIVIDER = 16;
    public static final int DEFAULT_CACHE_TERNARY_DIVIDER = 64;
    public static final int DEFAULT_CACHE_NEGATION_DIVIDER = 32;
    public static final int DEFAULT_CACHE_ABSTRACTION_DIVIDER = 32;
    public static final double DEFAULT_NODE_TABLE_FREE_NODE_PERCENTAGE = 0.10d;
    public static final double DEFAULT_NODE_TABLE_GROWTH_FACTOR = 1.5d;
    public static final int DEFAULT_MAXIMUM_RESTARTS = 32;
    public static final int DEFAULT_ABORT_CHECK_INTERVAL = 1024;

    @Value.Default
    public int cacheBinaryDivider() {
        return DEFAULT_CACHE_BINARY_DIVIDER;
    }

    @Value.Default
    public int cacheTernaryDivider() {
        return DEFAULT_CACHE_TERNARY_DIVIDER;
    }

    @Value.Default
    public int cacheNegationDivider() {
        return DEFAULT_CACHE_NEGATION_DIVIDER;
    }

    @Value.Default
    public int cacheAbstractionDivider() {
        return DEFAULT_CACHE_ABSTRACTION_DIVIDER;
    }

    @Value.Default
    public int initialSize() {
        return 1024;
    }

    @Value.Default
    public double growthFactor() {
        return DEFAULT_NODE_TABLE_GROWTH_FACTOR;
    }

    @Value.Default
    public double minimumFreeNodePercentageAfterGc() {
        return DEFAULT_NODE_TABLE_FREE_NODE_PERCENTAGE;
    }

    @Value.Default
    public boolean useGarbageCollection() {
        return true;
    }

    /**
     * Upper bound on the node table size. When it is reached and garbage collection cannot free a
     * node, operations fail with a {@link NodeAllocationException}.
     */
    @Value.Default
    public int maximumNodeCount() {
        return Integer.MAX_VALUE;
    }

    /**
     * How often a single operation may be restarted because the variable order changed while it was
     * running before it gives up with an {@link OperationAbortedException}.
     */
    @Value.Default
    public int maximumRestarts() {
        return DEFAULT_MAXIMUM_RESTARTS;
    }

    /**
     * Number of recursion steps between two polls of the abort check.
     */
    @Value.Default
    public int abortCheckInterval() {
        return DEFAULT_ABORT_CHECK_INTERVAL;
    }

    @Value.Default
    public boolean logStatisticsOnShutdown() {
        return false;
    }

    @Value.Default
    public boolean threadSafetyCheck() {
        return false;
    }

    @Value.Check
    protected void check() {
        Util.checkArgument(initialSize() > 0, "Non-positive initial size %d", initialSize());
        Util.checkArgument(maximumRestarts() >= 0, "Negative restart bound %d", maximumRestarts());
        Util.checkArgument(abortCheckInterval() > 0, "Non-positive abort check interval %d", abortCheckInterval());
        Util.checkArgument(
                cacheBinaryDivider() > 0
                        && cacheTernaryDivider() > 0
                        && cacheNegationDivider() > 0
                        && cacheAbstractionDivider() > 0,
                "Cache dividers have to be positive");
    }
}
