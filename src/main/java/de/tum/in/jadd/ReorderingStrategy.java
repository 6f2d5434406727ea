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

import javax.annotation.Nullable;

/**
 * Decides whether the variable order should change. The strategy is consulted after every
 * successful garbage collection, which may happen in the middle of an operation; the operation is
 * then transparently restarted under the new order. A proposal is applied only as far as the free
 * nodes of the table allow without another collection, so the resulting order may be a prefix of the
 * proposed one.
 */
@FunctionalInterface
public interface ReorderingStrategy {
    /**
     * Proposes a new order.
     *
     * @param diagram The diagram, which must only be queried (not modified) by the strategy.
     * @return The new order as an array mapping each level to a variable, or {@code null} to keep the
     *     current order.
     */
    @Nullable
    int[] proposeOrder(Add diagram);
}
