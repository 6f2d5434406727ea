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

import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

@State(Scope.Benchmark)
public class AddState {
    @Param({"1"})
    private float cacheSizeFactor;

    private Add add;

    @SuppressWarnings("NumericCastThatLosesPrecision")
    @Setup(Level.Iteration)
    public void setUpAdd() {
        add = AddFactory.buildAdd(ImmutableAddConfiguration.builder()
                .cacheNegationDivider((int) (AddConfiguration.DEFAULT_CACHE_NEGATION_DIVIDER / cacheSizeFactor))
                .cacheBinaryDivider((int) (AddConfiguration.DEFAULT_CACHE_BINARY_DIVIDER / cacheSizeFactor))
                .cacheTernaryDivider((int) (AddConfiguration.DEFAULT_CACHE_TERNARY_DIVIDER / cacheSizeFactor))
                .cacheAbstractionDivider(
                        (int) (AddConfiguration.DEFAULT_CACHE_ABSTRACTION_DIVIDER / cacheSizeFactor))
                .build());
    }

    public Add add() {
        return add;
    }
}
