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

public final class AddFactory {
    private AddFactory() {}

    public static Add buildAdd() {
        return buildAdd(ImmutableAddConfiguration.builder().build());
    }

    public static Add buildAdd(AddConfiguration configuration) {
        AddImpl add = new AddImpl(configuration);
        return configuration.threadSafetyCheck() ? new CheckedAdd(add) : add;
    }

    public static Add buildSynchronizedAdd(AddConfiguration configuration) {
        return SynchronizedAdd.create(new AddImpl(configuration));
    }
}
