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

/* Signals that the variable order changed while an operation was running. All intermediate
 * results computed so far refer to the old order, so the operation has to start over. Never
 * leaves the package. */
final class ReorderedException extends RuntimeException {
    private static final long serialVersionUID = -3322475925416716325L;

    static final ReorderedException INSTANCE = new ReorderedException();

    private ReorderedException() {
        super("Variable order changed", null, false, false);
    }
}
