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

/**
 * Thrown when a new node is required but the node table neither can free enough nodes by garbage
 * collection nor grow any further. The table is left consistent and no partial node is inserted.
 */
public class NodeAllocationException extends RuntimeException {
    private static final long serialVersionUID = -6102738495132404867L;

    private final int tableSize;

    public NodeAllocationException(int tableSize) {
        super(String.format("Node table exhausted at %d nodes", tableSize));
        this.tableSize = tableSize;
    }

    public int tableSize() {
        return tableSize;
    }
}
