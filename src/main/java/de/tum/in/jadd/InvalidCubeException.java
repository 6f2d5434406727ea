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
 * Thrown when an abstraction or representative operation is given a second operand which is not
 * a positive cube, i.e. a conjunction of un-negated variables.
 */
public class InvalidCubeException extends IllegalArgumentException {
    private static final long serialVersionUID = 2316052370271185476L;

    private final int node;

    public InvalidCubeException(int node) {
        super(String.format("Node %d is not a positive cube", node));
        this.node = node;
    }

    public int node() {
        return node;
    }
}
