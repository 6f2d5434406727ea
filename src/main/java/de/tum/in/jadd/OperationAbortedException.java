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
 * Thrown when an operation gave up before producing a result, either because the abort check
 * requested so or because the operation had to be restarted too often.
 *
 * @see Add#setAbortCheck(java.util.function.BooleanSupplier)
 */
public class OperationAbortedException extends RuntimeException {
    private static final long serialVersionUID = 4983366245096147531L;

    public OperationAbortedException(String message) {
        super(message);
    }
}
