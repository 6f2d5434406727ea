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
 * The ways of eliminating variables from a diagram. Abstracting a variable {@code x} from {@code f}
 * yields {@code combine(f[x := 0], f[x := 1])}; abstracting a cube abstracts each of its variables.
 *
 * @see Add#abstractCube(Abstraction, int, int)
 */
public enum Abstraction {
    /** Sums over all assignments. */
    EXISTS(BinaryOperation.PLUS, true),
    /** Multiplies over all assignments. */
    FORALL(BinaryOperation.TIMES, true),
    /** Disjunction over all assignments of a 0/1 diagram. */
    OR(BinaryOperation.OR, false),
    MINIMUM(BinaryOperation.MINIMUM, false),
    /** Minimum over all non-zero values, zero if all values are zero. */
    MINIMUM_EXCEPT_ZERO(BinaryOperation.MINIMUM_EXCEPT_ZERO, false),
    MAXIMUM(BinaryOperation.MAXIMUM, false);

    private final BinaryOperation combine;
    private final boolean foldsMissingVariable;

    Abstraction(BinaryOperation combine, boolean foldsMissingVariable) {
        this.combine = combine;
        this.foldsMissingVariable = foldsMissingVariable;
    }

    /**
     * The operation combining the two cofactors of an abstracted variable.
     */
    public BinaryOperation combine() {
        return combine;
    }

    /**
     * Whether abstracting a variable the function does not depend on changes the function. This is
     * the case for sum ({@code x + x}) and product ({@code x * x}), while the other combinations are
     * idempotent.
     */
    public boolean foldsMissingVariable() {
        return foldsMissingVariable;
    }
}
