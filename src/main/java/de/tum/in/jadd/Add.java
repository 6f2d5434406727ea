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

import java.util.BitSet;
import java.util.function.BooleanSupplier;
import javax.annotation.Nullable;

/**
 * An algebraic decision diagram (multi-terminal BDD) manager. Functions from boolean variables to
 * doubles are represented by int handles. Leaves are canonical per value, with {@link #zero()} and
 * {@link #one()} doubling as boolean false and true.
 *
 * <p>Results of operations are <b>not</b> referenced. A caller which wants to keep a result over
 * subsequent operations has to {@link #reference(int)} it and {@link #dereference(int)} it once it
 * is not needed anymore, otherwise it may be reclaimed during garbage collection. Handles denote the
 * same function for their whole lifetime, also across reorderings.</p>
 *
 * <p>Instances are not thread safe, see {@link SynchronizedAdd}.</p>
 */
@SuppressWarnings("unused")
public interface Add extends DecisionDiagram {
    // Leaves

    int zero();

    int one();

    /**
     * Returns the leaf with the given {@code value}.
     *
     * @throws IllegalArgumentException if {@code value} is NaN.
     */
    int constant(double value);

    /**
     * Returns the value of the given {@code leaf}.
     */
    double value(int leaf);

    // Structure

    /** Returns the child taken when the variable of {@code node} is false. */
    int low(int node);

    /** Returns the child taken when the variable of {@code node} is true. */
    int high(int node);

    /**
     * Returns the canonical node with the given {@code variable} and children. If both children are
     * equal, the child itself is returned.
     *
     * @throws IllegalArgumentException if {@code variable} is not above both children in the
     *     current order.
     */
    int makeNode(int variable, int low, int high);

    /**
     * Creates a new variable, placed at the bottom of the current order.
     *
     * @return The 0/1 projection of the new variable, which is saturated.
     */
    int createVariable();

    default int[] createVariables(int count) {
        int[] variableNodes = new int[count];
        for (int i = 0; i < count; i++) {
            variableNodes[i] = createVariable();
        }
        return variableNodes;
    }

    /**
     * Returns the projection of the given variable, i.e. the diagram which is {@code 1} iff the
     * variable is true and {@code 0} otherwise.
     */
    int variableNode(int variable);

    /**
     * Returns the conjunction of the given variables as 0/1 diagram.
     */
    int cube(int... variables);

    default int cube(BitSet variables) {
        return cube(BitSets.toArray(variables));
    }

    /**
     * Determines whether {@code node} is a positive cube, i.e. a chain of nodes whose low child is
     * {@link #zero()}, ending in {@link #one()}. The constant one is the empty cube.
     */
    boolean isCube(int node);

    double evaluate(int node, BitSet assignment);

    default double evaluate(int node, boolean[] assignment) {
        return evaluate(node, BitSets.of(assignment));
    }

    // Apply

    int apply(BinaryOperation operation, int node1, int node2);

    default int plus(int node1, int node2) {
        return apply(BinaryOperation.PLUS, node1, node2);
    }

    default int minus(int node1, int node2) {
        return apply(BinaryOperation.MINUS, node1, node2);
    }

    default int times(int node1, int node2) {
        return apply(BinaryOperation.TIMES, node1, node2);
    }

    default int divide(int node1, int node2) {
        return apply(BinaryOperation.DIVIDE, node1, node2);
    }

    default int minimum(int node1, int node2) {
        return apply(BinaryOperation.MINIMUM, node1, node2);
    }

    default int maximum(int node1, int node2) {
        return apply(BinaryOperation.MAXIMUM, node1, node2);
    }

    default int or(int node1, int node2) {
        return apply(BinaryOperation.OR, node1, node2);
    }

    default int and(int node1, int node2) {
        return apply(BinaryOperation.AND, node1, node2);
    }

    default int lessOrEqual(int node1, int node2) {
        return apply(BinaryOperation.LESS_OR_EQUAL, node1, node2);
    }

    default int greaterOrEqual(int node1, int node2) {
        return apply(BinaryOperation.GREATER_OR_EQUAL, node1, node2);
    }

    /**
     * Negates the given diagram, interpreting every non-zero value as true. The result is a 0/1
     * diagram.
     */
    int not(int node);

    /**
     * Returns the diagram which equals {@code thenNode} wherever {@code ifNode} is non-zero and
     * {@code elseNode} everywhere else.
     */
    int ifThenElse(int ifNode, int thenNode, int elseNode);

    // Abstraction

    /**
     * Eliminates all variables of the given {@code cube} from {@code node} by combining the values
     * for all their assignments as specified by {@code abstraction}.
     *
     * @throws InvalidCubeException if {@code cube} is not a positive cube.
     */
    int abstractCube(Abstraction abstraction, int node, int cube);

    /**
     * Sums {@code node} over all assignments to the variables in {@code cube}.
     */
    default int existAbstract(int node, int cube) {
        return abstractCube(Abstraction.EXISTS, node, cube);
    }

    /**
     * Multiplies {@code node} over all assignments to the variables in {@code cube}.
     */
    default int univAbstract(int node, int cube) {
        return abstractCube(Abstraction.FORALL, node, cube);
    }

    default int orAbstract(int node, int cube) {
        return abstractCube(Abstraction.OR, node, cube);
    }

    default int minAbstract(int node, int cube) {
        return abstractCube(Abstraction.MINIMUM, node, cube);
    }

    default int minExceptZeroAbstract(int node, int cube) {
        return abstractCube(Abstraction.MINIMUM_EXCEPT_ZERO, node, cube);
    }

    default int maxAbstract(int node, int cube) {
        return abstractCube(Abstraction.MAXIMUM, node, cube);
    }

    /**
     * Computes a 0/1 diagram which, for each assignment of the variables outside of {@code cube},
     * selects exactly one assignment of the cube variables at which {@code node} attains its minimum.
     * Among several minimal assignments, the one which is false at the topmost differing variable is
     * chosen.
     *
     * @throws InvalidCubeException if {@code cube} is not a positive cube.
     */
    int minRepresentative(int node, int cube);

    /**
     * The maximizing counterpart of {@link #minRepresentative(int, int)}.
     */
    int maxRepresentative(int node, int cube);

    // Order

    /**
     * Changes the variable order. All handles keep denoting the same function.
     *
     * @param levelToVariable The new order, listing the variables from top to bottom.
     * @throws IllegalArgumentException if the argument is not a permutation of all variables.
     */
    void reorder(int[] levelToVariable);

    int reorderCount();

    void setReorderingStrategy(@Nullable ReorderingStrategy strategy);

    /**
     * Sets a check which is polled regularly while operations run. Once it returns {@code true}, the
     * running operation fails with an {@link OperationAbortedException}.
     */
    void setAbortCheck(@Nullable BooleanSupplier shouldAbort);

    // Memory

    int forceGc();

    void invalidateCache();

    /**
     * Auxiliary function useful for updating node variables. It dereferences the inputs and
     * references {@code result}. This is useful for assignments like {@code node = f(in1, in2)}
     * where {@code f} is some operation on this diagram and both {@code in1} and {@code in2} are
     * temporary nodes not used anymore.
     *
     * @param result     The result of some operation on this diagram involving {@code inputNode1}
     *                   and {@code inputNode2}
     * @param inputNode1 Node which is de-referenced.
     * @param inputNode2 Node which is de-referenced.
     * @return The given {@code result}.
     */
    default int consume(int result, int inputNode1, int inputNode2) {
        reference(result);
        dereference(inputNode1);
        dereference(inputNode2);
        return result;
    }
}
