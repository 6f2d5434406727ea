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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.BitSet;
import org.junit.jupiter.api.Test;

/**
 * A collection of tests of concrete situations and error paths.
 */
public class AddRegressionTest {
    private static final AddConfiguration config =
            ImmutableAddConfiguration.builder().build();

    /* f(x0, x1) with f(0,0) = 3, f(0,1) = 5, f(1,0) = 2 and f(1,1) = 2 */
    private static int exampleFunction(Add add) {
        int x0 = add.variableNode(0);
        int x1 = add.variableNode(1);
        int x0False = add.reference(add.makeNode(1, add.constant(3.0d), add.constant(5.0d)));
        int result = add.ifThenElse(x0, add.constant(2.0d), x0False);
        add.dereference(x0False);
        assertThat(add.high(result), is(add.constant(2.0d)));
        assertThat(add.variableOf(add.low(result)), is(add.variableOf(x1)));
        return add.reference(result);
    }

    private static double valueAt(Add add, int node, boolean... assignment) {
        return add.evaluate(node, assignment);
    }

    @Test
    public void testConcreteAbstractions() {
        Add add = AddFactory.buildAdd(config);
        add.createVariables(2);
        int f = exampleFunction(add);
        int cube = add.reference(add.cube(1));

        int exists = add.reference(add.existAbstract(f, cube));
        assertThat(valueAt(add, exists, false, false), is(8.0d));
        assertThat(valueAt(add, exists, true, false), is(4.0d));

        int forall = add.reference(add.univAbstract(f, cube));
        assertThat(valueAt(add, forall, false, false), is(15.0d));
        assertThat(valueAt(add, forall, true, false), is(4.0d));

        int maximum = add.reference(add.maxAbstract(f, cube));
        assertThat(valueAt(add, maximum, false, true), is(5.0d));
        assertThat(valueAt(add, maximum, true, true), is(2.0d));

        int minimum = add.reference(add.minAbstract(f, cube));
        assertThat(valueAt(add, minimum, false, true), is(3.0d));
        assertThat(valueAt(add, minimum, true, true), is(2.0d));

        // None of the results depend on x1
        for (int node : new int[] {exists, forall, maximum, minimum}) {
            assertThat(add.support(node).get(1), is(false));
        }

        add.dereference(f, cube, exists, forall, maximum, minimum);
    }

    @Test
    public void testConcreteRepresentative() {
        Add add = AddFactory.buildAdd(config);
        add.createVariables(2);
        int f = exampleFunction(add);
        int cube = add.reference(add.cube(1));

        // At x0 = 0 the minimum 3 is unique, at x0 = 1 both values tie and x1 = 0 is chosen
        int representative = add.minRepresentative(f, cube);
        assertThat(representative, is(add.not(add.variableNode(1))));

        // The maximum 5 is attained at x1 = 1 for x0 = 0, the tie at x0 = 1 again resolves to x1 = 0
        int maximum = add.reference(add.maxRepresentative(f, cube));
        assertThat(valueAt(add, maximum, false, false), is(0.0d));
        assertThat(valueAt(add, maximum, false, true), is(1.0d));
        assertThat(valueAt(add, maximum, true, false), is(1.0d));
        assertThat(valueAt(add, maximum, true, true), is(0.0d));

        add.dereference(f, cube, maximum);
    }

    @Test
    public void testRepresentativeOfVariableAboveCube() {
        Add add = AddFactory.buildAdd(config);
        add.createVariables(3);
        // f = x0 ? x2 : 1 - x2, so the optimal value of x2 depends on x0
        int x0 = add.variableNode(0);
        int x2 = add.variableNode(2);
        int notX2 = add.reference(add.not(x2));
        int f = add.reference(add.ifThenElse(x0, x2, notX2));
        int cube = add.reference(add.cube(2));

        int minimum = add.reference(add.minRepresentative(f, cube));
        // x0 = 0: f = 1 - x2 is minimal at x2 = 1; x0 = 1: f = x2 is minimal at x2 = 0
        assertThat(minimum, is(add.ifThenElse(x0, notX2, x2)));

        add.dereference(notX2, f, cube, minimum);
    }

    @Test
    public void testRepresentativeOfUnusedCubeVariablesPrefersFalse() {
        Add add = AddFactory.buildAdd(config);
        add.createVariables(3);
        int f = add.reference(add.plus(add.variableNode(1), add.constant(2.0d)));
        int cube = add.reference(add.cube(0, 1, 2));

        int minimum = add.minRepresentative(f, cube);
        BitSet expected = new BitSet();
        assertThat(add.evaluate(minimum, expected), is(1.0d));
        assertThat(add.evaluate(minimum, ValueTable.bitSet(0b010)), is(0.0d));

        int maximum = add.maxRepresentative(f, cube);
        assertThat(add.evaluate(maximum, ValueTable.bitSet(0b010)), is(1.0d));
        assertThat(add.evaluate(maximum, ValueTable.bitSet(0b011)), is(0.0d));

        // Constant functions select the all-false assignment
        int constant = add.minRepresentative(add.constant(7.0d), cube);
        assertThat(add.evaluate(constant, new BitSet()), is(1.0d));
        assertThat(add.existAbstract(constant, cube), is(add.one()));

        add.dereference(f, cube);
    }

    @Test
    public void testMinimumExceptZero() {
        Add add = AddFactory.buildAdd(config);
        add.createVariables(3);
        int x0 = add.variableNode(0);
        int x1 = add.variableNode(1);
        // Value 0 for x0 = 0 and x1 = 0, otherwise 4 - 2 * x0 - x1
        int weighted = add.plus(add.times(x0, add.constant(2.0d)), x1);
        int values = add.reference(add.minus(add.constant(4.0d), weighted));
        int f = add.reference(add.times(values, add.or(x0, x1)));
        int cube = add.reference(add.cube(0, 1));

        assertThat(add.minExceptZeroAbstract(f, cube), is(add.constant(1.0d)));
        assertThat(add.minAbstract(f, cube), is(add.zero()));

        // Below the first abstracted variable the non-zero minimum still has to be used
        int nested = add.reference(add.ifThenElse(add.variableNode(2), f, add.constant(5.0d)));
        int expected = add.reference(add.ifThenElse(add.variableNode(2), add.constant(1.0d), add.constant(5.0d)));
        assertThat(add.minExceptZeroAbstract(nested, cube), is(expected));

        assertThat(add.minExceptZeroAbstract(add.zero(), cube), is(add.zero()));
        add.dereference(values, f, cube, nested, expected);
    }

    @Test
    public void testOrAbstraction() {
        Add add = AddFactory.buildAdd(config);
        add.createVariables(2);
        int and = add.reference(add.and(add.variableNode(0), add.variableNode(1)));
        int cube = add.reference(add.cube(1));
        assertThat(add.orAbstract(and, cube), is(add.variableNode(0)));
        assertThat(add.orAbstract(add.one(), cube), is(add.one()));
        assertThat(add.orAbstract(add.zero(), cube), is(add.zero()));
        add.dereference(and, cube);
    }

    @Test
    public void testCanonicity() {
        Add add = AddFactory.buildAdd(config);
        add.createVariables(3);
        int leaf = add.constant(2.5d);
        assertThat(add.makeNode(0, leaf, leaf), is(leaf));
        assertThat(add.constant(2.5d), is(leaf));
        assertThat(add.constant(-0.0d), is(add.zero()));
        assertThat(add.constant(1.0d), is(add.one()));

        int node = add.reference(add.makeNode(1, add.zero(), leaf));
        assertThat(add.makeNode(1, add.zero(), leaf), is(node));
        assertThat(add.times(add.variableNode(1), leaf), is(node));
        assertThat(add.low(node), is(add.zero()));
        assertThat(add.high(node), is(leaf));
        assertThat(add.value(add.high(node)), is(2.5d));

        // Equal functions built in different ways share their handle
        int sum = add.reference(add.plus(add.variableNode(0), add.variableNode(2)));
        int other = add.minus(add.plus(add.plus(add.variableNode(2), add.variableNode(0)), leaf), leaf);
        assertThat(other, is(sum));
        add.dereference(node, sum);
    }

    @Test
    public void testCube() {
        Add add = AddFactory.buildAdd(config);
        add.createVariables(4);
        int cube = add.cube(3, 1, 1);
        BitSet variables = new BitSet();
        variables.set(1);
        variables.set(3);
        assertThat(add.cube(variables), is(cube));
        assertThat(add.isCube(cube), is(true));
        assertThat(add.support(cube), is(variables));
        assertThat(add.cube(), is(add.one()));
        assertThat(add.isCube(add.one()), is(true));
        assertThat(add.isCube(add.zero()), is(false));
        assertThat(add.isCube(add.not(add.variableNode(0))), is(false));
        assertThat(add.isCube(add.times(add.variableNode(0), add.constant(2.0d))), is(false));
    }

    @Test
    public void testSupportAccumulates() {
        Add add = AddFactory.buildAdd(config);
        add.createVariables(4);
        int f = add.reference(add.plus(add.variableNode(0), add.variableNode(2)));

        BitSet support = new BitSet();
        support.set(1);
        assertThat(add.supportTo(f, support) == support, is(true));
        assertThat(support, is(BitSet.valueOf(new long[] {0b0111})));
        add.supportTo(add.variableNode(3), support);
        assertThat(support, is(BitSet.valueOf(new long[] {0b1111})));

        BitSet filter = BitSet.valueOf(new long[] {0b1100});
        assertThat(add.supportFilteredTo(f, new BitSet(), filter), is(BitSet.valueOf(new long[] {0b0100})));
        assertThat(add.supportFilteredTo(f, new BitSet(), new BitSet()).isEmpty(), is(true));
        assertThat(add.supportTo(add.constant(5.0d), new BitSet()).isEmpty(), is(true));
        add.dereference(f);
    }

    @Test
    public void testInvalidCube() {
        Add add = AddFactory.buildAdd(config);
        add.createVariables(3);
        int f = add.reference(add.plus(add.variableNode(0), add.variableNode(1)));
        int notCube = add.reference(add.or(add.variableNode(1), add.variableNode(2)));

        InvalidCubeException exception =
                assertThrows(InvalidCubeException.class, () -> add.existAbstract(f, notCube));
        assertThat(exception.node(), is(notCube));
        assertThrows(InvalidCubeException.class, () -> add.minAbstract(f, add.zero()));
        assertThrows(InvalidCubeException.class, () -> add.maxRepresentative(f, add.constant(2.0d)));
        assertThrows(InvalidCubeException.class, () -> add.minRepresentative(f, f));

        // The diagram stays usable
        assertThat(add.existAbstract(f, add.cube(2)), is(add.times(f, add.constant(2.0d))));
        add.dereference(f, notCube);
    }

    @Test
    public void testInvalidArguments() {
        Add add = AddFactory.buildAdd(config);
        add.createVariables(2);
        assertThrows(IllegalArgumentException.class, () -> add.constant(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> add.makeNode(2, add.zero(), add.one()));
        assertThrows(IllegalArgumentException.class, () -> add.makeNode(1, add.variableNode(0), add.one()));
        assertThrows(IllegalArgumentException.class, () -> add.variableNode(5));
        assertThrows(IllegalArgumentException.class, () -> add.cube(0, 2));
        assertThrows(ArithmeticException.class, () -> add.divide(add.zero(), add.zero()));
    }

    @Test
    public void testRelationalOperations() {
        Add add = AddFactory.buildAdd(config);
        add.createVariables(2);
        int f = add.reference(add.plus(add.variableNode(0), add.variableNode(1)));
        int g = add.reference(add.constant(1.0d));
        int xor = add.reference(add.apply(BinaryOperation.NOT_EQUAL, add.variableNode(0), add.variableNode(1)));
        assertThat(add.apply(BinaryOperation.EQUAL, f, g), is(xor));
        assertThat(add.apply(BinaryOperation.LESS_THAN, f, f), is(add.zero()));
        assertThat(add.lessOrEqual(f, f), is(add.one()));
        int and = add.reference(add.and(add.variableNode(0), add.variableNode(1)));
        assertThat(add.apply(BinaryOperation.GREATER_THAN, f, add.constant(1.5d)), is(and));
        add.dereference(f, g, xor, and);
    }

    @Test
    public void testReferenceOverflow() {
        AddImpl add = new AddImpl(config);
        int v1 = add.createVariable();
        int v2 = add.createVariable();
        int sum = add.plus(v1, v2);

        for (int i = 0; i < Integer.MAX_VALUE; i++) {
            add.reference(sum);
        }
        assertThat(add.isNodeSaturated(sum), is(true));

        for (int i = 0; i < Integer.MAX_VALUE; i++) {
            add.dereference(sum);
        }
        assertThat(add.isNodeSaturated(sum), is(true));
    }

    @Test
    public void testGarbageCollection() {
        AddImpl add = new AddImpl(config);
        add.createVariables(4);
        int kept = add.reference(add.plus(add.variableNode(0), add.variableNode(3)));
        int dropped = add.reference(add.times(add.variableNode(1), add.constant(3.0d)));
        add.times(add.variableNode(2), add.constant(5.0d));
        int active = add.activeNodeCount();
        int dead = add.reference(add.plus(dropped, add.variableNode(2)));
        add.dereference(dead);
        add.dereference(dropped);

        assertThat(add.forceGc() > 0, is(true));
        assertThat(add.activeNodeCount() < active, is(true));
        assertThat(add.isNodeValid(kept), is(true));
        assertThat(add.referenceCount(kept), is(1));
        assertThat(add.evaluate(kept, ValueTable.bitSet(0b1001)), is(2.0d));
        assertThat(add.plus(add.variableNode(0), add.variableNode(3)), is(kept));
        assertThat(add.check(), is(true));
        add.dereference(kept);
    }

    @Test
    public void testReferenceGuard() {
        AddImpl add = new AddImpl(config);
        add.createVariables(2);
        int node;
        try (DecisionDiagram.ReferenceGuard guard =
                new DecisionDiagram.ReferenceGuard(add.plus(add.variableNode(0), add.variableNode(1)), add)) {
            node = guard.node;
            assertThat(add.referenceCount(node), is(1));
        }
        assertThat(add.referenceCount(node), is(0));
        assertThat(add.referencedNodeCount(), is(add.numberOfVariables()));
    }

    @Test
    public void testConsume() {
        AddImpl add = new AddImpl(config);
        add.createVariables(3);
        int left = add.reference(add.plus(add.variableNode(0), add.variableNode(1)));
        int right = add.reference(add.plus(add.variableNode(1), add.variableNode(2)));
        int result = add.consume(add.times(left, right), left, right);
        assertThat(add.referenceCount(result), is(1));
        assertThat(add.referenceCount(left), is(0));
        assertThat(add.referenceCount(right), is(0));
        add.dereference(result);
    }

    @Test
    public void testAbortCheck() {
        AddConfiguration abortConfig =
                ImmutableAddConfiguration.builder().abortCheckInterval(1).build();
        AddImpl add = new AddImpl(abortConfig);
        add.createVariables(6);
        int f = add.reference(add.plus(add.variableNode(0), add.variableNode(5)));
        int g = add.reference(add.times(add.variableNode(2), add.constant(3.0d)));
        int cube = add.reference(add.cube(0, 2));

        add.setAbortCheck(() -> true);
        assertThrows(OperationAbortedException.class, () -> add.plus(f, g));
        assertThrows(OperationAbortedException.class, () -> add.existAbstract(f, cube));
        assertThrows(OperationAbortedException.class, () -> add.minRepresentative(g, cube));

        // Nothing is left behind, the diagram continues to work
        add.setAbortCheck(null);
        assertThat(add.isWorkStackEmpty(), is(true));
        assertThat(add.check(), is(true));
        int sum = add.plus(f, g);
        assertThat(add.evaluate(sum, ValueTable.bitSet(0b100101)), is(5.0d));
        add.dereference(f, g, cube);
    }

    @Test
    public void testAllocationFailure() {
        AddConfiguration bounded = ImmutableAddConfiguration.builder()
                .maximumNodeCount(1000)
                .useGarbageCollection(false)
                .build();
        AddImpl add = new AddImpl(bounded);
        add.createVariables(4);
        int tableSize = add.tableSize();

        NodeAllocationException exception = assertThrows(NodeAllocationException.class, () -> {
            for (int i = 0; ; i++) {
                add.reference(add.times(add.variableNode(i % 4), add.constant(i + 2.0d)));
            }
        });
        assertThat(exception.tableSize(), is(tableSize));
        assertThat(add.tableSize(), is(tableSize));
        assertThat(add.isWorkStackEmpty(), is(true));
        assertThat(add.check(), is(true));
    }

    @Test
    public void testAllocationRecoversAfterCollection() {
        AddConfiguration bounded =
                ImmutableAddConfiguration.builder().maximumNodeCount(1000).build();
        AddImpl add = new AddImpl(bounded);
        add.createVariables(4);
        int tableSize = add.tableSize();

        // Unreferenced results are collected once the table is full
        int previous = add.reference(add.variableNode(0));
        for (int i = 0; i < 5 * tableSize; i++) {
            int next = add.times(add.variableNode(i % 4), add.constant(i + 2.0d));
            previous = add.updateWith(next, previous);
        }
        assertThat(add.tableSize(), is(tableSize));
        assertThat(add.value(add.high(previous)), is(5.0d * tableSize + 1.0d));
        assertThat(add.check(), is(true));
    }

    @Test
    public void testVariableOrder() {
        Add add = AddFactory.buildAdd(config);
        add.createVariables(3);
        for (int variable = 0; variable < 3; variable++) {
            assertThat(add.levelOfVariable(variable), is(variable));
            assertThat(add.variableAtLevel(variable), is(variable));
        }
        assertThat(add.reorderCount(), is(0));
        assertThat(add.statistics(), not(""));
    }
}
