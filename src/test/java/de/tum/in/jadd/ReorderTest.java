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
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

public class ReorderTest {
    private static final int variableCount = 6;
    private static final AddConfiguration config =
            ImmutableAddConfiguration.builder().build();

    private static ValueTable randomTable(Random random) {
        double[] values = new double[1 << variableCount];
        for (int i = 0; i < values.length; i++) {
            values[i] = random.nextInt(6);
        }
        return ValueTable.of(variableCount, values);
    }

    private static int[] reversed(Add add) {
        int[] order = Generator.levelToVariable(add);
        int[] reversed = new int[order.length];
        for (int i = 0; i < order.length; i++) {
            reversed[i] = order[order.length - 1 - i];
        }
        return reversed;
    }

    private static BitSet variables(int... variables) {
        BitSet set = new BitSet();
        for (int variable : variables) {
            set.set(variable);
        }
        return set;
    }

    /* Creates unreferenced nodes until only two free nodes remain, so the next operation collects. */
    private static void fillTable(AddImpl add) {
        int dead = add.reference(add.times(add.variableNode(0), add.constant(99.0d)));
        add.dereference(dead);
        int i = 0;
        while (add.freeNodeCount() > 2) {
            add.times(add.variableNode(i % variableCount), add.constant(100.0d + i));
            i += 1;
        }
    }

    @Test
    public void testReorderPreservesFunctions() {
        AddImpl add = new AddImpl(config);
        add.createVariables(variableCount);
        Random random = new Random(0L);

        List<Integer> nodes = new ArrayList<>();
        List<ValueTable> tables = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            ValueTable table = randomTable(random);
            nodes.add(add.reference(table.build(add)));
            tables.add(table);
        }

        List<Integer> order = new ArrayList<>();
        for (int variable = 0; variable < variableCount; variable++) {
            order.add(variable);
        }
        for (int round = 0; round < 10; round++) {
            Collections.shuffle(order, random);
            int[] levelToVariable = order.stream().mapToInt(Integer::intValue).toArray();
            add.reorder(levelToVariable);

            for (int level = 0; level < variableCount; level++) {
                assertThat(add.variableAtLevel(level), is(levelToVariable[level]));
                assertThat(add.levelOfVariable(levelToVariable[level]), is(level));
            }
            assertThat(add.check(), is(true));
            for (int i = 0; i < nodes.size(); i++) {
                int node = nodes.get(i);
                assertThat(ValueTable.read(add, node), is(tables.get(i)));
                // Handles stay canonical in the new order
                assertThat(tables.get(i).build(add), is(node));
            }
        }

        // Operations keep working in the final order
        BitSet cube = variables(1, 3, 4);
        int cubeNode = add.reference(add.cube(cube));
        int result = add.existAbstract(nodes.get(0), cubeNode);
        assertThat(ValueTable.read(add, result), is(tables.get(0).abstractVariables(Abstraction.EXISTS, cube)));
        int representative = add.minRepresentative(nodes.get(1), cubeNode);
        assertThat(
                ValueTable.read(add, representative),
                is(tables.get(1).representative(true, cube, Generator.levelToVariable(add))));
    }

    @Test
    public void testReorderCount() {
        Add add = AddFactory.buildAdd(config);
        add.createVariables(3);
        int node = add.reference(add.plus(add.variableNode(0), add.variableNode(2)));

        add.reorder(new int[] {0, 1, 2});
        assertThat(add.reorderCount(), is(0));

        add.reorder(new int[] {2, 0, 1});
        assertThat(add.reorderCount(), is(1));
        assertThat(add.variableOf(node), is(2));
        assertThat(add.evaluate(node, variables(0, 2)), is(2.0d));

        add.reorder(new int[] {0, 1, 2});
        assertThat(add.reorderCount(), is(2));
        assertThat(add.variableOf(node), is(0));
        add.dereference(node);
    }

    @Test
    public void testInvalidOrder() {
        Add add = AddFactory.buildAdd(config);
        add.createVariables(3);
        assertThrows(IllegalArgumentException.class, () -> add.reorder(new int[] {0, 1}));
        assertThrows(IllegalArgumentException.class, () -> add.reorder(new int[] {0, 1, 1}));
        assertThrows(IllegalArgumentException.class, () -> add.reorder(new int[] {0, 1, 3}));
        assertThat(add.reorderCount(), is(0));
    }

    @Test
    public void testVariablesCreatedAfterReorder() {
        Add add = AddFactory.buildAdd(config);
        add.createVariables(2);
        add.reorder(new int[] {1, 0});
        int variable = add.createVariable();
        assertThat(add.variableOf(variable), is(2));
        assertThat(add.levelOfVariable(2), is(2));
        int cube = add.cube(0, 1, 2);
        assertThat(add.variableOf(cube), is(1));
        assertThat(add.support(cube), is(variables(0, 1, 2)));
    }

    @Test
    public void testReorderDuringOperation() {
        AddImpl add = new AddImpl(config);
        add.createVariables(variableCount);
        ValueTable table = randomTable(new Random(1L));
        int function = add.reference(table.build(add));
        BitSet cube = variables(1, 3, 4);
        int cubeNode = add.reference(add.cube(cube));
        ValueTable expected = table.abstractVariables(Abstraction.EXISTS, cube);

        fillTable(add);
        AtomicInteger calls = new AtomicInteger();
        add.setReorderingStrategy(diagram -> calls.getAndIncrement() == 0 ? reversed(diagram) : null);
        int result = add.reference(add.existAbstract(function, cubeNode));

        assertThat(calls.get() > 0, is(true));
        assertThat(add.reorderCount(), is(1));
        assertThat(add.levelOfVariable(0), is(variableCount - 1));
        assertThat(add.statistics(), containsString("1 restarts"));
        assertThat(ValueTable.read(add, result), is(expected));
        assertThat(expected.build(add), is(result));
        assertThat(ValueTable.read(add, function), is(table));
        assertThat(add.check(), is(true));
    }

    @Test
    public void testRepresentativeDuringReorder() {
        AddImpl add = new AddImpl(config);
        add.createVariables(variableCount);
        ValueTable table = randomTable(new Random(2L));
        int function = add.reference(table.build(add));
        BitSet cube = variables(0, 2, 5);
        int cubeNode = add.reference(add.cube(cube));

        fillTable(add);
        int[] order = {2, 4, 0, 5, 1, 3};
        add.setReorderingStrategy(diagram -> diagram.reorderCount() == 0 ? order : null);
        int result = add.reference(add.maxRepresentative(function, cubeNode));

        assertThat(add.reorderCount(), is(1));
        assertThat(ValueTable.read(add, result), is(table.representative(false, cube, order)));
        assertThat(add.check(), is(true));
    }

    @Test
    public void testRestartLimit() {
        AddConfiguration noRestarts =
                ImmutableAddConfiguration.builder().maximumRestarts(0).build();
        AddImpl add = new AddImpl(noRestarts);
        add.createVariables(variableCount);
        ValueTable table = randomTable(new Random(3L));
        int function = add.reference(table.build(add));
        int cubeNode = add.reference(add.cube(variables(0, 1)));

        fillTable(add);
        add.setReorderingStrategy(ReorderTest::reversed);
        assertThrows(OperationAbortedException.class, () -> add.maxAbstract(function, cubeNode));
        assertThat(add.isWorkStackEmpty(), is(true));
        assertThat(add.check(), is(true));

        add.setReorderingStrategy(null);
        int result = add.maxAbstract(function, cubeNode);
        assertThat(ValueTable.read(add, result), is(table.abstractVariables(Abstraction.MAXIMUM, variables(0, 1))));
    }

    @Test
    public void testStrategyWithoutProposal() {
        AddImpl add = new AddImpl(config);
        add.createVariables(variableCount);
        AtomicInteger calls = new AtomicInteger();
        add.setReorderingStrategy(diagram -> {
            calls.incrementAndGet();
            return null;
        });
        add.forceGc();
        assertThat(calls.get(), is(1));
        assertThat(add.reorderCount(), is(0));
    }

    @Test
    public void testReorderOnCollection() {
        AddImpl add = new AddImpl(config);
        add.createVariables(variableCount);
        int node = add.reference(add.plus(add.variableNode(0), add.variableNode(5)));
        add.setReorderingStrategy(ReorderTest::reversed);
        add.forceGc();
        assertThat(add.reorderCount(), is(1));
        assertThat(add.variableAtLevel(0), is(5));
        assertThat(add.variableOf(node), is(5));
        assertThat(add.evaluate(node, variables(0)), is(1.0d));
        assertThat(add.check(), is(true));
    }

    @Test
    public void testStrategyReorderInBoundedTable() {
        AddConfiguration bounded =
                ImmutableAddConfiguration.builder().maximumNodeCount(1000).build();
        AddImpl add = new AddImpl(bounded);
        add.createVariables(variableCount);
        Random random = new Random(4L);

        List<Integer> nodes = new ArrayList<>();
        List<ValueTable> tables = new ArrayList<>();
        while (add.activeNodeCount() < 600) {
            ValueTable table = randomTable(random);
            nodes.add(add.reference(table.build(add)));
            tables.add(table);
        }
        int tableSize = add.tableSize();

        // The table cannot grow, reorderings have to make do with what a collection frees
        AtomicInteger proposals = new AtomicInteger();
        add.setReorderingStrategy(diagram -> {
            proposals.incrementAndGet();
            return reversed(diagram);
        });
        for (int i = 0; i < 20_000; i++) {
            add.times(nodes.get(i % nodes.size()), add.constant(2.0d + i % 5));
        }

        assertThat(proposals.get() > 0, is(true));
        assertThat(add.tableSize(), is(tableSize));
        assertThat(add.isWorkStackEmpty(), is(true));
        assertThat(add.check(), is(true));
        for (int i = 0; i < nodes.size(); i++) {
            assertThat(ValueTable.read(add, nodes.get(i)), is(tables.get(i)));
        }
        int product = add.times(nodes.get(0), add.constant(3.0d));
        assertThat(
                ValueTable.read(add, product),
                is(tables.get(0).apply(BinaryOperation.TIMES, ValueTable.constant(variableCount, 3.0d))));
    }
}
