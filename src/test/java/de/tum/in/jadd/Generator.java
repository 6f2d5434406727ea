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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fills a diagram with random, referenced functions whose value tables are known.
 */
@SuppressWarnings("PMD.AvoidInstantiatingObjectsInLoops")
public final class Generator {
    /* Keeps sums and products of abstracted values exactly representable. */
    private static final double MAXIMAL_ABSOLUTE_VALUE = 64.0d;
    private static final double[] LEAF_VALUES = {0.0d, 1.0d, 2.0d, 3.0d, 0.5d, -1.0d};
    private static final Logger logger = Logger.getLogger(Generator.class.getName());

    private Generator() {
        // empty
    }

    public static Info fill(Add add, int seed, int variableCount, int depth, int width, int pairCount) {
        // Generation has to be ordered for the tests to be reproducible
        logger.log(Level.INFO, "Filling ADD: {0}/{1}, {2} pairs", new Object[] {depth, width, pairCount});

        Random random = new Random(seed);
        add.createVariables(variableCount);

        Map<Integer, ValueTable> functions = new LinkedHashMap<>();
        for (double value : LEAF_VALUES) {
            functions.put(add.constant(value), ValueTable.constant(variableCount, value));
        }
        for (int variable = 0; variable < variableCount; variable++) {
            int node = add.variableNode(variable);
            functions.put(node, ValueTable.read(add, node));
        }

        List<Integer> previous = new ArrayList<>(functions.keySet());
        for (int level = 1; level < depth; level++) {
            List<Integer> created = new ArrayList<>();
            int attempts = 0;
            while (created.size() < width && attempts < 10 * width) {
                attempts += 1;
                int left = previous.get(random.nextInt(previous.size()));
                int right = pick(random, functions);
                int node;
                ValueTable table;
                switch (random.nextInt(6)) {
                    case 0:
                        node = add.plus(left, right);
                        table = functions.get(left).apply(BinaryOperation.PLUS, functions.get(right));
                        break;
                    case 1:
                        node = add.minus(left, right);
                        table = functions.get(left).apply(BinaryOperation.MINUS, functions.get(right));
                        break;
                    case 2:
                        node = add.minimum(left, right);
                        table = functions.get(left).apply(BinaryOperation.MINIMUM, functions.get(right));
                        break;
                    case 3:
                        node = add.maximum(left, right);
                        table = functions.get(left).apply(BinaryOperation.MAXIMUM, functions.get(right));
                        break;
                    case 4:
                        int scale = add.constant(LEAF_VALUES[random.nextInt(LEAF_VALUES.length)]);
                        node = add.times(left, scale);
                        table = functions.get(left).apply(BinaryOperation.TIMES, functions.get(scale));
                        break;
                    default:
                        int condition = add.variableNode(random.nextInt(variableCount));
                        node = add.ifThenElse(condition, left, right);
                        table = functions.get(condition).ifThenElse(functions.get(left), functions.get(right));
                        break;
                }
                if (functions.containsKey(node) || !isBounded(add, node)) {
                    continue;
                }
                functions.put(add.reference(node), table);
                created.add(node);
            }
            logger.log(Level.FINEST, "Created {0} functions at depth {1}", new Object[] {created.size(), level});
            if (!created.isEmpty()) {
                previous = created;
            }
        }

        List<DataPoint> points = new ArrayList<>();
        functions.forEach((node, table) -> points.add(new DataPoint(add, node, table)));

        List<BinaryDataPoint> pairs = new ArrayList<>();
        for (int i = 0; i < pairCount; i++) {
            pairs.add(new BinaryDataPoint(
                    points.get(random.nextInt(points.size())), points.get(random.nextInt(points.size()))));
        }
        return new Info(ImmutableList.copyOf(points), ImmutableList.copyOf(pairs));
    }

    private static int pick(Random random, Map<Integer, ValueTable> functions) {
        int index = random.nextInt(functions.size());
        for (int node : functions.keySet()) {
            if (index == 0) {
                return node;
            }
            index -= 1;
        }
        throw new AssertionError();
    }

    private static boolean isBounded(Add add, int node) {
        ValueTable table = ValueTable.read(add, node);
        for (int i = 0; i < 1 << table.variableCount(); i++) {
            if (Math.abs(table.value(i)) > MAXIMAL_ABSOLUTE_VALUE) {
                return false;
            }
        }
        return true;
    }

    public static final class Info {
        final List<DataPoint> dataPoints;
        final List<BinaryDataPoint> binaryDataPoints;

        Info(List<DataPoint> dataPoints, List<BinaryDataPoint> binaryDataPoints) {
            this.dataPoints = dataPoints;
            this.binaryDataPoints = binaryDataPoints;
        }
    }

    public static final class DataPoint {
        final Add add;
        final int node;
        final ValueTable table;

        DataPoint(Add add, int node, ValueTable table) {
            this.add = add;
            this.node = node;
            this.table = table;
        }

        @Override
        public String toString() {
            return String.format("%s: %d %s", add, node, table);
        }
    }

    public static final class BinaryDataPoint {
        final DataPoint left;
        final DataPoint right;

        BinaryDataPoint(DataPoint left, DataPoint right) {
            assert left.add == right.add;
            this.left = left;
            this.right = right;
        }

        Add add() {
            return left.add;
        }

        @Override
        public String toString() {
            return String.format("%s: %d, %d", left.add, left.node, right.node);
        }
    }

    static int[] levelToVariable(Add add) {
        int[] order = new int[add.numberOfVariables()];
        Arrays.setAll(order, add::variableAtLevel);
        return order;
    }
}
