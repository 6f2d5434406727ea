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

import java.util.Random;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.infra.Blackhole;

public class AbstractionBenchmark extends BaseAddBenchmark {
    private static final int VARIABLES = 20;

    /* Random weighted sum of products over adjacent variables, referenced. */
    private static int weightedFunction(Add add, Random random) {
        add.createVariables(VARIABLES);
        int function = add.zero();
        for (int i = 0; i + 1 < VARIABLES; i++) {
            int product = add.times(add.variableNode(i), add.variableNode(i + 1));
            int weighted = add.times(product, add.constant(random.nextInt(16)));
            function = add.updateWith(add.plus(function, weighted), function);
        }
        return function;
    }

    private static int evenCube(Add add) {
        int[] variables = new int[VARIABLES / 2];
        for (int i = 0; i < variables.length; i++) {
            variables[i] = 2 * i;
        }
        return add.reference(add.cube(variables));
    }

    @Benchmark
    public static void sumAbstraction(AddState state, Blackhole bh) {
        Add add = state.add();
        int function = weightedFunction(add, new Random(0L));
        bh.consume(add.existAbstract(function, evenCube(add)));
    }

    @Benchmark
    public static void extremeAbstractions(AddState state, Blackhole bh) {
        Add add = state.add();
        int function = weightedFunction(add, new Random(0L));
        int cube = evenCube(add);
        bh.consume(add.reference(add.minAbstract(function, cube)));
        bh.consume(add.reference(add.maxAbstract(function, cube)));
        bh.consume(add.minExceptZeroAbstract(function, cube));
    }

    @Benchmark
    public static void representatives(AddState state, Blackhole bh) {
        Add add = state.add();
        int function = weightedFunction(add, new Random(0L));
        int cube = evenCube(add);
        bh.consume(add.reference(add.minRepresentative(function, cube)));
        bh.consume(add.maxRepresentative(function, cube));
    }
}
