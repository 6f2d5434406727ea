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

import static de.tum.in.jadd.Util.checkArgument;
import static de.tum.in.jadd.Util.min;

import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.function.IntConsumer;
import java.util.function.IntPredicate;
import java.util.function.IntSupplier;
import java.util.function.IntUnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/* Implementation notes:
 * - All recursive operations share the same shape: terminal cases, cache lookup, recursion on the
 *   cofactors with respect to the topmost variable (by level, not by number), node creation, cache
 *   put. Intermediate results live on the work stack.
 * - Public entry points run through runOperation, which restarts the whole computation if the
 *   order changed underneath it. Recursive methods never call public entry points.
 * - There are no complement edges, negation is an explicit, cached operation.
 */
@SuppressWarnings({
    "PMD.AvoidReassigningParameters",
    "PMD.TooManyFields",
    "PMD.GodClass",
    "AssignmentToMethodParameter",
})
final class AddImpl extends NodeTable implements Add {
    private static final Logger logger = Logger.getLogger(AddImpl.class.getName());

    private static final int ZERO_NODE = -1;
    private static final int ONE_NODE = -2;

    private final AddConfiguration configuration;
    private final AddCache cache;
    private int[] variableNodes;

    /* Low and high successors of each node */
    private int[] tree;

    /* Value of each leaf, leaf -(i + 1) is stored at index i. Leaves are never collected. */
    private double[] leafValues;
    private int leafCount;
    private final Map<Long, Integer> leafByValue = new HashMap<>();

    private int hashLookupLow = NOT_A_NODE;
    private int hashLookupHigh = NOT_A_NODE;

    @Nullable
    private ReorderingStrategy reorderingStrategy = null;

    @Nullable
    private BooleanSupplier abortCheck = null;

    private int stepsUntilAbortCheck;
    private long restartCount = 0;

    AddImpl(AddConfiguration configuration) {
        super(
                configuration.initialSize(),
                configuration.useGarbageCollection() ? configuration.minimumFreeNodePercentageAfterGc() : 1.0,
                configuration.growthFactor(),
                configuration.maximumNodeCount());
        this.configuration = configuration;
        this.stepsUntilAbortCheck = configuration.abortCheckInterval();

        tree = new int[2 * tableSize()];
        cache = new AddCache(this, configuration);
        variableNodes = new int[32];

        leafValues = new double[16];
        leafCount = 0;
        int zero = leaf(0.0d);
        int one = leaf(1.0d);
        assert zero == ZERO_NODE && one == ONE_NODE;
    }

    // Nodes

    @Override
    protected boolean checkLookupChildrenMatch(int lookup) {
        int[] tree = this.tree;
        return tree[lookup * 2] == hashLookupLow && tree[lookup * 2 + 1] == hashLookupHigh;
    }

    private int buildNode(int variable, int low, int high) {
        assert 0 <= variable && variable < numberOfVariables();
        assert levelOfVariable(variable) < levelOf(low) && levelOfVariable(variable) < levelOf(high)
                : "Variable " + variable + " not above children " + low + ", " + high;

        if (low == high) {
            return low;
        }

        hashLookupLow = low;
        hashLookupHigh = high;
        int freeNode = findOrCreateNode(variable, hashCode(variable, low, high));

        this.tree[2 * freeNode] = low;
        this.tree[2 * freeNode + 1] = high;
        assert hashCode(variable, low, high) == hashCode(freeNode, variable);
        return freeNode;
    }

    @Override
    public int makeNode(int variable, int low, int high) {
        assert isWorkStackEmpty();
        checkVariable(variable);
        checkNode(low);
        checkNode(high);
        return runOperation(
                "makeNode",
                () -> {
                    // The order may have changed during a previous attempt
                    int level = levelOfVariable(variable);
                    checkArgument(
                            level < levelOf(low) && level < levelOf(high),
                            "Variable %d is not above the children %d and %d",
                            variable,
                            low,
                            high);
                    return buildNode(variable, low, high);
                },
                low,
                high);
    }

    @Override
    public int low(int node) {
        assert isNodeValid(node);
        return tree[2 * node];
    }

    @Override
    public int high(int node) {
        assert isNodeValid(node);
        return tree[2 * node + 1];
    }

    @Override
    public boolean isLeaf(int node) {
        assert node < tableSize();
        return node < 0;
    }

    private void checkNode(int node) {
        checkArgument(isNodeValidOrLeaf(node) && (!isLeaf(node) || -node <= leafCount), "Invalid node %d", node);
    }

    private void checkVariable(int variable) {
        checkArgument(
                0 <= variable && variable < numberOfVariables(),
                "Variable %d out of range [0, %d)",
                variable,
                numberOfVariables());
    }

    // Leaves

    @Override
    public int zero() {
        return ZERO_NODE;
    }

    @Override
    public int one() {
        return ONE_NODE;
    }

    @Override
    public int constant(double value) {
        checkArgument(!Double.isNaN(value), "NaN is not a valid leaf value");
        return leaf(value);
    }

    @Override
    public double value(int leaf) {
        assert isLeaf(leaf) && -leaf <= leafCount : "Not a leaf " + leaf;
        return leafValues[-leaf - 1];
    }

    private int leaf(double value) {
        assert !Double.isNaN(value);
        // Maps -0.0 to 0.0
        double normalized = value == 0.0d ? 0.0d : value;
        Long key = Double.doubleToLongBits(normalized);
        Integer existing = leafByValue.get(key);
        if (existing != null) {
            return existing;
        }
        if (leafCount == leafValues.length) {
            leafValues = Arrays.copyOf(leafValues, leafValues.length * 2);
        }
        leafValues[leafCount] = normalized;
        leafCount += 1;
        int leaf = -leafCount;
        leafByValue.put(key, leaf);
        return leaf;
    }

    private int resultLeaf(BinaryOperation operation, int leaf1, int leaf2) {
        double value = operation.apply(value(leaf1), value(leaf2));
        if (Double.isNaN(value)) {
            throw new ArithmeticException(String.format(
                    "%s of %s and %s is not a number", operation, value(leaf1), value(leaf2)));
        }
        return leaf(value);
    }

    // Variables

    @Override
    public int variableNode(int variable) {
        checkVariable(variable);
        return variableNodes[variable];
    }

    @Override
    public int createVariable() {
        assert isWorkStackEmpty();
        int variable = appendVariable();
        if (variable == variableNodes.length) {
            variableNodes = Arrays.copyOf(variableNodes, variableNodes.length * 2);
        }
        int variableNode = saturateNode(runOperation("createVariable", () -> buildNode(variable, ZERO_NODE, ONE_NODE)));
        variableNodes[variable] = variableNode;
        return variableNode;
    }

    @Override
    public int cube(int... variables) {
        assert isWorkStackEmpty();
        for (int variable : variables) {
            checkVariable(variable);
        }
        return runOperation("cube", () -> {
            int[] levels = new int[variables.length];
            for (int i = 0; i < variables.length; i++) {
                levels[i] = levelOfVariable(variables[i]);
            }
            Arrays.sort(levels);

            int result = ONE_NODE;
            for (int i = levels.length - 1; i >= 0; i--) {
                if (i < levels.length - 1 && levels[i] == levels[i + 1]) {
                    continue;
                }
                result = pushToWorkStack(buildNode(variableAtLevel(levels[i]), ZERO_NODE, result));
            }
            return result;
        });
    }

    @Override
    public boolean isCube(int node) {
        assert isNodeValidOrLeaf(node);
        int current = node;
        while (!isLeaf(current)) {
            if (low(current) != ZERO_NODE) {
                return false;
            }
            current = high(current);
        }
        return current == ONE_NODE;
    }

    private void checkCube(int cube) {
        if (!isNodeValidOrLeaf(cube) || !isCube(cube)) {
            throw new InvalidCubeException(cube);
        }
    }

    @Override
    public double evaluate(int node, BitSet assignment) {
        assert isNodeValidOrLeaf(node);
        int current = node;
        while (!isLeaf(current)) {
            current = assignment.get(variableOf(current)) ? high(current) : low(current);
        }
        return value(current);
    }

    // Operation driver

    /**
     * Runs the given operation, restarting it from scratch whenever the variable order changes while
     * it runs. The {@code operands} are protected on the work stack during each attempt; all
     * intermediate results are released on every exit path.
     */
    private int runOperation(String name, IntSupplier operation, int... operands) {
        int height = workStackHeight();
        int restarts = 0;
        while (true) {
            try {
                pushToWorkStack(operands);
                stepsUntilAbortCheck = configuration.abortCheckInterval();
                return operation.getAsInt();
            } catch (ReorderedException e) {
                restarts += 1;
                restartCount += 1;
                logger.log(Level.FINE, "Restarting {0} after reordering, attempt {1}", new Object[] {name, restarts});
                if (restarts > configuration.maximumRestarts()) {
                    throw new OperationAbortedException(
                            String.format("%s was restarted %d times due to reordering", name, restarts - 1));
                }
            } finally {
                truncateWorkStack(height);
            }
        }
    }

    private void checkAbort() {
        BooleanSupplier abortCheck = this.abortCheck;
        if (abortCheck == null) {
            return;
        }
        stepsUntilAbortCheck -= 1;
        if (stepsUntilAbortCheck <= 0) {
            stepsUntilAbortCheck = configuration.abortCheckInterval();
            if (abortCheck.getAsBoolean()) {
                logger.log(Level.FINE, "Operation aborted by abort check");
                throw new OperationAbortedException("Aborted by abort check");
            }
        }
    }

    @Override
    public void setAbortCheck(@Nullable BooleanSupplier shouldAbort) {
        this.abortCheck = shouldAbort;
    }

    private int lowAtLevel(int node, int level) {
        return levelOf(node) == level ? low(node) : node;
    }

    private int highAtLevel(int node, int level) {
        return levelOf(node) == level ? high(node) : node;
    }

    // Apply

    @Override
    public int apply(BinaryOperation operation, int node1, int node2) {
        assert isWorkStackEmpty();
        checkNode(node1);
        checkNode(node2);
        return runOperation(operation.name(), () -> applyRecursive(operation, node1, node2), node1, node2);
    }

    private int applyRecursive(BinaryOperation operation, int node1, int node2) {
        int terminal = applyTerminal(operation, node1, node2);
        if (terminal != NOT_A_NODE) {
            return terminal;
        }
        if (operation.isCommutative() && node2 < node1) {
            int nodeSwap = node1;
            node1 = node2;
            node2 = nodeSwap;
        }

        checkAbort();
        if (cache.lookupApply(operation, node1, node2)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();

        int level = Math.min(levelOf(node1), levelOf(node2));
        int lowNode = pushToWorkStack(applyRecursive(operation, lowAtLevel(node1, level), lowAtLevel(node2, level)));
        int highNode =
                pushToWorkStack(applyRecursive(operation, highAtLevel(node1, level), highAtLevel(node2, level)));
        int resultNode = buildNode(variableAtLevel(level), lowNode, highNode);
        popWorkStack(2);
        cache.putApply(operation, hash, node1, node2, resultNode);
        return resultNode;
    }

    /* Returns the result if it can be determined without recursion, NOT_A_NODE otherwise. The
     * shortcuts must agree with the pointwise semantics for arbitrary leaves. */
    @SuppressWarnings("PMD.CyclomaticComplexity")
    private int applyTerminal(BinaryOperation operation, int node1, int node2) {
        if (isLeaf(node1) && isLeaf(node2)) {
            return resultLeaf(operation, node1, node2);
        }
        switch (operation) {
            case PLUS:
                if (node1 == ZERO_NODE) {
                    return node2;
                }
                if (node2 == ZERO_NODE) {
                    return node1;
                }
                break;
            case MINUS:
                if (node2 == ZERO_NODE) {
                    return node1;
                }
                if (node1 == node2) {
                    return ZERO_NODE;
                }
                break;
            case TIMES:
                if (node1 == ZERO_NODE || node2 == ZERO_NODE) {
                    return ZERO_NODE;
                }
                if (node1 == ONE_NODE) {
                    return node2;
                }
                if (node2 == ONE_NODE) {
                    return node1;
                }
                break;
            case DIVIDE:
                if (node2 == ONE_NODE) {
                    return node1;
                }
                break;
            case MINIMUM:
            case MAXIMUM:
                if (node1 == node2) {
                    return node1;
                }
                break;
            case MINIMUM_EXCEPT_ZERO:
                if (node1 == ZERO_NODE || node1 == node2) {
                    return node2;
                }
                if (node2 == ZERO_NODE) {
                    return node1;
                }
                break;
            case OR:
                if (node1 == ONE_NODE || node2 == ONE_NODE) {
                    return ONE_NODE;
                }
                break;
            case AND:
                if (node1 == ZERO_NODE || node2 == ZERO_NODE) {
                    return ZERO_NODE;
                }
                break;
            case LESS_OR_EQUAL:
            case GREATER_OR_EQUAL:
            case EQUAL:
                if (node1 == node2) {
                    return ONE_NODE;
                }
                break;
            case LESS_THAN:
            case GREATER_THAN:
            case NOT_EQUAL:
                if (node1 == node2) {
                    return ZERO_NODE;
                }
                break;
            default:
                throw new AssertionError(operation);
        }
        return NOT_A_NODE;
    }

    @Override
    public int not(int node) {
        assert isWorkStackEmpty();
        checkNode(node);
        return runOperation("not", () -> notRecursive(node), node);
    }

    private int notRecursive(int node) {
        if (isLeaf(node)) {
            return value(node) == 0.0d ? ONE_NODE : ZERO_NODE;
        }

        checkAbort();
        if (cache.lookupNot(node)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();
        int lowNode = pushToWorkStack(notRecursive(low(node)));
        int highNode = pushToWorkStack(notRecursive(high(node)));
        int resultNode = buildNode(variableOf(node), lowNode, highNode);
        popWorkStack(2);
        cache.putNot(hash, node, resultNode);
        return resultNode;
    }

    @Override
    public int ifThenElse(int ifNode, int thenNode, int elseNode) {
        assert isWorkStackEmpty();
        checkNode(ifNode);
        checkNode(thenNode);
        checkNode(elseNode);
        return runOperation(
                "ifThenElse",
                () -> ifThenElseRecursive(ifNode, thenNode, elseNode),
                ifNode,
                thenNode,
                elseNode);
    }

    private int ifThenElseRecursive(int ifNode, int thenNode, int elseNode) {
        if (isLeaf(ifNode)) {
            return value(ifNode) == 0.0d ? elseNode : thenNode;
        }
        if (thenNode == elseNode) {
            return thenNode;
        }
        if (thenNode == ONE_NODE && elseNode == ZERO_NODE) {
            // Only an identity if the condition is 0/1 valued, otherwise normalize below
            int ifLow = low(ifNode);
            int ifHigh = high(ifNode);
            if ((ifLow == ZERO_NODE || ifLow == ONE_NODE) && (ifHigh == ZERO_NODE || ifHigh == ONE_NODE)) {
                return ifNode;
            }
        }

        checkAbort();
        if (cache.lookupIfThenElse(ifNode, thenNode, elseNode)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();

        int level = min(levelOf(ifNode), levelOf(thenNode), levelOf(elseNode));
        int lowNode = pushToWorkStack(ifThenElseRecursive(
                lowAtLevel(ifNode, level), lowAtLevel(thenNode, level), lowAtLevel(elseNode, level)));
        int highNode = pushToWorkStack(ifThenElseRecursive(
                highAtLevel(ifNode, level), highAtLevel(thenNode, level), highAtLevel(elseNode, level)));
        int resultNode = buildNode(variableAtLevel(level), lowNode, highNode);
        popWorkStack(2);
        cache.putIfThenElse(hash, ifNode, thenNode, elseNode, resultNode);
        return resultNode;
    }

    // Abstraction

    @Override
    public int abstractCube(Abstraction abstraction, int node, int cube) {
        assert isWorkStackEmpty();
        checkNode(node);
        checkCube(cube);
        return runOperation(abstraction.name(), () -> abstractRecursive(abstraction, node, cube), node, cube);
    }

    private static boolean isAbstractionFixpoint(Abstraction abstraction, int node) {
        switch (abstraction) {
            case EXISTS:
                return node == ZERO_NODE;
            case FORALL:
                return node == ZERO_NODE || node == ONE_NODE;
            case OR:
            case MINIMUM:
            case MINIMUM_EXCEPT_ZERO:
            case MAXIMUM:
                // Idempotent combinations leave every constant unchanged
                return node < 0;
            default:
                throw new AssertionError(abstraction);
        }
    }

    private int abstractRecursive(Abstraction abstraction, int node, int cube) {
        if (cube == ONE_NODE || isAbstractionFixpoint(abstraction, node)) {
            return node;
        }

        int nodeLevel = levelOf(node);
        int cubeLevel = levelOf(cube);
        if (cubeLevel < nodeLevel) {
            // The function does not depend on this cube variable
            int result = abstractRecursive(abstraction, node, high(cube));
            if (!abstraction.foldsMissingVariable()) {
                return result;
            }
            pushToWorkStack(result);
            int folded = applyRecursive(abstraction.combine(), result, result);
            popWorkStack();
            return folded;
        }

        checkAbort();
        if (cache.lookupAbstraction(abstraction, node, cube)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();

        int resultNode;
        if (nodeLevel == cubeLevel) {
            int remainingCube = high(cube);
            int highNode = pushToWorkStack(abstractRecursive(abstraction, high(node), remainingCube));
            if (abstraction == Abstraction.OR && highNode == ONE_NODE) {
                resultNode = ONE_NODE;
                popWorkStack();
            } else {
                int lowNode = pushToWorkStack(abstractRecursive(abstraction, low(node), remainingCube));
                resultNode = applyRecursive(abstraction.combine(), lowNode, highNode);
                popWorkStack(2);
            }
        } else {
            int lowNode = pushToWorkStack(abstractRecursive(abstraction, low(node), cube));
            int highNode = pushToWorkStack(abstractRecursive(abstraction, high(node), cube));
            resultNode = buildNode(variableOf(node), lowNode, highNode);
            popWorkStack(2);
        }
        cache.putAbstraction(abstraction, hash, node, cube, resultNode);
        return resultNode;
    }

    @Override
    public int minRepresentative(int node, int cube) {
        return representative(true, node, cube);
    }

    @Override
    public int maxRepresentative(int node, int cube) {
        return representative(false, node, cube);
    }

    private int representative(boolean minimum, int node, int cube) {
        assert isWorkStackEmpty();
        checkNode(node);
        checkCube(cube);
        return runOperation(
                minimum ? "minRepresentative" : "maxRepresentative",
                () -> representativeRecursive(minimum, node, cube),
                node,
                cube);
    }

    private int representativeRecursive(boolean minimum, int node, int cube) {
        if (cube == ONE_NODE) {
            return ONE_NODE;
        }

        int nodeLevel = levelOf(node);
        int cubeLevel = levelOf(cube);
        if (cubeLevel < nodeLevel) {
            // Any value of the cube variable is optimal, choose false
            int witness = pushToWorkStack(representativeRecursive(minimum, node, high(cube)));
            int resultNode = buildNode(variableOf(cube), witness, ZERO_NODE);
            popWorkStack();
            return resultNode;
        }

        checkAbort();
        if (cache.lookupRepresentative(minimum, node, cube)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();

        int resultNode;
        if (nodeLevel == cubeLevel) {
            Abstraction extremum = minimum ? Abstraction.MINIMUM : Abstraction.MAXIMUM;
            BinaryOperation prefersLow = minimum ? BinaryOperation.LESS_OR_EQUAL : BinaryOperation.GREATER_OR_EQUAL;
            int remainingCube = high(cube);

            int lowWitness = pushToWorkStack(representativeRecursive(minimum, low(node), remainingCube));
            int highWitness = pushToWorkStack(representativeRecursive(minimum, high(node), remainingCube));
            int lowValue = pushToWorkStack(abstractRecursive(extremum, low(node), remainingCube));
            int highValue = pushToWorkStack(abstractRecursive(extremum, high(node), remainingCube));
            // On ties the low branch wins
            int chooseLow = pushToWorkStack(applyRecursive(prefersLow, lowValue, highValue));
            int chooseHigh = pushToWorkStack(notRecursive(chooseLow));
            int lowChoice = pushToWorkStack(ifThenElseRecursive(chooseLow, lowWitness, ZERO_NODE));
            int highChoice = pushToWorkStack(ifThenElseRecursive(chooseHigh, highWitness, ZERO_NODE));
            resultNode = buildNode(variableOf(node), lowChoice, highChoice);
            popWorkStack(8);
        } else {
            int lowWitness = pushToWorkStack(representativeRecursive(minimum, low(node), cube));
            int highWitness = pushToWorkStack(representativeRecursive(minimum, high(node), cube));
            resultNode = buildNode(variableOf(node), lowWitness, highWitness);
            popWorkStack(2);
        }
        cache.putRepresentative(minimum, hash, node, cube, resultNode);
        return resultNode;
    }

    // Reordering

    @Override
    public void reorder(int[] levelToVariable) {
        assert isWorkStackEmpty();
        checkOrder(levelToVariable);
        if (!applyOrder(levelToVariable, 0)) {
            throw new NodeAllocationException(tableSize());
        }
    }

    @Override
    public void setReorderingStrategy(@Nullable ReorderingStrategy strategy) {
        this.reorderingStrategy = strategy;
    }

    private void checkOrder(int[] levelToVariable) {
        checkArgument(
                levelToVariable.length == numberOfVariables(),
                "Order of length %d for %d variables",
                levelToVariable.length,
                numberOfVariables());
        BitSet seen = new BitSet(numberOfVariables());
        for (int variable : levelToVariable) {
            checkVariable(variable);
            checkArgument(!seen.get(variable), "Variable %d appears twice in order", variable);
            seen.set(variable);
        }
    }

    /* Moves each variable to its target level from the top down by adjacent swaps. Stops before a
     * swap which could leave at most reserve free nodes; the order then is consistent but only partially
     * applied. Returns whether the order was applied completely. */
    private boolean applyOrder(int[] levelToVariable, int reserve) {
        beginReordering();
        boolean changed = false;
        boolean complete = true;
        try {
            for (int level = 0; complete && level < levelToVariable.length; level++) {
                int currentLevel = levelOfVariable(levelToVariable[level]);
                while (currentLevel > level) {
                    if (!swapAdjacentLevels(currentLevel - 1, reserve)) {
                        complete = false;
                        break;
                    }
                    currentLevel -= 1;
                    changed = true;
                }
            }
        } finally {
            finishReordering(changed);
            if (changed) {
                cache.invalidate();
            }
        }
        assert check();
        if (complete) {
            logger.log(Level.FINE, "Reordered {0}, changed: {1}", new Object[] {this, changed});
        } else {
            logger.log(Level.FINE, "Stopped reordering {0} early, not enough free nodes", this);
        }
        return complete;
    }

    /* Swaps the variables at level and level + 1. Every node of the upper variable depending on the
     * lower one is rewritten in place to test the lower variable first, so it keeps its handle and
     * its function. Nodes of the lower variable are untouched; they may become unreachable. */
    private boolean swapAdjacentLevels(int level, int reserve) {
        int upper = variableAtLevel(level);
        int lower = variableAtLevel(level + 1);
        int[] candidates = nodesOfVariable(upper);
        // Each rewrite creates at most two nodes, none of which may trigger a collection
        if (!tryReserveFreeNodes(2 * candidates.length + 1 + reserve)) {
            return false;
        }
        swapLevelsInOrder(level);

        int rewritten = 0;
        for (int node : candidates) {
            int low = tree[2 * node];
            int high = tree[2 * node + 1];
            boolean lowSplits = !isLeaf(low) && variableOf(low) == lower;
            boolean highSplits = !isLeaf(high) && variableOf(high) == lower;
            if (!lowSplits && !highSplits) {
                continue;
            }
            // f<upper><lower>
            int f00 = lowSplits ? low(low) : low;
            int f01 = lowSplits ? high(low) : low;
            int f10 = highSplits ? low(high) : high;
            int f11 = highSplits ? high(high) : high;

            int newLow = buildNode(upper, f00, f10);
            int newHigh = buildNode(upper, f01, f11);
            assert newLow != newHigh;
            setVariableInPlace(node, lower);
            tree[2 * node] = newLow;
            tree[2 * node + 1] = newHigh;
            rewritten += 1;
        }
        rehash();
        increaseApproximateDeadNodeCount(rewritten);
        return true;
    }

    // Memory management

    @Override
    public void invalidateCache() {
        cache.invalidate();
    }

    @Override
    protected void onGarbageCollection() {
        cache.invalidate();
    }

    @Override
    protected void afterGarbageCollection() {
        ReorderingStrategy strategy = this.reorderingStrategy;
        if (strategy == null || isReordering()) {
            return;
        }
        int[] order = strategy.proposeOrder(this);
        if (order == null) {
            return;
        }
        checkOrder(order);
        logger.log(Level.FINE, "Reordering {0} after garbage collection", this);
        // The interrupted operation needs room to continue after the reordering
        applyOrder(order, freeNodesGuaranteedByGc());
    }

    @Override
    protected void onTableResize(int newSize) {
        tree = Arrays.copyOf(tree, newSize * 2);
    }

    @Override
    protected int hashCode(int node, int variable) {
        return hashCode(variable, tree[2 * node], tree[2 * node + 1]);
    }

    private static int hashCode(int variable, int low, int high) {
        return HashUtil.hash(variable, low, high);
    }

    @Override
    protected void forEachChild(int node, IntConsumer action) {
        action.accept(tree[2 * node]);
        action.accept(tree[2 * node + 1]);
    }

    @Override
    protected int sumEachBelow(int node, IntUnaryOperator operator) {
        return operator.applyAsInt(tree[2 * node]) + operator.applyAsInt(tree[2 * node + 1]);
    }

    @Override
    protected boolean allMatchBelow(int node, IntPredicate predicate) {
        return predicate.test(tree[2 * node]) && predicate.test(tree[2 * node + 1]);
    }

    @Override
    protected Node node(int node) {
        return new BinaryNode(variableOf(node), tree[2 * node], tree[2 * node + 1]);
    }

    @Override
    public String toString() {
        return String.format("ADD@%d(%d)", tableSize(), System.identityHashCode(this));
    }

    @Override
    public String statistics() {
        return getStatistics()
                + String.format("%n%d leaves, %d restarts%n", leafCount, restartCount)
                + cache.getStatistics();
    }

    private static final class BinaryNode implements NodeTable.Node {
        final int var;
        final int low;
        final int high;

        BinaryNode(int var, int low, int high) {
            this.var = var;
            this.low = low;
            this.high = high;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof BinaryNode)) {
                return false;
            }
            BinaryNode node = (BinaryNode) o;
            return var == node.var && low == node.low && high == node.high;
        }

        @Override
        public int hashCode() {
            return HashUtil.hash(var, low, high);
        }

        @Override
        public String toString() {
            return String.format("%d: %s", var, childrenString());
        }

        @Override
        public String childrenString() {
            return String.format("%5d %5d", low, high);
        }
    }
}
