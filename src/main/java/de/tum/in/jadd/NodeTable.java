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

import static de.tum.in.jadd.Util.checkState;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.function.IntConsumer;
import java.util.function.IntPredicate;
import java.util.function.IntUnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/* Arena of internal nodes. Next to the unique table and the garbage collector this class owns the
 * variable order: the variable <-> level permutation and the reorder counter. Leaves are not
 * stored here, they are represented by negative handles managed by the subclass. */
public abstract class NodeTable implements DecisionDiagram {
    private static final Logger logger = Logger.getLogger(NodeTable.class.getName());

    /* Bits allocated for the reference counter */
    private static final int REFERENCE_COUNT_BIT_SIZE = 14;
    private static final int REFERENCE_COUNT_SATURATED = (1 << REFERENCE_COUNT_BIT_SIZE) - 1;
    private static final int REFERENCE_COUNT_MASK = (1 << REFERENCE_COUNT_BIT_SIZE) - 1;
    private static final int REFERENCE_COUNT_OFFSET = 1;
    /* Bits allocated for the variable number */
    private static final int VARIABLE_BIT_SIZE = 17;

    /* Mask used to indicate invalid nodes */
    private static final int INVALID_NODE_VARIABLE = (1 << VARIABLE_BIT_SIZE) - 1;
    private static final int VARIABLE_OFFSET = REFERENCE_COUNT_OFFSET + REFERENCE_COUNT_BIT_SIZE;
    private static final int NON_VARIABLE_MASK = (1 << VARIABLE_OFFSET) - 1;

    static final int MAXIMAL_VARIABLE_COUNT = INVALID_NODE_VARIABLE;
    static final int LEAF_LEVEL = Integer.MAX_VALUE;

    static {
        //noinspection ConstantValue
        assert VARIABLE_BIT_SIZE + REFERENCE_COUNT_BIT_SIZE + 1 == Integer.SIZE;
    }

    static int dataMake(int variable) {
        return variable << VARIABLE_OFFSET;
    }

    static int dataGetVariable(int metadata) {
        assert dataIsValid(metadata);
        return dataGetVariableUnsafe(metadata);
    }

    static int dataGetVariableUnsafe(int metadata) {
        return metadata >>> VARIABLE_OFFSET;
    }

    static int dataSetVariable(int metadata, int variable) {
        return dataMake(variable) | (metadata & NON_VARIABLE_MASK);
    }

    static boolean dataIsValid(int metadata) {
        return (metadata >>> VARIABLE_OFFSET) != INVALID_NODE_VARIABLE;
    }

    static int dataMakeInvalid() {
        return INVALID_NODE_VARIABLE << VARIABLE_OFFSET;
    }

    static boolean dataIsSaturated(int metadata) {
        return ((metadata >>> REFERENCE_COUNT_OFFSET) & REFERENCE_COUNT_MASK) == REFERENCE_COUNT_SATURATED;
    }

    static int dataSaturate(int metadata) {
        return metadata | (REFERENCE_COUNT_SATURATED << REFERENCE_COUNT_OFFSET);
    }

    static boolean dataIsReferencedOrSaturated(int metadata) {
        return dataGetReferenceCountUnsafe(metadata) > 0;
    }

    static int dataGetReferenceCount(int metadata) {
        assert !dataIsSaturated(metadata);
        return (metadata >>> REFERENCE_COUNT_OFFSET) & REFERENCE_COUNT_MASK;
    }

    static int dataGetReferenceCountUnsafe(int metadata) {
        return (metadata >>> REFERENCE_COUNT_OFFSET) & REFERENCE_COUNT_MASK;
    }

    static int dataIncreaseReferenceCount(int metadata) {
        assert !dataIsSaturated(metadata);
        return metadata + 2;
    }

    static int dataDecreaseReferenceCount(int metadata) {
        assert !dataIsSaturated(metadata) && dataGetReferenceCount(metadata) > 0;
        return metadata - 2;
    }

    static int dataSetMark(int metadata) {
        return metadata | 1;
    }

    static int dataClearMark(int metadata) {
        return metadata & ~1;
    }

    static boolean dataIsMarked(int metadata) {
        return (metadata & 1) != 0;
    }

    static boolean countIsSaturated(int referenceCount) {
        return referenceCount == REFERENCE_COUNT_SATURATED;
    }

    // Use 0 as "not a node" to make re-allocations slightly more efficient
    protected static final int NOT_A_NODE = 0;
    protected static final int FIRST_NODE = 1;

    private static final int MINIMUM_NODE_TABLE_SIZE = Primes.nextPrime(1_000);
    private static final int MAXIMAL_NODE_COUNT = Integer.MAX_VALUE / 2 - 8;

    /* Approximation of dead node count. */
    private int approximateDeadNodeCount = 0;
    private final double minimumFreeNodeAfterGc;
    private final double growthFactor;
    private final int maximumNodeCount;

    /* Tracks the index of the last node which is referenced. Invariants on this variable:
     * biggestReferencedNode <= biggestValidNode and if a node has positive reference count, its
     * index is less than or equal to biggestReferencedNode. */
    private int biggestReferencedNode;
    /* Keep track of the last used node to terminate some loops early. The invariant is that if a node
     * is valid, then the node index is less than or equal to biggestValidNode. */
    private int biggestValidNode;
    /* First free (invalid) node, used when a new node is created. */
    private int firstFreeNode;
    /* Number of free (invalid) nodes. Used to determine if the table needs to be grown when adding a
     * node. */
    private int freeNodeCount;

    /* The work stack is used to store intermediate nodes created by some operations. While
     * constructing a new diagram, we may need to create multiple intermediate diagrams. As during
     * each creation the node table may run out of space, GC might be called and could delete the
     * intermediately created nodes. As increasing and decreasing the reference counter every time
     * is more expensive than just putting the values on the stack, we use this data structure. */
    private int[] workStack;
    /* Current top of the work stack. */
    private int workStackIndex = 0;

    /* Stores the meta-data for nodes, namely the variable number, reference count and a mask used
     * by various internal algorithms. These values are manipulated through static helper functions.
     *
     * Layout: <---VAR---><---REF---><MASK> */
    private int[] nodes;

    /* Hash map for existing nodes and a linked list for free nodes. The semantics of the "next
     * chain entry" change, depending on whether the node is valid or not.
     *
     * When a node with a certain hash is created, we add a pointer to the corresponding hash bucket
     * obtainable by hashToChainStart. Whenever we add another node with the same value, this
     * node gets added to the chain and one can traverse the chain by repeatedly accessing
     * hashChain on the chain start. If however a node is invalid, the "next chain
     * entry" points to the next free node. */
    private int[] hashToChainStart;
    private int[] hashChain;

    /* Variable order. variableToLevel and levelToVariable are inverse permutations of the first
     * numberOfVariables entries. */
    private int numberOfVariables = 0;
    private int[] variableToLevel = new int[32];
    private int[] levelToVariable = new int[32];
    /* Incremented whenever the order changes; operations compare it to detect a reorder. */
    private int reorderCount = 0;
    private boolean reordering = false;

    // Statistics
    private long createdNodes = 0;
    private long hashChainLookups = 0;
    private long hashChainLookupLength = 0;
    private long hashChainLookupHit = 0;
    private long growCount = 0;
    private long garbageCollectionCount = 0;
    private long garbageCollectedNodeCount = 0;
    private long garbageCollectionTime = 0;
    private long swapCount = 0;

    public NodeTable(int initialSize, double minimumFreeNodeAfterGc, double growthFactor, int maximumNodeCount) {
        this.minimumFreeNodeAfterGc = minimumFreeNodeAfterGc;
        this.growthFactor = growthFactor;
        this.maximumNodeCount = Math.min(maximumNodeCount, MAXIMAL_NODE_COUNT);
        int tableSize = Math.max(Primes.nextPrime(initialSize), MINIMUM_NODE_TABLE_SIZE);

        nodes = new int[tableSize];
        hashToChainStart = new int[tableSize];
        hashChain = new int[tableSize];

        firstFreeNode = FIRST_NODE;
        freeNodeCount = tableSize - FIRST_NODE;
        biggestReferencedNode = placeholder();
        biggestValidNode = placeholder();

        Arrays.fill(nodes, dataMakeInvalid());

        // Just to ensure a fail-fast
        Arrays.fill(hashChain, 0, FIRST_NODE, Integer.MIN_VALUE);
        for (int i = FIRST_NODE; i < tableSize - 1; i++) {
            hashChain[i] = i + 1;
        }
        hashChain[tableSize - 1] = FIRST_NODE;

        workStack = new int[32];
    }

    @Override
    public int variableOf(int node) {
        assert isNodeValidOrLeaf(node);
        return isLeaf(node) ? -1 : dataGetVariable(nodes[node]);
    }

    @Override
    public final int placeholder() {
        return NOT_A_NODE;
    }

    public boolean isNodeValid(int node) {
        assert node < tableSize();
        return FIRST_NODE <= node && node <= biggestValidNode && dataIsValid(nodes[node]);
    }

    /**
     * Determines if the given {@code node} is either a leaf or valid. For most operations it is
     * required that this is the case.
     *
     * @param node The node to be checked.
     * @return If {@code} is valid or leaf node.
     * @see #isLeaf(int)
     */
    public boolean isNodeValidOrLeaf(int node) {
        assert node < tableSize();
        return isLeaf(node) || isNodeValid(node);
    }

    // Variable order

    @Override
    public int numberOfVariables() {
        return numberOfVariables;
    }

    @Override
    public int levelOfVariable(int variable) {
        assert 0 <= variable && variable < numberOfVariables;
        return variableToLevel[variable];
    }

    @Override
    public int variableAtLevel(int level) {
        assert 0 <= level && level < numberOfVariables;
        return levelToVariable[level];
    }

    /**
     * Returns the level of the given {@code node}, i.e. the level of its variable, or
     * {@link Integer#MAX_VALUE} for leaves, which are below every variable.
     */
    protected final int levelOf(int node) {
        assert isNodeValidOrLeaf(node);
        return isLeaf(node) ? LEAF_LEVEL : variableToLevel[dataGetVariable(nodes[node])];
    }

    /**
     * Returns how often the variable order has been changed. Any operation which observes a change
     * of this value while running has to discard its intermediate results.
     */
    public int reorderCount() {
        return reorderCount;
    }

    boolean isReordering() {
        return reordering;
    }

    /**
     * Registers a new variable, placed at the bottom of the current order.
     *
     * @return The number of the new variable.
     */
    protected final int appendVariable() {
        checkState(numberOfVariables < MAXIMAL_VARIABLE_COUNT, "Too many variables");
        int variable = numberOfVariables;
        if (variable == variableToLevel.length) {
            variableToLevel = Arrays.copyOf(variableToLevel, variableToLevel.length * 2);
            levelToVariable = Arrays.copyOf(levelToVariable, levelToVariable.length * 2);
        }
        variableToLevel[variable] = variable;
        levelToVariable[variable] = variable;
        numberOfVariables += 1;
        ensureWorkStackSize(numberOfVariables * 4);
        return variable;
    }

    protected final void beginReordering() {
        checkState(!reordering, "Already reordering");
        reordering = true;
    }

    protected final void finishReordering(boolean changed) {
        assert reordering;
        reordering = false;
        if (changed) {
            reorderCount += 1;
        }
    }

    /**
     * Exchanges the variables at {@code level} and {@code level + 1} in the order. The nodes have to
     * be rewritten accordingly by the caller before any lookup happens.
     */
    protected final void swapLevelsInOrder(int level) {
        assert reordering;
        assert 0 <= level && level + 1 < numberOfVariables;
        int upper = levelToVariable[level];
        int lower = levelToVariable[level + 1];
        levelToVariable[level] = lower;
        levelToVariable[level + 1] = upper;
        variableToLevel[upper] = level + 1;
        variableToLevel[lower] = level;
        swapCount += 1;
    }

    protected final int[] nodesOfVariable(int variable) {
        int[] nodes = this.nodes;
        int count = 0;
        for (int node = FIRST_NODE; node <= biggestValidNode; node++) {
            int metadata = nodes[node];
            if (dataIsValid(metadata) && dataGetVariable(metadata) == variable) {
                count += 1;
            }
        }
        int[] result = new int[count];
        int index = 0;
        for (int node = FIRST_NODE; node <= biggestValidNode; node++) {
            int metadata = nodes[node];
            if (dataIsValid(metadata) && dataGetVariable(metadata) == variable) {
                result[index] = node;
                index += 1;
            }
        }
        return result;
    }

    /**
     * Changes the variable of an existing node in place, keeping its reference count. The node
     * stays in its (now possibly wrong) hash chain until {@link #rehash()} is called.
     */
    protected final void setVariableInPlace(int node, int variable) {
        assert reordering && isNodeValid(node);
        nodes[node] = dataSetVariable(nodes[node], variable);
    }

    // Work stack

    protected final void ensureWorkStackSize(int size) {
        if (size < workStack.length) {
            return;
        }
        int newSize = Math.max(workStack.length * 2, size + 1);
        workStack = Arrays.copyOf(workStack, newSize);
    }

    boolean isWorkStackEmpty() {
        return workStackIndex == 0;
    }

    protected final int workStackHeight() {
        return workStackIndex;
    }

    /**
     * Discards everything above the given {@code height}, used to release the intermediate results
     * of an aborted operation.
     */
    protected final void truncateWorkStack(int height) {
        assert 0 <= height && height <= workStackIndex;
        workStackIndex = height;
    }

    /**
     * Removes the topmost element from the stack.
     *
     * @see #pushToWorkStack(int)
     */
    protected final void popWorkStack() {
        assert !isWorkStackEmpty();
        workStackIndex--;
    }

    /**
     * Removes the {@code amount} topmost elements from the stack.
     *
     * @param amount The amount of elements to be removed.
     * @see #pushToWorkStack(int)
     */
    protected final void popWorkStack(int amount) {
        assert workStackIndex >= amount;
        workStackIndex -= amount;
    }

    /**
     * Pushes the given node onto the stack. While a node is on the work stack, it will not be garbage
     * collected. Hence, elements should be popped from the stack as soon as they are not used
     * anymore.
     *
     * @param node The node to be pushed.
     * @return The given {@code node}, to be used for chaining.
     * @see #popWorkStack(int)
     */
    protected final int pushToWorkStack(int node) {
        assert isNodeValidOrLeaf(node);
        ensureWorkStackSize(workStackIndex);
        workStack[workStackIndex] = node;
        workStackIndex += 1;
        return node;
    }

    protected final int[] pushToWorkStack(int[] nodes) {
        assert Arrays.stream(nodes).allMatch(this::isNodeValidOrLeaf);
        ensureWorkStackSize(workStackIndex + nodes.length);
        System.arraycopy(nodes, 0, workStack, workStackIndex, nodes.length);
        workStackIndex += nodes.length;
        return nodes;
    }

    // Reference counting

    @Override
    public int referenceCount(int node) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return -1;
        }
        int metadata = nodes[node];
        if (dataIsSaturated(metadata)) {
            return -1;
        }
        return dataGetReferenceCount(metadata);
    }

    @Override
    public int reference(int node) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return node;
        }
        int metadata = nodes[node];
        int referenceCount = dataGetReferenceCountUnsafe(metadata);
        if (countIsSaturated(referenceCount)) {
            return node;
        }
        assert 0 <= dataGetReferenceCount(metadata);

        nodes[node] = dataIncreaseReferenceCount(metadata);
        // Can't decrease approximateDeadNodeCount here - we may reference a node for the first time.
        if (node > biggestReferencedNode) {
            biggestReferencedNode = node;
        }
        return node;
    }

    @Override
    public int dereference(int node) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return node;
        }
        int metadata = nodes[node];
        int referenceCount = dataGetReferenceCountUnsafe(metadata);
        if (countIsSaturated(referenceCount)) {
            return node;
        }
        assert referenceCount > 0 : "Dereferencing unreferenced node " + node;
        nodes[node] = dataDecreaseReferenceCount(metadata);
        if (referenceCount == 1) {
            // After decrease its 0

            // We are approximating the actual dead node count here - it could be the case that
            // this node was the only one keeping its children "alive" - similarly, this node could be
            // kept alive by other nodes "above" it.
            approximateDeadNodeCount++;
            if (node == biggestReferencedNode) {
                biggestReferencedNode = NOT_A_NODE;
                for (int i = node - 1; i >= FIRST_NODE; i--) {
                    if (dataIsValid(nodes[i]) && dataIsReferencedOrSaturated(nodes[i])) {
                        biggestReferencedNode = i;
                        break;
                    }
                }
            }
        }
        return node;
    }

    @Override
    public int referencedNodeCount() {
        int[] nodes = this.nodes;
        int count = 0;

        for (int i = FIRST_NODE; i <= biggestReferencedNode; i++) {
            int metadata = nodes[i];
            if (dataIsValid(metadata) && dataIsReferencedOrSaturated(metadata)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public int saturateNode(int node) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return node;
        }
        if (node > biggestReferencedNode) {
            biggestReferencedNode = node;
        }
        nodes[node] = dataSaturate(nodes[node]);
        return node;
    }

    @Override
    public boolean isNodeSaturated(int node) {
        assert isNodeValidOrLeaf(node);
        return isLeaf(node) || dataIsSaturated(nodes[node]);
    }

    // Memory management

    int approximateDeadNodeCount() {
        return approximateDeadNodeCount;
    }

    protected final void increaseApproximateDeadNodeCount(int count) {
        approximateDeadNodeCount += count;
    }

    int freeNodeCount() {
        return freeNodeCount;
    }

    protected abstract boolean checkLookupChildrenMatch(int lookup);

    protected int findOrCreateNode(int variable, int hashCode) {
        createdNodes += 1;

        int[] nodes = this.nodes;
        int[] hashChain = this.hashChain;

        int lookup = hashToTable(hashCode);
        int currentLookupNode = hashToChainStart[lookup];
        assert currentLookupNode < tableSize() : "Invalid previous entry for " + lookup;

        // Search for the node in the hash chain
        int chainLookups = 1;
        this.hashChainLookups += 1;
        while (currentLookupNode != placeholder()) {
            if ((dataGetVariableUnsafe(nodes[currentLookupNode])) == variable
                    && checkLookupChildrenMatch(currentLookupNode)) {
                this.hashChainLookupLength += chainLookups;
                this.hashChainLookupHit += 1;
                return currentLookupNode;
            }
            int next = hashChain[currentLookupNode];
            assert next != currentLookupNode;
            currentLookupNode = next;
            chainLookups += 1;
        }
        this.hashChainLookupLength += chainLookups;

        // Check we have enough space to add the node
        assert freeNodeCount > 0;
        if (freeNodeCount == 1) {
            // We need a starting point for the free chain node, hence grow if only one node is remaining
            // instead of occupying that node
            int reorderCountBefore = reorderCount;
            ensureCapacity();
            if (reorderCountBefore != reorderCount) {
                // The order the caller computed the node for is gone, do not insert anything
                throw ReorderedException.INSTANCE;
            }
        }

        // Take next free node
        int freeNode = firstFreeNode;
        firstFreeNode = this.hashChain[firstFreeNode];
        freeNodeCount--;
        assert !isNodeValidOrLeaf(freeNode) : "Overwriting existing node " + freeNode;
        assert FIRST_NODE <= firstFreeNode && firstFreeNode < tableSize() : "Invalid free node " + firstFreeNode;

        // Adjust and write node
        this.nodes[freeNode] = dataMake(variable);
        if (biggestValidNode < freeNode) {
            biggestValidNode = freeNode;
        }
        connectHashList(freeNode, hashCode);
        return freeNode;
    }

    /**
     * Perform garbage collection by freeing up dead nodes.
     *
     * @return Number of freed nodes.
     */
    public int forceGc() {
        checkState(!reordering, "Garbage collection while reordering");
        int freedNodes = doGarbageCollection(0);
        onGarbageCollection();
        afterGarbageCollection();
        return freedNodes;
    }

    /**
     * Tries to free space by garbage collection and, if that does not yield enough free nodes,
     * re-sizes the table, recreating hashes. As a last resort, a garbage collection which only
     * needs to free a single node is attempted.
     *
     * @throws NodeAllocationException if no node could be freed and the table cannot grow.
     */
    private void ensureCapacity() {
        assert check();
        // Rewriting nodes during a swap must never move or free anything
        checkState(!reordering, "Node table exhausted while reordering");

        if (minimumFreeNodeAfterGc < 1.0 && approximateDeadNodeCount > 0) {
            logger.log(Level.FINE, "Running GC on {0} has size {1} and approximately {2} dead nodes", new Object[] {
                this, tableSize(), approximateDeadNodeCount
            });

            @SuppressWarnings("NumericCastThatLosesPrecision")
            int minimumFreeNodeCount = (int) (tableSize() * minimumFreeNodeAfterGc);
            int clearedNodes = doGarbageCollection(minimumFreeNodeCount);
            if (clearedNodes == -1) {
                logger.log(Level.FINE, "Not enough free nodes");
            } else {
                logger.log(Level.FINE, "Collected {0} nodes", clearedNodes);

                // Force all caches to be wiped out
                onGarbageCollection();
                afterGarbageCollection();
                return;
            }
        }

        if (canGrow()) {
            grow();
            return;
        }

        if (minimumFreeNodeAfterGc < 1.0) {
            int clearedNodes = doGarbageCollection(2);
            if (clearedNodes > 0) {
                logger.log(Level.FINE, "Table at maximum size, collected {0} nodes", clearedNodes);
                onGarbageCollection();
                afterGarbageCollection();
                return;
            }
        }
        logger.log(Level.FINE, "Node table {0} exhausted", this);
        throw new NodeAllocationException(tableSize());
    }

    /**
     * Grows the table, if allowed, until more than {@code count} free nodes are available, without
     * running garbage collection.
     *
     * @return Whether more than {@code count} nodes are free.
     */
    protected final boolean tryReserveFreeNodes(int count) {
        while (freeNodeCount <= count) {
            if (!canGrow()) {
                return false;
            }
            grow();
        }
        return true;
    }

    /**
     * The number of free nodes a successful garbage collection guarantees, or zero if garbage
     * collection is disabled.
     */
    protected final int freeNodesGuaranteedByGc() {
        if (minimumFreeNodeAfterGc >= 1.0) {
            return 0;
        }
        @SuppressWarnings("NumericCastThatLosesPrecision")
        int count = (int) (tableSize() * minimumFreeNodeAfterGc);
        return count;
    }

    private boolean canGrow() {
        return growthFactor > 1.0 && tableSize() < maximumNodeCount;
    }

    private void grow() {
        growCount += 1;
        int oldSize = tableSize();
        @SuppressWarnings("NumericCastThatLosesPrecision")
        int newSize = Math.min(maximumNodeCount, Primes.nextPrime((int) Math.ceil(oldSize * growthFactor)));
        assert oldSize < newSize : "Got new size " + newSize + " with old size " + oldSize;

        logger.log(Level.FINE, "Growing the table of {0} from {1} to {2}", new Object[] {this, oldSize, newSize});

        onTableResize(newSize);

        nodes = Arrays.copyOf(this.nodes, newSize); // NOPMD
        hashChain = Arrays.copyOf(this.hashChain, newSize); // NOPMD
        // We need to re-build hashToChainStart completely
        hashToChainStart = new int[newSize];

        // Chain start and next is used in calls to connectHashList so first enlarge and then copy to local reference
        int[] nodes = this.nodes;
        int[] hashChain = this.hashChain;

        // Invalidate the new nodes
        Arrays.fill(nodes, oldSize, newSize, dataMakeInvalid());

        int firstFreeNode = oldSize;
        int freeNodeCount = newSize - oldSize;

        // Update the hash references and free nodes chain of the old nodes
        // Reverse direction to build the downward chain towards first free node
        hashChain[newSize - 1] = FIRST_NODE;
        for (int hash = newSize - 2; hash >= oldSize; hash--) {
            hashChain[hash] = hash + 1;
        }
        for (int hash = oldSize - 1; hash >= FIRST_NODE; hash--) {
            int data = nodes[hash];
            if (!dataIsValid(data)) {
                hashChain[hash] = firstFreeNode;
                firstFreeNode = hash;
            }
        }

        // Need a second pass to build the existing nodes chain
        for (int node = oldSize - 1; node >= FIRST_NODE; node--) {
            int data = nodes[node];
            if (dataIsValid(data)) {
                connectHashList(node, hashCode(node, dataGetVariable(data)));
            } else {
                freeNodeCount++;
            }
        }

        this.firstFreeNode = firstFreeNode;
        this.freeNodeCount = freeNodeCount;

        onGarbageCollection();
        logger.log(Level.FINE, "Finished growing the table");
    }

    private int doGarbageCollection(int minimumFreeNodeCount) {
        assert check();
        assert isNoneMarked();
        long startTimestamp = System.currentTimeMillis();

        int referencedNodes = 0;
        for (int i = 0; i < workStackIndex; i++) {
            int node = workStack[i];
            if (!isLeaf(node) && isNodeValid(node)) {
                referencedNodes += markAllUnmarkedBelow(node);
            }
        }

        int biggestValidNode = this.biggestValidNode;
        int biggestReferencedNode = this.biggestReferencedNode;
        int[] nodes = this.nodes;
        int[] hashChain = this.hashChain;

        for (int i = FIRST_NODE; i <= biggestReferencedNode; i++) {
            int metadata = nodes[i];
            if (dataIsValid(metadata) && dataIsReferencedOrSaturated(metadata)) {
                referencedNodes += markAllUnmarkedBelow(i);
            }
        }

        int freeNodeCount = (tableSize() - FIRST_NODE) - referencedNodes;
        if (freeNodeCount < minimumFreeNodeCount) {
            unMarkAll();
            return -1;
        }

        // Clear chain starts, the chains of all surviving nodes are rebuilt below
        Arrays.fill(hashToChainStart, NOT_A_NODE);

        int previousFreeNodes = this.freeNodeCount;
        int firstFreeNode = FIRST_NODE;

        // Connect all definitely invalid nodes in the free node chain
        for (int i = tableSize() - 1; i > biggestValidNode; i--) {
            hashChain[i] = firstFreeNode;
            firstFreeNode = i;
        }

        // Rebuild hash chain for valid nodes, connect invalid nodes into the free chain
        // We need to rebuild the chain for unused nodes first as a smaller, unused node might be part
        // of a chain containing bigger nodes which are in use.
        for (int node = biggestValidNode; node >= FIRST_NODE; node--) {
            int metadata = nodes[node];
            int unmarkedData = dataClearMark(metadata);
            if (metadata == unmarkedData) {
                // This node is unmarked and thus unused
                nodes[node] = dataMakeInvalid();
                hashChain[node] = firstFreeNode;
                firstFreeNode = node;
                if (node == biggestValidNode) {
                    biggestValidNode--;
                }
            } else {
                // This node is used
                nodes[node] = unmarkedData;
                connectHashList(node, hashCode(node, dataGetVariable(unmarkedData)));
            }
        }

        this.biggestValidNode = biggestValidNode;
        this.firstFreeNode = firstFreeNode;
        this.freeNodeCount = freeNodeCount;
        approximateDeadNodeCount = 0;

        assert check();

        int collectedNodes = freeNodeCount - previousFreeNodes;
        this.garbageCollectedNodeCount += collectedNodes;
        this.garbageCollectionCount += 1;
        this.garbageCollectionTime += System.currentTimeMillis() - startTimestamp;
        return collectedNodes;
    }

    /**
     * Rebuilds the hash chains of all valid nodes. Required after nodes have been changed in place.
     */
    protected final void rehash() {
        Arrays.fill(hashToChainStart, NOT_A_NODE);
        int[] nodes = this.nodes;
        for (int node = biggestValidNode; node >= FIRST_NODE; node--) {
            int metadata = nodes[node];
            if (dataIsValid(metadata)) {
                connectHashList(node, hashCode(node, dataGetVariable(metadata)));
            }
        }
    }

    private void connectHashList(int node, int hashCode) {
        assert isNodeValid(node);
        int position = hashToTable(hashCode);
        int hashChainStart = hashToChainStart[position];
        int[] hashChain = this.hashChain;

        // Search the hash list if this node is already in there in order to avoid loops
        int chainLength = 1;
        int currentChain = hashChainStart;
        this.hashChainLookups += 1;
        while (currentChain != NOT_A_NODE) {
            if (currentChain == node) {
                // The node is already contained in the hash list
                this.hashChainLookupLength += chainLength;
                this.hashChainLookupHit += 1;
                return;
            }
            int next = hashChain[currentChain];
            assert next != currentChain;
            currentChain = next;
            chainLength += 1;
        }
        this.hashChainLookupLength += chainLength;

        hashChain[node] = hashChainStart;
        hashToChainStart[position] = node;
    }

    private int hashToTable(int hashCode) {
        int mod = hashCode % nodes.length;
        return mod < 0 ? mod + nodes.length : mod;
    }

    protected abstract int hashCode(int node, int variable);

    /**
     * Called whenever node handles may have been freed or re-used, i.e. after garbage collection
     * and growth.
     */
    protected abstract void onGarbageCollection();

    /**
     * Called after a successful garbage collection, when the table is in a consistent state. This
     * is the only point where the order may change automatically.
     */
    protected abstract void afterGarbageCollection();

    protected abstract void onTableResize(int newSize);

    // Marking

    private boolean isNodeMarked(int node) {
        assert isNodeValid(node);
        return dataIsMarked(nodes[node]);
    }

    private boolean isNoneMarked() {
        return findFirstMarked() == NOT_A_NODE;
    }

    private boolean isNoneMarkedBelow(int node) {
        return isLeaf(node) || !isNodeMarked(node) && allMatchBelow(node, this::isNoneMarkedBelow);
    }

    private int findFirstMarked() {
        for (int i = FIRST_NODE; i < nodes.length; i++) {
            if (dataIsMarked(nodes[i])) {
                return i;
            }
        }
        return NOT_A_NODE;
    }

    private int markAllUnmarkedBelow(int node) {
        /* The algorithm does not descend into trees whose root is marked, hence at the start of the
         * algorithm, every marked node must have all of its descendants marked to ensure correctness. */
        assert isNodeValidOrLeaf(node);

        if (isLeaf(node)) {
            return 0;
        }

        int metadata = nodes[node];
        int markedData = dataSetMark(metadata);

        if (metadata == markedData) {
            return 0;
        }
        nodes[node] = markedData;
        return 1 + sumEachBelow(node, this::markAllUnmarkedBelow);
    }

    protected int unMarkAll() {
        int unmarkedCount = 0;
        int[] nodes = this.nodes;

        for (int i = FIRST_NODE; i <= biggestValidNode; i++) {
            int metadata = nodes[i];
            if (dataIsValid(metadata)) {
                int unmarkedData = dataClearMark(metadata);
                if (metadata != unmarkedData) { // Node was marked
                    unmarkedCount++;
                    nodes[i] = unmarkedData;
                }
            }
        }

        assert isNoneMarked();
        return unmarkedCount;
    }

    protected int unMarkAllMarkedBelow(int node) {
        assert isNodeValidOrLeaf(node);

        if (isLeaf(node)) {
            return 0;
        }

        int metadata = nodes[node];
        int unmarkedData = dataClearMark(metadata);

        if (metadata == unmarkedData) {
            return 0;
        }
        nodes[node] = unmarkedData;
        return 1 + sumEachBelow(node, this::unMarkAllMarkedBelow);
    }

    // Reading

    public int tableSize() {
        return nodes.length;
    }

    /**
     * Counts the number of active nodes in the tree (i.e. the ones which are reachable from
     * referenced or saturated nodes), <b>excluding</b> the leaf nodes.
     *
     * @return Number of active nodes.
     */
    @Override
    public int activeNodeCount() {
        assert isNoneMarked();

        int count = 0;
        for (int node = FIRST_NODE; node <= biggestReferencedNode; node++) {
            int metadata = nodes[node];
            if (dataIsValid(metadata) && dataIsReferencedOrSaturated(metadata)) {
                count += markAllUnmarkedBelow(node);
            }
        }

        int unmarkedCount = unMarkAll();
        assert count == unmarkedCount;
        return count;
    }

    /**
     * Counts the number of nodes below the specified {@code node}.
     *
     * @param node The node to be counted.
     * @return The number of non-leaf nodes below {@code node}.
     */
    @Override
    public int nodeCount(int node) {
        assert isNodeValidOrLeaf(node);
        assert isNoneMarked();

        int count = markAllUnmarkedBelow(node);
        if (count > 0) {
            int unmarked = unMarkAllMarkedBelow(node);
            assert count == unmarked : "Expected " + count + " but only unmarked " + unmarked;
        }

        assert isNoneMarked();
        return count;
    }

    // Traversal

    protected void forEachNodeBelowOnce(int node, NodeVisitor action) {
        assert isNoneMarkedBelow(node);
        doForEachNodeBelowOnce(node, action);
        unMarkAllMarkedBelow(node);
        assert isNoneMarkedBelow(node);
    }

    private void doForEachNodeBelowOnce(int node, NodeVisitor action) {
        if (isLeaf(node)) {
            return;
        }
        int metadata = nodes[node];
        int markedData = dataSetMark(metadata);
        if (metadata == markedData) {
            return;
        }
        nodes[node] = markedData;
        action.visit(node, dataGetVariable(metadata));
        forEachChild(node, child -> doForEachNodeBelowOnce(child, action));
    }

    @Override
    public BitSet supportFilteredTo(int node, BitSet bitSet, BitSet filter) {
        assert isNodeValidOrLeaf(node);

        if (filter.isEmpty()) {
            return bitSet;
        }

        forEachNodeBelowOnce(node, (n, var) -> {
            if (filter.get(var)) {
                bitSet.set(var);
            }
        });

        return bitSet;
    }

    // Integrity checks and utility

    /**
     * Performs some integrity / invariant checks.
     *
     * @return True. This way, check can easily be called by an {@code assert} statement.
     */
    @SuppressWarnings("PMD.AvoidDeeplyNestedIfStmts")
    boolean check() {
        logger.log(Level.FINER, "Running integrity check");
        checkState(biggestReferencedNode <= biggestValidNode);

        // Check the order is a permutation
        for (int variable = 0; variable < numberOfVariables; variable++) {
            int level = variableToLevel[variable];
            checkState(
                    0 <= level && level < numberOfVariables && levelToVariable[level] == variable,
                    "Variable %d at inconsistent level %d",
                    variable,
                    level);
        }

        // Check the biggestValidNode variable
        if (biggestValidNode >= FIRST_NODE) {
            checkState(dataIsValid(nodes[biggestValidNode]), "Node (%s) is not valid", string(biggestValidNode));
        }
        for (int i = biggestValidNode + 1; i < tableSize(); i++) {
            checkState(!dataIsValid(nodes[i]), "Node (%s) is valid", string(i));
        }

        // Check biggestReferencedNode variable
        if (biggestReferencedNode >= FIRST_NODE) {
            checkState(
                    dataIsReferencedOrSaturated(nodes[biggestReferencedNode]),
                    "Node (%s) is not referenced",
                    string(biggestReferencedNode));
        }
        for (int i = biggestReferencedNode + 1; i < tableSize(); i++) {
            checkState(
                    !dataIsValid(nodes[i]) || !dataIsReferencedOrSaturated(nodes[i]),
                    "Node (%s) is referenced",
                    string(i));
        }

        // Check if the number of free nodes is correct
        int count = 0;
        for (int node = FIRST_NODE; node <= biggestValidNode; node++) {
            if (dataIsValid(nodes[node])) {
                count++;
            }
        }
        checkState(
                count == (tableSize() - freeNodeCount - FIRST_NODE),
                "Invalid # of free nodes: #live=%d, size=%d, free=%d, expected=%d",
                count,
                tableSize(),
                freeNodeCount,
                tableSize() - freeNodeCount - FIRST_NODE);

        // Check each node's children respect the order
        for (int node = FIRST_NODE; node <= biggestValidNode; node++) {
            int metadata = nodes[node];
            if (dataIsValid(metadata)) {
                int current = node;
                int level = variableToLevel[dataGetVariable(metadata)];
                forEachChild(node, child -> {
                    checkState(
                            isNodeValidOrLeaf(child),
                            "Invalid child entry (%s) -> (%s)",
                            string(current),
                            string(child));
                    if (!isLeaf(child)) {
                        checkState(
                                level < variableToLevel[dataGetVariable(nodes[child])],
                                "(%s) -> (%s) does not descend the order",
                                string(current),
                                string(child));
                    }
                });
            }
        }

        int maximalNodeCountCheckedSet = 4096;
        if (tableSize() < maximalNodeCountCheckedSet) {
            logger.log(Level.FINER, "Checking duplicate nodes");

            Set<Node> nodes = new HashSet<>();
            for (int node = FIRST_NODE; node <= biggestValidNode; node++) {
                if (isNodeValid(node)) {
                    Node nodeObject = node(node);
                    checkState(nodes.add(nodeObject), "Duplicate entry (%s)", nodeObject);
                }
            }
        }

        // Check the integrity of the hash chain
        for (int node = FIRST_NODE; node < tableSize(); node++) {
            int data = nodes[node];
            if (dataIsValid(data)) {
                // Check if each element is in its own hash chain
                int chainPosition = hashToChainStart[hashToTable(hashCode(node, dataGetVariable(data)))];
                boolean found = false;
                StringBuilder hashChain = new StringBuilder(32);
                while (chainPosition != placeholder()) {
                    hashChain.append(' ').append(chainPosition);
                    if (chainPosition == node) {
                        found = true;
                        break;
                    }
                    chainPosition = this.hashChain[chainPosition];
                }
                checkState(found, "(%s) is not contained in it's hash list: %s", string(node), hashChain);
            }
        }

        // Check firstFreeNode
        for (int i = FIRST_NODE; i < firstFreeNode; i++) {
            checkState(dataIsValid(nodes[i]), "Invalid node (%s) smaller than firstFreeNode", string(i));
        }

        // Check free nodes chain
        int currentFreeNode = firstFreeNode;
        do {
            checkState(
                    !dataIsValid(nodes[currentFreeNode]),
                    "Node (%s) in free node chain is valid",
                    string(currentFreeNode));
            int nextFreeNode = hashChain[currentFreeNode];
            // This also excludes possible loops
            checkState(
                    nextFreeNode == FIRST_NODE || currentFreeNode < nextFreeNode,
                    "Free node chain is not well ordered, %s <= %s",
                    nextFreeNode,
                    currentFreeNode);
            checkState(
                    nextFreeNode < nodes.length,
                    "Next free node points over horizon, %s -> %s (%s)",
                    currentFreeNode,
                    nextFreeNode,
                    nodes.length);
            currentFreeNode = nextFreeNode;
        } while (currentFreeNode != FIRST_NODE);

        return true;
    }

    public String getStatistics() {
        int childrenCount = 0;
        int saturatedNodes = 0;
        int referencedNodes = 0;
        int validNodes = 0;

        assert isNoneMarked();

        for (int node = FIRST_NODE; node < tableSize(); node++) {
            int metadata = nodes[node];
            if (dataIsValid(metadata)) {
                validNodes += 1;
                if (dataIsReferencedOrSaturated(metadata)) {
                    referencedNodes += 1;
                    childrenCount += markAllUnmarkedBelow(node);

                    if (dataIsSaturated(metadata)) {
                        saturatedNodes += 1;
                    }
                }
            }
        }

        unMarkAll();

        int[] chainLength = new int[tableSize()];
        Deque<Integer> path = new ArrayDeque<>();
        int distinctChains = 0;

        for (int node = FIRST_NODE; node < tableSize(); node++) {
            int metadata = nodes[node];
            if (chainLength[node] > 0) {
                continue;
            }

            if (dataIsValid(metadata)) {
                int chainPosition = hashToChainStart[hashToTable(hashCode(node, dataGetVariable(metadata)))];
                int length = 0;
                while (chainPosition != 0) {
                    path.push(chainPosition);
                    if (chainPosition == node) {
                        distinctChains += 1;
                        break;
                    }
                    chainPosition = hashChain[chainPosition];
                    if (chainLength[chainPosition] > 0) {
                        length = chainLength[chainPosition];
                        break;
                    }
                }
                while (!path.isEmpty()) {
                    int pathNode = path.pop();
                    length += 1;
                    chainLength[pathNode] = length;
                }
            }
        }

        int sum = 0;
        int max = 0;
        for (int length : chainLength) {
            if (length == 0) {
                continue;
            }
            sum += 1;
            if (max < length) {
                max = length;
            }
        }

        return String.format(
                "Node table statistics:%n"
                        + "Table Size: %1$d, (largest ref: %2$d), %3$d created nodes%n"
                        + "%4$d valid nodes, %5$d referenced (%6$d saturated), %7$d children%n"
                        + "Hash table: %8$d chains %9$.2f load, %10$.2f avg, %11$d max; "
                        + "%12$d lookups, %13$.2f avg. len, %14$d hits%n"
                        + "%15$d GC runs (%16$.2f s), %17$d freed, %18$d grows%n"
                        + "Order: %19$d variables, %20$d reorders, %21$d level swaps",
                tableSize(),
                biggestReferencedNode,
                createdNodes,
                validNodes,
                referencedNodes,
                saturatedNodes,
                childrenCount,
                distinctChains,
                sum * 1.0 / tableSize(),
                sum * 1.0 / Math.max(distinctChains, 1),
                max,
                hashChainLookups,
                hashChainLookupLength * 1.0 / Math.max(hashChainLookups, 1),
                hashChainLookupHit,
                garbageCollectionCount,
                garbageCollectionTime / 1000.0,
                garbageCollectedNodeCount,
                growCount,
                numberOfVariables,
                reorderCount,
                swapCount);
    }

    private Object string(int node) {
        return new Object() {
            @Override
            public String toString() {
                return dataIsValid(nodes[node]) ? node(node).toString() : "invalid " + node;
            }
        };
    }

    protected abstract Node node(int node);

    public interface Node {
        String childrenString();
    }

    @FunctionalInterface
    protected interface NodeVisitor {
        void visit(int node, int variable);
    }

    // Tree structure abstraction

    protected abstract void forEachChild(int node, IntConsumer action);

    protected abstract int sumEachBelow(int node, IntUnaryOperator operator);

    protected abstract boolean allMatchBelow(int node, IntPredicate predicate);
}
