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

import java.util.Arrays;
import java.util.Collection;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.logging.Level;
import java.util.logging.Logger;

/*
 * Direct-mapped operation caches. Every cache is only valid for the current set of nodes and the
 * current variable order, hence it is wiped completely after garbage collection, growth and
 * reordering.
 */
@SuppressWarnings({"PMD.UseUtilityClass", "PMD.TooManyFields"})
final class AddCache {
    private static final byte NOT_AN_OPERATION = 0;
    private static final byte REPRESENTATIVE_MINIMUM = 32;
    private static final byte REPRESENTATIVE_MAXIMUM = 33;

    private static final Logger logger = Logger.getLogger(AddCache.class.getName());

    @SuppressWarnings("StaticCollection")
    private static final Collection<AddCache> cacheShutdownHook = new ConcurrentLinkedDeque<>();

    private static final int[] EMPTY_INT_ARRAY = new int[0];
    private static final byte[] EMPTY_BYTE_ARRAY = new byte[0];

    private final NodeTable associatedDiagram;
    private final int placeholder;
    private final AddConfiguration configuration;
    private final CacheStatistics binaryStatistics = new CacheStatistics();
    private final CacheStatistics ternaryStatistics = new CacheStatistics();
    private final CacheStatistics negationStatistics = new CacheStatistics();
    private final CacheStatistics abstractionStatistics = new CacheStatistics();
    private final CacheStatistics representativeStatistics = new CacheStatistics();

    private int negationKeyCount = 0;
    private int[] negationCache = EMPTY_INT_ARRAY;

    private int binaryKeyCount = 0;
    private byte[] binaryOp = EMPTY_BYTE_ARRAY;
    private int[] binaryCache = EMPTY_INT_ARRAY;

    private int ternaryKeyCount = 0;
    private int[] ternaryCache = EMPTY_INT_ARRAY;

    /* Shared by abstraction and representative extraction, distinguished by the operation tag */
    private int abstractionKeyCount = 0;
    private byte[] abstractionOp = EMPTY_BYTE_ARRAY;
    private int[] abstractionCache = EMPTY_INT_ARRAY;

    private int lookupHash;
    private int lookupResult;

    AddCache(NodeTable associatedDiagram, AddConfiguration configuration) {
        this.associatedDiagram = associatedDiagram;
        this.placeholder = associatedDiagram.placeholder();
        this.configuration = configuration;
        this.lookupHash = -1;
        this.lookupResult = placeholder;

        reallocateNegation();
        reallocateBinary();
        reallocateTernary();
        reallocateAbstraction();

        if (logger.isLoggable(Level.INFO) && configuration.logStatisticsOnShutdown()) {
            logger.log(Level.FINER, "Adding {0} to shutdown hook", this);
            addToShutdownHook(this);
        }
    }

    private static void addToShutdownHook(AddCache cache) {
        ShutdownHookLazyHolder.init();
        cacheShutdownHook.add(cache);
    }

    static byte operationId(BinaryOperation operation) {
        return (byte) (operation.ordinal() + 1);
    }

    static byte operationId(Abstraction abstraction) {
        return (byte) (abstraction.ordinal() + 1);
    }

    private static boolean isAbstractionTag(byte operationId) {
        return (NOT_AN_OPERATION < operationId && operationId <= Abstraction.values().length)
                || operationId == REPRESENTATIVE_MINIMUM
                || operationId == REPRESENTATIVE_MAXIMUM;
    }

    private static int mod(int value, int modulus) {
        int val = value % modulus;
        return val < 0 ? val + modulus : val;
    }

    int lookupHash() {
        return lookupHash;
    }

    int lookupResult() {
        return lookupResult;
    }

    private float negationLoadFactor() {
        int loadedNegationBins = 0;
        for (int i = 0; i < negationKeyCount; i++) {
            if (negationCache[2 * i] != placeholder) {
                loadedNegationBins++;
            }
        }
        return (float) loadedNegationBins / (float) negationKeyCount;
    }

    private float binaryLoadFactor() {
        int loadedBinaryBins = 0;
        for (int i = 0; i < binaryKeyCount; i++) {
            if (binaryOp[i] != NOT_AN_OPERATION) {
                loadedBinaryBins++;
            }
        }
        return (float) loadedBinaryBins / (float) binaryKeyCount;
    }

    private float ternaryLoadFactor() {
        int loadedTernaryBins = 0;
        for (int i = 0; i < ternaryKeyCount; i++) {
            if (ternaryCache[4 * i] != placeholder) {
                loadedTernaryBins++;
            }
        }
        return (float) loadedTernaryBins / (float) ternaryKeyCount;
    }

    private float abstractionLoadFactor() {
        int loadedAbstractionBins = 0;
        for (int i = 0; i < abstractionKeyCount; i++) {
            if (abstractionOp[i] != NOT_AN_OPERATION) {
                loadedAbstractionBins++;
            }
        }
        return (float) loadedAbstractionBins / (float) abstractionKeyCount;
    }

    private int negationKeyCount() {
        assert negationKeyCount == negationCache.length / 2;
        return negationKeyCount;
    }

    private int binaryKeyCount() {
        assert binaryKeyCount == binaryCache.length / 3;
        return binaryKeyCount;
    }

    private int ternaryKeyCount() {
        assert ternaryKeyCount == ternaryCache.length / 4;
        return ternaryKeyCount;
    }

    private int abstractionKeyCount() {
        assert abstractionKeyCount == abstractionCache.length / 3;
        return abstractionKeyCount;
    }

    void invalidate() {
        logger.log(Level.FINER, "Invalidating caches");
        negationStatistics.invalidation();
        reallocateNegation();
        binaryStatistics.invalidation();
        reallocateBinary();
        ternaryStatistics.invalidation();
        reallocateTernary();
        abstractionStatistics.invalidation();
        representativeStatistics.invalidation();
        reallocateAbstraction();
    }

    // Apply

    boolean lookupApply(BinaryOperation operation, int inputNode1, int inputNode2) {
        assert !operation.isCommutative() || inputNode1 <= inputNode2;
        return binaryLookup(operationId(operation), inputNode1, inputNode2);
    }

    void putApply(BinaryOperation operation, int hash, int inputNode1, int inputNode2, int resultNode) {
        assert !operation.isCommutative() || inputNode1 <= inputNode2;
        binaryPut(operationId(operation), hash, inputNode1, inputNode2, resultNode);
    }

    private boolean binaryLookup(byte operationId, int inputNode1, int inputNode2) {
        assert operationId != NOT_AN_OPERATION;
        assert associatedDiagram.isNodeValidOrLeaf(inputNode1) && associatedDiagram.isNodeValidOrLeaf(inputNode2);
        int hash = HashUtil.hash(operationId, inputNode1, inputNode2);
        lookupHash = hash;
        int cachePosition = mod(hash, binaryKeyCount());
        byte[] binaryOp = this.binaryOp;
        int[] binaryCache = this.binaryCache;

        int binStart = 3 * cachePosition;
        if (inputNode1 == binaryCache[binStart]
                && inputNode2 == binaryCache[binStart + 1]
                && operationId == binaryOp[cachePosition]) {
            int result = binaryCache[binStart + 2];
            lookupResult = result;
            assert associatedDiagram.isNodeValidOrLeaf(result);
            binaryStatistics.cacheHit();
            return true;
        }
        return false;
    }

    private void binaryPut(byte operationId, int hash, int inputNode1, int inputNode2, int resultNode) {
        assert associatedDiagram.isNodeValidOrLeaf(resultNode);
        assert hash == HashUtil.hash(operationId, inputNode1, inputNode2);
        int cachePosition = mod(hash, binaryKeyCount());
        binaryStatistics.put();

        int binStart = 3 * cachePosition;
        binaryOp[cachePosition] = operationId;
        binaryCache[binStart] = inputNode1;
        binaryCache[binStart + 1] = inputNode2;
        binaryCache[binStart + 2] = resultNode;
    }

    // Negation

    boolean lookupNot(int inputNode) {
        assert associatedDiagram.isNodeValid(inputNode);
        int hash = HashUtil.hash(inputNode);
        lookupHash = hash;
        int binStart = 2 * mod(hash, negationKeyCount());
        int[] negationCache = this.negationCache;

        if (negationCache[binStart] == inputNode) {
            int result = negationCache[binStart + 1];
            lookupResult = result;
            assert associatedDiagram.isNodeValidOrLeaf(result);
            negationStatistics.cacheHit();
            return true;
        }
        return false;
    }

    void putNot(int hash, int inputNode, int resultNode) {
        assert associatedDiagram.isNodeValid(inputNode) && associatedDiagram.isNodeValidOrLeaf(resultNode);
        assert hash == HashUtil.hash(inputNode);
        negationStatistics.put();
        int binStart = 2 * mod(hash, negationKeyCount());
        negationCache[binStart] = inputNode;
        negationCache[binStart + 1] = resultNode;
    }

    // If-then-else

    boolean lookupIfThenElse(int inputNode1, int inputNode2, int inputNode3) {
        assert associatedDiagram.isNodeValid(inputNode1)
                && associatedDiagram.isNodeValidOrLeaf(inputNode2)
                && associatedDiagram.isNodeValidOrLeaf(inputNode3);
        int hash = HashUtil.hash(inputNode1, inputNode2, inputNode3);
        lookupHash = hash;
        int binStart = 4 * mod(hash, ternaryKeyCount());
        int[] ternaryCache = this.ternaryCache;

        if (inputNode1 == ternaryCache[binStart]
                && inputNode2 == ternaryCache[binStart + 1]
                && inputNode3 == ternaryCache[binStart + 2]) {
            int result = ternaryCache[binStart + 3];
            lookupResult = result;
            assert associatedDiagram.isNodeValidOrLeaf(result);
            ternaryStatistics.cacheHit();
            return true;
        }
        return false;
    }

    void putIfThenElse(int hash, int inputNode1, int inputNode2, int inputNode3, int resultNode) {
        assert associatedDiagram.isNodeValid(inputNode1) && associatedDiagram.isNodeValidOrLeaf(resultNode);
        assert hash == HashUtil.hash(inputNode1, inputNode2, inputNode3);
        ternaryStatistics.put();
        int binStart = 4 * mod(hash, ternaryKeyCount());
        int[] ternaryCache = this.ternaryCache;
        ternaryCache[binStart] = inputNode1;
        ternaryCache[binStart + 1] = inputNode2;
        ternaryCache[binStart + 2] = inputNode3;
        ternaryCache[binStart + 3] = resultNode;
    }

    // Abstraction and representatives

    boolean lookupAbstraction(Abstraction abstraction, int inputNode, int cube) {
        return abstractionLookup(operationId(abstraction), inputNode, cube, abstractionStatistics);
    }

    void putAbstraction(Abstraction abstraction, int hash, int inputNode, int cube, int resultNode) {
        abstractionPut(operationId(abstraction), hash, inputNode, cube, resultNode, abstractionStatistics);
    }

    boolean lookupRepresentative(boolean minimum, int inputNode, int cube) {
        return abstractionLookup(representativeId(minimum), inputNode, cube, representativeStatistics);
    }

    void putRepresentative(boolean minimum, int hash, int inputNode, int cube, int resultNode) {
        abstractionPut(representativeId(minimum), hash, inputNode, cube, resultNode, representativeStatistics);
    }

    private static byte representativeId(boolean minimum) {
        return minimum ? REPRESENTATIVE_MINIMUM : REPRESENTATIVE_MAXIMUM;
    }

    private boolean abstractionLookup(byte operationId, int inputNode, int cube, CacheStatistics statistics) {
        assert isAbstractionTag(operationId);
        assert associatedDiagram.isNodeValidOrLeaf(inputNode) && associatedDiagram.isNodeValid(cube);
        int hash = HashUtil.hash(operationId, inputNode, cube);
        lookupHash = hash;
        int cachePosition = mod(hash, abstractionKeyCount());
        int[] abstractionCache = this.abstractionCache;

        int binStart = 3 * cachePosition;
        if (inputNode == abstractionCache[binStart]
                && cube == abstractionCache[binStart + 1]
                && operationId == abstractionOp[cachePosition]) {
            int result = abstractionCache[binStart + 2];
            lookupResult = result;
            assert associatedDiagram.isNodeValidOrLeaf(result);
            statistics.cacheHit();
            return true;
        }
        return false;
    }

    private void abstractionPut(
            byte operationId, int hash, int inputNode, int cube, int resultNode, CacheStatistics statistics) {
        assert isAbstractionTag(operationId);
        assert associatedDiagram.isNodeValidOrLeaf(resultNode);
        assert hash == HashUtil.hash(operationId, inputNode, cube);
        statistics.put();
        int cachePosition = mod(hash, abstractionKeyCount());
        int binStart = 3 * cachePosition;
        abstractionOp[cachePosition] = operationId;
        abstractionCache[binStart] = inputNode;
        abstractionCache[binStart + 1] = cube;
        abstractionCache[binStart + 2] = resultNode;
    }

    // Allocation

    private void reallocateNegation() {
        int size = associatedDiagram.tableSize() / configuration.cacheNegationDivider();
        if (size < 2 * negationKeyCount) {
            for (int i = 0; i < negationCache.length; i += 2) {
                negationCache[i] = placeholder;
            }
        } else {
            int keyCount = Primes.nextPrime(size);
            negationCache = new int[keyCount * 2];
            negationKeyCount = keyCount;
        }
    }

    private void reallocateBinary() {
        int size = associatedDiagram.tableSize() / configuration.cacheBinaryDivider();
        if (size < 2 * binaryKeyCount) {
            Arrays.fill(binaryOp, NOT_AN_OPERATION);
        } else {
            int keyCount = Primes.nextPrime(size);
            binaryOp = new byte[keyCount];
            binaryCache = new int[keyCount * 3];
            binaryKeyCount = keyCount;
        }
    }

    private void reallocateTernary() {
        int size = associatedDiagram.tableSize() / configuration.cacheTernaryDivider();
        if (size < 2 * ternaryKeyCount) {
            for (int i = 0; i < ternaryCache.length; i += 4) {
                ternaryCache[i] = placeholder;
            }
        } else {
            int keyCount = Primes.nextPrime(size);
            ternaryCache = new int[keyCount * 4];
            ternaryKeyCount = keyCount;
        }
    }

    private void reallocateAbstraction() {
        int size = associatedDiagram.tableSize() / configuration.cacheAbstractionDivider();
        if (size < 2 * abstractionKeyCount) {
            Arrays.fill(abstractionOp, NOT_AN_OPERATION);
        } else {
            int keyCount = Primes.nextPrime(size);
            abstractionOp = new byte[keyCount];
            abstractionCache = new int[keyCount * 3];
            abstractionKeyCount = keyCount;
        }
    }

    public String getStatistics() {
        return String.format(
                "Negation: size: %d, load: %s%n %s%n"
                        + "Binary: size: %d, load: %s%n %s%n"
                        + "Ternary: size: %d, load: %s%n %s%n"
                        + "Abstraction: size: %d, load: %s%n %s%n"
                        + "Representative:%n %s",
                negationKeyCount,
                negationLoadFactor(),
                negationStatistics,
                binaryKeyCount,
                binaryLoadFactor(),
                binaryStatistics,
                ternaryKeyCount,
                ternaryLoadFactor(),
                ternaryStatistics,
                abstractionKeyCount,
                abstractionLoadFactor(),
                abstractionStatistics,
                representativeStatistics);
    }

    private static final class CacheStatistics {
        private int hitCount = 0;
        private int hitCountSinceInvalidation = 0;
        private int putCount = 0;
        private int putCountSinceInvalidation = 0;
        private int invalidationCount = 0;

        void cacheHit() {
            hitCount++;
            hitCountSinceInvalidation++;
        }

        void invalidation() {
            invalidationCount++;
            hitCountSinceInvalidation = 0;
            putCountSinceInvalidation = 0;
        }

        void put() {
            putCount++;
            putCountSinceInvalidation++;
        }

        @Override
        public String toString() {
            float hitToPutRatio = (float) hitCount / (float) Math.max(putCount, 1);
            return String.format(
                    "Cache access: put=%d, hit=%d, hit-to-put=%3.3f%n"
                            + "       invalidation: %d times, since last: put=%d, hit=%d",
                    putCount,
                    hitCount,
                    hitToPutRatio,
                    invalidationCount,
                    putCountSinceInvalidation,
                    hitCountSinceInvalidation);
        }
    }

    private static final class ShutdownHookLazyHolder {
        private static final Runnable shutdownHook = new ShutdownHookPrinter();

        static {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdownHook));
        }

        static void init() {
            // bogus method to force static initialization
        }
    }

    private static final class ShutdownHookPrinter implements Runnable {
        @Override
        public void run() {
            if (!logger.isLoggable(Level.INFO)) {
                return;
            }
            for (AddCache cache : cacheShutdownHook) {
                logger.info(cache.associatedDiagram.statistics());
            }
        }
    }
}
