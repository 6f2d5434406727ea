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
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BooleanSupplier;
import javax.annotation.Nullable;

/**
 * Synchronizes a given Add using a {@link java.util.concurrent.locks.ReadWriteLock}. Only calls which
 * neither allocate nor traverse with marks share the read lock.
 */
public final class SynchronizedAdd implements Add {
    private final Add delegate;
    private final Lock readLock;
    private final Lock writeLock;

    private SynchronizedAdd(Add delegate, ReadWriteLock lock) {
        this.delegate = delegate;
        writeLock = lock.writeLock();
        readLock = lock.readLock();
    }

    public static SynchronizedAdd create(Add add) {
        if (add instanceof SynchronizedAdd) {
            return (SynchronizedAdd) add;
        }
        return new SynchronizedAdd(add, new ReentrantReadWriteLock());
    }

    @Override
    public int placeholder() {
        readLock.lock();
        try {
            return delegate.placeholder();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public boolean isLeaf(int node) {
        readLock.lock();
        try {
            return delegate.isLeaf(node);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int variableOf(int node) {
        readLock.lock();
        try {
            return delegate.variableOf(node);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int numberOfVariables() {
        readLock.lock();
        try {
            return delegate.numberOfVariables();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int levelOfVariable(int variable) {
        readLock.lock();
        try {
            return delegate.levelOfVariable(variable);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int variableAtLevel(int level) {
        readLock.lock();
        try {
            return delegate.variableAtLevel(level);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int referenceCount(int node) {
        readLock.lock();
        try {
            return delegate.referenceCount(node);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int saturateNode(int node) {
        writeLock.lock();
        try {
            return delegate.saturateNode(node);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean isNodeSaturated(int node) {
        readLock.lock();
        try {
            return delegate.isNodeSaturated(node);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int reference(int node) {
        writeLock.lock();
        try {
            return delegate.reference(node);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int dereference(int node) {
        writeLock.lock();
        try {
            return delegate.dereference(node);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void dereference(int... nodes) {
        writeLock.lock();
        try {
            delegate.dereference(nodes);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int referencedNodeCount() {
        readLock.lock();
        try {
            return delegate.referencedNodeCount();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int activeNodeCount() {
        writeLock.lock();
        try {
            return delegate.activeNodeCount();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int nodeCount(int node) {
        writeLock.lock();
        try {
            return delegate.nodeCount(node);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public BitSet support(int node) {
        writeLock.lock();
        try {
            return delegate.support(node);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public BitSet supportTo(int node, BitSet bitSet) {
        writeLock.lock();
        try {
            return delegate.supportTo(node, bitSet);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public BitSet supportFilteredTo(int node, BitSet bitSet, BitSet filter) {
        writeLock.lock();
        try {
            return delegate.supportFilteredTo(node, bitSet, filter);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int updateWith(int result, int inputNode) {
        writeLock.lock();
        try {
            return delegate.updateWith(result, inputNode);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public String statistics() {
        writeLock.lock();
        try {
            return delegate.statistics();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int zero() {
        readLock.lock();
        try {
            return delegate.zero();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int one() {
        readLock.lock();
        try {
            return delegate.one();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int constant(double value) {
        writeLock.lock();
        try {
            return delegate.constant(value);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public double value(int leaf) {
        readLock.lock();
        try {
            return delegate.value(leaf);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int low(int node) {
        readLock.lock();
        try {
            return delegate.low(node);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int high(int node) {
        readLock.lock();
        try {
            return delegate.high(node);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int makeNode(int variable, int low, int high) {
        writeLock.lock();
        try {
            return delegate.makeNode(variable, low, high);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int createVariable() {
        writeLock.lock();
        try {
            return delegate.createVariable();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int[] createVariables(int count) {
        writeLock.lock();
        try {
            return delegate.createVariables(count);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int variableNode(int variable) {
        writeLock.lock();
        try {
            return delegate.variableNode(variable);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int cube(int... variables) {
        writeLock.lock();
        try {
            return delegate.cube(variables);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int cube(BitSet variables) {
        writeLock.lock();
        try {
            return delegate.cube(variables);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean isCube(int node) {
        readLock.lock();
        try {
            return delegate.isCube(node);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public double evaluate(int node, BitSet assignment) {
        readLock.lock();
        try {
            return delegate.evaluate(node, assignment);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public double evaluate(int node, boolean[] assignment) {
        readLock.lock();
        try {
            return delegate.evaluate(node, assignment);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int apply(BinaryOperation operation, int node1, int node2) {
        writeLock.lock();
        try {
            return delegate.apply(operation, node1, node2);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int not(int node) {
        writeLock.lock();
        try {
            return delegate.not(node);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int ifThenElse(int ifNode, int thenNode, int elseNode) {
        writeLock.lock();
        try {
            return delegate.ifThenElse(ifNode, thenNode, elseNode);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int abstractCube(Abstraction abstraction, int node, int cube) {
        writeLock.lock();
        try {
            return delegate.abstractCube(abstraction, node, cube);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int minRepresentative(int node, int cube) {
        writeLock.lock();
        try {
            return delegate.minRepresentative(node, cube);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int maxRepresentative(int node, int cube) {
        writeLock.lock();
        try {
            return delegate.maxRepresentative(node, cube);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void reorder(int[] levelToVariable) {
        writeLock.lock();
        try {
            delegate.reorder(levelToVariable);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int reorderCount() {
        readLock.lock();
        try {
            return delegate.reorderCount();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public void setReorderingStrategy(@Nullable ReorderingStrategy strategy) {
        writeLock.lock();
        try {
            delegate.setReorderingStrategy(strategy);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void setAbortCheck(@Nullable BooleanSupplier shouldAbort) {
        writeLock.lock();
        try {
            delegate.setAbortCheck(shouldAbort);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int forceGc() {
        writeLock.lock();
        try {
            return delegate.forceGc();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void invalidateCache() {
        writeLock.lock();
        try {
            delegate.invalidateCache();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int consume(int result, int inputNode1, int inputNode2) {
        writeLock.lock();
        try {
            return delegate.consume(result, inputNode1, inputNode2);
        } finally {
            writeLock.unlock();
        }
    }
}
