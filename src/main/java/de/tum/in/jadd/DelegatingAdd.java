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
 * Forwards every call to a delegate diagram, notifying subclasses before and after each call. The
 * exit notification also runs when the delegate throws.
 */
public class DelegatingAdd implements Add {
    private final Add delegate;

    public DelegatingAdd(Add delegate) {
        this.delegate = delegate;
    }

    protected void onEnter(String name) {
        // Empty
    }

    protected void onExit() {
        // Empty
    }

    @Override
    public int placeholder() {
        onEnter("placeholder");
        try {
            return delegate.placeholder();
        } finally {
            onExit();
        }
    }

    @Override
    public boolean isLeaf(int node) {
        onEnter("isLeaf");
        try {
            return delegate.isLeaf(node);
        } finally {
            onExit();
        }
    }

    @Override
    public int variableOf(int node) {
        onEnter("variableOf");
        try {
            return delegate.variableOf(node);
        } finally {
            onExit();
        }
    }

    @Override
    public int numberOfVariables() {
        onEnter("numberOfVariables");
        try {
            return delegate.numberOfVariables();
        } finally {
            onExit();
        }
    }

    @Override
    public int levelOfVariable(int variable) {
        onEnter("levelOfVariable");
        try {
            return delegate.levelOfVariable(variable);
        } finally {
            onExit();
        }
    }

    @Override
    public int variableAtLevel(int level) {
        onEnter("variableAtLevel");
        try {
            return delegate.variableAtLevel(level);
        } finally {
            onExit();
        }
    }

    @Override
    public int referenceCount(int node) {
        onEnter("referenceCount");
        try {
            return delegate.referenceCount(node);
        } finally {
            onExit();
        }
    }

    @Override
    public int saturateNode(int node) {
        onEnter("saturateNode");
        try {
            return delegate.saturateNode(node);
        } finally {
            onExit();
        }
    }

    @Override
    public boolean isNodeSaturated(int node) {
        onEnter("isNodeSaturated");
        try {
            return delegate.isNodeSaturated(node);
        } finally {
            onExit();
        }
    }

    @Override
    public int reference(int node) {
        onEnter("reference");
        try {
            return delegate.reference(node);
        } finally {
            onExit();
        }
    }

    @Override
    public int dereference(int node) {
        onEnter("dereference");
        try {
            return delegate.dereference(node);
        } finally {
            onExit();
        }
    }

    @Override
    public void dereference(int... nodes) {
        onEnter("dereference");
        try {
            delegate.dereference(nodes);
        } finally {
            onExit();
        }
    }

    @Override
    public int referencedNodeCount() {
        onEnter("referencedNodeCount");
        try {
            return delegate.referencedNodeCount();
        } finally {
            onExit();
        }
    }

    @Override
    public int activeNodeCount() {
        onEnter("activeNodeCount");
        try {
            return delegate.activeNodeCount();
        } finally {
            onExit();
        }
    }

    @Override
    public int nodeCount(int node) {
        onEnter("nodeCount");
        try {
            return delegate.nodeCount(node);
        } finally {
            onExit();
        }
    }

    @Override
    public BitSet support(int node) {
        onEnter("support");
        try {
            return delegate.support(node);
        } finally {
            onExit();
        }
    }

    @Override
    public BitSet supportTo(int node, BitSet bitSet) {
        onEnter("supportTo");
        try {
            return delegate.supportTo(node, bitSet);
        } finally {
            onExit();
        }
    }

    @Override
    public BitSet supportFilteredTo(int node, BitSet bitSet, BitSet filter) {
        onEnter("supportFilteredTo");
        try {
            return delegate.supportFilteredTo(node, bitSet, filter);
        } finally {
            onExit();
        }
    }

    @Override
    public int updateWith(int result, int inputNode) {
        onEnter("updateWith");
        try {
            return delegate.updateWith(result, inputNode);
        } finally {
            onExit();
        }
    }

    @Override
    public String statistics() {
        onEnter("statistics");
        try {
            return delegate.statistics();
        } finally {
            onExit();
        }
    }

    @Override
    public int zero() {
        onEnter("zero");
        try {
            return delegate.zero();
        } finally {
            onExit();
        }
    }

    @Override
    public int one() {
        onEnter("one");
        try {
            return delegate.one();
        } finally {
            onExit();
        }
    }

    @Override
    public int constant(double value) {
        onEnter("constant");
        try {
            return delegate.constant(value);
        } finally {
            onExit();
        }
    }

    @Override
    public double value(int leaf) {
        onEnter("value");
        try {
            return delegate.value(leaf);
        } finally {
            onExit();
        }
    }

    @Override
    public int low(int node) {
        onEnter("low");
        try {
            return delegate.low(node);
        } finally {
            onExit();
        }
    }

    @Override
    public int high(int node) {
        onEnter("high");
        try {
            return delegate.high(node);
        } finally {
            onExit();
        }
    }

    @Override
    public int makeNode(int variable, int low, int high) {
        onEnter("makeNode");
        try {
            return delegate.makeNode(variable, low, high);
        } finally {
            onExit();
        }
    }

    @Override
    public int createVariable() {
        onEnter("createVariable");
        try {
            return delegate.createVariable();
        } finally {
            onExit();
        }
    }

    @Override
    public int[] createVariables(int count) {
        onEnter("createVariables");
        try {
            return delegate.createVariables(count);
        } finally {
            onExit();
        }
    }

    @Override
    public int variableNode(int variable) {
        onEnter("variableNode");
        try {
            return delegate.variableNode(variable);
        } finally {
            onExit();
        }
    }

    @Override
    public int cube(int... variables) {
        onEnter("cube");
        try {
            return delegate.cube(variables);
        } finally {
            onExit();
        }
    }

    @Override
    public int cube(BitSet variables) {
        onEnter("cube");
        try {
            return delegate.cube(variables);
        } finally {
            onExit();
        }
    }

    @Override
    public boolean isCube(int node) {
        onEnter("isCube");
        try {
            return delegate.isCube(node);
        } finally {
            onExit();
        }
    }

    @Override
    public double evaluate(int node, BitSet assignment) {
        onEnter("evaluate");
        try {
            return delegate.evaluate(node, assignment);
        } finally {
            onExit();
        }
    }

    @Override
    public double evaluate(int node, boolean[] assignment) {
        onEnter("evaluate");
        try {
            return delegate.evaluate(node, assignment);
        } finally {
            onExit();
        }
    }

    @Override
    public int apply(BinaryOperation operation, int node1, int node2) {
        onEnter("apply");
        try {
            return delegate.apply(operation, node1, node2);
        } finally {
            onExit();
        }
    }

    @Override
    public int not(int node) {
        onEnter("not");
        try {
            return delegate.not(node);
        } finally {
            onExit();
        }
    }

    @Override
    public int ifThenElse(int ifNode, int thenNode, int elseNode) {
        onEnter("ifThenElse");
        try {
            return delegate.ifThenElse(ifNode, thenNode, elseNode);
        } finally {
            onExit();
        }
    }

    @Override
    public int abstractCube(Abstraction abstraction, int node, int cube) {
        onEnter("abstractCube");
        try {
            return delegate.abstractCube(abstraction, node, cube);
        } finally {
            onExit();
        }
    }

    @Override
    public int minRepresentative(int node, int cube) {
        onEnter("minRepresentative");
        try {
            return delegate.minRepresentative(node, cube);
        } finally {
            onExit();
        }
    }

    @Override
    public int maxRepresentative(int node, int cube) {
        onEnter("maxRepresentative");
        try {
            return delegate.maxRepresentative(node, cube);
        } finally {
            onExit();
        }
    }

    @Override
    public void reorder(int[] levelToVariable) {
        onEnter("reorder");
        try {
            delegate.reorder(levelToVariable);
        } finally {
            onExit();
        }
    }

    @Override
    public int reorderCount() {
        onEnter("reorderCount");
        try {
            return delegate.reorderCount();
        } finally {
            onExit();
        }
    }

    @Override
    public void setReorderingStrategy(@Nullable ReorderingStrategy strategy) {
        onEnter("setReorderingStrategy");
        try {
            delegate.setReorderingStrategy(strategy);
        } finally {
            onExit();
        }
    }

    @Override
    public void setAbortCheck(@Nullable BooleanSupplier shouldAbort) {
        onEnter("setAbortCheck");
        try {
            delegate.setAbortCheck(shouldAbort);
        } finally {
            onExit();
        }
    }

    @Override
    public int forceGc() {
        onEnter("forceGc");
        try {
            return delegate.forceGc();
        } finally {
            onExit();
        }
    }

    @Override
    public void invalidateCache() {
        onEnter("invalidateCache");
        try {
            delegate.invalidateCache();
        } finally {
            onExit();
        }
    }

    @Override
    public int consume(int result, int inputNode1, int inputNode2) {
        onEnter("consume");
        try {
            return delegate.consume(result, inputNode1, inputNode2);
        } finally {
            onExit();
        }
    }

    @Override
    public String toString() {
        return delegate.toString();
    }
}
