/*
 * Copyright (c) 2025 Sift Automaton
 * Licensed under the Apache License, Version 2.0
 */
package com.sift.automaton.runtime.evaluation;

import com.sift.automaton.runtime.model.TrieNodeTable;

/**
 * Query cursor pointing at one node of an automaton.
 *
 * <p>A state is an immutable view: it caches the node's depth and pattern
 * index and holds no mutable automaton data, so it is safe to copy and
 * keep. It is only valid for the automaton (and pattern set) that produced
 * it; passing it to another automaton, or to the same one after
 * {@link AhoCorasickAutomaton#reset}, is rejected.
 */
public final class AutomatonState {

    private final TrieNodeTable owner;
    private final int node;
    private final int depth;
    private final int leaf;

    AutomatonState(TrieNodeTable owner, int node) {
        this.owner = owner;
        this.node = node;
        this.depth = owner.depth(node);
        this.leaf = owner.leaf(node);
    }

    public int depth() {
        return depth;
    }

    public boolean isRoot() {
        return node == TrieNodeTable.ROOT;
    }

    public boolean isLeaf() {
        return leaf != TrieNodeTable.NO_NODE;
    }

    /**
     * Returns the index of the pattern this state spells.
     *
     * @throws IllegalStateException if this state is not a leaf
     */
    public int patternIndex() {
        if (!isLeaf()) {
            throw new IllegalStateException("State at depth " + depth + " does not end a pattern");
        }
        return leaf;
    }

    /**
     * Tests whether this state extends {@code previous} by exactly one
     * literal symbol, as opposed to having fallen back along a suffix link.
     */
    public boolean isNextTo(AutomatonState previous) {
        return depth == previous.depth + 1;
    }

    int node() {
        return node;
    }

    boolean belongsTo(TrieNodeTable table) {
        return owner == table;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AutomatonState other)) return false;
        return owner == other.owner && node == other.node;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(owner) + node;
    }

    @Override
    public String toString() {
        return isLeaf()
                ? String.format("AutomatonState{node=%d, depth=%d, pattern=%d}", node, depth, leaf)
                : String.format("AutomatonState{node=%d, depth=%d}", node, depth);
    }
}
