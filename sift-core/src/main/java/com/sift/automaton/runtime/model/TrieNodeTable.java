/*
 * Copyright (c) 2025 Sift Automaton
 * Licensed under the Apache License, Version 2.0
 */
package com.sift.automaton.runtime.model;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.Arrays;

/**
 * Index-addressed arena of trie nodes.
 *
 * It uses a Structure-of-Arrays (SoA) layout: every per-node attribute
 * lives in its own primitive list and a node is just its index, so the
 * mutually recursive resolvers never hold object references to each other.
 * The root is always node {@link #ROOT}.
 *
 * Two sentinels are used and never mixed:
 * <ul>
 *   <li>{@link #NO_NODE} - a resolved "nothing" (no edge, no leaf, no output)</li>
 *   <li>{@link #UNRESOLVED} - a memo cell that has not been computed yet</li>
 * </ul>
 */
public final class TrieNodeTable {

    public static final int ROOT = 0;
    public static final int NO_NODE = -1;
    public static final int UNRESOLVED = -2;

    private final int codeSize;

    // --- Trie structure (written by the builder only) ---
    private final IntArrayList depths = new IntArrayList();
    private final IntArrayList parents = new IntArrayList();
    private final IntArrayList parentCodes = new IntArrayList();
    private final IntArrayList leaves = new IntArrayList();
    private final ObjectArrayList<int[]> trieEdges = new ObjectArrayList<>();

    // --- Memo cells (written once by the resolvers) ---
    private final IntArrayList suffixLinks = new IntArrayList();
    private final IntArrayList outputLinks = new IntArrayList();
    private final ObjectArrayList<int[]> gotoRows = new ObjectArrayList<>();

    public TrieNodeTable(int codeSize) {
        if (codeSize < 0) {
            throw new IllegalArgumentException("codeSize must not be negative: " + codeSize);
        }
        this.codeSize = codeSize;
        appendNode(NO_NODE, NO_NODE, 0);
    }

    private int appendNode(int parent, int parentCode, int depth) {
        int index = depths.size();
        depths.add(depth);
        parents.add(parent);
        parentCodes.add(parentCode);
        leaves.add(NO_NODE);
        trieEdges.add(null);
        suffixLinks.add(UNRESOLVED);
        outputLinks.add(UNRESOLVED);
        gotoRows.add(null);
        return index;
    }

    /**
     * Returns the child of {@code node} along {@code code}, creating it
     * if the literal edge does not exist yet.
     */
    public int childOrCreate(int node, int code) {
        int[] edges = trieEdges.get(node);
        if (edges == null) {
            edges = newRow(NO_NODE);
            trieEdges.set(node, edges);
        }
        int child = edges[code];
        if (child == NO_NODE) {
            child = appendNode(node, code, depths.getInt(node) + 1);
            edges[code] = child;
        }
        return child;
    }

    /**
     * Returns the literal trie child of {@code node} along {@code code},
     * or {@link #NO_NODE}.
     */
    public int child(int node, int code) {
        int[] edges = trieEdges.get(node);
        return edges == null ? NO_NODE : edges[code];
    }

    public boolean hasChildren(int node) {
        return trieEdges.get(node) != null;
    }

    public void markLeaf(int node, int patternIndex) {
        leaves.set(node, patternIndex);
    }

    public int leaf(int node) {
        return leaves.getInt(node);
    }

    public boolean isLeaf(int node) {
        return leaves.getInt(node) != NO_NODE;
    }

    public int depth(int node) {
        return depths.getInt(node);
    }

    public int parent(int node) {
        return parents.getInt(node);
    }

    public int parentCode(int node) {
        return parentCodes.getInt(node);
    }

    public int suffixLink(int node) {
        return suffixLinks.getInt(node);
    }

    public void setSuffixLink(int node, int link) {
        suffixLinks.set(node, link);
    }

    public int outputLink(int node) {
        return outputLinks.getInt(node);
    }

    public void setOutputLink(int node, int output) {
        outputLinks.set(node, output);
    }

    /**
     * Returns the resolved-transition row of {@code node}, allocating it
     * (all cells {@link #UNRESOLVED}) on first access.
     */
    public int[] gotoRow(int node) {
        int[] row = gotoRows.get(node);
        if (row == null) {
            row = newRow(UNRESOLVED);
            gotoRows.set(node, row);
        }
        return row;
    }

    private int[] newRow(int fill) {
        int[] row = new int[codeSize];
        Arrays.fill(row, fill);
        return row;
    }

    public int size() {
        return depths.size();
    }

    public int codeSize() {
        return codeSize;
    }
}
