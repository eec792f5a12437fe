/*
 * Copyright (c) 2025 Sift Automaton
 * Licensed under the Apache License, Version 2.0
 */
package com.sift.automaton.runtime.evaluation;

import com.sift.automaton.runtime.model.TrieNodeTable;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import static com.sift.automaton.runtime.model.TrieNodeTable.NO_NODE;
import static com.sift.automaton.runtime.model.TrieNodeTable.ROOT;
import static com.sift.automaton.runtime.model.TrieNodeTable.UNRESOLVED;

/**
 * Computes the total Aho-Corasick transition function one cell at a time.
 *
 * <p>{@code goto(node, code)} is the literal trie child when one exists,
 * the root when {@code node} is the root, and otherwise
 * {@code goto(link(node), code)}. Every cell is written once into the
 * node's goto row and never recomputed, so the total work over the life of
 * the automaton is bounded by {@code nodes * codeSize} cells no matter how
 * many queries run.
 */
final class TransitionResolver {

    private final TrieNodeTable nodes;
    private final SuffixLinkResolver suffixLinks;
    private long resolvedTransitions;

    TransitionResolver(TrieNodeTable nodes) {
        this.nodes = nodes;
        this.suffixLinks = new SuffixLinkResolver(nodes, this::transition);
    }

    int transition(int node, int code) {
        int[] row = nodes.gotoRow(node);
        int target = row[code];
        if (target != UNRESOLVED) {
            return target;
        }
        int child = nodes.child(node, code);
        if (child != NO_NODE || node == ROOT) {
            row[code] = child != NO_NODE ? child : ROOT;
            resolvedTransitions++;
            return row[code];
        }

        // walk the failure chain; every node passed on the way gets the same target
        IntArrayList chain = new IntArrayList();
        int current = node;
        while (true) {
            target = nodes.gotoRow(current)[code];
            if (target != UNRESOLVED) {
                break;
            }
            chain.add(current);
            child = nodes.child(current, code);
            if (child != NO_NODE) {
                target = child;
                break;
            }
            if (current == ROOT) {
                target = ROOT;
                break;
            }
            current = suffixLinks.link(current);
        }
        for (int i = 0; i < chain.size(); i++) {
            nodes.gotoRow(chain.getInt(i))[code] = target;
        }
        resolvedTransitions += chain.size();
        return target;
    }

    SuffixLinkResolver suffixLinks() {
        return suffixLinks;
    }

    /**
     * Resolves every suffix link, output link and transition cell.
     *
     * <p>Nodes are visited breadth-first, so every link a node depends on
     * points to a shallower node that is already complete.
     */
    void resolveAll() {
        int codeSize = nodes.codeSize();
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(ROOT);

        while (!queue.isEmpty()) {
            int node = queue.dequeueInt();
            suffixLinks.link(node);
            suffixLinks.outputLink(node);
            for (int code = 0; code < codeSize; code++) {
                transition(node, code);
                int child = nodes.child(node, code);
                if (child != NO_NODE) {
                    queue.enqueue(child);
                }
            }
        }
    }

    long resolvedTransitions() {
        return resolvedTransitions;
    }
}
