/*
 * Copyright (c) 2025 Sift Automaton
 * Licensed under the Apache License, Version 2.0
 */
package com.sift.automaton.runtime.evaluation;

import com.sift.automaton.runtime.model.TrieNodeTable;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.function.IntBinaryOperator;

import static com.sift.automaton.runtime.model.TrieNodeTable.NO_NODE;
import static com.sift.automaton.runtime.model.TrieNodeTable.ROOT;
import static com.sift.automaton.runtime.model.TrieNodeTable.UNRESOLVED;

/**
 * Resolves failure links on demand and memoizes them in the node table.
 *
 * <p>The link of a node is the node of its longest proper suffix that is
 * also a trie prefix. It is defined through the transition function:
 * {@code link(v) = goto(link(parent(v)), parentCode(v))}, with the root and
 * the root's children linking to the root. Every dependency of a link is
 * a strictly shallower node, so resolution terminates.
 */
final class SuffixLinkResolver {

    private final TrieNodeTable nodes;
    private final IntBinaryOperator transitions;
    private long resolvedLinks;

    /**
     * @param nodes       node arena holding the memo cells
     * @param transitions the goto function, as {@code (node, code) -> node}
     */
    SuffixLinkResolver(TrieNodeTable nodes, IntBinaryOperator transitions) {
        this.nodes = nodes;
        this.transitions = transitions;
    }

    /**
     * Returns the suffix link of {@code node}, resolving it on first use.
     *
     * <p>A link is stored only once the links of the node's ancestors and
     * of its target are stored, so every resolved node has a fully resolved
     * failure chain. Pending nodes are kept on an explicit stack; resolution
     * depth never depends on pattern length.
     */
    int link(int node) {
        int link = nodes.suffixLink(node);
        if (link != UNRESOLVED) {
            return link;
        }

        IntArrayList pending = new IntArrayList();
        pending.add(node);
        while (!pending.isEmpty()) {
            int current = pending.getInt(pending.size() - 1);
            if (nodes.suffixLink(current) != UNRESOLVED) {
                pending.removeInt(pending.size() - 1);
                continue;
            }
            if (current == ROOT) {
                store(current, ROOT);
                continue;
            }
            int parent = nodes.parent(current);
            int parentLink = nodes.suffixLink(parent);
            if (parentLink == UNRESOLVED) {
                pending.add(parent);
                continue;
            }
            int target = parent == ROOT
                    ? ROOT
                    : transitions.applyAsInt(parentLink, nodes.parentCode(current));
            if (nodes.suffixLink(target) == UNRESOLVED) {
                pending.add(target);
                continue;
            }
            store(current, target);
        }
        return nodes.suffixLink(node);
    }

    private void store(int node, int link) {
        nodes.setSuffixLink(node, link);
        resolvedLinks++;
    }

    /**
     * Returns the nearest node on the proper suffix chain of {@code node}
     * that ends a pattern, or {@link TrieNodeTable#NO_NODE}.
     */
    int outputLink(int node) {
        int output = nodes.outputLink(node);
        if (output != UNRESOLVED) {
            return output;
        }

        // every node on the walked chain links to a non-leaf, so they share one answer
        IntArrayList chain = new IntArrayList();
        int current = node;
        while (true) {
            chain.add(current);
            int link = link(current);
            if (current == ROOT || link == ROOT) {
                output = NO_NODE;
                break;
            }
            if (nodes.isLeaf(link)) {
                output = link;
                break;
            }
            output = nodes.outputLink(link);
            if (output != UNRESOLVED) {
                break;
            }
            current = link;
        }
        for (int i = 0; i < chain.size(); i++) {
            nodes.setOutputLink(chain.getInt(i), output);
        }
        return output;
    }

    long resolvedLinks() {
        return resolvedLinks;
    }
}
