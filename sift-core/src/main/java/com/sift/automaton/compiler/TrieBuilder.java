/*
 * Copyright (c) 2025 Sift Automaton
 * Licensed under the Apache License, Version 2.0
 */
package com.sift.automaton.compiler;

import com.sift.automaton.runtime.model.AlphabetCompactor;
import com.sift.automaton.runtime.model.PatternTrie;
import com.sift.automaton.runtime.model.TrieNodeTable;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Inserts a pattern set into a fresh trie keyed by compacted symbol codes.
 *
 * <p>Each pattern walks the trie from the root and creates a node for every
 * missing edge. The node it lands on is marked with the pattern's index;
 * when the same pattern occurs twice the later index wins.
 */
public final class TrieBuilder {
    private static final Logger logger = Logger.getLogger(TrieBuilder.class.getName());

    private TrieBuilder() {
    }

    /**
     * Builds the trie for {@code patterns}.
     *
     * @param patterns ordered pattern set, indices follow list order
     * @return the compiled trie
     * @throws NullPointerException     if the list or any pattern is null
     * @throws IllegalArgumentException if a pattern is empty
     */
    public static PatternTrie build(List<byte[]> patterns) {
        Objects.requireNonNull(patterns, "patterns");
        for (int i = 0; i < patterns.size(); i++) {
            byte[] pattern = Objects.requireNonNull(patterns.get(i), "pattern at index " + i);
            if (pattern.length == 0) {
                throw new IllegalArgumentException("Pattern at index " + i + " is empty");
            }
        }

        AlphabetCompactor alphabet = AlphabetCompactor.fromPatterns(patterns);
        TrieNodeTable nodes = new TrieNodeTable(alphabet.size());

        for (int patternIndex = 0; patternIndex < patterns.size(); patternIndex++) {
            int node = TrieNodeTable.ROOT;
            for (byte symbol : patterns.get(patternIndex)) {
                node = nodes.childOrCreate(node, alphabet.codeOf(symbol));
            }
            nodes.markLeaf(node, patternIndex);
        }

        logger.fine(String.format("Built trie: %d patterns, %d nodes, %d symbol codes",
                patterns.size(), nodes.size(), alphabet.size()));
        return new PatternTrie(alphabet, nodes, patterns.size());
    }
}
