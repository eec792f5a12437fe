/*
 * Copyright (c) 2025 Sift Automaton
 * Licensed under the Apache License, Version 2.0
 */
package com.sift.automaton.runtime.model;

/**
 * The compiled trie of one pattern set: its alphabet, its node arena and
 * the number of patterns inserted.
 */
public record PatternTrie(AlphabetCompactor alphabet, TrieNodeTable nodes, int patternCount) {
}
