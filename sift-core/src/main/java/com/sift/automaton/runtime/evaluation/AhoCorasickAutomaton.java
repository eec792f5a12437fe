/*
 * Copyright (c) 2025 Sift Automaton
 * Licensed under the Apache License, Version 2.0
 */
package com.sift.automaton.runtime.evaluation;

import com.sift.automaton.api.IPatternMatcher;
import com.sift.automaton.api.MatchHandler;
import com.sift.automaton.api.model.AutomatonStats;
import com.sift.automaton.api.model.ResolutionMode;
import com.sift.automaton.compiler.TrieBuilder;
import com.sift.automaton.config.AutomatonConfig;
import com.sift.automaton.runtime.model.AlphabetCompactor;
import com.sift.automaton.runtime.model.PatternTrie;
import com.sift.automaton.runtime.model.TrieNodeTable;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import static com.sift.automaton.runtime.model.TrieNodeTable.NO_NODE;
import static com.sift.automaton.runtime.model.TrieNodeTable.ROOT;

/**
 * Aho-Corasick automaton over a byte alphabet with lazily resolved
 * suffix links and transitions.
 *
 * <p>The trie is built up front. Suffix links and transition cells are
 * computed the first time a query needs them and cached for the life of
 * the pattern set, so only the part of the automaton that the input
 * actually exercises is ever resolved.
 *
 * <h2>Queries</h2>
 * <ul>
 *   <li>{@link #hasString(byte[])} - exact membership; every step must be a
 *       literal one-symbol extension and the walk must end on a pattern</li>
 *   <li>{@link #hasPrefix(byte[])} - same walk without the final check</li>
 *   <li>{@link #searchIn(byte[], MatchHandler)} - a single linear pass over a
 *       text reporting every occurrence of every pattern</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>With {@link ResolutionMode#LAZY} (the default) queries write into the
 * memo tables and the automaton must be confined to one thread. With
 * {@link ResolutionMode#EAGER} every cell is resolved by the constructor and
 * by {@link #reset}, after which queries only read and the automaton may
 * be shared by concurrent readers once safely published. {@code reset}
 * itself is never safe to run concurrently with queries.
 */
public final class AhoCorasickAutomaton implements IPatternMatcher {
    private static final Logger logger = Logger.getLogger(AhoCorasickAutomaton.class.getName());

    private final AutomatonConfig config;

    private AlphabetCompactor alphabet;
    private TrieNodeTable nodes;
    private TransitionResolver transitions;
    private SuffixLinkResolver suffixLinks;
    private AutomatonState initialState;
    private int patternCount;

    public AhoCorasickAutomaton(List<byte[]> patterns) {
        this(patterns, AutomatonConfig.defaults());
    }

    public AhoCorasickAutomaton(List<byte[]> patterns, AutomatonConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        reset(patterns);
    }

    /**
     * Builds an automaton from strings encoded with the configured charset.
     */
    public static AhoCorasickAutomaton fromStrings(Collection<String> patterns, AutomatonConfig config) {
        Objects.requireNonNull(patterns, "patterns");
        Charset charset = config.charset();
        List<byte[]> encoded = new ArrayList<>(patterns.size());
        for (String pattern : patterns) {
            encoded.add(Objects.requireNonNull(pattern, "pattern").getBytes(charset));
        }
        return new AhoCorasickAutomaton(encoded, config);
    }

    public static AhoCorasickAutomaton fromStrings(Collection<String> patterns) {
        return fromStrings(patterns, AutomatonConfig.defaults());
    }

    /**
     * Discards all prior state and rebuilds the automaton for {@code patterns}.
     * States obtained before the reset are no longer accepted.
     *
     * @throws NullPointerException     if the list or any pattern is null
     * @throws IllegalArgumentException if a pattern is empty
     */
    public void reset(List<byte[]> patterns) {
        PatternTrie trie = TrieBuilder.build(patterns);
        this.alphabet = trie.alphabet();
        this.nodes = trie.nodes();
        this.patternCount = trie.patternCount();
        this.transitions = new TransitionResolver(nodes);
        this.suffixLinks = transitions.suffixLinks();
        this.initialState = new AutomatonState(nodes, ROOT);

        if (config.resolutionMode() == ResolutionMode.EAGER) {
            long start = System.nanoTime();
            transitions.resolveAll();
            logger.fine(String.format("Eagerly resolved %d transitions over %d nodes in %.2f ms",
                    transitions.resolvedTransitions(), nodes.size(), (System.nanoTime() - start) / 1_000_000.0));
        }
    }

    // ==================== State traversal ====================

    public AutomatonState initialState() {
        return initialState;
    }

    /**
     * Returns the state reached by consuming {@code symbol} from the initial state.
     */
    public AutomatonState getState(byte symbol) {
        return switchState(symbol, initialState);
    }

    /**
     * Returns the state reached by consuming {@code symbol} from {@code state}.
     * A symbol that occurs in no pattern leads back to the initial state.
     *
     * @throws IllegalArgumentException if {@code state} does not belong to this pattern set
     */
    public AutomatonState switchState(byte symbol, AutomatonState state) {
        int node = step(symbol, nodeOf(state));
        return node == state.node() ? state : new AutomatonState(nodes, node);
    }

    /**
     * Returns the failure target of {@code state}: the state of its longest
     * proper suffix that is also a prefix of some pattern. The initial
     * state links to itself.
     *
     * @throws IllegalArgumentException if {@code state} does not belong to this pattern set
     */
    public AutomatonState suffixLink(AutomatonState state) {
        return new AutomatonState(nodes, suffixLinks.link(nodeOf(state)));
    }

    // ==================== Queries ====================

    @Override
    public boolean hasString(byte[] input) {
        int node = walkLiteral(input);
        return node != NO_NODE && nodes.isLeaf(node);
    }

    @Override
    public boolean hasPrefix(byte[] input) {
        return walkLiteral(input) != NO_NODE;
    }

    @Override
    public void searchIn(byte[] text, MatchHandler handler) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(handler, "handler");

        int node = ROOT;
        for (int i = 0; i < text.length; i++) {
            node = step(text[i], node);
            emitMatches(node, i + 1L, handler);
        }
    }

    /**
     * Opens a searcher that scans text delivered in consecutive chunks.
     */
    public StreamingSearcher newSearcher() {
        return new StreamingSearcher(this);
    }

    @Override
    public AutomatonStats stats() {
        return new AutomatonStats(
                patternCount,
                nodes.size(),
                alphabet.size(),
                transitions.resolvedTransitions(),
                suffixLinks.resolvedLinks());
    }

    @Override
    public Charset charset() {
        return config.charset();
    }

    public AutomatonConfig config() {
        return config;
    }

    // ==================== Internals ====================

    /**
     * Walks {@code input} from the root and returns the landing node, or
     * {@link TrieNodeTable#NO_NODE} as soon as a step is not a literal
     * one-symbol extension.
     */
    private int walkLiteral(byte[] input) {
        Objects.requireNonNull(input, "input");
        int node = ROOT;
        for (byte symbol : input) {
            int next = step(symbol, node);
            if (nodes.depth(next) != nodes.depth(node) + 1) {
                return NO_NODE;
            }
            node = next;
        }
        return node;
    }

    int step(byte symbol, int node) {
        int code = alphabet.codeOf(symbol);
        if (code == AlphabetCompactor.UNMAPPED) {
            return ROOT;
        }
        return transitions.transition(node, code);
    }

    /**
     * Reports the pattern ending at {@code node} and every pattern on its
     * output chain, longest first. Returns whether anything was reported.
     */
    boolean emitMatches(int node, long position, MatchHandler handler) {
        boolean matched = false;
        if (nodes.isLeaf(node)) {
            handler.onMatch(position, nodes.leaf(node));
            matched = true;
        }
        for (int output = suffixLinks.outputLink(node); output != NO_NODE; output = suffixLinks.outputLink(output)) {
            handler.onMatch(position, nodes.leaf(output));
            matched = true;
        }
        return matched;
    }

    boolean endsPattern(int node) {
        return nodes.isLeaf(node) || suffixLinks.outputLink(node) != NO_NODE;
    }

    TrieNodeTable nodes() {
        return nodes;
    }

    AutomatonState stateOf(int node) {
        return new AutomatonState(nodes, node);
    }

    int nodeOf(AutomatonState state) {
        Objects.requireNonNull(state, "state");
        if (!state.belongsTo(nodes)) {
            throw new IllegalArgumentException("State does not belong to this automaton's current pattern set");
        }
        return state.node();
    }
}
