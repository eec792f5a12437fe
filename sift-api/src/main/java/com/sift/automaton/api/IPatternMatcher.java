/*
 * Copyright (c) 2025 Sift Automaton
 * Licensed under the Apache License, Version 2.0
 */
package com.sift.automaton.api;

import com.sift.automaton.api.model.AutomatonStats;
import com.sift.automaton.api.model.Match;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Contract for querying a compiled, immutable set of byte patterns.
 *
 * <p>Patterns are identified by their index in the collection the matcher
 * was built from. All queries operate on raw bytes; the {@code String}
 * overloads encode their argument with {@link #charset()} first, so the
 * reported positions are byte offsets in the encoded text.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IPatternMatcher matcher = compiler.compile(List.of("abcd", "bcde", "cdef"));
 *
 * matcher.hasString("abcd");   // true
 * matcher.hasString("abc");    // false
 * matcher.hasPrefix("abc");    // true
 *
 * for (Match match : matcher.searchIn("ZZbcdeXX")) {
 *     System.out.println(match.patternIndex() + " ends at " + match.position());
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations are not required to be thread-safe. See the
 * implementation for the conditions under which concurrent reads are allowed.
 */
public interface IPatternMatcher {

    /**
     * Tests whether {@code input} is exactly one of the patterns.
     *
     * @param input bytes to test (must not be null)
     * @return true if the whole input spells a pattern
     */
    boolean hasString(byte[] input);

    /**
     * Tests whether {@code input} is a prefix of at least one pattern.
     * The empty input is a prefix of every pattern set.
     *
     * @param input bytes to test (must not be null)
     * @return true if the whole input follows literal trie edges
     */
    boolean hasPrefix(byte[] input);

    /**
     * Scans {@code text} once and reports every pattern occurrence to
     * {@code handler}.
     *
     * @param text    bytes to scan (must not be null)
     * @param handler receives each occurrence (must not be null)
     */
    void searchIn(byte[] text, MatchHandler handler);

    /**
     * Returns structural and resolution statistics.
     */
    AutomatonStats stats();

    /**
     * Charset used by the {@code String} overloads.
     */
    default Charset charset() {
        return StandardCharsets.UTF_8;
    }

    /**
     * Scans {@code text} and collects every pattern occurrence in
     * left-to-right order of end position.
     *
     * @param text bytes to scan (must not be null)
     * @return matches as (1-based end position, pattern index) pairs
     */
    default List<Match> searchIn(byte[] text) {
        List<Match> matches = new ArrayList<>();
        searchIn(text, (position, patternIndex) -> matches.add(new Match(position, patternIndex)));
        return matches;
    }

    default boolean hasString(String input) {
        return hasString(input.getBytes(charset()));
    }

    default boolean hasPrefix(String input) {
        return hasPrefix(input.getBytes(charset()));
    }

    default List<Match> searchIn(String text) {
        return searchIn(text.getBytes(charset()));
    }

    default void searchIn(String text, MatchHandler handler) {
        searchIn(text.getBytes(charset()), handler);
    }
}
