/*
 * Copyright (c) 2025 Sift Automaton
 * Licensed under the Apache License, Version 2.0
 */
package com.sift.automaton.api;

/**
 * Callback receiving pattern occurrences as a search finds them.
 *
 * <p>Matches arrive in increasing order of end position. For one end
 * position, longer patterns are reported before the patterns that are
 * their suffixes.
 */
@FunctionalInterface
public interface MatchHandler {

    /**
     * @param position     1-based position just past the last matched byte
     * @param patternIndex index of the matched pattern in insertion order
     */
    void onMatch(long position, int patternIndex);
}
