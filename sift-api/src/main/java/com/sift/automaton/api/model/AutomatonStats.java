/*
 * Copyright (c) 2025 Sift Automaton
 * Licensed under the Apache License, Version 2.0
 */
package com.sift.automaton.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Point-in-time statistics of a compiled automaton.
 *
 * <p>The resolved counters grow while a lazily resolved automaton is
 * queried and stay constant once every cell has been computed.
 */
public record AutomatonStats(
    @JsonProperty("pattern_count") int patternCount,
    @JsonProperty("node_count") int nodeCount,
    @JsonProperty("code_size") int codeSize,
    @JsonProperty("resolved_transitions") long resolvedTransitions,
    @JsonProperty("resolved_suffix_links") long resolvedSuffixLinks
) implements Serializable {

    /**
     * Total number of transition cells the automaton can hold.
     */
    public long transitionCapacity() {
        return (long) nodeCount * codeSize;
    }

    /**
     * Fraction of transition cells resolved so far (0.0 - 1.0).
     */
    public double resolvedTransitionRatio() {
        long capacity = transitionCapacity();
        return capacity > 0 ? (double) resolvedTransitions / capacity : 0.0;
    }
}
