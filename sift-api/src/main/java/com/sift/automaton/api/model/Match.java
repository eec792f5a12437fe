/*
 * Copyright (c) 2025 Sift Automaton
 * Licensed under the Apache License, Version 2.0
 */
package com.sift.automaton.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A single pattern occurrence found by a search.
 *
 * @param position     1-based position just past the last matched byte
 * @param patternIndex index of the matched pattern in insertion order
 */
public record Match(
    @JsonProperty("position") long position,
    @JsonProperty("pattern_index") int patternIndex
) implements Serializable {

    /**
     * Returns the 0-based offset of the first matched byte, given the
     * length of the matched pattern.
     */
    public long startOffset(int patternLength) {
        return position - patternLength;
    }
}
