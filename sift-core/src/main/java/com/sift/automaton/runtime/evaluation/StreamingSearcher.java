/*
 * Copyright (c) 2025 Sift Automaton
 * Licensed under the Apache License, Version 2.0
 */
package com.sift.automaton.runtime.evaluation;

import com.sift.automaton.api.MatchHandler;
import com.sift.automaton.runtime.model.TrieNodeTable;

import java.util.Objects;

import static com.sift.automaton.runtime.model.TrieNodeTable.ROOT;

/**
 * Byte-at-a-time search cursor over one automaton.
 *
 * <p>The searcher keeps the current automaton node and the absolute
 * position across calls, so a text can be fed in arbitrary chunks and a
 * pattern split over a chunk boundary is still found. Positions are
 * 1-based and count every byte consumed since the last {@link #reset()}.
 *
 * <pre>{@code
 * StreamingSearcher searcher = automaton.newSearcher();
 * for (byte[] chunk : chunks) {
 *     searcher.feed(chunk, (position, patternIndex) -> ...);
 * }
 * }</pre>
 *
 * <p>Not thread-safe. A searcher is bound to the pattern set that was
 * current when it was opened and fails once the automaton is reset.
 */
public final class StreamingSearcher {

    private final AhoCorasickAutomaton automaton;
    private final TrieNodeTable nodes;
    private int currentNode = ROOT;
    private long position;

    StreamingSearcher(AhoCorasickAutomaton automaton) {
        this.automaton = automaton;
        this.nodes = automaton.nodes();
    }

    /**
     * Consumes one byte.
     *
     * @return true if at least one pattern ends at this byte
     */
    public boolean process(byte value) {
        ensureCurrent();
        currentNode = automaton.step(value, currentNode);
        position++;
        return automaton.endsPattern(currentNode);
    }

    /**
     * Consumes a chunk and reports every pattern occurrence ending in it.
     *
     * @return the number of occurrences reported
     */
    public int feed(byte[] chunk, MatchHandler handler) {
        return feed(chunk, 0, chunk.length, handler);
    }

    /**
     * Consumes {@code length} bytes of {@code chunk} starting at {@code offset}.
     *
     * @return the number of occurrences reported
     */
    public int feed(byte[] chunk, int offset, int length, MatchHandler handler) {
        Objects.requireNonNull(chunk, "chunk");
        Objects.requireNonNull(handler, "handler");
        Objects.checkFromIndexSize(offset, length, chunk.length);
        ensureCurrent();

        int[] reported = {0};
        MatchHandler counting = (pos, patternIndex) -> {
            reported[0]++;
            handler.onMatch(pos, patternIndex);
        };

        int node = currentNode;
        long pos = position;
        for (int i = offset; i < offset + length; i++) {
            node = automaton.step(chunk[i], node);
            pos++;
            automaton.emitMatches(node, pos, counting);
        }
        currentNode = node;
        position = pos;
        return reported[0];
    }

    /**
     * Returns the state reached after the bytes consumed so far.
     */
    public AutomatonState currentState() {
        ensureCurrent();
        return automaton.stateOf(currentNode);
    }

    /**
     * Number of bytes consumed since the last reset.
     */
    public long position() {
        return position;
    }

    public void reset() {
        currentNode = ROOT;
        position = 0;
    }

    private void ensureCurrent() {
        if (automaton.nodes() != nodes) {
            throw new IllegalStateException("Automaton was reset; open a new searcher");
        }
    }
}
