/*
 * Copyright (c) 2025 Sift Automaton
 * Licensed under the Apache License, Version 2.0
 */
package com.sift.automaton.runtime.model;

import it.unimi.dsi.fastutil.bytes.ByteArrayList;
import it.unimi.dsi.fastutil.bytes.ByteList;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A dictionary relabeling byte symbols to dense integer codes.
 *
 * Codes are assigned in order of first appearance across the pattern set,
 * so transition rows only need one cell per symbol actually used.
 * Symbols that never occur in a pattern stay {@link #UNMAPPED}.
 */
public final class AlphabetCompactor {

    public static final int UNMAPPED = -1;

    private static final int SYMBOL_COUNT = 1 << Byte.SIZE;

    private final int[] symbolToCode = new int[SYMBOL_COUNT];
    private final ByteList codeToSymbol = new ByteArrayList();

    private AlphabetCompactor() {
        Arrays.fill(symbolToCode, UNMAPPED);
    }

    /**
     * Builds the code map by scanning patterns in collection order and each
     * pattern left to right.
     *
     * @param patterns the pattern set (an empty set yields an empty alphabet)
     * @return the compacted alphabet
     */
    public static AlphabetCompactor fromPatterns(List<byte[]> patterns) {
        AlphabetCompactor alphabet = new AlphabetCompactor();
        for (byte[] pattern : patterns) {
            Objects.requireNonNull(pattern, "pattern");
            for (byte symbol : pattern) {
                alphabet.encode(symbol);
            }
        }
        return alphabet;
    }

    private int encode(byte symbol) {
        int slot = symbol & 0xFF;
        int code = symbolToCode[slot];
        if (code == UNMAPPED) {
            code = codeToSymbol.size();
            codeToSymbol.add(symbol);
            symbolToCode[slot] = code;
        }
        return code;
    }

    /**
     * Gets the code of a symbol.
     *
     * @return the code in {@code [0, size())}, or {@link #UNMAPPED}
     */
    public int codeOf(byte symbol) {
        return symbolToCode[symbol & 0xFF];
    }

    public boolean isMapped(byte symbol) {
        return codeOf(symbol) != UNMAPPED;
    }

    /**
     * Decodes a code back to its symbol.
     *
     * @throws IndexOutOfBoundsException if the code is not in {@code [0, size())}
     */
    public byte symbolOf(int code) {
        return codeToSymbol.getByte(code);
    }

    /**
     * Returns the number of distinct symbols used by the pattern set.
     */
    public int size() {
        return codeToSymbol.size();
    }
}
