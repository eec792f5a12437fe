/*
 * Copyright (c) 2025 Sift Automaton
 * Licensed under the Apache License, Version 2.0
 */
package com.sift.automaton.api;

import com.sift.automaton.api.exceptions.CompilationException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Contract for compiling pattern sets into a queryable matcher.
 */
public interface IPatternSetCompiler {

    /**
     * Compiles patterns from a file.
     *
     * @param patternsPath path to a pattern file
     * @return compiled matcher
     * @throws CompilationException if the file content is not a valid pattern set
     * @throws IOException          if the file cannot be read
     */
    IPatternMatcher compile(Path patternsPath) throws IOException;

    /**
     * Compiles an in-memory pattern list. Pattern indices follow list order.
     *
     * @param patterns patterns to compile
     * @return compiled matcher
     * @throws CompilationException if the list is not a valid pattern set
     */
    IPatternMatcher compile(List<String> patterns);
}
