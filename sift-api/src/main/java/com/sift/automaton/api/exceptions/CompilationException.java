/*
 * Copyright (c) 2025 Sift Automaton
 * Licensed under the Apache License, Version 2.0
 */
package com.sift.automaton.api.exceptions;

/**
 * Thrown when a pattern file or pattern list cannot be turned into an
 * automaton: an empty set, a null or empty pattern, or a pattern file
 * that is not a JSON array of strings. The message names the offending
 * file or pattern index.
 */
public class CompilationException extends RuntimeException {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
