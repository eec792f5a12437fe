package com.sift.automaton.api.model;

/**
 * Defines when the automaton resolves its suffix links and transitions.
 */
public enum ResolutionMode {
    /**
     * Resolve each suffix link and transition cell on first use.
     * Cheapest construction. Queries write to internal memo tables,
     * so the automaton must not be shared between threads.
     */
    LAZY,

    /**
     * Resolve every suffix link and transition cell at construction.
     * Queries become read-only and the automaton can be shared by
     * concurrent readers once safely published.
     */
    EAGER
}
