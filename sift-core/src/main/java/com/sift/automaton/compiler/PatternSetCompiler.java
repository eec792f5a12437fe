/*
 * Copyright (c) 2025 Sift Automaton
 * Licensed under the Apache License, Version 2.0
 */
package com.sift.automaton.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sift.automaton.api.IPatternSetCompiler;
import com.sift.automaton.api.exceptions.CompilationException;
import com.sift.automaton.api.model.AutomatonStats;
import com.sift.automaton.config.AutomatonConfig;
import com.sift.automaton.runtime.evaluation.AhoCorasickAutomaton;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Compiles pattern files and pattern lists into {@link AhoCorasickAutomaton}s.
 *
 * Supported pattern files:
 * - {@code *.json}: a JSON array of strings, e.g. {@code ["abcd", "bcde"]}
 * - anything else: UTF-8 text with one pattern per line; empty lines are skipped
 *
 * Pattern indices follow the order of the patterns in the file or list.
 */
public class PatternSetCompiler implements IPatternSetCompiler {
    private static final Logger logger = Logger.getLogger(PatternSetCompiler.class.getName());
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Tracer tracer;
    private final AutomatonConfig config;

    public PatternSetCompiler(Tracer tracer) {
        this(tracer, AutomatonConfig.defaults());
    }

    public PatternSetCompiler(Tracer tracer, AutomatonConfig config) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Compiles patterns from a file.
     *
     * @param patternsPath Path to a {@code .json} or line-based pattern file.
     * @return A compiled automaton.
     * @throws IOException If the file cannot be read.
     * @throws CompilationException If the file content is not a valid pattern set.
     */
    @Override
    public AhoCorasickAutomaton compile(Path patternsPath) throws IOException {
        Span span = tracer.spanBuilder("load-pattern-file").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("patternFile", patternsPath.toString());
            List<String> patterns = isJson(patternsPath) ? loadJson(patternsPath) : loadLines(patternsPath);
            return compile(patterns);
        } catch (IOException | CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Compiles an in-memory pattern list.
     *
     * @throws CompilationException If the list is empty or holds a null or empty pattern.
     */
    @Override
    public AhoCorasickAutomaton compile(List<String> patterns) {
        Span span = tracer.spanBuilder("compile-pattern-set").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();

            validate(patterns);
            span.setAttribute("patternCount", patterns.size());

            AhoCorasickAutomaton automaton = AhoCorasickAutomaton.fromStrings(patterns, config);

            long compilationTime = System.nanoTime() - startTime;
            AutomatonStats stats = automaton.stats();
            span.setAttribute("nodeCount", stats.nodeCount());
            span.setAttribute("codeSize", stats.codeSize());
            span.setAttribute("resolutionMode", config.resolutionMode().name());
            span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(compilationTime));

            logger.info(String.format("Compiled %d patterns into %d nodes over %d symbols (%s) in %.2f ms",
                    stats.patternCount(), stats.nodeCount(), stats.codeSize(),
                    config.resolutionMode(), compilationTime / 1_000_000.0));
            return automaton;
        } catch (CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static boolean isJson(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }

    private List<String> loadJson(Path path) throws IOException {
        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(path));
        } catch (JsonProcessingException e) {
            throw new CompilationException("Malformed pattern file " + path + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new CompilationException("Pattern file " + path + " must contain a JSON array of strings");
        }

        List<String> patterns = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            JsonNode element = root.get(i);
            if (element.isNull()) {
                patterns.add(null);
            } else if (element.isTextual()) {
                patterns.add(element.textValue());
            } else {
                throw new CompilationException("Pattern at index " + i + " is not a string: " + element);
            }
        }
        return patterns;
    }

    private static List<String> loadLines(Path path) throws IOException {
        List<String> patterns = new ArrayList<>();
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            if (!line.isEmpty()) {
                patterns.add(line);
            }
        }
        return patterns;
    }

    /**
     * Ensures the pattern set can be compiled. Duplicate patterns are
     * allowed; the later index is the one reported.
     */
    private static void validate(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new CompilationException("Pattern set cannot be empty");
        }
        for (int i = 0; i < patterns.size(); i++) {
            String pattern = patterns.get(i);
            if (pattern == null) {
                throw new CompilationException("Pattern at index " + i + " is null");
            }
            if (pattern.isEmpty()) {
                throw new CompilationException("Pattern at index " + i + " is empty");
            }
        }
    }
}
