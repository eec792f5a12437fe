/*
 * Copyright (c) 2025 Sift Automaton
 * Licensed under the Apache License, Version 2.0
 */
package com.sift.automaton.config;

import com.sift.automaton.api.model.ResolutionMode;

import java.io.FileInputStream;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration of a compiled automaton.
 *
 * <p><b>Environment Variable Override:</b>
 * Builder defaults can be overridden via environment variables:
 * <pre>
 * SIFT_RESOLUTION_MODE=EAGER
 * SIFT_CHARSET=ISO-8859-1
 * </pre>
 * Explicit builder calls take precedence over both.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * // Single-threaded use, cells resolved on demand
 * AutomatonConfig config = AutomatonConfig.defaults();
 *
 * // Shared between reader threads
 * AutomatonConfig config = AutomatonConfig.forConcurrentReads();
 *
 * // Custom
 * AutomatonConfig config = AutomatonConfig.builder()
 *     .resolutionMode(ResolutionMode.EAGER)
 *     .charset(StandardCharsets.ISO_8859_1)
 *     .build();
 * }</pre>
 */
public final class AutomatonConfig {

    private static final Logger logger = Logger.getLogger(AutomatonConfig.class.getName());

    private static final String ENV_RESOLUTION_MODE = "SIFT_RESOLUTION_MODE";
    private static final String ENV_CHARSET = "SIFT_CHARSET";

    private static final String PROP_RESOLUTION_MODE = "sift.resolution.mode";
    private static final String PROP_CHARSET = "sift.charset";

    private final ResolutionMode resolutionMode;
    private final Charset charset;

    private AutomatonConfig(Builder builder) {
        this.resolutionMode = Objects.requireNonNull(builder.resolutionMode, "resolutionMode");
        this.charset = Objects.requireNonNull(builder.charset, "charset");
    }

    /**
     * Lazy resolution, UTF-8 strings. Not safe for concurrent queries.
     */
    public static AutomatonConfig defaults() {
        return builder(false).build();
    }

    /**
     * Eager resolution so that queries never write to the automaton.
     */
    public static AutomatonConfig forConcurrentReads() {
        return builder(false)
                .resolutionMode(ResolutionMode.EAGER)
                .build();
    }

    /**
     * Create configuration from environment variables only.
     * Falls back to {@link #defaults()} values for unset variables.
     */
    public static AutomatonConfig fromEnvironment() {
        return builder().build();
    }

    /**
     * Load configuration from a properties file, searched on the classpath
     * first and then on the file system. Environment variables are applied
     * before the file, so file values win.
     *
     * <p><b>Example sift.properties:</b>
     * <pre>
     * sift.resolution.mode=EAGER
     * sift.charset=UTF-8
     * </pre>
     */
    public static AutomatonConfig loadFromProperties(String propertiesPath) {
        logger.info("Loading automaton configuration from: " + propertiesPath);

        Properties props = new Properties();
        try (InputStream is = AutomatonConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (Exception e) {
            logger.fine("Could not load from classpath: " + propertiesPath);
        }

        if (props.isEmpty()) {
            try (FileInputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (Exception e) {
                logger.warning("Could not load properties file: " + propertiesPath + ". Using defaults.");
            }
        }

        Builder builder = builder();
        parseResolutionMode(PROP_RESOLUTION_MODE, props.getProperty(PROP_RESOLUTION_MODE))
                .ifPresent(builder::resolutionMode);
        parseCharset(PROP_CHARSET, props.getProperty(PROP_CHARSET))
                .ifPresent(builder::charset);
        return builder.build();
    }

    public static Builder builder() {
        return builder(true);
    }

    private static Builder builder(boolean applyEnvironment) {
        Builder builder = new Builder();
        if (applyEnvironment) {
            builder.applyEnvironmentVariables();
        }
        return builder;
    }

    public Builder toBuilder() {
        return new Builder()
                .resolutionMode(resolutionMode)
                .charset(charset);
    }

    public ResolutionMode resolutionMode() {
        return resolutionMode;
    }

    public Charset charset() {
        return charset;
    }

    @Override
    public String toString() {
        return "AutomatonConfig{resolutionMode=" + resolutionMode + ", charset=" + charset.name() + "}";
    }

    public static class Builder {

        private ResolutionMode resolutionMode = ResolutionMode.LAZY;
        private Charset charset = StandardCharsets.UTF_8;

        private Builder() {
        }

        private void applyEnvironmentVariables() {
            parseResolutionMode(ENV_RESOLUTION_MODE, System.getenv(ENV_RESOLUTION_MODE))
                    .ifPresent(val -> this.resolutionMode = val);
            parseCharset(ENV_CHARSET, System.getenv(ENV_CHARSET))
                    .ifPresent(val -> this.charset = val);
        }

        public Builder resolutionMode(ResolutionMode mode) {
            this.resolutionMode = mode;
            return this;
        }

        public Builder charset(Charset charset) {
            this.charset = charset;
            return this;
        }

        public AutomatonConfig build() {
            return new AutomatonConfig(this);
        }
    }

    // ====================================================================
    // VALUE PARSING
    // ====================================================================

    static Optional<ResolutionMode> parseResolutionMode(String key, String value) {
        if (value == null || value.trim().isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(ResolutionMode.valueOf(value.trim().toUpperCase()));
        } catch (IllegalArgumentException e) {
            logger.warning("Invalid resolution mode for " + key + ": " + value);
            return Optional.empty();
        }
    }

    static Optional<Charset> parseCharset(String key, String value) {
        if (value == null || value.trim().isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Charset.forName(value.trim()));
        } catch (IllegalArgumentException e) {
            logger.warning("Invalid charset for " + key + ": " + value);
            return Optional.empty();
        }
    }
}
