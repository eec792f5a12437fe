package com.sift.automaton.config;

import com.sift.automaton.api.model.ResolutionMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AutomatonConfigTest {

    @Test
    @DisplayName("Should default to lazy resolution and UTF-8")
    void shouldProvideDefaults() {
        AutomatonConfig config = AutomatonConfig.defaults();

        assertThat(config.resolutionMode()).isEqualTo(ResolutionMode.LAZY);
        assertThat(config.charset()).isEqualTo(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should resolve eagerly for concurrent readers")
    void shouldResolveEagerlyForConcurrentReads() {
        assertThat(AutomatonConfig.forConcurrentReads().resolutionMode()).isEqualTo(ResolutionMode.EAGER);
    }

    @Test
    @DisplayName("Should let explicit builder values win")
    void shouldApplyBuilderValues() {
        AutomatonConfig config = AutomatonConfig.builder()
                .resolutionMode(ResolutionMode.EAGER)
                .charset(StandardCharsets.ISO_8859_1)
                .build();

        assertThat(config.resolutionMode()).isEqualTo(ResolutionMode.EAGER);
        assertThat(config.charset()).isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(config.toString()).contains("EAGER", "ISO-8859-1");
    }

    @Test
    @DisplayName("Should copy values into a new builder")
    void shouldCopyIntoBuilder() {
        AutomatonConfig original = AutomatonConfig.forConcurrentReads();

        AutomatonConfig copy = original.toBuilder()
                .charset(StandardCharsets.US_ASCII)
                .build();

        assertThat(copy.resolutionMode()).isEqualTo(ResolutionMode.EAGER);
        assertThat(copy.charset()).isEqualTo(StandardCharsets.US_ASCII);
        assertThat(original.charset()).isEqualTo(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should reject null builder values")
    void shouldRejectNullValues() {
        assertThatThrownBy(() -> AutomatonConfig.builder().resolutionMode(null).build())
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> AutomatonConfig.builder().charset(null).build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should load configuration from the classpath")
    void shouldLoadFromClasspath() {
        AutomatonConfig config = AutomatonConfig.loadFromProperties("sift-test.properties");

        assertThat(config.resolutionMode()).isEqualTo(ResolutionMode.EAGER);
        assertThat(config.charset()).isEqualTo(StandardCharsets.ISO_8859_1);
    }

    @Test
    @DisplayName("Should load configuration from the file system")
    void shouldLoadFromFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("sift.properties");
        Files.writeString(file, "sift.resolution.mode=eager\n");

        AutomatonConfig config = AutomatonConfig.loadFromProperties(file.toString());

        assertThat(config.resolutionMode()).isEqualTo(ResolutionMode.EAGER);
        assertThat(config.charset()).isEqualTo(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should fall back to defaults when the file is missing")
    void shouldFallBackForMissingFile(@TempDir Path tempDir) {
        AutomatonConfig config = AutomatonConfig.loadFromProperties(tempDir.resolve("absent.properties").toString());

        assertThat(config.resolutionMode()).isEqualTo(ResolutionMode.LAZY);
        assertThat(config.charset()).isEqualTo(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should ignore invalid values")
    void shouldIgnoreInvalidValues(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("sift.properties");
        Files.writeString(file, "sift.resolution.mode=SOMETIMES\nsift.charset=no-such-charset\n");

        AutomatonConfig config = AutomatonConfig.loadFromProperties(file.toString());

        assertThat(config.resolutionMode()).isEqualTo(ResolutionMode.LAZY);
        assertThat(config.charset()).isEqualTo(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should parse raw values")
    void shouldParseRawValues() {
        assertThat(AutomatonConfig.parseResolutionMode("k", " eager ")).contains(ResolutionMode.EAGER);
        assertThat(AutomatonConfig.parseResolutionMode("k", "")).isEmpty();
        assertThat(AutomatonConfig.parseResolutionMode("k", null)).isEmpty();
        assertThat(AutomatonConfig.parseResolutionMode("k", "never")).isEmpty();

        assertThat(AutomatonConfig.parseCharset("k", "us-ascii")).contains(StandardCharsets.US_ASCII);
        assertThat(AutomatonConfig.parseCharset("k", "  ")).isEmpty();
        assertThat(AutomatonConfig.parseCharset("k", "bogus!charset")).isEmpty();
    }
}
