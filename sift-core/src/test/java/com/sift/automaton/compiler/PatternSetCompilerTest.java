package com.sift.automaton.compiler;

import com.sift.automaton.api.exceptions.CompilationException;
import com.sift.automaton.api.model.AutomatonStats;
import com.sift.automaton.api.model.Match;
import com.sift.automaton.config.AutomatonConfig;
import com.sift.automaton.runtime.evaluation.AhoCorasickAutomaton;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatternSetCompilerTest {

    private PatternSetCompiler compiler;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        compiler = new PatternSetCompiler(OpenTelemetry.noop().getTracer("test"));
    }

    private Path writePatterns(String fileName, String content) throws IOException {
        Path patternsFile = tempDir.resolve(fileName);
        Files.writeString(patternsFile, content, StandardCharsets.UTF_8);
        return patternsFile;
    }

    @Test
    @DisplayName("Should compile a JSON pattern file")
    void shouldCompileJsonFile() throws IOException {
        Path patternsFile = writePatterns("patterns.json", """
                ["abcd", "bcde", "cdef"]
                """);

        AhoCorasickAutomaton automaton = compiler.compile(patternsFile);

        assertThat(automaton.stats().patternCount()).isEqualTo(3);
        assertThat(automaton.hasString("bcde")).isTrue();
        assertThat(automaton.searchIn("abcdef")).containsExactly(
                new Match(4, 0), new Match(5, 1), new Match(6, 2));
    }

    @Test
    @DisplayName("Should compile a line-based pattern file skipping empty lines")
    void shouldCompileLineFile() throws IOException {
        Path patternsFile = writePatterns("patterns.txt", "abcd\n\nbcde\n");

        AhoCorasickAutomaton automaton = compiler.compile(patternsFile);

        assertThat(automaton.stats().patternCount()).isEqualTo(2);
        assertThat(automaton.searchIn("xbcdex")).containsExactly(new Match(5, 1));
    }

    @Test
    @DisplayName("Should read line files as UTF-8")
    void shouldReadLineFilesAsUtf8() throws IOException {
        Path patternsFile = writePatterns("patterns.txt", "café\n");

        AhoCorasickAutomaton automaton = compiler.compile(patternsFile);

        assertThat(automaton.hasString("café")).isTrue();
        assertThat(automaton.searchIn("un café")).containsExactly(new Match(8, 0));
    }

    @Test
    @DisplayName("Should throw exception for an empty pattern set")
    void shouldThrowForEmptyPatternSet() throws IOException {
        Path patternsFile = writePatterns("patterns.json", "[]");

        assertThatThrownBy(() -> compiler.compile(patternsFile))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Pattern set cannot be empty");
    }

    @Test
    @DisplayName("Should throw exception for a line file with only blank lines")
    void shouldThrowForBlankLineFile() throws IOException {
        Path patternsFile = writePatterns("patterns.txt", "\n\n");

        assertThatThrownBy(() -> compiler.compile(patternsFile))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Pattern set cannot be empty");
    }

    @Test
    @DisplayName("Should throw exception for malformed JSON")
    void shouldThrowForMalformedJson() throws IOException {
        Path patternsFile = writePatterns("patterns.json", "[\"abcd\", ");

        assertThatThrownBy(() -> compiler.compile(patternsFile))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Malformed pattern file");
    }

    @Test
    @DisplayName("Should throw exception when the JSON root is not an array")
    void shouldThrowForNonArrayRoot() throws IOException {
        Path patternsFile = writePatterns("patterns.json", """
                {"patterns": ["abcd"]}
                """);

        assertThatThrownBy(() -> compiler.compile(patternsFile))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("must contain a JSON array of strings");
    }

    @Test
    @DisplayName("Should throw exception for a non-string pattern")
    void shouldThrowForNonStringPattern() throws IOException {
        Path patternsFile = writePatterns("patterns.json", "[\"abcd\", 42]");

        assertThatThrownBy(() -> compiler.compile(patternsFile))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Pattern at index 1 is not a string");
    }

    @Test
    @DisplayName("Should throw exception for a null pattern")
    void shouldThrowForNullPattern() throws IOException {
        Path patternsFile = writePatterns("patterns.json", "[null, \"abcd\"]");

        assertThatThrownBy(() -> compiler.compile(patternsFile))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Pattern at index 0 is null");
    }

    @Test
    @DisplayName("Should throw exception for an empty pattern")
    void shouldThrowForEmptyPattern() throws IOException {
        Path patternsFile = writePatterns("patterns.json", "[\"abcd\", \"\"]");

        assertThatThrownBy(() -> compiler.compile(patternsFile))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Pattern at index 1 is empty");
    }

    @Test
    @DisplayName("Should propagate a missing file as an I/O error")
    void shouldThrowForMissingFile() {
        Path missing = tempDir.resolve("missing.json");

        assertThatThrownBy(() -> compiler.compile(missing))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    @DisplayName("Should validate in-memory pattern lists")
    void shouldValidatePatternLists() {
        assertThatThrownBy(() -> compiler.compile(List.<String>of()))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Pattern set cannot be empty");
        assertThatThrownBy(() -> compiler.compile(Arrays.asList("abcd", null)))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Pattern at index 1 is null");
    }

    @Test
    @DisplayName("Should keep duplicate patterns and report the later index")
    void shouldAcceptDuplicates() {
        AhoCorasickAutomaton automaton = compiler.compile(List.of("ab", "ab"));

        assertThat(automaton.stats().patternCount()).isEqualTo(2);
        assertThat(automaton.searchIn("ab")).containsExactly(new Match(2, 1));
    }

    @Test
    @DisplayName("Should apply the configured resolution mode")
    void shouldApplyConfiguredResolutionMode() {
        PatternSetCompiler eagerCompiler = new PatternSetCompiler(
                OpenTelemetry.noop().getTracer("test"), AutomatonConfig.forConcurrentReads());

        AutomatonStats stats = eagerCompiler.compile(List.of("abcd", "bcde", "cdef")).stats();

        assertThat(stats.resolvedTransitions()).isEqualTo(78);
        assertThat(stats.resolvedSuffixLinks()).isEqualTo(13);
    }
}
