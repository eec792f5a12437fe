package com.sift.automaton.benchmark;

import com.sift.automaton.api.model.ResolutionMode;
import com.sift.automaton.config.AutomatonConfig;
import com.sift.automaton.runtime.evaluation.AhoCorasickAutomaton;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Search and construction throughput of the automaton.
 * <p>
 * Compares lazily and eagerly resolved automata over a synthetic
 * dictionary of lowercase words. The lazy automaton pays for resolution
 * on the first searches of each fork; the measurement iterations then run
 * on a warm memo table, which is the steady state of a long-lived matcher.
 * <p>
 * USAGE:
 * # Build benchmark JAR
 * mvn clean package -pl sift-benchmarks -am -DskipTests
 * <p>
 * # Run all benchmarks
 * java -cp sift-benchmarks/target/classes:... com.sift.automaton.benchmark.SearchBenchmark
 * <p>
 * CONFIGURATION:
 * -Dbench.quick : single short iteration per phase
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(1)
public class SearchBenchmark {

    private static final long SEED = 42L;

    @Param({"100", "10000"})
    private int patternCount;

    @Param({"LAZY", "EAGER"})
    private ResolutionMode resolutionMode;

    private List<byte[]> patterns;
    private AhoCorasickAutomaton automaton;
    private byte[] text;

    @Setup(Level.Trial)
    public void setup() {
        Random random = new Random(SEED);
        patterns = new ArrayList<>(patternCount);
        for (int i = 0; i < patternCount; i++) {
            patterns.add(randomWord(random, 4 + random.nextInt(8)));
        }

        AutomatonConfig config = AutomatonConfig.defaults().toBuilder()
                .resolutionMode(resolutionMode)
                .build();
        automaton = new AhoCorasickAutomaton(patterns, config);

        // 64 KiB of text with roughly one planted pattern every 256 bytes
        StringBuilder sb = new StringBuilder(64 * 1024);
        while (sb.length() < 64 * 1024) {
            if (random.nextInt(32) == 0) {
                sb.append(new String(patterns.get(random.nextInt(patternCount)), StandardCharsets.US_ASCII));
            } else {
                sb.append((char) ('a' + random.nextInt(26)));
            }
        }
        text = sb.toString().getBytes(StandardCharsets.US_ASCII);
    }

    @Benchmark
    public void search(Blackhole bh) {
        automaton.searchIn(text, (position, patternIndex) -> bh.consume(patternIndex));
    }

    @Benchmark
    public void hasString(Blackhole bh) {
        for (int i = 0; i < 64; i++) {
            bh.consume(automaton.hasString(patterns.get(i % patternCount)));
        }
    }

    @Benchmark
    public AhoCorasickAutomaton construct() {
        return new AhoCorasickAutomaton(patterns, AutomatonConfig.defaults().toBuilder()
                .resolutionMode(resolutionMode)
                .build());
    }

    private static byte[] randomWord(Random random, int length) {
        byte[] word = new byte[length];
        for (int i = 0; i < length; i++) {
            word[i] = (byte) ('a' + random.nextInt(26));
        }
        return word;
    }

    public static void main(String[] args) throws RunnerException {
        boolean quick = Boolean.getBoolean("bench.quick");

        Options opt = new OptionsBuilder()
                .include(SearchBenchmark.class.getSimpleName())
                .warmupIterations(quick ? 1 : 3)
                .warmupTime(TimeValue.seconds(quick ? 1 : 2))
                .measurementIterations(quick ? 1 : 5)
                .measurementTime(TimeValue.seconds(quick ? 1 : 3))
                .build();

        new Runner(opt).run();
    }
}
