/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.benchmark;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;
import org.opensearch.logindex.core.index.MemPostings;
import org.opensearch.logindex.core.model.ByteLabels;
import org.opensearch.logindex.core.postings.Postings;
import org.opensearch.logindex.core.postings.PostingsUtils;

import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmark for MemPostings bulk loading and set operators over its postings.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 3, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class PostingsBenchmark {

    private static final String[] ENVS = { "prod", "staging", "dev" };
    private static final int PODS = 500;

    @Param({ "10000", "100000" })
    public int series;

    private MemPostings postings;
    private long[] shuffledRefs;

    @Setup(Level.Trial)
    public void setup() {
        Random random = new Random(42);
        shuffledRefs = new long[series];
        for (int i = 0; i < series; i++) {
            shuffledRefs[i] = i;
        }
        for (int i = series - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            long tmp = shuffledRefs[i];
            shuffledRefs[i] = shuffledRefs[j];
            shuffledRefs[j] = tmp;
        }
        postings = MemPostings.ordered();
        for (int i = 0; i < series; i++) {
            postings.add(i, labelsFor(i));
        }
    }

    private static ByteLabels labelsFor(long ref) {
        return ByteLabels.fromStrings(
            "__name__",
            "log_lines",
            "env",
            ENVS[(int) (ref % ENVS.length)],
            "pod",
            "pod-" + (ref % PODS)
        );
    }

    /**
     * Unordered bulk fill followed by the parallel sort.
     */
    @Benchmark
    public void benchmarkUnorderedLoadAndEnsureOrder(Blackhole bh) {
        MemPostings unordered = MemPostings.unordered();
        for (long ref : shuffledRefs) {
            unordered.add(ref, labelsFor(ref));
        }
        unordered.ensureOrder();
        bh.consume(unordered);
    }

    @Benchmark
    public void benchmarkIntersect(Blackhole bh) {
        Postings p = PostingsUtils.intersect(postings.get("env", "prod"), postings.get("pod", "pod-7"));
        while (p.next()) {
            bh.consume(p.at());
        }
    }

    @Benchmark
    public void benchmarkMerge(Blackhole bh) {
        Postings p = PostingsUtils.merge(postings.get("env", "prod"), postings.get("env", "dev"));
        while (p.next()) {
            bh.consume(p.at());
        }
    }

    @Benchmark
    public void benchmarkWithout(Blackhole bh) {
        Postings p = PostingsUtils.without(postings.all(), postings.get("env", "staging"));
        while (p.next()) {
            bh.consume(p.at());
        }
    }
}
