/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.index;

import org.opensearch.common.settings.Settings;
import org.opensearch.logindex.LogIndexPlugin;
import org.opensearch.logindex.core.model.ByteLabels;
import org.opensearch.logindex.core.model.Label;
import org.opensearch.logindex.core.postings.Postings;
import org.opensearch.logindex.core.postings.PostingsUtils;
import org.opensearch.test.OpenSearchTestCase;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.LongStream;

public class MemPostingsTests extends OpenSearchTestCase {

    private static Settings sortSettings(int batchSize, int threads) {
        return Settings.builder()
            .put(LogIndexPlugin.POSTINGS_ENSURE_ORDER_BATCH_SIZE.getKey(), batchSize)
            .put(LogIndexPlugin.POSTINGS_ENSURE_ORDER_THREADS.getKey(), threads)
            .build();
    }

    private static List<String> sorted(List<String> values) {
        List<String> copy = new ArrayList<>(values);
        Collections.sort(copy);
        return copy;
    }

    public void testOrderedStoreKeepsListsSorted() {
        MemPostings postings = MemPostings.ordered();
        assertTrue(postings.isOrdered());
        postings.add(5, ByteLabels.fromStrings("env", "prod"));
        postings.add(1, ByteLabels.fromStrings("env", "prod"));
        postings.add(3, ByteLabels.fromStrings("env", "prod", "job", "api"));

        assertArrayEquals(new long[] { 1, 3, 5 }, PostingsUtils.expand(postings.get("env", "prod")));
        assertArrayEquals(new long[] { 3 }, PostingsUtils.expand(postings.get("job", "api")));
        assertArrayEquals(new long[] { 1, 3, 5 }, PostingsUtils.expand(postings.all()));
    }

    public void testUnknownPairReturnsEmptySentinel() {
        MemPostings postings = MemPostings.ordered();
        postings.add(1, ByteLabels.fromStrings("env", "prod"));
        assertTrue(PostingsUtils.isEmptyPostingsType(postings.get("env", "dev")));
        assertTrue(PostingsUtils.isEmptyPostingsType(postings.get("zone", "a")));
        assertTrue(PostingsUtils.isEmptyPostingsType(MemPostings.ordered().all()));
    }

    public void testAllPostingsKey() {
        assertEquals(new Label("", ""), MemPostings.allPostingsKey());
        MemPostings postings = MemPostings.ordered();
        postings.add(7, ByteLabels.fromStrings("env", "prod"));
        assertArrayEquals(
            new long[] { 7 },
            PostingsUtils.expand(postings.get(MemPostings.allPostingsKey().name(), MemPostings.allPostingsKey().value()))
        );
    }

    public void testNullLabelsOnlyRegisterAllPostings() {
        MemPostings postings = MemPostings.ordered();
        postings.add(4, null);
        assertArrayEquals(new long[] { 4 }, PostingsUtils.expand(postings.all()));
        assertTrue(postings.labelNames().isEmpty());
    }

    public void testEnsureOrderSortsUnorderedStore() {
        MemPostings postings = MemPostings.unordered(sortSettings(2, 3));
        assertFalse(postings.isOrdered());
        long[] refs = { 9, 2, 7, 4, 1, 8, 3 };
        for (long ref : refs) {
            postings.add(ref, ByteLabels.fromStrings("env", ref % 2 == 0 ? "even" : "odd", "id", Long.toString(ref)));
        }
        postings.ensureOrder();
        assertTrue(postings.isOrdered());

        assertArrayEquals(new long[] { 1, 2, 3, 4, 7, 8, 9 }, PostingsUtils.expand(postings.all()));
        assertArrayEquals(new long[] { 2, 4, 8 }, PostingsUtils.expand(postings.get("env", "even")));
        assertArrayEquals(new long[] { 1, 3, 7, 9 }, PostingsUtils.expand(postings.get("env", "odd")));

        postings.add(5, ByteLabels.fromStrings("env", "odd"));
        assertArrayEquals("Inserts after sorting keep order", new long[] { 1, 3, 5, 7, 9 }, PostingsUtils.expand(postings.get("env", "odd")));

        postings.ensureOrder();
        assertArrayEquals(new long[] { 1, 2, 3, 4, 5, 7, 8, 9 }, PostingsUtils.expand(postings.all()));
    }

    public void testEnsureOrderOnEmptyStore() {
        MemPostings postings = MemPostings.unordered(sortSettings(1, 1));
        postings.ensureOrder();
        assertTrue(postings.isOrdered());
        assertTrue(PostingsUtils.isEmptyPostingsType(postings.all()));
    }

    public void testConcurrentAddsThenEnsureOrder() throws InterruptedException {
        MemPostings postings = MemPostings.unordered(sortSettings(randomIntBetween(1, 16), randomIntBetween(1, 4)));
        int writers = 4;
        int perWriter = 250;
        CountDownLatch start = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            final int writer = w;
            Thread thread = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                // writers interleave their references
                for (int i = 0; i < perWriter; i++) {
                    long ref = (long) i * writers + writer;
                    postings.add(ref, ByteLabels.fromStrings("writer", Integer.toString(writer), "bucket", Long.toString(ref % 10)));
                }
            });
            threads.add(thread);
            thread.start();
        }
        start.countDown();
        for (Thread thread : threads) {
            thread.join();
        }
        postings.ensureOrder();

        long[] expected = LongStream.range(0, (long) writers * perWriter).toArray();
        assertArrayEquals(expected, PostingsUtils.expand(postings.all()));
        long[] bucketThree = PostingsUtils.expand(postings.get("bucket", "3"));
        assertEquals(writers * perWriter / 10, bucketThree.length);
        for (int i = 1; i < bucketThree.length; i++) {
            assertTrue("bucket postings must be strictly increasing", bucketThree[i - 1] < bucketThree[i]);
        }
    }

    public void testSnapshotIsolation() {
        MemPostings postings = MemPostings.ordered();
        postings.add(10, ByteLabels.fromStrings("env", "prod"));
        postings.add(30, ByteLabels.fromStrings("env", "prod"));
        Postings before = postings.get("env", "prod");

        postings.add(20, ByteLabels.fromStrings("env", "prod"));
        postings.add(40, ByteLabels.fromStrings("env", "prod"));
        postings.delete(Set.of(10L));

        assertArrayEquals(new long[] { 10, 30 }, PostingsUtils.expand(before));
        assertArrayEquals(new long[] { 20, 30, 40 }, PostingsUtils.expand(postings.get("env", "prod")));
    }

    public void testDelete() {
        MemPostings postings = MemPostings.ordered();
        postings.add(1, ByteLabels.fromStrings("env", "prod", "job", "api"));
        postings.add(2, ByteLabels.fromStrings("env", "dev", "job", "api"));
        postings.add(3, ByteLabels.fromStrings("env", "dev", "zone", "a"));

        postings.delete(Set.of(1L, 3L));

        assertTrue(PostingsUtils.isEmptyPostingsType(postings.get("env", "prod")));
        assertEquals(List.of("dev"), postings.labelValues("env"));
        assertEquals("Names without values are removed", List.of("env", "job"), sorted(postings.labelNames()));
        assertArrayEquals(new long[] { 2 }, PostingsUtils.expand(postings.get("job", "api")));
        assertArrayEquals(new long[] { 2 }, PostingsUtils.expand(postings.all()));

        postings.delete(Set.of());
        assertArrayEquals(new long[] { 2 }, PostingsUtils.expand(postings.all()));

        postings.delete(Set.of(2L));
        assertTrue(postings.labelNames().isEmpty());
        assertTrue(postings.sortedKeys().isEmpty());
    }

    public void testLabelNamesAndValues() {
        MemPostings postings = MemPostings.ordered();
        postings.add(1, ByteLabels.fromStrings("env", "prod", "job", "api"));
        postings.add(2, ByteLabels.fromStrings("env", "dev"));

        assertEquals(List.of("env", "job"), sorted(postings.labelNames()));
        assertEquals(List.of("dev", "prod"), sorted(postings.labelValues("env")));
        assertTrue(postings.labelValues("missing").isEmpty());
    }

    public void testSortedKeysAndSymbols() {
        MemPostings postings = MemPostings.ordered();
        postings.add(1, ByteLabels.fromStrings("job", "api", "env", "prod"));
        postings.add(2, ByteLabels.fromStrings("env", "dev", "app", "prod"));

        assertEquals(
            List.of(
                new Label("", ""),
                new Label("app", "prod"),
                new Label("env", "dev"),
                new Label("env", "prod"),
                new Label("job", "api")
            ),
            postings.sortedKeys()
        );
        assertEquals(List.of("", "api", "app", "dev", "env", "job", "prod"), postings.symbols());
    }

    public void testIter() throws IOException {
        MemPostings postings = MemPostings.ordered();
        postings.add(1, ByteLabels.fromStrings("env", "prod"));
        postings.add(2, ByteLabels.fromStrings("env", "prod", "job", "api"));

        Map<Label, long[]> seen = new HashMap<>();
        postings.iter((label, p) -> seen.put(label, PostingsUtils.expand(p)));
        assertEquals(3, seen.size());
        assertArrayEquals(new long[] { 1, 2 }, seen.get(new Label("env", "prod")));
        assertArrayEquals(new long[] { 2 }, seen.get(new Label("job", "api")));
        assertArrayEquals(new long[] { 1, 2 }, seen.get(MemPostings.allPostingsKey()));
    }

    public void testIterStopsAtFirstException() {
        MemPostings postings = MemPostings.ordered();
        postings.add(1, ByteLabels.fromStrings("a", "1", "b", "2", "c", "3"));
        List<Label> visited = new ArrayList<>();
        IOException e = expectThrows(IOException.class, () -> postings.iter((label, p) -> {
            visited.add(label);
            throw new IOException("stop");
        }));
        assertEquals("stop", e.getMessage());
        assertEquals(1, visited.size());
    }

    public void testStats() {
        MemPostings postings = MemPostings.ordered();
        postings.add(1, ByteLabels.fromStrings("__name__", "a", "env", "prod"));
        postings.add(2, ByteLabels.fromStrings("__name__", "a", "env", "dev"));
        postings.add(3, ByteLabels.fromStrings("__name__", "b", "env", "prod"));

        PostingsStats stats = postings.stats("__name__");
        assertEquals(List.of(new Stat("a", 2), new Stat("b", 1)), stats.cardinalityMetricsStats());
        assertEquals(List.of(new Stat("__name__", 2), new Stat("env", 2)), stats.cardinalityLabelStats());
        assertEquals(List.of(new Stat("env", 7), new Stat("__name__", 2)), stats.labelValueStats());
        assertEquals(
            List.of(new Stat("__name__=a", 2), new Stat("env=prod", 2), new Stat("__name__=b", 1), new Stat("env=dev", 1)),
            stats.labelValuePairsStats()
        );
        assertEquals(4, stats.numLabelPairs());
    }

    public void testStatsCountsUtf8Bytes() {
        MemPostings postings = MemPostings.ordered();
        postings.add(1, ByteLabels.fromStrings("city", "Zürich"));
        PostingsStats stats = postings.stats("city");
        assertEquals(List.of(new Stat("city", 7)), stats.labelValueStats());
        assertEquals(List.of(new Stat("Zürich", 1)), stats.cardinalityMetricsStats());
    }

    public void testStatsRespectMaxRecords() {
        Settings settings = Settings.builder().put(LogIndexPlugin.POSTINGS_STATS_MAX_RECORDS.getKey(), 1).build();
        MemPostings postings = MemPostings.ordered(settings);
        for (long ref = 0; ref < 5; ref++) {
            postings.add(ref, ByteLabels.fromStrings("id", Long.toString(ref), "env", ref < 3 ? "prod" : "dev"));
        }
        PostingsStats stats = postings.stats("env");
        assertEquals(List.of(new Stat("prod", 3)), stats.cardinalityMetricsStats());
        assertEquals(List.of(new Stat("id", 5)), stats.cardinalityLabelStats());
        assertEquals(1, stats.labelValuePairsStats().size());
        assertEquals(7, stats.numLabelPairs());
    }

    public void testStatsOnUnknownLabel() {
        MemPostings postings = MemPostings.ordered();
        postings.add(1, ByteLabels.fromStrings("env", "prod"));
        PostingsStats stats = postings.stats("missing");
        assertTrue(stats.cardinalityMetricsStats().isEmpty());
        assertEquals(1, stats.numLabelPairs());
        assertEquals(List.of(new Stat("env", 1)), stats.cardinalityLabelStats());
    }

    public void testConcurrentReadersSeeStableSnapshotsDuringTailRepairs() throws InterruptedException {
        MemPostings postings = MemPostings.ordered();
        int rounds = 2000;
        int readers = 3;
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean writing = new AtomicBoolean(true);
        AtomicInteger brokenSnapshots = new AtomicInteger();
        AtomicInteger snapshots = new AtomicInteger();

        List<Thread> threads = new ArrayList<>();
        for (int r = 0; r < readers; r++) {
            Thread reader = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                while (writing.get()) {
                    Postings snapshot = postings.get("env", "prod");
                    Thread.yield();
                    long[] values = PostingsUtils.expand(snapshot);
                    for (int i = 1; i < values.length; i++) {
                        if (values[i - 1] >= values[i]) {
                            brokenSnapshots.incrementAndGet();
                            break;
                        }
                    }
                    snapshots.incrementAndGet();
                }
            });
            threads.add(reader);
            reader.start();
        }

        start.countDown();
        // every odd reference lands before its even predecessor, so each one repairs into the snapshotted prefix
        for (long i = 0; i < rounds; i++) {
            postings.add(2 * i + 1, ByteLabels.fromStrings("env", "prod"));
            postings.add(2 * i, ByteLabels.fromStrings("env", "prod"));
        }
        writing.set(false);
        for (Thread thread : threads) {
            thread.join();
        }

        assertEquals("Snapshots must never observe an in-place repair", 0, brokenSnapshots.get());
        assertTrue(snapshots.get() > 0);
        assertArrayEquals(LongStream.range(0, 2L * rounds).toArray(), PostingsUtils.expand(postings.get("env", "prod")));
    }
}
