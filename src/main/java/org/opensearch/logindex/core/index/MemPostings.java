/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.index;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.lucene.util.UnicodeUtil;
import org.opensearch.OpenSearchException;
import org.opensearch.common.CheckedBiConsumer;
import org.opensearch.common.settings.Settings;
import org.opensearch.common.util.concurrent.OpenSearchExecutors;
import org.opensearch.common.util.concurrent.ReleasableLock;
import org.opensearch.logindex.LogIndexPlugin;
import org.opensearch.logindex.core.model.Label;
import org.opensearch.logindex.core.model.LabelConstants;
import org.opensearch.logindex.core.model.Labels;
import org.opensearch.logindex.core.postings.Postings;
import org.opensearch.logindex.core.postings.PostingsUtils;
import org.opensearch.threadpool.ThreadPool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * MemPostings holds a postings list of series references per label pair.
 * <p>
 * A store created with {@link #unordered(Settings)} accepts writes in any order and must not be read until
 * {@link #ensureOrder()} returned, which allows quick unordered bulk fills on startup. A store created with
 * {@link #ordered(Settings)}, or one that went through {@link #ensureOrder()}, keeps every list sorted on insert.
 * <p>
 * A single read/write lock guards the map structure. Readers hold it only for the lookup: the returned postings are a
 * point-in-time snapshot that later writes never change.
 */
public class MemPostings {
    private static final Logger logger = LogManager.getLogger(MemPostings.class);

    private static final Label ALL_POSTINGS_KEY = new Label(LabelConstants.EMPTY_STRING, LabelConstants.EMPTY_STRING);
    private static final String ENSURE_ORDER_THREAD_NAME = "log_index_ensure_order";
    private static final long ENSURE_ORDER_TERMINATION_TIMEOUT_SECONDS = 10;
    private static final int INITIAL_NAMES_CAPACITY = 512;

    // marks the end of the work queue for one sort worker, compared by identity
    private static final List<PostingsList> END_OF_WORK = new ArrayList<>(0);

    private final Map<String, Map<String, PostingsList>> postings = new HashMap<>(INITIAL_NAMES_CAPACITY);
    private final ReleasableLock readLock;
    private final ReleasableLock writeLock;
    private final int ensureOrderBatchSize;
    private final int ensureOrderThreads;
    private final int statsMaxRecords;
    private boolean ordered;

    private MemPostings(Settings settings, boolean ordered) {
        ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        this.readLock = new ReleasableLock(lock.readLock());
        this.writeLock = new ReleasableLock(lock.writeLock());
        this.ensureOrderBatchSize = LogIndexPlugin.POSTINGS_ENSURE_ORDER_BATCH_SIZE.get(settings);
        int threads = LogIndexPlugin.POSTINGS_ENSURE_ORDER_THREADS.get(settings);
        this.ensureOrderThreads = threads > 0 ? threads : OpenSearchExecutors.allocatedProcessors(settings);
        this.statsMaxRecords = LogIndexPlugin.POSTINGS_STATS_MAX_RECORDS.get(settings);
        this.ordered = ordered;
    }

    /**
     * Creates a store that is ready for reads and writes.
     *
     * @param settings index settings
     * @return an ordered store
     */
    public static MemPostings ordered(Settings settings) {
        return new MemPostings(settings, true);
    }

    /**
     * Creates an ordered store with default settings.
     *
     * @return an ordered store
     */
    public static MemPostings ordered() {
        return ordered(Settings.EMPTY);
    }

    /**
     * Creates a store that is not safe to read from until {@link #ensureOrder()} was called once.
     *
     * @param settings index settings
     * @return an unordered store
     */
    public static MemPostings unordered(Settings settings) {
        return new MemPostings(settings, false);
    }

    /**
     * Creates an unordered store with default settings.
     *
     * @return an unordered store
     */
    public static MemPostings unordered() {
        return unordered(Settings.EMPTY);
    }

    /**
     * The label under which every series reference is registered.
     *
     * @return the all-postings label, with empty name and value
     */
    public static Label allPostingsKey() {
        return ALL_POSTINGS_KEY;
    }

    /**
     * Whether lists are kept sorted, i.e. the store is in its serving phase.
     *
     * @return true once ordered
     */
    public boolean isOrdered() {
        try (ReleasableLock ignored = readLock.acquire()) {
            return ordered;
        }
    }

    /**
     * Adds a series reference under each of its labels and under the all-postings key.
     * Adding the same reference twice is not detected.
     *
     * @param ref    series reference
     * @param labels series labels, a null set only registers the all-postings key
     */
    public void add(long ref, Labels labels) {
        try (ReleasableLock ignored = writeLock.acquire()) {
            if (labels != null) {
                labels.forEach((name, value) -> addFor(ref, name, value));
            }
            addFor(ref, ALL_POSTINGS_KEY.name(), ALL_POSTINGS_KEY.value());
        }
    }

    private void addFor(long ref, String name, String value) {
        // references are generated independently of this lock, so a higher one may already be in the list;
        // ordered lists repair the violation on insert
        postings.computeIfAbsent(name, k -> new HashMap<>()).computeIfAbsent(value, k -> new PostingsList()).append(ref, ordered);
    }

    /**
     * Returns the postings for a label pair.
     *
     * @param name  label name
     * @param value label value
     * @return a snapshot of the list, or {@link PostingsUtils#emptyPostings()} if the pair is unknown
     */
    public Postings get(String name, String value) {
        try (ReleasableLock ignored = readLock.acquire()) {
            Map<String, PostingsList> values = postings.get(name);
            PostingsList list = values == null ? null : values.get(value);
            if (list == null) {
                return PostingsUtils.emptyPostings();
            }
            return list.snapshot();
        }
    }

    /**
     * Returns the postings of every series ever added and not deleted.
     *
     * @return a snapshot of the all-postings list
     */
    public Postings all() {
        return get(ALL_POSTINGS_KEY.name(), ALL_POSTINGS_KEY.value());
    }

    /**
     * Sorts every postings list once and switches the store to sorted inserts. Callers must not read or write
     * concurrently with this call. Does nothing if the store is already ordered.
     *
     * @throws OpenSearchException if interrupted while waiting for the sort workers; the store stays unordered
     */
    public void ensureOrder() {
        try (ReleasableLock ignored = writeLock.acquire()) {
            if (ordered) {
                return;
            }
            long startNanos = System.nanoTime();
            int threads = ensureOrderThreads;
            BlockingQueue<List<PostingsList>> work = new ArrayBlockingQueue<>(threads);
            BlockingQueue<List<PostingsList>> freeBatches = new ArrayBlockingQueue<>(threads * 2);
            CountDownLatch drained = new CountDownLatch(threads);
            ExecutorService executor = Executors.newFixedThreadPool(threads, OpenSearchExecutors.daemonThreadFactory(ENSURE_ORDER_THREAD_NAME));
            int lists = 0;
            int batches = 0;
            try {
                for (int i = 0; i < threads; i++) {
                    executor.execute(() -> sortBatches(work, freeBatches, drained));
                }
                List<PostingsList> batch = takeBatch(freeBatches);
                for (Map<String, PostingsList> values : postings.values()) {
                    for (PostingsList list : values.values()) {
                        batch.add(list);
                        lists++;
                        if (batch.size() >= ensureOrderBatchSize) {
                            logger.trace("Dispatching batch {} with {} postings lists", batches, batch.size());
                            work.put(batch);
                            batches++;
                            batch = takeBatch(freeBatches);
                        }
                    }
                }
                if (batch.isEmpty() == false) {
                    logger.trace("Dispatching batch {} with {} postings lists", batches, batch.size());
                    work.put(batch);
                    batches++;
                }
                for (int i = 0; i < threads; i++) {
                    work.put(END_OF_WORK);
                }
                drained.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OpenSearchException("Interrupted while sorting postings lists", e);
            } finally {
                ThreadPool.terminate(executor, ENSURE_ORDER_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            }
            ordered = true;
            logger.debug(
                "Sorted {} postings lists in {} batches with {} threads in {} ms",
                lists,
                batches,
                threads,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos)
            );
        }
    }

    private List<PostingsList> takeBatch(BlockingQueue<List<PostingsList>> freeBatches) {
        List<PostingsList> batch = freeBatches.poll();
        return batch != null ? batch : new ArrayList<>(ensureOrderBatchSize);
    }

    private static void sortBatches(
        BlockingQueue<List<PostingsList>> work,
        BlockingQueue<List<PostingsList>> freeBatches,
        CountDownLatch drained
    ) {
        try {
            while (true) {
                List<PostingsList> batch = work.take();
                if (batch == END_OF_WORK) {
                    return;
                }
                for (PostingsList list : batch) {
                    list.sort();
                }
                batch.clear();
                // the free list is bounded, surplus batches are left to the garbage collector
                freeBatches.offer(batch);
            }
        } catch (InterruptedException e) {
            // the producer gave up and terminated the pool
            Thread.currentThread().interrupt();
        } finally {
            drained.countDown();
        }
    }

    /**
     * Removes the given references from every postings list. Empty lists and label names without lists are removed.
     * <p>
     * The write lock is only held while one list is rewritten so reads are not blocked for long. Labels added after
     * this call started cannot contain deleted references and are not visited.
     *
     * @param deleted references to remove
     */
    public void delete(Set<Long> deleted) {
        if (deleted.isEmpty()) {
            return;
        }
        List<String> names;
        try (ReleasableLock ignored = readLock.acquire()) {
            names = new ArrayList<>(postings.keySet());
        }

        int rewritten = 0;
        int removedPairs = 0;
        List<String> values = new ArrayList<>();
        for (String name : names) {
            values.clear();
            try (ReleasableLock ignored = readLock.acquire()) {
                Map<String, PostingsList> byValue = postings.get(name);
                if (byValue != null) {
                    values.addAll(byValue.keySet());
                }
            }

            for (String value : values) {
                try (ReleasableLock ignored = writeLock.acquire()) {
                    Map<String, PostingsList> byValue = postings.get(name);
                    PostingsList list = byValue == null ? null : byValue.get(value);
                    if (list == null || list.containsAny(deleted) == false) {
                        continue;
                    }
                    rewritten++;
                    if (list.removeAll(deleted) == 0) {
                        byValue.remove(value);
                        removedPairs++;
                    }
                }
            }

            try (ReleasableLock ignored = writeLock.acquire()) {
                Map<String, PostingsList> byValue = postings.get(name);
                if (byValue != null && byValue.isEmpty()) {
                    postings.remove(name);
                }
            }
        }
        logger.debug("Deleted {} series references, rewrote {} postings lists, removed {} label pairs", deleted.size(), rewritten, removedPairs);
    }

    /**
     * Calls the consumer with a snapshot of every postings list, stopping at the first exception.
     *
     * @param consumer receives each label pair and its postings
     * @param <E>      exception type thrown by the consumer
     * @throws E the first exception thrown by the consumer
     */
    public <E extends Exception> void iter(CheckedBiConsumer<Label, Postings, E> consumer) throws E {
        try (ReleasableLock ignored = readLock.acquire()) {
            for (Map.Entry<String, Map<String, PostingsList>> byName : postings.entrySet()) {
                for (Map.Entry<String, PostingsList> byValue : byName.getValue().entrySet()) {
                    consumer.accept(new Label(byName.getKey(), byValue.getKey()), byValue.getValue().snapshot());
                }
            }
        }
    }

    /**
     * Returns all label names, excluding the all-postings name.
     *
     * @return label names in no particular order
     */
    public List<String> labelNames() {
        try (ReleasableLock ignored = readLock.acquire()) {
            List<String> names = new ArrayList<>(postings.size());
            for (String name : postings.keySet()) {
                if (name.equals(ALL_POSTINGS_KEY.name()) == false) {
                    names.add(name);
                }
            }
            return names;
        }
    }

    /**
     * Returns the values of a label name.
     *
     * @param name label name
     * @return label values in no particular order, empty for an unknown name
     */
    public List<String> labelValues(String name) {
        try (ReleasableLock ignored = readLock.acquire()) {
            Map<String, PostingsList> values = postings.get(name);
            return values == null ? new ArrayList<>() : new ArrayList<>(values.keySet());
        }
    }

    /**
     * Returns every label pair, sorted by name then value. The all-postings key sorts first.
     *
     * @return sorted label pairs
     */
    public List<Label> sortedKeys() {
        List<Label> keys = new ArrayList<>();
        try (ReleasableLock ignored = readLock.acquire()) {
            for (Map.Entry<String, Map<String, PostingsList>> byName : postings.entrySet()) {
                for (String value : byName.getValue().keySet()) {
                    keys.add(new Label(byName.getKey(), value));
                }
            }
        }
        Collections.sort(keys);
        return keys;
    }

    /**
     * Returns every distinct name and value string.
     *
     * @return sorted, de-duplicated symbols
     */
    public List<String> symbols() {
        TreeSet<String> symbols = new TreeSet<>();
        try (ReleasableLock ignored = readLock.acquire()) {
            for (Map.Entry<String, Map<String, PostingsList>> byName : postings.entrySet()) {
                symbols.add(byName.getKey());
                symbols.addAll(byName.getValue().keySet());
            }
        }
        return List.copyOf(symbols);
    }

    /**
     * Computes cardinality statistics in one pass over the store, under the read lock. Meant for diagnostics.
     *
     * @param label label name whose values are ranked by series count
     * @return the rankings
     */
    public PostingsStats stats(String label) {
        long startNanos = System.nanoTime();
        TopStatsQueue metrics = new TopStatsQueue(statsMaxRecords);
        TopStatsQueue labels = new TopStatsQueue(statsMaxRecords);
        TopStatsQueue labelValueLength = new TopStatsQueue(statsMaxRecords);
        TopStatsQueue labelValuePairs = new TopStatsQueue(statsMaxRecords);
        int numLabelPairs = 0;

        try (ReleasableLock ignored = readLock.acquire()) {
            for (Map.Entry<String, Map<String, PostingsList>> byName : postings.entrySet()) {
                String name = byName.getKey();
                if (name.isEmpty()) {
                    continue;
                }
                Map<String, PostingsList> values = byName.getValue();
                labels.offer(name, values.size());
                numLabelPairs += values.size();
                long valueBytes = 0;
                for (Map.Entry<String, PostingsList> byValue : values.entrySet()) {
                    String value = byValue.getKey();
                    int seriesCount = byValue.getValue().size();
                    if (name.equals(label)) {
                        metrics.offer(value, seriesCount);
                    }
                    labelValuePairs.offer(name + LabelConstants.PAIR_DELIMITER + value, seriesCount);
                    valueBytes += UnicodeUtil.calcUTF16toUTF8Length(value, 0, value.length());
                }
                labelValueLength.offer(name, valueBytes);
            }
        }

        logger.debug("Computed postings stats for label [{}] in {} ms", label, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        return new PostingsStats(
            metrics.drainDescending(),
            labels.drainDescending(),
            labelValueLength.drainDescending(),
            labelValuePairs.drainDescending(),
            numLabelPairs
        );
    }
}
