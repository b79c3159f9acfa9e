/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex;

import org.opensearch.common.settings.Setting;
import org.opensearch.plugins.Plugin;

import java.util.List;

/**
 * Plugin registering the settings of the in-memory log postings index.
 *
 * <p>The index itself has no REST or transport surface; the settings tune:
 * <ul>
 *   <li>the parallel sort that moves an unordered postings store into its serving phase</li>
 *   <li>the size of the cardinality rankings</li>
 *   <li>the sampling of fingerprint offset tables used for shard pre-filtering</li>
 * </ul>
 */
public class LogIndexPlugin extends Plugin {

    /**
     * Maximum number of postings lists handed to a sort worker at once.
     */
    public static final Setting<Integer> POSTINGS_ENSURE_ORDER_BATCH_SIZE = Setting.intSetting(
        "index.log_index.postings.ensure_order.batch_size",
        1024,
        1,
        Setting.Property.IndexScope,
        Setting.Property.Final
    );

    /**
     * Number of sort workers. 0 uses the number of allocated processors.
     */
    public static final Setting<Integer> POSTINGS_ENSURE_ORDER_THREADS = Setting.intSetting(
        "index.log_index.postings.ensure_order.threads",
        0,
        0,
        Setting.Property.IndexScope,
        Setting.Property.Final
    );

    /**
     * Number of entries kept in each cardinality ranking.
     */
    public static final Setting<Integer> POSTINGS_STATS_MAX_RECORDS = Setting.intSetting(
        "index.log_index.postings.stats.max_records",
        10,
        1,
        Setting.Property.IndexScope,
        Setting.Property.Final
    );

    /**
     * Every n-th series of the fingerprint-ordered series stream is sampled into a fingerprint offsets table.
     * Larger rates shrink the table and widen the superset returned for a shard.
     */
    public static final Setting<Integer> SHARD_FINGERPRINT_OFFSETS_SAMPLE_RATE = Setting.intSetting(
        "index.log_index.shard.fingerprint_offsets.sample_rate",
        16,
        1,
        Setting.Property.IndexScope,
        Setting.Property.Final
    );

    /**
     * Default constructor
     */
    public LogIndexPlugin() {}

    @Override
    public List<Setting<?>> getSettings() {
        return List.of(
            POSTINGS_ENSURE_ORDER_BATCH_SIZE,
            POSTINGS_ENSURE_ORDER_THREADS,
            POSTINGS_STATS_MAX_RECORDS,
            SHARD_FINGERPRINT_OFFSETS_SAMPLE_RATE
        );
    }
}
