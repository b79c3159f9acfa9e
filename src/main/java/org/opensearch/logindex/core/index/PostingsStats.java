/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.index;

import java.util.List;

/**
 * Cardinality statistics computed by {@link MemPostings#stats(String)}. Every list is sorted by count, highest first,
 * and holds at most the configured number of records.
 *
 * @param cardinalityMetricsStats series per value of the requested label
 * @param cardinalityLabelStats   distinct values per label name
 * @param labelValueStats         total UTF-8 length of the values per label name
 * @param labelValuePairsStats    series per {@code name=value} pair
 * @param numLabelPairs           number of distinct label pairs
 */
public record PostingsStats(
    List<Stat> cardinalityMetricsStats,
    List<Stat> cardinalityLabelStats,
    List<Stat> labelValueStats,
    List<Stat> labelValuePairsStats,
    int numLabelPairs
) {
}
