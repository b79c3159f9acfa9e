/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.index;

/**
 * A named count in a cardinality ranking.
 *
 * @param name  what was counted, a label name, a label value or a {@code name=value} pair
 * @param count the count
 */
public record Stat(String name, long count) {
}
