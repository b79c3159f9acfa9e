/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.index;

import org.apache.lucene.util.PriorityQueue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps the {@code maxSize} largest stats. Ties on count keep the lexicographically smaller name.
 */
final class TopStatsQueue extends PriorityQueue<Stat> {

    TopStatsQueue(int maxSize) {
        super(maxSize);
    }

    @Override
    protected boolean lessThan(Stat a, Stat b) {
        if (a.count() != b.count()) {
            return a.count() < b.count();
        }
        return a.name().compareTo(b.name()) > 0;
    }

    void offer(String name, long count) {
        insertWithOverflow(new Stat(name, count));
    }

    /**
     * Drains the queue.
     *
     * @return the retained stats, highest count first
     */
    List<Stat> drainDescending() {
        List<Stat> result = new ArrayList<>(size());
        while (size() > 0) {
            result.add(pop());
        }
        Collections.reverse(result);
        return Collections.unmodifiableList(result);
    }
}
