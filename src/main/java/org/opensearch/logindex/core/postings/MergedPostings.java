/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.postings;

import org.apache.lucene.util.PriorityQueue;

import java.util.List;

/**
 * Postings over the union of its inputs, with values shared by several inputs returned once.
 * <p>
 * Inputs are kept in a min-heap keyed by their current value. Every input must already be positioned on its
 * first value when handed over, see {@link PostingsUtils#merge(Postings...)}.
 */
final class MergedPostings implements Postings {
    private final PostingsQueue queue;
    private boolean initialized;
    private long cur;
    private Exception err;

    MergedPostings(List<Postings> positioned) {
        this.queue = new PostingsQueue(positioned.size());
        for (Postings p : positioned) {
            queue.add(p);
        }
    }

    @Override
    public boolean next() {
        if (queue.size() == 0 || err != null) {
            return false;
        }
        if (initialized == false) {
            initialized = true;
            cur = queue.top().at();
            return true;
        }
        while (true) {
            Postings top = queue.top();
            if (top.next()) {
                queue.updateTop();
            } else if (drop(top) == false) {
                return false;
            }
            long min = queue.top().at();
            if (min != cur) {
                cur = min;
                return true;
            }
        }
    }

    @Override
    public boolean seek(long target) {
        if (queue.size() == 0 || err != null) {
            return false;
        }
        if (initialized == false && next() == false) {
            return false;
        }
        while (cur < target) {
            Postings top = queue.top();
            if (top.seek(target)) {
                queue.updateTop();
            } else if (drop(top) == false) {
                return false;
            }
            cur = queue.top().at();
        }
        return true;
    }

    /**
     * Removes an exhausted input from the heap.
     *
     * @return false if iteration must stop, because the input failed or no input is left
     */
    private boolean drop(Postings top) {
        queue.pop();
        if (top.err() != null) {
            err = top.err();
            return false;
        }
        return queue.size() > 0;
    }

    @Override
    public long at() {
        return cur;
    }

    @Override
    public Exception err() {
        return err;
    }

    private static final class PostingsQueue extends PriorityQueue<Postings> {
        PostingsQueue(int maxSize) {
            super(maxSize);
        }

        @Override
        protected boolean lessThan(Postings a, Postings b) {
            return a.at() < b.at();
        }
    }
}
