/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.postings;

import java.util.Arrays;
import java.util.Objects;

/**
 * Postings over a sorted slice of a {@code long[]}. The array is read, never written.
 */
public final class ListPostings implements Postings {
    private final long[] list;
    private final int end;
    private int next;
    private long cur;
    private boolean positioned;

    /**
     * @param list sorted series references
     */
    public ListPostings(long... list) {
        this(list, 0, list.length);
    }

    /**
     * @param list   backing array, sorted within {@code [from, to)}
     * @param from   first index, inclusive
     * @param to     last index, exclusive
     */
    public ListPostings(long[] list, int from, int to) {
        Objects.checkFromToIndex(from, to, list.length);
        this.list = list;
        this.next = from;
        this.end = to;
    }

    @Override
    public boolean next() {
        if (next < end) {
            cur = list[next++];
            positioned = true;
            return true;
        }
        next = end;
        positioned = false;
        return false;
    }

    @Override
    public boolean seek(long target) {
        if (positioned && cur >= target) {
            return true;
        }
        if (next >= end) {
            positioned = false;
            return false;
        }
        int i = Arrays.binarySearch(list, next, end, target);
        if (i < 0) {
            i = -i - 1;
        }
        if (i < end) {
            cur = list[i];
            next = i + 1;
            positioned = true;
            return true;
        }
        next = end;
        positioned = false;
        return false;
    }

    @Override
    public long at() {
        return cur;
    }

    @Override
    public Exception err() {
        return null;
    }
}
