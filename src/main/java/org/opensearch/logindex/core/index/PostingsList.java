/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.index;

import org.apache.lucene.util.ArrayUtil;
import org.opensearch.logindex.core.postings.ListPostings;
import org.opensearch.logindex.core.postings.Postings;

import java.util.Arrays;
import java.util.Set;

/**
 * Growable list of series references for one label pair. Not thread safe: {@link MemPostings} guards every access.
 * <p>
 * Snapshots handed out by {@link #snapshot()} share the backing array. Appends only write past every snapshot, and
 * a tail repair that would move a snapshotted slot copies the array first, so a snapshot never changes.
 */
final class PostingsList {
    private static final int INITIAL_CAPACITY = 4;

    private long[] refs;
    private int size;
    // slots [0, shared) are visible to at least one snapshot; concurrent readers may raise it, always to size
    private int shared;

    PostingsList() {
        this.refs = new long[INITIAL_CAPACITY];
    }

    int size() {
        return size;
    }

    /**
     * Appends a reference. When {@code keepSorted} is set the list must already be sorted and the new reference is
     * moved backward past every larger predecessor.
     */
    void append(long ref, boolean keepSorted) {
        long[] grown = ArrayUtil.grow(refs, size + 1);
        if (grown != refs) {
            refs = grown;
            shared = 0;
        }
        refs[size++] = ref;
        if (keepSorted) {
            repairTail();
        }
    }

    private void repairTail() {
        int last = size - 1;
        long ref = refs[last];
        int insertAt = last;
        while (insertAt > 0 && refs[insertAt - 1] > ref) {
            insertAt--;
        }
        if (insertAt == last) {
            return;
        }
        if (insertAt < shared) {
            refs = Arrays.copyOf(refs, refs.length);
            shared = 0;
        }
        System.arraycopy(refs, insertAt, refs, insertAt + 1, last - insertAt);
        refs[insertAt] = ref;
    }

    /**
     * Sorts the whole list in place. Only valid while no snapshot is in use.
     */
    void sort() {
        Arrays.sort(refs, 0, size);
    }

    boolean containsAny(Set<Long> deleted) {
        for (int i = 0; i < size; i++) {
            if (deleted.contains(refs[i])) {
                return true;
            }
        }
        return false;
    }

    /**
     * Drops the given references, always into a fresh array so outstanding snapshots keep their contents.
     *
     * @return the number of references left
     */
    int removeAll(Set<Long> deleted) {
        long[] kept = new long[Math.max(size, INITIAL_CAPACITY)];
        int keptSize = 0;
        for (int i = 0; i < size; i++) {
            if (deleted.contains(refs[i]) == false) {
                kept[keptSize++] = refs[i];
            }
        }
        refs = kept;
        size = keptSize;
        shared = 0;
        return keptSize;
    }

    /**
     * Point-in-time view over the current contents.
     */
    Postings snapshot() {
        if (shared < size) {
            shared = size;
        }
        return new ListPostings(refs, 0, size);
    }
}
