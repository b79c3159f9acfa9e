/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.index;

import org.opensearch.logindex.core.postings.Postings;
import org.opensearch.logindex.core.postings.PostingsUtils;
import org.opensearch.test.OpenSearchTestCase;

import java.util.Set;

public class PostingsListTests extends OpenSearchTestCase {

    private static PostingsList of(boolean keepSorted, long... refs) {
        PostingsList list = new PostingsList();
        for (long ref : refs) {
            list.append(ref, keepSorted);
        }
        return list;
    }

    public void testAppendKeepsSortedOrder() {
        PostingsList list = of(true, 5, 1, 9, 3, 3, 7);
        assertArrayEquals(new long[] { 1, 3, 3, 5, 7, 9 }, PostingsUtils.expand(list.snapshot()));
        assertEquals(6, list.size());
    }

    public void testUnsortedAppendThenSort() {
        PostingsList list = of(false, 5, 1, 9, 3);
        list.sort();
        assertArrayEquals(new long[] { 1, 3, 5, 9 }, PostingsUtils.expand(list.snapshot()));
    }

    public void testSnapshotUnaffectedByTailRepair() {
        PostingsList list = of(true, 10, 20, 30);
        Postings snapshot = list.snapshot();
        list.append(15, true);
        list.append(40, true);
        assertArrayEquals(new long[] { 10, 20, 30 }, PostingsUtils.expand(snapshot));
        assertArrayEquals(new long[] { 10, 15, 20, 30, 40 }, PostingsUtils.expand(list.snapshot()));
    }

    public void testSnapshotUnaffectedByRemoval() {
        PostingsList list = of(true, 1, 2, 3, 4);
        Postings snapshot = list.snapshot();
        assertTrue(list.containsAny(Set.of(2L, 100L)));
        assertFalse(list.containsAny(Set.of(100L)));
        assertEquals(2, list.removeAll(Set.of(1L, 3L)));
        assertArrayEquals(new long[] { 1, 2, 3, 4 }, PostingsUtils.expand(snapshot));
        assertArrayEquals(new long[] { 2, 4 }, PostingsUtils.expand(list.snapshot()));
    }

    public void testRemoveEverything() {
        PostingsList list = of(true, 1, 2);
        assertEquals(0, list.removeAll(Set.of(1L, 2L)));
        assertEquals(0, list.size());
        list.append(3, true);
        assertArrayEquals(new long[] { 3 }, PostingsUtils.expand(list.snapshot()));
    }
}
