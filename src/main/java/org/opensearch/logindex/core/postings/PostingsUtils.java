/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.postings;

import org.apache.lucene.util.ArrayUtil;
import org.opensearch.ExceptionsHelper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Factories for the sentinel postings and the set operations over {@link Postings}.
 */
public final class PostingsUtils {

    private PostingsUtils() {
        // Utility class
    }

    /**
     * Returns the shared empty postings. Returning it instead of an empty list lets {@link #intersect(Postings...)}
     * and {@link #without(Postings, Postings)} short-circuit.
     *
     * @return the empty sentinel
     */
    public static Postings emptyPostings() {
        return ErrPostings.EMPTY;
    }

    /**
     * Tests for the empty sentinel by identity. A false result does not mean the postings have values.
     *
     * @param p postings to test
     * @return true if {@code p} is the empty sentinel
     */
    public static boolean isEmptyPostingsType(Postings p) {
        return p == ErrPostings.EMPTY;
    }

    /**
     * Returns postings that fail immediately.
     *
     * @param err the error reported by {@link Postings#err()}
     * @return failing postings
     */
    public static Postings errPostings(Exception err) {
        return new ErrPostings(err);
    }

    /**
     * Intersection of the inputs.
     *
     * @param its inputs
     * @return postings over values present in every input
     */
    public static Postings intersect(Postings... its) {
        if (its.length == 0) {
            return emptyPostings();
        }
        if (its.length == 1) {
            return its[0];
        }
        for (Postings p : its) {
            if (isEmptyPostingsType(p)) {
                return emptyPostings();
            }
        }
        return new IntersectPostings(its.clone());
    }

    /**
     * Union of the inputs, without duplicates. Every input is advanced once here; inputs without values are
     * dropped, and an input that failed turns the whole result into {@link #errPostings(Exception)}.
     *
     * @param its inputs
     * @return postings over values present in any input
     */
    public static Postings merge(Postings... its) {
        if (its.length == 0) {
            return emptyPostings();
        }
        if (its.length == 1) {
            return its[0];
        }
        List<Postings> positioned = new ArrayList<>(its.length);
        for (Postings p : its) {
            if (p.next()) {
                positioned.add(p);
            } else if (p.err() != null) {
                return errPostings(p.err());
            }
        }
        if (positioned.isEmpty()) {
            return emptyPostings();
        }
        return new MergedPostings(positioned);
    }

    /**
     * Values of {@code full} that are not in {@code drop}.
     *
     * @param full values to keep
     * @param drop values to remove
     * @return postings over the difference
     */
    public static Postings without(Postings full, Postings drop) {
        if (isEmptyPostingsType(full)) {
            return emptyPostings();
        }
        if (isEmptyPostingsType(drop)) {
            return full;
        }
        return new RemovedPostings(full, drop);
    }

    /**
     * Drains the postings into an array. Meant for tests and small lists.
     *
     * @param p postings to drain
     * @return the remaining values in order
     * @throws RuntimeException wrapping the postings error, if iteration failed
     */
    public static long[] expand(Postings p) {
        long[] values = new long[8];
        int size = 0;
        while (p.next()) {
            values = ArrayUtil.grow(values, size + 1);
            values[size++] = p.at();
        }
        if (p.err() != null) {
            throw ExceptionsHelper.convertToRuntime(p.err());
        }
        return Arrays.copyOf(values, size);
    }
}
