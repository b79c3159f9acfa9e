/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.postings;

/**
 * Iterative access over an ascending list of series references.
 * <p>
 * An iterator starts positioned before its first element. Successive values returned by {@link #at()} are strictly
 * increasing. Faults are never thrown from the iteration methods: once {@link #next()} or {@link #seek(long)}
 * returns false, callers check {@link #err()} to tell exhaustion from failure.
 */
public interface Postings {

    /**
     * Advances the iterator.
     *
     * @return true if another value was found
     */
    boolean next();

    /**
     * Advances the iterator to the first value greater than or equal to {@code target}. If the iterator is already
     * positioned on such a value it does not move and returns true.
     *
     * @param target the series reference to seek to
     * @return true if a value was found
     */
    boolean seek(long target);

    /**
     * Returns the value at the current position. Only valid after a successful {@link #next()} or {@link #seek(long)}.
     *
     * @return the current series reference
     */
    long at();

    /**
     * Returns the fault that terminated iteration, if any.
     *
     * @return the fault, or null
     */
    Exception err();
}
