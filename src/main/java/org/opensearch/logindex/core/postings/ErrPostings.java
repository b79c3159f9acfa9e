/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.postings;

/**
 * Postings without elements. With a null error this is the shared empty sentinel, see
 * {@link PostingsUtils#emptyPostings()}; otherwise every call fails and {@link #err()} reports the error.
 */
final class ErrPostings implements Postings {
    static final ErrPostings EMPTY = new ErrPostings(null);

    private final Exception err;

    ErrPostings(Exception err) {
        this.err = err;
    }

    @Override
    public boolean next() {
        return false;
    }

    @Override
    public boolean seek(long target) {
        return false;
    }

    @Override
    public long at() {
        return 0;
    }

    @Override
    public Exception err() {
        return err;
    }

    @Override
    public String toString() {
        return err == null ? "EmptyPostings" : "ErrPostings[" + err + "]";
    }
}
