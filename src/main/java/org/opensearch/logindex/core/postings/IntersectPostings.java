/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.postings;

/**
 * Postings over the values present in every input.
 * <p>
 * A candidate value is pushed to every input with {@link Postings#seek(long)}. Whenever an input lands beyond the
 * candidate, the candidate is raised to that value and the sweep restarts; it converges once all inputs agree.
 */
final class IntersectPostings implements Postings {
    private final Postings[] its;
    private long cur;

    IntersectPostings(Postings[] its) {
        this.its = its;
    }

    @Override
    public long at() {
        return cur;
    }

    private boolean converge() {
        sweep: while (true) {
            for (Postings p : its) {
                if (p.seek(cur) == false) {
                    return false;
                }
                if (p.at() > cur) {
                    cur = p.at();
                    continue sweep;
                }
            }
            return true;
        }
    }

    @Override
    public boolean next() {
        for (Postings p : its) {
            if (p.next() == false) {
                return false;
            }
            if (p.at() > cur) {
                cur = p.at();
            }
        }
        return converge();
    }

    @Override
    public boolean seek(long target) {
        cur = target;
        return converge();
    }

    @Override
    public Exception err() {
        for (Postings p : its) {
            Exception err = p.err();
            if (err != null) {
                return err;
            }
        }
        return null;
    }
}
