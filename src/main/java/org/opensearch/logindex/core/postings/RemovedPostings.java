/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.postings;

/**
 * Postings over every value of {@code full} that is not in {@code remove}.
 * <p>
 * {@code full} always runs one value ahead of what was returned; {@code remove} is only forwarded when it falls
 * behind {@code full}.
 */
final class RemovedPostings implements Postings {
    private final Postings full;
    private final Postings remove;
    private long cur;
    private boolean initialized;
    private boolean positioned;
    private boolean fullOk;
    private boolean removeOk;

    RemovedPostings(Postings full, Postings remove) {
        this.full = full;
        this.remove = remove;
    }

    @Override
    public long at() {
        return cur;
    }

    @Override
    public boolean next() {
        if (initialized == false) {
            fullOk = full.next();
            removeOk = remove.next();
            initialized = true;
        }
        while (true) {
            if (fullOk == false) {
                return positioned = false;
            }
            if (removeOk == false) {
                if (remove.err() != null) {
                    return positioned = false;
                }
                return emitCurrent();
            }
            long fcur = full.at();
            long rcur = remove.at();
            if (fcur < rcur) {
                return emitCurrent();
            } else if (rcur < fcur) {
                removeOk = remove.seek(fcur);
            } else {
                fullOk = full.next();
            }
        }
    }

    private boolean emitCurrent() {
        cur = full.at();
        fullOk = full.next();
        return positioned = true;
    }

    @Override
    public boolean seek(long target) {
        if (positioned && cur >= target) {
            return true;
        }
        if (initialized == false || fullOk) {
            fullOk = full.seek(target);
        }
        if (initialized == false || removeOk) {
            removeOk = remove.seek(target);
        }
        initialized = true;
        return next();
    }

    @Override
    public Exception err() {
        Exception err = full.err();
        return err != null ? err : remove.err();
    }
}
