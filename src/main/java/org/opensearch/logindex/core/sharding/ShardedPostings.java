/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.sharding;

import org.opensearch.logindex.core.postings.Postings;

/**
 * Restricts postings to the offset range that may contain the series of one shard. The result is a superset of the
 * shard's series: callers needing exact membership filter by fingerprint afterwards.
 */
public final class ShardedPostings implements Postings {
    private final Postings inner;
    private final long minOffset;
    private final long maxOffset;
    private boolean initialized;

    /**
     * Creates sharded postings.
     *
     * @param inner   postings ordered by series reference
     * @param filter  shard to restrict to
     * @param offsets fingerprint offsets table of the series stream
     */
    public ShardedPostings(Postings inner, FingerprintFilter filter, FingerprintOffsets offsets) {
        this.inner = inner;
        FingerprintOffsets.OffsetRange range = offsets.range(filter);
        this.minOffset = range.min();
        this.maxOffset = range.max();
    }

    @Override
    public boolean next() {
        if (initialized == false) {
            initialized = true;
            return inner.seek(minOffset) && inner.at() < maxOffset;
        }
        return inner.next() && inner.at() < maxOffset;
    }

    @Override
    public boolean seek(long target) {
        if (target >= maxOffset) {
            return false;
        }
        initialized = true;
        return inner.seek(Math.max(target, minOffset)) && inner.at() < maxOffset;
    }

    @Override
    public long at() {
        return inner.at();
    }

    @Override
    public Exception err() {
        return inner.err();
    }
}
