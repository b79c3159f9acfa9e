/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.postings;

import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.util.BitUtil;
import org.apache.lucene.util.BytesRef;

/**
 * Postings over a flat sequence of 4-byte big-endian unsigned integers, decoded lazily.
 * <p>
 * The buffer carries no length prefix or delimiter. Trailing bytes that do not form a whole value are reported
 * through {@link #err()} once every complete value has been returned.
 */
public final class BigEndianPostings implements Postings {
    private static final int VALUE_BYTES = Integer.BYTES;

    private final byte[] bytes;
    private final int end;
    private final int trailingBytes;
    private int offset;
    private long cur;
    private boolean positioned;
    private Exception err;

    /**
     * @param list encoded postings
     */
    public BigEndianPostings(BytesRef list) {
        this.bytes = list.bytes;
        this.offset = list.offset;
        this.trailingBytes = list.length % VALUE_BYTES;
        this.end = list.offset + list.length - trailingBytes;
    }

    private long valueAt(int byteOffset) {
        return Integer.toUnsignedLong((int) BitUtil.VH_BE_INT.get(bytes, byteOffset));
    }

    @Override
    public boolean next() {
        if (offset < end) {
            cur = valueAt(offset);
            offset += VALUE_BYTES;
            positioned = true;
            return true;
        }
        return exhausted();
    }

    @Override
    public boolean seek(long target) {
        if (positioned && cur >= target) {
            return true;
        }
        // binary search over whole values between the current position and the end
        int lo = 0;
        int hi = (end - offset) / VALUE_BYTES;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (valueAt(offset + mid * VALUE_BYTES) < target) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        int found = offset + lo * VALUE_BYTES;
        if (found < end) {
            cur = valueAt(found);
            offset = found + VALUE_BYTES;
            positioned = true;
            return true;
        }
        offset = end;
        return exhausted();
    }

    private boolean exhausted() {
        positioned = false;
        if (trailingBytes != 0 && err == null) {
            err = new CorruptIndexException(
                "postings length is not a multiple of " + VALUE_BYTES + " bytes, found " + trailingBytes + " trailing bytes",
                "big endian postings"
            );
        }
        return false;
    }

    @Override
    public long at() {
        return cur;
    }

    @Override
    public Exception err() {
        return err;
    }
}
