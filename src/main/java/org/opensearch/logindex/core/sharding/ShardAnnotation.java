/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.sharding;

/**
 * Shard {@code shard} out of {@code of} power-of-two shards. A series belongs to the shard selected by the top
 * {@code log2(of)} bits of its fingerprint, so every shard covers one contiguous fingerprint range.
 *
 * @param shard zero-based shard number
 * @param of    total number of shards
 */
public record ShardAnnotation(int shard, int of) implements FingerprintFilter {

    /**
     * Checks that {@code of} is a power of two and {@code shard} lies in {@code [0, of)}.
     *
     * @throws IllegalArgumentException if the annotation is malformed
     */
    public void validate() {
        if (of < 1 || Integer.bitCount(of) != 1) {
            throw new IllegalArgumentException("Shard count must be a power of two, got [" + of + "]");
        }
        if (shard < 0 || shard >= of) {
            throw new IllegalArgumentException("Shard [" + shard + "] is out of range for [" + of + "] shards");
        }
    }

    private int requiredBits() {
        return Integer.numberOfTrailingZeros(of);
    }

    @Override
    public boolean match(long fingerprint) {
        if (of < 2) {
            return true;
        }
        return (fingerprint >>> (Long.SIZE - requiredBits())) == shard;
    }

    @Override
    public FingerprintBounds bounds() {
        if (of < 2) {
            return FingerprintBounds.ALL;
        }
        int bits = requiredBits();
        long from = ((long) shard) << (Long.SIZE - bits);
        long through = from | (-1L >>> bits);
        return new FingerprintBounds(from, through);
    }

    @Override
    public String toString() {
        return shard + "_of_" + of;
    }
}
