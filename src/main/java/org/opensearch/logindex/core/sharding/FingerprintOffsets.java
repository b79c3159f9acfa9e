/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.sharding;

import org.apache.lucene.util.ArrayUtil;
import org.opensearch.common.settings.Settings;
import org.opensearch.logindex.LogIndexPlugin;

import java.util.Arrays;

/**
 * Sampled table of {@code (offset, fingerprint)} pairs taken from a series stream ordered by fingerprint, where the
 * offset is the series reference. Maps a {@link FingerprintFilter} to an offset range that contains every matching
 * series, possibly along with some neighbours.
 */
public final class FingerprintOffsets {

    /**
     * Half-open range of series references {@code [min, max)}. A max of {@link Long#MAX_VALUE} is unbounded.
     *
     * @param min first reference that may match
     * @param max first reference past the matching series
     */
    public record OffsetRange(long min, long max) {
    }

    private final long[] offsets;
    private final long[] fingerprints;

    /**
     * Creates a table from samples sorted by fingerprint. The arrays are copied.
     *
     * @param offsets      sample offsets
     * @param fingerprints sample fingerprints, ascending as unsigned values
     */
    public FingerprintOffsets(long[] offsets, long[] fingerprints) {
        this(offsets, fingerprints, offsets.length);
    }

    private FingerprintOffsets(long[] offsets, long[] fingerprints, int size) {
        if (offsets.length != fingerprints.length) {
            throw new IllegalArgumentException(
                "Offsets and fingerprints differ in length: [" + offsets.length + "] vs [" + fingerprints.length + "]"
            );
        }
        this.offsets = Arrays.copyOf(offsets, size);
        this.fingerprints = Arrays.copyOf(fingerprints, size);
        for (int i = 1; i < size; i++) {
            if (Long.compareUnsigned(this.fingerprints[i - 1], this.fingerprints[i]) > 0) {
                throw new IllegalArgumentException("Fingerprints must be ascending, found unordered sample at [" + i + "]");
            }
        }
    }

    /**
     * Number of samples.
     *
     * @return the sample count
     */
    public int size() {
        return offsets.length;
    }

    /**
     * Returns the conservative offset range of the series matching a filter.
     *
     * @param filter fingerprint filter
     * @return the range, {@code [0, Long.MAX_VALUE)} for an empty table
     */
    public OffsetRange range(FingerprintFilter filter) {
        FingerprintBounds bounds = filter.bounds();
        int lower = firstAbove(bounds.min(), false);
        int upper = firstAbove(bounds.max(), true);
        long min = lower > 0 ? offsets[lower - 1] : 0L;
        long max = upper < offsets.length ? offsets[upper] : Long.MAX_VALUE;
        return new OffsetRange(min, max);
    }

    // first index whose fingerprint is >= fingerprint, or > fingerprint when strict
    private int firstAbove(long fingerprint, boolean strict) {
        int lo = 0;
        int hi = fingerprints.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            int cmp = Long.compareUnsigned(fingerprints[mid], fingerprint);
            if (cmp < 0 || (strict && cmp == 0)) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    @Override
    public String toString() {
        return "FingerprintOffsets{offsets=" + Arrays.toString(offsets) + ", samples=" + offsets.length + "}";
    }

    /**
     * Samples every n-th series of a fingerprint-ordered stream. The first series is always kept.
     */
    public static final class Builder {
        private final int sampleRate;
        private long[] offsets = new long[16];
        private long[] fingerprints = new long[16];
        private int size;
        private long seen;
        private long lastFingerprint;

        /**
         * Creates a builder with the sample rate configured in the given settings.
         *
         * @param settings index settings
         */
        public Builder(Settings settings) {
            this(LogIndexPlugin.SHARD_FINGERPRINT_OFFSETS_SAMPLE_RATE.get(settings));
        }

        /**
         * Creates a builder keeping one series out of {@code sampleRate}.
         *
         * @param sampleRate sampling interval, at least 1
         */
        public Builder(int sampleRate) {
            if (sampleRate < 1) {
                throw new IllegalArgumentException("Sample rate must be at least 1, got [" + sampleRate + "]");
            }
            this.sampleRate = sampleRate;
        }

        /**
         * Records the next series of the stream.
         *
         * @param offset      series reference
         * @param fingerprint series fingerprint, not lower than the previous one
         * @return this builder
         */
        public Builder add(long offset, long fingerprint) {
            if (seen > 0 && Long.compareUnsigned(fingerprint, lastFingerprint) < 0) {
                throw new IllegalArgumentException(
                    "Fingerprint ["
                        + Long.toUnsignedString(fingerprint)
                        + "] is lower than the previous one ["
                        + Long.toUnsignedString(lastFingerprint)
                        + "]"
                );
            }
            if (seen % sampleRate == 0) {
                if (size == offsets.length) {
                    offsets = ArrayUtil.grow(offsets, size + 1);
                    fingerprints = ArrayUtil.grow(fingerprints, size + 1);
                }
                offsets[size] = offset;
                fingerprints[size] = fingerprint;
                size++;
            }
            lastFingerprint = fingerprint;
            seen++;
            return this;
        }

        /**
         * Builds the table from the samples collected so far.
         *
         * @return the table
         */
        public FingerprintOffsets build() {
            return new FingerprintOffsets(offsets, fingerprints, size);
        }
    }
}
