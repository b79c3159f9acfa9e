/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.sharding;

/**
 * Inclusive range of fingerprints, compared as unsigned 64-bit values.
 *
 * @param min lowest matching fingerprint
 * @param max highest matching fingerprint
 */
public record FingerprintBounds(long min, long max) implements FingerprintFilter {

    /**
     * Bounds matching every fingerprint.
     */
    public static final FingerprintBounds ALL = new FingerprintBounds(0L, -1L);

    @Override
    public boolean match(long fingerprint) {
        return Long.compareUnsigned(fingerprint, min) >= 0 && Long.compareUnsigned(fingerprint, max) <= 0;
    }

    @Override
    public FingerprintBounds bounds() {
        return this;
    }

    @Override
    public String toString() {
        return "[" + Long.toHexString(min) + ", " + Long.toHexString(max) + "]";
    }
}
