/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.sharding;

/**
 * Selects series by their 64-bit fingerprint. Fingerprints are compared as unsigned values.
 */
public interface FingerprintFilter {

    /**
     * Whether the fingerprint belongs to this filter.
     *
     * @param fingerprint series fingerprint
     * @return true on match
     */
    boolean match(long fingerprint);

    /**
     * Returns the inclusive unsigned range covering every matching fingerprint.
     *
     * @return the bounds
     */
    FingerprintBounds bounds();
}
