/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.model;

/**
 * Constants used for label formatting.
 */
public final class LabelConstants {

    private LabelConstants() {
        // Utility class
    }

    /** Empty string, also the name and value of the all-postings label. */
    public static final String EMPTY_STRING = "";

    /** Delimiter between a label name and its value. */
    public static final char LABEL_DELIMITER = ':';

    /** Delimiter between name and value in label-pair statistics. */
    public static final char PAIR_DELIMITER = '=';
}
