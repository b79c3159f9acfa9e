/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.model;

import java.util.function.BiConsumer;

/**
 * Labels is a set of name/value pairs, sorted by name.
 */
public interface Labels {

    /**
     * Visit every label in name order.
     * @param consumer receives each name and value
     */
    void forEach(BiConsumer<String, String> consumer);
}
