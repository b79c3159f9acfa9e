/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A single label name/value pair.
 *
 * @param name  the label name
 * @param value the label value
 */
public record Label(String name, String value) implements Comparable<Label> {

    private static final Comparator<Label> ORDER = Comparator.comparing(Label::name).thenComparing(Label::value);

    /**
     * Creates a label, rejecting null components.
     *
     * @param name  the label name
     * @param value the label value
     */
    public Label {
        Objects.requireNonNull(name, "label name must not be null");
        Objects.requireNonNull(value, "label value must not be null");
    }

    /**
     * Orders labels by name, then by value.
     */
    @Override
    public int compareTo(Label other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return name + LabelConstants.LABEL_DELIMITER + value;
    }
}
