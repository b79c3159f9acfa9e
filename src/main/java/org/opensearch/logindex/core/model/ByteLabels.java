/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logindex.core.model;

import org.apache.lucene.util.BytesRef;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.BiConsumer;

/**
 * ByteLabels implements Labels as a flat byte array of name-value pairs sorted by name.
 *
 * <h2>Encoding Format</h2>
 * <pre>
 * [name1_len][name1_bytes][value1_len][value1_bytes][name2_len][name2_bytes]...
 * </pre>
 * Lengths below 255 take one byte. Longer strings are written as the marker byte 255 followed by
 * three little-endian length bytes, capping a single name or value at 16MB.
 */
public final class ByteLabels implements Labels {
    private static final int LONG_LENGTH_MARKER = 255;
    private static final int MAX_LENGTH = 0xFFFFFF;

    private static final ByteLabels EMPTY = new ByteLabels(new byte[0]);

    private final byte[] data;

    private ByteLabels(byte[] data) {
        this.data = data;
    }

    /**
     * Creates a ByteLabels instance from alternating name-value strings.
     * A repeated name keeps its last value.
     *
     * @param labels an array where even indices are names and odd indices are values
     * @return a new ByteLabels instance with the given labels
     * @throws IllegalArgumentException if the array length is not even (unpaired labels)
     */
    public static ByteLabels fromStrings(String... labels) {
        if (labels.length % 2 != 0) {
            throw new IllegalArgumentException(
                "Labels must be in pairs (key-value). Received " + labels.length + " labels: " + Arrays.toString(labels)
            );
        }
        if (labels.length == 0) {
            return EMPTY;
        }
        TreeMap<String, String> sorted = new TreeMap<>();
        for (int i = 0; i < labels.length; i += 2) {
            if (labels[i] == null || labels[i + 1] == null) {
                throw new IllegalArgumentException("Label name and value cannot be null: " + labels[i] + "=" + labels[i + 1]);
            }
            sorted.put(labels[i], labels[i + 1]);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Map.Entry<String, String> entry : sorted.entrySet()) {
            writeString(out, entry.getKey());
            writeString(out, entry.getValue());
        }
        return new ByteLabels(out.toByteArray());
    }

    /**
     * Returns the shared empty instance.
     *
     * @return an empty ByteLabels instance
     */
    public static ByteLabels emptyLabels() {
        return EMPTY;
    }

    private static void writeString(ByteArrayOutputStream out, String str) {
        byte[] bytes = str.getBytes(StandardCharsets.UTF_8);
        int length = bytes.length;
        if (length < LONG_LENGTH_MARKER) {
            out.write(length);
        } else if (length <= MAX_LENGTH) {
            out.write(LONG_LENGTH_MARKER);
            out.write(length & 0xFF);
            out.write((length >> 8) & 0xFF);
            out.write((length >> 16) & 0xFF);
        } else {
            throw new IllegalArgumentException("String too long: " + length);
        }
        out.write(bytes, 0, length);
    }

    /**
     * Reads the string starting at {@code pos} into {@code ref} and returns the position after it.
     */
    private int readString(int pos, BytesRef ref) {
        int length = data[pos] & 0xFF;
        int start = pos + 1;
        if (length == LONG_LENGTH_MARKER) {
            length = (data[pos + 1] & 0xFF) | ((data[pos + 2] & 0xFF) << 8) | ((data[pos + 3] & 0xFF) << 16);
            start = pos + 4;
        }
        ref.bytes = data;
        ref.offset = start;
        ref.length = length;
        return start + length;
    }

    @Override
    public void forEach(BiConsumer<String, String> consumer) {
        BytesRef name = new BytesRef();
        BytesRef value = new BytesRef();
        int pos = 0;
        while (pos < data.length) {
            pos = readString(pos, name);
            pos = readString(pos, value);
            consumer.accept(name.utf8ToString(), value.utf8ToString());
        }
    }
}
