// file: src/main/java/io/crdtlite/core/rga/Slicer.java
package io.crdtlite.core.rga;

import io.crdtlite.core.clock.Timestamp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Payload strategy for an {@link Rga}: how to measure a chunk's content and
 * how to cut it at an item offset.
 * <p>
 * Implementations must agree with each other on what one "item" is:
 *  - {@link #STRING}: one Unicode code point, so surrogate pairs never split,
 *  - {@link #BYTES}: one byte,
 *  - {@link #IDS}: one array element id.
 */
public interface Slicer<T> {

    /** Number of items in {@code data}. */
    long length(T data);

    /** Items {@code [from, to)} of {@code data}. */
    T slice(T data, int from, int to);

    Slicer<String> STRING = new Slicer<>() {
        @Override
        public long length(String data) {
            return data.codePointCount(0, data.length());
        }

        @Override
        public String slice(String data, int from, int to) {
            int begin = data.offsetByCodePoints(0, from);
            int end = data.offsetByCodePoints(begin, to - from);
            return data.substring(begin, end);
        }
    };

    Slicer<byte[]> BYTES = new Slicer<>() {
        @Override
        public long length(byte[] data) {
            return data.length;
        }

        @Override
        public byte[] slice(byte[] data, int from, int to) {
            return Arrays.copyOfRange(data, from, to);
        }
    };

    Slicer<List<Timestamp>> IDS = new Slicer<>() {
        @Override
        public long length(List<Timestamp> data) {
            return data.size();
        }

        @Override
        public List<Timestamp> slice(List<Timestamp> data, int from, int to) {
            return new ArrayList<>(data.subList(from, to));
        }
    };
}
