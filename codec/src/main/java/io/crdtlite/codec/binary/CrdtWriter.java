// file: src/main/java/io/crdtlite/codec/binary/CrdtWriter.java
package io.crdtlite.codec.binary;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Growable byte buffer with the variable-length integer encodings used by
 * the binary formats.
 * <p>
 * Encodings:
 *  - vu57: up to 7 bytes of 7 payload bits with a continuation flag (0x80),
 *    then one final byte carrying 8 more bits; values up to 2^57 - 1,
 *  - b1vu56: first byte = 1 flag bit, a continuation bit (0x40) and 6 payload
 *    bits, then as vu57 for the remaining 50 bits; values up to 2^56 - 1,
 *  - id(x, y): one byte {@code x << 4 | y} when x fits 3 bits and y fits 4,
 *    otherwise b1vu56(1, x) followed by vu57(y).
 */
public final class CrdtWriter {

    public static final long MAX_VU57 = (1L << 57) - 1;
    public static final long MAX_VU56 = (1L << 56) - 1;

    private byte[] buf;
    private int size;

    public CrdtWriter() {
        this(64);
    }

    public CrdtWriter(int capacity) {
        this.buf = new byte[Math.max(capacity, 16)];
    }

    private void ensure(int extra) {
        if (size + extra > buf.length) {
            buf = Arrays.copyOf(buf, Math.max(buf.length * 2, size + extra));
        }
    }

    public int size() {
        return size;
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(buf, size);
    }

    public void u8(int b) {
        ensure(1);
        buf[size++] = (byte) b;
    }

    /** Big-endian 32-bit integer. */
    public void u32(int v) {
        ensure(4);
        buf[size++] = (byte) (v >>> 24);
        buf[size++] = (byte) (v >>> 16);
        buf[size++] = (byte) (v >>> 8);
        buf[size++] = (byte) v;
    }

    /** Overwrite 4 bytes at {@code pos} with a big-endian integer. */
    public void setU32(int pos, int v) {
        if (pos < 0 || pos + 4 > size) throw new IndexOutOfBoundsException("u32 at " + pos);
        buf[pos] = (byte) (v >>> 24);
        buf[pos + 1] = (byte) (v >>> 16);
        buf[pos + 2] = (byte) (v >>> 8);
        buf[pos + 3] = (byte) v;
    }

    public void bytes(byte[] data) {
        ensure(data.length);
        System.arraycopy(data, 0, buf, size, data.length);
        size += data.length;
    }

    /** Raw UTF-8 bytes of {@code text}; returns how many were written. */
    public int utf8(String text) {
        byte[] data = text.getBytes(StandardCharsets.UTF_8);
        bytes(data);
        return data.length;
    }

    /** @throws IllegalArgumentException if {@code v} is negative or above {@link #MAX_VU57} */
    public void vu57(long v) {
        if (v < 0 || v > MAX_VU57) throw new IllegalArgumentException("vu57 out of range: " + v);
        for (int i = 0; i < 7; i++) {
            if ((v >>> 7) == 0) {
                u8((int) v);
                return;
            }
            u8((int) (v & 0x7f) | 0x80);
            v >>>= 7;
        }
        u8((int) (v & 0xff));
    }

    /** @throws IllegalArgumentException if {@code v} is negative or above {@link #MAX_VU56} */
    public void b1vu56(boolean flag, long v) {
        if (v < 0 || v > MAX_VU56) throw new IllegalArgumentException("b1vu56 out of range: " + v);
        int f = flag ? 0x80 : 0;
        if (v <= 0x3f) {
            u8(f | (int) v);
            return;
        }
        u8(f | 0x40 | (int) (v & 0x3f));
        v >>>= 6;
        for (int i = 0; i < 6; i++) {
            if ((v >>> 7) == 0) {
                u8((int) v);
                return;
            }
            u8((int) (v & 0x7f) | 0x80);
            v >>>= 7;
        }
        u8((int) (v & 0xff));
    }

    public void id(long x, long y) {
        if (x >= 0 && x <= 0b111 && y >= 0 && y <= 0b1111) {
            u8((int) (x << 4 | y));
        } else {
            b1vu56(true, x);
            vu57(y);
        }
    }
}
