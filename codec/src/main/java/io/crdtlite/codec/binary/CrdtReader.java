// file: src/main/java/io/crdtlite/codec/binary/CrdtReader.java
package io.crdtlite.codec.binary;

import io.crdtlite.codec.CodecException;
import io.crdtlite.codec.ErrorCode;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Cursor over a byte array that decodes what {@link CrdtWriter} writes.
 * Reading past the end fails with {@link ErrorCode#OVERFLOW}.
 */
public final class CrdtReader {

    /** A b1vu56 value: the flag bit plus the number. */
    public record Flagged(boolean flag, long value) {
    }

    /** A compact id: (x, y) as written by {@link CrdtWriter#id}. */
    public record Id(long x, long y) {
    }

    private final byte[] data;
    private final int end;
    private int pos;

    public CrdtReader(byte[] data) {
        this(data, 0, data.length);
    }

    public CrdtReader(byte[] data, int offset, int end) {
        if (offset < 0 || end > data.length || offset > end) {
            throw new IndexOutOfBoundsException("range " + offset + ".." + end + " of " + data.length);
        }
        this.data = data;
        this.pos = offset;
        this.end = end;
    }

    public byte[] data() {
        return data;
    }

    public int position() {
        return pos;
    }

    public void position(int newPos) {
        if (newPos < 0 || newPos > end) throw new CodecException(ErrorCode.OVERFLOW, "seek to " + newPos);
        pos = newPos;
    }

    public int end() {
        return end;
    }

    public int remaining() {
        return end - pos;
    }

    public boolean isEof() {
        return pos >= end;
    }

    private void need(int n) {
        if (n < 0 || end - pos < n) {
            throw new CodecException(ErrorCode.OVERFLOW, "need " + n + " bytes at offset " + pos + ", have " + (end - pos));
        }
    }

    public int peek() {
        need(1);
        return data[pos] & 0xff;
    }

    public int u8() {
        need(1);
        return data[pos++] & 0xff;
    }

    public int u32() {
        need(4);
        int v = (data[pos] & 0xff) << 24 | (data[pos + 1] & 0xff) << 16
                | (data[pos + 2] & 0xff) << 8 | (data[pos + 3] & 0xff);
        pos += 4;
        return v;
    }

    public byte[] bytes(int n) {
        need(n);
        byte[] out = Arrays.copyOfRange(data, pos, pos + n);
        pos += n;
        return out;
    }

    public void skip(int n) {
        need(n);
        pos += n;
    }

    /** {@code n} bytes of strictly valid UTF-8. */
    public String utf8(int n) {
        need(n);
        try {
            var text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data, pos, n))
                    .toString();
            pos += n;
            return text;
        } catch (CharacterCodingException e) {
            throw new CodecException(ErrorCode.INVALID_UTF8, "bad UTF-8 at offset " + pos, e);
        }
    }

    public long vu57() {
        long v = 0;
        for (int i = 0; i < 7; i++) {
            int b = u8();
            v |= (long) (b & 0x7f) << (7 * i);
            if ((b & 0x80) == 0) return v;
        }
        return v | (long) u8() << 49;
    }

    /** vu57 that must fit an int, as lengths and counts do. */
    public int vu57Int() {
        long v = vu57();
        if (v > Integer.MAX_VALUE) throw new CodecException(ErrorCode.OVERFLOW, "length " + v + " too large");
        return (int) v;
    }

    public Flagged b1vu56() {
        int b = u8();
        boolean flag = (b & 0x80) != 0;
        long v = b & 0x3f;
        if ((b & 0x40) == 0) return new Flagged(flag, v);
        int shift = 6;
        for (int i = 0; i < 6; i++) {
            b = u8();
            v |= (long) (b & 0x7f) << shift;
            if ((b & 0x80) == 0) return new Flagged(flag, v);
            shift += 7;
        }
        return new Flagged(flag, v | (long) u8() << 48);
    }

    public Id id() {
        int b = peek();
        if (b <= 0x7f) {
            pos++;
            return new Id(b >>> 4, b & 0x0f);
        }
        long x = b1vu56().value();
        long y = vu57();
        return new Id(x, y);
    }
}
