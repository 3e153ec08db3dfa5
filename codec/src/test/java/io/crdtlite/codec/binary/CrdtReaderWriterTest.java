package io.crdtlite.codec.binary;

import io.crdtlite.codec.CodecException;
import io.crdtlite.codec.ErrorCode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavior tests: variable-length integers must survive the boundaries where an
 * extra byte is needed, and reading past the end must fail loudly.
 */
class CrdtReaderWriterTest {

    private static final long MAX_VU57 = CrdtWriter.MAX_VU57;
    private static final long MAX_VU56 = CrdtWriter.MAX_VU56;

    private static long vu57(long v) {
        var out = new CrdtWriter();
        out.vu57(v);
        var in = new CrdtReader(out.toByteArray());
        long read = in.vu57();
        assertTrue(in.isEof(), "reader should consume exactly what was written for " + v);
        return read;
    }

    @Test
    void vu57_survives_every_byte_boundary() {
        for (long v : new long[]{0, 1, 127, 128, 16_383, 16_384, 1L << 49, (1L << 49) - 1, MAX_VU57}) {
            assertEquals(v, vu57(v));
        }
    }

    @Test
    void vu57_uses_one_byte_for_small_values_and_eight_for_the_largest() {
        var small = new CrdtWriter();
        small.vu57(127);
        assertEquals(1, small.size());

        var large = new CrdtWriter();
        large.vu57(MAX_VU57);
        assertEquals(8, large.size());
    }

    @Test
    void b1vu56_keeps_flag_and_value_apart() {
        for (boolean flag : new boolean[]{false, true}) {
            for (long v : new long[]{0, 63, 64, 8191, 8192, 1L << 48, MAX_VU56}) {
                var out = new CrdtWriter();
                out.b1vu56(flag, v);
                var in = new CrdtReader(out.toByteArray());
                var read = in.b1vu56();
                assertEquals(flag, read.flag());
                assertEquals(v, read.value());
                assertTrue(in.isEof());
            }
        }
    }

    @Test
    void values_past_the_varint_range_are_refused_instead_of_truncated() {
        var out = new CrdtWriter();
        out.vu57((1L << 57) - 1);
        assertEquals(8, out.size());

        assertThrows(IllegalArgumentException.class, () -> out.vu57(1L << 57));
        assertThrows(IllegalArgumentException.class, () -> out.vu57(Long.MAX_VALUE));
        assertThrows(IllegalArgumentException.class, () -> out.vu57(-1));
        assertThrows(IllegalArgumentException.class, () -> out.b1vu56(true, 1L << 56));
        assertThrows(IllegalArgumentException.class, () -> out.b1vu56(false, -1));
        assertEquals(8, out.size(), "rejected values must not leave partial bytes behind");
    }

    @Test
    void small_relative_ids_fit_one_byte() {
        var out = new CrdtWriter();
        out.id(7, 15);
        assertEquals(1, out.size());
        assertEquals(new CrdtReader.Id(7, 15), new CrdtReader(out.toByteArray()).id());
    }

    @Test
    void large_relative_ids_use_the_long_form() {
        var out = new CrdtWriter();
        out.id(8, 300);
        assertTrue(out.size() > 1);
        assertEquals(new CrdtReader.Id(8, 300), new CrdtReader(out.toByteArray()).id());

        var out2 = new CrdtWriter();
        out2.id(1, 16);
        assertEquals(new CrdtReader.Id(1, 16), new CrdtReader(out2.toByteArray()).id());
    }

    @Test
    void u32_can_be_patched_after_the_fact() {
        var out = new CrdtWriter();
        out.u32(0);
        out.u8(9);
        out.setU32(0, 0x01020304);
        var in = new CrdtReader(out.toByteArray());
        assertEquals(0x01020304, in.u32());
        assertEquals(9, in.u8());
    }

    @Test
    void utf8_reports_the_byte_count_it_wrote() {
        var out = new CrdtWriter();
        int n = out.utf8("hé😀");
        assertEquals(1 + 2 + 4, n);
        assertEquals("hé😀", new CrdtReader(out.toByteArray()).utf8(n));
    }

    @Test
    void reading_past_the_end_is_an_overflow() {
        var in = new CrdtReader(new byte[]{(byte) 0x80});
        var e = assertThrows(CodecException.class, in::vu57);
        assertEquals(ErrorCode.OVERFLOW, e.code());
    }

    @Test
    void malformed_utf8_is_rejected() {
        var in = new CrdtReader(new byte[]{(byte) 0xc3, 0x28});
        var e = assertThrows(CodecException.class, () -> in.utf8(2));
        assertEquals(ErrorCode.INVALID_UTF8, e.code());
    }

    @Test
    void a_reader_window_does_not_see_bytes_outside_it() {
        var in = new CrdtReader(new byte[]{1, 2, 3, 4}, 1, 3);
        assertEquals(2, in.u8());
        assertEquals(3, in.u8());
        assertTrue(in.isEof());
        assertThrows(CodecException.class, in::u8);
    }
}
