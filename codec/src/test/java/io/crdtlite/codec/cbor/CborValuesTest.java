package io.crdtlite.codec.cbor;

import io.crdtlite.codec.CodecException;
import io.crdtlite.codec.ErrorCode;
import io.crdtlite.codec.binary.CrdtReader;
import io.crdtlite.codec.binary.CrdtWriter;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static io.crdtlite.codec.TestJson.json;
import static org.junit.jupiter.api.Assertions.*;

class CborValuesTest {

    @Test
    void consecutive_values_are_read_one_at_a_time() {
        var out = new CrdtWriter();
        CborValues.write(out, json("{'a':[1,2,'x']}"));
        CborValues.writeUndefined(out);
        CborValues.write(out, json("'tail'"));
        out.u8(42);

        var in = new CrdtReader(out.toByteArray());
        assertEquals(json("{'a':[1,2,'x']}"), CborValues.read(in).value());
        assertTrue(CborValues.read(in).isUndefined());
        assertEquals("tail", CborValues.readString(in));
        assertEquals(42, in.u8());
        assertTrue(in.isEof());
    }

    @Test
    void consumed_matches_the_encoded_size() {
        byte[] bytes = CborValues.encode(json("[true,null,-7,'ü']"));
        var decoded = CborValues.decode(bytes, 0);
        assertEquals(bytes.length, decoded.consumed());
        assertEquals(json("[true,null,-7,'ü']"), decoded.value());
    }

    @Test
    void consumed_is_counted_from_the_offset_in_a_large_buffer() {
        byte[] value = CborValues.encode(json("{'k':'v'}"));
        byte[] buffer = new byte[100_000 + value.length + 500];
        System.arraycopy(value, 0, buffer, 100_000, value.length);

        var decoded = CborValues.decode(buffer, 100_000);
        assertEquals(value.length, decoded.consumed());
        assertEquals(json("{'k':'v'}"), decoded.value());
    }

    @Test
    void undefined_is_a_single_byte() {
        var decoded = CborValues.decode(new byte[]{(byte) CborValues.UNDEFINED}, 0);
        assertTrue(decoded.isUndefined());
        assertEquals(1, decoded.consumed());
    }

    @Test
    void truncated_values_are_invalid_cbor() {
        byte[] bytes = CborValues.encode(json("'a longer string value'"));
        byte[] cut = Arrays.copyOf(bytes, bytes.length - 3);
        var e = assertThrows(CodecException.class, () -> CborValues.decode(cut, 0));
        assertEquals(ErrorCode.INVALID_CBOR, e.code());
    }

    @Test
    void read_string_rejects_other_types() {
        var in = new CrdtReader(CborValues.encode(json("5")));
        var e = assertThrows(CodecException.class, () -> CborValues.readString(in));
        assertEquals(ErrorCode.INVALID_CBOR, e.code());
    }
}
