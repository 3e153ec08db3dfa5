// file: src/main/java/io/crdtlite/codec/cbor/CborValues.java
package io.crdtlite.codec.cbor;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import io.crdtlite.codec.CodecException;
import io.crdtlite.codec.ErrorCode;
import io.crdtlite.codec.binary.CrdtReader;
import io.crdtlite.codec.binary.CrdtWriter;

import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * CBOR encoding of single JSON values, embedded inside the binary formats.
 * <p>
 * Jackson's tree model has no "undefined", so the simple value {@code 0xf7}
 * is written and recognised here; every other value goes through
 * {@link CBORMapper}.
 */
public final class CborValues {

    public static final int UNDEFINED = 0xf7;

    private static final CBORMapper MAPPER = new CBORMapper();

    /** A decoded value and the number of bytes it occupied. Null value means undefined. */
    public record Decoded(JsonNode value, int consumed) {
        public boolean isUndefined() {
            return value == null;
        }
    }

    private CborValues() {
        // utility
    }

    public static CBORMapper mapper() {
        return MAPPER;
    }

    public static byte[] encode(JsonNode value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("value is not CBOR-encodable: " + value, e);
        }
    }

    public static void write(CrdtWriter out, JsonNode value) {
        out.bytes(encode(value));
    }

    public static void writeUndefined(CrdtWriter out) {
        out.u8(UNDEFINED);
    }

    /** Decode one value at {@code offset}; {@code 0xf7} decodes as undefined. */
    public static Decoded decode(byte[] data, int offset) {
        if (offset >= data.length) throw new CodecException(ErrorCode.OVERFLOW, "CBOR value expected at " + offset);
        if ((data[offset] & 0xff) == UNDEFINED) return new Decoded(null, 1);

        int available = data.length - offset;
        // stream over the tail so byte offsets stay relative to the value start
        try (JsonParser parser = MAPPER.getFactory().createParser(new ByteArrayInputStream(data, offset, available))) {
            JsonToken token = parser.nextToken();
            if (token == null) throw new CodecException(ErrorCode.INVALID_CBOR, "no CBOR value at " + offset);
            JsonNode value = MAPPER.readTree(parser);
            long consumed = parser.currentLocation().getByteOffset();
            if (consumed <= 0 || consumed > available) {
                throw new CodecException(ErrorCode.INVALID_CBOR, "cannot locate end of CBOR value at " + offset);
            }
            return new Decoded(value, (int) consumed);
        } catch (IOException e) {
            throw new CodecException(ErrorCode.INVALID_CBOR, "bad CBOR at offset " + offset + ": " + e.getMessage(), e);
        }
    }

    /** Decode a value at the reader's position and move past it. */
    public static Decoded read(CrdtReader in) {
        var decoded = decode(in.data(), in.position());
        if (in.position() + decoded.consumed() > in.end()) {
            throw new CodecException(ErrorCode.OVERFLOW, "CBOR value runs past the end of its section");
        }
        in.skip(decoded.consumed());
        return decoded;
    }

    /** Decode a value that must be a CBOR text string. */
    public static String readString(CrdtReader in) {
        var decoded = read(in);
        if (decoded.isUndefined() || !decoded.value().isTextual()) {
            throw new CodecException(ErrorCode.INVALID_CBOR, "expected CBOR text string");
        }
        return decoded.value().textValue();
    }
}
