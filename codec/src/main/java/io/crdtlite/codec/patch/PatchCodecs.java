// file: src/main/java/io/crdtlite/codec/patch/PatchCodecs.java
package io.crdtlite.codec.patch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.crdtlite.codec.CodecException;
import io.crdtlite.codec.ErrorCode;
import io.crdtlite.core.patch.Patch;

import java.io.IOException;
import java.util.Objects;

/**
 * One entry point for all patch formats, working on bytes. JSON formats are
 * written as UTF-8 text.
 * <p>
 * Instances are stateless and safe to share.
 */
public final class PatchCodecs {

    private final ObjectMapper json = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    private final VerbosePatchCodec verbose = new VerbosePatchCodec();
    private final CompactPatchCodec compact = new CompactPatchCodec();
    private final CompactBinaryPatchCodec compactBinary = new CompactBinaryPatchCodec();
    private final BinaryPatchEncoder binaryEncoder = new BinaryPatchEncoder();
    private final BinaryPatchDecoder binaryDecoder = new BinaryPatchDecoder();

    public byte[] encode(Patch patch, PatchFormat format) {
        Objects.requireNonNull(format, "format");
        try {
            return switch (format) {
                case VERBOSE -> json.writeValueAsBytes(verbose.encode(patch));
                case COMPACT -> json.writeValueAsBytes(compact.encode(patch));
                case COMPACT_BINARY -> compactBinary.encode(patch);
                case BINARY -> binaryEncoder.encode(patch);
            };
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("patch cannot be written as JSON", e);
        }
    }

    public Patch decode(byte[] data, PatchFormat format) {
        Objects.requireNonNull(format, "format");
        return switch (format) {
            case VERBOSE -> verbose.decode(readJson(data));
            case COMPACT -> compact.decode(readJson(data));
            case COMPACT_BINARY -> compactBinary.decode(data);
            case BINARY -> binaryDecoder.decode(data);
        };
    }

    /** Lenient binary decode; see {@link BinaryPatchDecoder#decodeLenient}. */
    public RawPatch decodeRaw(byte[] data) {
        return binaryDecoder.decodeLenient(data);
    }

    private JsonNode readJson(byte[] data) {
        try {
            var node = json.readTree(data);
            if (node == null || node.isMissingNode()) throw new CodecException(ErrorCode.INVALID_PATCH, "empty input");
            return node;
        } catch (JsonProcessingException e) {
            throw new CodecException(ErrorCode.INVALID_PATCH, "bad JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CodecException(ErrorCode.INVALID_PATCH, "unreadable JSON", e);
        }
    }
}
