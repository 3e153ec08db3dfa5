// file: src/main/java/io/crdtlite/codec/patch/CompactBinaryPatchCodec.java
package io.crdtlite.codec.patch;

import io.crdtlite.codec.CodecException;
import io.crdtlite.codec.ErrorCode;
import io.crdtlite.codec.cbor.CborValues;
import io.crdtlite.core.patch.Patch;

/** The compact encoding serialized as CBOR instead of JSON text. */
public final class CompactBinaryPatchCodec {

    private final CompactPatchCodec compact = new CompactPatchCodec();

    public byte[] encode(Patch patch) {
        return CborValues.encode(compact.encode(patch));
    }

    public Patch decode(byte[] data) {
        if (data.length == 0) throw new CodecException(ErrorCode.OVERFLOW, "empty input");
        var decoded = CborValues.decode(data, 0);
        if (decoded.isUndefined() || !decoded.value().isArray()) {
            throw new CodecException(ErrorCode.INVALID_PATCH, "compact-binary patch must be a CBOR array");
        }
        if (decoded.consumed() != data.length) {
            throw new CodecException(ErrorCode.TRAILING_BYTES, (data.length - decoded.consumed()) + " bytes after the patch");
        }
        return compact.decode(decoded.value());
    }
}
