// file: src/main/java/io/crdtlite/codec/patch/RawPatch.java
package io.crdtlite.codec.patch;

import io.crdtlite.core.patch.Patch;

import java.util.Optional;

/**
 * Result of a lenient binary decode: the original bytes plus the decoded
 * patch when the bytes could be decoded. An opaque result keeps the bytes so
 * they can still be stored or forwarded.
 */
public record RawPatch(byte[] bytes, Patch patch) {

    public RawPatch {
        bytes = bytes.clone();
    }

    public static RawPatch opaque(byte[] bytes) {
        return new RawPatch(bytes, null);
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    public boolean isDecoded() {
        return patch != null;
    }

    public Optional<Patch> decoded() {
        return Optional.ofNullable(patch);
    }
}
