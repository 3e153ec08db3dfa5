// file: src/main/java/io/crdtlite/codec/patch/PatchFormat.java
package io.crdtlite.codec.patch;

/** Wire encodings a patch can travel in. */
public enum PatchFormat {
    /** JSON object with named fields; for debugging and interop. */
    VERBOSE,
    /** Positional JSON arrays. */
    COMPACT,
    /** The compact arrays as CBOR. */
    COMPACT_BINARY,
    /** Hand-packed binary with variable-length integers; the smallest. */
    BINARY
}
