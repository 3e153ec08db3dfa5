// file: src/main/java/io/crdtlite/codec/ErrorCode.java
package io.crdtlite.codec;

/** Why a decode failed. */
public enum ErrorCode {
    /** Input ended inside a value. */
    OVERFLOW,
    UNKNOWN_OPCODE,
    INVALID_CBOR,
    INVALID_UTF8,
    /** Bytes left over after a complete value. */
    TRAILING_BYTES,
    INVALID_CLOCK_TABLE,
    /** Well-formed input that does not describe a valid patch. */
    INVALID_PATCH,
    /** Well-formed input that does not describe a valid document. */
    INVALID_MODEL
}
