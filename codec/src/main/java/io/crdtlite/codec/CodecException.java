// file: src/main/java/io/crdtlite/codec/CodecException.java
package io.crdtlite.codec;

import java.util.Objects;

/** Decode failure with a machine-readable {@link ErrorCode}. */
public class CodecException extends RuntimeException {

    private final ErrorCode code;

    public CodecException(ErrorCode code, String message) {
        super(code + ": " + message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public CodecException(ErrorCode code, String message, Throwable cause) {
        super(code + ": " + message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode code() {
        return code;
    }
}
