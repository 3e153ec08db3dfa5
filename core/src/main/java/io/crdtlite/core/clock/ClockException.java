// file: src/main/java/io/crdtlite/core/clock/ClockException.java
package io.crdtlite.core.clock;

/**
 * Raised when a clock cannot advance: arithmetic overflow of a session's time,
 * or a server clock receiving an operation from its own future.
 */
public class ClockException extends RuntimeException {

    public ClockException(String message) {
        super(message);
    }

    public ClockException(String message, Throwable cause) {
        super(message, cause);
    }
}
