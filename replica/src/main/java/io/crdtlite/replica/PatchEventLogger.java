// file: src/main/java/io/crdtlite/replica/PatchEventLogger.java
package io.crdtlite.replica;

import io.crdtlite.core.patch.Patch;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Minimal hook for patch-level logging.
 *
 * Responsibilities:
 *  - Central place to log which patches were applied, dropped or rejected.
 *  - Can later be swapped for a metrics backend.
 */
public final class PatchEventLogger {
    private static final Logger log = Logger.getLogger(PatchEventLogger.class.getName());

    /** Where a patch came from. */
    public enum Source {
        LOCAL, REMOTE
    }

    /** What the replica did with it. */
    public enum Outcome {
        APPLIED, DUPLICATE, REJECTED
    }

    private PatchEventLogger() {
        // utility
    }

    /**
     * Log one handled patch.
     *
     * @param source  local edit or received from a peer
     * @param outcome applied, dropped as duplicate, or rejected
     * @param patch   decoded patch, or null when decoding failed
     * @param bytes   wire size of the patch
     * @param micros  time spent decoding and applying, or -1 if not measured
     * @param error   failure for rejected patches, null otherwise
     */
    public static void logPatch(
            Source source,
            Outcome outcome,
            Patch patch,
            int bytes,
            long micros,
            Throwable error
    ) {
        if (outcome != Outcome.REJECTED && !log.isLoggable(Level.FINE)) return;
        String msg = String.format(
                "PATCH %s %s -> %s (ops=%d, bytes=%d%s)",
                source,
                patch == null || patch.isEmpty() ? "?" : patch.id(),
                outcome,
                patch == null ? 0 : patch.ops().size(),
                bytes,
                micros >= 0 ? ", took=" + micros + "us" : ""
        );

        if (outcome == Outcome.REJECTED) {
            log.log(Level.WARNING, msg, error);
        } else {
            log.log(Level.FINE, msg);
        }
    }
}
