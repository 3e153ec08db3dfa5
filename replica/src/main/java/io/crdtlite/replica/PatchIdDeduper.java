// file: src/main/java/io/crdtlite/replica/PatchIdDeduper.java
package io.crdtlite.replica;

import io.crdtlite.core.clock.Timestamp;

/**
 * Remembers ids of patches already applied.
 * Rationale:
 *  - Peers rebroadcast and retry, so the same patch can arrive many times.
 *  - Applying a patch twice is harmless but wasted work; dropping a known id is cheap.
 * <p>
 * Forgetting an id is always safe: a patch that slips through is re-applied
 * as a no-op.
 */
public interface PatchIdDeduper {

    boolean seen(Timestamp patchId);

    /** Remember {@code patchId} as applied. */
    void record(Timestamp patchId);

    /** Returns true if this id was not seen before and is now recorded. */
    default boolean firstTime(Timestamp patchId) {
        if (seen(patchId)) return false;
        record(patchId);
        return true;
    }
}
