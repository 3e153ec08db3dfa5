// file: src/main/java/io/crdtlite/replica/WindowedPatchIdDeduper.java
package io.crdtlite.replica;

import io.crdtlite.core.clock.Timestamp;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Patch id deduper bounded by count.
 *
 * Semantics:
 *  - seen(id): true while the id is among the last {@code window} recorded ids.
 *  - record(id): remembers the id, evicting the oldest recorded one once the
 *    window is full. Lookups do not refresh an id (FIFO, not LRU).
 *
 * Implementation notes:
 *  - Backed by an insertion-ordered LinkedHashMap; eviction happens on insert,
 *    so there is no background cleanup.
 *  - Not thread safe; the owning replica serializes access.
 */
public final class WindowedPatchIdDeduper implements PatchIdDeduper {

    private final int window;
    private final Map<Timestamp, Boolean> recent;

    public WindowedPatchIdDeduper(int window) {
        if (window <= 0) throw new IllegalArgumentException("window must be positive, got: " + window);
        this.window = window;
        this.recent = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Timestamp, Boolean> eldest) {
                return size() > WindowedPatchIdDeduper.this.window;
            }
        };
    }

    @Override
    public boolean seen(Timestamp patchId) {
        Objects.requireNonNull(patchId, "patchId");
        return recent.containsKey(patchId);
    }

    @Override
    public void record(Timestamp patchId) {
        Objects.requireNonNull(patchId, "patchId");
        recent.put(patchId, Boolean.TRUE);
    }

    public int size() {
        return recent.size();
    }

    public int window() {
        return window;
    }
}
