// file: src/main/java/io/crdtlite/core/rga/Rga.java
package io.crdtlite.core.rga;

import io.crdtlite.core.clock.Timespan;
import io.crdtlite.core.clock.Timestamp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Replicated Growable Array: an ordered sequence of chunks where every item
 * keeps a unique timestamp forever, deleted items included.
 * <p>
 * Responsibilities:
 *  - place concurrent inserts deterministically, so replicas applying the same
 *    set of inserts in any order end with the same item order,
 *  - delete by id ranges, splitting chunks when a range starts or ends inside one,
 *  - stay idempotent: re-inserting a known id or re-deleting a tombstone is a no-op.
 * <p>
 * Lookups are linear scans over the chunk list. The payload type is abstracted
 * by a {@link Slicer}.
 */
public final class Rga<T> {

    private final Slicer<T> slicer;
    private final List<Chunk<T>> chunks = new ArrayList<>();

    public Rga(Slicer<T> slicer) {
        this.slicer = Objects.requireNonNull(slicer, "slicer");
    }

    public Slicer<T> slicer() {
        return slicer;
    }

    /** All chunks in sequence order, tombstones included (read-only view). */
    public List<Chunk<T>> chunks() {
        return Collections.unmodifiableList(chunks);
    }

    /** Chunks that still carry content. */
    public List<Chunk<T>> liveChunks() {
        var out = new ArrayList<Chunk<T>>();
        for (var c : chunks) if (!c.isDeleted()) out.add(c);
        return out;
    }

    /** Number of visible items. */
    public long size() {
        long n = 0;
        for (var c : chunks) n += c.length();
        return n;
    }

    /** Index of the chunk holding item {@code ts}, or -1 if no chunk holds it. */
    public int findById(Timestamp ts) {
        for (int i = 0; i < chunks.size(); i++) {
            if (chunks.get(i).contains(ts)) return i;
        }
        return -1;
    }

    public boolean contains(Timestamp ts) {
        return findById(ts) >= 0;
    }

    /**
     * Insert {@code span} items starting at id {@code id} right after item
     * {@code after}. {@link Timestamp#ORIGIN} inserts at the head.
     * <p>
     * Among inserts that share an anchor, the one with the greater id ends up
     * closer to the anchor: the new chunk skips over every following chunk
     * whose id is greater than its own.
     *
     * @return false when the insert was a no-op (id already present, or the anchor is unknown)
     */
    public boolean insert(Timestamp after, Timestamp id, long span, T data) {
        Objects.requireNonNull(after, "after");
        Objects.requireNonNull(id, "id");
        if (span < 1) throw new IllegalArgumentException("span must be >= 1");
        if (contains(id)) return false;

        int pos;
        if (after.isOrigin()) {
            pos = 0;
        } else {
            int idx = findById(after);
            if (idx < 0) return false;
            var anchor = chunks.get(idx);
            long offset = after.time() - anchor.id().time();
            if (offset + 1 < anchor.span()) {
                chunks.add(idx + 1, anchor.split(offset + 1, slicer));
            }
            pos = idx + 1;
        }
        while (pos < chunks.size() && chunks.get(pos).id().compareTo(id) > 0) {
            pos++;
        }
        chunks.add(pos, new Chunk<>(id, span, data));
        return true;
    }

    /**
     * Tombstone every item covered by {@code spans}. Unknown ids are ignored.
     *
     * @return the chunks that were live before this call and are now deleted
     */
    public List<Chunk<T>> delete(List<Timespan> spans) {
        var removed = new ArrayList<Chunk<T>>();
        for (var span : spans) {
            deleteSpan(span, removed);
        }
        return removed;
    }

    private void deleteSpan(Timespan span, List<Chunk<T>> removed) {
        for (int i = 0; i < chunks.size(); i++) {
            var c = chunks.get(i);
            if (c.id().sid() != span.sid()) continue;
            long cStart = c.id().time();
            long cEnd = cStart + c.span();
            long from = Math.max(cStart, span.time());
            long to = Math.min(cEnd, span.end());
            if (from >= to || c.isDeleted()) continue;

            if (from > cStart) {
                chunks.add(i + 1, c.split(from - cStart, slicer));
                continue;
            }
            if (to < cEnd) {
                chunks.add(i + 1, c.split(to - cStart, slicer));
            }
            removed.add(c.copy(slicer));
            c.delete();
        }
    }

    /** Append a chunk at the end; used when rebuilding a sequence from a snapshot. */
    public void pushChunk(Chunk<T> chunk) {
        chunks.add(Objects.requireNonNull(chunk, "chunk"));
    }

    /** Id of the visible item at position {@code pos}, or null when out of range. */
    public Timestamp findPosition(long pos) {
        if (pos < 0) return null;
        for (var c : chunks) {
            long len = c.length();
            if (pos < len) return c.itemId(pos);
            pos -= len;
        }
        return null;
    }

    /** Ids of all visible items, in order. */
    public List<Timestamp> itemIds() {
        var out = new ArrayList<Timestamp>();
        for (var c : chunks) {
            for (long i = 0; i < c.length(); i++) out.add(c.itemId(i));
        }
        return out;
    }

    /**
     * Id ranges covering the {@code length} visible items that start at
     * {@code pos}; one range per chunk touched.
     */
    public List<Timespan> findInterval(long pos, long length) {
        var out = new ArrayList<Timespan>();
        if (length <= 0) return out;
        for (var c : chunks) {
            long len = c.length();
            if (len == 0) continue;
            if (pos >= len) {
                pos -= len;
                continue;
            }
            long take = Math.min(len - pos, length);
            var start = c.itemId(pos);
            out.add(new Timespan(start.sid(), start.time(), take));
            length -= take;
            pos = 0;
            if (length == 0) break;
        }
        return out;
    }

    public Rga<T> copy() {
        var r = new Rga<>(slicer);
        for (var c : chunks) r.chunks.add(c.copy(slicer));
        return r;
    }

    @Override
    public String toString() {
        return chunks.toString();
    }
}
