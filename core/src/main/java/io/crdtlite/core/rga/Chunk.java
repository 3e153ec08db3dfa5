// file: src/main/java/io/crdtlite/core/rga/Chunk.java
package io.crdtlite.core.rga;

import io.crdtlite.core.clock.Timestamp;

import java.util.Objects;

/**
 * A run of consecutive RGA items inserted by one operation.
 * <p>
 * Item {@code i} of the chunk has id {@code (id.sid, id.time + i)}. A deleted
 * chunk keeps its id and span as a tombstone but drops its content.
 */
public final class Chunk<T> {

    private final Timestamp id;
    private long span;
    private boolean deleted;
    private T data;

    public Chunk(Timestamp id, long span, T data) {
        if (span < 1) throw new IllegalArgumentException("span must be >= 1");
        this.id = Objects.requireNonNull(id, "id");
        this.span = span;
        this.data = Objects.requireNonNull(data, "data");
    }

    private Chunk(Timestamp id, long span) {
        if (span < 1) throw new IllegalArgumentException("span must be >= 1");
        this.id = Objects.requireNonNull(id, "id");
        this.span = span;
        this.deleted = true;
    }

    public static <T> Chunk<T> tombstone(Timestamp id, long span) {
        return new Chunk<>(id, span);
    }

    public Timestamp id() {
        return id;
    }

    public long span() {
        return span;
    }

    public boolean isDeleted() {
        return deleted;
    }

    /** Content, or {@code null} for a tombstone. */
    public T data() {
        return data;
    }

    /** Number of visible items: the span, or 0 when deleted. */
    public long length() {
        return deleted ? 0 : span;
    }

    /** Id of the item at {@code offset} within this chunk. */
    public Timestamp itemId(long offset) {
        return id.tick(offset);
    }

    /** True when this chunk holds the item {@code ts}. */
    public boolean contains(Timestamp ts) {
        return ts.sid() == id.sid() && ts.time() >= id.time() && ts.time() < id.time() + span;
    }

    void delete() {
        deleted = true;
        data = null;
    }

    /**
     * Cut this chunk at {@code at}: this chunk keeps items {@code [0, at)} and
     * the returned chunk holds {@code [at, span)}.
     */
    Chunk<T> split(long at, Slicer<T> slicer) {
        if (at <= 0 || at >= span) {
            throw new IllegalStateException("split offset " + at + " outside chunk of span " + span);
        }
        Chunk<T> tail;
        if (deleted) {
            tail = new Chunk<>(id.tick(at), span - at);
        } else {
            tail = new Chunk<>(id.tick(at), span - at, slicer.slice(data, (int) at, (int) span));
            data = slicer.slice(data, 0, (int) at);
        }
        span = at;
        return tail;
    }

    Chunk<T> copy(Slicer<T> slicer) {
        if (deleted) return new Chunk<>(id, span);
        return new Chunk<>(id, span, slicer.slice(data, 0, (int) span));
    }

    @Override
    public String toString() {
        return id + "!" + span + (deleted ? " [deleted]" : " " + data);
    }
}
