// file: src/main/java/io/crdtlite/core/patch/Patch.java
package io.crdtlite.core.patch;

import com.fasterxml.jackson.databind.JsonNode;
import io.crdtlite.core.clock.Timestamp;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * An ordered, immutable batch of operations plus optional JSON metadata.
 * <p>
 * The patch id is the id of its first operation. Patches produced by the
 * builder are contiguous: each op starts where the previous one ended.
 */
public final class Patch {

    private final List<Op> ops;
    private final JsonNode meta;

    public Patch(List<Op> ops, JsonNode meta) {
        this.ops = List.copyOf(ops);
        this.meta = meta == null ? null : meta.deepCopy();
    }

    public Patch(List<Op> ops) {
        this(ops, null);
    }

    public static Patch empty() {
        return new Patch(List.of(), null);
    }

    public List<Op> ops() {
        return ops;
    }

    /** Copy of the user metadata, or null when absent. */
    public JsonNode meta() {
        return meta == null ? null : meta.deepCopy();
    }

    public boolean isEmpty() {
        return ops.isEmpty();
    }

    /** Id of the first operation, or null for an empty patch. */
    public Timestamp id() {
        return ops.isEmpty() ? null : ops.get(0).id();
    }

    /** Total clock time consumed: from the first op's id through the end of the last op. */
    public long span() {
        if (ops.isEmpty()) return 0;
        var last = ops.get(ops.size() - 1);
        return last.id().time() + last.span() - ops.get(0).id().time();
    }

    /** First time after this patch in its session, or 0 for an empty patch. */
    public long nextTime() {
        if (ops.isEmpty()) return 0;
        var last = ops.get(ops.size() - 1);
        return last.id().time() + last.span();
    }

    /** Copy with every timestamp of every operation mapped through {@code f}. */
    public Patch rewriteTime(UnaryOperator<Timestamp> f) {
        return new Patch(ops.stream().map(op -> op.rewrite(f)).toList(), meta);
    }

    /** Move this patch so it starts at {@code newTime}; see {@link #rebase(long, long)}. */
    public Patch rebase(long newTime) {
        var id = id();
        if (id == null) return this;
        return rebase(newTime, id.time());
    }

    /**
     * Shift this patch's own-session timestamps at or after {@code transformAfter}
     * by {@code newTime - id().time()}. References to other sessions and to
     * older own-session ids stay as they are.
     */
    public Patch rebase(long newTime, long transformAfter) {
        var id = id();
        if (id == null) return this;
        long sid = id.sid();
        long delta = newTime - id.time();
        if (delta == 0) return this;
        return rewriteTime(ts -> {
            if (ts.sid() != sid || ts.time() < transformAfter) return ts;
            return new Timestamp(sid, ts.time() + delta);
        });
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Patch p)) return false;
        return ops.equals(p.ops) && Objects.equals(meta, p.meta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ops, meta);
    }

    /** Multi-line dump: one line per operation. */
    @Override
    public String toString() {
        var sb = new StringBuilder("Patch ").append(id() == null ? "-" : id().toString())
                .append('!').append(span());
        if (meta != null) sb.append(" meta=").append(meta);
        for (var op : ops) {
            sb.append("\n  ").append(op.name()).append(' ').append(op);
        }
        return sb.toString();
    }
}
