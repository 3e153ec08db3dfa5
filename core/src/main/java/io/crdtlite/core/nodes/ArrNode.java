// file: src/main/java/io/crdtlite/core/nodes/ArrNode.java
package io.crdtlite.core.nodes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.crdtlite.core.clock.Timespan;
import io.crdtlite.core.clock.Timestamp;
import io.crdtlite.core.rga.Rga;
import io.crdtlite.core.rga.Slicer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Collaborative array: an RGA whose items are ids of child nodes.
 * <p>
 * Each slot is addressed by its item id; {@link #update} overwrites the child
 * a live slot points at, last writer wins by comparing child ids.
 */
public final class ArrNode implements CrdtNode {

    private final Timestamp id;
    private final Rga<List<Timestamp>> rga;

    public ArrNode(Timestamp id) {
        this(id, new Rga<>(Slicer.IDS));
    }

    private ArrNode(Timestamp id, Rga<List<Timestamp>> rga) {
        this.id = Objects.requireNonNull(id, "id");
        this.rga = rga;
    }

    @Override
    public Timestamp id() {
        return id;
    }

    public Rga<List<Timestamp>> rga() {
        return rga;
    }

    public boolean insert(Timestamp after, Timestamp itemId, List<Timestamp> values) {
        if (values.isEmpty()) return false;
        var ref = after.equals(id) ? Timestamp.ORIGIN : after;
        return rga.insert(ref, itemId, values.size(), new ArrayList<>(values));
    }

    /** Tombstone slots and return the child ids they held. */
    public List<Timestamp> delete(List<Timespan> spans) {
        var dropped = new ArrayList<Timestamp>();
        for (var c : rga.delete(spans)) dropped.addAll(c.data());
        return dropped;
    }

    /** Child id held by slot {@code slot}, or null when the slot is unknown or deleted. */
    public Timestamp getById(Timestamp slot) {
        int idx = rga.findById(slot);
        if (idx < 0) return null;
        var c = rga.chunks().get(idx);
        if (c.isDeleted()) return null;
        return c.data().get((int) (slot.time() - c.id().time()));
    }

    /**
     * Point live slot {@code slot} at {@code value} if {@code value} is newer
     * than the current child.
     *
     * @return the replaced child id, or null when nothing changed
     */
    public Timestamp update(Timestamp slot, Timestamp value) {
        int idx = rga.findById(slot);
        if (idx < 0) return null;
        var c = rga.chunks().get(idx);
        if (c.isDeleted()) return null;
        int offset = (int) (slot.time() - c.id().time());
        var old = c.data().get(offset);
        if (!value.isAfter(old)) return null;
        c.data().set(offset, value);
        return old;
    }

    /** Child ids of live slots, in order. */
    public List<Timestamp> values() {
        var out = new ArrayList<Timestamp>();
        for (var c : rga.chunks()) if (!c.isDeleted()) out.addAll(c.data());
        return out;
    }

    public long length() {
        return rga.size();
    }

    @Override
    public String name() {
        return "arr";
    }

    @Override
    public JsonNode view(NodeIndex index) {
        ArrayNode out = JsonNodeFactory.instance.arrayNode();
        for (var v : values()) {
            var child = index.get(v);
            out.add(child == null ? JsonNodeFactory.instance.nullNode() : child.view(index));
        }
        return out;
    }

    @Override
    public void children(Consumer<Timestamp> visitor) {
        values().forEach(visitor);
    }

    @Override
    public ArrNode copy() {
        return new ArrNode(id, rga.copy());
    }

    @Override
    public String toString() {
        return "arr " + id + " " + rga;
    }
}
