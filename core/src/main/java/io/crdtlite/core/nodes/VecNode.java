// file: src/main/java/io/crdtlite/core/nodes/VecNode.java
package io.crdtlite.core.nodes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.crdtlite.core.clock.Timestamp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Fixed-position tuple: slot {@code i} is a last-writer-wins register. Slots
 * never written read as absent (null entries); the tuple only grows.
 */
public final class VecNode implements CrdtNode {

    /** Slot indexes travel as one byte on the wire. */
    public static final int MAX_INDEX = 255;

    private final Timestamp id;
    private final List<Timestamp> elements = new ArrayList<>();

    public VecNode(Timestamp id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    @Override
    public Timestamp id() {
        return id;
    }

    /** Slot ids, null for never-written slots (read-only view). */
    public List<Timestamp> elements() {
        return Collections.unmodifiableList(elements);
    }

    public int size() {
        return elements.size();
    }

    public Timestamp get(int index) {
        return index < elements.size() ? elements.get(index) : null;
    }

    /**
     * Write slot {@code index} if {@code value} wins.
     *
     * @return the replaced child id, or null when nothing was replaced
     */
    public Timestamp put(int index, Timestamp value) {
        if (index < 0 || index > MAX_INDEX) throw new IllegalArgumentException("vec index out of range: " + index);
        while (elements.size() <= index) elements.add(null);
        var old = elements.get(index);
        if (old != null && !value.isAfter(old)) return null;
        elements.set(index, value);
        return old;
    }

    @Override
    public String name() {
        return "vec";
    }

    @Override
    public JsonNode view(NodeIndex index) {
        ArrayNode out = JsonNodeFactory.instance.arrayNode();
        for (var e : elements) {
            var child = e == null ? null : index.get(e);
            out.add(child == null ? JsonNodeFactory.instance.nullNode() : child.view(index));
        }
        return out;
    }

    @Override
    public void children(Consumer<Timestamp> visitor) {
        for (var e : elements) if (e != null) visitor.accept(e);
    }

    @Override
    public VecNode copy() {
        var c = new VecNode(id);
        c.elements.addAll(elements);
        return c;
    }

    @Override
    public String toString() {
        return "vec " + id + " " + elements;
    }
}
