// file: src/main/java/io/crdtlite/core/nodes/ValNode.java
package io.crdtlite.core.nodes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.crdtlite.core.clock.Timestamp;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Last-writer-wins register holding the id of one child node.
 * <p>
 * A write takes effect only when its id is greater than the current one, so
 * replicas receiving the same writes in any order settle on the same child.
 * A fresh register points at {@link Timestamp#ORIGIN}, i.e. holds nothing.
 */
public final class ValNode implements CrdtNode {

    private final Timestamp id;
    private Timestamp val;

    public ValNode(Timestamp id) {
        this(id, Timestamp.ORIGIN);
    }

    public ValNode(Timestamp id, Timestamp val) {
        this.id = Objects.requireNonNull(id, "id");
        this.val = Objects.requireNonNull(val, "val");
    }

    @Override
    public Timestamp id() {
        return id;
    }

    public Timestamp val() {
        return val;
    }

    public boolean isEmpty() {
        return val.isOrigin();
    }

    /**
     * Point the register at {@code newVal} if it wins.
     *
     * @return the replaced child id, or null when nothing was replaced
     */
    public Timestamp set(Timestamp newVal) {
        if (!newVal.isAfter(val)) return null;
        var old = val;
        val = newVal;
        return old.isOrigin() ? null : old;
    }

    @Override
    public String name() {
        return "val";
    }

    @Override
    public JsonNode view(NodeIndex index) {
        var child = index.get(val);
        return child == null ? JsonNodeFactory.instance.nullNode() : child.view(index);
    }

    @Override
    public void children(Consumer<Timestamp> visitor) {
        if (!val.isOrigin()) visitor.accept(val);
    }

    @Override
    public ValNode copy() {
        return new ValNode(id, val);
    }

    @Override
    public String toString() {
        return "val " + id + " -> " + val;
    }
}
