// file: src/main/java/io/crdtlite/core/nodes/ObjNode.java
package io.crdtlite.core.nodes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.crdtlite.core.clock.Timestamp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Map from string keys to child ids, each key an independent last-writer-wins
 * register. Deleting a key means writing an undefined constant to it.
 */
public final class ObjNode implements CrdtNode {

    private final Timestamp id;
    private final Map<String, Timestamp> keys = new LinkedHashMap<>();

    public ObjNode(Timestamp id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    @Override
    public Timestamp id() {
        return id;
    }

    /** Key to child id (read-only view, insertion order). */
    public Map<String, Timestamp> keys() {
        return Collections.unmodifiableMap(keys);
    }

    public Timestamp get(String key) {
        return keys.get(key);
    }

    /**
     * Write {@code value} under {@code key} if it is newer than the current entry.
     *
     * @return the replaced child id, or null when nothing was replaced
     */
    public Timestamp put(String key, Timestamp value) {
        Objects.requireNonNull(key, "key");
        var old = keys.get(key);
        if (old != null && !value.isAfter(old)) return null;
        keys.put(key, value);
        return old;
    }

    @Override
    public String name() {
        return "obj";
    }

    /** Keys whose child is missing or an undefined constant are left out. */
    @Override
    public JsonNode view(NodeIndex index) {
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        keys.forEach((key, childId) -> {
            var child = index.get(childId);
            if (child == null) return;
            if (child instanceof ConNode con && con.isUndefined()) return;
            out.set(key, child.view(index));
        });
        return out;
    }

    @Override
    public void children(Consumer<Timestamp> visitor) {
        keys.values().forEach(visitor);
    }

    @Override
    public ObjNode copy() {
        var c = new ObjNode(id);
        c.keys.putAll(keys);
        return c;
    }

    @Override
    public String toString() {
        return "obj " + id + " " + keys;
    }
}
