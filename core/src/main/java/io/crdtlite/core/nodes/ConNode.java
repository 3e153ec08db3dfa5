// file: src/main/java/io/crdtlite/core/nodes/ConNode.java
package io.crdtlite.core.nodes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.crdtlite.core.clock.Timestamp;

import java.util.Objects;
import java.util.function.Consumer;

/** Immutable constant. */
public record ConNode(Timestamp id, ConValue value) implements CrdtNode {

    public ConNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(value, "value");
    }

    public boolean isUndefined() {
        return value instanceof ConValue.Undefined;
    }

    @Override
    public String name() {
        return "con";
    }

    /**
     * Undefined views as JSON null; a reference views as a POJO node wrapping the timestamp.
     * JSON values are copied, so callers may edit the view freely.
     */
    @Override
    public JsonNode view(NodeIndex index) {
        if (value instanceof ConValue.Json j) return j.value().deepCopy();
        if (value instanceof ConValue.Ref r) return JsonNodeFactory.instance.pojoNode(r.id());
        return JsonNodeFactory.instance.nullNode();
    }

    @Override
    public void children(Consumer<Timestamp> visitor) {
        // leaf
    }

    @Override
    public ConNode copy() {
        return this;
    }
}
