// file: src/main/java/io/crdtlite/core/nodes/StrNode.java
package io.crdtlite.core.nodes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.crdtlite.core.clock.Timespan;
import io.crdtlite.core.clock.Timestamp;
import io.crdtlite.core.rga.Rga;
import io.crdtlite.core.rga.Slicer;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/** Collaborative text: an RGA of Unicode code points. */
public final class StrNode implements CrdtNode {

    private final Timestamp id;
    private final Rga<String> rga;

    public StrNode(Timestamp id) {
        this(id, new Rga<>(Slicer.STRING));
    }

    private StrNode(Timestamp id, Rga<String> rga) {
        this.id = Objects.requireNonNull(id, "id");
        this.rga = rga;
    }

    @Override
    public Timestamp id() {
        return id;
    }

    public Rga<String> rga() {
        return rga;
    }

    /** Insert {@code text} after item {@code after}; the node's own id means "at the start". */
    public boolean insert(Timestamp after, Timestamp itemId, String text) {
        if (text.isEmpty()) return false;
        var ref = after.equals(id) ? Timestamp.ORIGIN : after;
        return rga.insert(ref, itemId, Slicer.STRING.length(text), text);
    }

    public void delete(List<Timespan> spans) {
        rga.delete(spans);
    }

    /** Number of visible code points. */
    public long length() {
        return rga.size();
    }

    public String text() {
        var sb = new StringBuilder();
        for (var c : rga.chunks()) if (!c.isDeleted()) sb.append(c.data());
        return sb.toString();
    }

    @Override
    public String name() {
        return "str";
    }

    @Override
    public JsonNode view(NodeIndex index) {
        return JsonNodeFactory.instance.textNode(text());
    }

    @Override
    public void children(Consumer<Timestamp> visitor) {
        // leaf
    }

    @Override
    public StrNode copy() {
        return new StrNode(id, rga.copy());
    }

    @Override
    public String toString() {
        return "str " + id + " " + rga;
    }
}
