// file: src/main/java/io/crdtlite/core/nodes/BinNode.java
package io.crdtlite.core.nodes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.crdtlite.core.clock.Timespan;
import io.crdtlite.core.clock.Timestamp;
import io.crdtlite.core.rga.Rga;
import io.crdtlite.core.rga.Slicer;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/** Collaborative byte blob: an RGA of octets. Views as a Jackson binary node. */
public final class BinNode implements CrdtNode {

    private final Timestamp id;
    private final Rga<byte[]> rga;

    public BinNode(Timestamp id) {
        this(id, new Rga<>(Slicer.BYTES));
    }

    private BinNode(Timestamp id, Rga<byte[]> rga) {
        this.id = Objects.requireNonNull(id, "id");
        this.rga = rga;
    }

    @Override
    public Timestamp id() {
        return id;
    }

    public Rga<byte[]> rga() {
        return rga;
    }

    public boolean insert(Timestamp after, Timestamp itemId, byte[] data) {
        if (data.length == 0) return false;
        var ref = after.equals(id) ? Timestamp.ORIGIN : after;
        return rga.insert(ref, itemId, data.length, data.clone());
    }

    public void delete(List<Timespan> spans) {
        rga.delete(spans);
    }

    public byte[] bytes() {
        var out = new ByteArrayOutputStream();
        for (var c : rga.chunks()) if (!c.isDeleted()) out.writeBytes(c.data());
        return out.toByteArray();
    }

    @Override
    public String name() {
        return "bin";
    }

    @Override
    public JsonNode view(NodeIndex index) {
        return JsonNodeFactory.instance.binaryNode(bytes());
    }

    @Override
    public void children(Consumer<Timestamp> visitor) {
        // leaf
    }

    @Override
    public BinNode copy() {
        return new BinNode(id, rga.copy());
    }

    @Override
    public String toString() {
        return "bin " + id + " " + rga.chunks().size() + " chunks";
    }
}
