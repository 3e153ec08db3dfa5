// file: src/main/java/io/crdtlite/core/nodes/NodeIndex.java
package io.crdtlite.core.nodes;

import io.crdtlite.core.clock.Timestamp;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/** Id-to-node table of one document. */
public final class NodeIndex {

    private final Map<Timestamp, CrdtNode> nodes = new HashMap<>();

    public CrdtNode get(Timestamp id) {
        return nodes.get(id);
    }

    public boolean contains(Timestamp id) {
        return nodes.containsKey(id);
    }

    public void put(CrdtNode node) {
        nodes.put(node.id(), node);
    }

    public CrdtNode remove(Timestamp id) {
        return nodes.remove(id);
    }

    public int size() {
        return nodes.size();
    }

    public Collection<CrdtNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public NodeIndex copy() {
        var c = new NodeIndex();
        for (var n : nodes.values()) c.put(n.copy());
        return c;
    }
}
