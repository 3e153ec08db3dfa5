// file: src/main/java/io/crdtlite/core/nodes/CrdtNode.java
package io.crdtlite.core.nodes;

import com.fasterxml.jackson.databind.JsonNode;
import io.crdtlite.core.clock.Timestamp;

import java.util.function.Consumer;

/**
 * A node of the document graph. Every node is named by the timestamp of the
 * operation that created it and lives in the model's {@link NodeIndex}.
 * <p>
 * Containers hold child ids, never child objects; children are resolved
 * through the index at view time.
 */
public sealed interface CrdtNode permits ConNode, ValNode, ObjNode, VecNode, StrNode, BinNode, ArrNode {

    Timestamp id();

    /** Short type name, matching the {@code new_*} operation that creates the node. */
    String name();

    /** Plain JSON projection of this node and everything below it. */
    JsonNode view(NodeIndex index);

    /** Visit the ids of the children this node currently points at. */
    void children(Consumer<Timestamp> visitor);

    /** Deep copy of this node's own state (children stay ids). */
    CrdtNode copy();
}
