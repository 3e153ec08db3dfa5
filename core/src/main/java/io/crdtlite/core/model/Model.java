// file: src/main/java/io/crdtlite/core/model/Model.java
package io.crdtlite.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.crdtlite.core.clock.ClockVector;
import io.crdtlite.core.clock.LogicalClock;
import io.crdtlite.core.clock.ServerClock;
import io.crdtlite.core.clock.Session;
import io.crdtlite.core.clock.Timestamp;
import io.crdtlite.core.diff.JsonCrdtDiff;
import io.crdtlite.core.nodes.ArrNode;
import io.crdtlite.core.nodes.BinNode;
import io.crdtlite.core.nodes.ConNode;
import io.crdtlite.core.nodes.CrdtNode;
import io.crdtlite.core.nodes.NodeIndex;
import io.crdtlite.core.nodes.ObjNode;
import io.crdtlite.core.nodes.StrNode;
import io.crdtlite.core.nodes.ValNode;
import io.crdtlite.core.nodes.VecNode;
import io.crdtlite.core.patch.Op;
import io.crdtlite.core.patch.Patch;
import io.crdtlite.core.patch.PatchBuilder;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A JSON CRDT document: the clock, the root register and the node index.
 * <p>
 * Responsibilities:
 *  - apply patches idempotently and in any order consistent with causality;
 *    replicas that applied the same set of patches have equal views,
 *  - project the document to plain JSON ({@link #view()}),
 *  - compute a patch that turns the current view into a target one ({@link #diff}).
 * <p>
 * Design:
 *  - Operations aimed at unknown nodes, or at nodes of the wrong kind, are
 *    skipped and logged at FINE; they never fail the patch.
 *  - Overwritten and deleted subtrees are dropped from the index.
 *  - Not thread safe; callers serialize access.
 */
public final class Model {
    private static final Logger log = Logger.getLogger(Model.class.getName());

    private final LogicalClock clock;
    private final NodeIndex index;
    private final ValNode root;

    private Model(LogicalClock clock, NodeIndex index, ValNode root) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.index = index;
        this.root = root;
    }

    /** Empty document driven by {@code clock}. */
    public static Model withClock(LogicalClock clock) {
        return new Model(clock, new NodeIndex(), new ValNode(Timestamp.ORIGIN));
    }

    /** Empty document for a random user session. */
    public static Model create() {
        return withClock(ClockVector.random());
    }

    /** Empty document for session {@code sid}, starting at time 1. */
    public static Model create(long sid) {
        return withClock(new ClockVector(sid, 1));
    }

    /**
     * Empty document ordered by a central server. Time 0 is kept free so that
     * a zero id never names a real node.
     */
    public static Model withServerClock(long time) {
        if (time < 1) throw new IllegalArgumentException("server time must be >= 1");
        return withClock(new ServerClock(time));
    }

    public LogicalClock clock() {
        return clock;
    }

    public NodeIndex index() {
        return index;
    }

    public ValNode root() {
        return root;
    }

    public boolean isServerClock() {
        return clock instanceof ServerClock;
    }

    /** Node by id; the origin resolves to the root register. */
    public CrdtNode find(Timestamp id) {
        if (id.isOrigin()) return root;
        return index.get(id);
    }

    /** Builder that continues this document's clock; the model itself is not advanced. */
    public PatchBuilder builder() {
        return new PatchBuilder(clock.copy());
    }

    // ---- apply ----

    public void applyPatch(Patch patch) {
        for (var op : patch.ops()) applyOperation(op);
    }

    public void applyBatch(Collection<Patch> patches) {
        for (var p : patches) applyPatch(p);
    }

    /**
     * Apply one operation. The clock observes the op first, so later local
     * edits are always ordered after it.
     */
    public void applyOperation(Op op) {
        clock.observe(op.id(), op.span());

        if (op instanceof Op.NewCon o) {
            createIfAbsent(new ConNode(o.id(), o.value()));
        } else if (op instanceof Op.NewVal o) {
            createIfAbsent(new ValNode(o.id()));
        } else if (op instanceof Op.NewObj o) {
            createIfAbsent(new ObjNode(o.id()));
        } else if (op instanceof Op.NewVec o) {
            createIfAbsent(new VecNode(o.id()));
        } else if (op instanceof Op.NewStr o) {
            createIfAbsent(new StrNode(o.id()));
        } else if (op instanceof Op.NewBin o) {
            createIfAbsent(new BinNode(o.id()));
        } else if (op instanceof Op.NewArr o) {
            createIfAbsent(new ArrNode(o.id()));
        } else if (op instanceof Op.InsVal o) {
            applyInsVal(o);
        } else if (op instanceof Op.InsObj o) {
            if (!(index.get(o.obj()) instanceof ObjNode node)) {
                skip(op);
                return;
            }
            for (var e : o.entries()) {
                if (!index.contains(e.value())) continue;
                collect(node.put(e.key(), e.value()));
            }
        } else if (op instanceof Op.InsVec o) {
            if (!(index.get(o.obj()) instanceof VecNode node)) {
                skip(op);
                return;
            }
            for (var e : o.entries()) {
                if (!index.contains(e.value())) continue;
                collect(node.put(e.index(), e.value()));
            }
        } else if (op instanceof Op.InsStr o) {
            if (index.get(o.obj()) instanceof StrNode node) node.insert(o.after(), o.id(), o.data());
            else skip(op);
        } else if (op instanceof Op.InsBin o) {
            if (index.get(o.obj()) instanceof BinNode node) node.insert(o.after(), o.id(), o.data());
            else skip(op);
        } else if (op instanceof Op.InsArr o) {
            if (index.get(o.obj()) instanceof ArrNode node) node.insert(o.after(), o.id(), o.data());
            else skip(op);
        } else if (op instanceof Op.UpdArr o) {
            if (index.get(o.obj()) instanceof ArrNode node && index.contains(o.val())) {
                collect(node.update(o.ref(), o.val()));
            } else {
                skip(op);
            }
        } else if (op instanceof Op.Del o) {
            applyDel(o);
        }
        // nop: only the clock moves
    }

    private void applyInsVal(Op.InsVal o) {
        ValNode reg;
        if (o.obj().isOrigin()) {
            reg = root;
        } else if (index.get(o.obj()) instanceof ValNode v) {
            reg = v;
        } else {
            skip(o);
            return;
        }
        if (!index.contains(o.val())) {
            skip(o);
            return;
        }
        collect(reg.set(o.val()));
    }

    private void applyDel(Op.Del o) {
        var node = index.get(o.obj());
        if (node instanceof StrNode s) {
            s.delete(o.what());
        } else if (node instanceof BinNode b) {
            b.delete(o.what());
        } else if (node instanceof ArrNode a) {
            for (var child : a.delete(o.what())) collect(child);
        } else {
            skip(o);
        }
    }

    private void createIfAbsent(CrdtNode node) {
        if (!index.contains(node.id())) index.put(node);
    }

    private static void skip(Op op) {
        if (log.isLoggable(Level.FINE)) {
            log.fine("Skipping " + op.name() + " " + op.id() + ": target missing or of another kind");
        }
    }

    /** Drop the subtree under {@code id} from the index. System-owned ids are never collected. */
    // Assumes every node has exactly one parent: a subtree reachable from two
    // places would be dropped while the other parent still points at it.
    private void collect(Timestamp id) {
        if (id == null) return;
        var pending = new ArrayDeque<Timestamp>();
        pending.push(id);
        while (!pending.isEmpty()) {
            var next = pending.pop();
            if (next.sid() == Session.SYSTEM) continue;
            var node = index.remove(next);
            if (node != null) node.children(pending::push);
        }
    }

    // ---- views ----

    /** Plain JSON of the whole document; an empty document views as null. */
    public JsonNode view() {
        return root.view(index);
    }

    /** Ops that turn this document into {@code target}; the model itself is left untouched. */
    public Patch diff(JsonNode target) {
        return new JsonCrdtDiff(this).diff(target);
    }

    // ---- copies ----

    /** Independent deep copy with the same session. */
    public Model copy() {
        return new Model(clock.copy(), index.copy(), root.copy());
    }

    /** Independent deep copy that continues editing as session {@code sid}. */
    public Model fork(long sid) {
        return new Model(clock.fork(sid), index.copy(), root.copy());
    }

    /** Indented dump of the node tree, for debugging. */
    @Override
    public String toString() {
        var sb = new StringBuilder("model ").append(clock).append('\n');
        dump(sb, root, "  ");
        return sb.toString();
    }

    private void dump(StringBuilder sb, CrdtNode node, String indent) {
        sb.append(indent).append(node.name()).append(' ').append(node.id());
        if (node instanceof ConNode c) sb.append(' ').append(c.value());
        if (node instanceof StrNode s) sb.append(' ').append('"').append(s.text()).append('"');
        sb.append('\n');
        if (node instanceof ObjNode o) {
            o.keys().forEach((k, v) -> {
                sb.append(indent).append("  ").append(k).append(":\n");
                var child = index.get(v);
                if (child != null) dump(sb, child, indent + "    ");
            });
            return;
        }
        node.children(child -> {
            var n = index.get(child);
            if (n != null) dump(sb, n, indent + "  ");
        });
    }
}
