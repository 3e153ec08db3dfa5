// file: src/main/java/io/crdtlite/codec/model/ModelEncoder.java
package io.crdtlite.codec.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.crdtlite.codec.binary.CrdtWriter;
import io.crdtlite.codec.cbor.CborValues;
import io.crdtlite.core.clock.ClockVector;
import io.crdtlite.core.clock.Session;
import io.crdtlite.core.clock.Timestamp;
import io.crdtlite.core.model.Model;
import io.crdtlite.core.nodes.ArrNode;
import io.crdtlite.core.nodes.BinNode;
import io.crdtlite.core.nodes.ConNode;
import io.crdtlite.core.nodes.ConValue;
import io.crdtlite.core.nodes.CrdtNode;
import io.crdtlite.core.nodes.ObjNode;
import io.crdtlite.core.nodes.StrNode;
import io.crdtlite.core.nodes.ValNode;
import io.crdtlite.core.nodes.VecNode;

import java.util.ArrayList;

/**
 * Binary snapshot of a whole document, tombstones included.
 * <p>
 * Logical clock layout:
 * <pre>
 *   u32        byte length of the node section
 *   node       the root's child, or 0x00 for an empty document
 *   table      clock table (see {@link ClockTable})
 * </pre>
 * Server clock layout: {@code 0x80}, vu57 time, then the node section with
 * ids written as vu57 times.
 * <p>
 * Each node is its id followed by an octet {@code major << 5 | minor}; for
 * containers the minor is the child count (31 means a vu57 count follows).
 * Majors: 0 con, 1 val, 2 obj, 3 vec, 4 str, 5 bin, 6 arr.
 */
public final class ModelEncoder {

    static final int SERVER_MARKER = 0x80;

    static final int CON = 0;
    static final int VAL = 1;
    static final int OBJ = 2;
    static final int VEC = 3;
    static final int STR = 4;
    static final int BIN = 5;
    static final int ARR = 6;

    public byte[] encode(Model model) {
        var out = new CrdtWriter();
        if (model.clock() instanceof ClockVector clock) {
            var table = ClockTable.forEncoding(clock);
            out.u32(0);
            writeRoot(out, model, id -> {
                long[] rel = table.relative(id);
                out.id(rel[0], rel[1]);
            });
            out.setU32(0, out.size() - 4);
            table.write(out);
        } else {
            out.u8(SERVER_MARKER);
            out.vu57(model.clock().time());
            writeRoot(out, model, id -> {
                if (!id.isOrigin() && id.sid() != Session.SERVER) {
                    throw new IllegalStateException("server document holds foreign id " + id);
                }
                out.vu57(id.time());
            });
        }
        return out.toByteArray();
    }

    private interface IdWriter {
        void write(Timestamp id);
    }

    private void writeRoot(CrdtWriter out, Model model, IdWriter ids) {
        var child = model.root().isEmpty() ? null : model.index().get(model.root().val());
        if (child == null) out.u8(0);
        else new NodeWriter(out, model, ids).node(child);
    }

    private static final class NodeWriter {
        private final CrdtWriter out;
        private final Model model;
        private final IdWriter ids;

        NodeWriter(CrdtWriter out, Model model, IdWriter ids) {
            this.out = out;
            this.model = model;
            this.ids = ids;
        }

        /** Child by id; a missing child is written as an undefined constant under its id. */
        void child(Timestamp id) {
            var node = model.index().get(id);
            node(node != null ? node : new ConNode(id, ConValue.UNDEFINED));
        }

        void node(CrdtNode node) {
            ids.write(node.id());
            if (node instanceof ConNode c) {
                if (c.value() instanceof ConValue.Ref r) {
                    out.u8(CON << 5 | 1);
                    ids.write(r.id());
                } else if (c.value() instanceof ConValue.Json j) {
                    out.u8(CON << 5);
                    CborValues.write(out, j.value());
                } else {
                    out.u8(CON << 5);
                    CborValues.writeUndefined(out);
                }
            } else if (node instanceof ValNode v) {
                out.u8(VAL << 5);
                if (v.isEmpty()) out.u8(0);
                else child(v.val());
            } else if (node instanceof ObjNode o) {
                var keys = new ArrayList<String>();
                o.keys().forEach((k, id) -> {
                    if (model.index().contains(id)) keys.add(k);
                });
                header(OBJ, keys.size());
                for (var k : keys) {
                    CborValues.write(out, JsonNodeFactory.instance.textNode(k));
                    node(model.index().get(o.get(k)));
                }
            } else if (node instanceof VecNode v) {
                header(VEC, v.size());
                for (var el : v.elements()) {
                    var n = el == null ? null : model.index().get(el);
                    if (n == null) out.u8(0);
                    else node(n);
                }
            } else if (node instanceof StrNode s) {
                var chunks = s.rga().chunks();
                header(STR, chunks.size());
                for (var c : chunks) {
                    ids.write(c.id());
                    if (c.isDeleted()) CborValues.write(out, JsonNodeFactory.instance.numberNode(c.span()));
                    else CborValues.write(out, JsonNodeFactory.instance.textNode(c.data()));
                }
            } else if (node instanceof BinNode b) {
                var chunks = b.rga().chunks();
                header(BIN, chunks.size());
                for (var c : chunks) {
                    ids.write(c.id());
                    out.b1vu56(c.isDeleted(), c.span());
                    if (!c.isDeleted()) out.bytes(c.data());
                }
            } else if (node instanceof ArrNode a) {
                var chunks = a.rga().chunks();
                header(ARR, chunks.size());
                for (var c : chunks) {
                    ids.write(c.id());
                    out.b1vu56(c.isDeleted(), c.span());
                    if (!c.isDeleted()) for (var el : c.data()) child(el);
                }
            }
        }

        private void header(int major, int length) {
            if (length < 31) {
                out.u8(major << 5 | length);
            } else {
                out.u8(major << 5 | 31);
                out.vu57(length);
            }
        }
    }
}
