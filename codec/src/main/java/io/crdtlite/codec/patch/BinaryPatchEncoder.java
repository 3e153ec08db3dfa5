// file: src/main/java/io/crdtlite/codec/patch/BinaryPatchEncoder.java
package io.crdtlite.codec.patch;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.crdtlite.codec.binary.CrdtWriter;
import io.crdtlite.codec.cbor.CborValues;
import io.crdtlite.core.clock.Timestamp;
import io.crdtlite.core.nodes.ConValue;
import io.crdtlite.core.patch.Op;
import io.crdtlite.core.patch.OpCode;
import io.crdtlite.core.patch.Patch;

import java.nio.charset.StandardCharsets;

/**
 * Binary patch encoding.
 * <p>
 * Layout:
 * <pre>
 *   vu57 sid, vu57 time          patch id
 *   cbor                         undefined, or a 1-element array holding the meta
 *   vu57 count                   number of ops
 *   op*                          octet (opcode &lt;&lt; 3 | len), then operands
 * </pre>
 * A length from 1 to 7 lives in the low 3 bits of the op octet; otherwise
 * those bits are zero and a vu57 length follows. Ids of the patch's own
 * session are b1vu56(0, time); foreign ids are b1vu56(1, time) then vu57(sid).
 */
public final class BinaryPatchEncoder {

    public byte[] encode(Patch patch) {
        var id = PatchShape.requireEncodable(patch);
        var out = new CrdtWriter();
        out.vu57(id.sid());
        out.vu57(id.time());
        if (patch.meta() == null) {
            CborValues.writeUndefined(out);
        } else {
            CborValues.write(out, JsonNodeFactory.instance.arrayNode().add(patch.meta()));
        }
        out.vu57(patch.ops().size());
        for (var op : patch.ops()) writeOp(out, id.sid(), op);
        return out.toByteArray();
    }

    private static void writeOp(CrdtWriter out, long sid, Op op) {
        int code = op.code().code();
        if (op instanceof Op.NewCon o) {
            if (o.value() instanceof ConValue.Ref r) {
                out.u8(code << 3 | 1);
                writeId(out, sid, r.id());
            } else if (o.value() instanceof ConValue.Json j) {
                out.u8(code << 3);
                CborValues.write(out, j.value());
            } else {
                out.u8(code << 3);
                CborValues.writeUndefined(out);
            }
        } else if (op instanceof Op.InsVal o) {
            out.u8(code << 3);
            writeId(out, sid, o.obj());
            writeId(out, sid, o.val());
        } else if (op instanceof Op.InsObj o) {
            header(out, OpCode.INS_OBJ, o.entries().size());
            writeId(out, sid, o.obj());
            for (var e : o.entries()) {
                CborValues.write(out, JsonNodeFactory.instance.textNode(e.key()));
                writeId(out, sid, e.value());
            }
        } else if (op instanceof Op.InsVec o) {
            header(out, OpCode.INS_VEC, o.entries().size());
            writeId(out, sid, o.obj());
            for (var e : o.entries()) {
                out.u8(e.index());
                writeId(out, sid, e.value());
            }
        } else if (op instanceof Op.InsStr o) {
            byte[] utf8 = o.data().getBytes(StandardCharsets.UTF_8);
            header(out, OpCode.INS_STR, utf8.length);
            writeId(out, sid, o.obj());
            writeId(out, sid, o.after());
            out.bytes(utf8);
        } else if (op instanceof Op.InsBin o) {
            byte[] data = o.data();
            header(out, OpCode.INS_BIN, data.length);
            writeId(out, sid, o.obj());
            writeId(out, sid, o.after());
            out.bytes(data);
        } else if (op instanceof Op.InsArr o) {
            header(out, OpCode.INS_ARR, o.data().size());
            writeId(out, sid, o.obj());
            writeId(out, sid, o.after());
            for (var el : o.data()) writeId(out, sid, el);
        } else if (op instanceof Op.UpdArr o) {
            out.u8(code << 3);
            writeId(out, sid, o.obj());
            writeId(out, sid, o.ref());
            writeId(out, sid, o.val());
        } else if (op instanceof Op.Del o) {
            header(out, OpCode.DEL, o.what().size());
            writeId(out, sid, o.obj());
            for (var span : o.what()) {
                writeId(out, sid, span.start());
                out.vu57(span.span());
            }
        } else if (op instanceof Op.Nop o) {
            header(out, OpCode.NOP, o.len());
        } else {
            // new_val .. new_arr carry no operands
            out.u8(code << 3);
        }
    }

    private static void header(CrdtWriter out, OpCode code, long length) {
        if (length >= 1 && length <= 7) {
            out.u8(code.code() << 3 | (int) length);
        } else {
            out.u8(code.code() << 3);
            out.vu57(length);
        }
    }

    private static void writeId(CrdtWriter out, long patchSid, Timestamp id) {
        if (id.sid() == patchSid) {
            out.b1vu56(false, id.time());
        } else {
            out.b1vu56(true, id.time());
            out.vu57(id.sid());
        }
    }
}
