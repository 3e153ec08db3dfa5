// file: src/main/java/io/crdtlite/codec/patch/CompactPatchCodec.java
package io.crdtlite.codec.patch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.crdtlite.codec.CodecException;
import io.crdtlite.codec.ErrorCode;
import io.crdtlite.core.clock.ClockException;
import io.crdtlite.core.clock.Session;
import io.crdtlite.core.clock.Timespan;
import io.crdtlite.core.clock.Timestamp;
import io.crdtlite.core.nodes.ConValue;
import io.crdtlite.core.patch.Op;
import io.crdtlite.core.patch.OpCode;
import io.crdtlite.core.patch.Patch;
import io.crdtlite.core.patch.PatchBuilder;

import java.util.ArrayList;
import java.util.Base64;

/**
 * Compact JSON patch encoding: a flat array {@code [header, op, op, ...]}.
 * <p>
 * The header is {@code [[sid, time], meta?]}, or {@code [time, meta?]} for the
 * server session. Each op is an array starting with its numeric opcode. Ids
 * of the patch's own session are written as a bare time, others as
 * {@code [sid, time]}; spans as {@code [time, span]} or {@code [sid, time, span]}.
 */
public final class CompactPatchCodec {

    private static final JsonNodeFactory F = JsonNodeFactory.instance;

    public ArrayNode encode(Patch patch) {
        var id = PatchShape.requireEncodable(patch);
        long sid = id.sid();
        var out = F.arrayNode();

        var header = out.addArray();
        if (sid == Session.SERVER) header.add(id.time());
        else header.addArray().add(sid).add(id.time());
        if (patch.meta() != null) header.add(patch.meta());

        for (var op : patch.ops()) out.add(encodeOp(sid, op));
        return out;
    }

    private static ArrayNode encodeOp(long sid, Op op) {
        var a = F.arrayNode().add(op.code().code());
        if (op instanceof Op.NewCon o) {
            if (o.value() instanceof ConValue.Ref r) {
                a.add(id(sid, r.id())).add(true);
            } else if (o.value() instanceof ConValue.Json j) {
                a.add(j.value());
            }
        } else if (op instanceof Op.InsVal o) {
            a.add(id(sid, o.obj())).add(id(sid, o.val()));
        } else if (op instanceof Op.InsObj o) {
            a.add(id(sid, o.obj()));
            var tuples = a.addArray();
            for (var e : o.entries()) tuples.addArray().add(e.key()).add(id(sid, e.value()));
        } else if (op instanceof Op.InsVec o) {
            a.add(id(sid, o.obj()));
            var tuples = a.addArray();
            for (var e : o.entries()) tuples.addArray().add(e.index()).add(id(sid, e.value()));
        } else if (op instanceof Op.InsStr o) {
            a.add(id(sid, o.obj())).add(id(sid, o.after())).add(o.data());
        } else if (op instanceof Op.InsBin o) {
            a.add(id(sid, o.obj())).add(id(sid, o.after())).add(Base64.getEncoder().encodeToString(o.data()));
        } else if (op instanceof Op.InsArr o) {
            a.add(id(sid, o.obj())).add(id(sid, o.after()));
            var values = a.addArray();
            for (var el : o.data()) values.add(id(sid, el));
        } else if (op instanceof Op.UpdArr o) {
            a.add(id(sid, o.obj())).add(id(sid, o.ref())).add(id(sid, o.val()));
        } else if (op instanceof Op.Del o) {
            a.add(id(sid, o.obj()));
            var spans = a.addArray();
            for (var s : o.what()) {
                var span = spans.addArray();
                if (s.sid() != sid) span.add(s.sid());
                span.add(s.time()).add(s.span());
            }
        } else if (op instanceof Op.Nop o) {
            if (o.len() > 1) a.add(o.len());
        }
        return a;
    }

    private static JsonNode id(long patchSid, Timestamp ts) {
        if (ts.sid() == patchSid) return F.numberNode(ts.time());
        return F.arrayNode().add(ts.sid()).add(ts.time());
    }

    // ---- decode ----

    public Patch decode(JsonNode data) {
        if (data == null || !data.isArray() || data.isEmpty() || !data.get(0).isArray() || data.get(0).isEmpty()) {
            throw new CodecException(ErrorCode.INVALID_PATCH, "compact patch must start with a header array");
        }
        var header = data.get(0);
        var headId = header.get(0);
        long sid;
        long time;
        if (headId.isIntegralNumber()) {
            sid = Session.SERVER;
            time = headId.longValue();
        } else if (headId.isArray() && headId.size() == 2) {
            sid = longAt(headId, 0);
            time = longAt(headId, 1);
        } else {
            throw new CodecException(ErrorCode.INVALID_PATCH, "bad patch id " + headId);
        }

        try {
            var b = PatchBuilder.at(sid, time);
            for (int i = 1; i < data.size(); i++) decodeOp(b, sid, data.get(i));
            if (header.size() > 1) b.meta(header.get(1));
            return b.flush();
        } catch (IllegalArgumentException | ClockException e) {
            throw new CodecException(ErrorCode.INVALID_PATCH, e.getMessage(), e);
        }
    }

    private static void decodeOp(PatchBuilder b, long sid, JsonNode op) {
        if (!op.isArray() || op.isEmpty() || !op.get(0).isIntegralNumber()) {
            throw new CodecException(ErrorCode.INVALID_PATCH, "bad op " + op);
        }
        var code = OpCode.fromCode(op.get(0).intValue());
        if (code == null) throw new CodecException(ErrorCode.UNKNOWN_OPCODE, "opcode " + op.get(0));
        switch (code) {
            case NEW_CON -> {
                if (op.size() == 1) b.undefined();
                else if (op.size() > 2 && op.get(2).asBoolean(false)) b.conRef(id(sid, op.get(1)));
                else b.con(op.get(1));
            }
            case NEW_VAL -> b.val();
            case NEW_OBJ -> b.obj();
            case NEW_VEC -> b.vec();
            case NEW_STR -> b.str();
            case NEW_BIN -> b.bin();
            case NEW_ARR -> b.arr();
            case INS_VAL -> b.setVal(id(sid, at(op, 1)), id(sid, at(op, 2)));
            case INS_OBJ -> {
                var entries = new ArrayList<Op.ObjEntry>();
                for (var t : array(at(op, 2))) {
                    if (!at(t, 0).isTextual()) throw new CodecException(ErrorCode.INVALID_PATCH, "object key must be a string");
                    entries.add(new Op.ObjEntry(t.get(0).textValue(), id(sid, at(t, 1))));
                }
                b.insObj(id(sid, at(op, 1)), entries);
            }
            case INS_VEC -> {
                var entries = new ArrayList<Op.VecEntry>();
                for (var t : array(at(op, 2))) entries.add(new Op.VecEntry(intAt(t, 0), id(sid, at(t, 1))));
                b.insVec(id(sid, at(op, 1)), entries);
            }
            case INS_STR -> {
                if (!at(op, 3).isTextual()) throw new CodecException(ErrorCode.INVALID_PATCH, "ins_str data must be a string");
                b.insStr(id(sid, at(op, 1)), id(sid, at(op, 2)), op.get(3).textValue());
            }
            case INS_BIN -> b.insBin(id(sid, at(op, 1)), id(sid, at(op, 2)), base64(at(op, 3)));
            case INS_ARR -> {
                var values = new ArrayList<Timestamp>();
                for (var v : array(at(op, 3))) values.add(id(sid, v));
                b.insArr(id(sid, at(op, 1)), id(sid, at(op, 2)), values);
            }
            case UPD_ARR -> b.updArr(id(sid, at(op, 1)), id(sid, at(op, 2)), id(sid, at(op, 3)));
            case DEL -> {
                var what = new ArrayList<Timespan>();
                for (var s : array(at(op, 2))) {
                    if (s.size() == 3) what.add(new Timespan(longAt(s, 0), longAt(s, 1), longAt(s, 2)));
                    else if (s.size() == 2) what.add(new Timespan(sid, longAt(s, 0), longAt(s, 1)));
                    else throw new CodecException(ErrorCode.INVALID_PATCH, "bad span " + s);
                }
                b.del(id(sid, at(op, 1)), what);
            }
            case NOP -> b.nop(op.size() > 1 ? longAt(op, 1) : 1);
        }
    }

    private static Timestamp id(long patchSid, JsonNode v) {
        if (v.isIntegralNumber()) return new Timestamp(patchSid, v.longValue());
        if (v.isArray() && v.size() == 2) return new Timestamp(longAt(v, 0), longAt(v, 1));
        throw new CodecException(ErrorCode.INVALID_PATCH, "bad id " + v);
    }

    static JsonNode at(JsonNode arr, int i) {
        if (!arr.isArray() || i >= arr.size()) {
            throw new CodecException(ErrorCode.INVALID_PATCH, "missing element " + i + " in " + arr);
        }
        return arr.get(i);
    }

    static JsonNode array(JsonNode v) {
        if (!v.isArray()) throw new CodecException(ErrorCode.INVALID_PATCH, "expected array, got " + v);
        return v;
    }

    static long longAt(JsonNode arr, int i) {
        var v = at(arr, i);
        if (!v.isIntegralNumber()) throw new CodecException(ErrorCode.INVALID_PATCH, "expected integer, got " + v);
        return v.longValue();
    }

    static int intAt(JsonNode arr, int i) {
        long v = longAt(arr, i);
        if (v < 0 || v > Integer.MAX_VALUE) throw new CodecException(ErrorCode.INVALID_PATCH, "integer out of range " + v);
        return (int) v;
    }

    static byte[] base64(JsonNode v) {
        if (!v.isTextual()) throw new CodecException(ErrorCode.INVALID_PATCH, "expected base64 string");
        try {
            return Base64.getDecoder().decode(v.textValue());
        } catch (IllegalArgumentException e) {
            throw new CodecException(ErrorCode.INVALID_PATCH, "bad base64", e);
        }
    }
}
