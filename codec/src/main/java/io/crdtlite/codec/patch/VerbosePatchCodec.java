// file: src/main/java/io/crdtlite/codec/patch/VerbosePatchCodec.java
package io.crdtlite.codec.patch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
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

import static io.crdtlite.codec.patch.CompactPatchCodec.array;
import static io.crdtlite.codec.patch.CompactPatchCodec.at;
import static io.crdtlite.codec.patch.CompactPatchCodec.base64;
import static io.crdtlite.codec.patch.CompactPatchCodec.intAt;
import static io.crdtlite.codec.patch.CompactPatchCodec.longAt;

/**
 * Human-readable JSON patch encoding:
 * <pre>
 * {"id": [sid, time], "meta": ..., "ops": [{"op": "new_str"}, {"op": "ins_str", "obj": [sid, time], ...}]}
 * </pre>
 * Ids are {@code [sid, time]}; the server session writes a bare time.
 * Deletion spans are {@code [sid, time, span]} ({@code [time, span]} for the server).
 */
public final class VerbosePatchCodec {

    private static final JsonNodeFactory F = JsonNodeFactory.instance;

    public ObjectNode encode(Patch patch) {
        var id = PatchShape.requireEncodable(patch);
        var out = F.objectNode();
        out.set("id", id(id));
        if (patch.meta() != null) out.set("meta", patch.meta());
        var ops = out.putArray("ops");
        for (var op : patch.ops()) ops.add(encodeOp(op));
        return out;
    }

    private static ObjectNode encodeOp(Op op) {
        var o = F.objectNode().put("op", op.name());
        if (op instanceof Op.NewCon c) {
            if (c.value() instanceof ConValue.Ref r) {
                o.put("timestamp", true);
                o.set("value", id(r.id()));
            } else if (c.value() instanceof ConValue.Json j) {
                o.set("value", j.value());
            }
        } else if (op instanceof Op.InsVal v) {
            o.set("obj", id(v.obj()));
            o.set("value", id(v.val()));
        } else if (op instanceof Op.InsObj v) {
            o.set("obj", id(v.obj()));
            var tuples = o.putArray("value");
            for (var e : v.entries()) tuples.addArray().add(e.key()).add(id(e.value()));
        } else if (op instanceof Op.InsVec v) {
            o.set("obj", id(v.obj()));
            var tuples = o.putArray("value");
            for (var e : v.entries()) tuples.addArray().add(e.index()).add(id(e.value()));
        } else if (op instanceof Op.InsStr v) {
            o.set("obj", id(v.obj()));
            o.set("after", id(v.after()));
            o.put("value", v.data());
        } else if (op instanceof Op.InsBin v) {
            o.set("obj", id(v.obj()));
            o.set("after", id(v.after()));
            o.put("value", Base64.getEncoder().encodeToString(v.data()));
        } else if (op instanceof Op.InsArr v) {
            o.set("obj", id(v.obj()));
            o.set("after", id(v.after()));
            var values = o.putArray("values");
            for (var el : v.data()) values.add(id(el));
        } else if (op instanceof Op.UpdArr v) {
            o.set("obj", id(v.obj()));
            o.set("ref", id(v.ref()));
            o.set("value", id(v.val()));
        } else if (op instanceof Op.Del v) {
            o.set("obj", id(v.obj()));
            var what = o.putArray("what");
            for (var s : v.what()) {
                var span = what.addArray();
                if (s.sid() != Session.SERVER) span.add(s.sid());
                span.add(s.time()).add(s.span());
            }
        } else if (op instanceof Op.Nop v) {
            if (v.len() > 1) o.put("len", v.len());
        }
        return o;
    }

    private static JsonNode id(Timestamp ts) {
        if (ts.sid() == Session.SERVER) return F.numberNode(ts.time());
        ArrayNode a = F.arrayNode();
        return a.add(ts.sid()).add(ts.time());
    }

    // ---- decode ----

    public Patch decode(JsonNode data) {
        if (data == null || !data.isObject()) {
            throw new CodecException(ErrorCode.INVALID_PATCH, "verbose patch must be a JSON object");
        }
        var head = id(field(data, "id"));
        try {
            var b = PatchBuilder.at(head.sid(), head.time());
            var ops = data.get("ops");
            if (ops != null) {
                for (var op : array(ops)) decodeOp(b, op);
            }
            var meta = data.get("meta");
            if (meta != null) b.meta(meta);
            return b.flush();
        } catch (IllegalArgumentException | ClockException e) {
            throw new CodecException(ErrorCode.INVALID_PATCH, e.getMessage(), e);
        }
    }

    private static void decodeOp(PatchBuilder b, JsonNode op) {
        var name = field(op, "op");
        var code = name.isTextual() ? OpCode.fromName(name.textValue()) : null;
        if (code == null) throw new CodecException(ErrorCode.UNKNOWN_OPCODE, "op " + name);
        switch (code) {
            case NEW_CON -> {
                var value = op.get("value");
                if (value == null) b.undefined();
                else if (op.path("timestamp").asBoolean(false)) b.conRef(id(value));
                else b.con(value);
            }
            case NEW_VAL -> b.val();
            case NEW_OBJ -> b.obj();
            case NEW_VEC -> b.vec();
            case NEW_STR -> b.str();
            case NEW_BIN -> b.bin();
            case NEW_ARR -> b.arr();
            case INS_VAL -> b.setVal(id(field(op, "obj")), id(field(op, "value")));
            case INS_OBJ -> {
                var entries = new ArrayList<Op.ObjEntry>();
                for (var t : array(field(op, "value"))) {
                    if (!at(t, 0).isTextual()) throw new CodecException(ErrorCode.INVALID_PATCH, "object key must be a string");
                    entries.add(new Op.ObjEntry(t.get(0).textValue(), id(at(t, 1))));
                }
                b.insObj(id(field(op, "obj")), entries);
            }
            case INS_VEC -> {
                var entries = new ArrayList<Op.VecEntry>();
                for (var t : array(field(op, "value"))) entries.add(new Op.VecEntry(intAt(t, 0), id(at(t, 1))));
                b.insVec(id(field(op, "obj")), entries);
            }
            case INS_STR -> {
                var obj = id(field(op, "obj"));
                var text = field(op, "value");
                if (!text.isTextual()) throw new CodecException(ErrorCode.INVALID_PATCH, "ins_str value must be a string");
                b.insStr(obj, after(op, obj), text.textValue());
            }
            case INS_BIN -> {
                var obj = id(field(op, "obj"));
                b.insBin(obj, after(op, obj), base64(field(op, "value")));
            }
            case INS_ARR -> {
                var obj = id(field(op, "obj"));
                var values = new ArrayList<Timestamp>();
                for (var v : array(field(op, "values"))) values.add(id(v));
                b.insArr(obj, after(op, obj), values);
            }
            case UPD_ARR -> b.updArr(id(field(op, "obj")), id(field(op, "ref")), id(field(op, "value")));
            case DEL -> {
                var what = new ArrayList<Timespan>();
                for (var s : array(field(op, "what"))) {
                    if (s.size() == 3) what.add(new Timespan(longAt(s, 0), longAt(s, 1), longAt(s, 2)));
                    else if (s.size() == 2) what.add(new Timespan(Session.SERVER, longAt(s, 0), longAt(s, 1)));
                    else throw new CodecException(ErrorCode.INVALID_PATCH, "bad span " + s);
                }
                b.del(id(field(op, "obj")), what);
            }
            case NOP -> {
                var len = op.get("len");
                b.nop(len == null ? 1 : len.asLong());
            }
        }
    }

    /** A missing "after" means "at the start", i.e. the container itself. */
    private static Timestamp after(JsonNode op, Timestamp obj) {
        var after = op.get("after");
        return after == null ? obj : id(after);
    }

    private static JsonNode field(JsonNode obj, String name) {
        var v = obj.isObject() ? obj.get(name) : null;
        if (v == null) throw new CodecException(ErrorCode.INVALID_PATCH, "missing field '" + name + "'");
        return v;
    }

    private static Timestamp id(JsonNode v) {
        if (v.isIntegralNumber()) return new Timestamp(Session.SERVER, v.longValue());
        if (v.isArray() && v.size() == 2) return new Timestamp(longAt(v, 0), longAt(v, 1));
        throw new CodecException(ErrorCode.INVALID_PATCH, "bad id " + v);
    }
}
