// file: src/main/java/io/crdtlite/codec/patch/BinaryPatchDecoder.java
package io.crdtlite.codec.patch;

import com.fasterxml.jackson.databind.JsonNode;
import io.crdtlite.codec.CodecException;
import io.crdtlite.codec.ErrorCode;
import io.crdtlite.codec.binary.CrdtReader;
import io.crdtlite.codec.cbor.CborValues;
import io.crdtlite.core.clock.ClockException;
import io.crdtlite.core.clock.Timespan;
import io.crdtlite.core.clock.Timestamp;
import io.crdtlite.core.patch.Op;
import io.crdtlite.core.patch.OpCode;
import io.crdtlite.core.patch.Patch;
import io.crdtlite.core.patch.PatchBuilder;

import java.util.ArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decoder for {@link BinaryPatchEncoder}'s layout.
 * <p>
 * {@link #decode} is strict: any structural problem, including bytes left
 * after the last op, fails with a {@link CodecException}.
 * {@link #decodeLenient} keeps undecodable input as an opaque {@link RawPatch},
 * except for broken CBOR values and JSON text (a leading '{'), which are
 * rejected.
 */
public final class BinaryPatchDecoder {
    private static final Logger log = Logger.getLogger(BinaryPatchDecoder.class.getName());

    private static final int JSON_OBJECT_START = 0x7b;

    public Patch decode(byte[] data) {
        var in = new CrdtReader(data);
        var patch = read(in);
        if (!in.isEof()) {
            throw new CodecException(ErrorCode.TRAILING_BYTES, in.remaining() + " bytes after the last op");
        }
        return patch;
    }

    public RawPatch decodeLenient(byte[] data) {
        try {
            return new RawPatch(data, decode(data));
        } catch (CodecException e) {
            if (e.code() == ErrorCode.INVALID_CBOR) throw e;
            if (data.length > 0 && (data[0] & 0xff) == JSON_OBJECT_START) {
                throw new CodecException(ErrorCode.INVALID_CBOR, "input is JSON text, not a binary patch", e);
            }
            log.log(Level.WARNING, "Keeping " + data.length + " undecodable patch bytes as opaque: " + e.getMessage());
            return RawPatch.opaque(data);
        }
    }

    private Patch read(CrdtReader in) {
        long sid = in.vu57();
        long time = in.vu57();
        JsonNode meta = readMeta(in);
        int count = in.vu57Int();
        if (count > in.remaining()) {
            throw new CodecException(ErrorCode.OVERFLOW, count + " ops announced but only " + in.remaining() + " bytes left");
        }
        var builder = PatchBuilder.at(sid, time);
        try {
            for (int i = 0; i < count; i++) readOp(in, sid, builder);
        } catch (IllegalArgumentException | ClockException e) {
            throw new CodecException(ErrorCode.INVALID_PATCH, e.getMessage(), e);
        }
        builder.meta(meta);
        return builder.flush();
    }

    private static JsonNode readMeta(CrdtReader in) {
        var decoded = CborValues.read(in);
        if (decoded.isUndefined()) return null;
        var value = decoded.value();
        if (!value.isArray() || value.size() != 1) {
            throw new CodecException(ErrorCode.INVALID_PATCH, "patch meta must be undefined or a 1-element array");
        }
        return value.get(0);
    }

    private static void readOp(CrdtReader in, long sid, PatchBuilder b) {
        int octet = in.u8();
        var code = OpCode.fromCode(octet >>> 3);
        if (code == null) throw new CodecException(ErrorCode.UNKNOWN_OPCODE, "opcode " + (octet >>> 3));
        int low = octet & 0b111;
        switch (code) {
            case NEW_CON -> {
                if (low == 1) {
                    b.conRef(readId(in, sid));
                } else if (low == 0) {
                    var decoded = CborValues.read(in);
                    if (decoded.isUndefined()) b.undefined();
                    else b.con(decoded.value());
                } else {
                    throw new CodecException(ErrorCode.INVALID_PATCH, "bad new_con flags " + low);
                }
            }
            case NEW_VAL -> b.val();
            case NEW_OBJ -> b.obj();
            case NEW_VEC -> b.vec();
            case NEW_STR -> b.str();
            case NEW_BIN -> b.bin();
            case NEW_ARR -> b.arr();
            case INS_VAL -> {
                var obj = readId(in, sid);
                b.setVal(obj, readId(in, sid));
            }
            case INS_OBJ -> {
                int len = length(in, low);
                var obj = readId(in, sid);
                var entries = new ArrayList<Op.ObjEntry>();
                for (int i = 0; i < len; i++) {
                    var key = CborValues.readString(in);
                    entries.add(new Op.ObjEntry(key, readId(in, sid)));
                }
                b.insObj(obj, entries);
            }
            case INS_VEC -> {
                int len = length(in, low);
                var obj = readId(in, sid);
                var entries = new ArrayList<Op.VecEntry>();
                for (int i = 0; i < len; i++) {
                    int index = in.u8();
                    entries.add(new Op.VecEntry(index, readId(in, sid)));
                }
                b.insVec(obj, entries);
            }
            case INS_STR -> {
                int len = length(in, low);
                var obj = readId(in, sid);
                var after = readId(in, sid);
                b.insStr(obj, after, in.utf8(len));
            }
            case INS_BIN -> {
                int len = length(in, low);
                var obj = readId(in, sid);
                var after = readId(in, sid);
                b.insBin(obj, after, in.bytes(len));
            }
            case INS_ARR -> {
                int len = length(in, low);
                var obj = readId(in, sid);
                var after = readId(in, sid);
                if (len > in.remaining()) throw new CodecException(ErrorCode.OVERFLOW, "ins_arr of " + len + " elements");
                var values = new ArrayList<Timestamp>(len);
                for (int i = 0; i < len; i++) values.add(readId(in, sid));
                b.insArr(obj, after, values);
            }
            case UPD_ARR -> {
                var obj = readId(in, sid);
                var ref = readId(in, sid);
                b.updArr(obj, ref, readId(in, sid));
            }
            case DEL -> {
                int len = length(in, low);
                var obj = readId(in, sid);
                if (len > in.remaining()) throw new CodecException(ErrorCode.OVERFLOW, "del of " + len + " spans");
                var what = new ArrayList<Timespan>(len);
                for (int i = 0; i < len; i++) {
                    var start = readId(in, sid);
                    what.add(Timespan.of(start, in.vu57()));
                }
                b.del(obj, what);
            }
            case NOP -> b.nop(length(in, low));
        }
    }

    private static int length(CrdtReader in, int low) {
        return low != 0 ? low : in.vu57Int();
    }

    private static Timestamp readId(CrdtReader in, long patchSid) {
        var head = in.b1vu56();
        if (!head.flag()) return new Timestamp(patchSid, head.value());
        long sid = in.vu57();
        return new Timestamp(sid, head.value());
    }
}
