package io.crdtlite.codec.patch;

import io.crdtlite.codec.CodecException;
import io.crdtlite.codec.ErrorCode;
import io.crdtlite.core.clock.Session;
import io.crdtlite.core.clock.Timespan;
import io.crdtlite.core.clock.Timestamp;
import io.crdtlite.core.model.Model;
import io.crdtlite.core.patch.Op;
import io.crdtlite.core.patch.Patch;
import io.crdtlite.core.patch.PatchBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static io.crdtlite.codec.TestJson.json;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavior tests: every format must carry every op kind without loss, and the
 * binary format must reject or quarantine malformed input as documented.
 */
class PatchCodecsTest {

    private static final long SID = 123_456;
    private static final long PEER = 987_654;

    private final PatchCodecs codecs = new PatchCodecs();

    /** One of each op kind, with references into the patch's own and a foreign session. */
    private static Patch everyOp(long sid, long time, long peer) {
        var b = PatchBuilder.at(sid, time);
        var foreign = new Timestamp(peer, 40);
        var c1 = b.con(json("{'nested':[1,'two',null,true]}"));
        b.conRef(foreign);
        b.undefined();
        var val = b.val();
        var obj = b.obj();
        var vec = b.vec();
        var str = b.str();
        var bin = b.bin();
        var arr = b.arr();
        b.setVal(val, c1);
        b.insObj(obj, List.of(new Op.ObjEntry("a", c1), new Op.ObjEntry("long key ü", val)));
        b.insVec(vec, List.of(new Op.VecEntry(0, c1), new Op.VecEntry(255, val)));
        b.insStr(str, str, "héllo 😀");
        b.insBin(bin, bin, new byte[]{0, 1, (byte) 0xff});
        var ins = b.insArr(arr, arr, List.of(c1, foreign));
        b.updArr(arr, ins, val);
        b.del(str, List.of(Timespan.of(foreign, 3), new Timespan(sid, time + 1, 2)));
        b.nop(3);
        b.root(obj);
        b.meta(json("{'author':'ann','seq':[1,2]}"));
        return b.flush();
    }

    @ParameterizedTest
    @EnumSource(PatchFormat.class)
    void every_op_kind_round_trips(PatchFormat format) {
        var patch = everyOp(SID, 1000, PEER);
        var decoded = codecs.decode(codecs.encode(patch, format), format);
        assertEquals(patch, decoded);
        assertEquals(patch.meta(), decoded.meta());
    }

    @ParameterizedTest
    @EnumSource(PatchFormat.class)
    void server_session_patches_round_trip(PatchFormat format) {
        var b = PatchBuilder.at(Session.SERVER, 7);
        var str = b.str();
        b.insStr(str, str, "abc");
        b.root(str);
        var patch = b.flush();

        var decoded = codecs.decode(codecs.encode(patch, format), format);
        assertEquals(patch, decoded);
        assertEquals(new Timestamp(Session.SERVER, 7), decoded.id());
    }

    @ParameterizedTest
    @EnumSource(PatchFormat.class)
    void decoded_patches_apply_to_the_same_document(PatchFormat format) {
        var source = Model.create(SID);
        var b = source.builder();
        b.setRoot(json("{'title':'draft','tags':['a','b'],'n':3}"));
        var patch = b.flush();
        source.applyPatch(patch);

        var replica = Model.create(PEER);
        replica.applyPatch(codecs.decode(codecs.encode(patch, format), format));
        assertEquals(source.view(), replica.view());
    }

    @Test
    void binary_encoding_is_canonical() {
        var bytes = codecs.encode(everyOp(SID, 5, PEER), PatchFormat.BINARY);
        var again = codecs.encode(codecs.decode(bytes, PatchFormat.BINARY), PatchFormat.BINARY);
        assertArrayEquals(bytes, again);
    }

    @Test
    void verbose_format_names_ops_and_ids() {
        var b = PatchBuilder.at(SID, 1);
        b.obj();
        var text = new String(codecs.encode(b.flush(), PatchFormat.VERBOSE), StandardCharsets.UTF_8);
        var node = json(text);
        assertEquals(json("[" + SID + ",1]"), node.get("id"));
        assertEquals("new_obj", node.get("ops").get(0).get("op").textValue());
    }

    @Test
    void compact_format_is_header_then_ops() {
        var b = PatchBuilder.at(SID, 1);
        b.obj();
        var node = json(new String(codecs.encode(b.flush(), PatchFormat.COMPACT), StandardCharsets.UTF_8));
        assertEquals(json("[[[" + SID + ",1]],[2]]"), node);
    }

    @Test
    void empty_patches_cannot_be_encoded() {
        for (var format : PatchFormat.values()) {
            assertThrows(IllegalArgumentException.class, () -> codecs.encode(Patch.empty(), format));
        }
    }

    @Test
    void json_text_is_not_a_binary_patch() {
        byte[] text = "{\"a\":1}".getBytes(StandardCharsets.UTF_8);

        var compact = assertThrows(CodecException.class, () -> codecs.decode(text, PatchFormat.COMPACT_BINARY));
        assertEquals(ErrorCode.INVALID_CBOR, compact.code());

        var lenient = assertThrows(CodecException.class, () -> codecs.decodeRaw(text));
        assertEquals(ErrorCode.INVALID_CBOR, lenient.code());
    }

    @Test
    void unknown_opcodes_are_rejected() {
        var b = PatchBuilder.at(SID, 1);
        b.obj();
        byte[] bytes = codecs.encode(b.flush(), PatchFormat.BINARY);
        bytes[bytes.length - 1] = (byte) (7 << 3);

        var e = assertThrows(CodecException.class, () -> codecs.decode(bytes, PatchFormat.BINARY));
        assertEquals(ErrorCode.UNKNOWN_OPCODE, e.code());

        var compact = json("[[[" + SID + ",1]],[8]]").toString().getBytes(StandardCharsets.UTF_8);
        var e2 = assertThrows(CodecException.class, () -> codecs.decode(compact, PatchFormat.COMPACT));
        assertEquals(ErrorCode.UNKNOWN_OPCODE, e2.code());
    }

    @Test
    void trailing_bytes_are_rejected_by_strict_decoding() {
        byte[] bytes = codecs.encode(everyOp(SID, 1, PEER), PatchFormat.BINARY);
        byte[] longer = Arrays.copyOf(bytes, bytes.length + 1);

        var e = assertThrows(CodecException.class, () -> codecs.decode(longer, PatchFormat.BINARY));
        assertEquals(ErrorCode.TRAILING_BYTES, e.code());

        byte[] cbor = codecs.encode(everyOp(SID, 1, PEER), PatchFormat.COMPACT_BINARY);
        byte[] longerCbor = Arrays.copyOf(cbor, cbor.length + 1);
        var e2 = assertThrows(CodecException.class, () -> codecs.decode(longerCbor, PatchFormat.COMPACT_BINARY));
        assertEquals(ErrorCode.TRAILING_BYTES, e2.code());
    }

    @ParameterizedTest
    @EnumSource(value = PatchFormat.class, names = {"VERBOSE", "COMPACT"})
    void json_patches_followed_by_more_json_are_rejected(PatchFormat format) {
        var text = new String(codecs.encode(everyOp(SID, 1, PEER), format), StandardCharsets.UTF_8);

        byte[] padded = (text + " \n").getBytes(StandardCharsets.UTF_8);
        assertEquals(everyOp(SID, 1, PEER), codecs.decode(padded, format));

        byte[] longer = (text + " {\"x\":1}").getBytes(StandardCharsets.UTF_8);
        var e = assertThrows(CodecException.class, () -> codecs.decode(longer, format));
        assertEquals(ErrorCode.INVALID_PATCH, e.code());

        byte[] twice = (text + text).getBytes(StandardCharsets.UTF_8);
        assertThrows(CodecException.class, () -> codecs.decode(twice, format));
    }

    @Test
    void truncated_binary_patches_overflow() {
        var b = PatchBuilder.at(SID, 1);
        var str = b.str();
        b.insStr(str, str, "truncate me");
        byte[] bytes = codecs.encode(b.flush(), PatchFormat.BINARY);
        byte[] cut = Arrays.copyOf(bytes, bytes.length - 2);

        var e = assertThrows(CodecException.class, () -> codecs.decode(cut, PatchFormat.BINARY));
        assertEquals(ErrorCode.OVERFLOW, e.code());
    }

    @Test
    void lenient_decoding_keeps_malformed_bytes_opaque() {
        var b = PatchBuilder.at(SID, 1);
        b.obj();
        byte[] bytes = codecs.encode(b.flush(), PatchFormat.BINARY);
        bytes[bytes.length - 1] = (byte) (8 << 3);

        var raw = codecs.decodeRaw(bytes);
        assertFalse(raw.isDecoded());
        assertTrue(raw.decoded().isEmpty());
        assertArrayEquals(bytes, raw.bytes());
    }

    @Test
    void lenient_decoding_of_good_bytes_keeps_both() {
        var patch = everyOp(SID, 1, PEER);
        byte[] bytes = codecs.encode(patch, PatchFormat.BINARY);
        var raw = codecs.decodeRaw(bytes);
        assertTrue(raw.isDecoded());
        assertEquals(patch, raw.decoded().orElseThrow());
    }

    @Test
    void verbose_decoding_rejects_garbage() {
        byte[] text = "not json".getBytes(StandardCharsets.UTF_8);
        var e = assertThrows(CodecException.class, () -> codecs.decode(text, PatchFormat.VERBOSE));
        assertEquals(ErrorCode.INVALID_PATCH, e.code());
    }
}
