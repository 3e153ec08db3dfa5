// file: src/main/java/io/crdtlite/core/patch/PatchBuilder.java
package io.crdtlite.core.patch;

import com.fasterxml.jackson.databind.JsonNode;
import io.crdtlite.core.clock.ClockVector;
import io.crdtlite.core.clock.LogicalClock;
import io.crdtlite.core.clock.ServerClock;
import io.crdtlite.core.clock.Session;
import io.crdtlite.core.clock.Timespan;
import io.crdtlite.core.clock.Timestamp;
import io.crdtlite.core.nodes.ConValue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Fluent constructor of contiguous patches.
 * <p>
 * Every call reserves the op's span on the builder's clock and appends the op;
 * the returned timestamp is the new op's id, which later calls use to refer to
 * the node it created. {@link #flush()} hands out the accumulated patch and
 * starts a new one where the old one stopped.
 * <p>
 * Inserts with no content are rejected with {@link IllegalArgumentException}:
 * a zero-length op would carry no timestamp of its own.
 */
public final class PatchBuilder {

    private final LogicalClock clock;
    private List<Op> ops = new ArrayList<>();
    private JsonNode meta;

    public PatchBuilder(LogicalClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Builder whose first op gets id {@code (sid, time)}. */
    public static PatchBuilder at(long sid, long time) {
        return sid == Session.SERVER
                ? new PatchBuilder(new ServerClock(time))
                : new PatchBuilder(new ClockVector(sid, time));
    }

    public LogicalClock clock() {
        return clock;
    }

    /** Id the next op will receive. */
    public Timestamp nextId() {
        return clock.now();
    }

    public List<Op> ops() {
        return List.copyOf(ops);
    }

    public PatchBuilder meta(JsonNode meta) {
        this.meta = meta;
        return this;
    }

    /** Take the patch built so far and reset for the next one. */
    public Patch flush() {
        var patch = new Patch(ops, meta);
        ops = new ArrayList<>();
        meta = null;
        return patch;
    }

    private Timestamp push(long span, Function<Timestamp, Op> make) {
        var id = clock.tick(span);
        ops.add(make.apply(id));
        return id;
    }

    // ---- node creation ----

    public Timestamp con(JsonNode value) {
        Objects.requireNonNull(value, "value");
        return push(1, id -> new Op.NewCon(id, ConValue.of(value)));
    }

    public Timestamp conRef(Timestamp ref) {
        Objects.requireNonNull(ref, "ref");
        return push(1, id -> new Op.NewCon(id, ConValue.ref(ref)));
    }

    public Timestamp undefined() {
        return push(1, id -> new Op.NewCon(id, ConValue.UNDEFINED));
    }

    public Timestamp con(ConValue value) {
        Objects.requireNonNull(value, "value");
        return push(1, id -> new Op.NewCon(id, value));
    }

    public Timestamp val() {
        return push(1, Op.NewVal::new);
    }

    public Timestamp obj() {
        return push(1, Op.NewObj::new);
    }

    public Timestamp vec() {
        return push(1, Op.NewVec::new);
    }

    public Timestamp str() {
        return push(1, Op.NewStr::new);
    }

    public Timestamp bin() {
        return push(1, Op.NewBin::new);
    }

    public Timestamp arr() {
        return push(1, Op.NewArr::new);
    }

    // ---- mutation ----

    /** Set register {@code obj}; pass {@link Timestamp#ORIGIN} to set the document root. */
    public Timestamp setVal(Timestamp obj, Timestamp val) {
        return push(1, id -> new Op.InsVal(id, obj, val));
    }

    public Timestamp root(Timestamp val) {
        return setVal(Timestamp.ORIGIN, val);
    }

    public Timestamp insObj(Timestamp obj, List<Op.ObjEntry> entries) {
        if (entries.isEmpty()) throw new IllegalArgumentException("ins_obj needs at least one entry");
        return push(1, id -> new Op.InsObj(id, obj, entries));
    }

    public Timestamp insVec(Timestamp obj, List<Op.VecEntry> entries) {
        if (entries.isEmpty()) throw new IllegalArgumentException("ins_vec needs at least one entry");
        return push(1, id -> new Op.InsVec(id, obj, entries));
    }

    public Timestamp insStr(Timestamp obj, Timestamp after, String text) {
        if (text.isEmpty()) throw new IllegalArgumentException("ins_str needs non-empty text");
        return push(text.length(), id -> new Op.InsStr(id, obj, after, text));
    }

    public Timestamp insBin(Timestamp obj, Timestamp after, byte[] data) {
        if (data.length == 0) throw new IllegalArgumentException("ins_bin needs non-empty data");
        return push(data.length, id -> new Op.InsBin(id, obj, after, data));
    }

    public Timestamp insArr(Timestamp obj, Timestamp after, List<Timestamp> values) {
        if (values.isEmpty()) throw new IllegalArgumentException("ins_arr needs at least one element");
        return push(values.size(), id -> new Op.InsArr(id, obj, after, values));
    }

    public Timestamp updArr(Timestamp obj, Timestamp ref, Timestamp val) {
        return push(1, id -> new Op.UpdArr(id, obj, ref, val));
    }

    public Timestamp del(Timestamp obj, List<Timespan> what) {
        if (what.isEmpty()) throw new IllegalArgumentException("del needs at least one span");
        return push(1, id -> new Op.Del(id, obj, what));
    }

    public Timestamp nop(long span) {
        if (span < 1) throw new IllegalArgumentException("nop span must be >= 1");
        return push(span, id -> new Op.Nop(id, span));
    }

    // ---- JSON helpers ----

    /**
     * Emit ops that build {@code value} as a fresh subtree and return the id
     * of its top node. Scalars become a register holding a constant, strings
     * and binaries become RGA nodes, arrays and objects recurse.
     */
    public Timestamp json(JsonNode value) {
        if (value == null || value.isMissingNode()) return undefined();
        if (value.isTextual()) {
            var id = str();
            if (!value.textValue().isEmpty()) insStr(id, id, value.textValue());
            return id;
        }
        if (value.isBinary()) {
            var id = bin();
            byte[] bytes = binaryValue(value);
            if (bytes.length > 0) insBin(id, id, bytes);
            return id;
        }
        if (value.isArray()) {
            var id = arr();
            var elements = new ArrayList<Timestamp>();
            for (var el : value) elements.add(constOrJson(el));
            if (!elements.isEmpty()) insArr(id, id, elements);
            return id;
        }
        if (value.isObject()) {
            var id = obj();
            var entries = new ArrayList<Op.ObjEntry>();
            for (Map.Entry<String, JsonNode> e : value.properties()) {
                entries.add(new Op.ObjEntry(e.getKey(), constOrJson(e.getValue())));
            }
            if (!entries.isEmpty()) insObj(id, entries);
            return id;
        }
        var reg = val();
        setVal(reg, con(value));
        return reg;
    }

    /** Scalars (null, booleans, numbers) as a bare constant, everything else via {@link #json}. */
    public Timestamp constOrJson(JsonNode value) {
        if (isScalar(value)) return con(value);
        return json(value);
    }

    /** Build {@code value} and make it the document root. */
    public Timestamp setRoot(JsonNode value) {
        var id = json(value);
        root(id);
        return id;
    }

    public static boolean isScalar(JsonNode value) {
        return value != null && (value.isNull() || value.isBoolean() || value.isNumber());
    }

    private static byte[] binaryValue(JsonNode value) {
        try {
            return value.binaryValue();
        } catch (IOException e) {
            throw new IllegalArgumentException("unreadable binary value", e);
        }
    }
}
