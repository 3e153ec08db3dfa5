// file: src/main/java/io/crdtlite/core/patch/Op.java
package io.crdtlite.core.patch;

import io.crdtlite.core.clock.Timespan;
import io.crdtlite.core.clock.Timestamp;
import io.crdtlite.core.nodes.ConValue;

import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * One CRDT operation. Every operation has an id (its first timestamp) and a
 * span (how many consecutive timestamps it consumes).
 * <p>
 * The {@code new_*} kinds create nodes; {@code ins_*}, {@code upd_arr} and
 * {@code del} mutate existing ones; {@code nop} only burns clock time.
 */
public sealed interface Op permits
        Op.NewCon, Op.NewVal, Op.NewObj, Op.NewVec, Op.NewStr, Op.NewBin, Op.NewArr,
        Op.InsVal, Op.InsObj, Op.InsVec, Op.InsStr, Op.InsBin, Op.InsArr,
        Op.UpdArr, Op.Del, Op.Nop {

    Timestamp id();

    OpCode code();

    default long span() {
        return 1;
    }

    default String name() {
        return code().opName();
    }

    /** Same operation with every timestamp passed through {@code f}. */
    Op rewrite(UnaryOperator<Timestamp> f);

    /** Key/child pair of an {@code ins_obj}. */
    record ObjEntry(String key, Timestamp value) {
        public ObjEntry {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
    }

    /** Slot/child pair of an {@code ins_vec}. */
    record VecEntry(int index, Timestamp value) {
        public VecEntry {
            if (index < 0 || index > 255) throw new IllegalArgumentException("vec index out of range: " + index);
            Objects.requireNonNull(value, "value");
        }
    }

    record NewCon(Timestamp id, ConValue value) implements Op {
        public OpCode code() { return OpCode.NEW_CON; }

        public Op rewrite(UnaryOperator<Timestamp> f) {
            var v = value instanceof ConValue.Ref r ? ConValue.ref(f.apply(r.id())) : value;
            return new NewCon(f.apply(id), v);
        }
    }

    record NewVal(Timestamp id) implements Op {
        public OpCode code() { return OpCode.NEW_VAL; }
        public Op rewrite(UnaryOperator<Timestamp> f) { return new NewVal(f.apply(id)); }
    }

    record NewObj(Timestamp id) implements Op {
        public OpCode code() { return OpCode.NEW_OBJ; }
        public Op rewrite(UnaryOperator<Timestamp> f) { return new NewObj(f.apply(id)); }
    }

    record NewVec(Timestamp id) implements Op {
        public OpCode code() { return OpCode.NEW_VEC; }
        public Op rewrite(UnaryOperator<Timestamp> f) { return new NewVec(f.apply(id)); }
    }

    record NewStr(Timestamp id) implements Op {
        public OpCode code() { return OpCode.NEW_STR; }
        public Op rewrite(UnaryOperator<Timestamp> f) { return new NewStr(f.apply(id)); }
    }

    record NewBin(Timestamp id) implements Op {
        public OpCode code() { return OpCode.NEW_BIN; }
        public Op rewrite(UnaryOperator<Timestamp> f) { return new NewBin(f.apply(id)); }
    }

    record NewArr(Timestamp id) implements Op {
        public OpCode code() { return OpCode.NEW_ARR; }
        public Op rewrite(UnaryOperator<Timestamp> f) { return new NewArr(f.apply(id)); }
    }

    /** Set register {@code obj} (or the root, when {@code obj} is the origin) to {@code val}. */
    record InsVal(Timestamp id, Timestamp obj, Timestamp val) implements Op {
        public OpCode code() { return OpCode.INS_VAL; }

        public Op rewrite(UnaryOperator<Timestamp> f) {
            return new InsVal(f.apply(id), f.apply(obj), f.apply(val));
        }
    }

    record InsObj(Timestamp id, Timestamp obj, List<ObjEntry> entries) implements Op {
        public InsObj {
            entries = List.copyOf(entries);
        }

        public OpCode code() { return OpCode.INS_OBJ; }

        public Op rewrite(UnaryOperator<Timestamp> f) {
            return new InsObj(f.apply(id), f.apply(obj),
                    entries.stream().map(e -> new ObjEntry(e.key(), f.apply(e.value()))).toList());
        }
    }

    record InsVec(Timestamp id, Timestamp obj, List<VecEntry> entries) implements Op {
        public InsVec {
            entries = List.copyOf(entries);
        }

        public OpCode code() { return OpCode.INS_VEC; }

        public Op rewrite(UnaryOperator<Timestamp> f) {
            return new InsVec(f.apply(id), f.apply(obj),
                    entries.stream().map(e -> new VecEntry(e.index(), f.apply(e.value()))).toList());
        }
    }

    /**
     * Insert text into a string. The op consumes one timestamp per UTF-16 code
     * unit; the string node numbers its items by code point from {@code id}.
     */
    record InsStr(Timestamp id, Timestamp obj, Timestamp after, String data) implements Op {
        public InsStr {
            Objects.requireNonNull(data, "data");
        }

        public OpCode code() { return OpCode.INS_STR; }

        public long span() { return data.length(); }

        public Op rewrite(UnaryOperator<Timestamp> f) {
            return new InsStr(f.apply(id), f.apply(obj), f.apply(after), data);
        }
    }

    record InsBin(Timestamp id, Timestamp obj, Timestamp after, byte[] data) implements Op {
        public InsBin {
            data = data.clone();
        }

        public OpCode code() { return OpCode.INS_BIN; }

        public long span() { return data.length; }

        @Override
        public byte[] data() { return data.clone(); }

        public Op rewrite(UnaryOperator<Timestamp> f) {
            return new InsBin(f.apply(id), f.apply(obj), f.apply(after), data);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof InsBin b && id.equals(b.id) && obj.equals(b.obj)
                    && after.equals(b.after) && Arrays.equals(data, b.data);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, obj, after) * 31 + Arrays.hashCode(data);
        }

        @Override
        public String toString() {
            return "InsBin[id=" + id + ", obj=" + obj + ", after=" + after
                    + ", data=" + Base64.getEncoder().encodeToString(data) + "]";
        }
    }

    record InsArr(Timestamp id, Timestamp obj, Timestamp after, List<Timestamp> data) implements Op {
        public InsArr {
            data = List.copyOf(data);
        }

        public OpCode code() { return OpCode.INS_ARR; }

        public long span() { return data.size(); }

        public Op rewrite(UnaryOperator<Timestamp> f) {
            return new InsArr(f.apply(id), f.apply(obj), f.apply(after), data.stream().map(f).toList());
        }
    }

    /** Point the live array slot {@code ref} at {@code val}. */
    record UpdArr(Timestamp id, Timestamp obj, Timestamp ref, Timestamp val) implements Op {
        public OpCode code() { return OpCode.UPD_ARR; }

        public Op rewrite(UnaryOperator<Timestamp> f) {
            return new UpdArr(f.apply(id), f.apply(obj), f.apply(ref), f.apply(val));
        }
    }

    record Del(Timestamp id, Timestamp obj, List<Timespan> what) implements Op {
        public Del {
            what = List.copyOf(what);
        }

        public OpCode code() { return OpCode.DEL; }

        public Op rewrite(UnaryOperator<Timestamp> f) {
            return new Del(f.apply(id), f.apply(obj),
                    what.stream().map(s -> Timespan.of(f.apply(s.start()), s.span())).toList());
        }
    }

    record Nop(Timestamp id, long len) implements Op {
        public Nop {
            if (len < 1) throw new IllegalArgumentException("nop length must be >= 1");
        }

        public OpCode code() { return OpCode.NOP; }

        public long span() { return len; }

        public Op rewrite(UnaryOperator<Timestamp> f) { return new Nop(f.apply(id), len); }
    }
}
