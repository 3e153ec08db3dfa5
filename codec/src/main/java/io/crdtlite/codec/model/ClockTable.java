// file: src/main/java/io/crdtlite/codec/model/ClockTable.java
package io.crdtlite.codec.model;

import io.crdtlite.codec.CodecException;
import io.crdtlite.codec.ErrorCode;
import io.crdtlite.codec.binary.CrdtReader;
import io.crdtlite.codec.binary.CrdtWriter;
import io.crdtlite.core.clock.ClockVector;
import io.crdtlite.core.clock.Session;
import io.crdtlite.core.clock.Timestamp;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Session table of a logically-clocked document snapshot.
 * <p>
 * Entry 1 is the local session with the last time it handed out; further
 * entries are added as ids of other sessions are met while writing nodes.
 * An id is then stored as (entry index, entry time - id time), which keeps
 * most ids to a single byte. Index 0 is reserved for the origin.
 */
final class ClockTable {

    private final ClockVector clock;
    private final List<Timestamp> entries = new ArrayList<>();
    private final Map<Long, Integer> indexBySid = new HashMap<>();

    private ClockTable(ClockVector clock) {
        this.clock = clock;
    }

    /** Table for encoding a document driven by {@code clock}. */
    static ClockTable forEncoding(ClockVector clock) {
        var table = new ClockTable(clock);
        table.add(new Timestamp(clock.sid(), Math.max(0, clock.time() - 1)));
        return table;
    }

    private int add(Timestamp entry) {
        entries.add(entry);
        indexBySid.put(entry.sid(), entries.size());
        return entries.size();
    }

    /** Relative (index, diff) form of {@code id}, registering its session if new. */
    long[] relative(Timestamp id) {
        if (id.isOrigin()) return new long[]{0, 0};
        if (id.sid() == Session.SYSTEM) throw new IllegalStateException("system id " + id + " cannot be encoded");
        Integer idx = indexBySid.get(id.sid());
        if (idx == null) {
            var peer = clock.peers().get(id.sid());
            idx = add(peer != null ? peer : new Timestamp(id.sid(), Math.max(0, clock.time() - 1)));
        }
        long diff = entries.get(idx - 1).time() - id.time();
        if (diff < 0) throw new IllegalStateException("id " + id + " is newer than the clock knows");
        return new long[]{idx, diff};
    }

    void write(CrdtWriter out) {
        out.vu57(entries.size());
        for (var e : entries) {
            out.vu57(e.sid());
            out.vu57(e.time());
        }
    }

    // ---- decoding ----

    /** Decoded table: the rebuilt clock and the entries ids refer to. */
    static final class Decoded {
        private final ClockVector clock;
        private final List<Timestamp> entries;

        private Decoded(ClockVector clock, List<Timestamp> entries) {
            this.clock = clock;
            this.entries = entries;
        }

        ClockVector clock() {
            return clock;
        }

        Timestamp absolute(long x, long y) {
            if (x == 0) {
                if (y != 0) throw new CodecException(ErrorCode.INVALID_MODEL, "bad origin reference");
                return Timestamp.ORIGIN;
            }
            if (x > entries.size()) throw new CodecException(ErrorCode.INVALID_CLOCK_TABLE, "no clock entry " + x);
            var entry = entries.get((int) x - 1);
            long time = entry.time() - y;
            if (time < 0) throw new CodecException(ErrorCode.INVALID_MODEL, "negative time for session " + entry.sid());
            return new Timestamp(entry.sid(), time);
        }
    }

    static Decoded read(CrdtReader in) {
        try {
            int count = in.vu57Int();
            if (count < 1) throw new CodecException(ErrorCode.INVALID_CLOCK_TABLE, "empty clock table");
            if (count > in.remaining()) throw new CodecException(ErrorCode.INVALID_CLOCK_TABLE, "clock table truncated");
            var entries = new ArrayList<Timestamp>(count);
            for (int i = 0; i < count; i++) entries.add(new Timestamp(in.vu57(), in.vu57()));
            var local = entries.get(0);
            var clock = new ClockVector(local.sid(), local.time() + 1);
            for (int i = 1; i < count; i++) clock.observe(entries.get(i), 1);
            return new Decoded(clock, entries);
        } catch (CodecException e) {
            if (e.code() == ErrorCode.OVERFLOW) {
                throw new CodecException(ErrorCode.INVALID_CLOCK_TABLE, "clock table truncated", e);
            }
            throw e;
        }
    }
}
