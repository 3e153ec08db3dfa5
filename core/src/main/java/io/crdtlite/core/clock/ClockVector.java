// file: src/main/java/io/crdtlite/core/clock/ClockVector.java
package io.crdtlite.core.clock;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Lamport clock with a per-peer table of the latest observed time.
 * <p>
 * Design:
 *  - The local time only ever moves forward; observing an operation pushes it
 *    past the last timestamp the operation covers.
 *  - Peer entries are kept in first-seen order, which keeps the clock table
 *    of the binary model codec deterministic.
 *  - Time arithmetic is overflow-checked and fails with {@link ClockException}.
 */
public final class ClockVector implements LogicalClock {

    private final long sid;
    private long time;
    private final Map<Long, Timestamp> peers = new LinkedHashMap<>();

    public ClockVector(long sid, long time) {
        if (sid < 0) throw new IllegalArgumentException("sid must be >= 0");
        if (time < 0) throw new IllegalArgumentException("time must be >= 0");
        this.sid = sid;
        this.time = time;
    }

    /** Fresh clock for a random user session, starting at time 1. */
    public static ClockVector random() {
        return new ClockVector(Session.random(), 1);
    }

    @Override
    public long sid() {
        return sid;
    }

    @Override
    public long time() {
        return time;
    }

    @Override
    public Timestamp tick(long span) {
        if (span < 0) throw new IllegalArgumentException("span must be >= 0");
        var ts = new Timestamp(sid, time);
        time = advance(time, span);
        return ts;
    }

    @Override
    public void observe(Timestamp id, long span) {
        Objects.requireNonNull(id, "id");
        if (span < 1) return;
        long edge = advance(id.time(), span - 1);
        if (id.sid() != sid) {
            var seen = peers.get(id.sid());
            if (seen == null || seen.time() < edge) {
                peers.put(id.sid(), new Timestamp(id.sid(), edge));
            }
        }
        if (time <= edge) {
            time = advance(edge, 1);
        }
    }

    /** Latest observed timestamp per peer session (read-only view). */
    public Map<Long, Timestamp> peers() {
        return Collections.unmodifiableMap(peers);
    }

    @Override
    public ClockVector copy() {
        return fork(sid);
    }

    @Override
    public ClockVector fork(long newSid) {
        var c = new ClockVector(newSid, time);
        c.peers.putAll(peers);
        if (newSid != sid) {
            c.peers.remove(newSid);
            if (time > 0) c.peers.put(sid, new Timestamp(sid, time - 1));
        }
        return c;
    }

    private static long advance(long base, long delta) {
        try {
            return Math.addExact(base, delta);
        } catch (ArithmeticException e) {
            throw new ClockException("clock overflow at time " + base, e);
        }
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("clock ").append(sid).append('.').append(time);
        for (var p : peers.values()) sb.append(' ').append(p);
        return sb.toString();
    }
}
