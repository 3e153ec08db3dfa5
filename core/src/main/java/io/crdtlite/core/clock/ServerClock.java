// file: src/main/java/io/crdtlite/core/clock/ServerClock.java
package io.crdtlite.core.clock;

import java.util.Objects;

/**
 * Clock of a centrally-ordered document: every operation carries the
 * {@link Session#SERVER} session and one global, gap-free time.
 * <p>
 * Observing an operation whose time lies beyond the current time means a
 * patch was skipped; that fails with {@link ClockException} rather than
 * silently leaving a hole in the history.
 */
public final class ServerClock implements LogicalClock {

    private long time;

    public ServerClock(long time) {
        if (time < 0) throw new IllegalArgumentException("time must be >= 0");
        this.time = time;
    }

    @Override
    public long sid() {
        return Session.SERVER;
    }

    @Override
    public long time() {
        return time;
    }

    @Override
    public Timestamp tick(long span) {
        if (span < 0) throw new IllegalArgumentException("span must be >= 0");
        var ts = new Timestamp(Session.SERVER, time);
        try {
            time = Math.addExact(time, span);
        } catch (ArithmeticException e) {
            throw new ClockException("clock overflow at time " + time, e);
        }
        return ts;
    }

    @Override
    public void observe(Timestamp id, long span) {
        Objects.requireNonNull(id, "id");
        if (id.sid() != Session.SERVER) {
            throw new ClockException("server clock cannot observe session " + id.sid());
        }
        if (id.time() > time) {
            throw new ClockException("time travel: observed " + id.time() + " but clock is at " + time);
        }
        long end = id.time() + span;
        if (end > time) time = end;
    }

    @Override
    public ServerClock copy() {
        return new ServerClock(time);
    }

    /** Forking a server clock keeps the server session; only the time carries over. */
    @Override
    public ServerClock fork(long sid) {
        return copy();
    }

    @Override
    public String toString() {
        return "server clock " + time;
    }
}
