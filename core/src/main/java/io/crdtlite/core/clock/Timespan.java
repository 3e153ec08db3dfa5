// file: src/main/java/io/crdtlite/core/clock/Timespan.java
package io.crdtlite.core.clock;

/**
 * A run of {@code span} consecutive timestamps of one session, starting at
 * {@code (sid, time)}. Used by deletions to address ranges of sequence items.
 */
public record Timespan(long sid, long time, long span) {

    public Timespan {
        if (span < 1) throw new IllegalArgumentException("span must be >= 1");
    }

    public static Timespan of(Timestamp start, long span) {
        return new Timespan(start.sid(), start.time(), span);
    }

    public Timestamp start() {
        return new Timestamp(sid, time);
    }

    /** Exclusive end time. */
    public long end() {
        return time + span;
    }

    public boolean contains(Timestamp ts) {
        return ts.sid() == sid && ts.time() >= time && ts.time() < end();
    }

    @Override
    public String toString() {
        return sid + "." + time + "!" + span;
    }
}
