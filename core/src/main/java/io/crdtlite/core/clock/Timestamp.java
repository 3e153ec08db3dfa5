// file: src/main/java/io/crdtlite/core/clock/Timestamp.java
package io.crdtlite.core.clock;

/**
 * Logical timestamp: a (session id, time) pair that uniquely names one
 * operation or one sequence item.
 * <p>
 * Ordering is total: by {@code time} first, then by {@code sid}. The pair
 * order is what breaks ties between concurrent writers, so every replica
 * that compares the same two ids gets the same answer.
 */
public record Timestamp(long sid, long time) implements Comparable<Timestamp> {

    /** Id of the document root register and the origin of every sequence. */
    public static final Timestamp ORIGIN = new Timestamp(Session.SYSTEM, 0);

    public Timestamp {
        if (sid < 0) throw new IllegalArgumentException("sid must be >= 0");
        if (time < 0) throw new IllegalArgumentException("time must be >= 0");
    }

    public static Timestamp of(long sid, long time) {
        return new Timestamp(sid, time);
    }

    /** Timestamp {@code delta} ticks later in the same session. */
    public Timestamp tick(long delta) {
        return new Timestamp(sid, time + delta);
    }

    public boolean isOrigin() {
        return sid == Session.SYSTEM && time == 0;
    }

    @Override
    public int compareTo(Timestamp other) {
        int c = Long.compare(time, other.time);
        return c != 0 ? c : Long.compare(sid, other.sid);
    }

    public boolean isAfter(Timestamp other) {
        return compareTo(other) > 0;
    }

    @Override
    public String toString() {
        return sid + "." + time;
    }
}
