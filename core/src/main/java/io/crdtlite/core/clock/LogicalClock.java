// file: src/main/java/io/crdtlite/core/clock/LogicalClock.java
package io.crdtlite.core.clock;

/**
 * A replica's clock: the owning session id plus the next time it will hand out.
 * <p>
 * Two flavours exist:
 *  - {@link ClockVector}: Lamport clock that also tracks the highest time seen per peer,
 *  - {@link ServerClock}: a single monotonic counter for documents ordered by one server.
 * <p>
 * Clocks are mutable and not thread safe; one clock belongs to one model.
 */
public interface LogicalClock {

    long sid();

    /** Next time this clock will assign. */
    long time();

    /** Current (sid, time) without advancing. */
    default Timestamp now() {
        return new Timestamp(sid(), time());
    }

    /**
     * Reserve {@code span} consecutive timestamps and return the first one.
     *
     * @throws ClockException if the time would overflow
     */
    Timestamp tick(long span);

    /**
     * Account for a (possibly remote) operation with id {@code id} covering
     * {@code span} timestamps.
     */
    void observe(Timestamp id, long span);

    LogicalClock copy();

    /** Copy of this clock that continues under a different session id. */
    LogicalClock fork(long sid);
}
