// file: src/main/java/io/crdtlite/core/clock/Session.java
package io.crdtlite.core.clock;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Reserved session ids.
 * <p>
 * Ids below {@link #MIN_USER} are reserved:
 *  - 0 is the system session, which owns the root register and sequence origins,
 *  - 1 is the server session used by centrally-ordered documents,
 *  - the rest are kept for future system use.
 */
public final class Session {

    public static final long SYSTEM = 0;
    public static final long SERVER = 1;

    /** Smallest id a user replica may own. */
    public static final long MIN_USER = 65_536;

    /** Largest id that still fits the 53-bit integer range of JSON number codecs. */
    public static final long MAX = (1L << 53) - 1;

    private Session() {
        // constants
    }

    /** Random user session id in [{@link #MIN_USER}, {@link #MAX}]. */
    public static long random() {
        return ThreadLocalRandom.current().nextLong(MIN_USER, MAX + 1);
    }

    public static boolean isUser(long sid) {
        return sid >= MIN_USER && sid <= MAX;
    }
}
