// file: src/main/java/io/crdtlite/replica/ReplicaConfig.java
package io.crdtlite.replica;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.crdtlite.codec.patch.PatchFormat;
import io.crdtlite.core.clock.Session;
import io.crdtlite.replica.dto.JsonReplicaConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Per-replica settings.
 *
 * Supports:
 *  - sessionId:    session of local edits; 0 picks a random user session,
 *                  server mode always runs as {@link Session#SERVER}
 *  - clockMode:    LOGICAL or SERVER
 *  - format:       wire format of patches sent and received
 *  - dedupeWindow: how many recent patch ids are remembered to drop duplicates
 */
public record ReplicaConfig(
        long sessionId,
        ClockMode clockMode,
        PatchFormat format,
        int dedupeWindow
) {
    public static final int DEFAULT_DEDUPE_WINDOW = 1024;

    public ReplicaConfig {
        Objects.requireNonNull(clockMode, "clockMode");
        Objects.requireNonNull(format, "format");
        if (dedupeWindow <= 0) throw new IllegalArgumentException("dedupeWindow must be > 0");
        if (clockMode == ClockMode.SERVER) {
            if (sessionId != 0 && sessionId != Session.SERVER) {
                throw new IllegalArgumentException("server mode runs as session " + Session.SERVER + ", got " + sessionId);
            }
            sessionId = Session.SERVER;
        } else if (sessionId == 0) {
            sessionId = Session.random();
        } else if (!Session.isUser(sessionId)) {
            throw new IllegalArgumentException("sessionId must be in [" + Session.MIN_USER + ", " + Session.MAX + "], got " + sessionId);
        }
    }

    /** Logical clock, random session, binary wire format. */
    public static ReplicaConfig defaults() {
        return new ReplicaConfig(0, ClockMode.LOGICAL, PatchFormat.BINARY, DEFAULT_DEDUPE_WINDOW);
    }

    public static ReplicaConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonReplicaConfig cfg = mapper.readValue(path.toFile(), JsonReplicaConfig.class);
            return new ReplicaConfig(
                    cfg.sessionId,
                    parse(ClockMode.class, "clockMode", cfg.clockMode),
                    parse(PatchFormat.class, "format", cfg.format),
                    cfg.dedupeWindow
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load ReplicaConfig from " + path, e);
        }
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String field, String value) {
        if (value == null || value.isBlank()) throw new IllegalArgumentException(field + " must not be blank");
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown " + field + ": " + value, e);
        }
    }
}
