// file: src/main/java/io/crdtlite/replica/Replica.java
package io.crdtlite.replica;

import com.fasterxml.jackson.databind.JsonNode;
import io.crdtlite.codec.CodecException;
import io.crdtlite.codec.model.ModelCodec;
import io.crdtlite.codec.patch.PatchCodecs;
import io.crdtlite.core.clock.ClockException;
import io.crdtlite.core.model.Model;
import io.crdtlite.core.patch.Patch;
import io.crdtlite.core.patch.PatchBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * One collaborator's copy of a document.
 *
 * Responsibilities:
 *  - Turn local edits into patches, apply them, and hand back wire bytes.
 *  - Apply patches received from peers, dropping ones it has already applied.
 *  - Keep the applied patches in order so they can be replayed elsewhere.
 *  - Snapshot and restore the document through the binary model codec.
 * <p>
 * Not thread safe; callers serialize access.
 */
public final class Replica {
    private static final Logger log = Logger.getLogger(Replica.class.getName());

    private static final byte[] NO_PATCH = new byte[0];

    private final ReplicaConfig config;
    private final Model model;
    private final PatchCodecs codecs = new PatchCodecs();
    private final PatchIdDeduper deduper;
    private final List<Patch> history = new ArrayList<>();

    private Replica(ReplicaConfig config, Model model) {
        this.config = Objects.requireNonNull(config, "config");
        this.model = model;
        this.deduper = new WindowedPatchIdDeduper(config.dedupeWindow());
    }

    public static Replica create(ReplicaConfig config) {
        var model = config.clockMode() == ClockMode.SERVER
                ? Model.withServerClock(1)
                : Model.create(config.sessionId());
        var replica = new Replica(config, model);
        log.info(() -> "Replica created: session=" + config.sessionId() + " clock=" + config.clockMode()
                + " format=" + config.format());
        return replica;
    }

    /**
     * Rebuild a replica from {@link #snapshot()} bytes. A logical snapshot taken
     * under another session continues under the configured session.
     *
     * @throws CodecException           if the bytes are not a document snapshot
     * @throws IllegalArgumentException if the snapshot's clock kind does not match the config
     */
    public static Replica restore(ReplicaConfig config, byte[] snapshot) {
        var decoded = ModelCodec.decode(snapshot);
        boolean server = config.clockMode() == ClockMode.SERVER;
        if (decoded.isServerClock() != server) {
            throw new IllegalArgumentException("snapshot clock does not match clock mode " + config.clockMode());
        }
        var model = server || decoded.clock().sid() == config.sessionId()
                ? decoded
                : decoded.fork(config.sessionId());
        log.info(() -> "Replica restored: session=" + config.sessionId() + " clock=" + model.clock()
                + " nodes=" + model.index().size() + " bytes=" + snapshot.length);
        return new Replica(config, model);
    }

    /**
     * Build a patch with {@code edits}, apply it locally and encode it in the
     * configured wire format.
     *
     * @return the encoded patch, or an empty array when the edits produced no ops
     */
    public byte[] edit(Consumer<PatchBuilder> edits) {
        Objects.requireNonNull(edits, "edits");
        var builder = model.builder();
        edits.accept(builder);
        return commit(builder.flush());
    }

    /** Edit the document so that it views as {@code target}. */
    public byte[] set(JsonNode target) {
        return commit(model.diff(target));
    }

    private byte[] commit(Patch patch) {
        if (patch.isEmpty()) return NO_PATCH;
        long start = System.nanoTime();
        model.applyPatch(patch);
        deduper.record(patch.id());
        history.add(patch);
        byte[] bytes = codecs.encode(patch, config.format());
        PatchEventLogger.logPatch(PatchEventLogger.Source.LOCAL, PatchEventLogger.Outcome.APPLIED,
                patch, bytes.length, micros(start), null);
        return bytes;
    }

    /**
     * Apply a patch received from a peer.
     *
     * @return true if the patch was applied, false if it was a known duplicate or empty
     * @throws CodecException if the bytes cannot be decoded in the configured format
     * @throws ClockException if a server-ordered replica receives a patch it cannot order
     */
    public boolean receive(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        long start = System.nanoTime();
        Patch patch;
        try {
            patch = codecs.decode(bytes, config.format());
        } catch (CodecException e) {
            PatchEventLogger.logPatch(PatchEventLogger.Source.REMOTE, PatchEventLogger.Outcome.REJECTED,
                    null, bytes.length, micros(start), e);
            throw e;
        }
        if (patch.isEmpty()) return false;
        if (deduper.seen(patch.id())) {
            PatchEventLogger.logPatch(PatchEventLogger.Source.REMOTE, PatchEventLogger.Outcome.DUPLICATE,
                    patch, bytes.length, micros(start), null);
            return false;
        }
        try {
            model.applyPatch(patch);
        } catch (ClockException e) {
            PatchEventLogger.logPatch(PatchEventLogger.Source.REMOTE, PatchEventLogger.Outcome.REJECTED,
                    patch, bytes.length, micros(start), e);
            throw e;
        }
        deduper.record(patch.id());
        history.add(patch);
        PatchEventLogger.logPatch(PatchEventLogger.Source.REMOTE, PatchEventLogger.Outcome.APPLIED,
                patch, bytes.length, micros(start), null);
        return true;
    }

    /** Patches applied so far, local and remote, in application order. */
    public List<Patch> log() {
        return Collections.unmodifiableList(history);
    }

    /** Applied patches starting at position {@code from} of {@link #log()}, encoded for the wire. */
    public List<byte[]> patchesSince(int from) {
        if (from < 0 || from > history.size()) {
            throw new IllegalArgumentException("from out of range: " + from);
        }
        var out = new ArrayList<byte[]>(history.size() - from);
        for (var p : history.subList(from, history.size())) out.add(codecs.encode(p, config.format()));
        return out;
    }

    public byte[] snapshot() {
        return ModelCodec.encode(model);
    }

    public JsonNode view() {
        return model.view();
    }

    public Model model() {
        return model;
    }

    public ReplicaConfig config() {
        return config;
    }

    public long sessionId() {
        return model.clock().sid();
    }

    private static long micros(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000;
    }
}
