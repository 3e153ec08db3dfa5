package io.crdtlite.replica;

import io.crdtlite.codec.CodecException;
import io.crdtlite.codec.patch.PatchFormat;
import io.crdtlite.core.clock.ClockException;
import io.crdtlite.core.nodes.ObjNode;
import io.crdtlite.core.nodes.StrNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static io.crdtlite.replica.TestJson.json;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavior tests: we describe behavior in English and check that replicas which
 * see the same patches, in any order and any number of times, end up with the
 * same document.
 */
class ReplicaTest {

    private static final long A = 300_001;
    private static final long B = 300_002;
    private static final long C = 300_003;

    private static Replica replica(long sid, PatchFormat format) {
        return Replica.create(new ReplicaConfig(sid, ClockMode.LOGICAL, format, 128));
    }

    private static StrNode text(Replica r, String key) {
        var root = (ObjNode) r.model().index().get(r.model().root().val());
        return (StrNode) r.model().index().get(root.get(key));
    }

    @ParameterizedTest
    @EnumSource(PatchFormat.class)
    void concurrent_edits_converge_in_every_wire_format(PatchFormat format) {
        var a = replica(A, format);
        var b = replica(B, format);
        var c = replica(C, format);

        var init = a.set(json("{'title':'draft','tags':['x']}"));
        assertTrue(b.receive(init));
        assertTrue(c.receive(init));

        var fromA = a.edit(p -> {
            var title = text(a, "title");
            p.insStr(title.id(), title.rga().findPosition(4), " one");
        });
        var fromB = b.edit(p -> {
            var title = text(b, "title");
            p.insStr(title.id(), title.id(), ">> ");
        });
        var fromC = c.set(json("{'title':'draft','tags':['x','y'],'done':false}"));

        a.receive(fromB);
        a.receive(fromC);
        b.receive(fromC);
        b.receive(fromA);
        c.receive(fromA);
        c.receive(fromB);

        assertEquals(a.view(), b.view());
        assertEquals(a.view(), c.view());
        assertEquals(">> draft one", a.view().get("title").textValue());
        assertEquals(json("['x','y']"), a.view().get("tags"));
    }

    @Test
    void duplicates_are_dropped_and_own_patches_are_not_reapplied() {
        var a = replica(A, PatchFormat.BINARY);
        var b = replica(B, PatchFormat.BINARY);

        var bytes = a.set(json("{'n':1}"));

        assertFalse(a.receive(bytes), "echo of a local patch is a duplicate");
        assertTrue(b.receive(bytes));
        assertFalse(b.receive(bytes));
        assertEquals(1, b.log().size());
        assertEquals(a.view(), b.view());
    }

    @Test
    void shuffled_delivery_with_repeats_converges() {
        var a = replica(A, PatchFormat.COMPACT);
        var b = replica(B, PatchFormat.COMPACT);
        var init = a.set(json("{'items':[],'text':''}"));
        b.receive(init);

        var wire = new ArrayList<byte[]>();
        for (int i = 0; i < 5; i++) {
            var n = i;
            wire.add(a.edit(p -> {
                var text = text(a, "text");
                p.insStr(text.id(), text.id(), "a" + n);
            }));
            wire.add(b.edit(p -> {
                var text = text(b, "text");
                p.insStr(text.id(), text.id(), "b" + n);
            }));
        }

        var target = replica(C, PatchFormat.COMPACT);
        target.receive(init);
        var delivery = new ArrayList<>(wire);
        delivery.addAll(wire);
        Collections.shuffle(delivery, new Random(7));
        int applied = 0;
        for (var bytes : delivery) {
            if (target.receive(bytes)) applied++;
        }

        for (var bytes : wire) {
            a.receive(bytes);
            b.receive(bytes);
        }
        assertEquals(wire.size(), applied);
        assertEquals(a.view(), b.view());
        assertEquals(a.view(), target.view());
        assertEquals(20, a.view().get("text").textValue().length());
    }

    @Test
    void empty_edit_produces_no_patch() {
        var a = replica(A, PatchFormat.BINARY);
        var bytes = a.edit(p -> { });
        assertEquals(0, bytes.length);
        assertTrue(a.log().isEmpty());
    }

    @Test
    void log_replays_onto_a_fresh_replica() {
        var a = replica(A, PatchFormat.VERBOSE);
        a.set(json("{'a':1}"));
        a.set(json("{'a':2,'b':[true]}"));
        a.set(json("{'b':[true,false]}"));

        var fresh = replica(B, PatchFormat.VERBOSE);
        for (var bytes : a.patchesSince(0)) assertTrue(fresh.receive(bytes));

        assertEquals(a.view(), fresh.view());
        assertEquals(3, a.log().size());
        assertEquals(1, a.patchesSince(2).size());
        assertThrows(IllegalArgumentException.class, () -> a.patchesSince(4));
    }

    @Test
    void snapshot_restores_under_a_new_session_and_keeps_merging() {
        var a = replica(A, PatchFormat.BINARY);
        a.set(json("{'title':'hello','list':[1,2,3]}"));
        a.set(json("{'title':'help','list':[1,3]}"));

        var restored = Replica.restore(
                new ReplicaConfig(B, ClockMode.LOGICAL, PatchFormat.BINARY, 128), a.snapshot());
        assertEquals(a.view(), restored.view());
        assertEquals(B, restored.sessionId());

        var fromRestored = restored.set(json("{'title':'help!','list':[1,3]}"));
        var fromA = a.set(json("{'title':'help','list':[0,1,3]}"));
        assertTrue(a.receive(fromRestored));
        assertTrue(restored.receive(fromA));

        assertEquals(a.view(), restored.view());
        assertEquals(json("{'title':'help!','list':[0,1,3]}"), a.view());
    }

    @Test
    void snapshot_of_another_clock_kind_is_rejected() {
        var logical = replica(A, PatchFormat.BINARY);
        logical.set(json("[1]"));
        var serverConfig = new ReplicaConfig(0, ClockMode.SERVER, PatchFormat.BINARY, 16);

        assertThrows(IllegalArgumentException.class, () -> Replica.restore(serverConfig, logical.snapshot()));
    }

    @Test
    void server_ordered_replicas_follow_the_server_in_order() {
        var config = new ReplicaConfig(0, ClockMode.SERVER, PatchFormat.COMPACT, 16);
        var server = Replica.create(config);
        var first = server.set(json("{'v':1}"));
        var second = server.set(json("{'v':2}"));

        var inOrder = Replica.create(config);
        assertTrue(inOrder.receive(first));
        assertTrue(inOrder.receive(second));
        assertEquals(server.view(), inOrder.view());

        var skipped = Replica.create(config);
        assertThrows(ClockException.class, () -> skipped.receive(second));
        assertTrue(skipped.log().isEmpty());
    }

    @Test
    void undecodable_bytes_are_rejected() {
        var a = replica(A, PatchFormat.COMPACT);
        var e = assertThrows(CodecException.class,
                () -> a.receive("{oops".getBytes(StandardCharsets.UTF_8)));
        assertNotNull(e.code());
        assertTrue(a.log().isEmpty());
    }

    @Test
    void restored_server_replica_keeps_the_server_clock() {
        var config = new ReplicaConfig(0, ClockMode.SERVER, PatchFormat.BINARY, 16);
        var server = Replica.create(config);
        server.set(json("{'k':'v'}"));

        var restored = Replica.restore(config, server.snapshot());

        assertTrue(restored.model().isServerClock());
        assertEquals(server.model().clock().time(), restored.model().clock().time());
        assertEquals(List.of(), restored.log());
        assertEquals(server.view(), restored.view());
    }
}
