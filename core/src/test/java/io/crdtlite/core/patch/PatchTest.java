package io.crdtlite.core.patch;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.crdtlite.core.clock.Timespan;
import io.crdtlite.core.clock.Timestamp;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.crdtlite.core.TestJson.json;
import static org.junit.jupiter.api.Assertions.*;

class PatchTest {

    private static final long SID = 100_000;

    private static Timestamp ts(long time) {
        return new Timestamp(SID, time);
    }

    @Test
    void rebase_shifts_own_session_ids_and_keeps_foreign_ones() {
        var b = PatchBuilder.at(SID, 5);
        var str = b.str();
        b.insStr(str, str, "hi");
        b.del(new Timestamp(200_000, 3), List.of(new Timespan(200_000, 4, 1)));
        b.root(str);
        var patch = b.flush();

        var moved = patch.rebase(20);

        assertEquals(ts(20), moved.id());
        assertEquals(patch.span(), moved.span());
        var ins = (Op.InsStr) moved.ops().get(1);
        assertEquals(ts(21), ins.id());
        assertEquals(ts(20), ins.obj());
        assertEquals(ts(20), ins.after());
        var del = (Op.Del) moved.ops().get(2);
        assertEquals(new Timestamp(200_000, 3), del.obj());
        var root = (Op.InsVal) moved.ops().get(3);
        assertEquals(Timestamp.ORIGIN, root.obj());
    }

    @Test
    void rebase_leaves_references_older_than_the_cutoff_alone() {
        var b = PatchBuilder.at(SID, 10);
        b.insStr(ts(2), ts(3), "x");
        var patch = b.flush();

        var moved = patch.rebase(15, 10);

        var ins = (Op.InsStr) moved.ops().get(0);
        assertEquals(ts(15), ins.id());
        assertEquals(ts(2), ins.obj());
        assertEquals(ts(3), ins.after());
    }

    @Test
    void rebase_to_the_same_time_returns_the_patch_itself() {
        var b = PatchBuilder.at(SID, 10);
        b.obj();
        var patch = b.flush();
        assertSame(patch, patch.rebase(10));
    }

    @Test
    void empty_patch_has_no_id_and_no_span() {
        var patch = Patch.empty();
        assertNull(patch.id());
        assertEquals(0, patch.span());
        assertTrue(patch.isEmpty());
    }

    @Test
    void binary_inserts_compare_by_content() {
        var a = new Op.InsBin(ts(1), ts(0), ts(0), new byte[]{1, 2});
        var b = new Op.InsBin(ts(1), ts(0), ts(0), new byte[]{1, 2});
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(2, a.span());
    }

    @Test
    void meta_is_copied_in_and_out() {
        var meta = (ObjectNode) json("{'author':'ann'}");
        var b = PatchBuilder.at(SID, 1);
        b.root(b.con(json("1")));
        var patch = new Patch(b.flush().ops(), meta);

        meta.put("author", "bob");
        assertEquals(json("{'author':'ann'}"), patch.meta());

        ((ObjectNode) patch.meta()).put("author", "eve");
        assertEquals(json("{'author':'ann'}"), patch.meta());
    }

    @Test
    void to_string_lists_one_op_per_line() {
        var b = PatchBuilder.at(SID, 1);
        b.obj();
        b.nop(2);
        var text = b.flush().toString();

        assertTrue(text.startsWith("Patch " + SID + ".1!3"));
        assertTrue(text.contains("\n  new_obj"));
        assertTrue(text.contains("\n  nop"));
    }
}
