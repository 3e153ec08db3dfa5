package io.crdtlite.core.model;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BinaryNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.POJONode;
import io.crdtlite.core.clock.ClockException;
import io.crdtlite.core.clock.Session;
import io.crdtlite.core.clock.Timespan;
import io.crdtlite.core.clock.Timestamp;
import io.crdtlite.core.nodes.ArrNode;
import io.crdtlite.core.nodes.ConValue;
import io.crdtlite.core.nodes.ObjNode;
import io.crdtlite.core.nodes.StrNode;
import io.crdtlite.core.patch.Op;
import io.crdtlite.core.patch.Patch;
import io.crdtlite.core.patch.PatchBuilder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.crdtlite.core.TestJson.json;
import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    private static final long A = 100_001;
    private static final long B = 100_002;

    private static Model withRoot(long sid, String json) {
        var model = Model.create(sid);
        var b = model.builder();
        b.setRoot(json(json));
        model.applyPatch(b.flush());
        return model;
    }

    @Test
    void empty_document_views_as_null() {
        assertEquals(NullNode.getInstance(), Model.create(A).view());
    }

    @Test
    void applying_a_patch_twice_changes_nothing() {
        var model = Model.create(A);
        var b = model.builder();
        b.setRoot(json("{'title':'notes','items':[1,2,3]}"));
        var patch = b.flush();

        model.applyPatch(patch);
        var once = model.view();
        int nodes = model.index().size();
        model.applyPatch(patch);

        assertEquals(once, model.view());
        assertEquals(nodes, model.index().size());
    }

    @Test
    void applying_ops_advances_the_clock_past_them() {
        var model = Model.create(A);
        var b = PatchBuilder.at(B, 50);
        b.setRoot(json("'abc'"));
        var patch = b.flush();

        model.applyPatch(patch);

        assertTrue(model.clock().time() >= patch.nextTime());
        var next = model.builder().obj();
        assertTrue(next.isAfter(patch.ops().get(patch.ops().size() - 1).id()));
    }

    @Test
    void concurrent_key_writes_converge_to_the_greater_id() {
        var base = withRoot(A, "{'k':0}");
        var objId = base.root().val();

        var left = base.fork(A);
        var right = base.fork(B);

        var lb = left.builder();
        lb.insObj(objId, List.of(new Op.ObjEntry("k", lb.con(json("1")))));
        var pl = lb.flush();
        var rb = right.builder();
        rb.insObj(objId, List.of(new Op.ObjEntry("k", rb.con(json("2")))));
        var pr = rb.flush();

        left.applyPatch(pl);
        left.applyPatch(pr);
        right.applyPatch(pr);
        right.applyPatch(pl);

        // same time, greater session wins
        assertEquals(json("{'k':2}"), left.view());
        assertEquals(left.view(), right.view());
    }

    @Test
    void concurrent_text_edits_merge() {
        var base = withRoot(A, "'ac'");
        var strId = base.root().val();
        var str = (StrNode) base.index().get(strId);
        var first = str.rga().itemIds().get(0);

        var left = base.fork(A);
        var right = base.fork(B);
        var lb = left.builder();
        lb.insStr(strId, first, "b");
        var pl = lb.flush();
        var rb = right.builder();
        rb.insStr(strId, str.rga().itemIds().get(1), "d");
        var pr = rb.flush();

        left.applyBatch(List.of(pl, pr));
        right.applyBatch(List.of(pr, pl));

        assertEquals(json("'abcd'"), left.view());
        assertEquals(left.view(), right.view());
    }

    @Test
    void ops_aimed_at_missing_or_mismatched_nodes_are_skipped() {
        var model = withRoot(A, "{'a':1}");
        var objId = model.root().val();
        var before = model.view();

        var b = model.builder();
        b.insStr(objId, objId, "nope");
        b.insArr(new Timestamp(B, 999), new Timestamp(B, 999), List.of(objId));
        b.del(objId, List.of(new Timespan(A, 1, 1)));
        b.setVal(objId, objId);
        model.applyPatch(b.flush());

        assertEquals(before, model.view());
    }

    @Test
    void undefined_removes_a_key_from_the_view() {
        var model = withRoot(A, "{'a':1,'b':2}");
        var b = model.builder();
        b.insObj(model.root().val(), List.of(new Op.ObjEntry("a", b.undefined())));
        model.applyPatch(b.flush());

        assertEquals(json("{'b':2}"), model.view());
    }

    @Test
    void overwritten_subtrees_are_dropped_from_the_index() {
        var model = withRoot(A, "{'text':'long text','list':[1,2]}");
        var oldRoot = model.root().val();
        assertTrue(model.index().size() > 3);

        var b = model.builder();
        b.root(b.con(json("7")));
        model.applyPatch(b.flush());

        assertFalse(model.index().contains(oldRoot));
        assertEquals(1, model.index().size());
        assertEquals(json("7"), model.view());
    }

    @Test
    void overwriting_a_nested_key_drops_the_whole_subtree_and_later_ops_on_it_are_no_ops() {
        var model = withRoot(A, "{'doc':{'inner':{'text':'abc'}},'keep':1}");
        var rootObj = (ObjNode) model.index().get(model.root().val());
        var docId = rootObj.get("doc");
        var innerId = ((ObjNode) model.index().get(docId)).get("inner");
        var textId = ((ObjNode) model.index().get(innerId)).get("text");
        assertInstanceOf(StrNode.class, model.index().get(textId));

        var b = model.builder();
        b.insObj(rootObj.id(), List.of(new Op.ObjEntry("doc", b.con(json("0")))));
        model.applyPatch(b.flush());

        assertFalse(model.index().contains(docId));
        assertFalse(model.index().contains(innerId));
        assertFalse(model.index().contains(textId));
        var after = model.view();
        int nodes = model.index().size();

        var late = model.builder();
        late.insStr(textId, textId, "zzz");
        late.insObj(innerId, List.of(new Op.ObjEntry("x", late.con(json("1")))));
        model.applyPatch(late.flush());

        assertEquals(json("{'doc':0,'keep':1}"), after);
        assertEquals(after, model.view());
        assertFalse(model.index().contains(textId));
        // only the orphaned constant from the late patch was added
        assertEquals(nodes + 1, model.index().size());
    }

    @Test
    void editing_a_view_does_not_reach_the_document() {
        var model = Model.create(A);
        var b = model.builder();
        var payload = (ObjectNode) json("{'k':[1,2]}");
        b.root(b.con(payload));
        model.applyPatch(b.flush());

        payload.put("k", 99);
        assertEquals(json("{'k':[1,2]}"), model.view());

        var view = (ObjectNode) model.view();
        view.put("k", "changed");
        ((ArrayNode) model.view().get("k")).add(3);
        assertEquals(json("{'k':[1,2]}"), model.view());
    }

    @Test
    void deleting_array_slots_drops_their_children() {
        var model = withRoot(A, "[{'x':1},{'y':2}]");
        var arrId = model.root().val();
        var slots = ((ArrNode) model.index().get(arrId)).rga().itemIds();
        var child = ((ArrNode) model.index().get(arrId)).values().get(0);

        var b = model.builder();
        b.del(arrId, List.of(Timespan.of(slots.get(0), 1)));
        model.applyPatch(b.flush());

        assertEquals(json("[{'y':2}]"), model.view());
        assertFalse(model.index().contains(child));
    }

    @Test
    void upd_arr_replaces_the_child_of_a_live_slot() {
        var model = withRoot(A, "[1,2,3]");
        var arrId = model.root().val();
        var slot = ((ArrNode) model.index().get(arrId)).rga().itemIds().get(1);

        var b = model.builder();
        b.updArr(arrId, slot, b.con(json("'two'")));
        model.applyPatch(b.flush());

        assertEquals(json("[1,'two',3]"), model.view());
    }

    @Test
    void vectors_view_unwritten_slots_as_null() {
        var model = Model.create(A);
        var b = model.builder();
        var vec = b.vec();
        b.insVec(vec, List.of(new Op.VecEntry(2, b.con(json("true")))));
        b.root(vec);
        model.applyPatch(b.flush());

        assertEquals(json("[null,null,true]"), model.view());
    }

    @Test
    void binaries_and_references_have_typed_views() {
        var model = Model.create(A);
        var b = model.builder();
        var obj = b.obj();
        var bin = b.bin();
        b.insBin(bin, bin, new byte[]{1, 2, 3});
        var ref = b.con(ConValue.ref(new Timestamp(B, 4)));
        b.insObj(obj, List.of(new Op.ObjEntry("bin", bin), new Op.ObjEntry("ref", ref)));
        b.root(obj);
        model.applyPatch(b.flush());

        var view = model.view();
        assertInstanceOf(BinaryNode.class, view.get("bin"));
        assertArrayEquals(new byte[]{1, 2, 3}, ((BinaryNode) view.get("bin")).binaryValue());
        assertInstanceOf(POJONode.class, view.get("ref"));
        assertEquals(new Timestamp(B, 4), ((POJONode) view.get("ref")).getPojo());
    }

    @Test
    void any_delivery_order_of_causally_ready_patches_converges() {
        var base = withRoot(A, "{'list':['a'],'n':0}");
        var obj = base.root().val();
        var patches = new ArrayList<Patch>();
        long sid = 200_000;
        for (int i = 0; i < 3; i++) {
            var fork = base.fork(sid + i);
            var b = fork.builder();
            b.insObj(obj, List.of(new Op.ObjEntry("n", b.con(json(String.valueOf(i + 1))))));
            patches.add(b.flush());
        }

        var expected = base.copy();
        expected.applyBatch(patches);
        var reversed = base.copy();
        reversed.applyBatch(List.of(patches.get(2), patches.get(1), patches.get(0)));
        var shuffled = base.copy();
        shuffled.applyBatch(List.of(patches.get(1), patches.get(0), patches.get(2), patches.get(1)));

        assertEquals(expected.view(), reversed.view());
        assertEquals(expected.view(), shuffled.view());
        assertEquals(json("3"), expected.view().get("n"));
    }

    @Test
    void server_documents_reject_patches_from_the_future() {
        var model = Model.withServerClock(1);
        var b = PatchBuilder.at(Session.SERVER, 5);
        b.obj();
        var gap = b.flush();

        assertThrows(ClockException.class, () -> model.applyPatch(gap));
    }

    @Test
    void forks_are_independent() {
        var model = withRoot(A, "{'a':'x'}");
        var fork = model.fork(B);

        var b = fork.builder();
        b.insObj(model.root().val(), List.of(new Op.ObjEntry("a", b.con(json("1")))));
        fork.applyPatch(b.flush());

        assertEquals(json("{'a':'x'}"), model.view());
        assertEquals(json("{'a':1}"), fork.view());
        assertEquals(B, fork.clock().sid());
    }
}
