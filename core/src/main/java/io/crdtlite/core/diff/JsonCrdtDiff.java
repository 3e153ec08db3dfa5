// file: src/main/java/io/crdtlite/core/diff/JsonCrdtDiff.java
package io.crdtlite.core.diff;

import com.fasterxml.jackson.databind.JsonNode;
import io.crdtlite.core.clock.Timespan;
import io.crdtlite.core.clock.Timestamp;
import io.crdtlite.core.model.JsonValues;
import io.crdtlite.core.model.Model;
import io.crdtlite.core.nodes.ArrNode;
import io.crdtlite.core.nodes.BinNode;
import io.crdtlite.core.nodes.CrdtNode;
import io.crdtlite.core.nodes.NodeIndex;
import io.crdtlite.core.nodes.ObjNode;
import io.crdtlite.core.nodes.StrNode;
import io.crdtlite.core.nodes.ValNode;
import io.crdtlite.core.nodes.VecNode;
import io.crdtlite.core.patch.Op;
import io.crdtlite.core.patch.Patch;
import io.crdtlite.core.patch.PatchBuilder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the patch that turns a model's current view into a target JSON value.
 * <p>
 * Nodes whose kind still fits the target are edited in place:
 *  - strings and binaries: common prefix/suffix trimmed, one insert and one delete for the middle,
 *  - objects: removed keys get an undefined constant, changed keys recurse or are rewritten,
 *  - arrays: index-wise edit when lengths match, then an LCS alignment of the
 *    elements, then (for very large arrays) a plain replace of the changed middle,
 *  - vectors: per-slot writes.
 * Anything else is rebuilt from scratch and written into its parent.
 * <p>
 * The ops are generated against a copy of the model's clock; apply the
 * returned patch to the model to reach the target.
 */
public final class JsonCrdtDiff {

    /** Cells of the LCS table above which arrays fall back to the plain middle replace. */
    static final long MAX_LCS_CELLS = 1_000_000;

    private final Model model;
    private final NodeIndex index;
    private final PatchBuilder builder;

    public JsonCrdtDiff(Model model) {
        this.model = Objects.requireNonNull(model, "model");
        this.index = model.index();
        this.builder = model.builder();
    }

    public Patch diff(JsonNode target) {
        Objects.requireNonNull(target, "target");
        if (JsonValues.equal(model.view(), target)) return builder.flush();

        var rootVal = model.root().val();
        var child = rootVal.isOrigin() ? null : index.get(rootVal);
        if (child != null && canDiffInPlace(child, target)) {
            diffNode(child, target);
        } else {
            builder.root(builder.constOrJson(target));
        }
        return builder.flush();
    }

    private boolean canDiffInPlace(CrdtNode node, JsonNode dst) {
        if (node instanceof ValNode) return true;
        if (node instanceof StrNode) return dst.isTextual();
        if (node instanceof BinNode) return dst.isBinary();
        if (node instanceof ObjNode) return dst.isObject();
        if (node instanceof ArrNode) return dst.isArray();
        if (node instanceof VecNode v) {
            return dst.isArray() && dst.size() >= v.size() && dst.size() <= VecNode.MAX_INDEX + 1;
        }
        return false;
    }

    /** Edit {@code node} in place so it views as {@code dst}. Requires {@link #canDiffInPlace}. */
    private void diffNode(CrdtNode node, JsonNode dst) {
        var src = node.view(index);
        if (JsonValues.equal(src, dst)) return;

        if (node instanceof ValNode v) {
            var inner = v.isEmpty() ? null : index.get(v.val());
            if (inner != null && canDiffInPlace(inner, dst)) {
                diffNode(inner, dst);
            } else {
                builder.setVal(v.id(), builder.constOrJson(dst));
            }
        } else if (node instanceof StrNode s) {
            diffStr(s, src.textValue(), dst.textValue());
        } else if (node instanceof BinNode b) {
            diffBin(b, binary(src), binary(dst));
        } else if (node instanceof ObjNode o) {
            diffObj(o, src, dst);
        } else if (node instanceof ArrNode a) {
            diffArr(a, src, dst);
        } else if (node instanceof VecNode v) {
            diffVec(v, src, dst);
        } else {
            throw new IllegalStateException("node " + node.id() + " cannot be edited in place");
        }
    }

    // ---- strings and binaries ----

    private void diffStr(StrNode node, String src, String dst) {
        int[] a = src.codePoints().toArray();
        int[] b = dst.codePoints().toArray();
        int lcp = 0;
        while (lcp < a.length && lcp < b.length && a[lcp] == b[lcp]) lcp++;
        int lcs = 0;
        while (lcs < a.length - lcp && lcs < b.length - lcp
                && a[a.length - 1 - lcs] == b[b.length - 1 - lcs]) lcs++;

        int delLen = a.length - lcp - lcs;
        int insLen = b.length - lcp - lcs;
        var slots = node.rga().itemIds();
        if (insLen > 0) {
            var ref = insertAnchor(node.id(), slots, lcp, delLen);
            builder.insStr(node.id(), ref, new String(b, lcp, insLen));
        }
        if (delLen > 0) {
            builder.del(node.id(), coalesce(slots.subList(lcp, lcp + delLen)));
        }
    }

    private void diffBin(BinNode node, byte[] a, byte[] b) {
        int lcp = 0;
        while (lcp < a.length && lcp < b.length && a[lcp] == b[lcp]) lcp++;
        int lcs = 0;
        while (lcs < a.length - lcp && lcs < b.length - lcp
                && a[a.length - 1 - lcs] == b[b.length - 1 - lcs]) lcs++;

        int delLen = a.length - lcp - lcs;
        int insLen = b.length - lcp - lcs;
        var slots = node.rga().itemIds();
        if (insLen > 0) {
            var ref = insertAnchor(node.id(), slots, lcp, delLen);
            var data = new byte[insLen];
            System.arraycopy(b, lcp, data, 0, insLen);
            builder.insBin(node.id(), ref, data);
        }
        if (delLen > 0) {
            builder.del(node.id(), coalesce(slots.subList(lcp, lcp + delLen)));
        }
    }

    /**
     * Item to insert after. When the insert replaces a deleted range it goes
     * after the last deleted item; otherwise after the common prefix, or at
     * the start (the container id) when there is no prefix.
     */
    static Timestamp insertAnchor(Timestamp container, List<Timestamp> slots, int lcp, int delLen) {
        if (delLen > 0) return slots.get(lcp + delLen - 1);
        if (lcp > 0) return slots.get(lcp - 1);
        return container;
    }

    /** Merge runs of consecutive item ids of one session into spans. */
    static List<Timespan> coalesce(List<Timestamp> ids) {
        var out = new ArrayList<Timespan>();
        Timestamp start = null;
        long span = 0;
        for (var id : ids) {
            if (start != null && id.sid() == start.sid() && id.time() == start.time() + span) {
                span++;
                continue;
            }
            if (start != null) out.add(Timespan.of(start, span));
            start = id;
            span = 1;
        }
        if (start != null) out.add(Timespan.of(start, span));
        return out;
    }

    // ---- objects and vectors ----

    private void diffObj(ObjNode node, JsonNode src, JsonNode dst) {
        var entries = new ArrayList<Op.ObjEntry>();
        Iterator<String> names = src.fieldNames();
        while (names.hasNext()) {
            var key = names.next();
            if (!dst.has(key)) entries.add(new Op.ObjEntry(key, builder.undefined()));
        }
        for (Map.Entry<String, JsonNode> e : dst.properties()) {
            var key = e.getKey();
            var value = e.getValue();
            var before = src.get(key);
            if (before != null && JsonValues.equal(before, value)) continue;
            var childId = node.get(key);
            var child = childId == null ? null : index.get(childId);
            if (before != null && child != null && canDiffInPlace(child, value)) {
                diffNode(child, value);
            } else {
                entries.add(new Op.ObjEntry(key, builder.constOrJson(value)));
            }
        }
        if (!entries.isEmpty()) builder.insObj(node.id(), entries);
    }

    private void diffVec(VecNode node, JsonNode src, JsonNode dst) {
        var entries = new ArrayList<Op.VecEntry>();
        for (int i = 0; i < dst.size(); i++) {
            var value = dst.get(i);
            var before = i < src.size() ? src.get(i) : null;
            if (before != null && JsonValues.equal(before, value)) continue;
            var childId = node.get(i);
            var child = childId == null ? null : index.get(childId);
            if (child != null && canDiffInPlace(child, value)) {
                diffNode(child, value);
            } else {
                entries.add(new Op.VecEntry(i, builder.constOrJson(value)));
            }
        }
        if (!entries.isEmpty()) builder.insVec(node.id(), entries);
    }

    // ---- arrays ----

    private void diffArr(ArrNode node, JsonNode src, JsonNode dst) {
        var slots = node.rga().itemIds();
        var values = node.values();
        if (diffArrIndexwise(node, values, src, dst)) return;
        if (diffArrStructural(node, slots, values, src, dst)) return;
        diffArrDelta(node, slots, src, dst);
    }

    /** Same length, and every changed element can be edited where it stands. */
    private boolean diffArrIndexwise(ArrNode node, List<Timestamp> values, JsonNode src, JsonNode dst) {
        if (src.size() != dst.size()) return false;
        var changed = new ArrayList<Integer>();
        for (int i = 0; i < src.size(); i++) {
            if (JsonValues.equal(src.get(i), dst.get(i))) continue;
            var child = index.get(values.get(i));
            if (child == null || !canDiffInPlace(child, dst.get(i))) return false;
            changed.add(i);
        }
        for (int i : changed) diffNode(index.get(values.get(i)), dst.get(i));
        return true;
    }

    /**
     * Align old and new elements by their longest common subsequence. Inside
     * each gap between matched elements, old and new elements are paired up
     * and edited in place or overwritten with {@code upd_arr}; leftovers are
     * deleted or inserted.
     *
     * @return false when the changed window is too large to align
     */
    private boolean diffArrStructural(ArrNode node, List<Timestamp> slots, List<Timestamp> values,
                                      JsonNode src, JsonNode dst) {
        int n = src.size();
        int m = dst.size();
        int lcp = 0;
        while (lcp < n && lcp < m && JsonValues.equal(src.get(lcp), dst.get(lcp))) lcp++;
        int lcs = 0;
        while (lcs < n - lcp && lcs < m - lcp
                && JsonValues.equal(src.get(n - 1 - lcs), dst.get(m - 1 - lcs))) lcs++;

        int on = n - lcp - lcs;
        int nn = m - lcp - lcs;
        if ((long) (on + 1) * (nn + 1) > MAX_LCS_CELLS) return false;

        int[][] table = new int[on + 1][nn + 1];
        for (int i = on - 1; i >= 0; i--) {
            for (int j = nn - 1; j >= 0; j--) {
                table[i][j] = JsonValues.equal(src.get(lcp + i), dst.get(lcp + j))
                        ? table[i + 1][j + 1] + 1
                        : Math.max(table[i + 1][j], table[i][j + 1]);
            }
        }

        var gap = new Gap(node, slots, values, dst, lcp > 0 ? slots.get(lcp - 1) : node.id());
        int i = 0;
        int j = 0;
        while (i < on || j < nn) {
            if (i < on && j < nn && JsonValues.equal(src.get(lcp + i), dst.get(lcp + j))) {
                gap.flush();
                gap.before = slots.get(lcp + i);
                i++;
                j++;
            } else if (j >= nn || (i < on && table[i + 1][j] >= table[i][j + 1])) {
                gap.oldIdx.add(lcp + i++);
            } else {
                gap.newIdx.add(lcp + j++);
            }
        }
        gap.flush();
        if (!gap.deleted.isEmpty()) builder.del(node.id(), coalesce(gap.deleted));
        return true;
    }

    /** Pending unmatched elements between two matched ones. */
    private final class Gap {
        final ArrNode node;
        final List<Timestamp> slots;
        final List<Timestamp> values;
        final JsonNode dst;
        final List<Integer> oldIdx = new ArrayList<>();
        final List<Integer> newIdx = new ArrayList<>();
        final List<Timestamp> deleted = new ArrayList<>();
        Timestamp before;

        Gap(ArrNode node, List<Timestamp> slots, List<Timestamp> values, JsonNode dst, Timestamp before) {
            this.node = node;
            this.slots = slots;
            this.values = values;
            this.dst = dst;
            this.before = before;
        }

        void flush() {
            int pairs = Math.min(oldIdx.size(), newIdx.size());
            var anchor = before;
            for (int p = 0; p < pairs; p++) {
                int o = oldIdx.get(p);
                var value = dst.get(newIdx.get(p));
                var child = index.get(values.get(o));
                if (child != null && canDiffInPlace(child, value)) {
                    diffNode(child, value);
                } else {
                    builder.updArr(node.id(), slots.get(o), builder.constOrJson(value));
                }
                anchor = slots.get(o);
            }
            for (int p = pairs; p < oldIdx.size(); p++) deleted.add(slots.get(oldIdx.get(p)));
            if (newIdx.size() > pairs) {
                var ids = new ArrayList<Timestamp>();
                for (int p = pairs; p < newIdx.size(); p++) ids.add(builder.constOrJson(dst.get(newIdx.get(p))));
                builder.insArr(node.id(), anchor, ids);
            }
            oldIdx.clear();
            newIdx.clear();
        }
    }

    /** Delete the changed middle and insert its replacement after the common prefix. */
    private void diffArrDelta(ArrNode node, List<Timestamp> slots, JsonNode src, JsonNode dst) {
        int n = src.size();
        int m = dst.size();
        int lcp = 0;
        while (lcp < n && lcp < m && JsonValues.equal(src.get(lcp), dst.get(lcp))) lcp++;
        int lcs = 0;
        while (lcs < n - lcp && lcs < m - lcp
                && JsonValues.equal(src.get(n - 1 - lcs), dst.get(m - 1 - lcs))) lcs++;

        if (m - lcp - lcs > 0) {
            var ids = new ArrayList<Timestamp>();
            for (int k = lcp; k < m - lcs; k++) ids.add(builder.constOrJson(dst.get(k)));
            builder.insArr(node.id(), lcp > 0 ? slots.get(lcp - 1) : node.id(), ids);
        }
        if (n - lcp - lcs > 0) {
            builder.del(node.id(), coalesce(slots.subList(lcp, n - lcs)));
        }
    }

    private static byte[] binary(JsonNode node) {
        try {
            return node.binaryValue();
        } catch (IOException e) {
            throw new IllegalArgumentException("unreadable binary value", e);
        }
    }
}
