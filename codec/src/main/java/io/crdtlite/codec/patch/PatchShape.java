// file: src/main/java/io/crdtlite/codec/patch/PatchShape.java
package io.crdtlite.codec.patch;

import io.crdtlite.core.clock.Timestamp;
import io.crdtlite.core.patch.Patch;

/**
 * Structural preconditions shared by the encoders. Every wire format stores
 * only the patch id and re-derives op ids from spans, so a patch must be
 * non-empty and contiguous to be encodable.
 */
final class PatchShape {

    private PatchShape() {
        // utility
    }

    static Timestamp requireEncodable(Patch patch) {
        var id = patch.id();
        if (id == null) throw new IllegalArgumentException("cannot encode an empty patch");
        long expected = id.time();
        for (var op : patch.ops()) {
            if (op.id().sid() != id.sid() || op.id().time() != expected) {
                throw new IllegalArgumentException("patch is not contiguous at op " + op.id() + ", expected time " + expected);
            }
            expected += op.span();
        }
        return id;
    }
}
