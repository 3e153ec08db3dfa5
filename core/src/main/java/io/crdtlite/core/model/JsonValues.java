// file: src/main/java/io/crdtlite/core/model/JsonValues.java
package io.crdtlite.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Comparator;

/** JSON comparison helpers shared by the model and the diff engine. */
public final class JsonValues {

    /** Numbers compare by value ({@code 1 == 1.0}); every other node by type and content. */
    private static final Comparator<JsonNode> NUMERIC_AWARE = (a, b) -> {
        if (a.equals(b)) return 0;
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue()) == 0 ? 0 : 1;
        }
        return 1;
    };

    private JsonValues() {
        // utility
    }

    public static boolean equal(JsonNode a, JsonNode b) {
        if (a == b) return true;
        if (a == null || b == null) return false;
        return a.equals(NUMERIC_AWARE, b);
    }
}
