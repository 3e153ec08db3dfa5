// file: src/main/java/io/crdtlite/core/nodes/ConValue.java
package io.crdtlite.core.nodes;

import com.fasterxml.jackson.databind.JsonNode;
import io.crdtlite.core.clock.Timestamp;

import java.util.Objects;

/**
 * Payload of a constant node: a JSON value, the distinguished "undefined"
 * (which removes a key from an object view), or a reference to another timestamp.
 */
public sealed interface ConValue permits ConValue.Json, ConValue.Undefined, ConValue.Ref {

    Undefined UNDEFINED = new Undefined();

    static ConValue of(JsonNode value) {
        return new Json(value);
    }

    static ConValue ref(Timestamp id) {
        return new Ref(id);
    }

    /** Holds a private copy of the JSON it was built from. */
    record Json(JsonNode value) implements ConValue {
        public Json {
            value = Objects.requireNonNull(value, "value").deepCopy();
        }
    }

    record Undefined() implements ConValue {
        @Override
        public String toString() {
            return "undefined";
        }
    }

    record Ref(Timestamp id) implements ConValue {
        public Ref {
            Objects.requireNonNull(id, "id");
        }
    }
}
