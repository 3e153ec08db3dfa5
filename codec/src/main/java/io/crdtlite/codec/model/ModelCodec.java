// file: src/main/java/io/crdtlite/codec/model/ModelCodec.java
package io.crdtlite.codec.model;

import io.crdtlite.core.model.Model;

import java.util.logging.Logger;

/** Entry point for whole-document snapshots. */
public final class ModelCodec {
    private static final Logger log = Logger.getLogger(ModelCodec.class.getName());

    private ModelCodec() {
    }

    public static byte[] encode(Model model) {
        var bytes = new ModelEncoder().encode(model);
        log.fine(() -> "encoded model clock=" + model.clock() + " nodes=" + model.index().size() + " bytes=" + bytes.length);
        return bytes;
    }

    public static Model decode(byte[] data) {
        var model = new ModelDecoder().decode(data);
        log.fine(() -> "decoded model clock=" + model.clock() + " nodes=" + model.index().size());
        return model;
    }
}
