// file: src/main/java/io/crdtlite/codec/model/ModelDecoder.java
package io.crdtlite.codec.model;

import io.crdtlite.codec.CodecException;
import io.crdtlite.codec.ErrorCode;
import io.crdtlite.codec.binary.CrdtReader;
import io.crdtlite.codec.cbor.CborValues;
import io.crdtlite.core.clock.ClockException;
import io.crdtlite.core.clock.ServerClock;
import io.crdtlite.core.clock.Session;
import io.crdtlite.core.clock.Timestamp;
import io.crdtlite.core.model.Model;
import io.crdtlite.core.nodes.ArrNode;
import io.crdtlite.core.nodes.BinNode;
import io.crdtlite.core.nodes.ConNode;
import io.crdtlite.core.nodes.ConValue;
import io.crdtlite.core.nodes.CrdtNode;
import io.crdtlite.core.nodes.ObjNode;
import io.crdtlite.core.nodes.StrNode;
import io.crdtlite.core.nodes.ValNode;
import io.crdtlite.core.nodes.VecNode;
import io.crdtlite.core.rga.Chunk;
import io.crdtlite.core.rga.Slicer;

import java.util.ArrayList;
import java.util.List;

/**
 * Inverse of {@link ModelEncoder}. The first byte tells the clock kind: its
 * high bit is set only by the server marker, since a logical snapshot starts
 * with the big-endian length of its node section.
 */
public final class ModelDecoder {

    private interface IdReader {
        Timestamp read(CrdtReader in);
    }

    public Model decode(byte[] data) {
        if (data.length == 0) throw new CodecException(ErrorCode.INVALID_MODEL, "empty model");
        try {
            return (data[0] & ModelEncoder.SERVER_MARKER) != 0 ? decodeServer(data) : decodeLogical(data);
        } catch (IllegalArgumentException | IllegalStateException | ClockException e) {
            throw new CodecException(ErrorCode.INVALID_MODEL, e.getMessage(), e);
        }
    }

    private Model decodeLogical(byte[] data) {
        var header = new CrdtReader(data);
        int length = header.u32();
        if (length < 1 || length > header.remaining()) {
            throw new CodecException(ErrorCode.INVALID_MODEL, "node section length " + length + " out of range");
        }
        int tableStart = 4 + length;
        var tableIn = new CrdtReader(data, tableStart, data.length);
        var table = ClockTable.read(tableIn);
        if (!tableIn.isEof()) throw new CodecException(ErrorCode.TRAILING_BYTES, tableIn.remaining() + " bytes after clock table");

        var model = Model.withClock(table.clock());
        var in = new CrdtReader(data, 4, tableStart);
        readRoot(in, model, r -> {
            var id = r.id();
            return table.absolute(id.x(), id.y());
        });
        if (!in.isEof()) throw new CodecException(ErrorCode.INVALID_MODEL, "node section not fully consumed");
        return model;
    }

    private Model decodeServer(byte[] data) {
        var in = new CrdtReader(data);
        in.u8();
        long time = in.vu57();
        var model = Model.withClock(new ServerClock(time));
        readRoot(in, model, r -> {
            long t = r.vu57();
            return t == 0 ? Timestamp.ORIGIN : new Timestamp(Session.SERVER, t);
        });
        if (!in.isEof()) throw new CodecException(ErrorCode.TRAILING_BYTES, in.remaining() + " bytes after document");
        return model;
    }

    private void readRoot(CrdtReader in, Model model, IdReader ids) {
        if (in.peek() == 0) {
            in.u8();
            return;
        }
        var child = new NodeReader(in, model, ids).node();
        model.root().set(child.id());
    }

    private static final class NodeReader {
        private final CrdtReader in;
        private final Model model;
        private final IdReader ids;

        NodeReader(CrdtReader in, Model model, IdReader ids) {
            this.in = in;
            this.model = model;
            this.ids = ids;
        }

        CrdtNode node() {
            var id = ids.read(in);
            if (id.isOrigin()) throw new CodecException(ErrorCode.INVALID_MODEL, "node with origin id");
            int octet = in.u8();
            int major = octet >>> 5;
            int minor = octet & 0x1f;
            CrdtNode node;
            switch (major) {
                case ModelEncoder.CON -> node = con(id, minor);
                case ModelEncoder.VAL -> node = val(id);
                case ModelEncoder.OBJ -> node = obj(id, length(minor));
                case ModelEncoder.VEC -> node = vec(id, length(minor));
                case ModelEncoder.STR -> node = str(id, length(minor));
                case ModelEncoder.BIN -> node = bin(id, length(minor));
                case ModelEncoder.ARR -> node = arr(id, length(minor));
                default -> throw new CodecException(ErrorCode.INVALID_MODEL, "unknown node type " + major);
            }
            if (model.index().contains(id)) throw new CodecException(ErrorCode.INVALID_MODEL, "duplicate node " + id);
            model.index().put(node);
            return node;
        }

        private int length(int minor) {
            int n = minor < 31 ? minor : in.vu57Int();
            if (n > in.remaining()) throw new CodecException(ErrorCode.OVERFLOW, "child count " + n + " exceeds input");
            return n;
        }

        private ConNode con(Timestamp id, int minor) {
            if (minor == 1) return new ConNode(id, ConValue.ref(ids.read(in)));
            if (minor != 0) throw new CodecException(ErrorCode.INVALID_MODEL, "bad con flags " + minor);
            var decoded = CborValues.read(in);
            return new ConNode(id, decoded.isUndefined() ? ConValue.UNDEFINED : ConValue.of(decoded.value()));
        }

        private ValNode val(Timestamp id) {
            if (in.peek() == 0) {
                in.u8();
                return new ValNode(id);
            }
            return new ValNode(id, node().id());
        }

        private ObjNode obj(Timestamp id, int n) {
            var obj = new ObjNode(id);
            for (int i = 0; i < n; i++) {
                var key = CborValues.readString(in);
                obj.put(key, node().id());
            }
            return obj;
        }

        private VecNode vec(Timestamp id, int n) {
            if (n > VecNode.MAX_INDEX + 1) throw new CodecException(ErrorCode.INVALID_MODEL, "vec too long: " + n);
            var vec = new VecNode(id);
            for (int i = 0; i < n; i++) {
                if (in.peek() == 0) {
                    in.u8();
                    continue;
                }
                vec.put(i, node().id());
            }
            return vec;
        }

        private StrNode str(Timestamp id, int n) {
            var str = new StrNode(id);
            for (int i = 0; i < n; i++) {
                var chunkId = ids.read(in);
                var decoded = CborValues.read(in);
                var value = decoded.value();
                if (value != null && value.isTextual()) {
                    var text = value.textValue();
                    str.rga().pushChunk(new Chunk<>(chunkId, Slicer.STRING.length(text), text));
                } else if (value != null && value.canConvertToLong()) {
                    str.rga().pushChunk(Chunk.tombstone(chunkId, value.longValue()));
                } else {
                    throw new CodecException(ErrorCode.INVALID_MODEL, "bad string chunk in " + id);
                }
            }
            return str;
        }

        private BinNode bin(Timestamp id, int n) {
            var bin = new BinNode(id);
            for (int i = 0; i < n; i++) {
                var chunkId = ids.read(in);
                var head = in.b1vu56();
                if (head.flag()) {
                    bin.rga().pushChunk(Chunk.tombstone(chunkId, head.value()));
                } else {
                    bin.rga().pushChunk(new Chunk<>(chunkId, head.value(), in.bytes(Math.toIntExact(head.value()))));
                }
            }
            return bin;
        }

        private ArrNode arr(Timestamp id, int n) {
            var arr = new ArrNode(id);
            for (int i = 0; i < n; i++) {
                var chunkId = ids.read(in);
                var head = in.b1vu56();
                if (head.flag()) {
                    arr.rga().pushChunk(Chunk.tombstone(chunkId, head.value()));
                    continue;
                }
                if (head.value() > in.remaining()) throw new CodecException(ErrorCode.OVERFLOW, "array chunk exceeds input");
                List<Timestamp> values = new ArrayList<>((int) head.value());
                for (long j = 0; j < head.value(); j++) values.add(node().id());
                arr.rga().pushChunk(new Chunk<>(chunkId, head.value(), values));
            }
            return arr;
        }
    }
}
