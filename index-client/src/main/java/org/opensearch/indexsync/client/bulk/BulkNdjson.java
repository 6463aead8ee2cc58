package org.opensearch.indexsync.client.bulk;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Map;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Writes bulk operations in the newline-delimited format of the _bulk endpoint.
 *
 * Creates and updates are both sent as upserts, so a create never conflicts with an upsert of the same
 * document that reached the cluster first.
 *
 * <pre>
 * {"update":{"_index":"i","_id":"1"}}
 * {"doc":{...},"doc_as_upsert":true}
 * {"delete":{"_index":"i","_id":"3"}}
 * </pre>
 */
public final class BulkNdjson {
    private static final byte[] NEWLINE_BYTES = "\n".getBytes(StandardCharsets.UTF_8);

    private BulkNdjson() {}

    /**
     * Write a single operation, action line first, followed by its payload line if it has one.
     * No trailing newline is written.
     */
    public static void writeOperation(BulkOperation op, OutputStream out, ObjectMapper mapper) throws IOException {
        try (JsonGenerator gen = mapper.getFactory().createGenerator(out)) {
            gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
            gen.writeStartObject();
            gen.writeObjectFieldStart(wireActionName(op));
            gen.writeStringField("_index", op.index());
            gen.writeStringField("_id", op.id());
            gen.writeEndObject();
            gen.writeEndObject();
            gen.flush();
        }

        var body = upsertBody(op);
        if (body != null) {
            out.write(NEWLINE_BYTES);
            try (JsonGenerator gen = mapper.getFactory().createGenerator(out)) {
                gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
                gen.writeStartObject();
                gen.writeFieldName("doc");
                mapper.writeValue(gen, body);
                gen.writeBooleanField("doc_as_upsert", true);
                gen.writeEndObject();
                gen.flush();
            }
        }
    }

    static String wireActionName(BulkOperation op) {
        return op.type() == OperationType.DELETE
            ? OperationType.DELETE.getActionName()
            : OperationType.UPDATE.getActionName();
    }

    private static Map<String, Object> upsertBody(BulkOperation op) {
        if (op instanceof CreateOperation create) {
            return create.body();
        } else if (op instanceof UpdateOperation update) {
            return update.body();
        }
        return null;
    }

    public static void writeAll(Collection<? extends BulkOperation> ops, OutputStream out, ObjectMapper mapper)
        throws IOException {
        for (BulkOperation op : ops) {
            writeOperation(op, out, mapper);
            out.write(NEWLINE_BYTES);
        }
    }

    /**
     * Convert a list of bulk operations to a request body.  The body always ends with a newline.
     */
    public static String toBulkNdjson(Collection<? extends BulkOperation> ops, ObjectMapper mapper) {
        try (var baos = new ByteArrayOutputStream()) {
            writeAll(ops, baos, mapper);
            return baos.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Total number of NDJSON lines the given operations occupy.
     */
    public static int countWireEntries(Collection<? extends BulkOperation> ops) {
        return ops.stream().mapToInt(BulkOperation::wireEntries).sum();
    }
}
