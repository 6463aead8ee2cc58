package org.opensearch.indexsync.pipeline.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A document as produced by a data source.  The id may be absent until the document is classified;
 * the timestamp is an opaque token compared for exact equality with the one stored in the index.
 *
 * Instances never share state with the map they were built from.
 */
public record SourceDocument(String id, Map<String, Object> fields, String timestamp) {
    public static final String RAW_ID_FIELD = "_id";
    public static final String ID_FIELD = "id";
    public static final String TIMESTAMP_FIELD = "timestamp";

    public SourceDocument {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields == null ? Map.of() : fields));
    }

    /**
     * Builds a document from a raw field map.  The id comes from {@code _id}, falling back to {@code id};
     * both keys, and {@code timestamp}, are lifted out of the remaining fields.
     */
    public static SourceDocument fromMap(Map<String, Object> raw) {
        return fromMap(null, raw);
    }

    /**
     * As {@link #fromMap(Map)}, with {@code explicitId} taking precedence over the id fields when not null.
     */
    public static SourceDocument fromMap(String explicitId, Map<String, Object> raw) {
        var fields = new LinkedHashMap<>(raw);
        Object rawId = fields.remove(RAW_ID_FIELD);
        Object plainId = fields.remove(ID_FIELD);
        Object timestamp = fields.remove(TIMESTAMP_FIELD);
        Object id = explicitId != null ? explicitId : (rawId != null ? rawId : plainId);
        return new SourceDocument(
            id == null ? null : String.valueOf(id),
            fields,
            timestamp == null ? null : String.valueOf(timestamp));
    }

    public boolean hasId() {
        return id != null && !id.isEmpty();
    }

    public boolean hasTimestamp() {
        return timestamp != null;
    }

    public SourceDocument withTimestamp(String newTimestamp) {
        return new SourceDocument(id, fields, newTimestamp);
    }

    /**
     * The body written to the index: the fields plus {@code id} and {@code timestamp}, which the snapshot scan
     * reads back on the next pass.
     */
    public Map<String, Object> toIndexBody() {
        var body = new LinkedHashMap<>(fields);
        body.put(ID_FIELD, id);
        if (timestamp != null) {
            body.put(TIMESTAMP_FIELD, timestamp);
        }
        return body;
    }
}
