package org.opensearch.indexsync.client.bulk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of a bulk request.  Create and update carry a document body, delete carries none.
 */
public sealed interface BulkOperation permits CreateOperation, UpdateOperation, DeleteOperation {

    String index();

    String id();

    OperationType type();

    default int wireEntries() {
        return type().getWireEntries();
    }

    static Map<String, Object> immutableBody(Map<String, Object> body) {
        if (body == null) {
            throw new IllegalArgumentException("A document body is required");
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(body));
    }
}
