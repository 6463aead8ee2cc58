package org.opensearch.indexsync.client.bulk;

import java.util.Map;

/**
 * Partial-document update, always sent with doc_as_upsert so it also creates missing documents.
 */
public record UpdateOperation(String index, String id, Map<String, Object> body) implements BulkOperation {
    public UpdateOperation {
        body = BulkOperation.immutableBody(body);
    }

    @Override
    public OperationType type() {
        return OperationType.UPDATE;
    }
}
