package org.opensearch.indexsync.client.bulk;

import java.util.Map;

public record CreateOperation(String index, String id, Map<String, Object> body) implements BulkOperation {
    public CreateOperation {
        body = BulkOperation.immutableBody(body);
    }

    @Override
    public OperationType type() {
        return OperationType.CREATE;
    }
}
