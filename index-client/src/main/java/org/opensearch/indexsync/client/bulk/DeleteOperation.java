package org.opensearch.indexsync.client.bulk;

public record DeleteOperation(String index, String id) implements BulkOperation {
    @Override
    public OperationType type() {
        return OperationType.DELETE;
    }
}
