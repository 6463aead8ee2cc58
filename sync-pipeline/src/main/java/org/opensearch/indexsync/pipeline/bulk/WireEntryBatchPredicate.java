package org.opensearch.indexsync.pipeline.bulk;

import java.util.function.Predicate;

import org.opensearch.indexsync.client.bulk.BulkOperation;

/**
 * Batching predicate for {@code bufferUntil(predicate, true)}: starts a new batch before any operation
 * that would push the current one past {@code maxWireEntries} NDJSON lines.
 * Stateful, so use one instance per stream.
 */
class WireEntryBatchPredicate implements Predicate<BulkOperation> {
    private final int maxWireEntries;
    private int currentEntries;

    WireEntryBatchPredicate(int maxWireEntries) {
        if (maxWireEntries < 2) {
            throw new IllegalArgumentException("A batch must fit at least one operation with a payload");
        }
        this.maxWireEntries = maxWireEntries;
    }

    @Override
    public boolean test(BulkOperation op) {
        if (currentEntries + op.wireEntries() > maxWireEntries) {
            currentEntries = op.wireEntries();
            return true; // op opens the next batch
        }
        currentEntries += op.wireEntries();
        return false;
    }

    int pendingWireEntries() {
        return currentEntries;
    }
}
