package org.opensearch.indexsync.pipeline;

import java.time.Duration;
import java.util.Map;

import org.opensearch.indexsync.pipeline.bulk.BulkStats;
import org.opensearch.indexsync.pipeline.fetch.FetchStats;

import lombok.Builder;
import lombok.Value;

/**
 * Summary of one pass over an index.
 */
@Value
@Builder
public class SyncResult {
    String indexName;
    /** Bulk action name to number of operations consumed, e.g. {@code create -> 12}. */
    Map<String, Long> bulkOperationCounts;
    long documentsCreated;
    long documentsUpdated;
    long documentsSkipped;
    long documentsDeleted;
    long attachmentsExtracted;
    long batchesDispatched;
    Duration bulkTime;
    Duration totalTime;

    static SyncResult of(String indexName, FetchStats fetch, BulkStats bulk, Duration totalTime) {
        return SyncResult.builder()
            .indexName(indexName)
            .bulkOperationCounts(Map.copyOf(bulk.countsByActionName()))
            .documentsCreated(fetch.getCreated())
            .documentsUpdated(fetch.getUpdated())
            .documentsSkipped(fetch.getSkipped())
            .documentsDeleted(fetch.getDeleted())
            .attachmentsExtracted(fetch.getAttachmentsExtracted())
            .batchesDispatched(bulk.getBatchesDispatched())
            .bulkTime(bulk.getBulkTime())
            .totalTime(totalTime)
            .build();
    }

    public long operationCount(String actionName) {
        return bulkOperationCounts.getOrDefault(actionName, 0L);
    }
}
