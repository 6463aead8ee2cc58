package org.opensearch.indexsync.pipeline;

import lombok.Builder;

/**
 * Tuning for a synchronization pass.  Unset builder fields keep their defaults.
 *
 * @param chunkSize                 half the number of NDJSON lines allowed in one bulk request
 * @param channelCapacity           operations buffered per producer ahead of the bulker
 * @param downloadQueueCapacity     scheduled downloads waiting for a free slot
 * @param maxConcurrentDownloads    downloads running at once
 * @param maxConcurrentBulkRequests bulk requests in flight at once
 * @param scanPageSize              page size of the snapshot scan
 */
@Builder
public record SyncConfig(int chunkSize,
                         int channelCapacity,
                         int downloadQueueCapacity,
                         int maxConcurrentDownloads,
                         int maxConcurrentBulkRequests,
                         int scanPageSize) {
    public static final int DEFAULT_CHUNK_SIZE = 500;
    public static final int DEFAULT_CHANNEL_CAPACITY = 1024;
    public static final int DEFAULT_DOWNLOAD_QUEUE_CAPACITY = 1024;
    public static final int DEFAULT_MAX_CONCURRENT_DOWNLOADS = 16;
    public static final int DEFAULT_MAX_CONCURRENT_BULK_REQUESTS = 8;
    public static final int DEFAULT_SCAN_PAGE_SIZE = 1000;

    public SyncConfig {
        requirePositive("chunkSize", chunkSize);
        requirePositive("channelCapacity", channelCapacity);
        requirePositive("downloadQueueCapacity", downloadQueueCapacity);
        requirePositive("maxConcurrentDownloads", maxConcurrentDownloads);
        requirePositive("maxConcurrentBulkRequests", maxConcurrentBulkRequests);
        requirePositive("scanPageSize", scanPageSize);
    }

    public static SyncConfig defaults() {
        return builder().build();
    }

    public int maxWireEntriesPerBatch() {
        return chunkSize * 2;
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, was " + value);
        }
    }

    public static class SyncConfigBuilder {
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private int channelCapacity = DEFAULT_CHANNEL_CAPACITY;
        private int downloadQueueCapacity = DEFAULT_DOWNLOAD_QUEUE_CAPACITY;
        private int maxConcurrentDownloads = DEFAULT_MAX_CONCURRENT_DOWNLOADS;
        private int maxConcurrentBulkRequests = DEFAULT_MAX_CONCURRENT_BULK_REQUESTS;
        private int scanPageSize = DEFAULT_SCAN_PAGE_SIZE;
    }
}
