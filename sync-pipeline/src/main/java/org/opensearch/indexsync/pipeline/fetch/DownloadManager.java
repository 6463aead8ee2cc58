package org.opensearch.indexsync.pipeline.fetch;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.opensearch.indexsync.client.bulk.UpdateOperation;
import org.opensearch.indexsync.pipeline.ir.SourceDocument;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

/**
 * Runs scheduled downloads on a bounded pool and turns each non-empty result into an upsert.
 *
 * Up to {@code queueCapacity} tasks wait for a slot; once the queue is full the scheduling side is no longer
 * requested.  Results are emitted in scheduling order.
 */
@Slf4j
public class DownloadManager {
    static final int PROGRESS_INTERVAL = 10;

    private final String indexName;
    private final int queueCapacity;
    private final int maxConcurrentDownloads;
    private final AtomicLong completed = new AtomicLong();

    public DownloadManager(String indexName, int queueCapacity, int maxConcurrentDownloads) {
        this.indexName = indexName;
        this.queueCapacity = queueCapacity;
        this.maxConcurrentDownloads = maxConcurrentDownloads;
    }

    public Flux<UpdateOperation> drain(Flux<DownloadTask> scheduled) {
        return scheduled
            .limitRate(queueCapacity)
            .flatMapSequential(DownloadTask::start, maxConcurrentDownloads)
            .map(this::toUpsert)
            .doOnNext(op -> logProgress(completed.incrementAndGet()))
            .doOnComplete(() -> log.info("Downloads done, {} attachments extracted for {}",
                completed.get(), indexName));
    }

    public long getCompletedCount() {
        return completed.get();
    }

    private UpdateOperation toUpsert(Map<String, Object> result) {
        var body = new LinkedHashMap<>(result);
        Object rawId = body.remove(SourceDocument.RAW_ID_FIELD);
        Object id = rawId != null ? rawId : body.get(SourceDocument.ID_FIELD);
        if (id == null) {
            throw new MalformedDocumentException("Download result for " + indexName + " carries no document id");
        }
        return new UpdateOperation(indexName, String.valueOf(id), body);
    }

    private static void logProgress(long total) {
        if (total % PROGRESS_INTERVAL == 0) {
            log.info("Downloaded {} files", total);
        }
    }
}
