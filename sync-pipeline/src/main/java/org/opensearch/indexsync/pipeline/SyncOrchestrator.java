package org.opensearch.indexsync.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.opensearch.indexsync.client.IndexClient;
import org.opensearch.indexsync.pipeline.bulk.Bulker;
import org.opensearch.indexsync.pipeline.channel.OperationChannel;
import org.opensearch.indexsync.pipeline.fetch.DownloadManager;
import org.opensearch.indexsync.pipeline.fetch.Fetcher;
import org.opensearch.indexsync.pipeline.ir.IndexSnapshot;
import org.opensearch.indexsync.pipeline.ir.SourceItem;
import org.opensearch.indexsync.pipeline.snapshot.SnapshotBuilder;
import org.opensearch.indexsync.pipeline.source.DocumentSource;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Runs synchronization passes: snapshot the index, then stream the source through a fresh fetcher and bulker.
 *
 * Every pass gets its own snapshot, channel and counters, so one orchestrator can serve several indices.
 */
@Slf4j
public class SyncOrchestrator {
    private final IndexClient client;
    private final SyncConfig config;
    private final Clock clock;
    private final SnapshotBuilder snapshotBuilder;

    public SyncOrchestrator(IndexClient client, SyncConfig config) {
        this(client, config, Clock.systemUTC());
    }

    public SyncOrchestrator(IndexClient client, SyncConfig config, Clock clock) {
        this.client = client;
        this.config = config;
        this.clock = clock;
        this.snapshotBuilder = new SnapshotBuilder(client, config.scanPageSize());
    }

    public Mono<SyncResult> syncIndex(String index, DocumentSource source) {
        return syncIndex(index, Flux.defer(source::readDocuments));
    }

    /**
     * Makes {@code index} mirror {@code source}: new documents are created, changed ones updated, unchanged ones
     * skipped and documents no longer in the source deleted.  Completes once every bulk request has finished.
     */
    public Mono<SyncResult> syncIndex(String index, Flux<SourceItem> source) {
        return Mono.defer(() -> {
            log.info("Starting sync of {}", index);
            long start = clock.millis();
            return snapshotBuilder.buildSnapshot(index)
                .flatMap(snapshot -> runPass(index, snapshot, source, start))
                .doOnNext(this::logResult)
                .doOnError(e -> log.atError().setMessage("Sync of {} failed after {}ms")
                    .addArgument(index).addArgument(() -> clock.millis() - start).setCause(e).log());
        });
    }

    private void logResult(SyncResult result) {
        log.atInfo()
            .setMessage("Sync of {} finished in {}: {} created, {} updated, {} skipped, {} deleted, {} attachments")
            .addArgument(result::getIndexName).addArgument(result::getTotalTime)
            .addArgument(result::getDocumentsCreated).addArgument(result::getDocumentsUpdated)
            .addArgument(result::getDocumentsSkipped).addArgument(result::getDocumentsDeleted)
            .addArgument(result::getAttachmentsExtracted).log();
    }

    private Mono<SyncResult> runPass(String index, IndexSnapshot snapshot, Flux<SourceItem> source, long start) {
        var downloads = new DownloadManager(index, config.downloadQueueCapacity(), config.maxConcurrentDownloads());
        var fetcher = new Fetcher(index, snapshot, new OperationChannel(config.channelCapacity()), downloads, clock);
        var bulker = new Bulker(client, config.chunkSize(), config.maxConcurrentBulkRequests());
        return bulker.run(fetcher.run(source))
            .map(bulkStats -> SyncResult.of(index, fetcher.getStats(), bulkStats,
                Duration.ofMillis(clock.millis() - start)));
    }

    /**
     * Test and bootstrap helper: creates {@code index} with {@code mappings} and indexes {@code documents} with
     * ids 1..n.  An existing index is left untouched unless {@code deleteFirst} is set.
     */
    public Mono<Void> prepareIndex(String index, ObjectNode mappings, List<Map<String, Object>> documents,
                                   boolean deleteFirst) {
        return client.indexExists(index)
            .flatMap(exists -> {
                if (exists && !deleteFirst) {
                    log.info("Index {} already exists, leaving it as is", index);
                    return Mono.just(false);
                }
                return (exists ? client.deleteIndex(index) : Mono.<Void>empty())
                    .then(client.createIndex(index, mappings))
                    .thenReturn(true);
            })
            .flatMap(created -> !created || documents == null
                ? Mono.<Void>empty()
                : Flux.range(0, documents.size())
                    .concatMap(i -> client.indexDocument(index, String.valueOf(i + 1), documents.get(i)))
                    .then(client.isServerless() ? Mono.<Void>empty() : client.refresh(index)));
    }
}
