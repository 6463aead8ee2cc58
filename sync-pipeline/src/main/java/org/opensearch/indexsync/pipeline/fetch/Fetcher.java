package org.opensearch.indexsync.pipeline.fetch;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import org.opensearch.indexsync.client.bulk.BulkOperation;
import org.opensearch.indexsync.client.bulk.CreateOperation;
import org.opensearch.indexsync.client.bulk.DeleteOperation;
import org.opensearch.indexsync.client.bulk.UpdateOperation;
import org.opensearch.indexsync.pipeline.channel.OperationChannel;
import org.opensearch.indexsync.pipeline.ir.ChannelSignal;
import org.opensearch.indexsync.pipeline.ir.IndexSnapshot;
import org.opensearch.indexsync.pipeline.ir.SourceDocument;
import org.opensearch.indexsync.pipeline.ir.SourceItem;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Classifies the documents of one pass against the index snapshot.
 *
 * <ul>
 *   <li>unchanged documents (same timestamp as stored) are skipped and their download is released</li>
 *   <li>known documents become updates, new ones creates</li>
 *   <li>a document with a lazy download also schedules that download on the {@link DownloadManager}</li>
 *   <li>once the source is exhausted, every snapshot id not seen becomes a delete</li>
 * </ul>
 *
 * A Fetcher holds per-pass state and is meant to be run once.
 */
@Slf4j
public class Fetcher {
    private final String indexName;
    private final IndexSnapshot snapshot;
    private final OperationChannel channel;
    private final DownloadManager downloadManager;
    private final Clock clock;

    private final Set<String> seenIds = new HashSet<>();
    private final AtomicLong created = new AtomicLong();
    private final AtomicLong updated = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong deleted = new AtomicLong();

    public Fetcher(String indexName, IndexSnapshot snapshot, OperationChannel channel,
                   DownloadManager downloadManager, Clock clock) {
        this.indexName = indexName;
        this.snapshot = snapshot;
        this.channel = channel;
        this.downloadManager = downloadManager;
        this.clock = clock;
    }

    /**
     * Consumes the source and returns the channel both producers write to.  The documents side closes after
     * the deletes; the downloads side closes once every scheduled download has finished.
     */
    public Flux<ChannelSignal> run(Flux<SourceItem> source) {
        return source
            .concatMap(this::classify)
            .publish(classified -> channel.open(
                classified.map(Classified::operation)
                    .concatWith(Flux.defer(this::pendingDeletes)),
                downloadManager.drain(classified
                    .filter(Classified::hasDownload)
                    .map(Classified::download))));
    }

    public FetchStats getStats() {
        return FetchStats.builder()
            .created(created.get())
            .updated(updated.get())
            .skipped(skipped.get())
            .deleted(deleted.get())
            .attachmentsExtracted(downloadManager.getCompletedCount())
            .build();
    }

    private Mono<Classified> classify(SourceItem item) {
        var document = item.document();
        if (!document.hasId()) {
            return Mono.error(new MalformedDocumentException("Document for " + indexName + " has no id"));
        }
        var id = document.id();
        if (!seenIds.add(id)) {
            log.atWarn().setMessage("Duplicate document id {} in {}, ignoring the later occurrence")
                .addArgument(id).addArgument(indexName).log();
            return release(item).then(Mono.empty());
        }

        if (snapshot.contains(id) && snapshot.isUnchanged(id, document.timestamp())) {
            skipped.incrementAndGet();
            log.atDebug().setMessage("Skipping unchanged document {}").addArgument(id).log();
            return release(item).then(Mono.empty());
        }

        if (!document.hasTimestamp()) {
            document = document.withTimestamp(Instant.now(clock).toString());
        }
        var body = document.toIndexBody();
        BulkOperation operation;
        if (snapshot.contains(id)) {
            updated.incrementAndGet();
            operation = new UpdateOperation(indexName, id, body);
        } else {
            created.incrementAndGet();
            operation = new CreateOperation(indexName, id, body);
        }
        var download = item.hasLazyDownload()
            ? new DownloadTask(id, item.lazyDownload(), document.timestamp())
            : null;
        return Mono.just(new Classified(operation, download));
    }

    private static Mono<Void> release(SourceItem item) {
        return item.hasLazyDownload()
            ? item.lazyDownload().invoke(false, null).then()
            : Mono.empty();
    }

    private Flux<BulkOperation> pendingDeletes() {
        return Flux.fromIterable(snapshot.ids())
            .filter(id -> !seenIds.contains(id))
            .<BulkOperation>map(id -> new DeleteOperation(indexName, id))
            .doOnNext(op -> deleted.incrementAndGet())
            .doOnComplete(() -> log.info("Source exhausted for {}: {} created, {} updated, {} skipped, {} deleted",
                indexName, created.get(), updated.get(), skipped.get(), deleted.get()));
    }

    private record Classified(BulkOperation operation, DownloadTask download) {
        boolean hasDownload() {
            return download != null;
        }
    }
}
