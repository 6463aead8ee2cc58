package org.opensearch.indexsync.pipeline.bulk;

import java.util.List;

import org.opensearch.indexsync.client.BulkResponse;
import org.opensearch.indexsync.client.IndexClient;
import org.opensearch.indexsync.client.bulk.BulkOperation;
import org.opensearch.indexsync.pipeline.channel.ChannelState;
import org.opensearch.indexsync.pipeline.channel.ChannelStateTracker;
import org.opensearch.indexsync.pipeline.ir.ChannelSignal;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Drains an operation channel into batched _bulk requests.
 *
 * Batches hold at most {@code 2 * chunkSize} NDJSON lines and up to {@code maxConcurrentBulkRequests} of them
 * are in flight at once.  A full batch goes out when the next operation arrives or the channel closes.  The run completes once both producers have closed and every dispatched request has
 * finished; a failed request fails the run.
 */
@Slf4j
public class Bulker {
    private final IndexClient client;
    private final int maxWireEntries;
    private final int maxConcurrentBulkRequests;

    public Bulker(IndexClient client, int chunkSize, int maxConcurrentBulkRequests) {
        this.client = client;
        this.maxWireEntries = chunkSize * 2;
        this.maxConcurrentBulkRequests = maxConcurrentBulkRequests;
    }

    public Mono<BulkStats> run(Flux<ChannelSignal> channel) {
        return Mono.defer(() -> {
            var stats = new BulkStats.Accumulator();
            var tracker = new ChannelStateTracker();
            return channel
                .takeUntil(signal -> signal instanceof ChannelSignal.EndOfStream end
                    && tracker.close(end.source()) == ChannelState.BOTH_CLOSED)
                .concatWith(Mono.defer(() -> tracker.state() == ChannelState.BOTH_CLOSED
                    ? Mono.<ChannelSignal>empty()
                    : Mono.<ChannelSignal>error(new IllegalStateException(
                        "Operation channel completed in state " + tracker.state()))))
                .ofType(ChannelSignal.Item.class)
                .map(ChannelSignal.Item::operation)
                .doOnNext(stats::consumed)
                .bufferUntil(new WireEntryBatchPredicate(maxWireEntries), true)
                .flatMap(batch -> dispatch(batch, stats), maxConcurrentBulkRequests)
                .then(Mono.fromSupplier(stats::snapshot))
                .doOnNext(result -> log.atInfo().setMessage("Bulk operations complete: {} in {} batches")
                    .addArgument(result::countsByActionName).addArgument(result::getBatchesDispatched).log());
        });
    }

    private Mono<BulkResponse> dispatch(List<BulkOperation> batch, BulkStats.Accumulator stats) {
        return client.bulk(batch)
            .doFirst(() -> log.atInfo().setMessage("{} operations in bulk request").addArgument(batch.size()).log())
            .elapsed()
            .doOnNext(timed -> stats.dispatched(timed.getT1()))
            .map(timed -> timed.getT2());
    }
}
