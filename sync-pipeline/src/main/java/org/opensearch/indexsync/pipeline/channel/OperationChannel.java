package org.opensearch.indexsync.pipeline.channel;

import org.opensearch.indexsync.client.bulk.BulkOperation;
import org.opensearch.indexsync.pipeline.ir.ChannelSignal;
import org.opensearch.indexsync.pipeline.ir.StreamSource;

import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Bounded multi-producer channel between the fetch stage and the bulker.
 *
 * Each producer's operations are followed by its own end-of-stream marker.  At most {@code capacity} signals
 * per producer are buffered ahead of the consumer; beyond that the producer is no longer requested.
 */
public class OperationChannel {
    private final int capacity;

    public OperationChannel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Channel capacity must be positive, was " + capacity);
        }
        this.capacity = capacity;
    }

    public Flux<ChannelSignal> open(Publisher<? extends BulkOperation> documents,
                                    Publisher<? extends BulkOperation> downloads) {
        return Flux.merge(capacity,
            withEndMarker(documents, StreamSource.DOCUMENTS),
            withEndMarker(downloads, StreamSource.DOWNLOADS));
    }

    private static Flux<ChannelSignal> withEndMarker(Publisher<? extends BulkOperation> ops, StreamSource source) {
        return Flux.<BulkOperation>from(ops)
            .map(ChannelSignal::item)
            .concatWith(Mono.fromSupplier(() -> ChannelSignal.endOf(source)));
    }
}
