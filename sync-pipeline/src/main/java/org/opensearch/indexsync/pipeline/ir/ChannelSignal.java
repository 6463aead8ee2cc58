package org.opensearch.indexsync.pipeline.ir;

import org.opensearch.indexsync.client.bulk.BulkOperation;

/**
 * What travels on the operation channel: either an operation or the end of one producer's stream.
 */
public sealed interface ChannelSignal {

    static ChannelSignal item(BulkOperation operation) {
        return new Item(operation);
    }

    static ChannelSignal endOf(StreamSource source) {
        return new EndOfStream(source);
    }

    record Item(BulkOperation operation) implements ChannelSignal {}

    record EndOfStream(StreamSource source) implements ChannelSignal {}
}
