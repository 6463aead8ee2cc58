package org.opensearch.indexsync.pipeline.source;

import org.opensearch.indexsync.pipeline.ir.SourceItem;

import reactor.core.publisher.Flux;

/**
 * Port for the external system whose documents are synchronized into the index.
 */
public interface DocumentSource extends AutoCloseable {

    /**
     * Streams every document the source currently holds.  Returns a cold Flux; each subscription is a new read.
     */
    Flux<SourceItem> readDocuments();

    @Override
    default void close() throws Exception {
        // Default no-op for sources that don't hold resources
    }
}
