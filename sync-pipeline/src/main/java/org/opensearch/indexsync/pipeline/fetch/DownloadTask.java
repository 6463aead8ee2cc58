package org.opensearch.indexsync.pipeline.fetch;

import java.util.Map;

import org.opensearch.indexsync.pipeline.source.LazyDownload;

import reactor.core.publisher.Mono;

/**
 * A download scheduled for a document.  Nothing runs until {@link #start()} is subscribed.
 */
public record DownloadTask(String documentId, LazyDownload download, String timestamp) {

    public Mono<Map<String, Object>> start() {
        return Mono.defer(() -> download.invoke(true, timestamp));
    }
}
