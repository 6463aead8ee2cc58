package org.opensearch.indexsync.pipeline.source;

import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * Deferred fetch of the attachment content belonging to a document.
 */
@FunctionalInterface
public interface LazyDownload {

    /**
     * @param commit    false when the document was skipped; the implementation should only release what it holds
     *                  and complete empty
     * @param timestamp the timestamp assigned to the document, null when not committing
     * @return the attachment fields, including the id of the document they belong to ({@code _id} or {@code id}),
     *         or an empty Mono when there is nothing to add
     */
    Mono<Map<String, Object>> invoke(boolean commit, String timestamp);
}
