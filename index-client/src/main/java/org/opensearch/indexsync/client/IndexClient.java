package org.opensearch.indexsync.client;

import java.util.List;
import java.util.Map;

import org.opensearch.indexsync.client.bulk.BulkOperation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reactive operations against a single search cluster.
 *
 * Implementations own their retry policy for transient failures; an error signal from any of these
 * methods means the call is not going to succeed.
 */
public interface IndexClient {

    Mono<Boolean> indexExists(String index);

    /** Creates the index, with the given mappings when they are not null. */
    Mono<Void> createIndex(String index, ObjectNode mappings);

    Mono<Void> deleteIndex(String index);

    Mono<Void> refresh(String index);

    /**
     * Streams every hit of the index, page by page, retrieving only the requested source fields.
     * Each element is a raw hit ({@code _id}, {@code _source}, ...).
     */
    Flux<JsonNode> scan(String index, List<String> sourceFields, int pageSize);

    /** Sends one _bulk request.  The response is returned as-is; items are not inspected. */
    Mono<BulkResponse> bulk(List<? extends BulkOperation> operations);

    /**
     * Fetches a document by id.
     *
     * @throws DocumentNotFoundException (as an error signal) if the index or document does not exist
     */
    Mono<JsonNode> getDocument(String index, String id);

    /** Indexes a document, letting the cluster generate the id when {@code id} is null. */
    Mono<JsonNode> indexDocument(String index, String id, Map<String, Object> document);

    /**
     * Partially updates a document.  When both {@code ifSeqNo} and {@code ifPrimaryTerm} are set, the update
     * only succeeds if the document has not changed since it was read.
     */
    Mono<JsonNode> updateDocument(String index, String id, Map<String, Object> document,
                                  Long ifSeqNo, Long ifPrimaryTerm);

    /** Updates a document by running a stored or inline script against it. */
    Mono<JsonNode> updateDocumentByScript(String index, String id, JsonNode script);

    /** One page of a from/size search. */
    Mono<JsonNode> search(String index, JsonNode query, JsonNode sort, int from, int size);

    Mono<JsonNode> deleteByQuery(String index, JsonNode query);

    /** Whether explicit refreshes are rejected by the cluster. */
    default boolean isServerless() {
        return false;
    }
}
