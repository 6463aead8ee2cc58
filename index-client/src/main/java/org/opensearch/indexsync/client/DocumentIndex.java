package org.opensearch.indexsync.client;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Typed access to the documents of one index.
 *
 * Subclasses decide how a raw hit becomes a domain object by implementing {@link #createObject(JsonNode)}.
 *
 * @param <T> the domain type documents are mapped to
 */
@Slf4j
public abstract class DocumentIndex<T> {
    public static final int DEFAULT_PAGE_SIZE = 100;

    protected final IndexClient client;
    @Getter
    protected final String indexName;

    protected DocumentIndex(IndexClient client, String indexName) {
        this.client = client;
        this.indexName = indexName;
    }

    /**
     * Maps a raw hit or get response ({@code _id}, {@code _source}, {@code _seq_no}, ...) to the domain type.
     */
    protected abstract T createObject(JsonNode doc);

    public Mono<T> fetchById(String id) {
        return fetchResponseById(id).map(this::createObject);
    }

    /**
     * Refreshes the index first so that recent writes are visible, unless the cluster is serverless.
     */
    public Mono<JsonNode> fetchResponseById(String id) {
        return client.refresh(indexName)
            .then(client.getDocument(indexName, id));
    }

    public Mono<JsonNode> index(Map<String, Object> document) {
        return client.indexDocument(indexName, null, document);
    }

    public Mono<JsonNode> update(String id, Map<String, Object> document) {
        return update(id, document, null, null);
    }

    public Mono<JsonNode> update(String id, Map<String, Object> document, Long ifSeqNo, Long ifPrimaryTerm) {
        return client.updateDocument(indexName, id, document, ifSeqNo, ifPrimaryTerm);
    }

    /**
     * Runs {@code script} against the stored document, e.g.
     * {@code {"source": "ctx._source.count += params.n", "params": {"n": 1}}}.
     */
    public Mono<JsonNode> updateByScript(String id, JsonNode script) {
        return client.updateDocumentByScript(indexName, id, script);
    }

    /** Deletes every document while keeping the index and its mappings. */
    public Mono<JsonNode> cleanIndex() {
        return client.deleteByQuery(indexName, matchAll());
    }

    public Flux<T> getAllDocs() {
        return getAllDocs(null, null, DEFAULT_PAGE_SIZE);
    }

    /**
     * Pages through every document matching {@code query} (all documents when null) with from/size requests,
     * stopping once the number of hits seen reaches the reported total.
     */
    public Flux<T> getAllDocs(JsonNode query, JsonNode sort, int pageSize) {
        var effectiveQuery = query == null ? matchAll() : query;
        return Flux.defer(() -> {
            var count = new AtomicInteger();
            return client.refresh(indexName)
                .thenMany(fetchPage(effectiveQuery, sort, 0, pageSize)
                    .expand(page -> {
                        int seen = count.addAndGet(page.hits().size());
                        if (page.hits().isEmpty() || seen >= page.total()) {
                            return Mono.empty();
                        }
                        return fetchPage(effectiveQuery, sort, seen, pageSize);
                    }));
        })
            .concatMapIterable(Page::hits)
            .map(this::createObject);
    }

    private Mono<Page> fetchPage(JsonNode query, JsonNode sort, int from, int size) {
        log.atDebug().setMessage("Fetching {} documents from {} starting at {}").addArgument(size)
            .addArgument(indexName).addArgument(from).log();
        return client.search(indexName, query, sort, from, size)
            .map(Page::parse);
    }

    private static JsonNode matchAll() {
        var query = JsonNodeFactory.instance.objectNode();
        query.putObject("match_all");
        return query;
    }

    private record Page(List<JsonNode> hits, long total) {
        static Page parse(JsonNode response) {
            var hits = new ArrayList<JsonNode>();
            response.path("hits").path("hits").forEach(hits::add);
            return new Page(hits, response.path("hits").path("total").path("value").asLong(hits.size()));
        }
    }
}
