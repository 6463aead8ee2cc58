package org.opensearch.indexsync.client;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import org.opensearch.indexsync.client.bulk.BulkNdjson;
import org.opensearch.indexsync.client.bulk.BulkOperation;
import org.opensearch.indexsync.client.http.AbstractRestClient;
import org.opensearch.indexsync.client.http.HttpResponse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * {@link IndexClient} speaking the Elasticsearch/OpenSearch REST API.
 *
 * Responses with status 429, 502, 503 or 504 and connection-level failures are retried with exponential
 * backoff.  Any other unexpected status fails the call with {@link OperationFailed}.
 */
@Slf4j
public class OpenSearchIndexClient implements IndexClient {
    protected static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.createDefaultMapper();

    private static final int DEFAULT_MAX_RETRY_ATTEMPTS = 3;
    private static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(1);
    private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(10);
    public static final Retry DEFAULT_RETRY_STRATEGY = Retry.backoff(DEFAULT_MAX_RETRY_ATTEMPTS, DEFAULT_BACKOFF)
        .maxBackoff(DEFAULT_MAX_BACKOFF)
        .filter(OpenSearchIndexClient::isTransient);

    private static final int BULK_MAX_RETRY_ATTEMPTS = 10;
    private static final Duration BULK_BACKOFF = Duration.ofSeconds(2);
    private static final Duration BULK_MAX_BACKOFF = Duration.ofSeconds(60);
    public static final Retry DEFAULT_BULK_RETRY_STRATEGY = Retry.backoff(BULK_MAX_RETRY_ATTEMPTS, BULK_BACKOFF)
        .maxBackoff(BULK_MAX_BACKOFF)
        .filter(OpenSearchIndexClient::isTransient);

    public static final String DEFAULT_SCROLL_KEEP_ALIVE = "1m";

    private static final Set<Integer> TRANSIENT_STATUS_CODES = Set.of(429, 502, 503, 504);

    protected final AbstractRestClient client;
    private final Retry retryStrategy;
    private final Retry bulkRetryStrategy;
    private final String scrollKeepAlive;

    public OpenSearchIndexClient(AbstractRestClient client) {
        this(client, DEFAULT_RETRY_STRATEGY, DEFAULT_BULK_RETRY_STRATEGY, DEFAULT_SCROLL_KEEP_ALIVE);
    }

    public OpenSearchIndexClient(AbstractRestClient client, Retry retryStrategy, Retry bulkRetryStrategy,
                                 String scrollKeepAlive) {
        this.client = client;
        this.retryStrategy = retryStrategy;
        this.bulkRetryStrategy = bulkRetryStrategy;
        this.scrollKeepAlive = scrollKeepAlive;
    }

    @Override
    public boolean isServerless() {
        return client.getConnectionContext() != null && client.getConnectionContext().isServerless();
    }

    @Override
    public Mono<Boolean> indexExists(String index) {
        var path = encode(index);
        return Mono.defer(() -> client.getAsync(path))
            .flatMap(resp -> expectStatus(resp, "Could not check index " + index,
                HttpURLConnection.HTTP_OK, HttpURLConnection.HTTP_NOT_FOUND))
            .retryWhen(retryStrategy)
            .map(resp -> resp.statusCode == HttpURLConnection.HTTP_OK)
            .doOnNext(exists -> log.atDebug().setMessage("Index {} exists: {}").addArgument(index)
                .addArgument(exists).log());
    }

    @Override
    public Mono<Void> createIndex(String index, ObjectNode mappings) {
        var body = OBJECT_MAPPER.createObjectNode();
        if (mappings != null) {
            body.set("mappings", mappings);
        }
        return Mono.defer(() -> client.putAsync(encode(index), body.toString()))
            .flatMap(resp -> expectStatus(resp, "Could not create index " + index, HttpURLConnection.HTTP_OK))
            .retryWhen(retryStrategy)
            .doOnSuccess(resp -> log.info("Created index {}", index))
            .then();
    }

    @Override
    public Mono<Void> deleteIndex(String index) {
        return Mono.defer(() -> client.deleteAsync(encode(index) + "?expand_wildcards=hidden", null))
            .flatMap(resp -> expectStatus(resp, "Could not delete index " + index,
                HttpURLConnection.HTTP_OK, HttpURLConnection.HTTP_NOT_FOUND))
            .retryWhen(retryStrategy)
            .doOnSuccess(resp -> log.info("Deleted index {}", index))
            .then();
    }

    @Override
    public Mono<Void> refresh(String index) {
        if (isServerless()) {
            return Mono.empty();
        }
        return Mono.defer(() -> client.postAsync(encode(index) + "/_refresh", null))
            .flatMap(resp -> expectStatus(resp, "Could not refresh index " + index, HttpURLConnection.HTTP_OK))
            .retryWhen(retryStrategy)
            .then();
    }

    @Override
    public Flux<JsonNode> scan(String index, List<String> sourceFields, int pageSize) {
        return Flux.usingWhen(
            Mono.fromSupplier(AtomicReference<String>::new),
            scrollId -> openScroll(index, sourceFields, pageSize)
                .expand(page -> page.hits().isEmpty() || page.scrollId() == null
                    ? Mono.<ScrollPage>empty()
                    : continueScroll(page.scrollId()))
                .doOnNext(page -> {
                    if (page.scrollId() != null) {
                        scrollId.set(page.scrollId());
                    }
                })
                .concatMapIterable(ScrollPage::hits),
            this::clearScroll
        );
    }

    private Mono<ScrollPage> openScroll(String index, List<String> sourceFields, int pageSize) {
        var body = OBJECT_MAPPER.createObjectNode();
        body.put("size", pageSize);
        var source = body.putArray("_source");
        sourceFields.forEach(source::add);
        body.putArray("sort").add("_doc");
        var path = encode(index) + "/_search?scroll=" + scrollKeepAlive + "&expand_wildcards=hidden";
        return Mono.defer(() -> client.postAsync(path, body.toString()))
            .flatMap(resp -> expectStatus(resp, "Could not scan index " + index,
                HttpURLConnection.HTTP_OK, HttpURLConnection.HTTP_NOT_FOUND))
            .retryWhen(retryStrategy)
            .map(resp -> resp.statusCode == HttpURLConnection.HTTP_NOT_FOUND
                ? new ScrollPage(null, List.of())
                : ScrollPage.parse(readTree(resp)));
    }

    private Mono<ScrollPage> continueScroll(String scrollId) {
        var body = OBJECT_MAPPER.createObjectNode()
            .put("scroll", scrollKeepAlive)
            .put("scroll_id", scrollId);
        return Mono.defer(() -> client.postAsync("_search/scroll", body.toString()))
            .flatMap(resp -> expectStatus(resp, "Could not continue scroll", HttpURLConnection.HTTP_OK))
            .retryWhen(retryStrategy)
            .map(resp -> ScrollPage.parse(readTree(resp)))
            .doOnNext(page -> log.atDebug().setMessage("Scroll page with {} hits").addArgument(page.hits()::size)
                .log());
    }

    private Mono<Void> clearScroll(AtomicReference<String> scrollId) {
        var id = scrollId.get();
        if (id == null) {
            return Mono.empty();
        }
        var body = OBJECT_MAPPER.createObjectNode();
        body.putArray("scroll_id").add(id);
        return client.deleteAsync("_search/scroll", body.toString())
            .doOnNext(resp -> {
                if (!resp.isSuccess() && resp.statusCode != HttpURLConnection.HTTP_NOT_FOUND) {
                    log.warn("Clearing scroll context returned status {}", resp.statusCode);
                }
            })
            .onErrorResume(e -> {
                // the context expires on its own after the keep-alive
                log.atWarn().setMessage("Failed to clear scroll context").setCause(e).log();
                return Mono.empty();
            })
            .then();
    }

    @Override
    public Mono<BulkResponse> bulk(List<? extends BulkOperation> operations) {
        return Mono.defer(() -> {
            log.atTrace().setMessage("Creating bulk body with {} operations").addArgument(operations::size).log();
            var body = BulkNdjson.toBulkNdjson(operations, OBJECT_MAPPER);
            return client.postNdjsonAsync("_bulk", body);
        })
            .flatMap(response -> {
                var resp = BulkResponse.from(response);
                if (isTransientStatus(resp.statusCode)) {
                    return Mono.error(new TransientFailure("Bulk request was throttled or the cluster is unavailable", resp));
                }
                if (resp.hasBadStatusCode()) {
                    return Mono.error(new OperationFailed("Bulk request failed.  Status code: " + resp.statusCode
                        + ", Response body: " + resp.bodyPreview(), resp));
                }
                if (resp.hasFailedOperations()) {
                    log.atWarn()
                        .setMessage("Bulk request of {} operations reported item errors: {}")
                        .addArgument(operations::size)
                        .addArgument(resp::bodyPreview)
                        .log();
                }
                return Mono.just(resp);
            })
            .retryWhen(bulkRetryStrategy);
    }

    @Override
    public Mono<JsonNode> getDocument(String index, String id) {
        return Mono.defer(() -> client.getAsync(encode(index) + "/_doc/" + encode(id)))
            .flatMap(resp -> expectStatus(resp, "Could not get document " + id + " from " + index,
                HttpURLConnection.HTTP_OK, HttpURLConnection.HTTP_NOT_FOUND))
            .retryWhen(retryStrategy)
            .flatMap(resp -> {
                if (resp.statusCode == HttpURLConnection.HTTP_NOT_FOUND) {
                    log.atError().setMessage("The server returned {} for document {} in {}").addArgument(resp.statusCode)
                        .addArgument(id).addArgument(index).log();
                    return Mono.error(new DocumentNotFoundException(index, id, new OperationFailed("Not found", resp)));
                }
                return Mono.just(readTree(resp));
            });
    }

    @Override
    public Mono<JsonNode> indexDocument(String index, String id, Map<String, Object> document) {
        var body = writeJson(document);
        return Mono.defer(() -> id == null
                ? client.postAsync(encode(index) + "/_doc", body)
                : client.putAsync(encode(index) + "/_doc/" + encode(id), body))
            .flatMap(resp -> expectStatus(resp, "Could not index document into " + index,
                HttpURLConnection.HTTP_OK, HttpURLConnection.HTTP_CREATED))
            .retryWhen(retryStrategy)
            .map(this::readTree);
    }

    @Override
    public Mono<JsonNode> updateDocument(String index, String id, Map<String, Object> document,
                                         Long ifSeqNo, Long ifPrimaryTerm) {
        var path = new StringBuilder(encode(index)).append("/_update/").append(encode(id));
        if (ifSeqNo != null && ifPrimaryTerm != null) {
            path.append("?if_seq_no=").append(ifSeqNo).append("&if_primary_term=").append(ifPrimaryTerm);
        }
        var body = OBJECT_MAPPER.createObjectNode();
        body.set("doc", OBJECT_MAPPER.valueToTree(document));
        return Mono.defer(() -> client.postAsync(path.toString(), body.toString()))
            .flatMap(resp -> expectStatus(resp, "Could not update document " + id + " in " + index,
                HttpURLConnection.HTTP_OK))
            .retryWhen(retryStrategy)
            .map(this::readTree);
    }

    @Override
    public Mono<JsonNode> updateDocumentByScript(String index, String id, JsonNode script) {
        var body = OBJECT_MAPPER.createObjectNode();
        body.set("script", script);
        var path = encode(index) + "/_update/" + encode(id);
        return Mono.defer(() -> client.postAsync(path, body.toString()))
            .flatMap(resp -> expectStatus(resp, "Could not run script on document " + id + " in " + index,
                HttpURLConnection.HTTP_OK))
            .retryWhen(retryStrategy)
            .map(this::readTree);
    }

    @Override
    public Mono<JsonNode> search(String index, JsonNode query, JsonNode sort, int from, int size) {
        var body = OBJECT_MAPPER.createObjectNode();
        body.set("query", query);
        if (sort != null) {
            body.set("sort", sort);
        }
        body.put("from", from);
        body.put("size", size);
        var path = encode(index) + "/_search?expand_wildcards=hidden&seq_no_primary_term=true";
        return Mono.defer(() -> client.postAsync(path, body.toString()))
            .flatMap(resp -> expectStatus(resp, "Search on " + index + " failed", HttpURLConnection.HTTP_OK))
            .doOnError(e -> log.atError().setMessage("GET {}/_search failed").addArgument(index).setCause(e).log())
            .retryWhen(retryStrategy)
            .map(this::readTree);
    }

    @Override
    public Mono<JsonNode> deleteByQuery(String index, JsonNode query) {
        var body = OBJECT_MAPPER.createObjectNode();
        body.set("query", query);
        var path = encode(index) + "/_delete_by_query?conflicts=proceed&ignore_unavailable=true";
        return Mono.defer(() -> client.postAsync(path, body.toString()))
            .flatMap(resp -> expectStatus(resp, "Delete by query on " + index + " failed", HttpURLConnection.HTTP_OK))
            .retryWhen(retryStrategy)
            .map(this::readTree);
    }

    private static Mono<HttpResponse> expectStatus(HttpResponse resp, String message, int... acceptedStatusCodes) {
        for (int accepted : acceptedStatusCodes) {
            if (resp.statusCode == accepted) {
                return Mono.just(resp);
            }
        }
        if (isTransientStatus(resp.statusCode)) {
            return Mono.error(new TransientFailure(message, resp));
        }
        return Mono.error(new OperationFailed(message + ". " + getString(resp), resp));
    }

    private JsonNode readTree(HttpResponse resp) {
        try {
            return resp.hasBody() ? OBJECT_MAPPER.readTree(resp.body) : OBJECT_MAPPER.createObjectNode();
        } catch (IOException e) {
            throw new OperationFailed("Could not parse response body", resp);
        }
    }

    private static String writeJson(Map<String, Object> document) {
        try {
            return OBJECT_MAPPER.writeValueAsString(document);
        } catch (IOException e) {
            throw new IllegalArgumentException("Document is not serializable", e);
        }
    }

    static String encode(String pathSegment) {
        return URLEncoder.encode(pathSegment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    static boolean isTransientStatus(int statusCode) {
        return TRANSIENT_STATUS_CODES.contains(statusCode);
    }

    static boolean isTransient(Throwable t) {
        return t instanceof TransientFailure || t instanceof IOException;
    }

    private static String getString(HttpResponse resp) {
        return "Response Code: "
            + resp.statusCode
            + ", Response Message: "
            + resp.statusText
            + ", Response Body: "
            + resp.bodyPreview();
    }

    private record ScrollPage(String scrollId, List<JsonNode> hits) {
        static ScrollPage parse(JsonNode response) {
            var hits = new ArrayList<JsonNode>();
            response.path("hits").path("hits").forEach(hits::add);
            var scrollId = response.path("_scroll_id");
            return new ScrollPage(scrollId.isMissingNode() || scrollId.isNull() ? null : scrollId.asText(), hits);
        }
    }

    public static class OperationFailed extends RuntimeException {
        public final transient HttpResponse response;

        public OperationFailed(String message, HttpResponse response) {
            super(message);
            this.response = response;
        }
    }

    /**
     * A failure the cluster may recover from on its own; retried by the client.
     */
    public static class TransientFailure extends OperationFailed {
        public TransientFailure(String message, HttpResponse response) {
            super(message + ". Response Code: " + response.statusCode, response);
        }
    }
}
