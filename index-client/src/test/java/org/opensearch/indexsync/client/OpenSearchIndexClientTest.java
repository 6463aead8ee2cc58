package org.opensearch.indexsync.client;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.opensearch.indexsync.client.bulk.CreateOperation;
import org.opensearch.indexsync.client.bulk.DeleteOperation;
import org.opensearch.indexsync.client.http.AbstractRestClient;
import org.opensearch.indexsync.client.http.ConnectionContext;
import org.opensearch.indexsync.client.http.HttpResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.util.retry.Retry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OpenSearchIndexClientTest {
    private static final Retry FAST_RETRY = Retry.max(2).filter(OpenSearchIndexClient::isTransient);

    @Mock
    private AbstractRestClient restClient;

    private OpenSearchIndexClient client;

    @BeforeEach
    void setUp() {
        client = new OpenSearchIndexClient(restClient, FAST_RETRY, FAST_RETRY, "1m");
    }

    private static Mono<HttpResponse> response(int status, String body) {
        return Mono.just(new HttpResponse(status, "", Map.of(), body));
    }

    @Test
    void indexExistsMapsStatusCodes() {
        when(restClient.getAsync("present")).thenReturn(response(200, "{}"));
        when(restClient.getAsync("absent")).thenReturn(response(404, "{}"));

        StepVerifier.create(client.indexExists("present")).expectNext(true).verifyComplete();
        StepVerifier.create(client.indexExists("absent")).expectNext(false).verifyComplete();
    }

    @Test
    void scanFollowsScrollUntilEmptyPageAndClearsContext() {
        when(restClient.postAsync(eq("docs/_search?scroll=1m&expand_wildcards=hidden"), anyString()))
            .thenReturn(response(200, "{\"_scroll_id\":\"s1\",\"hits\":{\"hits\":[{\"_id\":\"a\"},{\"_id\":\"b\"}]}}"));
        when(restClient.postAsync(eq("_search/scroll"), anyString()))
            .thenReturn(response(200, "{\"_scroll_id\":\"s1\",\"hits\":{\"hits\":[{\"_id\":\"c\"}]}}"))
            .thenReturn(response(200, "{\"_scroll_id\":\"s1\",\"hits\":{\"hits\":[]}}"));
        when(restClient.deleteAsync(eq("_search/scroll"), anyString())).thenReturn(response(200, "{}"));

        StepVerifier.create(client.scan("docs", List.of("id", "timestamp"), 2).map(hit -> hit.get("_id").asText()))
            .expectNext("a", "b", "c")
            .verifyComplete();

        var searchBody = ArgumentCaptor.forClass(String.class);
        verify(restClient).postAsync(eq("docs/_search?scroll=1m&expand_wildcards=hidden"), searchBody.capture());
        assertTrue(searchBody.getValue().contains("\"_source\":[\"id\",\"timestamp\"]"));
        verify(restClient, times(2)).postAsync(eq("_search/scroll"), anyString());
        verify(restClient).deleteAsync(eq("_search/scroll"), anyString());
    }

    @Test
    void scanOfMissingIndexIsEmpty() {
        when(restClient.postAsync(eq("gone/_search?scroll=1m&expand_wildcards=hidden"), anyString()))
            .thenReturn(response(404, "{}"));

        StepVerifier.create(client.scan("gone", List.of("id"), 10)).verifyComplete();

        verify(restClient, never()).deleteAsync(anyString(), anyString());
    }

    @Test
    void bulkSendsNdjsonAndReturnsResponseWithItemErrors() {
        when(restClient.postNdjsonAsync(eq("_bulk"), anyString()))
            .thenReturn(response(200, "{\"errors\":true,\"items\":[]}"));

        StepVerifier.create(client.bulk(List.of(
                new CreateOperation("docs", "1", Map.of("v", 1)),
                new DeleteOperation("docs", "2"))))
            .assertNext(resp -> assertTrue(resp.hasFailedOperations()))
            .verifyComplete();

        var body = ArgumentCaptor.forClass(String.class);
        verify(restClient).postNdjsonAsync(eq("_bulk"), body.capture());
        assertEquals(3, body.getValue().split("\n").length);
    }

    @Test
    void bulkRetriesThrottledRequests() {
        when(restClient.postNdjsonAsync(eq("_bulk"), anyString()))
            .thenReturn(response(429, "{}"))
            .thenReturn(response(200, "{\"errors\":false}"));

        StepVerifier.create(client.bulk(List.of(new DeleteOperation("docs", "1"))))
            .assertNext(resp -> assertEquals(200, resp.statusCode))
            .verifyComplete();

        verify(restClient, times(2)).postNdjsonAsync(eq("_bulk"), anyString());
    }

    @Test
    void bulkRetriesConnectionFailures() {
        when(restClient.postNdjsonAsync(eq("_bulk"), anyString()))
            .thenReturn(Mono.error(new IOException("connection reset")))
            .thenReturn(response(200, "{\"errors\":false}"));

        StepVerifier.create(client.bulk(List.of(new DeleteOperation("docs", "1"))))
            .expectNextCount(1)
            .verifyComplete();
    }

    @Test
    void bulkFailsFastOnBadRequest() {
        when(restClient.postNdjsonAsync(eq("_bulk"), anyString())).thenReturn(response(400, "{\"error\":\"bad\"}"));

        StepVerifier.create(client.bulk(List.of(new DeleteOperation("docs", "1"))))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(OpenSearchIndexClient.OperationFailed.class, e);
                assertEquals(400, ((OpenSearchIndexClient.OperationFailed) e).response.statusCode);
            })
            .verify();

        verify(restClient, times(1)).postNdjsonAsync(eq("_bulk"), anyString());
    }

    @Test
    void missingDocumentIsNotFound() {
        when(restClient.getAsync("docs/_doc/42")).thenReturn(response(404, "{\"found\":false}"));

        StepVerifier.create(client.getDocument("docs", "42"))
            .expectError(DocumentNotFoundException.class)
            .verify();
    }

    @Test
    void indexDocumentWithoutIdLetsClusterAssignOne() {
        when(restClient.postAsync(eq("docs/_doc"), anyString())).thenReturn(response(201, "{\"_id\":\"xyz\"}"));

        StepVerifier.create(client.indexDocument("docs", null, Map.of("v", 1)))
            .assertNext(resp -> assertEquals("xyz", resp.get("_id").asText()))
            .verifyComplete();
    }

    @Test
    void updateUsesOptimisticConcurrencyWhenGiven() {
        when(restClient.postAsync(eq("docs/_update/7?if_seq_no=3&if_primary_term=1"), anyString()))
            .thenReturn(response(200, "{\"result\":\"updated\"}"));

        StepVerifier.create(client.updateDocument("docs", "7", Map.of("v", 2), 3L, 1L))
            .expectNextCount(1)
            .verifyComplete();
    }

    @Test
    void scriptedUpdateWrapsScriptInRequestBody() throws IOException {
        var script = ObjectMapperFactory.createDefaultMapper().readTree(
            "{\"source\":\"ctx._source.views += params.n\",\"params\":{\"n\":1}}");
        var body = ArgumentCaptor.forClass(String.class);
        when(restClient.postAsync(eq("docs/_update/7"), anyString()))
            .thenReturn(response(200, "{\"result\":\"updated\"}"));

        StepVerifier.create(client.updateDocumentByScript("docs", "7", script))
            .assertNext(resp -> assertEquals("updated", resp.get("result").asText()))
            .verifyComplete();

        verify(restClient).postAsync(eq("docs/_update/7"), body.capture());
        var sent = ObjectMapperFactory.createDefaultMapper().readTree(body.getValue());
        assertEquals(script, sent.get("script"));
        assertEquals(1, sent.size());
    }

    @Test
    void refreshIsSkippedOnServerless() {
        var context = ConnectionContext.Params.builder()
            .host("https://serverless.example.com")
            .serverless(true)
            .build()
            .toConnectionContext();
        when(restClient.getConnectionContext()).thenReturn(context);

        StepVerifier.create(client.refresh("docs")).verifyComplete();

        verify(restClient, never()).postAsync(anyString(), eq(null));
    }

    @Test
    void pathSegmentsAreEncoded() {
        assertEquals("my%20index", OpenSearchIndexClient.encode("my index"));
        assertEquals("a%2Fb", OpenSearchIndexClient.encode("a/b"));
    }
}
