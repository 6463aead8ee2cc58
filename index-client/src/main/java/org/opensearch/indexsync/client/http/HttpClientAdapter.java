package org.opensearch.indexsync.client.http;

import java.util.List;
import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * Seam between the REST client and the library that actually moves bytes over the wire.
 */
public interface HttpClientAdapter {
    /**
     * Performs an HTTP request.
     *
     * @param method The HTTP method (GET, POST, PUT, etc.)
     * @param path The request path, relative to the cluster uri
     * @param body The request body, or null if no body
     * @param headers The request headers
     * @return A Mono that emits the HTTP response
     */
    Mono<HttpResponse> request(String method, String path, String body, Map<String, List<String>> headers);

    /**
     * @return true if responses may be requested gzip-compressed
     */
    boolean supportsGzipCompression();
}
