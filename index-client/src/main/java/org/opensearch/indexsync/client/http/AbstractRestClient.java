package org.opensearch.indexsync.client.http;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import reactor.core.publisher.Mono;

/**
 * Abstract base class for RestClient implementations.
 * This class prepares the common headers and exposes one method per HTTP verb used against the cluster.
 */
public abstract class AbstractRestClient {
    @Getter
    protected final ConnectionContext connectionContext;
    protected final HttpClientAdapter httpClientAdapter;

    private static final String USER_AGENT_HEADER_NAME = "User-Agent";
    private static final String CONTENT_TYPE_HEADER_NAME = "Content-Type";
    private static final String HOST_HEADER_NAME = "Host";

    private static final String USER_AGENT = "IndexSync-1.0";
    private static final String JSON_CONTENT_TYPE = "application/json";
    private static final String NDJSON_CONTENT_TYPE = "application/x-ndjson";

    protected AbstractRestClient(ConnectionContext connectionContext, HttpClientAdapter httpClientAdapter) {
        this.connectionContext = connectionContext;
        this.httpClientAdapter = httpClientAdapter;
    }

    /**
     * Gets the host header value for the connection context.
     *
     * @param connectionContext The connection context
     * @return The host header value
     */
    public static String getHostHeaderValue(ConnectionContext connectionContext) {
        String host = connectionContext.getUri().getHost();
        int port = connectionContext.getUri().getPort();
        ConnectionContext.Protocol protocol = connectionContext.getProtocol();

        if (ConnectionContext.Protocol.HTTP.equals(protocol)) {
            if (port == -1 || port == 80) {
                return host;
            }
        } else if (ConnectionContext.Protocol.HTTPS.equals(protocol)) {
            if (port == -1 || port == 443) {
                return host;
            }
        } else {
            throw new IllegalArgumentException("Unexpected protocol" + protocol);
        }
        return host + ":" + port;
    }

    /**
     * Performs an HTTP request.
     *
     * @param method The HTTP method
     * @param path The request path
     * @param body The request body
     * @param additionalHeaders Additional headers, may be null
     * @return A Mono that emits the HTTP response
     */
    public Mono<HttpResponse> asyncRequest(String method, String path, String body, Map<String, List<String>> additionalHeaders) {
        Map<String, List<String>> headers = prepareHeaders(body, additionalHeaders);
        return httpClientAdapter.request(method, path, body, headers);
    }

    /**
     * Prepares the headers for an HTTP request.
     *
     * @param body The request body
     * @param additionalHeaders Additional headers
     * @return The prepared headers
     */
    protected Map<String, List<String>> prepareHeaders(String body, Map<String, List<String>> additionalHeaders) {
        Map<String, List<String>> headers = new HashMap<>();
        headers.put(USER_AGENT_HEADER_NAME, List.of(USER_AGENT));
        var hostHeaderValue = getHostHeaderValue(connectionContext);
        headers.put(HOST_HEADER_NAME, List.of(hostHeaderValue));
        if (body != null) {
            headers.put(CONTENT_TYPE_HEADER_NAME, List.of(JSON_CONTENT_TYPE));
        }
        if (httpClientAdapter.supportsGzipCompression()) {
            HttpClientUtils.addGzipResponseHeaders(headers);
        }
        if (additionalHeaders != null) {
            additionalHeaders.forEach((key, value) -> {
                if (headers.containsKey(key.toLowerCase())) {
                    headers.put(key.toLowerCase(), value);
                } else {
                    headers.put(key, value);
                }
            });
        }
        return headers;
    }

    public Mono<HttpResponse> getAsync(String path) {
        return asyncRequest("GET", path, null, null);
    }

    public Mono<HttpResponse> postAsync(String path, String body) {
        return asyncRequest("POST", path, body, null);
    }

    /**
     * Posts a newline-delimited body, as the _bulk endpoint expects.
     */
    public Mono<HttpResponse> postNdjsonAsync(String path, String body) {
        return asyncRequest("POST", path, body, Map.of(CONTENT_TYPE_HEADER_NAME, List.of(NDJSON_CONTENT_TYPE)));
    }

    public Mono<HttpResponse> putAsync(String path, String body) {
        return asyncRequest("PUT", path, body, null);
    }

    public Mono<HttpResponse> deleteAsync(String path, String body) {
        return asyncRequest("DELETE", path, body, null);
    }
}
