package org.opensearch.indexsync.client.http;

import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * Headers and body of a request as it will go on the wire, after authentication has been applied.
 * The header map is a read-only copy.
 */
public record TransformedRequest(Map<String, List<String>> headers, Mono<ByteBuffer> body) {
    public TransformedRequest {
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static TransformedRequest unchanged(Map<String, List<String>> headers, Mono<ByteBuffer> body) {
        return new TransformedRequest(headers, body);
    }

    /** A copy with {@code name} set to the single value {@code value}, replacing any earlier values. */
    public TransformedRequest withHeader(String name, String value) {
        var newHeaders = new LinkedHashMap<>(headers);
        newHeaders.put(name, List.of(value));
        return new TransformedRequest(newHeaders, body);
    }
}
