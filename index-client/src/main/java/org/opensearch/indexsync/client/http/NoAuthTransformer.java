package org.opensearch.indexsync.client.http;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

import reactor.core.publisher.Mono;

public class NoAuthTransformer implements RequestTransformer {

    @Override
    public Mono<TransformedRequest> transform(String method, String path, Map<String, List<String>> headers,
                                              Mono<ByteBuffer> body) {
        return Mono.just(TransformedRequest.unchanged(headers, body));
    }
}
