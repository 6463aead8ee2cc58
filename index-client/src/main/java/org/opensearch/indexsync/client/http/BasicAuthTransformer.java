package org.opensearch.indexsync.client.http;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import reactor.core.publisher.Mono;

@AllArgsConstructor
public class BasicAuthTransformer implements RequestTransformer {
    private static final String AUTHORIZATION_HEADER_NAME = "Authorization";

    private final String username;
    private final String password;

    @Override
    public Mono<TransformedRequest> transform(String method, String path, Map<String, List<String>> headers,
                                              Mono<ByteBuffer> body) {
        String credentials = username + ":" + password;
        String encodedCredentials = Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
        return Mono.just(TransformedRequest.unchanged(headers, body)
            .withHeader(AUTHORIZATION_HEADER_NAME, "Basic " + encodedCredentials));
    }
}
