package org.opensearch.indexsync.client.http;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * Applied to every request right before it is sent, to add credentials.  The body publisher is passed
 * through untouched and must not be subscribed to here.
 */
@FunctionalInterface
public interface RequestTransformer {
    Mono<TransformedRequest> transform(String method, String path, Map<String, List<String>> headers,
                                       Mono<ByteBuffer> body);

    /** Basic auth when both credentials are set, otherwise requests go out as they are. */
    static RequestTransformer forCredentials(String username, String password) {
        if (username == null || password == null) {
            return new NoAuthTransformer();
        }
        return new BasicAuthTransformer(username, password);
    }
}
