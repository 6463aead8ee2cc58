package org.opensearch.indexsync.client.http;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * Implementation of HttpClientAdapter using Reactor Netty.
 */
@Slf4j
public class ReactorNettyAdapter implements HttpClientAdapter {
    private final HttpClient client;
    private final ConnectionContext connectionContext;

    public ReactorNettyAdapter(ConnectionContext connectionContext, HttpClient client) {
        this.connectionContext = connectionContext;
        this.client = client;
    }

    @Override
    public Mono<HttpResponse> request(String method, String path, String body, Map<String, List<String>> headers) {
        return connectionContext.getRequestTransformer()
            .transform(method, path, headers, Mono.justOrEmpty(body)
                .map(b -> ByteBuffer.wrap(b.getBytes(StandardCharsets.UTF_8)))
            )
            .<HttpResponse>flatMap(transformedRequest ->
                client.headers(h -> transformedRequest.headers().forEach(h::add))
                .compress(HttpClientUtils.hasGzipResponseHeaders(transformedRequest.headers()))
                .request(HttpMethod.valueOf(method))
                .uri("/" + path)
                .send(transformedRequest.body().map(Unpooled::wrappedBuffer))
                .responseSingle(
                    (response, bytes) -> bytes.asString()
                        .singleOptional()
                        .map(bodyOp -> new HttpResponse(
                            response.status().code(),
                            response.status().reasonPhrase(),
                            extractHeaders(response.responseHeaders()),
                            bodyOp.orElse(null)
                            ))
                )
            )
            .doOnError(t -> log.atDebug().setMessage("{} /{} failed").addArgument(method).addArgument(path)
                .setCause(t).log());
    }

    @Override
    public boolean supportsGzipCompression() {
        return connectionContext.isCompressionSupported();
    }

    private Map<String, String> extractHeaders(HttpHeaders headers) {
        return headers.entries().stream()
            .collect(Collectors.toMap(
                Map.Entry::getKey,
                Map.Entry::getValue,
                (v1, v2) -> v1 + "," + v2
            ));
    }
}
