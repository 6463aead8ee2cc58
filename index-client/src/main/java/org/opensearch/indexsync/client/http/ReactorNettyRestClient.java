package org.opensearch.indexsync.client.http;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;

import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.tcp.SslProvider;

/**
 * Implementation of RestClient using Reactor Netty.
 */
public class ReactorNettyRestClient extends AbstractRestClient {

    public ReactorNettyRestClient(ConnectionContext connectionContext) {
        this(connectionContext, 0);
    }

    /**
     * @param maxConnections If &gt; 0, the pool is capped at this many connections.  Otherwise, Reactor's
     *                       default provider is used.
     */
    public ReactorNettyRestClient(ConnectionContext connectionContext, int maxConnections) {
        super(connectionContext, createAdapter(connectionContext, maxConnections));
    }

    private static ReactorNettyAdapter createAdapter(ConnectionContext connectionContext, int maxConnections) {
        HttpClient httpClient;

        if (maxConnections <= 0) {
            httpClient = HttpClient.create();
        } else {
            httpClient = HttpClient.create(ConnectionProvider.create("IndexSyncClient", maxConnections));
        }

        if (ConnectionContext.Protocol.HTTPS.equals(connectionContext.getProtocol())) {
            httpClient = httpClient.secure(connectionContext.isInsecure()
                ? getInsecureSslProvider()
                : SslProvider.defaultClientProvider());
        }

        httpClient = httpClient
            .baseUrl(connectionContext.getUri().toString())
            .disableRetry(false) // Enable one retry on connection reset with no delay
            .keepAlive(true);

        return new ReactorNettyAdapter(connectionContext, httpClient);
    }

    private static SslProvider getInsecureSslProvider() {
        try {
            SslContext sslContext = SslContextBuilder.forClient()
                .trustManager(InsecureTrustManagerFactory.INSTANCE)
                .build();

            return SslProvider.builder()
                .sslContext(sslContext)
                .handlerConfigurator(sslHandler -> {
                    SSLEngine engine = sslHandler.engine();
                    SSLParameters sslParameters = engine.getSSLParameters();
                    sslParameters.setEndpointIdentificationAlgorithm(null);
                    engine.setSSLParameters(sslParameters);
                })
                .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Unable to construct SslProvider", e);
        }
    }
}
