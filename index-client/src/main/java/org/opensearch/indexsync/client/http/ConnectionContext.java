package org.opensearch.indexsync.client.http;

import java.net.URI;
import java.net.URISyntaxException;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Stores the connection context for the target Elasticsearch/OpenSearch cluster
 */
@Getter
@EqualsAndHashCode(exclude={"requestTransformer"})
@ToString(exclude={"requestTransformer"})
public class ConnectionContext {
    public enum Protocol {
        HTTP,
        HTTPS
    }

    private final URI uri;
    private final Protocol protocol;
    private final boolean insecure;
    private final RequestTransformer requestTransformer;
    private final boolean compressionSupported;
    private final boolean serverless;

    private ConnectionContext(IParams params) {
        if (params.getHost() == null) {
            throw new IllegalArgumentException("No host was found");
        }

        this.insecure = params.isInsecure();

        try {
            uri = new URI(params.getHost()); // e.g. http://localhost:9200
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL format", e);
        }

        if ("http".equals(uri.getScheme())) {
            protocol = Protocol.HTTP;
        } else if ("https".equals(uri.getScheme())) {
            protocol = Protocol.HTTPS;
        } else {
            throw new IllegalArgumentException("Invalid protocol");
        }

        if (params.getUsername() != null ^ params.getPassword() != null) {
            throw new IllegalArgumentException("Both username and password must be provided, or neither");
        }

        requestTransformer = RequestTransformer.forCredentials(params.getUsername(), params.getPassword());
        compressionSupported = params.isCompressionEnabled();
        serverless = params.isServerless();
    }

    public interface IParams {
        String getHost();

        String getUsername();

        String getPassword();

        boolean isCompressionEnabled();

        boolean isInsecure();

        /** Serverless deployments reject explicit refresh calls. */
        boolean isServerless();

        default ConnectionContext toConnectionContext() {
            return new ConnectionContext(this);
        }
    }

    @Getter
    @Builder
    public static class Params implements IParams {
        private final String host;
        private final String username;
        private final String password;
        private final boolean compressionEnabled;
        private final boolean insecure;
        private final boolean serverless;
    }
}
