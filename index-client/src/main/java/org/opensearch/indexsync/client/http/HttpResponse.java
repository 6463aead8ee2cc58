package org.opensearch.indexsync.client.http;

import java.util.Map;

import lombok.ToString;

/**
 * Status line, headers and UTF-8 body of one cluster response.  The body is null when the cluster sent none.
 */
@ToString
public class HttpResponse {
    /** Longest body, in characters, that {@link #bodyPreview()} returns whole. */
    public static final int BODY_PREVIEW_MAX_LENGTH = 1500;

    public final int statusCode;
    public final String statusText;
    public final Map<String, String> headers;
    public final String body;

    public HttpResponse(int statusCode, String statusText, Map<String, String> headers, String body) {
        this.statusCode = statusCode;
        this.statusText = statusText;
        this.headers = headers == null ? Map.of() : headers;
        this.body = body;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean hasBody() {
        return body != null && !body.isEmpty();
    }

    /**
     * The body for logs and error messages; long bodies keep their head and tail around a truncation marker.
     */
    public String bodyPreview() {
        if (body == null || body.length() <= BODY_PREVIEW_MAX_LENGTH) {
            return body;
        }
        int partLength = BODY_PREVIEW_MAX_LENGTH / 2;
        return body.substring(0, partLength) + "... [truncated] ..." + body.substring(body.length() - partLength);
    }
}
