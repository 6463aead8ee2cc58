package org.opensearch.indexsync.client;

import java.net.HttpURLConnection;
import java.util.Map;
import java.util.regex.Pattern;

import org.opensearch.indexsync.client.http.HttpResponse;

public class BulkResponse extends HttpResponse {
    private static final Pattern ERRORS_TRUE_PATTERN = Pattern.compile("\"errors\"\\s*:\\s*true");

    public BulkResponse(int statusCode, String statusText, Map<String, String> headers, String body) {
        super(statusCode, statusText, headers, body);
    }

    public static BulkResponse from(HttpResponse response) {
        return new BulkResponse(response.statusCode, response.statusText, response.headers, response.body);
    }

    public boolean hasBadStatusCode() {
        return !(statusCode == HttpURLConnection.HTTP_OK || statusCode == HttpURLConnection.HTTP_CREATED);
    }

    /**
     * The _bulk response carries a top-level "errors" flag when any item failed.  Only the flag is checked,
     * the individual items are not inspected.
     */
    public boolean hasFailedOperations() {
        return body != null && ERRORS_TRUE_PATTERN.matcher(body).find();
    }
}
