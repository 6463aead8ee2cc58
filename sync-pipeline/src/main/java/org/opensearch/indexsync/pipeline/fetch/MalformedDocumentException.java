package org.opensearch.indexsync.pipeline.fetch;

/**
 * A document or attachment result that cannot be turned into an operation, typically for lack of an id.
 */
public class MalformedDocumentException extends RuntimeException {
    public MalformedDocumentException(String message) {
        super(message);
    }
}
