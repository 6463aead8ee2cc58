package org.opensearch.indexsync.client;

/**
 * A point lookup found no document with the requested id.  Callers may treat this as recoverable.
 */
public class DocumentNotFoundException extends RuntimeException {
    public DocumentNotFoundException(String index, String id, Throwable cause) {
        super("Couldn't find document in " + index + " by id " + id, cause);
    }
}
