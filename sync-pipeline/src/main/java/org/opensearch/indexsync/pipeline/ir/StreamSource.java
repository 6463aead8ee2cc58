package org.opensearch.indexsync.pipeline.ir;

/**
 * The two producers writing to the operation channel.
 */
public enum StreamSource {
    DOCUMENTS,
    DOWNLOADS
}
