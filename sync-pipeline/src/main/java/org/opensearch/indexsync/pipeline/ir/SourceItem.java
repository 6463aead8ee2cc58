package org.opensearch.indexsync.pipeline.ir;

import org.opensearch.indexsync.pipeline.source.LazyDownload;

/**
 * One element of a source's output: a document and, when it has attachable content, the capability to fetch it.
 */
public record SourceItem(SourceDocument document, LazyDownload lazyDownload) {

    public static SourceItem of(SourceDocument document) {
        return new SourceItem(document, null);
    }

    public boolean hasLazyDownload() {
        return lazyDownload != null;
    }
}
