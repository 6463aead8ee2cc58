package org.opensearch.indexsync.pipeline.fetch;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FetchStats {
    long created;
    long updated;
    long skipped;
    long deleted;
    long attachmentsExtracted;
}
