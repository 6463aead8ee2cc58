package org.opensearch.indexsync.client.bulk;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Bulk action kinds, with the number of NDJSON lines each one occupies in a request body.
 * The action name labels statistics; creates go on the wire as upserts (see {@link BulkNdjson}).
 */
@Getter
@RequiredArgsConstructor
public enum OperationType {
    CREATE("create", 2),
    UPDATE("update", 2),
    DELETE("delete", 1);

    private final String actionName;
    private final int wireEntries;
}
