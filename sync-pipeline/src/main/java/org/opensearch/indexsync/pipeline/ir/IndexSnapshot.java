package org.opensearch.indexsync.pipeline.ir;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The ids, and their last-seen timestamps, stored in the target index when a pass started.
 * Read-only for the whole pass.
 */
public record IndexSnapshot(Set<String> ids, Map<String, String> timestamps) {

    public IndexSnapshot {
        ids = Collections.unmodifiableSet(new LinkedHashSet<>(ids));
        timestamps = Collections.unmodifiableMap(new HashMap<>(timestamps));
    }

    public static IndexSnapshot empty() {
        return new IndexSnapshot(Set.of(), Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String id) {
        return ids.contains(id);
    }

    /**
     * True only when the document carries a timestamp identical to the stored one.
     */
    public boolean isUnchanged(String id, String timestamp) {
        return timestamp != null && Objects.equals(timestamps.get(id), timestamp);
    }

    public int size() {
        return ids.size();
    }

    public static class Builder {
        private final Set<String> ids = new LinkedHashSet<>();
        private final Map<String, String> timestamps = new HashMap<>();

        public Builder add(String id, String timestamp) {
            ids.add(id);
            if (timestamp != null) {
                timestamps.put(id, timestamp);
            }
            return this;
        }

        public IndexSnapshot build() {
            return new IndexSnapshot(ids, timestamps);
        }
    }
}
