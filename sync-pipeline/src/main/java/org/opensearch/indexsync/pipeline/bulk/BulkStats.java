package org.opensearch.indexsync.pipeline.bulk;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.opensearch.indexsync.client.bulk.BulkOperation;
import org.opensearch.indexsync.client.bulk.OperationType;

import lombok.Value;

/**
 * Outcome of one bulker run.  Operation counts reflect what was consumed from the channel, whether or not
 * the bulk request carrying it has completed.
 */
@Value
public class BulkStats {
    Map<OperationType, Long> operationCounts;
    long batchesDispatched;
    Duration bulkTime;

    public long count(OperationType type) {
        return operationCounts.getOrDefault(type, 0L);
    }

    public long totalOperations() {
        return operationCounts.values().stream().mapToLong(Long::longValue).sum();
    }

    /** Counts keyed by bulk action name, e.g. {@code {"create": 3, "delete": 1}}. */
    public Map<String, Long> countsByActionName() {
        var byName = new LinkedHashMap<String, Long>();
        operationCounts.forEach((type, count) -> byName.put(type.getActionName(), count));
        return byName;
    }

    static class Accumulator {
        private final Map<OperationType, AtomicLong> counts = new EnumMap<>(OperationType.class);
        private final AtomicLong batches = new AtomicLong();
        private final AtomicLong bulkMillis = new AtomicLong();

        Accumulator() {
            for (var type : OperationType.values()) {
                counts.put(type, new AtomicLong());
            }
        }

        void consumed(BulkOperation op) {
            counts.get(op.type()).incrementAndGet();
        }

        void dispatched(long elapsedMillis) {
            batches.incrementAndGet();
            bulkMillis.addAndGet(elapsedMillis);
        }

        BulkStats snapshot() {
            var result = new EnumMap<OperationType, Long>(OperationType.class);
            counts.forEach((type, count) -> {
                if (count.get() > 0) {
                    result.put(type, count.get());
                }
            });
            return new BulkStats(Collections.unmodifiableMap(result), batches.get(),
                Duration.ofMillis(bulkMillis.get()));
        }
    }
}
