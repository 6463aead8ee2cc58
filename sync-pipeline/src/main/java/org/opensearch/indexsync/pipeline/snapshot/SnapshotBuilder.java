package org.opensearch.indexsync.pipeline.snapshot;

import java.util.List;

import org.opensearch.indexsync.client.IndexClient;
import org.opensearch.indexsync.pipeline.ir.IndexSnapshot;
import org.opensearch.indexsync.pipeline.ir.SourceDocument;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Reads the id and timestamp of every document currently stored in an index.
 */
@Slf4j
public class SnapshotBuilder {
    static final List<String> SNAPSHOT_FIELDS = List.of(SourceDocument.ID_FIELD, SourceDocument.TIMESTAMP_FIELD);

    private final IndexClient client;
    private final int pageSize;

    public SnapshotBuilder(IndexClient client, int pageSize) {
        this.client = client;
        this.pageSize = pageSize;
    }

    /**
     * A missing index yields an empty snapshot.  Hits without an {@code id} source field fall back to their
     * {@code _id}; hits without a timestamp are recorded without one and will never be skipped.
     */
    public Mono<IndexSnapshot> buildSnapshot(String index) {
        return client.indexExists(index)
            .flatMap(exists -> {
                if (!exists) {
                    log.info("Index {} does not exist yet, starting from an empty snapshot", index);
                    return Mono.just(IndexSnapshot.empty());
                }
                return client.scan(index, SNAPSHOT_FIELDS, pageSize)
                    .collect(IndexSnapshot::builder, SnapshotBuilder::addHit)
                    .map(IndexSnapshot.Builder::build);
            })
            .elapsed()
            .doOnNext(timed -> log.atInfo().setMessage("Snapshot of {} holds {} documents, built in {}ms")
                .addArgument(index).addArgument(timed.getT2().size()).addArgument(timed.getT1()).log())
            .map(timed -> timed.getT2());
    }

    private static void addHit(IndexSnapshot.Builder builder, JsonNode hit) {
        var source = hit.path("_source");
        var idNode = source.path(SourceDocument.ID_FIELD);
        var id = idNode.isValueNode() && !idNode.isNull() ? idNode.asText() : hit.path("_id").asText(null);
        if (id == null) {
            log.atWarn().setMessage("Ignoring hit without an id: {}").addArgument(hit).log();
            return;
        }
        builder.add(id, asToken(source.path(SourceDocument.TIMESTAMP_FIELD)));
    }

    private static String asToken(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
