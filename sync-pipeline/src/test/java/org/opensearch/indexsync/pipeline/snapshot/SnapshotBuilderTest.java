package org.opensearch.indexsync.pipeline.snapshot;

import java.util.List;

import org.opensearch.indexsync.client.IndexClient;
import org.opensearch.indexsync.client.ObjectMapperFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SnapshotBuilderTest {
    private static final ObjectMapper MAPPER = ObjectMapperFactory.createDefaultMapper();

    @Mock
    private IndexClient client;

    private static JsonNode hit(String json) throws Exception {
        return MAPPER.readTree(json);
    }

    @Test
    void missingIndexGivesEmptySnapshot() {
        when(client.indexExists("docs")).thenReturn(Mono.just(false));

        StepVerifier.create(new SnapshotBuilder(client, 100).buildSnapshot("docs"))
            .assertNext(snapshot -> assertEquals(0, snapshot.size()))
            .verifyComplete();

        verify(client, never()).scan(anyString(), anyList(), anyInt());
    }

    @Test
    void readsIdsAndTimestampsFromTheScan() throws Exception {
        when(client.indexExists("docs")).thenReturn(Mono.just(true));
        when(client.scan("docs", List.of("id", "timestamp"), 100)).thenReturn(Flux.just(
            hit("{\"_id\":\"r1\",\"_source\":{\"id\":\"a\",\"timestamp\":\"T1\"}}"),
            hit("{\"_id\":\"b\",\"_source\":{\"timestamp\":\"T2\"}}"),
            hit("{\"_id\":\"c\",\"_source\":{\"id\":\"c\"}}"),
            hit("{\"_id\":\"d\",\"_source\":{\"id\":\"d\",\"timestamp\":1714564800}}")));

        StepVerifier.create(new SnapshotBuilder(client, 100).buildSnapshot("docs"))
            .assertNext(snapshot -> {
                assertEquals(List.of("a", "b", "c", "d"), List.copyOf(snapshot.ids()));
                assertTrue(snapshot.isUnchanged("a", "T1"));
                assertTrue(snapshot.isUnchanged("b", "T2"));
                assertFalse(snapshot.isUnchanged("c", null));
                assertTrue(snapshot.isUnchanged("d", "1714564800"));
            })
            .verifyComplete();
    }

    @Test
    void scanFailurePropagates() {
        when(client.indexExists("docs")).thenReturn(Mono.just(true));
        when(client.scan("docs", List.of("id", "timestamp"), 10))
            .thenReturn(Flux.error(new IllegalStateException("scroll lost")));

        StepVerifier.create(new SnapshotBuilder(client, 10).buildSnapshot("docs"))
            .expectErrorMessage("scroll lost")
            .verify();
    }
}
