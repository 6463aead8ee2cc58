package org.opensearch.indexsync.pipeline.bulk;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.opensearch.indexsync.client.BulkResponse;
import org.opensearch.indexsync.client.IndexClient;
import org.opensearch.indexsync.client.bulk.BulkNdjson;
import org.opensearch.indexsync.client.bulk.BulkOperation;
import org.opensearch.indexsync.client.bulk.CreateOperation;
import org.opensearch.indexsync.client.bulk.DeleteOperation;
import org.opensearch.indexsync.client.bulk.OperationType;
import org.opensearch.indexsync.client.bulk.UpdateOperation;
import org.opensearch.indexsync.pipeline.ir.ChannelSignal;
import org.opensearch.indexsync.pipeline.ir.StreamSource;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BulkerTest {
    private static final BulkResponse OK = new BulkResponse(200, "OK", Map.of(), "{\"errors\":false}");

    @Mock
    private IndexClient client;

    private static ChannelSignal create(int i) {
        return ChannelSignal.item(new CreateOperation("docs", "c" + i, Map.of("n", i)));
    }

    private static ChannelSignal end(StreamSource source) {
        return ChannelSignal.endOf(source);
    }

    @Test
    void batchesByWireEntriesAndCountsEveryOperation() {
        when(client.bulk(anyList())).thenReturn(Mono.just(OK));
        var signals = new ArrayList<ChannelSignal>();
        for (int i = 0; i < 5; i++) {
            signals.add(create(i));
        }
        signals.add(ChannelSignal.item(new DeleteOperation("docs", "gone")));
        signals.add(end(StreamSource.DOCUMENTS));
        signals.add(end(StreamSource.DOWNLOADS));

        StepVerifier.create(new Bulker(client, 2, 1).run(Flux.fromIterable(signals)))
            .assertNext(stats -> {
                assertEquals(5, stats.count(OperationType.CREATE));
                assertEquals(1, stats.count(OperationType.DELETE));
                assertEquals(0, stats.count(OperationType.UPDATE));
                assertEquals(3, stats.getBatchesDispatched());
                assertEquals(Map.of("create", 5L, "delete", 1L), stats.countsByActionName());
            })
            .verifyComplete();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<BulkOperation>> batches = ArgumentCaptor.forClass(List.class);
        verify(client, times(3)).bulk(batches.capture());
        batches.getAllValues().forEach(batch -> assertTrue(BulkNdjson.countWireEntries(batch) <= 4));
        assertEquals(List.of(2, 2, 2), batches.getAllValues().stream().map(List::size).toList());
    }

    @Test
    void keepsDrainingUntilBothSidesClose() {
        when(client.bulk(anyList())).thenReturn(Mono.just(OK));
        var channel = Flux.just(
            create(1),
            end(StreamSource.DOWNLOADS),
            ChannelSignal.item(new UpdateOperation("docs", "c1", Map.of("attachment", "x"))),
            end(StreamSource.DOCUMENTS));

        StepVerifier.create(new Bulker(client, 500, 1).run(channel))
            .assertNext(stats -> {
                assertEquals(2, stats.totalOperations());
                assertEquals(1, stats.getBatchesDispatched());
            })
            .verifyComplete();
    }

    @Test
    void channelEndingWithOneSideOpenIsAnError() {
        var channel = Flux.just(create(1), end(StreamSource.DOCUMENTS));

        StepVerifier.create(new Bulker(client, 500, 1).run(channel))
            .expectError(IllegalStateException.class)
            .verify();
    }

    @Test
    void repeatedEndMarkerIsAnError() {
        var channel = Flux.just(end(StreamSource.DOCUMENTS), end(StreamSource.DOCUMENTS));

        StepVerifier.create(new Bulker(client, 500, 1).run(channel))
            .expectError(IllegalStateException.class)
            .verify();

        verify(client, never()).bulk(anyList());
    }

    @Test
    void emptyChannelDispatchesNothing() {
        var channel = Flux.just(end(StreamSource.DOCUMENTS), end(StreamSource.DOWNLOADS));

        StepVerifier.create(new Bulker(client, 500, 1).run(channel))
            .assertNext(stats -> {
                assertEquals(0, stats.totalOperations());
                assertEquals(0, stats.getBatchesDispatched());
            })
            .verifyComplete();
    }

    @Test
    void dispatchFailureAbortsTheRun() {
        when(client.bulk(anyList())).thenReturn(Mono.error(new IllegalStateException("cluster gone")));
        var channel = Flux.just(create(1), end(StreamSource.DOCUMENTS), end(StreamSource.DOWNLOADS));

        StepVerifier.create(new Bulker(client, 500, 1).run(channel))
            .expectErrorMessage("cluster gone")
            .verify();
    }

    @Test
    void limitsBulkRequestsInFlight() {
        var inFlight = new AtomicInteger();
        var maxInFlight = new AtomicInteger();
        when(client.bulk(anyList())).thenAnswer(invocation -> Mono.defer(() -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            return Mono.delay(Duration.ofMillis(20))
                .thenReturn(OK)
                .doFinally(signal -> inFlight.decrementAndGet());
        }));
        var signals = new ArrayList<ChannelSignal>();
        for (int i = 0; i < 12; i++) {
            signals.add(create(i));
        }
        signals.add(end(StreamSource.DOCUMENTS));
        signals.add(end(StreamSource.DOWNLOADS));

        StepVerifier.create(new Bulker(client, 1, 2).run(Flux.fromIterable(signals)))
            .assertNext(stats -> assertEquals(12, stats.getBatchesDispatched()))
            .verifyComplete();

        assertEquals(2, maxInFlight.get());
    }

    @Test
    void countsAreExactWhenBatchesFinishInReverseOrder() {
        var calls = new AtomicInteger();
        var dispatchOrder = new ArrayList<String>();
        var completionOrder = new ArrayList<String>();
        when(client.bulk(anyList())).thenAnswer(invocation -> {
            List<BulkOperation> batch = invocation.getArgument(0);
            var first = batch.get(0).id();
            synchronized (dispatchOrder) {
                dispatchOrder.add(first);
            }
            long delayMillis = (6 - calls.getAndIncrement()) * 30L;
            return Mono.delay(Duration.ofMillis(delayMillis))
                .doOnNext(tick -> {
                    synchronized (completionOrder) {
                        completionOrder.add(first);
                    }
                })
                .thenReturn(OK);
        });
        var signals = new ArrayList<ChannelSignal>();
        for (int i = 0; i < 4; i++) {
            signals.add(create(i));
        }
        signals.add(ChannelSignal.item(new DeleteOperation("docs", "gone-1")));
        signals.add(ChannelSignal.item(new DeleteOperation("docs", "gone-2")));
        signals.add(end(StreamSource.DOWNLOADS));
        signals.add(end(StreamSource.DOCUMENTS));

        StepVerifier.create(new Bulker(client, 1, 8).run(Flux.fromIterable(signals)))
            .assertNext(stats -> {
                assertEquals(4, stats.count(OperationType.CREATE));
                assertEquals(2, stats.count(OperationType.DELETE));
                assertEquals(6, stats.totalOperations());
                assertEquals(5, stats.getBatchesDispatched());
            })
            .verifyComplete();

        verify(client, times(5)).bulk(anyList());
        assertEquals(List.of("c0", "c1", "c2", "c3", "gone-1"), dispatchOrder);
        var reversed = new ArrayList<>(dispatchOrder);
        Collections.reverse(reversed);
        assertEquals(reversed, completionOrder);
    }

    @Test
    void eachRunHasItsOwnCounters() {
        when(client.bulk(anyList())).thenReturn(Mono.just(OK));
        var bulker = new Bulker(client, 500, 1);
        var channel = Flux.just(create(1), end(StreamSource.DOCUMENTS), end(StreamSource.DOWNLOADS));

        StepVerifier.create(bulker.run(channel).then(bulker.run(channel)))
            .assertNext(stats -> assertEquals(1, stats.count(OperationType.CREATE)))
            .verifyComplete();
    }
}
