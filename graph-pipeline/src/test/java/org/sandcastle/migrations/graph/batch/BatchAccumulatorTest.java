package org.sandcastle.migrations.graph.batch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.sandcastle.migrations.graph.store.BulkOperationException;
import org.sandcastle.migrations.graph.store.InMemoryRecordStore;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import reactor.core.publisher.Mono;

import static org.junit.jupiter.api.Assertions.*;

class BatchAccumulatorTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private static BatchAccumulator<Map<String, Object>> accumulator(int batchSize,
                                                                    BatchAccumulator.BulkSubmitter<Map<String, Object>> submitter) {
        return new BatchAccumulator<>(batchSize, TIMEOUT, submitter, payload -> (String) payload.get("Marker"));
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 7L, 42L})
    void returnedIdsFollowSubmissionOrder(long seed) {
        var store = new InMemoryRecordStore("target");
        var accumulator = accumulator(1000, store::bulkCreate);
        var random = new Random(seed);
        var markers = IntStream.range(0, 50).mapToObj(i -> "M" + i).collect(Collectors.toList());
        Collections.shuffle(markers, random);

        for (String marker : markers) {
            var payload = new HashMap<String, Object>();
            payload.put("Marker", marker);
            payload.put("Name", Long.toHexString(random.nextLong()));
            if (random.nextBoolean()) {
                payload.put("Phone", String.valueOf(random.nextInt(1000)));
            }
            accumulator.add("Contact", payload);
        }
        var outcome = accumulator.flush("Contact");

        assertEquals(markers.size(), outcome.size());
        for (int i = 0; i < outcome.size(); i++) {
            assertEquals(markers.get(i), outcome.entries().get(i).get("Marker"));
            String createdMarker = (String) store.get("Contact", outcome.targetIds().get(i)).orElseThrow().get("Marker");
            assertEquals(markers.get(i), createdMarker);
        }
        assertEquals(0, accumulator.pendingCount("Contact"));
    }

    @Test
    void reachingTheBatchSizeFlushesAutomatically() {
        var submitted = new ArrayList<Integer>();
        var accumulator = accumulator(3, (type, batch) -> {
            submitted.add(batch.size());
            return Mono.just(batch.stream().map(p -> "T-" + p.get("Marker")).collect(Collectors.toList()));
        });

        assertTrue(accumulator.add("Account", Map.of("Marker", "a")).isEmpty());
        assertTrue(accumulator.add("Account", Map.of("Marker", "b")).isEmpty());
        var outcome = accumulator.add("Account", Map.of("Marker", "c")).orElseThrow();
        accumulator.add("Account", Map.of("Marker", "d"));

        assertEquals(List.of("T-a", "T-b", "T-c"), outcome.targetIds());
        assertEquals(List.of(3), submitted);
        assertEquals(1, accumulator.pendingCount("Account"));
        assertTrue(accumulator.isPending("Account", "d"));
        assertFalse(accumulator.isPending("Account", "a"));
    }

    @Test
    void failedFlushKeepsTheQueueForARetry() {
        var attempts = new AtomicInteger();
        var accumulator = accumulator(10, (type, batch) -> attempts.incrementAndGet() == 1
            ? Mono.error(new BulkOperationException(type, "job failed", List.of()))
            : Mono.just(batch.stream().map(p -> "T-" + p.get("Marker")).collect(Collectors.toList())));
        accumulator.add("Account", Map.of("Marker", "a"));
        accumulator.add("Account", Map.of("Marker", "b"));

        var failure = assertThrows(BatchFlushException.class, () -> accumulator.flush("Account"));
        assertEquals(2, accumulator.pendingCount("Account"));
        assertEquals(List.of(), failure.getPartialIds());

        assertEquals(List.of("T-a", "T-b"), accumulator.flush("Account").targetIds());
    }

    @Test
    void partialResultsAreCarriedPositionally() {
        var partial = new ArrayList<String>();
        partial.add("T-a");
        partial.add(null);
        partial.add("T-c");
        var accumulator = accumulator(10, (type, batch) -> Mono.error(new BulkOperationException(type, "1 of 3 rejected", partial)));
        accumulator.add("Contact", Map.of("Marker", "a"));
        accumulator.add("Contact", Map.of("Marker", "b"));
        accumulator.add("Contact", Map.of("Marker", "c"));

        var failure = assertThrows(BatchFlushException.class, () -> accumulator.flush("Contact"));

        assertTrue(failure.hasPartialIds());
        assertEquals(partial, failure.getPartialIds());
        assertEquals(3, accumulator.clear("Contact").size());
        assertEquals(0, accumulator.pendingCount("Contact"));
    }

    @Test
    void responseWithTheWrongNumberOfIdsIsAFailedFlush() {
        var accumulator = accumulator(10, (type, batch) -> Mono.just(List.of("only-one")));
        accumulator.add("Contact", Map.of("Marker", "a"));
        accumulator.add("Contact", Map.of("Marker", "b"));

        var failure = assertThrows(BatchFlushException.class, () -> accumulator.flush("Contact"));

        assertFalse(failure.hasPartialIds());
        assertEquals(2, accumulator.pendingCount("Contact"));
    }

    @Test
    void submissionThatOutlivesTheTimeoutIsAFailedFlush() {
        var accumulator = new BatchAccumulator<Map<String, Object>>(10, Duration.ofMillis(50),
            (type, batch) -> Mono.<List<String>>never(), payload -> (String) payload.get("Marker"));
        accumulator.add("Contact", Map.of("Marker", "a"));

        assertThrows(BatchFlushException.class, () -> accumulator.flush("Contact"));
        assertEquals(1, accumulator.pendingCount("Contact"));
    }

    @Test
    void emptyFlushSubmitsNothing() {
        var calls = new AtomicInteger();
        var accumulator = accumulator(10, (type, batch) -> {
            calls.incrementAndGet();
            return Mono.just(List.of());
        });

        assertTrue(accumulator.flush("Account").isEmpty());
        assertEquals(0, calls.get());
        assertTrue(accumulator.pendingTypes().isEmpty());
    }
}
