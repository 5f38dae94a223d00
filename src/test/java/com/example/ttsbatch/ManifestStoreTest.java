package com.example.ttsbatch;

import com.example.ttsbatch.model.FailedUnitRecord;
import com.example.ttsbatch.model.ManifestState;
import com.example.ttsbatch.model.RetryAttempt;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ManifestStoreTest {
    @Test
    void persistsMarksAcrossInstances() throws Exception {
        Path output = Files.createTempDirectory("manifest-output");
        Path manifest = output.resolve("manifest.json");
        ManifestStore store = new ManifestStore(manifest);
        store.initialize(output, 5, List.of(0));
        store.markCompleted(3);
        store.markFailed(failure(4, "HTTP 500"));

        ManifestStore reopened = new ManifestStore(manifest);
        ManifestState state = reopened.load().orElseThrow();

        assertEquals(5, state.totalUnits());
        assertEquals(List.of(0, 3), state.completedIndices());
        assertEquals(List.of(4), state.failedIndices());
        assertEquals("HTTP 500", state.failures().get(4).lastError());
        assertEquals(3, state.failures().get(4).retryAttempts().size());
        assertFalse(Files.list(output).anyMatch(path -> path.toString().endsWith(".tmp")));
    }

    @Test
    void completionClearsEarlierFailure() throws Exception {
        Path output = Files.createTempDirectory("manifest-output");
        ManifestStore store = new ManifestStore(output.resolve("manifest.json"));
        store.initialize(output, 3, List.of());
        store.markFailed(failure(1, "timeout"));

        store.markCompleted(1);

        ManifestState state = store.snapshot();
        assertEquals(List.of(1), state.completedIndices());
        assertTrue(state.failedIndices().isEmpty());
        assertTrue(state.failures().isEmpty());
    }

    @Test
    void failureNeverOverridesCompletion() throws Exception {
        Path output = Files.createTempDirectory("manifest-output");
        ManifestStore store = new ManifestStore(output.resolve("manifest.json"));
        store.initialize(output, 3, List.of());
        store.markCompleted(2);

        store.markFailed(failure(2, "late failure"));

        assertEquals(List.of(2), store.snapshot().completedIndices());
        assertTrue(store.snapshot().failedIndices().isEmpty());
    }

    @Test
    void concurrentMarksAreNotLost() throws Exception {
        Path output = Files.createTempDirectory("manifest-output");
        Path manifest = output.resolve("manifest.json");
        ManifestStore store = new ManifestStore(manifest);
        store.initialize(output, 200, List.of());

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int index = 0; index < 200; index++) {
                int unit = index;
                futures.add(executor.submit(() -> {
                    store.markCompleted(unit);
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        ManifestState reloaded = new ManifestStore(manifest).load().orElseThrow();
        assertEquals(IntStream.range(0, 200).boxed().toList(), reloaded.completedIndices());
    }

    @Test
    void missingManifestLoadsEmpty() throws Exception {
        Path output = Files.createTempDirectory("manifest-output");
        ManifestStore store = new ManifestStore(output.resolve("manifest.json"));

        assertTrue(store.load().isEmpty());
        assertFalse(store.isOpen());
        assertThrows(IllegalStateException.class, () -> store.markCompleted(0));
    }

    @Test
    void rejectsCorruptManifests() throws Exception {
        Path output = Files.createTempDirectory("manifest-output");
        Path manifest = output.resolve("manifest.json");

        Files.writeString(manifest, "{ not json");
        assertThrows(ManifestCorruptionException.class, () -> new ManifestStore(manifest).load());

        Files.writeString(manifest, "{\"totalUnits\":3,\"completedIndices\":[0,5],\"failedIndices\":[]}");
        assertThrows(ManifestCorruptionException.class, () -> new ManifestStore(manifest).load());

        Files.writeString(manifest, "{\"totalUnits\":3,\"completedIndices\":[1],\"failedIndices\":[1]}");
        assertThrows(ManifestCorruptionException.class, () -> new ManifestStore(manifest).load());

        Files.writeString(manifest, "{\"totalUnits\":3}");
        assertThrows(ManifestCorruptionException.class, () -> new ManifestStore(manifest).load());
    }

    @Test
    void rejectsOutOfRangeMarks() throws Exception {
        Path output = Files.createTempDirectory("manifest-output");
        ManifestStore store = new ManifestStore(output.resolve("manifest.json"));
        store.initialize(output, 2, List.of());

        assertThrows(IllegalArgumentException.class, () -> store.markCompleted(2));
        assertThrows(IllegalArgumentException.class, () -> store.markCompleted(-1));
    }

    private static FailedUnitRecord failure(int index, String error) {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        return new FailedUnitRecord(index, 1, 3, 3, now, error, List.of(
                new RetryAttempt(1, now, error),
                new RetryAttempt(2, now, error),
                new RetryAttempt(3, now, error)));
    }
}
