package com.example.ttsbatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void appliesDefaults() throws Exception {
        Path config = write("{\"unitsFile\":\"units.json\",\"endpoint\":\"http://localhost:8080/tts\"}");

        RunnerConfig loaded = new ConfigLoader().load(config);

        assertEquals(Path.of("output"), loaded.outputDirectory());
        assertEquals(Path.of("output", "manifest.json"), loaded.manifestFile());
        assertEquals(Optional.empty(), loaded.workerCount());
        assertEquals(15, loaded.maxWorkers());
        assertEquals(55, loaded.checkpointThreshold());
        assertEquals(60, loaded.hardQuota());
        assertEquals(Duration.ofMillis(2500), loaded.interRequestDelay());
        assertEquals(3, loaded.maxAttempts());
        assertEquals(CheckpointCoordinationMode.ALL_AT_ONCE, loaded.coordinationMode());
        assertEquals(ResumeMode.AUTO, loaded.resumeMode());
        assertTrue(loaded.safetyProbeEnabled());
        assertTrue(loaded.validateArtifacts());
        assertFalse(loaded.s3SyncEnabled());
        assertEquals(new ProbeSettings(2, 100, 10, 5, 55), loaded.probeSettings());
    }

    @Test
    void readsExplicitSettings() throws Exception {
        Path config = write("{"
                + "\"unitsFile\":\"in/units.json\","
                + "\"outputDirectory\":\"audio\","
                + "\"endpoint\":\"https://tts.example.com/v1/speak\","
                + "\"workerCount\":4,"
                + "\"checkpointThreshold\":40,"
                + "\"hardQuota\":45,"
                + "\"interRequestDelayMillis\":0,"
                + "\"checkpointCoordinationMode\":\"staggered\","
                + "\"staggerIntervalSeconds\":30,"
                + "\"resumeMode\":\"fresh\","
                + "\"s3SyncEnabled\":true,"
                + "\"s3Bucket\":\"tts-artifacts\","
                + "\"someFutureSetting\":true"
                + "}");

        RunnerConfig loaded = new ConfigLoader().load(config);

        assertEquals(Optional.of(4), loaded.workerCount());
        assertEquals(40, loaded.workerSettings().checkpointThreshold());
        assertEquals(Duration.ZERO, loaded.workerSettings().interRequestDelay());
        assertEquals(CheckpointCoordinationMode.STAGGERED, loaded.coordinatorSettings().mode());
        assertEquals(Duration.ofSeconds(30), loaded.coordinatorSettings().staggerInterval());
        assertEquals(ResumeMode.FRESH, loaded.resumeMode());
        assertEquals(Optional.of("tts-artifacts"), loaded.s3Bucket());
        assertEquals(Path.of("audio", "manifest.json"), loaded.manifestFile());
    }

    @Test
    void rejectsInvalidSettings() throws Exception {
        ConfigLoader loader = new ConfigLoader();

        assertThrows(IllegalArgumentException.class,
                () -> loader.load(write("{\"endpoint\":\"http://localhost\"}")));
        assertThrows(IllegalArgumentException.class,
                () -> loader.load(write("{\"unitsFile\":\"u.json\"}")));
        assertThrows(IllegalArgumentException.class,
                () -> loader.load(write("{\"unitsFile\":\"u.json\",\"endpoint\":\"http://localhost\","
                        + "\"checkpointThreshold\":60,\"hardQuota\":60}")));
        assertThrows(IllegalArgumentException.class,
                () -> loader.load(write("{\"unitsFile\":\"u.json\",\"endpoint\":\"http://localhost\","
                        + "\"workerCount\":\"many\"}")));
        assertThrows(IllegalArgumentException.class,
                () -> loader.load(write("{\"unitsFile\":\"u.json\",\"endpoint\":\"http://localhost\","
                        + "\"checkpointCoordinationMode\":\"random\"}")));
        assertThrows(IllegalArgumentException.class,
                () -> loader.load(write("{\"unitsFile\":\"u.json\",\"endpoint\":\"http://localhost\","
                        + "\"s3SyncEnabled\":true}")));
    }

    @Test
    void parsesCoordinationModeAliases() {
        assertEquals(CheckpointCoordinationMode.ALL_AT_ONCE, CheckpointCoordinationMode.parse(null));
        assertEquals(CheckpointCoordinationMode.ALL_AT_ONCE, CheckpointCoordinationMode.parse("simultaneous"));
        assertEquals(CheckpointCoordinationMode.BATCHED, CheckpointCoordinationMode.parse("SEQUENTIAL"));
        assertEquals(CheckpointCoordinationMode.ALL_AT_ONCE, CheckpointCoordinationMode.parse("all_at_once"));
    }

    @Test
    void malformedOrMissingFileIsReadError() throws Exception {
        ConfigLoader loader = new ConfigLoader();

        assertThrows(JsonProcessingException.class, () -> loader.load(write("{\"unitsFile\": ")));
        assertThrows(JsonProcessingException.class, () -> loader.load(write("[1, 2]")));
        assertThrows(IOException.class,
                () -> loader.load(Files.createTempDirectory("runner-config").resolve("absent.json")));
    }

    private static Path write(String json) throws Exception {
        Path file = Files.createTempFile("runner-config", ".json");
        Files.writeString(file, json);
        return file;
    }
}
