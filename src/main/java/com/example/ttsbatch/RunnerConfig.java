package com.example.ttsbatch;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable runtime settings for a conversion run.
 */
public record RunnerConfig(
        Path unitsFile,
        Path outputDirectory,
        Path manifestFile,
        URI endpoint,
        String voice,
        Duration requestTimeout,
        Optional<Integer> workerCount,
        int maxWorkers,
        int checkpointThreshold,
        int hardQuota,
        Duration interRequestDelay,
        int maxAttempts,
        Duration retryBackoff,
        CheckpointCoordinationMode coordinationMode,
        Duration staggerInterval,
        int batchSize,
        boolean safetyProbeEnabled,
        int probeWorkers,
        int probeUnits,
        int probeMinUnits,
        int probeEarlyLimitMargin,
        Duration dashboardInterval,
        boolean validateArtifacts,
        ResumeMode resumeMode,
        boolean s3SyncEnabled,
        Optional<String> s3Bucket,
        Optional<String> s3Prefix,
        Optional<String> s3Region
) {
    public WorkerSettings workerSettings() {
        return new WorkerSettings(voice, interRequestDelay, maxAttempts, retryBackoff, checkpointThreshold);
    }

    public CoordinatorSettings coordinatorSettings() {
        return new CoordinatorSettings(coordinationMode, staggerInterval, batchSize, dashboardInterval);
    }

    public ProbeSettings probeSettings() {
        return new ProbeSettings(probeWorkers, probeUnits, probeMinUnits, probeEarlyLimitMargin, checkpointThreshold);
    }
}
