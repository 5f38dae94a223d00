package com.example.ttsbatch;

import java.time.Duration;

/**
 * Per-worker pacing, retry and budget settings shared by every session in a run.
 */
public record WorkerSettings(
        String voice,
        Duration interRequestDelay,
        int maxAttempts,
        Duration retryBackoff,
        int checkpointThreshold
) {
}
