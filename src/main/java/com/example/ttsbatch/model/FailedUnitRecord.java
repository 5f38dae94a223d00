package com.example.ttsbatch.model;

import java.time.Instant;
import java.util.List;

/**
 * Details kept in the manifest for a unit that exhausted its send attempts.
 */
public record FailedUnitRecord(
        int index,
        int workerId,
        int attempts,
        int maxAttempts,
        Instant lastAttemptTime,
        String lastError,
        List<RetryAttempt> retryAttempts
) {
}
