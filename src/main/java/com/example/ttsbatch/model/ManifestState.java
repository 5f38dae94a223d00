package com.example.ttsbatch.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Serializable manifest payload for resuming a conversion run.
 */
public record ManifestState(
        String outputDirectory,
        int totalUnits,
        List<Integer> completedIndices,
        List<Integer> failedIndices,
        Map<Integer, FailedUnitRecord> failures,
        Instant updatedAt
) {
}
