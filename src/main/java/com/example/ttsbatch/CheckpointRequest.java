package com.example.ttsbatch;

/**
 * What the operator sees when a worker pauses for a verification checkpoint.
 */
public record CheckpointRequest(
        int workerId,
        Reason reason,
        int requestsSinceCheckpoint,
        long totalRequests,
        int completedUnits,
        int assignedUnits
) {
    public enum Reason {
        THRESHOLD_REACHED,
        HARD_LIMIT
    }
}
