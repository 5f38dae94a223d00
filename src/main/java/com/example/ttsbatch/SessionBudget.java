package com.example.ttsbatch;

/**
 * Per-session count of requests issued since the last verification checkpoint.
 * <p>
 * The threshold is a policy constant held below the remote's hard quota; it is never
 * derived from observed response timing. Instances are owned by a single worker and
 * are not thread-safe.
 */
public final class SessionBudget {
    private final int checkpointThreshold;
    private int requestsSinceCheckpoint;
    private long totalRequests;

    public SessionBudget(int checkpointThreshold) {
        if (checkpointThreshold <= 0) {
            throw new IllegalArgumentException("checkpointThreshold must be positive: " + checkpointThreshold);
        }
        this.checkpointThreshold = checkpointThreshold;
    }

    /**
     * Returns true once the session has used its whole budget and must pause for a checkpoint.
     */
    public boolean shouldCheckpoint() {
        return requestsSinceCheckpoint >= checkpointThreshold;
    }

    public void recordSuccess() {
        requestsSinceCheckpoint++;
        totalRequests++;
    }

    /**
     * Starts a new budget window. The lifetime total is kept.
     */
    public void recordCheckpointCompleted() {
        requestsSinceCheckpoint = 0;
    }

    public int requestsSinceCheckpoint() {
        return requestsSinceCheckpoint;
    }

    public long totalRequests() {
        return totalRequests;
    }

    public int checkpointThreshold() {
        return checkpointThreshold;
    }
}
