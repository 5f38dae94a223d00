package com.example.ttsbatch;

import java.time.Duration;
import java.util.Map;
import java.util.SortedSet;

/**
 * Outcome of a run over a set of units. Units that were never attempted are missing, not failed.
 */
public record RunSummary(
        int totalUnits,
        SortedSet<Integer> completed,
        SortedSet<Integer> failed,
        SortedSet<Integer> missing,
        Map<Integer, WorkerState> workerStates,
        Duration duration,
        boolean aborted
) {
    /**
     * True when every unit was either completed or explicitly failed.
     */
    public boolean successful() {
        return !aborted && missing.isEmpty();
    }

    public boolean fullyCompleted() {
        return successful() && failed.isEmpty();
    }

    public long failedWorkers() {
        return workerStates.values().stream().filter(state -> state == WorkerState.FAILED).count();
    }
}
