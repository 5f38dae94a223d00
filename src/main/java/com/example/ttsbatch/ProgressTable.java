package com.example.ttsbatch;

import com.example.ttsbatch.model.WorkerAssignment;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Coordinator-owned table of worker progress. Mutated only by applying worker events.
 */
public final class ProgressTable {
    private final int totalUnits;
    private final Map<Integer, WorkerProgress> rows = new TreeMap<>();

    public ProgressTable(int totalUnits, List<WorkerAssignment> assignments) {
        this.totalUnits = totalUnits;
        for (WorkerAssignment assignment : assignments) {
            rows.put(assignment.workerId(), WorkerProgress.initial(assignment.workerId(), assignment.size()));
        }
    }

    /**
     * Applies one event and returns the worker's updated row.
     */
    public synchronized WorkerProgress apply(ProgressEvent event) {
        WorkerProgress current = rows.get(event.workerId());
        if (current == null) {
            throw new IllegalArgumentException("Unknown worker #" + event.workerId());
        }
        WorkerProgress updated;
        if (event.type() == ProgressEvent.Type.STATE_CHANGED) {
            updated = current.withState(event.state(), event.detail());
        } else if (event.type() == ProgressEvent.Type.UNIT_STARTED) {
            updated = current.withCurrent(event.index());
        } else if (event.type() == ProgressEvent.Type.UNIT_COMPLETED) {
            updated = current.withCompleted(event.index());
        } else {
            updated = current.withFailed(event.index());
        }
        rows.put(event.workerId(), updated);
        return updated;
    }

    public synchronized List<WorkerProgress> snapshot() {
        return List.copyOf(rows.values());
    }

    public synchronized WorkerProgress row(int workerId) {
        return rows.get(workerId);
    }

    public synchronized int completedCount() {
        return rows.values().stream().mapToInt(row -> row.completed().size()).sum();
    }

    public synchronized int failedCount() {
        return rows.values().stream().mapToInt(row -> row.failed().size()).sum();
    }

    public int totalUnits() {
        return totalUnits;
    }
}
