package com.example.ttsbatch.model;

import java.util.List;

/**
 * Ordered units handed to a single worker for one run.
 */
public record WorkerAssignment(
        int workerId,
        List<WorkUnit> units
) {
    public List<Integer> indices() {
        return units.stream().map(WorkUnit::index).toList();
    }

    public int size() {
        return units.size();
    }
}
