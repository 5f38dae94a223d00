package com.example.ttsbatch;

import com.example.ttsbatch.model.WorkUnit;

import java.util.List;
import java.util.SortedSet;

/**
 * Which units still need audio. {@code missing} is every index not yet completed,
 * including units that failed in an earlier run.
 */
public record ResumePlan(
        int totalUnits,
        SortedSet<Integer> completed,
        SortedSet<Integer> previouslyFailed,
        SortedSet<Integer> missing,
        Source source
) {
    public enum Source {
        MANIFEST,
        ARTIFACTS,
        FRESH
    }

    public boolean isComplete() {
        return missing.isEmpty();
    }

    /**
     * Units to run next, in original order and with their original indices.
     */
    public List<WorkUnit> pendingUnits(List<WorkUnit> units) {
        return units.stream().filter(unit -> missing.contains(unit.index())).toList();
    }
}
