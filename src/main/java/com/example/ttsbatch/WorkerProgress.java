package com.example.ttsbatch;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable view of one worker's progress as last reported to the coordinator.
 */
public record WorkerProgress(
        int workerId,
        int assignedUnits,
        SortedSet<Integer> completed,
        SortedSet<Integer> failed,
        Integer currentIndex,
        WorkerState state,
        String detail
) {
    public static WorkerProgress initial(int workerId, int assignedUnits) {
        return new WorkerProgress(workerId, assignedUnits, Collections.emptySortedSet(),
                Collections.emptySortedSet(), null, WorkerState.IDLE, null);
    }

    public WorkerProgress withState(WorkerState next, String nextDetail) {
        Integer current = next.isTerminal() ? null : currentIndex;
        return new WorkerProgress(workerId, assignedUnits, completed, failed, current, next, nextDetail);
    }

    public WorkerProgress withCurrent(int index) {
        return new WorkerProgress(workerId, assignedUnits, completed, failed, index, state, detail);
    }

    public WorkerProgress withCompleted(int index) {
        return new WorkerProgress(workerId, assignedUnits, add(completed, index), failed, null, state, detail);
    }

    public WorkerProgress withFailed(int index) {
        return new WorkerProgress(workerId, assignedUnits, completed, add(failed, index), null, state, detail);
    }

    public int processed() {
        return completed.size() + failed.size();
    }

    private static SortedSet<Integer> add(SortedSet<Integer> source, int index) {
        SortedSet<Integer> copy = new TreeSet<>(source);
        copy.add(index);
        return Collections.unmodifiableSortedSet(copy);
    }
}
