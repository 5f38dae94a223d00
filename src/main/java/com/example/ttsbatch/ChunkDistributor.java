package com.example.ttsbatch;

import com.example.ttsbatch.model.WorkUnit;
import com.example.ttsbatch.model.WorkerAssignment;

import java.util.ArrayList;
import java.util.List;

/**
 * Round-robin partitioning of work across workers.
 * <p>
 * Position {@code i} goes to worker slot {@code i mod N}, so losing one worker leaves
 * gaps spread thinly over the whole range instead of one contiguous hole. The result
 * depends only on the inputs, which lets a resumed run partition its missing units the
 * same way.
 */
public final class ChunkDistributor {

    private ChunkDistributor() {
    }

    /**
     * Returns, for each of {@code workerCount} slots, the positions in {@code 0..totalUnits-1} it owns.
     */
    public static List<List<Integer>> partition(int totalUnits, int workerCount) {
        if (totalUnits < 0) {
            throw new IllegalArgumentException("totalUnits must not be negative: " + totalUnits);
        }
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1: " + workerCount);
        }
        List<List<Integer>> slots = new ArrayList<>(workerCount);
        for (int w = 0; w < workerCount; w++) {
            slots.add(new ArrayList<>(totalUnits / workerCount + 1));
        }
        for (int i = 0; i < totalUnits; i++) {
            slots.get(i % workerCount).add(i);
        }
        return slots.stream().map(List::copyOf).toList();
    }

    /**
     * Splits {@code units} across workers 1..N. Units keep their original indices, so the
     * list may be a sparse subset such as the missing units of a resumed run.
     */
    public static List<WorkerAssignment> distribute(List<WorkUnit> units, int workerCount) {
        List<List<Integer>> slots = partition(units.size(), workerCount);
        List<WorkerAssignment> assignments = new ArrayList<>(workerCount);
        for (int w = 0; w < slots.size(); w++) {
            List<WorkUnit> assigned = slots.get(w).stream().map(units::get).toList();
            assignments.add(new WorkerAssignment(w + 1, assigned));
        }
        return List.copyOf(assignments);
    }
}
