package com.example.ttsbatch;

@FunctionalInterface
public interface HardLimitPolicy {
    /**
     * Decides what a worker does after a hard-limit signal: true pauses for a checkpoint
     * and retries the unit, false stops the worker.
     */
    boolean onHardLimit(int workerId, SessionBudget budget);

    /**
     * Policy used in normal runs (always checkpoint).
     */
    HardLimitPolicy CHECKPOINT = (workerId, budget) -> true;
}
