package com.example.ttsbatch;

import com.example.ttsbatch.model.WorkerAssignment;

import java.util.function.IntFunction;

/**
 * Builds the session that will run one assignment.
 */
@FunctionalInterface
public interface WorkerFactory {
    WorkerSession create(WorkerAssignment assignment, ProgressReporter reporter, HardLimitPolicy hardLimitPolicy);

    /**
     * Each session gets the sender that {@code senders} returns for its worker id, so
     * sessions never share remote state such as cookies.
     */
    static WorkerFactory standard(WorkerSettings settings,
                                  IntFunction<? extends SpeechSender> senders,
                                  CheckpointGate gate,
                                  ManifestStore manifest,
                                  SegmentWriter segmentWriter) {
        return (assignment, reporter, policy) -> new WorkerSession(
                assignment, settings, senders.apply(assignment.workerId()),
                gate, manifest, segmentWriter, reporter, policy);
    }
}
