package com.example.ttsbatch;

/**
 * Message sent from a worker to the coordinator. Workers never touch the progress table directly.
 */
public record ProgressEvent(
        int workerId,
        Type type,
        int index,
        WorkerState state,
        String detail
) {
    public enum Type {
        STATE_CHANGED,
        UNIT_STARTED,
        UNIT_COMPLETED,
        UNIT_FAILED
    }

    public static final int NO_INDEX = -1;

    public static ProgressEvent stateChanged(int workerId, WorkerState state, String detail) {
        return new ProgressEvent(workerId, Type.STATE_CHANGED, NO_INDEX, state, detail);
    }

    public static ProgressEvent unitStarted(int workerId, int index) {
        return new ProgressEvent(workerId, Type.UNIT_STARTED, index, null, null);
    }

    public static ProgressEvent unitCompleted(int workerId, int index) {
        return new ProgressEvent(workerId, Type.UNIT_COMPLETED, index, null, null);
    }

    public static ProgressEvent unitFailed(int workerId, int index, String error) {
        return new ProgressEvent(workerId, Type.UNIT_FAILED, index, null, error);
    }
}
