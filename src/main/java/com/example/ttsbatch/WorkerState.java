package com.example.ttsbatch;

public enum WorkerState {
    IDLE("Idle"),
    WORKING("Working"),
    AWAITING_CHECKPOINT("Checkpoint"),
    DONE("Done"),
    FAILED("Failed");

    private final String label;

    WorkerState(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
