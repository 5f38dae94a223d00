package com.example.ttsbatch;

@FunctionalInterface
public interface CheckpointGate {
    /**
     * Blocks the calling worker until the operator confirms the checkpoint for it.
     * Must return promptly with {@link InterruptedException} when the worker is interrupted.
     */
    void await(CheckpointRequest request) throws InterruptedException;
}
