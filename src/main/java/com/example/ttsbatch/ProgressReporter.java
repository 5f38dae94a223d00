package com.example.ttsbatch;

@FunctionalInterface
public interface ProgressReporter {
    void report(ProgressEvent event);

    static ProgressReporter noop() {
        return event -> {
        };
    }
}
