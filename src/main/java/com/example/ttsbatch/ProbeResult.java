package com.example.ttsbatch;

public record ProbeResult(
        boolean passed,
        String message,
        RunSummary summary
) {
    static ProbeResult failed(String message, RunSummary summary) {
        return new ProbeResult(false, message, summary);
    }

    static ProbeResult passed(String message, RunSummary summary) {
        return new ProbeResult(true, message, summary);
    }
}
