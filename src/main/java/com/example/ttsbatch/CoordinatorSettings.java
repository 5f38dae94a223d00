package com.example.ttsbatch;

import java.time.Duration;

public record CoordinatorSettings(
        CheckpointCoordinationMode mode,
        Duration staggerInterval,
        int batchSize,
        Duration dashboardInterval
) {
}
