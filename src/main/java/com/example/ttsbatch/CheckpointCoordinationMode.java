package com.example.ttsbatch;

import java.util.Locale;

/**
 * How worker launches are spread out so that their checkpoints reach the operator manageably.
 */
public enum CheckpointCoordinationMode {
    /** Every worker starts at once; checkpoints tend to arrive together. */
    ALL_AT_ONCE,
    /** Worker {@code k} starts {@code k * staggerInterval} after the first. */
    STAGGERED,
    /** Workers run in fixed-size groups, one group after another. */
    BATCHED;

    public static CheckpointCoordinationMode parse(String value) {
        if (value == null || value.isBlank()) {
            return ALL_AT_ONCE;
        }
        switch (value.trim().toLowerCase(Locale.ROOT).replace('_', '-')) {
            case "all-at-once":
            case "simultaneous":
                return ALL_AT_ONCE;
            case "staggered":
                return STAGGERED;
            case "batched":
            case "sequential":
                return BATCHED;
            default:
                throw new IllegalArgumentException("Unknown checkpointCoordinationMode: " + value);
        }
    }
}
