package com.example.ttsbatch;

/**
 * Fixed policy for the pre-flight trial. Independent of the size of the real run.
 */
public record ProbeSettings(
        int workers,
        int units,
        int minUnits,
        int earlyLimitMargin,
        int checkpointThreshold
) {
}
