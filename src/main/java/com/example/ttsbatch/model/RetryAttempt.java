package com.example.ttsbatch.model;

import java.time.Instant;

public record RetryAttempt(
        int attempt,
        Instant timestamp,
        String error
) {
}
