package com.example.ttsbatch;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Estimates time to completion from the completion rate over a trailing window.
 * The rate is recomputed on every call, so pauses for checkpoints are reflected quickly.
 */
public final class EtaEstimator {
    private final Clock clock;
    private final Duration window;
    private final Deque<Sample> samples = new ArrayDeque<>();

    public EtaEstimator(Clock clock, Duration window) {
        this.clock = clock;
        this.window = window;
    }

    public synchronized void record(int completed) {
        Instant now = clock.instant();
        samples.addLast(new Sample(now, completed));
        Instant horizon = now.minus(window);
        // Keep the newest sample at or before the horizon as the rate's starting point.
        while (samples.size() > 2 && !secondOldest().at().isAfter(horizon)) {
            samples.removeFirst();
        }
    }

    /**
     * Records the current count and extrapolates the recent rate over {@code remaining} units.
     * Empty when no rate can be measured yet.
     */
    public synchronized Optional<Duration> estimate(int completed, int remaining) {
        record(completed);
        if (remaining <= 0) {
            return Optional.of(Duration.ZERO);
        }
        Sample oldest = samples.peekFirst();
        Sample newest = samples.peekLast();
        long elapsedMillis = Duration.between(oldest.at(), newest.at()).toMillis();
        int delta = newest.completed() - oldest.completed();
        if (elapsedMillis <= 0 || delta <= 0) {
            return Optional.empty();
        }
        double unitsPerMilli = delta / (double) elapsedMillis;
        return Optional.of(Duration.ofMillis((long) Math.ceil(remaining / unitsPerMilli)));
    }

    private Sample secondOldest() {
        var iterator = samples.iterator();
        iterator.next();
        return iterator.next();
    }

    private record Sample(Instant at, int completed) {
    }
}
