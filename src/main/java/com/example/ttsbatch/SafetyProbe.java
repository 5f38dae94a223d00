package com.example.ttsbatch;

import com.example.ttsbatch.model.WorkUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Small parallel trial run that detects limits enforced above the session level.
 * <p>
 * Each session should be able to reach its own checkpoint threshold. A hard-limit signal
 * well before that point means the remote counts requests across sessions (for example
 * per network address), and parallel execution would only multiply checkpoints.
 */
public final class SafetyProbe {
    private static final Logger LOGGER = LoggerFactory.getLogger(SafetyProbe.class);

    private final ParallelCoordinator coordinator;
    private final ProbeSettings settings;

    public SafetyProbe(ParallelCoordinator coordinator, ProbeSettings settings) {
        this.coordinator = coordinator;
        this.settings = settings;
    }

    /**
     * Runs the first {@code settings.units()} of {@code candidates} with {@code settings.workers()} sessions.
     * Units completed here are real progress and are recorded like any other.
     */
    public ProbeResult run(List<WorkUnit> candidates) {
        List<WorkUnit> trial = candidates.subList(0, Math.min(settings.units(), candidates.size()));
        if (trial.size() < settings.minUnits()) {
            return ProbeResult.failed("Not enough units for a safety probe (need at least "
                    + settings.minUnits() + ", have " + trial.size() + ")", null);
        }
        LOGGER.info("Safety probe: {} workers over {} units", settings.workers(), trial.size());

        AtomicBoolean earlyLimit = new AtomicBoolean();
        int earliestExpected = settings.checkpointThreshold() - settings.earlyLimitMargin();
        HardLimitPolicy detector = (workerId, budget) -> {
            if (budget.requestsSinceCheckpoint() < earliestExpected) {
                LOGGER.warn("Worker #{} was limited after only {} requests; limit is shared across sessions",
                        workerId, budget.requestsSinceCheckpoint());
                earlyLimit.set(true);
                return false;
            }
            return true;
        };

        RunSummary summary = coordinator.run(trial, settings.workers(), detector);
        if (earlyLimit.get()) {
            return ProbeResult.failed("Limit enforced above the session level; parallel mode is not safe", summary);
        }
        if (summary.aborted()) {
            return ProbeResult.failed("Safety probe aborted", summary);
        }
        if (summary.failedWorkers() > 0) {
            return ProbeResult.failed("Safety probe failed: " + summary.failedWorkers() + " worker(s) failed", summary);
        }
        return ProbeResult.passed("No limits above the session level detected", summary);
    }
}
