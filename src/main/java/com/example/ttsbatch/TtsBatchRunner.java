package com.example.ttsbatch;

import com.example.ttsbatch.model.FailedUnitRecord;
import com.example.ttsbatch.model.ManifestState;
import com.example.ttsbatch.model.WorkUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Drives a conversion run: resume planning, manifest setup, the optional safety probe,
 * the parallel run, and the manifest-wide summary.
 */
public final class TtsBatchRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(TtsBatchRunner.class);
    private static final Duration ABORT_GRACE = Duration.ofSeconds(15);

    private final RunnerConfig config;
    private final ManifestStore manifestStore;
    private final ResumePlanner resumePlanner;
    private final ParallelCoordinator coordinator;
    private final SafetyProbe safetyProbe;
    private final Clock clock;
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean running;

    public TtsBatchRunner(RunnerConfig config,
                          ManifestStore manifestStore,
                          ResumePlanner resumePlanner,
                          ParallelCoordinator coordinator) {
        this(config, manifestStore, resumePlanner, coordinator, Clock.systemUTC());
    }

    TtsBatchRunner(RunnerConfig config,
                   ManifestStore manifestStore,
                   ResumePlanner resumePlanner,
                   ParallelCoordinator coordinator,
                   Clock clock) {
        this.config = config;
        this.manifestStore = manifestStore;
        this.resumePlanner = resumePlanner;
        this.coordinator = coordinator;
        this.safetyProbe = new SafetyProbe(coordinator, config.probeSettings());
        this.clock = clock;
    }

    /**
     * Converts every unit that is not yet completed and returns the state of the whole manifest.
     *
     * @throws ManifestCorruptionException if the existing manifest cannot be used for resuming
     */
    public RunSummary run(List<WorkUnit> units) throws IOException {
        return run(units, summary -> {
        });
    }

    /**
     * Same as {@link #run(List)}, handing the summary to {@code report} before a pending
     * {@link #abort()} is released.
     */
    public RunSummary run(List<WorkUnit> units, Consumer<RunSummary> report) throws IOException {
        running = true;
        try {
            RunSummary summary = convert(units);
            report.accept(summary);
            return summary;
        } finally {
            running = false;
            finished.countDown();
        }
    }

    private RunSummary convert(List<WorkUnit> units) throws IOException {
        Instant started = clock.instant();
        ResumePlan plan = config.resumeMode() == ResumeMode.FRESH
                ? resumePlanner.fresh(units)
                : resumePlanner.plan(units);
        if (plan.source() != ResumePlan.Source.MANIFEST) {
            manifestStore.initialize(config.outputDirectory(), units.size(), plan.completed());
        }
        if (plan.isComplete()) {
            LOGGER.info("All {} units are already completed; nothing to do.", units.size());
            return summarize(Map.of(), started, false);
        }

        List<WorkUnit> pending = plan.pendingUnits(units);
        int workers = resolveWorkerCount(pending.size());
        if (workers > 1 && config.safetyProbeEnabled()) {
            ProbeResult probe = safetyProbe.run(pending);
            if (probe.passed()) {
                LOGGER.info("Safety probe passed: {}", probe.message());
            } else {
                LOGGER.warn("Safety probe failed: {}. Falling back to a single worker.", probe.message());
                workers = 1;
            }
            if (coordinator.isAborted()) {
                return summarize(probe.summary() == null ? Map.of() : probe.summary().workerStates(), started, true);
            }
            pending = resumePlanner.plan(units).pendingUnits(units);
        }
        if (pending.isEmpty()) {
            return summarize(Map.of(), started, false);
        }

        LOGGER.info("Processing {} units with {} worker(s)", pending.size(), workers);
        RunSummary run = coordinator.run(pending, workers);
        return summarize(run.workerStates(), started, run.aborted());
    }

    /**
     * Stops the run and waits briefly for workers to finish their in-flight attempts and for
     * the summary to be reported.
     */
    public void abort() {
        coordinator.abort();
        if (!running) {
            return;
        }
        try {
            if (!finished.await(ABORT_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Run did not stop within {} seconds", ABORT_GRACE.toSeconds());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    public Map<Integer, FailedUnitRecord> failures() {
        return manifestStore.snapshot().failures();
    }

    int resolveWorkerCount(int pendingUnits) {
        return config.workerCount()
                .map(count -> Math.min(count, config.maxWorkers()))
                .orElseGet(() -> ParallelCoordinator.optimalWorkerCount(
                        pendingUnits, config.checkpointThreshold(), config.maxWorkers()));
    }

    private RunSummary summarize(Map<Integer, WorkerState> workerStates, Instant started, boolean aborted) {
        ManifestState state = manifestStore.snapshot();
        SortedSet<Integer> completed = new TreeSet<>(state.completedIndices());
        SortedSet<Integer> failed = new TreeSet<>(state.failedIndices());
        SortedSet<Integer> missing = new TreeSet<>();
        for (int index = 0; index < state.totalUnits(); index++) {
            if (!completed.contains(index) && !failed.contains(index)) {
                missing.add(index);
            }
        }
        return new RunSummary(state.totalUnits(), completed, failed, missing, workerStates,
                Duration.between(started, clock.instant()), aborted);
    }
}
