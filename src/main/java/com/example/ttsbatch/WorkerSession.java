package com.example.ttsbatch;

import com.example.ttsbatch.model.FailedUnitRecord;
import com.example.ttsbatch.model.RetryAttempt;
import com.example.ttsbatch.model.WorkUnit;
import com.example.ttsbatch.model.WorkerAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * One isolated session working through its assignment in order.
 * <p>
 * State machine: {@code IDLE -> WORKING -> (AWAITING_CHECKPOINT <-> WORKING) -> DONE | FAILED}.
 * Every transition and unit outcome is reported to the coordinator as a {@link ProgressEvent}.
 */
public final class WorkerSession implements Callable<WorkerState> {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerSession.class);

    /** Failure detail of a session stopped by a run abort. */
    static final String ABORTED = "Aborted";

    private final WorkerAssignment assignment;
    private final WorkerSettings settings;
    private final SessionBudget budget;
    private final SpeechSender sender;
    private final CheckpointGate gate;
    private final ManifestStore manifest;
    private final SegmentWriter segmentWriter;
    private final ProgressReporter reporter;
    private final HardLimitPolicy hardLimitPolicy;
    private final Clock clock;

    private WorkerState state = WorkerState.IDLE;
    private int completedCount;
    private long lastSendNanos;
    private boolean sentOnce;

    public WorkerSession(WorkerAssignment assignment,
                         WorkerSettings settings,
                         SpeechSender sender,
                         CheckpointGate gate,
                         ManifestStore manifest,
                         SegmentWriter segmentWriter,
                         ProgressReporter reporter,
                         HardLimitPolicy hardLimitPolicy) {
        this(assignment, settings, sender, gate, manifest, segmentWriter, reporter, hardLimitPolicy, Clock.systemUTC());
    }

    WorkerSession(WorkerAssignment assignment,
                  WorkerSettings settings,
                  SpeechSender sender,
                  CheckpointGate gate,
                  ManifestStore manifest,
                  SegmentWriter segmentWriter,
                  ProgressReporter reporter,
                  HardLimitPolicy hardLimitPolicy,
                  Clock clock) {
        this.assignment = assignment;
        this.settings = settings;
        this.budget = new SessionBudget(settings.checkpointThreshold());
        this.sender = sender;
        this.gate = gate;
        this.manifest = manifest;
        this.segmentWriter = segmentWriter;
        this.reporter = reporter == null ? ProgressReporter.noop() : reporter;
        this.hardLimitPolicy = hardLimitPolicy == null ? HardLimitPolicy.CHECKPOINT : hardLimitPolicy;
        this.clock = clock;
    }

    /**
     * Runs the assignment to completion and returns the terminal state. Never throws:
     * unexpected errors end the session in {@link WorkerState#FAILED}.
     */
    @Override
    public WorkerState call() {
        MDC.put("worker", String.valueOf(workerId()));
        try {
            transition(WorkerState.WORKING, null);
            List<WorkUnit> units = assignment.units();
            for (int position = 0; position < units.size(); position++) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Run aborted");
                }
                WorkUnit unit = units.get(position);
                reporter.report(ProgressEvent.unitStarted(workerId(), unit.index()));
                if (!process(unit)) {
                    transition(WorkerState.FAILED, "Stopped after hard-limit signal");
                    return state;
                }
                boolean moreRemaining = position < units.size() - 1;
                if (moreRemaining && budget.shouldCheckpoint()) {
                    awaitCheckpoint(CheckpointRequest.Reason.THRESHOLD_REACHED);
                }
            }
            transition(WorkerState.DONE, null);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.info("Worker #{} stopped by run abort", workerId());
            transition(WorkerState.FAILED, ABORTED);
        } catch (Exception ex) {
            LOGGER.error("Worker #{} failed unexpectedly", workerId(), ex);
            transition(WorkerState.FAILED, ex.getClass().getSimpleName() + ": " + ex.getMessage());
        } finally {
            MDC.remove("worker");
        }
        return state;
    }

    /**
     * Sends one unit until it completes or permanently fails. Returns false when the
     * hard-limit policy asks the worker to stop.
     */
    private boolean process(WorkUnit unit) throws IOException, InterruptedException {
        List<RetryAttempt> history = new ArrayList<>();
        int attempt = 0;
        while (true) {
            pace();
            attempt++;
            try {
                byte[] audio = sender.send(unit.payload(), settings.voice());
                // The segment must be on disk before the manifest claims it.
                segmentWriter.write(unit, audio);
                budget.recordSuccess();
                manifest.markCompleted(unit.index());
                completedCount++;
                reporter.report(ProgressEvent.unitCompleted(workerId(), unit.index()));
                return true;
            } catch (HardLimitException ex) {
                LOGGER.warn("Worker #{} hit the remote limit after {} requests since checkpoint: {}",
                        workerId(), budget.requestsSinceCheckpoint(), ex.getMessage());
                if (!hardLimitPolicy.onHardLimit(workerId(), budget)) {
                    return false;
                }
                awaitCheckpoint(CheckpointRequest.Reason.HARD_LIMIT);
                attempt--;
            } catch (TransientSendException ex) {
                history.add(new RetryAttempt(attempt, clock.instant(), ex.getMessage()));
                if (attempt >= settings.maxAttempts()) {
                    recordFailure(unit, attempt, history, ex);
                    return true;
                }
                LOGGER.warn("Worker #{} unit {} failed (attempt {}/{}): {}",
                        workerId(), unit.index(), attempt, settings.maxAttempts(), ex.getMessage());
                sleep(settings.retryBackoff().toMillis());
            } catch (SendException ex) {
                throw new IllegalStateException("Unmodeled send outcome for unit " + unit.index(), ex);
            }
        }
    }

    private void recordFailure(WorkUnit unit, int attempts, List<RetryAttempt> history, Exception last)
            throws IOException {
        LOGGER.warn("Worker #{} gave up on unit {} after {} attempts", workerId(), unit.index(), attempts);
        Instant now = clock.instant();
        FailedUnitRecord record = new FailedUnitRecord(
                unit.index(),
                workerId(),
                attempts,
                settings.maxAttempts(),
                now,
                last.getMessage(),
                List.copyOf(history)
        );
        manifest.markFailed(record);
        reporter.report(ProgressEvent.unitFailed(workerId(), unit.index(), last.getMessage()));
    }

    private void awaitCheckpoint(CheckpointRequest.Reason reason) throws InterruptedException {
        transition(WorkerState.AWAITING_CHECKPOINT, reason.name());
        LOGGER.info("Worker #{} waiting for checkpoint ({}, {} requests since last)",
                workerId(), reason, budget.requestsSinceCheckpoint());
        gate.await(new CheckpointRequest(
                workerId(),
                reason,
                budget.requestsSinceCheckpoint(),
                budget.totalRequests(),
                completedCount,
                assignment.size()
        ));
        budget.recordCheckpointCompleted();
        LOGGER.info("Worker #{} checkpoint confirmed", workerId());
        transition(WorkerState.WORKING, null);
    }

    /**
     * Keeps at least the configured delay between the starts of consecutive sends.
     */
    private void pace() throws InterruptedException {
        long delayNanos = settings.interRequestDelay().toNanos();
        if (sentOnce && delayNanos > 0) {
            long waitNanos = delayNanos - (System.nanoTime() - lastSendNanos);
            if (waitNanos > 0) {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            }
        }
        lastSendNanos = System.nanoTime();
        sentOnce = true;
    }

    private void sleep(long millis) throws InterruptedException {
        if (millis > 0) {
            TimeUnit.MILLISECONDS.sleep(millis);
        } else if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Run aborted");
        }
    }

    private void transition(WorkerState next, String detail) {
        state = next;
        reporter.report(ProgressEvent.stateChanged(workerId(), next, detail));
    }

    public int workerId() {
        return assignment.workerId();
    }

    public WorkerState state() {
        return state;
    }

    SessionBudget budget() {
        return budget;
    }
}
