package com.example.ttsbatch;

import com.example.ttsbatch.model.WorkUnit;
import com.example.ttsbatch.model.WorkerAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one session per assignment concurrently and supervises them.
 * <p>
 * Workers report through a queue drained by a single consumer thread, which is the only
 * writer of the {@link ProgressTable}. A scheduled task renders the table periodically.
 * A failing worker is reported but never stops the others.
 */
public final class ParallelCoordinator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ParallelCoordinator.class);
    private static final ProgressEvent POISON = ProgressEvent.stateChanged(-1, WorkerState.DONE, "poison");
    private static final Duration ETA_WINDOW = Duration.ofMinutes(2);

    private final WorkerFactory workerFactory;
    private final CoordinatorSettings settings;
    private final PrintStream dashboardOut;
    private final Clock clock;
    private final StatusRenderer renderer = new StatusRenderer();

    private volatile boolean aborted;
    private volatile ExecutorService activeExecutor;

    public ParallelCoordinator(WorkerFactory workerFactory, CoordinatorSettings settings, PrintStream dashboardOut) {
        this(workerFactory, settings, dashboardOut, Clock.systemUTC());
    }

    ParallelCoordinator(WorkerFactory workerFactory,
                        CoordinatorSettings settings,
                        PrintStream dashboardOut,
                        Clock clock) {
        this.workerFactory = workerFactory;
        this.settings = settings;
        this.dashboardOut = dashboardOut;
        this.clock = clock;
    }

    /**
     * Worker count that gives each worker about one checkpoint window of units, capped at {@code maxWorkers}.
     */
    public static int optimalWorkerCount(int totalUnits, int targetUnitsPerWorker, int maxWorkers) {
        if (targetUnitsPerWorker < 1 || maxWorkers < 1) {
            throw new IllegalArgumentException("targetUnitsPerWorker and maxWorkers must be positive");
        }
        int optimal = (totalUnits + targetUnitsPerWorker - 1) / targetUnitsPerWorker;
        return Math.max(1, Math.min(optimal, maxWorkers));
    }

    public RunSummary run(List<WorkUnit> units, int workerCount) {
        return run(units, workerCount, HardLimitPolicy.CHECKPOINT);
    }

    /**
     * Distributes {@code units} over at most {@code requestedWorkers} sessions and waits for all of them.
     * The summary covers only the units passed in.
     */
    public RunSummary run(List<WorkUnit> units, int requestedWorkers, HardLimitPolicy hardLimitPolicy) {
        Instant started = clock.instant();
        int workerCount = Math.max(1, Math.min(requestedWorkers, units.size()));
        List<WorkerAssignment> assignments = ChunkDistributor.distribute(units, workerCount);
        logDistribution(assignments);

        ProgressTable table = new ProgressTable(units.size(), assignments);
        EtaEstimator eta = new EtaEstimator(clock, ETA_WINDOW);
        eta.record(0);

        BlockingQueue<ProgressEvent> events = new LinkedBlockingQueue<>();
        Thread consumer = new Thread(() -> consumeEvents(events, table), "progress-consumer");
        consumer.start();

        ScheduledExecutorService dashboard = Executors.newSingleThreadScheduledExecutor(named("dashboard", true));
        long intervalMillis = settings.dashboardInterval().toMillis();
        if (intervalMillis > 0) {
            dashboard.scheduleAtFixedRate(() -> renderDashboard(table, eta),
                    intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        }

        ExecutorService executor = Executors.newFixedThreadPool(workerCount, named("worker", false));
        activeExecutor = executor;
        boolean interrupted = false;
        try {
            launch(assignments, executor, events::add, hardLimitPolicy);
        } catch (InterruptedException ex) {
            interrupted = true;
            abort();
        }
        executor.shutdown();
        interrupted |= awaitQuietly(executor);
        activeExecutor = null;

        events.add(POISON);
        interrupted |= joinQuietly(consumer);
        dashboard.shutdownNow();
        renderDashboard(table, eta);

        RunSummary summary = summarize(units, table, started);
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return summary;
    }

    /**
     * Stops issuing new requests in every worker. Units already in flight finish their
     * current attempt before anything is marked.
     */
    public void abort() {
        boolean first = !aborted;
        aborted = true;
        ExecutorService executor = activeExecutor;
        if (executor != null) {
            if (first) {
                LOGGER.warn("Aborting run; workers stop before their next request.");
            }
            executor.shutdownNow();
        }
    }

    public boolean isAborted() {
        return aborted;
    }

    private void launch(List<WorkerAssignment> assignments,
                        ExecutorService executor,
                        ProgressReporter reporter,
                        HardLimitPolicy hardLimitPolicy) throws InterruptedException {
        CheckpointCoordinationMode mode = settings.mode();
        LOGGER.info("Launching {} workers ({})", assignments.size(), mode);
        if (mode == CheckpointCoordinationMode.BATCHED) {
            int batchSize = Math.max(1, settings.batchSize());
            for (int start = 0; start < assignments.size() && !aborted; start += batchSize) {
                List<Future<WorkerState>> batch = new ArrayList<>();
                for (WorkerAssignment assignment : assignments.subList(start, Math.min(start + batchSize, assignments.size()))) {
                    Future<WorkerState> future = submit(executor, task(assignment, reporter, hardLimitPolicy, Duration.ZERO));
                    if (future != null) {
                        batch.add(future);
                    }
                }
                awaitBatch(batch);
            }
            return;
        }
        for (int k = 0; k < assignments.size(); k++) {
            Duration delay = mode == CheckpointCoordinationMode.STAGGERED
                    ? settings.staggerInterval().multipliedBy(k)
                    : Duration.ZERO;
            submit(executor, task(assignments.get(k), reporter, hardLimitPolicy, delay));
        }
    }

    private Callable<WorkerState> task(WorkerAssignment assignment,
                                       ProgressReporter reporter,
                                       HardLimitPolicy hardLimitPolicy,
                                       Duration startDelay) {
        WorkerSession session = workerFactory.create(assignment, reporter, hardLimitPolicy);
        return () -> {
            if (!startDelay.isZero()) {
                try {
                    TimeUnit.MILLISECONDS.sleep(startDelay.toMillis());
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return session.state();
                }
            }
            return session.call();
        };
    }

    private Future<WorkerState> submit(ExecutorService executor, Callable<WorkerState> task) {
        if (aborted) {
            return null;
        }
        try {
            return executor.submit(task);
        } catch (RejectedExecutionException ex) {
            LOGGER.debug("Worker not launched; run is shutting down", ex);
            return null;
        }
    }

    private void awaitBatch(List<Future<WorkerState>> batch) throws InterruptedException {
        for (Future<WorkerState> future : batch) {
            try {
                future.get();
            } catch (ExecutionException ex) {
                LOGGER.error("Worker task ended with an exception", ex.getCause());
            } catch (CancellationException ex) {
                LOGGER.debug("Worker task cancelled", ex);
            }
        }
    }

    private void consumeEvents(BlockingQueue<ProgressEvent> queue, ProgressTable table) {
        while (true) {
            ProgressEvent event;
            try {
                event = queue.take();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                LOGGER.error("Progress consumer stopped unexpectedly", ex);
                return;
            }
            if (event == POISON) {
                return;
            }
            WorkerProgress row = table.apply(event);
            if (event.type() == ProgressEvent.Type.STATE_CHANGED && event.state() == WorkerState.FAILED
                    && WorkerSession.ABORTED.equals(event.detail())) {
                LOGGER.warn("Worker #{} stopped by abort; {} of its units are left for a later run",
                        event.workerId(), row.assignedUnits() - row.processed());
            } else if (event.type() == ProgressEvent.Type.STATE_CHANGED && event.state() == WorkerState.FAILED) {
                LOGGER.error("Worker #{} failed ({}); {} of its units are left for a later run",
                        event.workerId(), event.detail(), row.assignedUnits() - row.processed());
            } else if (event.type() == ProgressEvent.Type.UNIT_FAILED) {
                LOGGER.warn("Unit {} permanently failed on worker #{}: {}", event.index(), event.workerId(), event.detail());
            }
        }
    }

    private void renderDashboard(ProgressTable table, EtaEstimator eta) {
        try {
            int completed = table.completedCount();
            int processed = completed + table.failedCount();
            String etaText = renderer.formatEta(
                    eta.estimate(completed, table.totalUnits() - processed),
                    completed, processed, table.totalUnits());
            dashboardOut.print(renderer.render(table.snapshot(), table.totalUnits(), etaText));
            dashboardOut.flush();
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to render progress dashboard", ex);
        }
    }

    private RunSummary summarize(List<WorkUnit> units, ProgressTable table, Instant started) {
        SortedSet<Integer> completed = new TreeSet<>();
        SortedSet<Integer> failed = new TreeSet<>();
        Map<Integer, WorkerState> states = new TreeMap<>();
        for (WorkerProgress row : table.snapshot()) {
            completed.addAll(row.completed());
            failed.addAll(row.failed());
            states.put(row.workerId(), row.state());
        }
        SortedSet<Integer> missing = new TreeSet<>();
        for (WorkUnit unit : units) {
            if (!completed.contains(unit.index()) && !failed.contains(unit.index())) {
                missing.add(unit.index());
            }
        }
        RunSummary summary = new RunSummary(
                units.size(), completed, failed, missing, states,
                Duration.between(started, clock.instant()), aborted);
        LOGGER.info("Run finished: {} completed, {} failed, {} missing of {} units",
                completed.size(), failed.size(), missing.size(), units.size());
        return summary;
    }

    private void logDistribution(List<WorkerAssignment> assignments) {
        for (WorkerAssignment assignment : assignments) {
            List<Integer> indices = assignment.indices();
            LOGGER.info("Worker #{}: {} units (starting with {})",
                    assignment.workerId(), indices.size(), indices.subList(0, Math.min(3, indices.size())));
        }
    }

    private static boolean awaitQuietly(ExecutorService executor) {
        boolean interrupted = false;
        while (true) {
            try {
                if (executor.awaitTermination(1, TimeUnit.SECONDS)) {
                    return interrupted;
                }
            } catch (InterruptedException ex) {
                interrupted = true;
                executor.shutdownNow();
            }
        }
    }

    private static boolean joinQuietly(Thread thread) {
        boolean interrupted = false;
        while (true) {
            try {
                thread.join();
                return interrupted;
            } catch (InterruptedException ex) {
                interrupted = true;
            }
        }
    }

    private static ThreadFactory named(String prefix, boolean daemon) {
        AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.getAndIncrement());
            thread.setDaemon(daemon);
            return thread;
        };
    }
}
