package com.example.ttsbatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Operator-facing checkpoint prompt shared by all workers.
 * <p>
 * Each waiting worker gets its own banner. A single reader thread takes operator input:
 * a worker number releases that worker, a blank line releases the one that has waited
 * longest, and {@code all} releases everyone.
 */
public final class ConsoleCheckpointGate implements CheckpointGate, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConsoleCheckpointGate.class);

    private final BufferedReader input;
    private final PrintStream out;
    private final Map<Integer, CompletableFuture<Void>> waiting = new LinkedHashMap<>();
    private Thread reader;
    private boolean inputClosed;

    public ConsoleCheckpointGate(InputStream in, PrintStream out) {
        this.input = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public void await(CheckpointRequest request) throws InterruptedException {
        CompletableFuture<Void> confirmation = new CompletableFuture<>();
        synchronized (this) {
            if (inputClosed) {
                throw new IllegalStateException("Operator input is closed; worker #"
                        + request.workerId() + " cannot pass its checkpoint");
            }
            waiting.put(request.workerId(), confirmation);
            startReader();
            printBanner(request);
        }
        try {
            confirmation.get();
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Checkpoint for worker #" + request.workerId() + " was not confirmed",
                    ex.getCause());
        } finally {
            synchronized (this) {
                waiting.remove(request.workerId(), confirmation);
            }
        }
    }

    /**
     * Fails every pending wait. The reader thread is a daemon blocked on input and is left to the JVM.
     */
    @Override
    public synchronized void close() {
        inputClosed = true;
        failPending(new EOFException("Checkpoint gate closed"));
    }

    synchronized void handle(String line) {
        if (waiting.isEmpty()) {
            out.println("No worker is waiting for a checkpoint.");
            return;
        }
        if (line.isEmpty()) {
            confirm(waiting.keySet().iterator().next());
            return;
        }
        if ("all".equalsIgnoreCase(line)) {
            new ArrayList<>(waiting.keySet()).forEach(this::confirm);
            return;
        }
        try {
            int workerId = Integer.parseInt(line.startsWith("#") ? line.substring(1) : line);
            if (!waiting.containsKey(workerId)) {
                out.println("Worker #" + workerId + " is not waiting. Waiting: " + waiting.keySet());
                return;
            }
            confirm(workerId);
        } catch (NumberFormatException ex) {
            out.println("Enter a worker number, 'all', or press Enter for worker #"
                    + waiting.keySet().iterator().next() + ".");
        }
    }

    private void confirm(int workerId) {
        CompletableFuture<Void> confirmation = waiting.remove(workerId);
        if (confirmation != null) {
            out.println("Worker #" + workerId + " resumes.");
            confirmation.complete(null);
        }
    }

    private void startReader() {
        if (reader != null) {
            return;
        }
        reader = new Thread(this::readLoop, "checkpoint-input");
        reader.setDaemon(true);
        reader.start();
    }

    private void readLoop() {
        try {
            String line;
            while ((line = input.readLine()) != null) {
                handle(line.trim());
            }
        } catch (IOException ex) {
            LOGGER.warn("Operator input failed", ex);
        }
        synchronized (this) {
            inputClosed = true;
            failPending(new EOFException("Operator input closed"));
        }
    }

    private void failPending(Exception cause) {
        waiting.values().forEach(confirmation -> confirmation.completeExceptionally(cause));
        waiting.clear();
    }

    private void printBanner(CheckpointRequest request) {
        String rule = "=".repeat(62);
        out.println();
        out.println(rule);
        out.println("  WORKER #" + request.workerId() + " - VERIFICATION CHECKPOINT REQUIRED");
        out.println(rule);
        if (request.reason() == CheckpointRequest.Reason.HARD_LIMIT) {
            out.println("  The remote refused a request before the planned checkpoint.");
        }
        out.println("  Total requests:          " + request.totalRequests());
        out.println("  Requests since last:     " + request.requestsSinceCheckpoint());
        out.println("  Completed / assigned:    " + request.completedUnits() + "/" + request.assignedUnits());
        out.println("  Complete the check in session #" + request.workerId()
                + ", then type " + request.workerId() + " and press Enter.");
        out.println(rule);
        out.flush();
    }
}
