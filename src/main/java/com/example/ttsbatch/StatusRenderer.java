package com.example.ttsbatch;

import com.example.ttsbatch.model.FailedUnitRecord;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Stateless text formatting for the live dashboard and the final run report.
 */
public final class StatusRenderer {
    private static final int WIDTH = 62;
    private static final int BAR_WIDTH = 20;
    private static final String RULE = "+" + "-".repeat(WIDTH) + "+";

    public String render(List<WorkerProgress> rows, int totalUnits, String eta) {
        int completed = rows.stream().mapToInt(row -> row.completed().size()).sum();
        int failed = rows.stream().mapToInt(row -> row.failed().size()).sum();
        StringBuilder out = new StringBuilder();
        out.append(RULE).append('\n');
        out.append(line(" PARALLEL CONVERSION PROGRESS"));
        out.append(RULE).append('\n');
        out.append(line(String.format(" Total: %d | Workers: %d | Completed: %d/%d (%d%%)",
                totalUnits, rows.size(), completed, totalUnits, percent(completed, totalUnits))));
        out.append(line(String.format(" Failed: %d | ETA: %s", failed, eta)));
        out.append(RULE).append('\n');
        for (WorkerProgress row : rows) {
            String current = row.currentIndex() == null ? "" : " @" + row.currentIndex();
            out.append(line(String.format(" Worker #%2d %s %3d/%3d  %s%s",
                    row.workerId(),
                    progressBar(row.processed(), row.assignedUnits()),
                    row.completed().size(),
                    row.assignedUnits(),
                    row.state().label(),
                    current)));
        }
        out.append(RULE).append('\n');
        String waiting = rows.stream()
                .filter(row -> row.state() == WorkerState.AWAITING_CHECKPOINT)
                .map(row -> "#" + row.workerId())
                .collect(Collectors.joining(", "));
        if (!waiting.isEmpty()) {
            out.append("Workers awaiting checkpoint: ").append(waiting).append('\n');
        }
        return out.toString();
    }

    public String progressBar(int done, int total) {
        if (total <= 0) {
            return "[" + ".".repeat(BAR_WIDTH) + "]";
        }
        int filled = Math.min(BAR_WIDTH, (int) ((done / (double) total) * BAR_WIDTH));
        return "[" + "#".repeat(filled) + ".".repeat(BAR_WIDTH - filled) + "]";
    }

    public String formatEta(Optional<Duration> eta, int completed, int processed, int totalUnits) {
        if (processed >= totalUnits) {
            return "Complete!";
        }
        if (eta.isEmpty()) {
            return completed == 0 ? "Calculating..." : "Unknown";
        }
        return formatDuration(eta.get());
    }

    public String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        if (seconds < 60) {
            return seconds + " sec";
        }
        if (seconds < 3600) {
            return (seconds / 60) + " min";
        }
        return (seconds / 3600) + " hr " + ((seconds % 3600) / 60) + " min";
    }

    /**
     * Final report listing what completed, what failed permanently and what is still missing.
     */
    public String renderSummary(RunSummary summary, Map<Integer, FailedUnitRecord> failures) {
        StringBuilder out = new StringBuilder();
        out.append("=".repeat(WIDTH)).append('\n');
        out.append("CONVERSION SUMMARY").append('\n');
        out.append("=".repeat(WIDTH)).append('\n');
        out.append(String.format("Completed: %d/%d units (%d%%)%n",
                summary.completed().size(), summary.totalUnits(),
                percent(summary.completed().size(), summary.totalUnits())));
        out.append(String.format("Failed:    %d units%n", summary.failed().size()));
        out.append(String.format("Missing:   %d units%n", summary.missing().size()));
        out.append(String.format("Duration:  %d min %d sec%n",
                summary.duration().toMinutes(), summary.duration().toSecondsPart()));
        if (!summary.workerStates().isEmpty()) {
            out.append(String.format("Workers:   %d total, %d failed%n",
                    summary.workerStates().size(), summary.failedWorkers()));
        }
        if (summary.aborted()) {
            out.append("Run was aborted; resume to process the missing units.").append('\n');
        }
        for (Integer index : summary.failed()) {
            FailedUnitRecord record = failures.get(index);
            String reason = record == null ? "unknown error" : record.lastError();
            out.append(String.format("  failed unit %d: %s%n", index, reason));
        }
        out.append("=".repeat(WIDTH)).append('\n');
        return out.toString();
    }

    private static int percent(int part, int total) {
        return total <= 0 ? 0 : (int) ((part * 100L) / total);
    }

    private static String line(String content) {
        String clipped = content.length() > WIDTH ? content.substring(0, WIDTH) : content;
        return "|" + clipped + " ".repeat(WIDTH - clipped.length()) + "|\n";
    }
}
