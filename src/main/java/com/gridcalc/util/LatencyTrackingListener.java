package com.gridcalc.util;

import com.gridcalc.api.Coordinate;
import com.gridcalc.api.EngineError;
import com.gridcalc.api.EvalOutcome;
import com.gridcalc.api.RecalcListener;
import com.gridcalc.api.Value;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A listener that tracks performance metrics for commits.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> Min, Max, Average time per recalculation pass (in
 * nanoseconds).</li>
 * <li><b>Throughput:</b> Total number of accepted and rejected commits.</li>
 * <li><b>Workload:</b> Number of cells recomputed per pass.</li>
 * </ul>
 *
 * <p>
 * Advisory cell outcomes are logged as warnings, throttled to one per second.
 */
public final class LatencyTrackingListener implements RecalcListener {
    private static final Logger log = LogManager.getLogger(LatencyTrackingListener.class);

    private final ErrorRateLimiter issueLimiter = new ErrorRateLimiter(log, 1000);
    private long recalcStartNanos, lastLatencyNanos;
    private long totalCommits, totalRejected, totalLatencyNanos, totalCellsRecomputed;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;
    private int lastCellsRecomputed;

    @Override
    public void onRecalcStart(long epoch, Coordinate target) {
        recalcStartNanos = System.nanoTime();
    }

    @Override
    public void onCellRecomputed(long epoch, Coordinate cell, Value value, long durationNanos) {
        // No-op to keep overhead minimal
    }

    @Override
    public void onCellIssue(long epoch, Coordinate cell, EvalOutcome outcome) {
        issueLimiter.warn("Commit #{}: cell {} evaluated with {}", epoch, cell, outcome);
    }

    @Override
    public void onCommitRejected(long epoch, Coordinate target, EngineError error) {
        totalRejected++;
    }

    @Override
    public void onRecalcEnd(long epoch, int n) {
        lastLatencyNanos = System.nanoTime() - recalcStartNanos;
        lastCellsRecomputed = n;
        totalCommits++;
        totalCellsRecomputed += n;
        totalLatencyNanos += lastLatencyNanos;
        if (lastLatencyNanos < minLatencyNanos)
            minLatencyNanos = lastLatencyNanos;
        if (lastLatencyNanos > maxLatencyNanos)
            maxLatencyNanos = lastLatencyNanos;
    }

    public long lastLatencyNanos() {
        return lastLatencyNanos;
    }

    public double lastLatencyMicros() {
        return lastLatencyNanos / 1000.0;
    }

    public int lastCellsRecomputed() {
        return lastCellsRecomputed;
    }

    public long totalCommits() {
        return totalCommits;
    }

    public long totalRejected() {
        return totalRejected;
    }

    public long totalCellsRecomputed() {
        return totalCellsRecomputed;
    }

    public double avgLatencyNanos() {
        return totalCommits > 0 ? (double) totalLatencyNanos / totalCommits : 0;
    }

    public double avgLatencyMicros() {
        return avgLatencyNanos() / 1000.0;
    }

    public long minLatencyNanos() {
        return minLatencyNanos == Long.MAX_VALUE ? 0 : minLatencyNanos;
    }

    public long maxLatencyNanos() {
        return maxLatencyNanos == Long.MIN_VALUE ? 0 : maxLatencyNanos;
    }

    public void reset() {
        totalCommits = 0;
        totalRejected = 0;
        totalCellsRecomputed = 0;
        totalLatencyNanos = 0;
        minLatencyNanos = Long.MAX_VALUE;
        maxLatencyNanos = Long.MIN_VALUE;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-20s | %10s | %10s | %10s | %10s%n", "Metric", "Value", "Avg (us)", "Min (us)",
                "Max (us)"));
        sb.append("------------------------------------------------------------------------\n");
        sb.append(String.format("%-20s | %10d | %10.2f | %10.2f | %10.2f%n",
                "Total Commits",
                totalCommits,
                avgLatencyMicros(),
                minLatencyNanos() / 1000.0,
                maxLatencyNanos() / 1000.0));
        sb.append(String.format("%-20s | %10d |%n", "Rejected", totalRejected));
        sb.append(String.format("%-20s | %10d |%n", "Cells Recomputed", totalCellsRecomputed));
        return sb.toString();
    }
}
