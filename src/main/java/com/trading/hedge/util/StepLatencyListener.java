package com.trading.hedge.util;

import com.trading.hedge.api.HedgeListener;
import com.trading.hedge.engine.HedgeLeg;
import com.trading.hedge.engine.HedgeState;
import com.trading.hedge.engine.ResultRow;
import com.trading.hedge.market.MarketSnapshot;

/**
 * Tracks per-step timing and trade counts for a run.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> Min, Max, Average time per step (in nanoseconds).</li>
 * <li><b>Activity:</b> Number of hedge trades and skipped stages.</li>
 * </ul>
 */
public final class StepLatencyListener implements HedgeListener {
    private long totalSteps, totalLatencyNanos, lastLatencyNanos;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;
    private long trades, skippedStages;

    @Override
    public void onRunStart(MarketSnapshot day0, HedgeState initial) {
        // No-op
    }

    @Override
    public void onTrade(int step, HedgeLeg leg, double quantity, double price, double cost) {
        trades++;
    }

    @Override
    public void onStageSkipped(int step, HedgeLeg leg, double unitSensitivity) {
        skippedStages++;
    }

    @Override
    public void onStepEnd(int step, ResultRow row, long durationNanos) {
        lastLatencyNanos = durationNanos;
        totalSteps++;
        totalLatencyNanos += durationNanos;
        if (durationNanos < minLatencyNanos)
            minLatencyNanos = durationNanos;
        if (durationNanos > maxLatencyNanos)
            maxLatencyNanos = durationNanos;
    }

    @Override
    public void onRunEnd(int steps) {
        // No-op
    }

    public long totalSteps() {
        return totalSteps;
    }

    public long trades() {
        return trades;
    }

    public long skippedStages() {
        return skippedStages;
    }

    public long lastLatencyNanos() {
        return lastLatencyNanos;
    }

    public double avgLatencyMicros() {
        return totalSteps > 0 ? (double) totalLatencyNanos / totalSteps / 1000.0 : 0;
    }

    public long minLatencyNanos() {
        return minLatencyNanos == Long.MAX_VALUE ? 0 : minLatencyNanos;
    }

    public long maxLatencyNanos() {
        return maxLatencyNanos == Long.MIN_VALUE ? 0 : maxLatencyNanos;
    }

    public void reset() {
        totalSteps = 0;
        totalLatencyNanos = 0;
        lastLatencyNanos = 0;
        trades = 0;
        skippedStages = 0;
        minLatencyNanos = Long.MAX_VALUE;
        maxLatencyNanos = Long.MIN_VALUE;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-12s | %8s | %8s | %10s | %10s | %10s%n",
                "Metric", "Steps", "Trades", "Avg (us)", "Min (us)", "Max (us)"));
        sb.append("--------------------------------------------------------------------------\n");
        sb.append(String.format("%-12s | %8d | %8d | %10.2f | %10.2f | %10.2f%n",
                "Cascade",
                totalSteps,
                trades,
                avgLatencyMicros(),
                minLatencyNanos() / 1000.0,
                maxLatencyNanos() / 1000.0));
        return sb.toString();
    }
}
