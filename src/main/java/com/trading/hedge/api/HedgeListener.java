package com.trading.hedge.api;

import com.trading.hedge.engine.HedgeLeg;
import com.trading.hedge.engine.HedgeState;
import com.trading.hedge.engine.ResultRow;
import com.trading.hedge.market.MarketSnapshot;

/**
 * Observability interface for monitoring a hedging run.
 *
 * Implementations can be registered with the simulation to receive callbacks
 * while the rebalancing cascade executes. This is the primary mechanism for:
 *
 * - Auditing: recording every hedge trade with its friction charge.
 * - Debugging: seeing which stages were skipped and why.
 * - Profiling: measuring how long each step takes.
 *
 * Callbacks run on the simulation thread inside the step loop. Keep them
 * lightweight; a listener that throws is isolated and logged by
 * {@link com.trading.hedge.util.CompositeHedgeListener}.
 */
public interface HedgeListener {

    /**
     * Called once after Day-0 neutralization has established the initial hedges.
     *
     * @param day0    The snapshot used for neutralization.
     * @param initial The ledger state after the Day-0 hedges were put on.
     */
    void onRunStart(MarketSnapshot day0, HedgeState initial);

    /**
     * Called after a hedge trade has been settled against the ledger.
     *
     * @param step     Zero-based step index.
     * @param leg      Which hedge leg traded.
     * @param quantity Signed quantity traded (net rebalancing amount).
     * @param price    Unit price the trade settled at.
     * @param cost     Friction cost charged for the trade.
     */
    void onTrade(int step, HedgeLeg leg, double quantity, double price, double cost);

    /**
     * Called when a configured option hedge stage could not trade because the
     * hedge instrument's unit sensitivity was within epsilon of zero.
     *
     * @param step            Zero-based step index (-1 during Day-0).
     * @param leg             The skipped leg.
     * @param unitSensitivity The degenerate unit gamma or vega.
     */
    void onStageSkipped(int step, HedgeLeg leg, double unitSensitivity);

    /**
     * Called after a step has been valued and its result row emitted.
     *
     * @param step          Zero-based step index.
     * @param row           The emitted row.
     * @param durationNanos Wall-clock time spent in the step.
     */
    void onStepEnd(int step, ResultRow row, long durationNanos);

    /**
     * Called when the feed is exhausted.
     *
     * @param steps Number of steps processed.
     */
    void onRunEnd(int steps);
}
