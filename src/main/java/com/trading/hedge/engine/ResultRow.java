package com.trading.hedge.engine;

import java.time.LocalDate;

/**
 * One line of the simulation output, emitted for every snapshot.
 *
 * @param date               Snapshot date.
 * @param spot               Spot on that date.
 * @param totalPnl           Base portfolio value + hedge value + cash.
 * @param stockPosition      Underlying hedge after the step.
 * @param gammaHedgePosition Gamma hedge after the step.
 * @param vegaHedgePosition  Vega hedge after the step.
 * @param transactionCost    Friction paid across all legs this step.
 * @param fundingCost        Interest accrued this step (negative when paid).
 * @param cash               Cash balance after the step.
 */
public record ResultRow(
        LocalDate date,
        double spot,
        double totalPnl,
        double stockPosition,
        double gammaHedgePosition,
        double vegaHedgePosition,
        double transactionCost,
        double fundingCost,
        double cash) {
}
