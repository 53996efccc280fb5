package com.trading.hedge;

import com.trading.hedge.engine.ResultRow;

import java.util.List;

/**
 * Output of one run: the row series plus summary statistics over it.
 */
public record SimulationResult(String name, List<ResultRow> rows) {

    public SimulationResult {
        rows = List.copyOf(rows);
    }

    public int steps() {
        return rows.size();
    }

    public ResultRow last() {
        return rows.get(rows.size() - 1);
    }

    public double finalPnl() {
        return last().totalPnl();
    }

    /** Change in total P&L from the first row to the last. */
    public double pnlChange() {
        return last().totalPnl() - rows.get(0).totalPnl();
    }

    public double totalTransactionCost() {
        double sum = 0.0;
        for (ResultRow r : rows)
            sum += r.transactionCost();
        return sum;
    }

    public double totalFundingCost() {
        double sum = 0.0;
        for (ResultRow r : rows)
            sum += r.fundingCost();
        return sum;
    }

    /** Largest peak-to-trough fall in total P&L over the path. */
    public double maxDrawdown() {
        double peak = Double.NEGATIVE_INFINITY;
        double worst = 0.0;
        for (ResultRow r : rows) {
            peak = Math.max(peak, r.totalPnl());
            worst = Math.max(worst, peak - r.totalPnl());
        }
        return worst;
    }
}
