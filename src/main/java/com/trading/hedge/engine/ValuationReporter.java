package com.trading.hedge.engine;

import com.trading.hedge.api.Instrument;
import com.trading.hedge.market.MarketSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Daily mark-to-market of the hedged book and owner of the result series.
 * <p>
 * {@code totalPnl = pvBase + pvHedges + cash}, where {@code pvHedges} values
 * the stock, gamma and vega hedges at the step's snapshot (a leg with no
 * configured instrument contributes nothing). Runs on every step regardless of
 * the rehedge gate.
 */
public final class ValuationReporter {

    /** The three components of the book's value at one snapshot. */
    public record Valuation(double pvBase, double pvHedges, double cash) {
        public double totalPnl() {
            return pvBase + pvHedges + cash;
        }
    }

    private final List<Position> basePositions;
    private final Instrument gammaInstrument;
    private final Instrument vegaInstrument;
    private final List<ResultRow> rows = new ArrayList<>();

    public ValuationReporter(List<Position> basePositions, EngineConfig config) {
        this.basePositions = List.copyOf(basePositions);
        this.gammaInstrument = config.getGammaHedgeInstrument();
        this.vegaInstrument = config.getVegaHedgeInstrument();
    }

    public Valuation value(HedgeState state, MarketSnapshot s) {
        double pvBase = PortfolioAggregator.aggregate(basePositions, s).price();

        double pvHedges = state.stockPosition() * s.spot();
        if (gammaInstrument != null)
            pvHedges += state.gammaHedgePosition() * gammaInstrument.price(s.spot(), s.date(), s.rate(), s.vol());
        if (vegaInstrument != null)
            pvHedges += state.vegaHedgePosition() * vegaInstrument.price(s.spot(), s.date(), s.rate(), s.vol());

        return new Valuation(pvBase, pvHedges, state.cash());
    }

    /**
     * Values the book and appends the step's row to the series.
     *
     * @param transactionCost Friction summed across legs this step.
     * @param fundingCost     Interest accrued this step.
     */
    public ResultRow report(MarketSnapshot s, HedgeState state, double transactionCost, double fundingCost) {
        Valuation v = value(state, s);
        ResultRow row = new ResultRow(
                s.date(),
                s.spot(),
                v.totalPnl(),
                state.stockPosition(),
                state.gammaHedgePosition(),
                state.vegaHedgePosition(),
                transactionCost,
                fundingCost,
                state.cash());
        rows.add(row);
        return row;
    }

    /** Read-only view of the rows emitted so far, in date order. */
    public List<ResultRow> rows() {
        return Collections.unmodifiableList(rows);
    }
}
