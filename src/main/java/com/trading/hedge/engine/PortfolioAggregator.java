package com.trading.hedge.engine;

import com.trading.hedge.api.Instrument;
import com.trading.hedge.market.MarketSnapshot;

/**
 * Sums price and Greeks across a weighted collection of positions.
 * <p>
 * Stateless and side-effect free. Callers assemble whichever position set a
 * cascade stage needs (base only, base plus hedges) and aggregate it against
 * the current snapshot. Nothing is cached.
 */
public final class PortfolioAggregator {
    private PortfolioAggregator() {
        // Utility class
    }

    /**
     * @return Sum of {@code quantity * metric} for every position; all-zero for
     *         an empty set.
     */
    public static RiskVector aggregate(Iterable<Position> positions, MarketSnapshot snapshot) {
        double price = 0.0, delta = 0.0, gamma = 0.0, vega = 0.0;
        for (Position p : positions) {
            RiskVector unit = unitRisk(p.instrument(), snapshot);
            double qty = p.quantity();
            price += unit.price() * qty;
            delta += unit.delta() * qty;
            gamma += unit.gamma() * qty;
            vega += unit.vega() * qty;
        }
        return new RiskVector(price, delta, gamma, vega);
    }

    /** Price and Greeks of a single unit of the instrument. */
    public static RiskVector unitRisk(Instrument inst, MarketSnapshot s) {
        return new RiskVector(
                inst.price(s.spot(), s.date(), s.rate(), s.vol()),
                inst.delta(s.spot(), s.date(), s.rate(), s.vol()),
                inst.gamma(s.spot(), s.date(), s.rate(), s.vol()),
                inst.vega(s.spot(), s.date(), s.rate(), s.vol()));
    }
}
