package com.trading.hedge.market;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Market state for one simulation date.
 *
 * @param date         Valuation date.
 * @param spot         Spot price of the underlying, strictly positive.
 * @param vol          Annualized volatility, strictly positive.
 * @param rate         Risk-free (SOFR) rate.
 * @param creditSpread Desk funding spread over the risk-free rate, non-negative.
 */
public record MarketSnapshot(LocalDate date, double spot, double vol, double rate, double creditSpread) {

    public MarketSnapshot {
        Objects.requireNonNull(date, "date");
        if (!(spot > 0) || !Double.isFinite(spot))
            throw new IllegalArgumentException("Spot must be positive and finite: " + spot + " on " + date);
        if (!(vol > 0) || !Double.isFinite(vol))
            throw new IllegalArgumentException("Vol must be positive and finite: " + vol + " on " + date);
        if (!Double.isFinite(rate))
            throw new IllegalArgumentException("Rate must be finite on " + date);
        if (!(creditSpread >= 0) || !Double.isFinite(creditSpread))
            throw new IllegalArgumentException(
                    "Credit spread must be non-negative and finite: " + creditSpread + " on " + date);
    }
}
