package com.trading.hedge.api;

import java.time.LocalDate;

/**
 * Pricing and risk capability of a tradeable instrument.
 *
 * Implementations must be pure functions of the four market inputs: no side
 * effects, no state shared between calls, and finite results for every valid
 * input (including dates on or after expiry). The hedging engine treats an
 * instrument as a black box and only ever calls these four methods, so a new
 * instrument kind plugs in without touching the rebalancing cascade.
 *
 * Conventions:
 * - price is per unit of the instrument.
 * - delta is per unit move of spot.
 * - gamma is per unit move of spot, squared.
 * - vega is per 1 vol point (0.01 absolute volatility).
 */
public interface Instrument {

    /**
     * Fair value of one unit.
     *
     * @param spot Spot price of the underlying (strictly positive).
     * @param date Valuation date.
     * @param rate Continuously compounded risk-free rate.
     * @param vol  Annualized volatility (strictly positive).
     */
    double price(double spot, LocalDate date, double rate, double vol);

    /** First derivative of price with respect to spot. */
    double delta(double spot, LocalDate date, double rate, double vol);

    /** Second derivative of price with respect to spot. */
    double gamma(double spot, LocalDate date, double rate, double vol);

    /** Sensitivity of price to a 1 vol point move. */
    double vega(double spot, LocalDate date, double rate, double vol);

    /** Human-readable label used in logs and exports. */
    default String name() {
        return getClass().getSimpleName();
    }
}
