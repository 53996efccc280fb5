package com.trading.hedge.engine;

/**
 * Aggregate sensitivities of a position set at one snapshot.
 * <p>
 * Purely derived: valid only for the snapshot it was computed at.
 */
public record RiskVector(double price, double delta, double gamma, double vega) {
    public static final RiskVector ZERO = new RiskVector(0.0, 0.0, 0.0, 0.0);
}
