package com.trading.hedge.engine;

/**
 * Mutable working risk view threaded through one pass of the cascade.
 * <p>
 * Each stage reads the view, trades, then folds the trade's side effects back
 * in with {@link #absorb(RiskVector, double)} so the next stage sizes against
 * the post-trade exposure.
 */
public final class RiskView {
    private double delta;
    private double gamma;
    private double vega;

    public RiskView(double delta, double gamma, double vega) {
        this.delta = delta;
        this.gamma = gamma;
        this.vega = vega;
    }

    public static RiskView of(RiskVector risk) {
        return new RiskView(risk.delta(), risk.gamma(), risk.vega());
    }

    /** Adds {@code quantity} units of an instrument with the given unit risk. */
    public void absorb(RiskVector unitRisk, double quantity) {
        delta += unitRisk.delta() * quantity;
        gamma += unitRisk.gamma() * quantity;
        vega += unitRisk.vega() * quantity;
    }

    /** Adds stock delta, one per unit held. */
    public void absorbStock(double quantity) {
        delta += quantity;
    }

    public double delta() {
        return delta;
    }

    public double gamma() {
        return gamma;
    }

    public double vega() {
        return vega;
    }

    @Override
    public String toString() {
        return String.format("RiskView[delta=%.6f, gamma=%.6f, vega=%.6f]", delta, gamma, vega);
    }
}
