package com.trading.hedge.engine;

/**
 * Transaction cost from a half-spread that widens with volatility.
 * <p>
 * Logic: {@code cost = |notional| * (bps * vol / baseVol / 10000) / 2}.
 * If vol doubles from its starting level the spread doubles, so trading into a
 * crash is much more expensive than trading in calm markets. Options pay a far
 * wider base spread than the underlying.
 * <p>
 * {@code baseVol} is fixed per run and owned by this instance, so concurrent
 * runs never share it.
 */
public final class FrictionCostModel {
    public static final double DEFAULT_STOCK_SPREAD_BPS = 5.0;
    public static final double DEFAULT_OPTION_SPREAD_BPS = 100.0;

    private static final double BPS = 10_000.0;

    private final double baseVol;
    private final double stockSpreadBps;
    private final double optionSpreadBps;

    public FrictionCostModel(double baseVol) {
        this(baseVol, DEFAULT_STOCK_SPREAD_BPS, DEFAULT_OPTION_SPREAD_BPS);
    }

    public FrictionCostModel(double baseVol, double stockSpreadBps, double optionSpreadBps) {
        if (!(baseVol > 0))
            throw new IllegalArgumentException("Base vol must be positive: " + baseVol);
        if (!(stockSpreadBps >= 0) || !(optionSpreadBps >= 0))
            throw new IllegalArgumentException(
                    "Spreads must be non-negative: stock=" + stockSpreadBps + " option=" + optionSpreadBps);
        this.baseVol = baseVol;
        this.stockSpreadBps = stockSpreadBps;
        this.optionSpreadBps = optionSpreadBps;
    }

    /**
     * @param notional   Signed trade notional; only its magnitude matters.
     * @param currentVol Volatility at the time of the trade.
     * @param isOption   Whether the option spread applies.
     * @return Non-negative friction charge.
     */
    public double cost(double notional, double currentVol, boolean isOption) {
        double multiplier = currentVol / baseVol;
        double bps = isOption ? optionSpreadBps : stockSpreadBps;
        double spreadFraction = (bps * multiplier) / BPS;
        return Math.abs(notional) * spreadFraction / 2.0;
    }

    public double baseVol() {
        return baseVol;
    }

    public double stockSpreadBps() {
        return stockSpreadBps;
    }

    public double optionSpreadBps() {
        return optionSpreadBps;
    }
}
