package com.trading.hedge.engine;

import com.trading.hedge.api.Instrument;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable engine settings for one run.
 * <p>
 * Absent hedge instruments are a valid configuration: the matching cascade
 * stage is simply omitted.
 */
@Value
@Builder(toBuilder = true)
public class EngineConfig {

    /** Rebalance every N steps; 1 means every step. */
    @Builder.Default
    int rehedgeInterval = 1;

    /** Short-dated option used to neutralize gamma, or null. */
    Instrument gammaHedgeInstrument;

    /** Long-dated option used to neutralize vega, or null. */
    Instrument vegaHedgeInstrument;

    @Builder.Default
    double stockSpreadBps = FrictionCostModel.DEFAULT_STOCK_SPREAD_BPS;

    @Builder.Default
    double optionSpreadBps = FrictionCostModel.DEFAULT_OPTION_SPREAD_BPS;

    public static EngineConfig defaults() {
        return builder().build();
    }

    public boolean hasGammaHedge() {
        return gammaHedgeInstrument != null;
    }

    public boolean hasVegaHedge() {
        return vegaHedgeInstrument != null;
    }

    /**
     * @throws IllegalArgumentException if any setting is out of range.
     */
    public EngineConfig validate() {
        if (rehedgeInterval < 1)
            throw new IllegalArgumentException("rehedgeInterval must be >= 1: " + rehedgeInterval);
        if (!(stockSpreadBps >= 0) || !Double.isFinite(stockSpreadBps))
            throw new IllegalArgumentException("stockSpreadBps must be non-negative: " + stockSpreadBps);
        if (!(optionSpreadBps >= 0) || !Double.isFinite(optionSpreadBps))
            throw new IllegalArgumentException("optionSpreadBps must be non-negative: " + optionSpreadBps);
        return this;
    }
}
