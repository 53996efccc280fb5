package com.trading.hedge.market;

/**
 * Library of preset stress narratives mimicking well-known market dislocations.
 */
public enum StressScenario {
    /** Bear steepener: Fed threatens to stop buying, repo/credit spreads widen 50bp. */
    TAPER_TANTRUM_2013(20, -0.05, 1.5, 0.0000, 0.0050),
    /** Growth and inflation expectations rise, equities rally, spreads tighten. */
    TRUMP_REFLATION_2016(20, 0.10, 0.0, 0.0000, -0.0010),
    /** Reserve scarcity: SOFR spikes violently, spreads blow out 300bp. */
    REPO_CRISIS_2019(5, -0.02, 2.0, 0.0500, 0.0300),
    /** Dash for cash: equities crash 30%, vol explodes, rates cut to zero. */
    COVID_CRASH_2020(20, -0.30, 4.0, -0.0150, 0.0400),
    /** Bear flattener: hiking cycle, growth stocks reprice. */
    INFLATION_SHOCK_2022(20, -0.15, 1.5, 0.0150, 0.0050),
    /** Tariff stagflation: growth down, rates and spreads up. */
    LIBERATION_DAY_2025(10, -0.15, 2.0, 0.0025, 0.0200);

    private final int defaultDays;
    private final double spotReturn;
    private final double volMultiplier;
    private final double dRate;
    private final double dSpread;

    StressScenario(int defaultDays, double spotReturn, double volMultiplier, double dRate, double dSpread) {
        this.defaultDays = defaultDays;
        this.spotReturn = spotReturn;
        this.volMultiplier = volMultiplier;
        this.dRate = dRate;
        this.dSpread = dSpread;
    }

    public int defaultDays() {
        return defaultDays;
    }

    public double spotReturn() {
        return spotReturn;
    }

    public double volMultiplier() {
        return volMultiplier;
    }

    public double dRate() {
        return dRate;
    }

    public double dSpread() {
        return dSpread;
    }

    /** Case-insensitive lookup, accepting '-' as a separator. */
    public static StressScenario fromString(String s) {
        if (s == null)
            throw new IllegalArgumentException("Stress scenario name is null");
        try {
            return valueOf(s.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown stress scenario: " + s, e);
        }
    }
}
