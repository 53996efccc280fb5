package com.trading.hedge.market;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds deterministic stress paths for spot, volatility, SOFR and credit
 * spread over a Monday-Friday calendar.
 *
 * Path construction:
 * 1. Spot compounds by {@code spotReturn / numDays} every business day.
 * 2. Rate and spread move linearly by {@code dRate / numDays} and
 * {@code dSpread / numDays}.
 * 3. Vol follows the leverage effect: when spot trades below its starting level
 * vol is {@code vol0 * (1 + drop * volMultiplier)} with
 * {@code drop = (S0 - S) / S0}; when spot is at or above the start, vol decays
 * to {@code max(0.05, 0.95 * vol0)}.
 *
 * The first snapshot always carries the starting values unchanged.
 */
public final class ScenarioGenerator {
    static final double VOL_FLOOR = 0.05;
    static final double RALLY_VOL_DECAY = 0.95;

    private final double spot0;
    private final double vol0;
    private final double rate0;
    private final double spread0;

    /** Generator with the desk's default starting market: 100 spot, 20% vol, 4% SOFR, 100bp spread. */
    public ScenarioGenerator() {
        this(100.0, 0.20, 0.04, 0.01);
    }

    public ScenarioGenerator(double spot0, double vol0, double rate0, double spread0) {
        this.spot0 = spot0;
        this.vol0 = vol0;
        this.rate0 = rate0;
        this.spread0 = spread0;
    }

    /**
     * Generates {@code numDays + 1} daily snapshots starting on the first
     * business day on or after {@code startDate}.
     *
     * @param startDate     When the shock begins.
     * @param numDays       Number of business days the shock evolves over.
     * @param spotReturn    Total spot return over the path (e.g. -0.10).
     * @param volMultiplier Vol sensitivity to the spot drawdown.
     * @param dRate         Total change in SOFR.
     * @param dSpread       Total change in credit spread.
     */
    public ListMarketFeed simulate(LocalDate startDate, int numDays, double spotReturn, double volMultiplier,
            double dRate, double dSpread) {
        if (numDays < 1)
            throw new IllegalArgumentException("numDays must be >= 1: " + numDays);

        List<LocalDate> dates = businessDays(startDate, numDays + 1);
        List<MarketSnapshot> path = new ArrayList<>(dates.size());

        double spotStep = spotReturn / numDays;
        double rateStep = dRate / numDays;
        double spreadStep = dSpread / numDays;

        double spot = spot0;
        double rate = rate0;
        double spread = spread0;
        path.add(new MarketSnapshot(dates.get(0), spot0, vol0, rate0, spread0));

        for (int i = 1; i < dates.size(); i++) {
            spot = spot * (1 + spotStep);
            rate = rate + rateStep;
            spread = spread + spreadStep;

            double drop = (spot0 - spot) / spot0;
            double vol = drop > 0
                    ? vol0 * (1 + drop * volMultiplier)
                    : Math.max(VOL_FLOOR, vol0 * RALLY_VOL_DECAY);

            // Spread can be pushed marginally negative by a tightening shock; floor at zero.
            path.add(new MarketSnapshot(dates.get(i), spot, vol, rate, Math.max(0.0, spread)));
        }
        return new ListMarketFeed(path);
    }

    /** Runs one of the preset historical stress narratives. */
    public ListMarketFeed simulate(StressScenario scenario, LocalDate startDate) {
        return simulate(scenario, startDate, scenario.defaultDays());
    }

    public ListMarketFeed simulate(StressScenario scenario, LocalDate startDate, int numDays) {
        return simulate(startDate, numDays, scenario.spotReturn(), scenario.volMultiplier(),
                scenario.dRate(), scenario.dSpread());
    }

    static List<LocalDate> businessDays(LocalDate start, int count) {
        List<LocalDate> out = new ArrayList<>(count);
        LocalDate d = start;
        while (out.size() < count) {
            if (isBusinessDay(d))
                out.add(d);
            d = d.plusDays(1);
        }
        return out;
    }

    static boolean isBusinessDay(LocalDate d) {
        DayOfWeek dow = d.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY;
    }
}
