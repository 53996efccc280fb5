package com.trading.hedge.engine;

import com.trading.hedge.market.MarketSnapshot;

/**
 * Cash account and hedge inventory for one simulation run.
 * <p>
 * Every change to cash goes through this class:
 * <ul>
 * <li>{@link #establish} books a Day-0 hedge at its price, frictionless.</li>
 * <li>{@link #accrueFunding} charges or credits one day of interest.</li>
 * <li>{@link #settleOptionTrade} and {@link #rebalanceStock} settle rehedges
 * including their friction cost.</li>
 * </ul>
 * Funding is asymmetric: a net borrower pays SOFR plus the desk's credit
 * spread, a net lender earns SOFR only.
 * <p>
 * Not thread-safe. A ledger belongs to exactly one cascade.
 */
public final class HedgeLedger {
    public static final double TRADING_DAYS_PER_YEAR = 252.0;

    private double cash;
    private double stockPosition;
    private double gammaHedgePosition;
    private double vegaHedgePosition;

    /**
     * Books an opening hedge position paid for (or funded by) cash at its
     * current price. No friction is charged.
     */
    public void establish(HedgeLeg leg, double quantity, double price) {
        switch (leg) {
            case GAMMA -> gammaHedgePosition += quantity;
            case VEGA -> vegaHedgePosition += quantity;
            case STOCK -> stockPosition += quantity;
        }
        cash -= quantity * price;
    }

    /**
     * Applies one day of interest to the cash balance.
     *
     * @return The signed amount credited (positive) or charged (negative).
     */
    public double accrueFunding(MarketSnapshot snapshot) {
        double funding = cash * fundingRate(cash, snapshot) / TRADING_DAYS_PER_YEAR;
        cash += funding;
        return funding;
    }

    /** SOFR plus spread when borrowing, SOFR when long cash. */
    public static double fundingRate(double cash, MarketSnapshot snapshot) {
        return cash < 0 ? snapshot.rate() + snapshot.creditSpread() : snapshot.rate();
    }

    /**
     * Settles a net rebalancing trade in an option hedge: the position is
     * incremented, cash pays the premium plus friction.
     */
    public void settleOptionTrade(HedgeLeg leg, double quantity, double price, double cost) {
        switch (leg) {
            case GAMMA -> gammaHedgePosition += quantity;
            case VEGA -> vegaHedgePosition += quantity;
            case STOCK -> throw new IllegalArgumentException("Stock trades settle via rebalanceStock");
        }
        cash -= quantity * price + cost;
    }

    /**
     * Moves the stock hedge to {@code target}, paying for the difference plus
     * friction.
     *
     * @return The quantity traded.
     */
    public double rebalanceStock(double target, double spot, double cost) {
        double trade = target - stockPosition;
        cash -= trade * spot + cost;
        stockPosition = target;
        return trade;
    }

    public double cash() {
        return cash;
    }

    public double stockPosition() {
        return stockPosition;
    }

    public double gammaHedgePosition() {
        return gammaHedgePosition;
    }

    public double vegaHedgePosition() {
        return vegaHedgePosition;
    }

    public HedgeState state() {
        return new HedgeState(cash, stockPosition, gammaHedgePosition, vegaHedgePosition);
    }
}
