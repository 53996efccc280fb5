package com.trading.hedge.engine;

/** The three hedge legs, in cascade order. */
public enum HedgeLeg {
    GAMMA(true),
    VEGA(true),
    STOCK(false);

    private final boolean option;

    HedgeLeg(boolean option) {
        this.option = option;
    }

    /** Whether trades on this leg are charged at the option spread. */
    public boolean isOption() {
        return option;
    }
}
