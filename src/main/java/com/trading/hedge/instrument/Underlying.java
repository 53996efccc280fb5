package com.trading.hedge.instrument;

import com.trading.hedge.api.Instrument;

import java.time.LocalDate;

/**
 * The underlying asset itself: worth spot, delta one, no convexity, no vega.
 */
public final class Underlying implements Instrument {
    public static final Underlying INSTANCE = new Underlying();

    private Underlying() {
    }

    @Override
    public double price(double spot, LocalDate date, double rate, double vol) {
        return spot;
    }

    @Override
    public double delta(double spot, LocalDate date, double rate, double vol) {
        return 1.0;
    }

    @Override
    public double gamma(double spot, LocalDate date, double rate, double vol) {
        return 0.0;
    }

    @Override
    public double vega(double spot, LocalDate date, double rate, double vol) {
        return 0.0;
    }

    @Override
    public String name() {
        return "UNDERLYING";
    }

    @Override
    public String toString() {
        return "Underlying";
    }
}
