package com.trading.hedge.engine;

import com.trading.hedge.api.Instrument;

import java.time.LocalDate;

/** Instrument with constant price and greeks, for exact arithmetic in tests. */
final class FixedInstrument implements Instrument {
    private final double price;
    private final double delta;
    private final double gamma;
    private final double vega;

    FixedInstrument(double price, double delta, double gamma, double vega) {
        this.price = price;
        this.delta = delta;
        this.gamma = gamma;
        this.vega = vega;
    }

    @Override
    public double price(double spot, LocalDate date, double rate, double vol) {
        return price;
    }

    @Override
    public double delta(double spot, LocalDate date, double rate, double vol) {
        return delta;
    }

    @Override
    public double gamma(double spot, LocalDate date, double rate, double vol) {
        return gamma;
    }

    @Override
    public double vega(double spot, LocalDate date, double rate, double vol) {
        return vega;
    }
}
