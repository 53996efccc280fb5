package com.trading.hedge.engine;

import com.trading.hedge.api.Instrument;

import java.util.Objects;

/**
 * A signed holding of one instrument. Positions are never mutated; the engine
 * rebuilds its risk views from fresh position lists every time it evaluates.
 */
public record Position(Instrument instrument, double quantity) {

    public Position {
        Objects.requireNonNull(instrument, "instrument");
        if (!Double.isFinite(quantity))
            throw new IllegalArgumentException("Quantity must be finite: " + quantity);
    }
}
