package com.trading.hedge.api;

import com.trading.hedge.market.MarketSnapshot;

/**
 * Ordered, finite sequence of market snapshots driving one simulation run.
 *
 * Contract:
 * - at least one element;
 * - dates strictly increasing;
 * - iterating twice yields the same sequence (implementations are immutable).
 *
 * Element 0 is the Day-0 snapshot used for initial neutralization.
 */
public interface MarketFeed extends Iterable<MarketSnapshot> {

    /** Number of snapshots, always at least 1. */
    int size();

    /** Snapshot at the given position. */
    MarketSnapshot get(int index);

    /** The Day-0 snapshot. */
    default MarketSnapshot first() {
        return get(0);
    }
}
