package com.trading.hedge.engine;

/**
 * Point-in-time copy of the ledger: cash and the three hedge positions.
 */
public record HedgeState(double cash, double stockPosition, double gammaHedgePosition, double vegaHedgePosition) {
}
