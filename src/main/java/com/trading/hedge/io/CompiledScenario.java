package com.trading.hedge.io;

import com.trading.hedge.api.MarketFeed;
import com.trading.hedge.engine.EngineConfig;
import com.trading.hedge.engine.Position;

import java.util.List;

/**
 * A scenario resolved into engine inputs, ready to run.
 */
public record CompiledScenario(String name, List<Position> portfolio, MarketFeed feed, EngineConfig config) {

    public CompiledScenario {
        portfolio = List.copyOf(portfolio);
    }
}
