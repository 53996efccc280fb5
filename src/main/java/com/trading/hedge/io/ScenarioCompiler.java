package com.trading.hedge.io;

import com.trading.hedge.api.Instrument;
import com.trading.hedge.api.MarketFeed;
import com.trading.hedge.engine.EngineConfig;
import com.trading.hedge.engine.Position;
import com.trading.hedge.market.ListMarketFeed;
import com.trading.hedge.market.MarketSnapshot;
import com.trading.hedge.market.ScenarioGenerator;
import com.trading.hedge.market.StressScenario;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles a JSON {@link ScenarioDefinition} into a {@link CompiledScenario}.
 * <p>
 * Built-in instrument kinds come from {@link InstrumentType}; additional kinds
 * can be registered by name with {@link #registerFactory}.
 */
public final class ScenarioCompiler {

    /** Creates an instrument from its declaration. */
    @FunctionalInterface
    public interface InstrumentFactory {
        Instrument create(ScenarioDefinition.InstrumentDef def);
    }

    private final Map<String, InstrumentFactory> customFactories = new HashMap<>();

    /** Registers a factory for a custom instrument type name (case-insensitive). */
    public ScenarioCompiler registerFactory(String type, InstrumentFactory factory) {
        customFactories.put(type.trim().toLowerCase(), factory);
        return this;
    }

    public CompiledScenario compile(ScenarioDefinition def) {
        ScenarioDefinition.ScenarioInfo info = def.getScenario();
        if (info == null)
            throw new IllegalArgumentException("Missing 'scenario' key");

        List<Position> portfolio = new ArrayList<>();
        if (info.getPortfolio() != null) {
            for (ScenarioDefinition.InstrumentDef pd : info.getPortfolio()) {
                if (pd.getQuantity() == null) {
                    throw new IllegalArgumentException(
                            "Portfolio entry '" + label(pd) + "' is missing 'quantity'");
                }
                portfolio.add(new Position(instrument(pd), pd.getQuantity()));
            }
        }

        EngineConfig.EngineConfigBuilder config = EngineConfig.builder();
        ScenarioDefinition.HedgesDef hedges = info.getHedges();
        if (hedges != null) {
            if (hedges.getGamma() != null)
                config.gammaHedgeInstrument(instrument(hedges.getGamma()));
            if (hedges.getVega() != null)
                config.vegaHedgeInstrument(instrument(hedges.getVega()));
        }
        ScenarioDefinition.EngineDef engine = info.getEngine();
        if (engine != null) {
            if (engine.getRehedgeInterval() != null)
                config.rehedgeInterval(engine.getRehedgeInterval());
            if (engine.getStockSpreadBps() != null)
                config.stockSpreadBps(engine.getStockSpreadBps());
            if (engine.getOptionSpreadBps() != null)
                config.optionSpreadBps(engine.getOptionSpreadBps());
        }

        String name = info.getName() != null ? info.getName() : "unnamed";
        return new CompiledScenario(name, portfolio, feed(info.getMarket()), config.build().validate());
    }

    Instrument instrument(ScenarioDefinition.InstrumentDef def) {
        if (def.getType() != null) {
            InstrumentFactory custom = customFactories.get(def.getType().trim().toLowerCase());
            if (custom != null)
                return custom.create(def);
        }
        return InstrumentType.fromString(def.getType()).create(def);
    }

    static MarketFeed feed(ScenarioDefinition.MarketDef m) {
        if (m == null)
            throw new IllegalArgumentException("Missing 'market' section");

        if (m.getSnapshots() != null && !m.getSnapshots().isEmpty()) {
            List<MarketSnapshot> path = new ArrayList<>(m.getSnapshots().size());
            for (int i = 0; i < m.getSnapshots().size(); i++) {
                ScenarioDefinition.SnapshotDef sd = m.getSnapshots().get(i);
                path.add(new MarketSnapshot(
                        required(sd.getDate(), "date", i),
                        required(sd.getSpot(), "spot", i),
                        required(sd.getVol(), "vol", i),
                        required(sd.getRate(), "rate", i),
                        required(sd.getCreditSpread(), "creditSpread", i)));
            }
            return new ListMarketFeed(path);
        }

        if (m.getStartDate() == null)
            throw new IllegalArgumentException("Generated market path requires 'startDate'");

        StressScenario preset = m.getPreset() != null ? StressScenario.fromString(m.getPreset()) : null;
        if (preset == null && (m.getDays() == null || m.getSpotReturn() == null)) {
            throw new IllegalArgumentException(
                    "Market path needs 'snapshots', a 'preset', or explicit 'days' and 'spotReturn'");
        }

        var generator = new ScenarioGenerator(
                orDefault(m.getSpotStart(), 100.0),
                orDefault(m.getVolStart(), 0.20),
                orDefault(m.getRateStart(), 0.04),
                orDefault(m.getSpreadStart(), 0.01));

        int days = m.getDays() != null ? m.getDays() : preset.defaultDays();
        return generator.simulate(m.getStartDate(), days,
                orDefault(m.getSpotReturn(), preset != null ? preset.spotReturn() : 0.0),
                orDefault(m.getVolMultiplier(), preset != null ? preset.volMultiplier() : 0.0),
                orDefault(m.getRateChange(), preset != null ? preset.dRate() : 0.0),
                orDefault(m.getSpreadChange(), preset != null ? preset.dSpread() : 0.0));
    }

    private static <T> T required(T value, String field, int index) {
        if (value == null)
            throw new IllegalArgumentException("Market snapshot " + index + " is missing '" + field + "'");
        return value;
    }

    private static double orDefault(Double v, double def) {
        return v != null ? v : def;
    }

    private static String label(ScenarioDefinition.InstrumentDef def) {
        return def.getName() != null ? def.getName() : String.valueOf(def.getType());
    }
}
