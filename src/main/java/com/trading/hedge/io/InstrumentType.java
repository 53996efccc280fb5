package com.trading.hedge.io;

import com.trading.hedge.api.Instrument;
import com.trading.hedge.instrument.EuropeanOption;
import com.trading.hedge.instrument.OptionType;
import com.trading.hedge.instrument.Underlying;

/**
 * Built-in instrument kinds that can be declared in a scenario file.
 */
public enum InstrumentType {
    OPTION(def -> {
        if (def.getStrike() == null)
            throw new IllegalArgumentException("Option '" + def.getName() + "' is missing 'strike'");
        if (def.getExpiry() == null)
            throw new IllegalArgumentException("Option '" + def.getName() + "' is missing 'expiry'");
        String side = def.getOptionType();
        if (side == null && "put".equalsIgnoreCase(def.getType()))
            side = "put";
        return new EuropeanOption(def.getStrike(), def.getExpiry(), OptionType.fromString(side));
    }),
    UNDERLYING(def -> Underlying.INSTANCE);

    private final ScenarioCompiler.InstrumentFactory factory;

    InstrumentType(ScenarioCompiler.InstrumentFactory factory) {
        this.factory = factory;
    }

    public Instrument create(ScenarioDefinition.InstrumentDef def) {
        return factory.create(def);
    }

    /** Accepts aliases such as "european_option", "call", "put", "stock". */
    public static InstrumentType fromString(String type) {
        if (type == null)
            throw new IllegalArgumentException("Instrument type is required");
        return switch (type.trim().toLowerCase()) {
            case "option", "european_option", "european", "call", "put" -> OPTION;
            case "underlying", "stock", "spot" -> UNDERLYING;
            default -> throw new IllegalArgumentException("Unknown instrument type: " + type);
        };
    }
}
