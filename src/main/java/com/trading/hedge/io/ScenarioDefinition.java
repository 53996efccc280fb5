package com.trading.hedge.io;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a hedging scenario file.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ScenarioDefinition {
    private ScenarioInfo scenario;

    /** The book, its hedges, the market path and the engine settings. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ScenarioInfo {
        private String name, description;
        private MarketDef market;
        private List<InstrumentDef> portfolio;
        private HedgesDef hedges;
        private EngineDef engine;
    }

    /**
     * Market path: either an explicit list of snapshots, or a generated stress
     * path (a preset and/or explicit shock parameters). Explicit parameters
     * override the preset's.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class MarketDef {
        private String preset;
        private LocalDate startDate;
        private Integer days;
        private Double spotStart, volStart, rateStart, spreadStart;
        private Double spotReturn, volMultiplier, rateChange, spreadChange;
        private List<SnapshotDef> snapshots;
    }

    /** One explicit market snapshot. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class SnapshotDef {
        private LocalDate date;
        private Double spot, vol, rate, creditSpread;
    }

    /** An instrument, with a quantity when it is part of the base book. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class InstrumentDef {
        private String name, type, optionType;
        private Double strike;
        private LocalDate expiry;
        private Double quantity;
        private Map<String, Object> properties;
    }

    /** Optional gamma and vega hedge instruments. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class HedgesDef {
        private InstrumentDef gamma, vega;
    }

    /** Engine settings; absent values take the engine defaults. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class EngineDef {
        private Integer rehedgeInterval;
        private Double stockSpreadBps, optionSpreadBps;
    }
}
