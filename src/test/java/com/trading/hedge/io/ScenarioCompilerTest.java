package com.trading.hedge.io;

import com.trading.hedge.api.MarketFeed;
import com.trading.hedge.instrument.EuropeanOption;
import com.trading.hedge.instrument.OptionType;
import com.trading.hedge.instrument.Underlying;

import org.junit.Test;

import java.io.IOException;
import java.time.LocalDate;

import static org.junit.Assert.*;

public class ScenarioCompilerTest {

    private final ScenarioCompiler compiler = new ScenarioCompiler();

    @Test
    public void testExplicitSnapshotScenario() throws IOException {
        CompiledScenario sc = compiler.compile(ScenarioLoader.parseResource("scenarios/underlying_only.json"));

        assertEquals("underlying_only", sc.name());
        assertEquals(1, sc.portfolio().size());
        assertSame(Underlying.INSTANCE, sc.portfolio().get(0).instrument());
        assertEquals(100.0, sc.portfolio().get(0).quantity(), 0.0);

        MarketFeed feed = sc.feed();
        assertEquals(4, feed.size());
        assertEquals(LocalDate.of(2024, 3, 1), feed.first().date());
        assertEquals(95.0, feed.get(2).spot(), 0.0);
        assertEquals(0.041, feed.get(3).rate(), 0.0);

        assertFalse(sc.config().hasGammaHedge());
        assertFalse(sc.config().hasVegaHedge());
        assertEquals(1, sc.config().getRehedgeInterval());
    }

    @Test
    public void testPresetScenarioWithOverrides() throws IOException {
        CompiledScenario sc = compiler.compile(ScenarioLoader.parseResource("scenarios/hedged_straddle.json"));

        assertEquals(11, sc.feed().size());
        assertEquals(LocalDate.of(2025, 4, 2), sc.feed().first().date());
        // preset spot path, overridden vol feedback
        double spot1 = 100.0 * (1 - 0.15 / 10);
        assertEquals(spot1, sc.feed().get(1).spot(), 1e-12);
        assertEquals(0.2 * (1 + 3.0 * (100.0 - spot1) / 100.0), sc.feed().get(1).vol(), 1e-12);

        assertEquals(EuropeanOption.call(100.0, LocalDate.of(2025, 7, 2)), sc.portfolio().get(0).instrument());
        assertEquals(EuropeanOption.put(95.0, LocalDate.of(2025, 7, 2)), sc.portfolio().get(1).instrument());

        assertEquals(EuropeanOption.call(100.0, LocalDate.of(2025, 5, 2)), sc.config().getGammaHedgeInstrument());
        assertEquals(EuropeanOption.put(100.0, LocalDate.of(2026, 4, 2)), sc.config().getVegaHedgeInstrument());
        assertEquals(2, sc.config().getRehedgeInterval());
        assertEquals(80.0, sc.config().getOptionSpreadBps(), 0.0);
        assertEquals(5.0, sc.config().getStockSpreadBps(), 0.0);
    }

    @Test
    public void testBundledScenarioCompiles() throws IOException {
        CompiledScenario sc = compiler.compile(ScenarioLoader.parseResource("scenarios/covid_short_straddle.json"));
        assertEquals(21, sc.feed().size());
        assertEquals(2, sc.portfolio().size());
        assertTrue(sc.config().hasGammaHedge());
        assertTrue(sc.config().hasVegaHedge());
    }

    @Test
    public void testGeneratedPathFromExplicitParameters() {
        String json = "{\"scenario\":{\"market\":{\"startDate\":\"2024-01-02\",\"days\":3,\"spotReturn\":0.03,"
                + "\"spotStart\":50.0},\"portfolio\":[]}}";
        CompiledScenario sc = compiler.compile(ScenarioLoader.parse(json));
        assertEquals("unnamed", sc.name());
        assertEquals(4, sc.feed().size());
        assertEquals(50.0 * Math.pow(1.01, 3), sc.feed().get(3).spot(), 1e-9);
        assertTrue(sc.portfolio().isEmpty());
    }

    @Test
    public void testCustomFactoryTakesPrecedence() {
        var fixedPut = EuropeanOption.put(42.0, LocalDate.of(2030, 1, 1));
        compiler.registerFactory("Desk-Put", def -> fixedPut);

        var def = new ScenarioDefinition.InstrumentDef();
        def.setType("desk-put");
        assertSame(fixedPut, compiler.instrument(def));
    }

    @Test
    public void testOptionTypeDefaultsFromTypeAlias() {
        var def = new ScenarioDefinition.InstrumentDef();
        def.setType("put");
        def.setStrike(90.0);
        def.setExpiry(LocalDate.of(2025, 1, 1));
        var option = (EuropeanOption) compiler.instrument(def);
        assertEquals(OptionType.PUT, option.type());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOptionWithoutStrikeRejected() {
        var def = new ScenarioDefinition.InstrumentDef();
        def.setType("option");
        def.setExpiry(LocalDate.of(2025, 1, 1));
        compiler.instrument(def);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownInstrumentTypeRejected() {
        var def = new ScenarioDefinition.InstrumentDef();
        def.setType("swaption");
        compiler.instrument(def);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPortfolioEntryNeedsQuantity() {
        String json = "{\"scenario\":{\"market\":{\"preset\":\"repo-crisis-2019\",\"startDate\":\"2024-01-02\"},"
                + "\"portfolio\":[{\"type\":\"underlying\"}]}}";
        compiler.compile(ScenarioLoader.parse(json));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testGeneratedPathNeedsStartDate() {
        String json = "{\"scenario\":{\"market\":{\"preset\":\"repo-crisis-2019\"}}}";
        compiler.compile(ScenarioLoader.parse(json));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingRootKeyRejected() {
        ScenarioLoader.parse("{\"name\":\"x\"}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedJsonRejected() {
        ScenarioLoader.parse("{\"scenario\": [");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedResourceRejected() throws IOException {
        ScenarioLoader.parseResource("scenarios/malformed.json");
    }

    @Test
    public void testSnapshotMissingFundingFieldsRejected() {
        String json = "{\"scenario\":{\"market\":{\"snapshots\":["
                + "{\"date\":\"2024-03-01\",\"spot\":100.0,\"vol\":0.2}]}}}";
        try {
            compiler.compile(ScenarioLoader.parse(json));
            fail("snapshot without rate should be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("'rate'"));
        }
    }

    @Test
    public void testSnapshotMissingSpotNamesField() {
        String json = "{\"scenario\":{\"market\":{\"snapshots\":["
                + "{\"date\":\"2024-03-01\",\"spot\":100.0,\"vol\":0.2,\"rate\":0.04,\"creditSpread\":0.01},"
                + "{\"date\":\"2024-03-04\",\"vol\":0.2,\"rate\":0.04,\"creditSpread\":0.01}]}}}";
        try {
            compiler.compile(ScenarioLoader.parse(json));
            fail("snapshot without spot should be rejected");
        } catch (IllegalArgumentException e) {
            assertEquals("Market snapshot 1 is missing 'spot'", e.getMessage());
        }
    }

    @Test(expected = IOException.class)
    public void testMissingResourceRejected() throws IOException {
        ScenarioLoader.parseResource("scenarios/does_not_exist.json");
    }
}
