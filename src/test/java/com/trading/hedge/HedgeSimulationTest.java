package com.trading.hedge;

import com.trading.hedge.engine.EngineConfig;
import com.trading.hedge.engine.Position;
import com.trading.hedge.engine.ResultRow;
import com.trading.hedge.instrument.EuropeanOption;
import com.trading.hedge.market.ScenarioGenerator;
import com.trading.hedge.market.StressScenario;

import org.junit.Test;

import java.time.LocalDate;

import static org.junit.Assert.*;

public class HedgeSimulationTest {

    private static final LocalDate START = LocalDate.of(2025, 4, 1);

    static HedgeSimulation straddle(StressScenario scenario) {
        return HedgeSimulation.builder(scenario.name())
                .position(new Position(EuropeanOption.call(100.0, START.plusMonths(3)), -1000))
                .position(new Position(EuropeanOption.put(100.0, START.plusMonths(3)), -1000))
                .feed(new ScenarioGenerator().simulate(scenario, START))
                .config(EngineConfig.builder()
                        .gammaHedgeInstrument(EuropeanOption.call(100.0, START.plusMonths(1)))
                        .vegaHedgeInstrument(EuropeanOption.call(100.0, START.plusYears(1)))
                        .build())
                .build();
    }

    @Test
    public void testUnderlyingOnlyResource() {
        SimulationResult result = HedgeSimulation.fromResource("scenarios/underlying_only.json").run();

        assertEquals("underlying_only", result.name());
        assertEquals(4, result.steps());
        assertEquals(0.0, result.totalTransactionCost(), 0.0);
        assertTrue(result.totalFundingCost() > 0.0);
        for (ResultRow row : result.rows()) {
            assertEquals(-100.0, row.stockPosition(), 0.0);
            assertEquals(row.cash(), row.totalPnl(), 1e-9);
        }
        assertEquals(result.totalFundingCost(), result.pnlChange() + result.rows().get(0).fundingCost(), 1e-9);
    }

    @Test
    public void testRerunStartsFromFreshLedger() {
        HedgeSimulation sim = straddle(StressScenario.COVID_CRASH_2020);
        SimulationResult first = sim.run();
        SimulationResult second = sim.run();
        assertEquals(first.rows(), second.rows());
    }

    @Test
    public void testStressRunCostsMoney() {
        SimulationResult result = straddle(StressScenario.COVID_CRASH_2020).run();
        assertEquals(21, result.steps());
        assertTrue(result.totalTransactionCost() > 0.0);
        assertTrue(result.maxDrawdown() >= 0.0);
        for (ResultRow row : result.rows())
            assertTrue(Double.isFinite(row.totalPnl()));
    }

    @Test
    public void testLatencyTrackingSeesEveryStep() {
        HedgeSimulation sim = straddle(StressScenario.REPO_CRISIS_2019);
        var latency = sim.enableLatencyTracking();
        SimulationResult result = sim.run();
        assertEquals(result.steps(), latency.totalSteps());
        assertTrue(latency.trades() > 0);
    }

    @Test
    public void testBundledScenarioRuns() {
        SimulationResult result = HedgeSimulation.fromResource("scenarios/covid_short_straddle.json").run();
        assertEquals(21, result.steps());
    }

    @Test
    public void testStreamingMatchesBatchRun() {
        HedgeSimulation sim = straddle(StressScenario.LIBERATION_DAY_2025);
        var latency = sim.enableLatencyTracking();
        SimulationResult batch = sim.run();
        latency.reset();

        SimulationResult streamed = sim.runStreaming();
        assertEquals(batch.rows(), streamed.rows());
        assertEquals(streamed.steps(), latency.totalSteps());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedResource() {
        HedgeSimulation.fromResource("scenarios/malformed.json");
    }

    @Test(expected = java.io.UncheckedIOException.class)
    public void testMissingResource() {
        HedgeSimulation.fromResource("scenarios/nope.json");
    }

    @Test(expected = NullPointerException.class)
    public void testFeedIsRequired() {
        HedgeSimulation.builder("empty").build();
    }
}
