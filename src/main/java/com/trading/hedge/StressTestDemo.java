package com.trading.hedge;

import com.trading.hedge.engine.EngineConfig;
import com.trading.hedge.engine.Position;
import com.trading.hedge.instrument.EuropeanOption;
import com.trading.hedge.io.ResultExporter;
import com.trading.hedge.market.ScenarioGenerator;
import com.trading.hedge.market.StressScenario;

import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a short-straddle book through every preset stress scenario, fully
 * hedged (gamma, vega, delta), and prints the outcome of each.
 * <p>
 * With a path argument, runs that JSON scenario instead and writes its rows to
 * {@code <name>.csv} in the working directory. Add {@code --stream} to feed the
 * scenario through the Disruptor ring buffer instead.
 */
@Log4j2
public class StressTestDemo {
    private static final LocalDate START = LocalDate.of(2025, 4, 1);

    public static void main(String[] args) throws IOException {
        if (args.length > 0) {
            runScenarioFile(Path.of(args[0]), args.length > 1 && "--stream".equals(args[1]));
            return;
        }

        log.info("Starting stress test across {} scenarios...", StressScenario.values().length);

        // Desk is short 1000 3m ATM straddles; hedges with 1m calls (gamma) and 1y calls (vega).
        var call = EuropeanOption.call(100.0, START.plusMonths(3));
        var put = EuropeanOption.put(100.0, START.plusMonths(3));
        List<Position> book = List.of(new Position(call, -1000), new Position(put, -1000));
        EngineConfig config = EngineConfig.builder()
                .gammaHedgeInstrument(EuropeanOption.call(100.0, START.plusMonths(1)))
                .vegaHedgeInstrument(EuropeanOption.call(100.0, START.plusYears(1)))
                .build();

        var generator = new ScenarioGenerator();
        List<HedgeSimulation> sims = new ArrayList<>();
        for (StressScenario scenario : StressScenario.values()) {
            sims.add(HedgeSimulation.builder(scenario.name())
                    .positions(book)
                    .feed(generator.simulate(scenario, START))
                    .config(config)
                    .build());
        }

        List<SimulationResult> results;
        try (var runner = new ScenarioBatchRunner()) {
            results = runner.runAll(sims);
        }

        StringBuilder sb = new StringBuilder("\n");
        sb.append(String.format("%-22s | %5s | %14s | %12s | %12s | %12s%n",
                "Scenario", "Steps", "P&L change", "Txn costs", "Funding", "Drawdown"));
        sb.append("------------------------------------------------------------------------------------------\n");
        for (SimulationResult r : results) {
            sb.append(String.format("%-22s | %5d | %14.2f | %12.2f | %12.2f | %12.2f%n",
                    r.name(), r.steps(), r.pnlChange(), r.totalTransactionCost(), r.totalFundingCost(),
                    r.maxDrawdown()));
        }
        log.info(sb.toString());
        log.info("Stress test complete.");
    }

    private static void runScenarioFile(Path path, boolean stream) throws IOException {
        var sim = HedgeSimulation.fromJson(path);
        var latency = sim.enableLatencyTracking();
        var result = stream ? sim.runStreaming() : sim.run();

        Path out = Path.of(result.name() + ".csv");
        ResultExporter.writeCsv(result.rows(), out);
        log.info("Results for '{}' saved to {}", result.name(), out);
        log.info("\n{}", latency.dump());
    }
}
