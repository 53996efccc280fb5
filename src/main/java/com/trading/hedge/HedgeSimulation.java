package com.trading.hedge;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.trading.hedge.api.HedgeListener;
import com.trading.hedge.api.MarketFeed;
import com.trading.hedge.engine.EngineConfig;
import com.trading.hedge.engine.Position;
import com.trading.hedge.engine.RebalancingCascade;
import com.trading.hedge.io.CompiledScenario;
import com.trading.hedge.io.ScenarioCompiler;
import com.trading.hedge.io.ScenarioLoader;
import com.trading.hedge.market.MarketSnapshot;
import com.trading.hedge.util.CompositeHedgeListener;
import com.trading.hedge.util.StepLatencyListener;
import com.trading.hedge.wiring.CascadePublisher;
import com.trading.hedge.wiring.SnapshotEvent;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;

/**
 * A high-level wrapper around the hedging engine that runs one book through one
 * market path.
 * <p>
 * This class handles:
 * <ul>
 * <li>Loading and compiling JSON scenarios via {@link ScenarioLoader} and
 * {@link ScenarioCompiler}</li>
 * <li>Building a fresh {@link RebalancingCascade} per run, so repeated runs
 * never share ledger state</li>
 * <li>Feeding every snapshot through the cascade in order</li>
 * <li>Fanning run events out to registered {@link HedgeListener}s</li>
 * </ul>
 */
public class HedgeSimulation {
    private static final Logger log = LogManager.getLogger(HedgeSimulation.class);
    private static final int RING_BUFFER_SIZE = 1024;

    private final String name;
    private final List<Position> portfolio;
    private final MarketFeed feed;
    private final EngineConfig config;
    private final CompositeHedgeListener listeners = new CompositeHedgeListener();

    private HedgeSimulation(String name, List<Position> portfolio, MarketFeed feed, EngineConfig config) {
        this.name = name;
        this.portfolio = List.copyOf(portfolio);
        this.feed = Objects.requireNonNull(feed, "feed");
        this.config = Objects.requireNonNull(config, "config").validate();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static HedgeSimulation of(CompiledScenario scenario) {
        return new HedgeSimulation(scenario.name(), scenario.portfolio(), scenario.feed(), scenario.config());
    }

    /**
     * Creates a simulation from a JSON scenario file.
     *
     * @param jsonPath Path to the scenario definition.
     */
    public static HedgeSimulation fromJson(Path jsonPath) {
        try {
            return of(new ScenarioCompiler().compile(ScenarioLoader.parseFile(jsonPath)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load scenario from " + jsonPath, e);
        }
    }

    /** Creates a simulation from a JSON scenario on the classpath. */
    public static HedgeSimulation fromResource(String resource) {
        try {
            return of(new ScenarioCompiler().compile(ScenarioLoader.parseResource(resource)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load scenario resource " + resource, e);
        }
    }

    /** Registers a listener in addition to any already registered. */
    public HedgeSimulation addListener(HedgeListener listener) {
        listeners.add(listener);
        return this;
    }

    /** Enables per-step timing; use the returned listener to read statistics. */
    public StepLatencyListener enableLatencyTracking() {
        var latency = new StepLatencyListener();
        listeners.add(latency);
        return latency;
    }

    /**
     * Executes the run: Day-0 neutralization on the first snapshot, then one
     * cascade transition per snapshot.
     */
    public SimulationResult run() {
        MarketSnapshot day0 = feed.first();
        log.info("Running '{}': {} positions, {} steps from {}, gammaHedge={}, vegaHedge={}, interval={}",
                name, portfolio.size(), feed.size(), day0.date(),
                config.hasGammaHedge() ? config.getGammaHedgeInstrument().name() : "none",
                config.hasVegaHedge() ? config.getVegaHedgeInstrument().name() : "none",
                config.getRehedgeInterval());

        var cascade = new RebalancingCascade(portfolio, day0, config, listeners);
        for (MarketSnapshot s : feed) {
            cascade.step(s);
        }
        listeners.onRunEnd(cascade.steps());

        var result = new SimulationResult(name, cascade.rows());
        log.info("Finished '{}': final P&L {} (change {}), transaction costs {}, funding {}",
                name,
                String.format("%.2f", result.finalPnl()),
                String.format("%.2f", result.pnlChange()),
                String.format("%.2f", result.totalTransactionCost()),
                String.format("%.2f", result.totalFundingCost()));
        return result;
    }

    /**
     * Same run as {@link #run()}, but the feed is published snapshot by snapshot
     * into a Disruptor ring buffer and the cascade steps on the consumer thread.
     * Blocks until the end-of-feed event has been processed.
     */
    public SimulationResult runStreaming() {
        log.info("Streaming '{}': {} snapshots through ring buffer of {}", name, feed.size(), RING_BUFFER_SIZE);

        var publisher = new CascadePublisher(portfolio, config, listeners);
        var done = new CountDownLatch(1);
        publisher.setCompletionCallback(done::countDown);

        Disruptor<SnapshotEvent> disruptor = new Disruptor<>(
                SnapshotEvent::new,
                RING_BUFFER_SIZE,
                DaemonThreadFactory.INSTANCE,
                ProducerType.SINGLE,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(publisher);
        RingBuffer<SnapshotEvent> ringBuffer = disruptor.start();

        try {
            for (int i = 0; i < feed.size(); i++)
                SnapshotEvent.publish(ringBuffer, feed.get(i), i == feed.size() - 1);
            done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while streaming '" + name + "'", e);
        } finally {
            disruptor.shutdown();
        }

        if (publisher.droppedEvents() > 0)
            log.warn("'{}' dropped {} snapshot events", name, publisher.droppedEvents());
        return new SimulationResult(name, publisher.rows());
    }

    public String name() {
        return name;
    }

    public List<Position> portfolio() {
        return portfolio;
    }

    public MarketFeed feed() {
        return feed;
    }

    public EngineConfig config() {
        return config;
    }

    /** Fluent construction of a simulation from in-memory inputs. */
    public static final class Builder {
        private final String name;
        private final List<Position> portfolio = new ArrayList<>();
        private final List<HedgeListener> listeners = new ArrayList<>();
        private MarketFeed feed;
        private EngineConfig config = EngineConfig.defaults();

        private Builder(String name) {
            this.name = name;
        }

        public Builder position(Position position) {
            portfolio.add(position);
            return this;
        }

        public Builder positions(List<Position> positions) {
            portfolio.addAll(positions);
            return this;
        }

        public Builder feed(MarketFeed feed) {
            this.feed = feed;
            return this;
        }

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder listener(HedgeListener listener) {
            listeners.add(listener);
            return this;
        }

        public HedgeSimulation build() {
            var sim = new HedgeSimulation(name, portfolio, feed, config);
            for (HedgeListener l : listeners)
                sim.addListener(l);
            return sim;
        }
    }
}
