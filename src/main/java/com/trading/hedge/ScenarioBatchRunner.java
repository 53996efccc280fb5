package com.trading.hedge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs independent simulations in parallel.
 * <p>
 * A single run is strictly sequential, but separate runs share nothing mutable:
 * each builds its own cascade and ledger, while feeds and instruments are
 * immutable. Runs are therefore spread over a fixed worker pool with no
 * locking. Each simulation instance must be submitted at most once per batch.
 */
public final class ScenarioBatchRunner implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(ScenarioBatchRunner.class);

    private final ExecutorService pool;

    public ScenarioBatchRunner() {
        this(Runtime.getRuntime().availableProcessors());
    }

    public ScenarioBatchRunner(int threads) {
        if (threads < 1)
            throw new IllegalArgumentException("threads must be >= 1: " + threads);
        this.pool = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
    }

    /**
     * Runs every simulation and returns results in submission order.
     *
     * @throws RuntimeException the first failure of any run, rethrown as-is when
     *                          unchecked.
     */
    public List<SimulationResult> runAll(List<HedgeSimulation> simulations) {
        long start = System.nanoTime();
        List<Future<SimulationResult>> futures = new ArrayList<>(simulations.size());
        for (HedgeSimulation sim : simulations) {
            futures.add(pool.submit(sim::run));
        }

        List<SimulationResult> results = new ArrayList<>(futures.size());
        try {
            for (Future<SimulationResult> f : futures) {
                results.add(f.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new IllegalStateException("Interrupted while waiting for batch results", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re)
                throw re;
            if (cause instanceof Error err)
                throw err;
            throw new IllegalStateException("Simulation failed", cause);
        }

        log.info("Batch of {} runs finished in {} ms", results.size(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return results;
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Batch workers did not terminate within 30s, forcing shutdown");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "hedge-batch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
