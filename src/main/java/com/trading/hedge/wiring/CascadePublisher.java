package com.trading.hedge.wiring;

import com.lmax.disruptor.EventHandler;
import com.trading.hedge.api.HedgeListener;
import com.trading.hedge.engine.EngineConfig;
import com.trading.hedge.engine.Position;
import com.trading.hedge.engine.RebalancingCascade;
import com.trading.hedge.engine.ResultRow;
import com.trading.hedge.market.MarketSnapshot;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Disruptor EventHandler that consumes SnapshotEvents and drives the cascade.
 *
 * This class bridges the LMAX Disruptor ring buffer and a
 * {@link RebalancingCascade} for live, streaming runs where snapshots arrive
 * one at a time instead of as a complete feed. It runs on the single consumer
 * thread, so the cascade stays single-threaded and lock-free.
 *
 * Workflow:
 * 1. The first event carries the Day-0 snapshot: the cascade is created and
 * neutralizes the book against it, then steps it like any other snapshot.
 * 2. Every event is stepped through the cascade, in ring-buffer order.
 * 3. The emitted row is handed to the {@link RowCallback}.
 * 4. An event flagged end-of-feed closes the run.
 *
 * Unlike graph ticks, snapshots are never coalesced: each one is a separate
 * funding day and must be processed, whatever the endOfBatch flag says.
 *
 * A malformed or out-of-order event is logged and dropped; the consumer thread
 * stays alive and the ledger is left untouched.
 */
public final class CascadePublisher implements EventHandler<SnapshotEvent> {
    private static final Logger log = LogManager.getLogger(CascadePublisher.class);

    private final List<Position> portfolio;
    private final EngineConfig config;
    private final HedgeListener listener;

    private RebalancingCascade cascade;
    private RowCallback rowCallback;
    private Runnable completionCallback;
    private long dropped;
    private boolean finished;

    public CascadePublisher(List<Position> portfolio, EngineConfig config, HedgeListener listener) {
        this.portfolio = List.copyOf(portfolio);
        this.config = Objects.requireNonNull(config, "config").validate();
        this.listener = listener;
    }

    /** Sets a callback invoked with every emitted row. */
    public void setRowCallback(RowCallback cb) {
        this.rowCallback = cb;
    }

    /** Sets a callback invoked once the end-of-feed event has been processed. */
    public void setCompletionCallback(Runnable cb) {
        this.completionCallback = cb;
    }

    @Override
    public void onEvent(SnapshotEvent event, long sequence, boolean endOfBatch) {
        if (finished) {
            log.error("Received snapshot {} after end of feed (seq={}), dropping", event.date(), sequence);
            dropped++;
            return;
        }

        ResultRow row = null;
        try {
            MarketSnapshot s = event.toSnapshot();
            if (cascade == null) {
                log.info("Day-0 neutralization on {} for {} positions", s.date(), portfolio.size());
                cascade = new RebalancingCascade(portfolio, s, config, listener);
            }
            row = cascade.step(s);
        } catch (RuntimeException e) {
            log.error("Dropping snapshot event seq={} date={}: {}", sequence, event.date(), e.getMessage());
            dropped++;
        }

        if (row != null && rowCallback != null)
            rowCallback.onRow(row);

        if (event.isEndOfFeed())
            finish();
    }

    private void finish() {
        finished = true;
        int steps = cascade == null ? 0 : cascade.steps();
        log.info("End of feed after {} steps, {} events dropped", steps, dropped);
        if (listener != null)
            listener.onRunEnd(steps);
        if (completionCallback != null)
            completionCallback.run();
    }

    /** The live cascade, or null before the first snapshot has arrived. */
    public RebalancingCascade cascade() {
        return cascade;
    }

    /** Rows emitted so far. */
    public List<ResultRow> rows() {
        return cascade == null ? List.of() : cascade.rows();
    }

    public long droppedEvents() {
        return dropped;
    }

    public boolean isFinished() {
        return finished;
    }

    /**
     * Callback for rows produced by the streaming cascade.
     */
    @FunctionalInterface
    public interface RowCallback {
        void onRow(ResultRow row);
    }
}
