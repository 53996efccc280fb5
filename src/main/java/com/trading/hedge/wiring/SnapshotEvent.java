package com.trading.hedge.wiring;

import com.lmax.disruptor.RingBuffer;
import com.trading.hedge.market.MarketSnapshot;

import java.time.LocalDate;

/**
 * A mutable market update carried by the LMAX Disruptor RingBuffer.
 *
 * <p>
 * <b>Flyweight Pattern:</b> Instances are pre-allocated when the RingBuffer is
 * built and reused for its lifetime. The producer copies a snapshot's fields in,
 * the consumer rebuilds an immutable {@link MarketSnapshot} from them.
 *
 * <p>
 * {@code endOfFeed} marks the last snapshot of a run.
 */
public final class SnapshotEvent {
    private LocalDate date;
    private double spot;
    private double vol;
    private double rate;
    private double creditSpread;
    private boolean endOfFeed;
    private long sequenceId;

    public void set(MarketSnapshot s, boolean endOfFeed, long seqId) {
        this.date = s.date();
        this.spot = s.spot();
        this.vol = s.vol();
        this.rate = s.rate();
        this.creditSpread = s.creditSpread();
        this.endOfFeed = endOfFeed;
        this.sequenceId = seqId;
    }

    /**
     * @throws IllegalArgumentException if the carried fields do not form a valid
     *                                  snapshot.
     */
    public MarketSnapshot toSnapshot() {
        return new MarketSnapshot(date, spot, vol, rate, creditSpread);
    }

    public LocalDate date() {
        return date;
    }

    public boolean isEndOfFeed() {
        return endOfFeed;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        date = null;
        spot = 0;
        vol = 0;
        rate = 0;
        creditSpread = 0;
        endOfFeed = false;
        sequenceId = 0;
    }

    /** Claims the next slot, copies the snapshot in and publishes it. */
    public static void publish(RingBuffer<SnapshotEvent> ringBuffer, MarketSnapshot s, boolean endOfFeed) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(s, endOfFeed, sequence);
        } finally {
            ringBuffer.publish(sequence);
        }
    }
}
