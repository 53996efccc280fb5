package com.trading.hedge.market;

import com.trading.hedge.api.MarketFeed;

import java.util.Iterator;
import java.util.List;

/**
 * Immutable, list-backed {@link MarketFeed}.
 * <p>
 * Validates the feed contract once at construction (non-empty, dates strictly
 * increasing) so the engine can trust it for the lifetime of a run. Instances
 * are safe to share between concurrently running simulations.
 */
public final class ListMarketFeed implements MarketFeed {
    private final List<MarketSnapshot> snapshots;

    public ListMarketFeed(List<MarketSnapshot> snapshots) {
        if (snapshots == null || snapshots.isEmpty())
            throw new IllegalArgumentException("Market feed must contain at least one snapshot");
        this.snapshots = List.copyOf(snapshots);

        for (int i = 1; i < this.snapshots.size(); i++) {
            var prev = this.snapshots.get(i - 1).date();
            var next = this.snapshots.get(i).date();
            if (!next.isAfter(prev)) {
                throw new IllegalArgumentException(
                        "Feed dates must be strictly increasing: " + next + " follows " + prev + " at index " + i);
            }
        }
    }

    public static ListMarketFeed of(MarketSnapshot... snapshots) {
        return new ListMarketFeed(List.of(snapshots));
    }

    @Override
    public int size() {
        return snapshots.size();
    }

    @Override
    public MarketSnapshot get(int index) {
        return snapshots.get(index);
    }

    /** The last snapshot of the path. */
    public MarketSnapshot last() {
        return snapshots.get(snapshots.size() - 1);
    }

    @Override
    public Iterator<MarketSnapshot> iterator() {
        return snapshots.iterator();
    }

    @Override
    public String toString() {
        return "ListMarketFeed[" + snapshots.get(0).date() + " .. " + last().date() + ", " + size() + " steps]";
    }
}
