package com.trading.hedge.engine;

import com.trading.hedge.api.HedgeListener;
import com.trading.hedge.market.MarketSnapshot;

import java.util.ArrayList;
import java.util.List;

/** Captures every callback so tests can replay a run. */
final class RecordingListener implements HedgeListener {

    record Trade(int step, HedgeLeg leg, double quantity, double price, double cost) {
    }

    record Skip(int step, HedgeLeg leg, double unitSensitivity) {
    }

    HedgeState initial;
    final List<Trade> trades = new ArrayList<>();
    final List<Skip> skips = new ArrayList<>();
    final List<ResultRow> rows = new ArrayList<>();
    int endedAfter = -1;

    @Override
    public void onRunStart(MarketSnapshot day0, HedgeState initial) {
        this.initial = initial;
    }

    @Override
    public void onTrade(int step, HedgeLeg leg, double quantity, double price, double cost) {
        trades.add(new Trade(step, leg, quantity, price, cost));
    }

    @Override
    public void onStageSkipped(int step, HedgeLeg leg, double unitSensitivity) {
        skips.add(new Skip(step, leg, unitSensitivity));
    }

    @Override
    public void onStepEnd(int step, ResultRow row, long durationNanos) {
        rows.add(row);
    }

    @Override
    public void onRunEnd(int steps) {
        endedAfter = steps;
    }

    List<Trade> tradesAt(int step) {
        List<Trade> out = new ArrayList<>();
        for (Trade t : trades) {
            if (t.step() == step)
                out.add(t);
        }
        return out;
    }
}
