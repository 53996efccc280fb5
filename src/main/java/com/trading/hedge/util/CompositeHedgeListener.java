package com.trading.hedge.util;

import com.trading.hedge.api.HedgeListener;
import com.trading.hedge.engine.HedgeLeg;
import com.trading.hedge.engine.HedgeState;
import com.trading.hedge.engine.ResultRow;
import com.trading.hedge.market.MarketSnapshot;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * Fans callbacks out to multiple {@link HedgeListener} instances.
 * <p>
 * A listener that throws is logged (throttled) and skipped; the run and the
 * remaining listeners carry on.
 */
public class CompositeHedgeListener implements HedgeListener {
    private static final Logger log = LogManager.getLogger(CompositeHedgeListener.class);

    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private HedgeListener[] listeners = new HedgeListener[0];

    public CompositeHedgeListener add(HedgeListener listener) {
        HedgeListener[] old = listeners;
        HedgeListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRunStart(MarketSnapshot day0, HedgeState initial) {
        for (HedgeListener l : listeners) {
            try {
                l.onRunStart(day0, initial);
            } catch (RuntimeException e) {
                failed(l, "onRunStart", e);
            }
        }
    }

    @Override
    public void onTrade(int step, HedgeLeg leg, double quantity, double price, double cost) {
        for (HedgeListener l : listeners) {
            try {
                l.onTrade(step, leg, quantity, price, cost);
            } catch (RuntimeException e) {
                failed(l, "onTrade", e);
            }
        }
    }

    @Override
    public void onStageSkipped(int step, HedgeLeg leg, double unitSensitivity) {
        for (HedgeListener l : listeners) {
            try {
                l.onStageSkipped(step, leg, unitSensitivity);
            } catch (RuntimeException e) {
                failed(l, "onStageSkipped", e);
            }
        }
    }

    @Override
    public void onStepEnd(int step, ResultRow row, long durationNanos) {
        for (HedgeListener l : listeners) {
            try {
                l.onStepEnd(step, row, durationNanos);
            } catch (RuntimeException e) {
                failed(l, "onStepEnd", e);
            }
        }
    }

    @Override
    public void onRunEnd(int steps) {
        for (HedgeListener l : listeners) {
            try {
                l.onRunEnd(steps);
            } catch (RuntimeException e) {
                failed(l, "onRunEnd", e);
            }
        }
    }

    private void failed(HedgeListener l, String callback, RuntimeException e) {
        errLimiter.log(String.format("Listener %s failed in %s: %s",
                l.getClass().getSimpleName(), callback, e.getMessage()), e);
    }
}
