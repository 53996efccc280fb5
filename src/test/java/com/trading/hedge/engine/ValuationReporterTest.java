package com.trading.hedge.engine;

import com.trading.hedge.instrument.Underlying;
import com.trading.hedge.market.MarketSnapshot;

import org.junit.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.Assert.*;

public class ValuationReporterTest {

    private static final MarketSnapshot SNAP = new MarketSnapshot(LocalDate.of(2024, 1, 3), 100.0, 0.2, 0.04, 0.01);

    @Test
    public void testTotalIsBasePlusHedgesPlusCash() {
        EngineConfig config = EngineConfig.builder()
                .gammaHedgeInstrument(new FixedInstrument(3.0, 0.5, 0.1, 0.2))
                .build();
        var reporter = new ValuationReporter(List.of(new Position(Underlying.INSTANCE, 10)), config);

        var v = reporter.value(new HedgeState(50.0, -10.0, 2.0, 0.0), SNAP);
        assertEquals(1000.0, v.pvBase(), 1e-12);
        assertEquals(-1000.0 + 6.0, v.pvHedges(), 1e-12);
        assertEquals(56.0, v.totalPnl(), 1e-12);
    }

    @Test
    public void testUnconfiguredHedgeContributesNothing() {
        var reporter = new ValuationReporter(List.of(), EngineConfig.defaults());
        var v = reporter.value(new HedgeState(0.0, 0.0, 7.0, 9.0), SNAP);
        assertEquals(0.0, v.totalPnl(), 0.0);
    }

    @Test
    public void testReportAppendsRow() {
        var reporter = new ValuationReporter(List.of(new Position(Underlying.INSTANCE, 1)), EngineConfig.defaults());
        ResultRow row = reporter.report(SNAP, new HedgeState(-100.0, 0.0, 0.0, 0.0), 0.25, -0.02);

        assertEquals(1, reporter.rows().size());
        assertSame(row, reporter.rows().get(0));
        assertEquals(SNAP.date(), row.date());
        assertEquals(100.0, row.spot(), 0.0);
        assertEquals(0.0, row.totalPnl(), 1e-12);
        assertEquals(0.25, row.transactionCost(), 0.0);
        assertEquals(-0.02, row.fundingCost(), 0.0);
        assertEquals(-100.0, row.cash(), 0.0);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testRowsAreReadOnly() {
        var reporter = new ValuationReporter(List.of(), EngineConfig.defaults());
        reporter.rows().clear();
    }
}
