package com.trading.hedge.engine;

import com.trading.hedge.instrument.EuropeanOption;
import com.trading.hedge.instrument.Underlying;
import com.trading.hedge.market.MarketSnapshot;

import org.junit.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class PortfolioAggregatorTest {

    private static final LocalDate DATE = LocalDate.of(2024, 1, 2);
    private static final MarketSnapshot SNAP = new MarketSnapshot(DATE, 101.0, 0.22, 0.04, 0.01);

    private final Position shortCalls = new Position(EuropeanOption.call(100.0, DATE.plusMonths(3)), -1000);
    private final Position longPuts = new Position(EuropeanOption.put(95.0, DATE.plusMonths(6)), 500);
    private final Position stock = new Position(Underlying.INSTANCE, 30);

    @Test
    public void testEmptySetIsZero() {
        RiskVector risk = PortfolioAggregator.aggregate(Collections.emptyList(), SNAP);
        assertEquals(0.0, risk.price(), 0.0);
        assertEquals(0.0, risk.delta(), 0.0);
        assertEquals(0.0, risk.gamma(), 0.0);
        assertEquals(0.0, risk.vega(), 0.0);
    }

    @Test
    public void testAggregationIsAdditiveOverDisjointSplit() {
        RiskVector whole = PortfolioAggregator.aggregate(List.of(shortCalls, longPuts, stock), SNAP);
        RiskVector left = PortfolioAggregator.aggregate(List.of(shortCalls), SNAP);
        RiskVector right = PortfolioAggregator.aggregate(List.of(longPuts, stock), SNAP);

        assertEquals(left.price() + right.price(), whole.price(), 1e-9);
        assertEquals(left.delta() + right.delta(), whole.delta(), 1e-9);
        assertEquals(left.gamma() + right.gamma(), whole.gamma(), 1e-9);
        assertEquals(left.vega() + right.vega(), whole.vega(), 1e-9);
    }

    @Test
    public void testAggregationIgnoresOrder() {
        List<Position> book = new ArrayList<>(List.of(shortCalls, longPuts, stock));
        RiskVector forward = PortfolioAggregator.aggregate(book, SNAP);
        Collections.reverse(book);
        RiskVector backward = PortfolioAggregator.aggregate(book, SNAP);

        assertEquals(forward.price(), backward.price(), 1e-9);
        assertEquals(forward.delta(), backward.delta(), 1e-9);
        assertEquals(forward.gamma(), backward.gamma(), 1e-12);
        assertEquals(forward.vega(), backward.vega(), 1e-9);
    }

    @Test
    public void testQuantityScalesUnitRisk() {
        var option = EuropeanOption.call(100.0, DATE.plusMonths(3));
        RiskVector unit = PortfolioAggregator.unitRisk(option, SNAP);
        RiskVector split = PortfolioAggregator.aggregate(
                List.of(new Position(option, 1.0), new Position(option, 2.0)), SNAP);

        assertEquals(3.0 * unit.price(), split.price(), 1e-9);
        assertEquals(3.0 * unit.delta(), split.delta(), 1e-12);
        assertEquals(3.0 * unit.gamma(), split.gamma(), 1e-12);
        assertEquals(3.0 * unit.vega(), split.vega(), 1e-12);
    }

    @Test
    public void testUnderlyingContributesDeltaOnly() {
        RiskVector risk = PortfolioAggregator.aggregate(List.of(stock), SNAP);
        assertEquals(30 * 101.0, risk.price(), 1e-9);
        assertEquals(30.0, risk.delta(), 0.0);
        assertEquals(0.0, risk.gamma(), 0.0);
        assertEquals(0.0, risk.vega(), 0.0);
    }
}
