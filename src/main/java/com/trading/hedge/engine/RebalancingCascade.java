package com.trading.hedge.engine;

import com.trading.hedge.api.HedgeListener;
import com.trading.hedge.market.MarketSnapshot;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The hierarchical hedging state machine: one transition per market snapshot.
 *
 * Construction runs the Day-0 pre-hedge against the first snapshot, putting on
 * gamma, vega and stock hedges so the book starts risk-neutral. The hedges are
 * financed from cash with no friction charge.
 *
 * Each {@link #step(MarketSnapshot)} then executes:
 *
 * 1. Funding: accrue one day of interest on cash (SOFR + spread when
 * borrowing, SOFR when lending).
 *
 * 2. Rehedge gate: steps 3-5 only run when the step counter is a multiple of
 * the rehedge interval. On other steps positions are left untouched and the
 * row reports zero transaction cost.
 *
 * 3. Gamma stage: size a net trade in the gamma instrument against the
 * current book (base + both option hedges), settle it with option friction on
 * a x100 contract notional, then fold its vega and delta into the working view.
 *
 * 4. Vega stage: same against the post-gamma view, then fold in its delta.
 *
 * 5. Delta stage: always runs. The stock hedge is replaced by the target
 * {@code -delta}; only the difference trades, at the stock spread.
 *
 * The order Gamma -> Vega -> Delta hedges the most nonlinear risk first, and
 * each stage sizes against the side effects of the previous one through the
 * explicit {@link RiskView}.
 *
 * A configured option hedge whose unit gamma (or vega) is within
 * {@link #EPSILON} of zero skips its stage instead of producing a huge
 * unstable trade. This is never reported as an error.
 *
 * Single-threaded and non-reentrant. One instance owns one ledger for the
 * lifetime of one run.
 */
public final class RebalancingCascade {
    private static final Logger log = LogManager.getLogger(RebalancingCascade.class);

    /** Smallest unit sensitivity a hedge instrument may have and still be traded. */
    public static final double EPSILON = 1e-9;

    /** Option notional scaling used when charging friction on option hedges. */
    public static final double CONTRACT_MULTIPLIER = 100.0;

    private final List<Position> basePositions;
    private final EngineConfig config;
    private final FrictionCostModel friction;
    private final HedgeLedger ledger = new HedgeLedger();
    private final ValuationReporter reporter;
    private final HedgeListener listener;

    private int step;
    private LocalDate lastDate;

    public RebalancingCascade(List<Position> basePositions, MarketSnapshot day0, EngineConfig config) {
        this(basePositions, day0, config, null);
    }

    /**
     * @param basePositions The book to hedge, fixed for the run.
     * @param day0          First snapshot of the feed, used for neutralization.
     * @param config        Engine settings.
     * @param listener      Optional observer, may be null.
     */
    public RebalancingCascade(List<Position> basePositions, MarketSnapshot day0, EngineConfig config,
            HedgeListener listener) {
        Objects.requireNonNull(basePositions, "basePositions");
        Objects.requireNonNull(day0, "day0");
        this.config = Objects.requireNonNull(config, "config").validate();
        this.basePositions = List.copyOf(basePositions);
        this.friction = new FrictionCostModel(day0.vol(), config.getStockSpreadBps(), config.getOptionSpreadBps());
        this.reporter = new ValuationReporter(this.basePositions, config);
        this.listener = listener;

        neutralize(day0);

        log.debug("Day-0 hedges on {}: {}", day0.date(), ledger.state());
        if (listener != null)
            listener.onRunStart(day0, ledger.state());
    }

    /**
     * Day-0 pre-hedge: gamma, then vega (including the gamma hedge's vega), then
     * stock against the delta of everything, then seed cash with the cost of
     * the three hedges.
     */
    private void neutralize(MarketSnapshot s) {
        RiskVector base = PortfolioAggregator.aggregate(basePositions, s);

        RiskVector gammaUnit = RiskVector.ZERO;
        double gammaPos = 0.0;
        if (config.hasGammaHedge()) {
            gammaUnit = PortfolioAggregator.unitRisk(config.getGammaHedgeInstrument(), s);
            if (Math.abs(gammaUnit.gamma()) > EPSILON) {
                gammaPos = -base.gamma() / gammaUnit.gamma();
            } else {
                skipped(-1, HedgeLeg.GAMMA, gammaUnit.gamma());
            }
        }

        RiskVector vegaUnit = RiskVector.ZERO;
        double vegaPos = 0.0;
        if (config.hasVegaHedge()) {
            double addedVega = gammaPos * gammaUnit.vega();
            vegaUnit = PortfolioAggregator.unitRisk(config.getVegaHedgeInstrument(), s);
            if (Math.abs(vegaUnit.vega()) > EPSILON) {
                vegaPos = -(base.vega() + addedVega) / vegaUnit.vega();
            } else {
                skipped(-1, HedgeLeg.VEGA, vegaUnit.vega());
            }
        }

        double stockPos = -(base.delta() + gammaPos * gammaUnit.delta() + vegaPos * vegaUnit.delta());

        ledger.establish(HedgeLeg.GAMMA, gammaPos, gammaUnit.price());
        ledger.establish(HedgeLeg.VEGA, vegaPos, vegaUnit.price());
        ledger.establish(HedgeLeg.STOCK, stockPos, s.spot());
    }

    /**
     * Advances the run by one snapshot.
     *
     * @return The row emitted for this snapshot.
     * @throws IllegalStateException if the snapshot does not come strictly after
     *                               the previous one.
     */
    public ResultRow step(MarketSnapshot s) {
        Objects.requireNonNull(s, "snapshot");
        if (lastDate != null && !s.date().isAfter(lastDate)) {
            throw new IllegalStateException(
                    "Snapshots must arrive in strictly increasing date order: " + s.date() + " after " + lastDate);
        }
        long start = System.nanoTime();

        double funding = ledger.accrueFunding(s);

        double transactionCost = 0.0;
        if (step % config.getRehedgeInterval() == 0) {
            transactionCost = rebalance(s);
        }

        ResultRow row = reporter.report(s, ledger.state(), transactionCost, funding);

        if (listener != null)
            listener.onStepEnd(step, row, System.nanoTime() - start);

        lastDate = s.date();
        step++;
        return row;
    }

    /** Runs the three stages against a fresh view of the current book. */
    double rebalance(MarketSnapshot s) {
        RiskView view = RiskView.of(PortfolioAggregator.aggregate(currentBook(), s));
        double cost = gammaStage(view, s);
        cost += vegaStage(view, s);
        cost += deltaStage(view, s);
        return cost;
    }

    /** Base positions plus the option hedges currently held. */
    List<Position> currentBook() {
        List<Position> book = new ArrayList<>(basePositions.size() + 2);
        book.addAll(basePositions);
        if (ledger.gammaHedgePosition() != 0)
            book.add(new Position(config.getGammaHedgeInstrument(), ledger.gammaHedgePosition()));
        if (ledger.vegaHedgePosition() != 0)
            book.add(new Position(config.getVegaHedgeInstrument(), ledger.vegaHedgePosition()));
        return book;
    }

    /** @return Friction charged, zero when the stage is omitted or skipped. */
    double gammaStage(RiskView view, MarketSnapshot s) {
        if (!config.hasGammaHedge())
            return 0.0;

        RiskVector unit = PortfolioAggregator.unitRisk(config.getGammaHedgeInstrument(), s);
        if (Math.abs(unit.gamma()) <= EPSILON) {
            skipped(step, HedgeLeg.GAMMA, unit.gamma());
            return 0.0;
        }
        return tradeOption(HedgeLeg.GAMMA, -view.gamma() / unit.gamma(), unit, view, s);
    }

    /** @return Friction charged, zero when the stage is omitted or skipped. */
    double vegaStage(RiskView view, MarketSnapshot s) {
        if (!config.hasVegaHedge())
            return 0.0;

        RiskVector unit = PortfolioAggregator.unitRisk(config.getVegaHedgeInstrument(), s);
        if (Math.abs(unit.vega()) <= EPSILON) {
            skipped(step, HedgeLeg.VEGA, unit.vega());
            return 0.0;
        }
        return tradeOption(HedgeLeg.VEGA, -view.vega() / unit.vega(), unit, view, s);
    }

    /** Replaces the stock hedge with {@code -delta}; always runs. */
    double deltaStage(RiskView view, MarketSnapshot s) {
        double target = -view.delta();
        double trade = target - ledger.stockPosition();
        double cost = friction.cost(trade * s.spot(), s.vol(), HedgeLeg.STOCK.isOption());
        ledger.rebalanceStock(target, s.spot(), cost);
        // View carries option legs only until the stock hedge is replaced.
        view.absorbStock(target);
        onTrade(HedgeLeg.STOCK, trade, s.spot(), cost);
        return cost;
    }

    private double tradeOption(HedgeLeg leg, double quantity, RiskVector unit, RiskView view, MarketSnapshot s) {
        double price = unit.price();
        double cost = friction.cost(quantity * price * CONTRACT_MULTIPLIER, s.vol(), leg.isOption());
        ledger.settleOptionTrade(leg, quantity, price, cost);
        view.absorb(unit, quantity);
        onTrade(leg, quantity, price, cost);
        return cost;
    }

    private void onTrade(HedgeLeg leg, double quantity, double price, double cost) {
        if (quantity == 0)
            return;
        if (log.isDebugEnabled())
            log.debug("step={} {} trade qty={} px={} cost={}", step, leg, quantity, price, cost);
        if (listener != null)
            listener.onTrade(step, leg, quantity, price, cost);
    }

    private void skipped(int atStep, HedgeLeg leg, double unitSensitivity) {
        log.debug("step={} {} hedge skipped, unit sensitivity {} within epsilon", atStep, leg, unitSensitivity);
        if (listener != null)
            listener.onStageSkipped(atStep, leg, unitSensitivity);
    }

    /** Number of steps processed so far. */
    public int steps() {
        return step;
    }

    public HedgeState state() {
        return ledger.state();
    }

    /** Rows emitted so far. */
    public List<ResultRow> rows() {
        return reporter.rows();
    }
}
