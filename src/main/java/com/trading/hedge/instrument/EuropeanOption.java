package com.trading.hedge.instrument;

import com.trading.hedge.api.Instrument;

import org.apache.commons.math3.distribution.NormalDistribution;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Vanilla European option priced with Black-Scholes-Merton (no dividends).
 *
 * Key formulas:
 * - d1 = [ln(S/K) + (r + sigma^2/2) * T] / (sigma * sqrt(T)), d2 = d1 - sigma * sqrt(T)
 * - Call: S * N(d1) - K * e^(-rT) * N(d2); Put: K * e^(-rT) * N(-d2) - S * N(-d1)
 * - Delta: N(d1) for calls, N(d1) - 1 for puts
 * - Gamma: n(d1) / (S * sigma * sqrt(T))
 * - Vega: S * sqrt(T) * n(d1) / 100 (per 1 vol point)
 *
 * Time to maturity uses ACT/365 on whole calendar days and is floored at zero.
 * At or past expiry (T below {@link #EXPIRY_EPSILON}) the option is worth its
 * intrinsic value, delta is the exercise indicator, and gamma and vega are zero.
 */
public final class EuropeanOption implements Instrument {
    static final double EXPIRY_EPSILON = 1e-6;
    private static final double DAYS_PER_YEAR = 365.0;

    // Reusable standard normal distribution (thread-safe in commons-math3)
    private static final NormalDistribution NORM = new NormalDistribution();

    private final double strike;
    private final LocalDate expiry;
    private final OptionType type;

    public EuropeanOption(double strike, LocalDate expiry, OptionType type) {
        if (!(strike > 0))
            throw new IllegalArgumentException("Strike must be positive: " + strike);
        this.strike = strike;
        this.expiry = Objects.requireNonNull(expiry, "expiry");
        this.type = Objects.requireNonNull(type, "type");
    }

    public static EuropeanOption call(double strike, LocalDate expiry) {
        return new EuropeanOption(strike, expiry, OptionType.CALL);
    }

    public static EuropeanOption put(double strike, LocalDate expiry) {
        return new EuropeanOption(strike, expiry, OptionType.PUT);
    }

    public double strike() {
        return strike;
    }

    public LocalDate expiry() {
        return expiry;
    }

    public OptionType type() {
        return type;
    }

    /** Years to expiry on ACT/365, zero once the option has expired. */
    public double timeToMaturity(LocalDate date) {
        long days = ChronoUnit.DAYS.between(date, expiry);
        if (days < 0)
            return 0.0;
        return days / DAYS_PER_YEAR;
    }

    @Override
    public double price(double spot, LocalDate date, double rate, double vol) {
        double t = timeToMaturity(date);
        if (t < EXPIRY_EPSILON)
            return intrinsic(spot);

        double sqrtT = Math.sqrt(t);
        double d1 = d1(spot, t, rate, vol, sqrtT);
        double d2 = d1 - vol * sqrtT;
        double df = Math.exp(-rate * t);

        if (type == OptionType.CALL)
            return spot * NORM.cumulativeProbability(d1) - strike * df * NORM.cumulativeProbability(d2);
        return strike * df * NORM.cumulativeProbability(-d2) - spot * NORM.cumulativeProbability(-d1);
    }

    @Override
    public double delta(double spot, LocalDate date, double rate, double vol) {
        double t = timeToMaturity(date);
        if (t < EXPIRY_EPSILON) {
            if (type == OptionType.CALL)
                return spot > strike ? 1.0 : 0.0;
            return spot < strike ? -1.0 : 0.0;
        }

        double nd1 = NORM.cumulativeProbability(d1(spot, t, rate, vol, Math.sqrt(t)));
        return type == OptionType.CALL ? nd1 : nd1 - 1.0;
    }

    @Override
    public double gamma(double spot, LocalDate date, double rate, double vol) {
        double t = timeToMaturity(date);
        // ATM gamma explodes at expiry; pinned to zero for stability.
        if (t < EXPIRY_EPSILON)
            return 0.0;

        double sqrtT = Math.sqrt(t);
        return NORM.density(d1(spot, t, rate, vol, sqrtT)) / (spot * vol * sqrtT);
    }

    @Override
    public double vega(double spot, LocalDate date, double rate, double vol) {
        double t = timeToMaturity(date);
        if (t < EXPIRY_EPSILON)
            return 0.0;

        double sqrtT = Math.sqrt(t);
        return spot * sqrtT * NORM.density(d1(spot, t, rate, vol, sqrtT)) / 100.0;
    }

    @Override
    public String name() {
        return String.format("%s %.2f %s", type, strike, expiry);
    }

    private double intrinsic(double spot) {
        return type == OptionType.CALL ? Math.max(0.0, spot - strike) : Math.max(0.0, strike - spot);
    }

    private double d1(double spot, double t, double rate, double vol, double sqrtT) {
        return (Math.log(spot / strike) + (rate + 0.5 * vol * vol) * t) / (vol * sqrtT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EuropeanOption other))
            return false;
        return Double.compare(strike, other.strike) == 0 && expiry.equals(other.expiry) && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(strike, expiry, type);
    }

    @Override
    public String toString() {
        return "EuropeanOption[" + name() + "]";
    }
}
