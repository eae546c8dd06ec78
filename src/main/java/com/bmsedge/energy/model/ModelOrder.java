package com.bmsedge.energy.model;

import lombok.Getter;

import java.util.Comparator;
import java.util.Objects;

/**
 * Seasonal ARIMA order (p, d, q)(P, D, Q)m.
 */
@Getter
public final class ModelOrder {

    /** Simpler first: lower total ARMA order, then lexicographic (p, q, P, Q, d, D). */
    public static final Comparator<ModelOrder> SIMPLICITY = Comparator
            .comparingInt(ModelOrder::totalOrder)
            .thenComparingInt(ModelOrder::getP)
            .thenComparingInt(ModelOrder::getQ)
            .thenComparingInt(ModelOrder::getSeasonalP)
            .thenComparingInt(ModelOrder::getSeasonalQ)
            .thenComparingInt(ModelOrder::getD)
            .thenComparingInt(ModelOrder::getSeasonalD);

    private final int p;
    private final int d;
    private final int q;
    private final int seasonalP;
    private final int seasonalD;
    private final int seasonalQ;
    private final int period;

    public ModelOrder(int p, int d, int q, int seasonalP, int seasonalD, int seasonalQ, int period) {
        if (p < 0 || d < 0 || q < 0 || seasonalP < 0 || seasonalD < 0 || seasonalQ < 0) {
            throw new IllegalArgumentException("Model orders must be non-negative");
        }
        if (period < 1) {
            throw new IllegalArgumentException("Seasonal period must be at least 1: " + period);
        }
        if (period == 1 && (seasonalP > 0 || seasonalD > 0 || seasonalQ > 0)) {
            throw new IllegalArgumentException("Seasonal terms require a seasonal period above 1");
        }
        this.p = p;
        this.d = d;
        this.q = q;
        this.seasonalP = seasonalP;
        this.seasonalD = seasonalD;
        this.seasonalQ = seasonalQ;
        this.period = period;
    }

    public static ModelOrder nonSeasonal(int p, int d, int q) {
        return new ModelOrder(p, d, q, 0, 0, 0, 1);
    }

    /** p + q + P + Q. */
    public int totalOrder() {
        return p + q + seasonalP + seasonalQ;
    }

    public boolean hasArmaTerms() {
        return totalOrder() > 0;
    }

    public boolean isSeasonal() {
        return period > 1;
    }

    /** Largest lag of the expanded AR polynomial. */
    public int arLags() {
        return p + seasonalP * period;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModelOrder)) return false;
        ModelOrder that = (ModelOrder) o;
        return p == that.p && d == that.d && q == that.q
                && seasonalP == that.seasonalP && seasonalD == that.seasonalD
                && seasonalQ == that.seasonalQ && period == that.period;
    }

    @Override
    public int hashCode() {
        return Objects.hash(p, d, q, seasonalP, seasonalD, seasonalQ, period);
    }

    @Override
    public String toString() {
        String order = "ARIMA(" + p + "," + d + "," + q + ")";
        return isSeasonal()
                ? order + "(" + seasonalP + "," + seasonalD + "," + seasonalQ + ")[" + period + "]"
                : order;
    }
}
