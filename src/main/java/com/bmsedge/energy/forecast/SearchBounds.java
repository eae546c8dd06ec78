package com.bmsedge.energy.forecast;

import lombok.Builder;
import lombok.Getter;

/**
 * Bounded search space and policy for automatic SARIMA order selection.
 * {@code d} and {@code seasonalD} are fixed when set and chosen by unit-root tests otherwise.
 */
@Getter
@Builder(toBuilder = true)
public class SearchBounds {

    @Builder.Default private final int minP = 0;
    @Builder.Default private final int maxP = 5;
    @Builder.Default private final int minQ = 0;
    @Builder.Default private final int maxQ = 5;
    @Builder.Default private final int minSeasonalP = 0;
    @Builder.Default private final int maxSeasonalP = 2;
    @Builder.Default private final int minSeasonalQ = 0;
    @Builder.Default private final int maxSeasonalQ = 2;
    @Builder.Default private final int maxD = 2;
    @Builder.Default private final int maxSeasonalD = 1;
    private final Integer d;
    private final Integer seasonalD;

    @Builder.Default private final int startP = 2;
    @Builder.Default private final int startQ = 2;
    @Builder.Default private final int startSeasonalP = 1;
    @Builder.Default private final int startSeasonalQ = 1;
    @Builder.Default private final int maxOrder = 5;

    @Builder.Default private final int period = 12;
    @Builder.Default private final InformationCriterion criterion = InformationCriterion.AIC;
    @Builder.Default private final boolean stepwise = true;
    @Builder.Default private final int maxSteps = 100;
    @Builder.Default private final boolean withIntercept = true;
    @Builder.Default private final double whiteNoiseSignificance = 0.05;
    @Builder.Default private final double confidenceLevel = 0.95;

    public static SearchBounds defaults() {
        return SearchBounds.builder().build();
    }

    public boolean isSeasonal() {
        return period > 1;
    }

    /**
     * @throws IllegalArgumentException when a bound is negative or a minimum exceeds its maximum
     */
    public SearchBounds validate() {
        requireRange("p", minP, maxP);
        requireRange("q", minQ, maxQ);
        requireRange("P", minSeasonalP, maxSeasonalP);
        requireRange("Q", minSeasonalQ, maxSeasonalQ);
        requireRange("d", 0, maxD);
        requireRange("D", 0, maxSeasonalD);
        if (d != null && (d < 0 || d > maxD)) {
            throw new IllegalArgumentException("Fixed d=" + d + " is outside [0, " + maxD + "]");
        }
        if (seasonalD != null && (seasonalD < 0 || seasonalD > maxSeasonalD)) {
            throw new IllegalArgumentException("Fixed D=" + seasonalD + " is outside [0, " + maxSeasonalD + "]");
        }
        if (period < 1) {
            throw new IllegalArgumentException("Seasonal period must be at least 1: " + period);
        }
        if (maxOrder < 0) {
            throw new IllegalArgumentException("max order must not be negative: " + maxOrder);
        }
        if (maxSteps < 1) {
            throw new IllegalArgumentException("max steps must be positive: " + maxSteps);
        }
        if (!(whiteNoiseSignificance > 0 && whiteNoiseSignificance < 1)) {
            throw new IllegalArgumentException("White-noise significance must be in (0, 1): " + whiteNoiseSignificance);
        }
        if (!(confidenceLevel > 0 && confidenceLevel < 1)) {
            throw new IllegalArgumentException("Confidence level must be in (0, 1): " + confidenceLevel);
        }
        return this;
    }

    private static void requireRange(String name, int min, int max) {
        if (min < 0 || max < 0) {
            throw new IllegalArgumentException("Bounds for " + name + " must not be negative");
        }
        if (min > max) {
            throw new IllegalArgumentException("Minimum " + name + "=" + min + " exceeds maximum " + max);
        }
    }
}
