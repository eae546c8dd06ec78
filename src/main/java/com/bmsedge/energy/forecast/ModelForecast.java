package com.bmsedge.energy.forecast;

/**
 * Forecast values of a fitted model, indexed by step (0 = one period ahead).
 */
public class ModelForecast {

    private final double[] mean;
    private final double[] lower;
    private final double[] upper;
    private final double confidenceLevel;

    public ModelForecast(double[] mean, double[] lower, double[] upper, double confidenceLevel) {
        if (mean.length != lower.length || mean.length != upper.length) {
            throw new IllegalArgumentException("Forecast arrays must have equal length");
        }
        this.mean = mean.clone();
        this.lower = lower.clone();
        this.upper = upper.clone();
        this.confidenceLevel = confidenceLevel;
    }

    public int size() {
        return mean.length;
    }

    public double getMean(int step) {
        return mean[step];
    }

    public double getLower(int step) {
        return lower[step];
    }

    public double getUpper(int step) {
        return upper[step];
    }

    public double[] getMean() {
        return mean.clone();
    }

    public double getConfidenceLevel() {
        return confidenceLevel;
    }
}
