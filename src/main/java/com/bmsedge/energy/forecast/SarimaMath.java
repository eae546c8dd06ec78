package com.bmsedge.energy.forecast;

import org.apache.commons.math3.stat.StatUtils;

/**
 * Series arithmetic shared by the order search and the unit-root tests.
 */
public final class SarimaMath {

    private SarimaMath() {
    }

    public static double[] difference(double[] series, int lag) {
        if (series.length <= lag) {
            return new double[0];
        }
        double[] result = new double[series.length - lag];
        for (int t = lag; t < series.length; t++) {
            result[t - lag] = series[t] - series[t - lag];
        }
        return result;
    }

    /**
     * Sample autocorrelation at lags 1..maxLag.
     */
    public static double[] autocorrelation(double[] values, int maxLag) {
        double mean = StatUtils.mean(values);
        double denominator = 0.0;
        for (double v : values) {
            denominator += (v - mean) * (v - mean);
        }
        double[] acf = new double[maxLag];
        if (denominator == 0.0) {
            return acf;
        }
        for (int lag = 1; lag <= maxLag; lag++) {
            double numerator = 0.0;
            for (int t = lag; t < values.length; t++) {
                numerator += (values[t] - mean) * (values[t - lag] - mean);
            }
            acf[lag - 1] = numerator / denominator;
        }
        return acf;
    }
}
