package com.bmsedge.energy.forecast;

import com.bmsedge.energy.model.ModelOrder;

/**
 * A fitted seasonal ARIMA model.
 */
public interface SarimaModel {

    ModelOrder getOrder();

    double getLogLikelihood();

    /** Estimated coefficients plus the innovation variance. */
    int getParameterCount();

    /** Observations the likelihood was computed over: the series length less d + D*m. */
    int getObservationCount();

    double getSigma2();

    boolean hasIntercept();

    /** One-step residuals on the differenced scale. */
    double[] getResiduals();

    /**
     * Point forecasts and symmetric prediction bounds for the next {@code steps} periods on the
     * original (undifferenced) scale.
     */
    ModelForecast forecast(int steps, double confidenceLevel);
}
