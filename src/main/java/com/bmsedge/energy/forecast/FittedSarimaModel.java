package com.bmsedge.energy.forecast;

import com.bmsedge.energy.model.ModelOrder;
import com.github.signaflo.timeseries.forecast.Forecast;
import com.github.signaflo.timeseries.model.arima.Arima;

/**
 * A signaflo {@link Arima} model seen through the engine's {@link SarimaModel} view.
 */
class FittedSarimaModel implements SarimaModel {

    private final Arima arima;
    private final ModelOrder order;
    private final boolean intercept;
    private final double logLikelihood;
    private final double sigma2;
    private final int parameterCount;
    private final int observationCount;
    private final double[] residuals;

    FittedSarimaModel(Arima arima, ModelOrder order, boolean intercept, double logLikelihood, double sigma2,
                      int parameterCount, int observationCount, double[] residuals) {
        this.arima = arima;
        this.order = order;
        this.intercept = intercept;
        this.logLikelihood = logLikelihood;
        this.sigma2 = sigma2;
        this.parameterCount = parameterCount;
        this.observationCount = observationCount;
        this.residuals = residuals;
    }

    @Override
    public ModelOrder getOrder() {
        return order;
    }

    @Override
    public double getLogLikelihood() {
        return logLikelihood;
    }

    @Override
    public int getParameterCount() {
        return parameterCount;
    }

    @Override
    public int getObservationCount() {
        return observationCount;
    }

    @Override
    public double getSigma2() {
        return sigma2;
    }

    @Override
    public boolean hasIntercept() {
        return intercept;
    }

    @Override
    public double[] getResiduals() {
        return residuals.clone();
    }

    @Override
    public ModelForecast forecast(int steps, double confidenceLevel) {
        if (steps < 1) {
            throw new IllegalArgumentException("Forecast horizon must be positive: " + steps);
        }
        if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
            throw new IllegalArgumentException("Confidence level must be in (0, 1): " + confidenceLevel);
        }
        Forecast forecast = arima.forecast(steps, 1.0 - confidenceLevel);
        return new ModelForecast(
                forecast.pointEstimates().asArray(),
                forecast.lowerPredictionInterval().asArray(),
                forecast.upperPredictionInterval().asArray(),
                confidenceLevel);
    }
}
