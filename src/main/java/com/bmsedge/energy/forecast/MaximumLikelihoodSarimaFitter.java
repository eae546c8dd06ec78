package com.bmsedge.energy.forecast;

import com.bmsedge.energy.exception.NonConvergentCandidateException;
import com.bmsedge.energy.model.ModelOrder;
import com.github.signaflo.timeseries.TimePeriod;
import com.github.signaflo.timeseries.TimeSeries;
import com.github.signaflo.timeseries.TimeUnit;
import com.github.signaflo.timeseries.model.arima.Arima;
import com.github.signaflo.timeseries.model.arima.ArimaOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fits seasonal ARIMA candidates with signaflo's exact-likelihood estimator (CSS start values refined
 * by maximum likelihood). The likelihood of every candidate is evaluated over the same differenced
 * series of {@code n - d - D*m} observations, so criteria are comparable across AR and MA orders.
 */
@Component
public class MaximumLikelihoodSarimaFitter implements SarimaFitter {

    private static final Logger logger = LoggerFactory.getLogger(MaximumLikelihoodSarimaFitter.class);

    /** Innovation variance below this fraction of the series' mean square is treated as a perfect fit. */
    private static final double DEGENERATE_VARIANCE_RATIO = 1e-12;

    @Override
    public SarimaModel fit(double[] series, ModelOrder order, boolean withIntercept) {
        int differenced = order.getD() + order.getSeasonalD() * order.getPeriod();
        boolean intercept = withIntercept && order.getD() + order.getSeasonalD() <= 1;
        int parameters = order.totalOrder() + (intercept ? 1 : 0) + 1;
        int effective = series.length - differenced;
        if (effective - order.arLags() <= parameters + 1) {
            throw new NonConvergentCandidateException("Too few observations (" + series.length + ") for " + order);
        }

        Arima arima;
        try {
            arima = Arima.model(
                    TimeSeries.from(TimePeriod.oneYear(), series),
                    toArimaOrder(order, intercept),
                    new TimePeriod(TimeUnit.YEAR, Math.max(1, order.getPeriod())),
                    Arima.FittingStrategy.CSSML);
        } catch (RuntimeException e) {
            throw new NonConvergentCandidateException("Estimation failed for " + order + ": " + e.getMessage(), e);
        }

        double logLikelihood = arima.logLikelihood();
        double sigma2 = arima.sigma2();
        if (!Double.isFinite(logLikelihood) || !Double.isFinite(sigma2)) {
            throw new NonConvergentCandidateException("Non-finite likelihood for " + order);
        }
        if (sigma2 <= DEGENERATE_VARIANCE_RATIO * meanSquare(series)) {
            throw new NonConvergentCandidateException("Degenerate innovation variance for " + order);
        }

        double[] errors = arima.predictionErrors().asArray();
        double[] residuals = new double[Math.max(0, errors.length - differenced)];
        System.arraycopy(errors, errors.length - residuals.length, residuals, 0, residuals.length);

        logger.trace("{} logLik={} sigma2={}", order, logLikelihood, sigma2);
        return new FittedSarimaModel(arima, order, intercept, logLikelihood, sigma2, parameters, effective, residuals);
    }

    private static ArimaOrder toArimaOrder(ModelOrder order, boolean intercept) {
        return ArimaOrder.order(order.getP(), order.getD(), order.getQ(),
                order.getSeasonalP(), order.getSeasonalD(), order.getSeasonalQ(),
                intercept ? Arima.Constant.INCLUDE : Arima.Constant.EXCLUDE);
    }

    private static double meanSquare(double[] series) {
        double sum = 0.0;
        for (double v : series) {
            sum += v * v;
        }
        return series.length == 0 ? 0.0 : sum / series.length;
    }
}
