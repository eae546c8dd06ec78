package com.bmsedge.energy.forecast;

import com.bmsedge.energy.exception.NonConvergentCandidateException;
import com.bmsedge.energy.model.ModelOrder;

/**
 * Fits one seasonal ARIMA order to a series. Implementations must be stateless so candidates can be
 * fitted concurrently.
 */
public interface SarimaFitter {

    /**
     * @param series        observations, oldest first
     * @param order         the candidate order
     * @param withIntercept whether to estimate a mean (or drift, once differenced) when d + D is at most 1
     * @throws NonConvergentCandidateException when the candidate cannot be fitted reliably
     */
    SarimaModel fit(double[] series, ModelOrder order, boolean withIntercept);
}
