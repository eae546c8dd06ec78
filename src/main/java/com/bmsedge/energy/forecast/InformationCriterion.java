package com.bmsedge.energy.forecast;

/**
 * Criteria used to rank fitted candidates; lower is better.
 */
public enum InformationCriterion {

    AIC {
        @Override
        public double evaluate(double logLikelihood, int parameters, int observations) {
            return -2.0 * logLikelihood + 2.0 * parameters;
        }
    },
    AICC {
        @Override
        public double evaluate(double logLikelihood, int parameters, int observations) {
            double denominator = observations - parameters - 1.0;
            if (denominator <= 0) {
                return Double.POSITIVE_INFINITY;
            }
            return AIC.evaluate(logLikelihood, parameters, observations)
                    + 2.0 * parameters * (parameters + 1.0) / denominator;
        }
    },
    BIC {
        @Override
        public double evaluate(double logLikelihood, int parameters, int observations) {
            return -2.0 * logLikelihood + parameters * Math.log(observations);
        }
    };

    public abstract double evaluate(double logLikelihood, int parameters, int observations);

    public double evaluate(SarimaModel model) {
        return evaluate(model.getLogLikelihood(), model.getParameterCount(), model.getObservationCount());
    }
}
