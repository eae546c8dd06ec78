package com.bmsedge.energy.exception;

/**
 * A single candidate model could not be fitted. The order search records it and moves on.
 */
public class NonConvergentCandidateException extends EnergyEngineException {

    public NonConvergentCandidateException(String message) {
        super(message);
    }

    public NonConvergentCandidateException(String message, Throwable cause) {
        super(message, cause);
    }
}
