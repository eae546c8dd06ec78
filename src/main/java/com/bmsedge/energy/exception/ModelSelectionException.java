package com.bmsedge.energy.exception;

/**
 * No candidate order in the bounded search space produced a usable model.
 * Fatal to the forecast request only.
 */
public class ModelSelectionException extends EnergyEngineException {

    private final int candidatesTried;

    public ModelSelectionException(String message, int candidatesTried) {
        super(message);
        this.candidatesTried = candidatesTried;
    }

    public int getCandidatesTried() {
        return candidatesTried;
    }
}
