package com.bmsedge.energy.exception;

public class EnergyEngineException extends RuntimeException {

    public EnergyEngineException(String message) {
        super(message);
    }

    public EnergyEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
