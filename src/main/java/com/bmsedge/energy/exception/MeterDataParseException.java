package com.bmsedge.energy.exception;

/**
 * Raw meter input cannot be ingested: a required column is absent, a timestamp cannot be parsed,
 * or the source cannot be read. Fatal to ingestion.
 */
public class MeterDataParseException extends EnergyEngineException {

    private final long lineNumber;

    public MeterDataParseException(String message) {
        super(message);
        this.lineNumber = -1;
    }

    public MeterDataParseException(String message, long lineNumber) {
        super("Line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public MeterDataParseException(String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = -1;
    }

    /**
     * @return the 1-based source line that failed, or -1 when the failure is not tied to a line
     */
    public long getLineNumber() {
        return lineNumber;
    }
}
