package com.bmsedge.energy.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.stereotype.Component;

/**
 * Maps failures escaping the command-line runner to process exit codes.
 */
@Component
public class EngineExitCodeMapper implements ExitCodeExceptionMapper {

    public static final int GENERIC_FAILURE = 1;
    public static final int PARSE_FAILURE = 2;
    public static final int MODEL_SELECTION_FAILURE = 3;
    public static final int INVALID_ARGUMENT = 4;

    private static final Logger logger = LoggerFactory.getLogger(EngineExitCodeMapper.class);

    @Override
    public int getExitCode(Throwable exception) {
        Throwable cause = rootEngineCause(exception);

        if (cause instanceof MeterDataParseException) {
            logger.error("Ingestion failed: {}", cause.getMessage());
            return PARSE_FAILURE;
        }
        if (cause instanceof ModelSelectionException) {
            logger.error("Forecast failed: {}", cause.getMessage());
            return MODEL_SELECTION_FAILURE;
        }
        if (cause instanceof IllegalArgumentException) {
            logger.error("Invalid argument: {}", cause.getMessage());
            return INVALID_ARGUMENT;
        }

        logger.error("Unexpected error: {}", cause.getMessage(), cause);
        return GENERIC_FAILURE;
    }

    // Spring wraps runner failures in IllegalStateException
    private Throwable rootEngineCause(Throwable exception) {
        Throwable current = exception;
        while (current != null) {
            if (current instanceof EnergyEngineException || current instanceof IllegalArgumentException) {
                return current;
            }
            current = current.getCause();
        }
        return exception;
    }
}
