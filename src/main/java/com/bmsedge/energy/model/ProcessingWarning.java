package com.bmsedge.energy.model;

import lombok.Getter;

import java.util.Objects;

/**
 * A non-fatal condition raised while cleaning, resampling or aggregating.
 */
@Getter
public class ProcessingWarning {

    private final WarningType type;
    private final MeterChannel channel;
    private final String message;

    public ProcessingWarning(WarningType type, MeterChannel channel, String message) {
        this.type = Objects.requireNonNull(type, "type");
        this.channel = channel;
        this.message = message;
    }

    public static ProcessingWarning of(WarningType type, String message) {
        return new ProcessingWarning(type, null, message);
    }

    @Override
    public String toString() {
        return channel == null
                ? type + ": " + message
                : type + " [" + channel.getColumnName() + "]: " + message;
    }
}
