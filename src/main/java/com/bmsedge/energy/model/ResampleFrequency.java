package com.bmsedge.energy.model;

import lombok.Getter;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A resampling frequency: a calendar unit and a positive multiplier, e.g. {@code 3D} or {@code M}.
 */
@Getter
public final class ResampleFrequency {

    public static final ResampleFrequency HOURLY = new ResampleFrequency(FrequencyUnit.HOUR, 1);
    public static final ResampleFrequency DAILY = new ResampleFrequency(FrequencyUnit.DAY, 1);
    public static final ResampleFrequency WEEKLY = new ResampleFrequency(FrequencyUnit.WEEK, 1);
    public static final ResampleFrequency MONTHLY = new ResampleFrequency(FrequencyUnit.MONTH, 1);

    private static final Pattern ALIAS = Pattern.compile("^(\\d*)\\s*([A-Za-z]+)$");

    /** Largest multiplier accepted in an alias. */
    static final int MAX_MULTIPLIER = 10_000;

    private final FrequencyUnit unit;
    private final int multiplier;

    public ResampleFrequency(FrequencyUnit unit, int multiplier) {
        this.unit = Objects.requireNonNull(unit, "unit");
        if (multiplier < 1) {
            throw new IllegalArgumentException("Frequency multiplier must be positive: " + multiplier);
        }
        this.multiplier = multiplier;
    }

    /**
     * Parse an alias such as {@code H}, {@code 2H}, {@code D}, {@code 3D}, {@code W}, {@code M} or {@code 15T}.
     */
    public static ResampleFrequency parse(String alias) {
        if (alias == null || alias.trim().isEmpty()) {
            throw new IllegalArgumentException("Frequency alias must not be empty");
        }
        Matcher matcher = ALIAS.matcher(alias.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid frequency alias: '" + alias + "'");
        }
        int multiplier = matcher.group(1).isEmpty() ? 1 : Integer.parseInt(matcher.group(1));
        if (multiplier > MAX_MULTIPLIER) {
            throw new IllegalArgumentException("Frequency multiplier exceeds " + MAX_MULTIPLIER + ": '" + alias + "'");
        }
        return new ResampleFrequency(parseUnit(matcher.group(2), alias), multiplier);
    }

    private static FrequencyUnit parseUnit(String unit, String alias) {
        switch (unit.toUpperCase(Locale.ROOT)) {
            case "T", "MIN", "MINUTE" -> { return FrequencyUnit.MINUTE; }
            case "H", "HOUR" -> { return FrequencyUnit.HOUR; }
            case "D", "DAY" -> { return FrequencyUnit.DAY; }
            case "W", "WEEK" -> { return FrequencyUnit.WEEK; }
            case "M", "MONTH" -> { return FrequencyUnit.MONTH; }
            default -> throw new IllegalArgumentException("Unknown frequency unit in alias: '" + alias + "'");
        }
    }

    public LocalDateTime label(LocalDateTime timestamp, LocalDateTime origin) {
        return unit.label(timestamp, origin, multiplier);
    }

    public long stepsBetween(LocalDateTime fromLabel, LocalDateTime toLabel) {
        return unit.stepsBetween(fromLabel, toLabel, multiplier);
    }

    public LocalDateTime advance(LocalDateTime label, long steps) {
        return unit.advance(label, multiplier, steps);
    }

    public String getAlias() {
        return multiplier == 1 ? unit.getAlias() : multiplier + unit.getAlias();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResampleFrequency)) return false;
        ResampleFrequency that = (ResampleFrequency) o;
        return multiplier == that.multiplier && unit == that.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(unit, multiplier);
    }

    @Override
    public String toString() {
        return getAlias();
    }
}
