package com.bmsedge.energy.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses meter timestamps given either as separate date and time fields ({@code 16/12/2006} and
 * {@code 17:24:00}) or as one combined field ({@code 2006-12-16 17:24:00}).
 * The formatter that matched last is tried first, since a file uses a single layout throughout.
 */
public class MeterTimestampParser {

    private final List<DateTimeFormatter> dateFormatters = new ArrayList<>();
    private final List<DateTimeFormatter> timeFormatters = new ArrayList<>();

    private DateTimeFormatter lastDateFormatter;
    private DateTimeFormatter lastTimeFormatter;

    public MeterTimestampParser(List<String> datePatterns, List<String> timePatterns) {
        if (datePatterns == null || datePatterns.isEmpty()) {
            throw new IllegalArgumentException("At least one date pattern is required");
        }
        if (timePatterns == null || timePatterns.isEmpty()) {
            throw new IllegalArgumentException("At least one time pattern is required");
        }
        for (String pattern : datePatterns) {
            dateFormatters.add(DateTimeFormatter.ofPattern(pattern));
        }
        for (String pattern : timePatterns) {
            timeFormatters.add(DateTimeFormatter.ofPattern(pattern));
        }
    }

    public LocalDateTime parse(String date, String time) {
        if (date == null || date.trim().isEmpty()) {
            throw new DateTimeParseException("Empty date", date == null ? "" : date, 0);
        }
        LocalDate parsedDate = parseDate(date.trim());
        if (time == null || time.trim().isEmpty()) {
            return parsedDate.atStartOfDay();
        }
        return LocalDateTime.of(parsedDate, parseTime(time.trim()));
    }

    /**
     * Parse a combined field, with date and time separated by a space or {@code T}.
     */
    public LocalDateTime parseCombined(String dateTime) {
        if (dateTime == null || dateTime.trim().isEmpty()) {
            throw new DateTimeParseException("Empty timestamp", dateTime == null ? "" : dateTime, 0);
        }
        String[] parts = dateTime.trim().split("[ T]", 2);
        return parse(parts[0], parts.length > 1 ? parts[1] : null);
    }

    private LocalDate parseDate(String value) {
        if (lastDateFormatter != null) {
            Optional<TemporalAccessor> parsed = tryParse(value, lastDateFormatter);
            if (parsed.isPresent()) {
                return LocalDate.from(parsed.get());
            }
        }
        for (DateTimeFormatter formatter : dateFormatters) {
            Optional<TemporalAccessor> parsed = tryParse(value, formatter);
            if (parsed.isPresent()) {
                lastDateFormatter = formatter;
                return LocalDate.from(parsed.get());
            }
        }
        throw new DateTimeParseException("Unrecognised date '" + value + "'", value, 0);
    }

    private LocalTime parseTime(String value) {
        if (lastTimeFormatter != null) {
            Optional<TemporalAccessor> parsed = tryParse(value, lastTimeFormatter);
            if (parsed.isPresent()) {
                return LocalTime.from(parsed.get());
            }
        }
        for (DateTimeFormatter formatter : timeFormatters) {
            Optional<TemporalAccessor> parsed = tryParse(value, formatter);
            if (parsed.isPresent()) {
                lastTimeFormatter = formatter;
                return LocalTime.from(parsed.get());
            }
        }
        throw new DateTimeParseException("Unrecognised time '" + value + "'", value, 0);
    }

    private static Optional<TemporalAccessor> tryParse(String value, DateTimeFormatter formatter) {
        try {
            return Optional.of(formatter.parse(value));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
