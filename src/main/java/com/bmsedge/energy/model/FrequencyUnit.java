package com.bmsedge.energy.model;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Calendar units a table can be resampled to. Each unit knows how to label the window a timestamp
 * falls into: minute, hour and day windows are labelled by their start and counted from midnight of
 * the first day in the table; week windows run Monday to Sunday and are labelled by the Sunday;
 * month windows are calendar months labelled by their last day.
 */
public enum FrequencyUnit {

    MINUTE("T", Duration.ofMinutes(1)),
    HOUR("H", Duration.ofHours(1)),
    DAY("D", Duration.ofDays(1)),
    WEEK("W", null) {
        @Override
        public LocalDateTime label(LocalDateTime timestamp, LocalDateTime origin, int multiplier) {
            LocalDateTime firstEnd = weekEnd(origin);
            long weeks = ChronoUnit.WEEKS.between(firstEnd, weekEnd(timestamp));
            long bucket = Math.floorDiv(weeks, multiplier);
            return firstEnd.plusWeeks(bucket * multiplier + multiplier - 1);
        }

        @Override
        public long stepsBetween(LocalDateTime fromLabel, LocalDateTime toLabel, int multiplier) {
            return ChronoUnit.WEEKS.between(fromLabel, toLabel) / multiplier;
        }

        @Override
        public LocalDateTime advance(LocalDateTime label, int multiplier, long steps) {
            return label.plusWeeks(steps * multiplier);
        }
    },
    MONTH("M", null) {
        @Override
        public LocalDateTime label(LocalDateTime timestamp, LocalDateTime origin, int multiplier) {
            long first = monthIndex(origin);
            long bucket = Math.floorDiv(monthIndex(timestamp) - first, multiplier);
            return monthEnd(first + bucket * multiplier + multiplier - 1);
        }

        @Override
        public long stepsBetween(LocalDateTime fromLabel, LocalDateTime toLabel, int multiplier) {
            return (monthIndex(toLabel) - monthIndex(fromLabel)) / multiplier;
        }

        @Override
        public LocalDateTime advance(LocalDateTime label, int multiplier, long steps) {
            return monthEnd(monthIndex(label) + steps * multiplier);
        }
    };

    private final String alias;
    private final Duration length;

    FrequencyUnit(String alias, Duration length) {
        this.alias = alias;
        this.length = length;
    }

    public String getAlias() {
        return alias;
    }

    /**
     * Label of the window containing {@code timestamp}, for windows laid out from {@code origin}.
     */
    public LocalDateTime label(LocalDateTime timestamp, LocalDateTime origin, int multiplier) {
        LocalDateTime start = origin.toLocalDate().atStartOfDay();
        long windowSeconds = length.getSeconds() * multiplier;
        long elapsed = Duration.between(start, timestamp).getSeconds();
        return start.plusSeconds(Math.floorDiv(elapsed, windowSeconds) * windowSeconds);
    }

    /**
     * Number of whole windows from one label to a later one.
     */
    public long stepsBetween(LocalDateTime fromLabel, LocalDateTime toLabel, int multiplier) {
        return Duration.between(fromLabel, toLabel).getSeconds() / (length.getSeconds() * multiplier);
    }

    /**
     * Label {@code steps} windows after {@code label}.
     */
    public LocalDateTime advance(LocalDateTime label, int multiplier, long steps) {
        return label.plusSeconds(length.getSeconds() * multiplier * steps);
    }

    private static LocalDateTime weekEnd(LocalDateTime timestamp) {
        return timestamp.toLocalDate().with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY)).atStartOfDay();
    }

    private static long monthIndex(LocalDateTime timestamp) {
        return timestamp.getYear() * 12L + timestamp.getMonthValue() - 1;
    }

    private static LocalDateTime monthEnd(long monthIndex) {
        int year = (int) Math.floorDiv(monthIndex, 12);
        int month = (int) Math.floorMod(monthIndex, 12) + 1;
        return LocalDate.of(year, month, 1).with(TemporalAdjusters.lastDayOfMonth()).atStartOfDay();
    }
}
