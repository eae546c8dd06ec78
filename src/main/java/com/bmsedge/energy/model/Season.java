package com.bmsedge.energy.model;

import lombok.Getter;

import java.time.LocalDate;
import java.time.Month;
import java.time.MonthDay;
import java.util.Arrays;
import java.util.Optional;

/**
 * The four fixed seasons in canonical order. Boundaries are inclusive month/day pairs;
 * {@link #WINTER} is the only season whose range crosses the December/January seam.
 */
@Getter
public enum Season {

    SPRING(1, "Spring", MonthDay.of(Month.MARCH, 21), MonthDay.of(Month.JUNE, 20)),
    SUMMER(2, "Summer", MonthDay.of(Month.JUNE, 21), MonthDay.of(Month.SEPTEMBER, 22)),
    FALL(3, "Fall", MonthDay.of(Month.SEPTEMBER, 23), MonthDay.of(Month.DECEMBER, 20)),
    WINTER(4, "Winter", MonthDay.of(Month.DECEMBER, 21), MonthDay.of(Month.MARCH, 20));

    private final int order;
    private final String label;
    private final MonthDay start;
    private final MonthDay end;

    Season(int order, String label, MonthDay start, MonthDay end) {
        this.order = order;
        this.label = label;
        this.start = start;
        this.end = end;
    }

    public boolean crossesYearBoundary() {
        return end.isBefore(start);
    }

    /**
     * Concrete range of this season with the start boundary in {@code startYear} and the end boundary
     * in {@code endYear}.
     */
    public SeasonInterval interval(int startYear, int endYear) {
        return new SeasonInterval(this, start.atYear(startYear), end.atYear(endYear));
    }

    /**
     * Concrete range to test {@code date} against. Every season is evaluated in the date's own year,
     * except a year-crossing season: for a date in or before its end month the start is taken from the
     * previous year, and for a date in or after its start month the end is taken from the next year.
     * For any other date the resulting range is empty.
     */
    public SeasonInterval intervalFor(LocalDate date) {
        int year = date.getYear();
        int startYear = year;
        int endYear = year;
        if (crossesYearBoundary()) {
            if (date.getMonthValue() <= end.getMonthValue()) {
                startYear = year - 1;
            }
            if (date.getMonthValue() >= start.getMonthValue()) {
                endYear = year + 1;
            }
        }
        return interval(startYear, endYear);
    }

    public static Optional<Season> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim();
        return Arrays.stream(values())
                .filter(season -> season.label.equalsIgnoreCase(normalized) || season.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
