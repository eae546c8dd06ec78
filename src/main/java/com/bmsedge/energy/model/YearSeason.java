package com.bmsedge.energy.model;

import lombok.Getter;

import java.util.Comparator;
import java.util.Objects;

/**
 * Grouping key combining a season with the raw calendar year of the dates it groups, e.g.
 * {@code "Winter 2007"}. The year is the date's own year, so a winter spanning two calendar
 * years contributes to two keys.
 */
@Getter
public final class YearSeason implements Comparable<YearSeason> {

    private static final Comparator<YearSeason> ORDER = Comparator
            .comparingInt(YearSeason::getYear)
            .thenComparingInt(key -> key.getSeason().getOrder());

    private final Season season;
    private final int year;

    public YearSeason(Season season, int year) {
        this.season = Objects.requireNonNull(season, "season");
        this.year = year;
    }

    /**
     * Parse a {@code "<season> <year>"} label back into its components.
     */
    public static YearSeason parse(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Year-season label must not be null");
        }
        String[] parts = label.trim().split("\\s+");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid year-season label: '" + label + "'");
        }
        Season season = Season.fromLabel(parts[0])
                .orElseThrow(() -> new IllegalArgumentException("Unknown season in label: '" + label + "'"));
        try {
            return new YearSeason(season, Integer.parseInt(parts[1]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid year in label: '" + label + "'", e);
        }
    }

    public String getLabel() {
        return season.getLabel() + " " + year;
    }

    @Override
    public int compareTo(YearSeason other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof YearSeason)) return false;
        YearSeason that = (YearSeason) o;
        return year == that.year && season == that.season;
    }

    @Override
    public int hashCode() {
        return Objects.hash(season, year);
    }

    @Override
    public String toString() {
        return getLabel();
    }
}
