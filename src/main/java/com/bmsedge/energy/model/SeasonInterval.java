package com.bmsedge.energy.model;

import lombok.Getter;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A season's concrete [start, end] date range, both ends inclusive.
 * A range whose start lies after its end contains no date.
 */
@Getter
public final class SeasonInterval {

    private final Season season;
    private final LocalDate start;
    private final LocalDate end;

    public SeasonInterval(Season season, LocalDate start, LocalDate end) {
        this.season = Objects.requireNonNull(season, "season");
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    public boolean isEmpty() {
        return start.isAfter(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SeasonInterval)) return false;
        SeasonInterval that = (SeasonInterval) o;
        return season == that.season && start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(season, start, end);
    }

    @Override
    public String toString() {
        return season.getLabel() + " [" + start + ", " + end + "]";
    }
}
