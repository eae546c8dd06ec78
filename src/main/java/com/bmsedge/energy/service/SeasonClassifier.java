package com.bmsedge.energy.service;

import com.bmsedge.energy.model.Season;
import com.bmsedge.energy.model.SeasonInterval;
import com.bmsedge.energy.model.YearSeason;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps calendar dates to seasons. Total over every valid date.
 */
@Component
public class SeasonClassifier {

    public Season seasonOf(LocalDate date) {
        Season match = null;
        for (SeasonInterval interval : intervalsFor(date)) {
            if (interval.contains(date)) {
                if (match != null) {
                    throw new IllegalStateException(date + " falls in both " + match + " and " + interval.getSeason());
                }
                match = interval.getSeason();
            }
        }
        if (match == null) {
            throw new IllegalStateException("No season covers " + date);
        }
        return match;
    }

    public Season seasonOf(LocalDateTime timestamp) {
        return seasonOf(timestamp.toLocalDate());
    }

    /**
     * Grouping key of the season and the date's own calendar year (not the shifted boundary year).
     */
    public YearSeason yearSeasonOf(LocalDate date) {
        return new YearSeason(seasonOf(date), date.getYear());
    }

    public YearSeason yearSeasonOf(LocalDateTime timestamp) {
        return yearSeasonOf(timestamp.toLocalDate());
    }

    /**
     * The concrete range of every season that {@code date} is tested against, in canonical order.
     */
    public List<SeasonInterval> intervalsFor(LocalDate date) {
        List<SeasonInterval> intervals = new ArrayList<>(Season.values().length);
        for (Season season : Season.values()) {
            intervals.add(season.intervalFor(date));
        }
        return intervals;
    }
}
