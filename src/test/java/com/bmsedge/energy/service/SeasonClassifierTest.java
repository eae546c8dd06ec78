package com.bmsedge.energy.service;

import com.bmsedge.energy.model.Season;
import com.bmsedge.energy.model.SeasonInterval;
import com.bmsedge.energy.model.YearSeason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SeasonClassifierTest {

    private SeasonClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new SeasonClassifier();
    }

    @Test
    @DisplayName("Every date from 2000 to 2030 falls in exactly one season")
    void testExactlyOneSeasonPerDate() {
        for (LocalDate date = LocalDate.of(2000, 1, 1); date.isBefore(LocalDate.of(2031, 1, 1)); date = date.plusDays(1)) {
            int matches = 0;
            for (SeasonInterval interval : classifier.intervalsFor(date)) {
                if (interval.contains(date)) {
                    matches++;
                }
            }
            assertEquals(1, matches, "season matches for " + date);
            assertNotNull(classifier.seasonOf(date));
        }
    }

    @Test
    @DisplayName("Seasons partition each year with the expected number of days")
    void testSeasonsPartitionYear() {
        Map<Season, Integer> days = new EnumMap<>(Season.class);
        for (LocalDate date = LocalDate.of(2007, 1, 1); date.getYear() == 2007; date = date.plusDays(1)) {
            days.merge(classifier.seasonOf(date), 1, Integer::sum);
        }

        assertEquals(92, days.get(Season.SPRING));
        assertEquals(94, days.get(Season.SUMMER));
        assertEquals(89, days.get(Season.FALL));
        assertEquals(90, days.get(Season.WINTER));
    }

    @ParameterizedTest
    @CsvSource({
            "2007-03-20, WINTER",
            "2007-03-21, SPRING",
            "2007-06-20, SPRING",
            "2007-06-21, SUMMER",
            "2007-09-22, SUMMER",
            "2007-09-23, FALL",
            "2007-12-20, FALL",
            "2007-12-21, WINTER",
            "2007-12-31, WINTER",
            "2008-01-01, WINTER",
            "2008-02-29, WINTER"
    })
    @DisplayName("Boundary days classify into the right season")
    void testBoundaries(String date, Season expected) {
        assertEquals(expected, classifier.seasonOf(LocalDate.parse(date)));
    }

    @Test
    @DisplayName("Dates either side of the year seam belong to the same winter")
    void testWinterAcrossYearSeam() {
        LocalDate december = LocalDate.of(2007, 12, 25);
        LocalDate january = LocalDate.of(2008, 1, 15);

        assertEquals(Season.WINTER, classifier.seasonOf(december));
        assertEquals(Season.WINTER, classifier.seasonOf(january));
        assertEquals(Season.WINTER.intervalFor(december), Season.WINTER.intervalFor(january));
    }

    @Test
    @DisplayName("Year-season keys use the date's own calendar year")
    void testYearSeasonUsesRawYear() {
        YearSeason december = classifier.yearSeasonOf(LocalDateTime.of(2007, 12, 25, 8, 0));
        YearSeason january = classifier.yearSeasonOf(LocalDate.of(2008, 1, 15));

        assertEquals("Winter 2007", december.getLabel());
        assertEquals("Winter 2008", january.getLabel());
    }
}
