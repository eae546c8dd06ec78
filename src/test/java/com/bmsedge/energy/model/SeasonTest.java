package com.bmsedge.energy.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class SeasonTest {

    @Test
    @DisplayName("Only winter crosses the year boundary")
    void testCrossesYearBoundary() {
        assertTrue(Season.WINTER.crossesYearBoundary());
        assertFalse(Season.SPRING.crossesYearBoundary());
        assertFalse(Season.SUMMER.crossesYearBoundary());
        assertFalse(Season.FALL.crossesYearBoundary());
    }

    @Test
    @DisplayName("Winter interval for a January date starts the previous December")
    void testWinterIntervalInJanuary() {
        SeasonInterval interval = Season.WINTER.intervalFor(LocalDate.of(2008, 1, 15));

        assertEquals(LocalDate.of(2007, 12, 21), interval.getStart());
        assertEquals(LocalDate.of(2008, 3, 20), interval.getEnd());
        assertTrue(interval.contains(LocalDate.of(2008, 1, 15)));
    }

    @Test
    @DisplayName("Winter interval for a December date ends the following March")
    void testWinterIntervalInDecember() {
        SeasonInterval interval = Season.WINTER.intervalFor(LocalDate.of(2007, 12, 25));

        assertEquals(LocalDate.of(2007, 12, 21), interval.getStart());
        assertEquals(LocalDate.of(2008, 3, 20), interval.getEnd());
    }

    @Test
    @DisplayName("Winter interval for a mid-year date is empty")
    void testWinterIntervalInSummerIsEmpty() {
        SeasonInterval interval = Season.WINTER.intervalFor(LocalDate.of(2007, 7, 1));

        assertTrue(interval.isEmpty());
        assertFalse(interval.contains(LocalDate.of(2007, 7, 1)));
    }

    @Test
    @DisplayName("Explicit (season, year) intervals are inclusive at both ends")
    void testIntervalInclusive() {
        SeasonInterval summer = Season.SUMMER.interval(2010, 2010);

        assertTrue(summer.contains(LocalDate.of(2010, 6, 21)));
        assertTrue(summer.contains(LocalDate.of(2010, 9, 22)));
        assertFalse(summer.contains(LocalDate.of(2010, 6, 20)));
        assertFalse(summer.contains(LocalDate.of(2010, 9, 23)));
    }

    @Test
    @DisplayName("Should look seasons up by label or name")
    void testFromLabel() {
        assertEquals(Season.FALL, Season.fromLabel("Fall").orElseThrow());
        assertEquals(Season.WINTER, Season.fromLabel(" winter ").orElseThrow());
        assertTrue(Season.fromLabel("Autumn").isEmpty());
        assertTrue(Season.fromLabel(null).isEmpty());
    }
}
