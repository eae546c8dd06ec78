package com.bmsedge.energy.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class YearSeasonTest {

    @Test
    @DisplayName("Should parse a label back into season and year")
    void testParse() {
        YearSeason key = YearSeason.parse("Winter 2007");

        assertEquals(Season.WINTER, key.getSeason());
        assertEquals(2007, key.getYear());
        assertEquals("Winter 2007", key.getLabel());
    }

    @Test
    @DisplayName("Should reject malformed labels")
    void testParseInvalid() {
        assertThrows(IllegalArgumentException.class, () -> YearSeason.parse("Winter"));
        assertThrows(IllegalArgumentException.class, () -> YearSeason.parse("Monsoon 2007"));
        assertThrows(IllegalArgumentException.class, () -> YearSeason.parse("Winter two"));
    }

    @Test
    @DisplayName("Should order by year, then by season order")
    void testOrdering() {
        List<YearSeason> keys = new ArrayList<>(Arrays.asList(
                YearSeason.parse("Spring 2008"),
                YearSeason.parse("Winter 2007"),
                YearSeason.parse("Fall 2007"),
                YearSeason.parse("Winter 2006"),
                YearSeason.parse("Spring 2007")));

        Collections.sort(keys);

        assertEquals(Arrays.asList("Winter 2006", "Spring 2007", "Fall 2007", "Winter 2007", "Spring 2008"),
                keys.stream().map(YearSeason::getLabel).toList());
    }
}
