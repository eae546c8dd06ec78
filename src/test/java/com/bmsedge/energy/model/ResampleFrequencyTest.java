package com.bmsedge.energy.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class ResampleFrequencyTest {

    @ParameterizedTest
    @CsvSource({
            "H, HOUR, 1",
            "2H, HOUR, 2",
            "D, DAY, 1",
            "3D, DAY, 3",
            "W, WEEK, 1",
            "M, MONTH, 1",
            "15T, MINUTE, 15",
            "5min, MINUTE, 5",
            "'2 day', DAY, 2"
    })
    @DisplayName("Should parse frequency aliases")
    void testParse(String alias, FrequencyUnit unit, int multiplier) {
        ResampleFrequency frequency = ResampleFrequency.parse(alias);

        assertEquals(unit, frequency.getUnit());
        assertEquals(multiplier, frequency.getMultiplier());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "0H", "X", "H2", "-1D"})
    @DisplayName("Should reject invalid aliases")
    void testParseInvalid(String alias) {
        assertThrows(IllegalArgumentException.class, () -> ResampleFrequency.parse(alias));
    }

    @ParameterizedTest
    @ValueSource(strings = {"99999999M", "10001D", "99999999999H"})
    @DisplayName("Should reject multipliers beyond the supported range with IllegalArgumentException")
    void testParseOversizedMultiplier(String alias) {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> ResampleFrequency.parse(alias));

        assertFalse(ex.getMessage().isEmpty());
    }

    @Test
    @DisplayName("Largest accepted multiplier still labels month windows")
    void testParseMaximumMultiplier() {
        ResampleFrequency frequency = ResampleFrequency.parse(ResampleFrequency.MAX_MULTIPLIER + "M");

        assertEquals(ResampleFrequency.MAX_MULTIPLIER, frequency.getMultiplier());
        assertNotNull(frequency.label(LocalDateTime.of(2007, 1, 3, 12, 0), LocalDateTime.of(2007, 1, 1, 0, 0)));
    }

    @Test
    @DisplayName("Hour and day windows are labelled by their start")
    void testHourAndDayLabels() {
        LocalDateTime origin = LocalDateTime.of(2007, 1, 1, 10, 17);

        assertEquals(LocalDateTime.of(2007, 1, 1, 11, 0),
                ResampleFrequency.HOURLY.label(LocalDateTime.of(2007, 1, 1, 11, 59), origin));
        assertEquals(LocalDateTime.of(2007, 1, 4, 0, 0),
                ResampleFrequency.parse("3D").label(LocalDateTime.of(2007, 1, 5, 8, 0), origin));
        assertEquals(LocalDateTime.of(2007, 1, 1, 10, 0),
                ResampleFrequency.parse("2H").label(LocalDateTime.of(2007, 1, 1, 11, 30), origin));
    }

    @Test
    @DisplayName("Week windows are labelled by their Sunday, month windows by their last day")
    void testWeekAndMonthLabels() {
        LocalDateTime wednesday = LocalDateTime.of(2007, 1, 3, 12, 0);

        assertEquals(LocalDateTime.of(2007, 1, 7, 0, 0), ResampleFrequency.WEEKLY.label(wednesday, wednesday));
        assertEquals(LocalDateTime.of(2007, 1, 31, 0, 0), ResampleFrequency.MONTHLY.label(wednesday, wednesday));
        assertEquals(LocalDateTime.of(2008, 2, 29, 0, 0),
                ResampleFrequency.MONTHLY.label(LocalDateTime.of(2008, 2, 10, 0, 0), wednesday));
    }

    @Test
    @DisplayName("Advancing month labels stays on month ends")
    void testAdvanceMonth() {
        LocalDateTime january = LocalDateTime.of(2008, 1, 31, 0, 0);

        assertEquals(LocalDateTime.of(2008, 2, 29, 0, 0), ResampleFrequency.MONTHLY.advance(january, 1));
        assertEquals(LocalDateTime.of(2008, 4, 30, 0, 0), ResampleFrequency.MONTHLY.advance(january, 3));
        assertEquals(3, ResampleFrequency.MONTHLY.stepsBetween(january, LocalDateTime.of(2008, 4, 30, 0, 0)));
    }

    @Test
    @DisplayName("Alias round-trips through toString")
    void testAlias() {
        assertEquals("3D", ResampleFrequency.parse("3d").getAlias());
        assertEquals("M", ResampleFrequency.MONTHLY.toString());
    }
}
