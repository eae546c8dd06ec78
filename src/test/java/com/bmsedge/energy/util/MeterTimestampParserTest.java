package com.bmsedge.energy.util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class MeterTimestampParserTest {

    private MeterTimestampParser parser;

    @BeforeEach
    void setUp() {
        parser = new MeterTimestampParser(Arrays.asList("d/M/yyyy", "yyyy-MM-dd"), Arrays.asList("H:mm:ss", "H:mm"));
    }

    @Test
    @DisplayName("Should parse split day-first date and time fields")
    void testSplitFields() {
        assertEquals(LocalDateTime.of(2006, 12, 16, 17, 24), parser.parse("16/12/2006", "17:24:00"));
        assertEquals(LocalDateTime.of(2007, 1, 1, 0, 5), parser.parse("1/1/2007", "0:05"));
    }

    @Test
    @DisplayName("Should parse a combined ISO-style field with or without a time")
    void testCombinedField() {
        assertEquals(LocalDateTime.of(2006, 12, 16, 17, 0), parser.parseCombined("2006-12-16 17:00:00"));
        assertEquals(LocalDateTime.of(2006, 12, 16, 17, 0), parser.parseCombined("2006-12-16T17:00"));
        assertEquals(LocalDateTime.of(2007, 1, 31, 0, 0), parser.parseCombined("2007-01-31"));
    }

    @Test
    @DisplayName("Should switch layouts mid-stream")
    void testLayoutSwitch() {
        parser.parse("16/12/2006", "17:24:00");

        assertEquals(LocalDateTime.of(2006, 12, 17, 8, 0), parser.parse("2006-12-17", "8:00"));
        assertEquals(LocalDateTime.of(2006, 12, 18, 9, 30), parser.parse("18/12/2006", "09:30:00"));
    }

    @Test
    @DisplayName("Should reject unrecognised or empty values")
    void testRejects() {
        assertThrows(DateTimeParseException.class, () -> parser.parse("31/02/2007x", "10:00:00"));
        assertThrows(DateTimeParseException.class, () -> parser.parse("16/12/2006", "noon"));
        assertThrows(DateTimeParseException.class, () -> parser.parse(" ", "10:00:00"));
        assertThrows(DateTimeParseException.class, () -> parser.parseCombined(null));
        assertThrows(IllegalArgumentException.class,
                () -> new MeterTimestampParser(Collections.emptyList(), Arrays.asList("H:mm")));
    }
}
