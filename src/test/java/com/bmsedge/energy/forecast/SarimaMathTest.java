package com.bmsedge.energy.forecast;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SarimaMathTest {

    private static final double EPS = 1e-12;

    @Test
    @DisplayName("Should difference at a given lag")
    void testDifference() {
        assertArrayEquals(new double[]{3, 5, 7}, SarimaMath.difference(new double[]{1, 4, 9, 16}, 1), EPS);
        assertArrayEquals(new double[]{8, 12}, SarimaMath.difference(new double[]{1, 4, 9, 16}, 2), EPS);
        assertEquals(0, SarimaMath.difference(new double[]{1, 2}, 2).length);
    }

    @Test
    @DisplayName("Autocorrelation of an alternating series flips sign")
    void testAutocorrelation() {
        double[] acf = SarimaMath.autocorrelation(new double[]{1, -1, 1, -1, 1, -1, 1, -1}, 2);

        assertTrue(acf[0] < -0.8);
        assertTrue(acf[1] > 0.7);
    }
}
