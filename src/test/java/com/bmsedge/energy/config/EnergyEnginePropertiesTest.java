package com.bmsedge.energy.config;

import com.bmsedge.energy.forecast.InformationCriterion;
import com.bmsedge.energy.forecast.SearchBounds;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnergyEnginePropertiesTest {

    @Test
    @DisplayName("Forecast settings translate into search bounds")
    void testToSearchBounds() {
        EnergyEngineProperties.Forecast forecast = new EnergyEngineProperties.Forecast();
        forecast.setMaxP(3);
        forecast.setMaxSeasonalQ(1);
        forecast.setSeasonalD(1);
        forecast.setSeasonalPeriod(4);
        forecast.setInformationCriterion(InformationCriterion.BIC);
        forecast.setStepwise(false);

        SearchBounds bounds = forecast.toSearchBounds();

        assertEquals(3, bounds.getMaxP());
        assertEquals(1, bounds.getMaxSeasonalQ());
        assertEquals(1, bounds.getSeasonalD());
        assertNull(bounds.getD());
        assertEquals(4, bounds.getPeriod());
        assertEquals(InformationCriterion.BIC, bounds.getCriterion());
        assertFalse(bounds.isStepwise());
    }

    @Test
    @DisplayName("Inconsistent bounds are rejected when the search bounds are built")
    void testInconsistentBoundsRejected() {
        EnergyEngineProperties.Forecast forecast = new EnergyEngineProperties.Forecast();
        forecast.setMinP(4);
        forecast.setMaxP(2);

        assertThrows(IllegalArgumentException.class, forecast::toSearchBounds);
    }

    @Test
    @DisplayName("Defaults cover the household meter file layout")
    void testDefaults() {
        EnergyEngineProperties properties = new EnergyEngineProperties();

        assertEquals("auto", properties.getInput().getDelimiter());
        assertTrue(properties.getInput().getMissingTokens().contains("?"));
        assertEquals("H", properties.getView().getDefaultFrequency());
        assertEquals(12, properties.getForecast().getHorizon());
        assertEquals(12, properties.getForecast().toSearchBounds().getPeriod());
    }
}
