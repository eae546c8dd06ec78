package com.bmsedge.energy.config;

import com.bmsedge.energy.forecast.InformationCriterion;
import com.bmsedge.energy.forecast.SearchBounds;
import com.bmsedge.energy.model.SeasonGrouping;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Externalized settings for ingestion, views and the forecast order search.
 * Bound from {@code energy.*} in application.properties.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "energy")
public class EnergyEngineProperties {

    @Valid
    private Input input = new Input();

    @Valid
    private View view = new View();

    @Valid
    private Forecast forecast = new Forecast();

    @Data
    public static class Input {

        /** Raw meter file, read once at start-up */
        private String path = "data/household_power_consumption.txt";

        /** ";", "," or "auto" to sniff from the header line */
        @NotBlank
        private String delimiter = "auto";

        /** Tokens treated as missing before numeric coercion (compared after trimming) */
        private List<String> missingTokens = new ArrayList<>(Arrays.asList("?", ""));

        @NotEmpty
        private List<String> datePatterns = new ArrayList<>(Arrays.asList("d/M/yyyy", "yyyy-MM-dd"));

        @NotEmpty
        private List<String> timePatterns = new ArrayList<>(Arrays.asList("H:mm:ss", "H:mm"));
    }

    @Data
    public static class View {

        /** Resample alias used by the "All data" view when none is requested */
        @NotBlank
        private String defaultFrequency = "H";

        @NotNull
        private SeasonGrouping defaultGrouping = SeasonGrouping.SEASON;
    }

    @Data
    public static class Forecast {

        @Min(1)
        private int horizon = 12;

        @Min(1)
        private int seasonalPeriod = 12;

        @Min(0) private int minP = 0;
        @Min(0) private int maxP = 5;
        @Min(0) private int minQ = 0;
        @Min(0) private int maxQ = 5;
        @Min(0) private int minSeasonalP = 0;
        @Min(0) private int maxSeasonalP = 2;
        @Min(0) private int minSeasonalQ = 0;
        @Min(0) private int maxSeasonalQ = 2;

        @Min(0) private int maxD = 2;
        @Min(0) private int maxSeasonalD = 1;

        /** Fixed differencing orders; unit-root tests decide when unset */
        @Min(0) private Integer d;
        @Min(0) private Integer seasonalD;

        @Min(0) private int startP = 2;
        @Min(0) private int startQ = 2;
        @Min(0) private int startSeasonalP = 1;
        @Min(0) private int startSeasonalQ = 1;

        /** Cap on p + q + P + Q */
        @Min(0)
        private int maxOrder = 5;

        @NotNull
        private InformationCriterion informationCriterion = InformationCriterion.AIC;

        private boolean stepwise = true;

        @Min(1)
        private int maxSteps = 100;

        private boolean withIntercept = true;

        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "1.0", inclusive = false)
        private double whiteNoiseSignificance = 0.05;

        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "1.0", inclusive = false)
        private double confidenceLevel = 0.95;

        /** Worker threads for candidate fits; 1 fits sequentially */
        @Min(1)
        @Max(64)
        private int parallelism = 1;

        public SearchBounds toSearchBounds() {
            return SearchBounds.builder()
                    .minP(minP).maxP(maxP)
                    .minQ(minQ).maxQ(maxQ)
                    .minSeasonalP(minSeasonalP).maxSeasonalP(maxSeasonalP)
                    .minSeasonalQ(minSeasonalQ).maxSeasonalQ(maxSeasonalQ)
                    .maxD(maxD).maxSeasonalD(maxSeasonalD)
                    .d(d).seasonalD(seasonalD)
                    .startP(startP).startQ(startQ)
                    .startSeasonalP(startSeasonalP).startSeasonalQ(startSeasonalQ)
                    .maxOrder(maxOrder)
                    .period(seasonalPeriod)
                    .criterion(informationCriterion)
                    .stepwise(stepwise)
                    .maxSteps(maxSteps)
                    .withIntercept(withIntercept)
                    .whiteNoiseSignificance(whiteNoiseSignificance)
                    .confidenceLevel(confidenceLevel)
                    .build()
                    .validate();
        }
    }
}
