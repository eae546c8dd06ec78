package com.bmsedge.energy.dto;

import com.bmsedge.energy.forecast.InformationCriterion;
import com.bmsedge.energy.model.ProcessingWarning;
import lombok.Getter;

import java.util.List;

/**
 * Forecast overlay: the observed monthly totals, the predicted periods and the selected model.
 */
@Getter
public class ForecastResult {

    private final List<SeriesPoint> observed;
    private final List<ForecastPoint> forecast;
    private final String order;
    private final InformationCriterion criterion;
    private final double criterionValue;
    private final double confidenceLevel;
    private final int candidatesEvaluated;
    private final long candidatesFailed;
    private final List<ProcessingWarning> warnings;

    public ForecastResult(List<SeriesPoint> observed, List<ForecastPoint> forecast, String order,
                          InformationCriterion criterion, double criterionValue, double confidenceLevel,
                          int candidatesEvaluated, long candidatesFailed, List<ProcessingWarning> warnings) {
        this.observed = List.copyOf(observed);
        this.forecast = List.copyOf(forecast);
        this.order = order;
        this.criterion = criterion;
        this.criterionValue = criterionValue;
        this.confidenceLevel = confidenceLevel;
        this.candidatesEvaluated = candidatesEvaluated;
        this.candidatesFailed = candidatesFailed;
        this.warnings = List.copyOf(warnings);
    }

    public int getHorizon() {
        return forecast.size();
    }
}
