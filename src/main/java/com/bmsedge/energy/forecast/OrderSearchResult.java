package com.bmsedge.energy.forecast;

import com.bmsedge.energy.model.ModelOrder;
import lombok.Getter;

import java.util.List;

/**
 * Chosen model plus the trace of every candidate evaluated, in evaluation order.
 */
@Getter
public class OrderSearchResult {

    private final CandidateEvaluation best;
    private final List<CandidateEvaluation> evaluations;
    private final InformationCriterion criterion;
    private final int d;
    private final int seasonalD;

    public OrderSearchResult(CandidateEvaluation best, List<CandidateEvaluation> evaluations,
                             InformationCriterion criterion, int d, int seasonalD) {
        this.best = best;
        this.evaluations = List.copyOf(evaluations);
        this.criterion = criterion;
        this.d = d;
        this.seasonalD = seasonalD;
    }

    public SarimaModel getModel() {
        return best.getModel();
    }

    public ModelOrder getOrder() {
        return best.getOrder();
    }

    public double getCriterionValue() {
        return best.getCriterionValue();
    }

    public long getFailedCount() {
        return evaluations.stream().filter(e -> !e.isSuccessful()).count();
    }
}
