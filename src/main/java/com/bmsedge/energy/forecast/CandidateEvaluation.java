package com.bmsedge.energy.forecast;

import com.bmsedge.energy.model.ModelOrder;
import lombok.Getter;

import java.util.Comparator;

/**
 * Outcome of fitting one candidate order: either a model with its criterion value or a failure reason.
 */
@Getter
public final class CandidateEvaluation {

    /** Values closer than this are treated as tied and resolved by {@link ModelOrder#SIMPLICITY}. */
    public static final double TIE_TOLERANCE = 1e-8;

    /** Best first. Failed candidates sort last. */
    public static final Comparator<CandidateEvaluation> RANKING = (a, b) -> {
        if (a.isSuccessful() != b.isSuccessful()) {
            return a.isSuccessful() ? -1 : 1;
        }
        if (a.isSuccessful() && Math.abs(a.criterionValue - b.criterionValue) > TIE_TOLERANCE) {
            return Double.compare(a.criterionValue, b.criterionValue);
        }
        return ModelOrder.SIMPLICITY.compare(a.order, b.order);
    };

    private final ModelOrder order;
    private final SarimaModel model;
    private final double criterionValue;
    private final String failureReason;

    private CandidateEvaluation(ModelOrder order, SarimaModel model, double criterionValue, String failureReason) {
        this.order = order;
        this.model = model;
        this.criterionValue = criterionValue;
        this.failureReason = failureReason;
    }

    public static CandidateEvaluation fitted(SarimaModel model, double criterionValue) {
        return new CandidateEvaluation(model.getOrder(), model, criterionValue, null);
    }

    public static CandidateEvaluation failed(ModelOrder order, String reason) {
        return new CandidateEvaluation(order, null, Double.NaN, reason);
    }

    public boolean isSuccessful() {
        return model != null && Double.isFinite(criterionValue);
    }

    public boolean isBetterThan(CandidateEvaluation other) {
        return other == null || RANKING.compare(this, other) < 0;
    }

    @Override
    public String toString() {
        return isSuccessful()
                ? order + " criterion=" + criterionValue
                : order + " failed: " + failureReason;
    }
}
