package com.bmsedge.energy.forecast;

import com.bmsedge.energy.model.ModelOrder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CandidateEvaluationTest {

    @Test
    @DisplayName("Lower criterion value ranks first")
    void testLowerCriterionWins() {
        CandidateEvaluation complex = fitted(ModelOrder.nonSeasonal(2, 0, 1), 100.0);
        CandidateEvaluation simple = fitted(ModelOrder.nonSeasonal(0, 0, 1), 101.0);

        assertTrue(complex.isBetterThan(simple));
    }

    @Test
    @DisplayName("Ties within tolerance go to the simpler order")
    void testTieBreakBySimplicity() {
        CandidateEvaluation complex = fitted(ModelOrder.nonSeasonal(1, 0, 1), 100.0);
        CandidateEvaluation simple = fitted(ModelOrder.nonSeasonal(0, 0, 1), 100.0 + 1e-10);
        CandidateEvaluation sameSizeLaterP = fitted(ModelOrder.nonSeasonal(1, 0, 0), 100.0);

        assertTrue(simple.isBetterThan(complex));
        // same total order: lower p first
        assertTrue(simple.isBetterThan(sameSizeLaterP));
    }

    @Test
    @DisplayName("Failed candidates sort after every fitted one")
    void testFailuresSortLast() {
        CandidateEvaluation failed = CandidateEvaluation.failed(ModelOrder.nonSeasonal(0, 0, 0), "did not converge");
        CandidateEvaluation fitted = fitted(ModelOrder.nonSeasonal(3, 0, 2), 1e6);

        List<CandidateEvaluation> evaluations = new ArrayList<>(Arrays.asList(failed, fitted));
        evaluations.sort(CandidateEvaluation.RANKING);

        assertSame(fitted, evaluations.get(0));
        assertFalse(failed.isSuccessful());
        assertEquals("did not converge", failed.getFailureReason());
        assertTrue(failed.toString().contains("failed"));
    }

    private static CandidateEvaluation fitted(ModelOrder order, double value) {
        SarimaModel model = mock(SarimaModel.class);
        when(model.getOrder()).thenReturn(order);
        return CandidateEvaluation.fitted(model, value);
    }
}
