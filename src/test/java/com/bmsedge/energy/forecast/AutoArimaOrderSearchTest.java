package com.bmsedge.energy.forecast;

import com.bmsedge.energy.exception.ModelSelectionException;
import com.bmsedge.energy.exception.NonConvergentCandidateException;
import com.bmsedge.energy.model.ModelOrder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class AutoArimaOrderSearchTest {

    @Mock
    private SarimaFitter failingFitter;

    private AutoArimaOrderSearch search;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        search = new AutoArimaOrderSearch(new MaximumLikelihoodSarimaFitter(), Runnable::run);
    }

    @Test
    @DisplayName("Should report a selection failure when every candidate fails to fit")
    void testAllCandidatesFail() {
        // Arrange
        when(failingFitter.fit(any(), any(), anyBoolean()))
                .thenThrow(new NonConvergentCandidateException("did not converge"));
        AutoArimaOrderSearch failing = new AutoArimaOrderSearch(failingFitter, Runnable::run);
        SearchBounds bounds = SearchBounds.builder().period(1).maxP(1).maxQ(1).build();

        // Act
        ModelSelectionException e = assertThrows(ModelSelectionException.class,
                () -> failing.search(MaximumLikelihoodSarimaFitterTest.simulateAr1(0.5, 60, 4L), bounds));

        // Assert: stepwise start set plus the full 2x2 grid, each fitted once
        assertEquals(4, e.getCandidatesTried());
        verify(failingFitter, times(4)).fit(any(), any(), anyBoolean());
    }

    @Test
    @DisplayName("Infeasible space: an autocorrelated series with no ARMA terms allowed is not forecast")
    void testInfeasibleBoundsReportSelectionError() {
        double[] trend = new double[24];
        for (int t = 0; t < trend.length; t++) {
            trend[t] = 10.0 + 3.0 * t;
        }
        SearchBounds bounds = SearchBounds.builder()
                .maxP(0).maxQ(0).maxSeasonalP(0).maxSeasonalQ(0)
                .d(0).seasonalD(0)
                .build();

        assertThrows(ModelSelectionException.class, () -> search.search(trend, bounds));
    }

    @Test
    @DisplayName("Should select an ARMA model for an autocorrelated series")
    void testSelectsArmaTerms() {
        double[] series = MaximumLikelihoodSarimaFitterTest.simulateAr1(0.7, 200, 21L);
        SearchBounds bounds = SearchBounds.builder().period(1).d(0).maxP(3).maxQ(2).build();

        OrderSearchResult result = search.search(series, bounds);

        assertTrue(result.getOrder().hasArmaTerms());
        assertEquals(0, result.getD());
        assertTrue(Double.isFinite(result.getCriterionValue()));
        Set<ModelOrder> seen = new HashSet<>();
        for (CandidateEvaluation evaluation : result.getEvaluations()) {
            assertTrue(seen.add(evaluation.getOrder()), "evaluated twice: " + evaluation.getOrder());
        }
        for (CandidateEvaluation evaluation : result.getEvaluations()) {
            if (evaluation.isSuccessful()) {
                assertFalse(evaluation.isBetterThan(result.getBest()));
            }
        }
    }

    @Test
    @DisplayName("Exhaustive search respects the total order cap")
    void testExhaustiveRespectsMaxOrder() {
        double[] series = MaximumLikelihoodSarimaFitterTest.simulateAr1(0.5, 120, 8L);
        SearchBounds bounds = SearchBounds.builder()
                .period(1).d(0).maxP(3).maxQ(3).maxOrder(2).stepwise(false)
                .build();

        OrderSearchResult result = search.search(series, bounds);

        // (p, q) pairs with p + q <= 2 in a 4x4 grid
        assertEquals(6, result.getEvaluations().size());
        assertTrue(result.getEvaluations().stream().allMatch(e -> e.getOrder().totalOrder() <= 2));
    }

    @Test
    @DisplayName("White noise around a level selects no seasonal AR term and scores every candidate on all observations")
    void testWhiteNoiseSelectsNoSeasonalAr() {
        // Arrange
        Random random = new Random(42L);
        double[] series = new double[60];
        for (int t = 0; t < series.length; t++) {
            series[t] = 100.0 + 10.0 * random.nextGaussian();
        }
        SearchBounds bounds = SearchBounds.builder()
                .period(12).d(0).seasonalD(0).criterion(InformationCriterion.BIC).build();

        // Act
        OrderSearchResult result = search.search(series, bounds);

        // Assert
        assertEquals(0, result.getOrder().getSeasonalP());
        assertEquals(0, result.getOrder().getSeasonalQ());
        assertTrue(result.getEvaluations().stream()
                .filter(CandidateEvaluation::isSuccessful)
                .allMatch(e -> e.getModel().getObservationCount() == 60));
    }

    @Test
    @DisplayName("A candidate whose fit throws an unexpected runtime error is skipped, not fatal to the search")
    void testUnexpectedFitErrorIsRecordedAsFailure() {
        // Arrange
        MaximumLikelihoodSarimaFitter real = new MaximumLikelihoodSarimaFitter();
        ModelOrder broken = ModelOrder.nonSeasonal(1, 0, 1);
        SarimaFitter flaky = (series, order, withIntercept) -> {
            if (order.equals(broken)) {
                throw new ArithmeticException("singular matrix");
            }
            return real.fit(series, order, withIntercept);
        };
        SearchBounds bounds = SearchBounds.builder().period(1).d(0).maxP(2).maxQ(2).stepwise(false).build();

        // Act
        OrderSearchResult result = new AutoArimaOrderSearch(flaky, Runnable::run)
                .search(MaximumLikelihoodSarimaFitterTest.simulateAr1(0.5, 120, 23L), bounds);

        // Assert
        CandidateEvaluation failed = result.getEvaluations().stream()
                .filter(e -> e.getOrder().equals(broken))
                .findFirst()
                .orElseThrow();
        assertFalse(failed.isSuccessful());
        assertTrue(failed.getFailureReason().contains("singular matrix"));
        assertNotEquals(broken, result.getOrder());
        assertEquals(9, result.getEvaluations().size());
    }

    @Test
    @DisplayName("Parallel candidate fits select the same model as sequential fits")
    void testParallelMatchesSequential() {
        double[] series = MaximumLikelihoodSarimaFitterTest.simulateAr1(0.4, 150, 13L);
        SearchBounds bounds = SearchBounds.builder().period(1).d(0).maxP(2).maxQ(2).stepwise(false).build();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            OrderSearchResult sequential = search.search(series, bounds);
            OrderSearchResult parallel = new AutoArimaOrderSearch(new MaximumLikelihoodSarimaFitter(), pool).search(series, bounds);

            assertEquals(sequential.getOrder(), parallel.getOrder());
            assertEquals(sequential.getCriterionValue(), parallel.getCriterionValue(), 1e-9);
            assertEquals(sequential.getEvaluations().size(), parallel.getEvaluations().size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Fixed differencing orders are used as given")
    void testFixedDifferencing() {
        double[] noise = MaximumLikelihoodSarimaFitterTest.simulateAr1(0.0, 60, 17L);
        double[] series = new double[60];
        for (int t = 1; t < series.length; t++) {
            series[t] = series[t - 1] + noise[t];
        }
        SearchBounds bounds = SearchBounds.builder().period(1).d(1).maxP(1).maxQ(1).build();

        OrderSearchResult result = search.search(series, bounds);

        assertEquals(1, result.getD());
        assertEquals(1, result.getOrder().getD());
        assertEquals(0, result.getSeasonalD());
    }

    @Test
    @DisplayName("Should reject inconsistent bounds and missing values")
    void testInvalidInput() {
        SearchBounds inverted = SearchBounds.builder().minP(3).maxP(1).build();
        double[] withGap = {1.0, 2.0, Double.NaN, 4.0};

        assertThrows(IllegalArgumentException.class, () -> search.search(new double[10], inverted));
        assertThrows(IllegalArgumentException.class, () -> search.search(withGap, SearchBounds.defaults()));
    }
}
