package com.bmsedge.energy.forecast;

import com.bmsedge.energy.exception.ModelSelectionException;
import com.bmsedge.energy.exception.NonConvergentCandidateException;
import com.bmsedge.energy.model.ModelOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Automatic seasonal ARIMA order selection.
 *
 * <p>Differencing orders come from unit-root tests unless fixed. ARMA orders are then chosen by a
 * stepwise neighbourhood search (or an exhaustive walk of the bounded grid) that keeps the candidate
 * with the lowest information criterion. Candidates that fail to fit are recorded and skipped.
 * Each batch of candidates may be fitted concurrently; the winner is picked only after the whole
 * batch completes, so the result does not depend on scheduling.
 */
@Component
public class AutoArimaOrderSearch {

    private static final Logger logger = LoggerFactory.getLogger(AutoArimaOrderSearch.class);

    private final SarimaFitter fitter;
    private final Executor executor;

    public AutoArimaOrderSearch(SarimaFitter fitter, @Qualifier("modelFitExecutor") Executor executor) {
        this.fitter = fitter;
        this.executor = executor;
    }

    /**
     * @throws ModelSelectionException  when no candidate in the bounded space can be fitted
     * @throws IllegalArgumentException when the bounds are inconsistent or the series has missing values
     */
    public OrderSearchResult search(double[] series, SearchBounds bounds) {
        bounds.validate();
        for (double v : series) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("Series must not contain missing or infinite values");
            }
        }

        int period = bounds.getPeriod();
        int seasonalD = bounds.getSeasonalD() != null
                ? bounds.getSeasonalD()
                : (bounds.isSeasonal() ? StationarityTests.nsdiffs(series, period, bounds.getMaxSeasonalD()) : 0);
        if (!bounds.isSeasonal()) {
            seasonalD = 0;
        }
        double[] seasonallyDifferenced = series;
        for (int i = 0; i < seasonalD; i++) {
            seasonallyDifferenced = SarimaMath.difference(seasonallyDifferenced, period);
        }
        int d = bounds.getD() != null
                ? bounds.getD()
                : StationarityTests.ndiffs(seasonallyDifferenced, bounds.getMaxD());
        logger.info("Order search on {} observations: d={}, D={}, period={}, {} with {}",
                series.length, d, seasonalD, period, bounds.isStepwise() ? "stepwise" : "exhaustive",
                bounds.getCriterion());

        Search search = new Search(series, bounds, d, seasonalD);
        CandidateEvaluation best = bounds.isStepwise() ? search.stepwise() : search.exhaustive();

        List<CandidateEvaluation> evaluations = new ArrayList<>(search.evaluated.values());
        if (best == null) {
            logger.error("No candidate order could be fitted ({} tried)", evaluations.size());
            throw new ModelSelectionException("No candidate order in the search space produced a usable model ("
                    + evaluations.size() + " tried)", evaluations.size());
        }
        logger.info("Selected {} with {}={} after {} candidates", best.getOrder(), bounds.getCriterion(),
                best.getCriterionValue(), evaluations.size());
        return new OrderSearchResult(best, evaluations, bounds.getCriterion(), d, seasonalD);
    }

    /** One evaluation: fit, score, and screen models without ARMA terms for white-noise residuals. */
    CandidateEvaluation evaluate(double[] series, ModelOrder order, SearchBounds bounds) {
        SarimaModel model;
        try {
            model = fitter.fit(series, order, bounds.isWithIntercept());
        } catch (NonConvergentCandidateException e) {
            logger.debug("Skipping {}: {}", order, e.getMessage());
            return CandidateEvaluation.failed(order, e.getMessage());
        } catch (RuntimeException e) {
            logger.debug("Skipping {}: fit raised {}", order, e.toString());
            return CandidateEvaluation.failed(order, "fit failed: " + e);
        }

        if (!order.hasArmaTerms()) {
            double[] residuals = model.getResiduals();
            double pValue = StationarityTests.ljungBoxPValue(residuals,
                    StationarityTests.ljungBoxLags(residuals.length), 0);
            if (pValue < bounds.getWhiteNoiseSignificance()) {
                logger.debug("Skipping {}: residuals are autocorrelated (Ljung-Box p={})", order, pValue);
                return CandidateEvaluation.failed(order, "residuals are not white noise (Ljung-Box p=" + pValue + ")");
            }
        }

        double value = bounds.getCriterion().evaluate(model);
        if (!Double.isFinite(value)) {
            return CandidateEvaluation.failed(order, bounds.getCriterion() + " is not finite");
        }
        logger.debug("{} {}={}", order, bounds.getCriterion(), value);
        return CandidateEvaluation.fitted(model, value);
    }

    private final class Search {
        private final double[] series;
        private final SearchBounds bounds;
        private final int d;
        private final int seasonalD;
        private final int period;
        private final Map<ModelOrder, CandidateEvaluation> evaluated = new LinkedHashMap<>();

        private Search(double[] series, SearchBounds bounds, int d, int seasonalD) {
            this.series = series;
            this.bounds = bounds;
            this.d = d;
            this.seasonalD = seasonalD;
            this.period = bounds.isSeasonal() ? bounds.getPeriod() : 1;
        }

        CandidateEvaluation stepwise() {
            Set<ModelOrder> start = new LinkedHashSet<>();
            addClamped(start, bounds.getStartP(), bounds.getStartQ(), bounds.getStartSeasonalP(), bounds.getStartSeasonalQ());
            addClamped(start, 0, 0, 0, 0);
            addClamped(start, 1, 0, 1, 0);
            addClamped(start, 0, 1, 0, 1);

            CandidateEvaluation current = best(evaluateBatch(start));
            if (current == null) {
                logger.warn("No stepwise start model could be fitted; searching the full grid");
                return exhaustive();
            }

            for (int step = 0; step < bounds.getMaxSteps(); step++) {
                CandidateEvaluation candidate = best(evaluateBatch(neighbours(current.getOrder())));
                if (candidate == null || !candidate.isBetterThan(current)) {
                    break;
                }
                current = candidate;
            }
            return current;
        }

        CandidateEvaluation exhaustive() {
            Set<ModelOrder> grid = new LinkedHashSet<>();
            for (int p = bounds.getMinP(); p <= bounds.getMaxP(); p++) {
                for (int q = bounds.getMinQ(); q <= bounds.getMaxQ(); q++) {
                    for (int sp = seasonalMin(bounds.getMinSeasonalP()); sp <= seasonalMax(bounds.getMaxSeasonalP()); sp++) {
                        for (int sq = seasonalMin(bounds.getMinSeasonalQ()); sq <= seasonalMax(bounds.getMaxSeasonalQ()); sq++) {
                            if (admissible(p, q, sp, sq)) {
                                grid.add(order(p, q, sp, sq));
                            }
                        }
                    }
                }
            }
            evaluateBatch(grid);
            return best(evaluated.values());
        }

        private Set<ModelOrder> neighbours(ModelOrder order) {
            int p = order.getP();
            int q = order.getQ();
            int sp = order.getSeasonalP();
            int sq = order.getSeasonalQ();
            Set<ModelOrder> result = new LinkedHashSet<>();
            for (int delta : new int[]{-1, 1}) {
                addIfAdmissible(result, p + delta, q, sp, sq);
                addIfAdmissible(result, p, q + delta, sp, sq);
                addIfAdmissible(result, p, q, sp + delta, sq);
                addIfAdmissible(result, p, q, sp, sq + delta);
                addIfAdmissible(result, p + delta, q + delta, sp, sq);
                addIfAdmissible(result, p, q, sp + delta, sq + delta);
            }
            return result;
        }

        /** Fits the orders not evaluated yet and returns the evaluations of the whole batch. */
        private List<CandidateEvaluation> evaluateBatch(Set<ModelOrder> orders) {
            List<ModelOrder> pending = orders.stream()
                    .filter(o -> !evaluated.containsKey(o))
                    .collect(Collectors.toList());
            List<CompletableFuture<CandidateEvaluation>> futures = pending.stream()
                    .map(o -> CompletableFuture.supplyAsync(() -> evaluate(series, o, bounds), executor))
                    .collect(Collectors.toList());
            for (CompletableFuture<CandidateEvaluation> future : futures) {
                CandidateEvaluation evaluation = future.join();
                evaluated.put(evaluation.getOrder(), evaluation);
            }
            return orders.stream().map(evaluated::get).collect(Collectors.toList());
        }

        private CandidateEvaluation best(Iterable<CandidateEvaluation> evaluations) {
            CandidateEvaluation best = null;
            for (CandidateEvaluation evaluation : evaluations) {
                if (evaluation.isSuccessful() && evaluation.isBetterThan(best)) {
                    best = evaluation;
                }
            }
            return best;
        }

        private void addClamped(Set<ModelOrder> target, int p, int q, int sp, int sq) {
            int cp = clamp(p, bounds.getMinP(), bounds.getMaxP());
            int cq = clamp(q, bounds.getMinQ(), bounds.getMaxQ());
            int csp = clamp(sp, seasonalMin(bounds.getMinSeasonalP()), seasonalMax(bounds.getMaxSeasonalP()));
            int csq = clamp(sq, seasonalMin(bounds.getMinSeasonalQ()), seasonalMax(bounds.getMaxSeasonalQ()));
            // shed seasonal terms first, then non-seasonal, until the total order fits
            while (cp + cq + csp + csq > bounds.getMaxOrder()) {
                if (csq > seasonalMin(bounds.getMinSeasonalQ())) {
                    csq--;
                } else if (csp > seasonalMin(bounds.getMinSeasonalP())) {
                    csp--;
                } else if (cq > bounds.getMinQ()) {
                    cq--;
                } else if (cp > bounds.getMinP()) {
                    cp--;
                } else {
                    return;
                }
            }
            target.add(order(cp, cq, csp, csq));
        }

        private void addIfAdmissible(Set<ModelOrder> target, int p, int q, int sp, int sq) {
            if (admissible(p, q, sp, sq)) {
                target.add(order(p, q, sp, sq));
            }
        }

        private boolean admissible(int p, int q, int sp, int sq) {
            return p >= bounds.getMinP() && p <= bounds.getMaxP()
                    && q >= bounds.getMinQ() && q <= bounds.getMaxQ()
                    && sp >= seasonalMin(bounds.getMinSeasonalP()) && sp <= seasonalMax(bounds.getMaxSeasonalP())
                    && sq >= seasonalMin(bounds.getMinSeasonalQ()) && sq <= seasonalMax(bounds.getMaxSeasonalQ())
                    && p + q + sp + sq <= bounds.getMaxOrder();
        }

        private int seasonalMin(int bound) {
            return period > 1 ? bound : 0;
        }

        private int seasonalMax(int bound) {
            return period > 1 ? bound : 0;
        }

        private ModelOrder order(int p, int q, int sp, int sq) {
            return new ModelOrder(p, d, q, sp, period > 1 ? seasonalD : 0, sq, period);
        }

        private int clamp(int value, int min, int max) {
            return Math.max(min, Math.min(max, value));
        }
    }
}
