package com.bmsedge.energy.service;

import com.bmsedge.energy.dto.ForecastPoint;
import com.bmsedge.energy.dto.ForecastResult;
import com.bmsedge.energy.dto.SeriesPoint;
import com.bmsedge.energy.exception.ModelSelectionException;
import com.bmsedge.energy.forecast.AutoArimaOrderSearch;
import com.bmsedge.energy.forecast.ModelForecast;
import com.bmsedge.energy.forecast.OrderSearchResult;
import com.bmsedge.energy.forecast.SearchBounds;
import com.bmsedge.energy.model.MeterChannel;
import com.bmsedge.energy.model.ProcessingWarning;
import com.bmsedge.energy.model.ResampleFrequency;
import com.bmsedge.energy.model.TimeIndexedTable;
import com.bmsedge.energy.model.WarningType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Monthly total-consumption forecasts over the four metering channels.
 */
@Service
public class ForecastingService {

    private static final Logger logger = LoggerFactory.getLogger(ForecastingService.class);

    private final ResamplingService resamplingService;
    private final AutoArimaOrderSearch orderSearch;

    public ForecastingService(ResamplingService resamplingService, AutoArimaOrderSearch orderSearch) {
        this.resamplingService = resamplingService;
        this.orderSearch = orderSearch;
    }

    /**
     * Resample the cleaned table to months, sum the metering channels and forecast the total.
     *
     * @throws ModelSelectionException when no candidate model can be fitted
     */
    public ForecastResult forecast(TimeIndexedTable cleaned, int horizon, SearchBounds bounds) {
        List<ProcessingWarning> warnings = new ArrayList<>();
        List<SeriesPoint> monthly = monthlyTotals(cleaned, warnings);
        return forecast(monthly, ResampleFrequency.MONTHLY, horizon, bounds, warnings);
    }

    /**
     * Forecast a regularly spaced series {@code horizon} steps past its last point.
     * Missing steps are forward-filled and reported.
     *
     * @throws ModelSelectionException when no candidate model can be fitted
     */
    public ForecastResult forecast(List<SeriesPoint> series, ResampleFrequency step, int horizon, SearchBounds bounds,
                                   List<ProcessingWarning> warnings) {
        if (horizon < 1) {
            throw new IllegalArgumentException("Forecast horizon must be positive: " + horizon);
        }
        if (series.isEmpty()) {
            throw new ModelSelectionException("Nothing to forecast: the series is empty", 0);
        }

        List<ProcessingWarning> allWarnings = new ArrayList<>(warnings);
        List<SeriesPoint> regular = fillGaps(series, step, allWarnings);
        double[] values = regular.stream().mapToDouble(SeriesPoint::getValue).toArray();

        long started = System.currentTimeMillis();
        OrderSearchResult search = orderSearch.search(values, bounds);
        ModelForecast prediction = search.getModel().forecast(horizon, bounds.getConfidenceLevel());

        LocalDateTime last = regular.get(regular.size() - 1).getTimestamp();
        List<ForecastPoint> points = new ArrayList<>(horizon);
        for (int h = 0; h < horizon; h++) {
            points.add(new ForecastPoint(step.advance(last, h + 1),
                    prediction.getMean(h), prediction.getLower(h), prediction.getUpper(h)));
        }

        logger.info("Forecast {} periods with {} in {} ms", horizon, search.getOrder(),
                System.currentTimeMillis() - started);
        return new ForecastResult(regular, points, search.getOrder().toString(), search.getCriterion(),
                search.getCriterionValue(), bounds.getConfidenceLevel(), search.getEvaluations().size(),
                search.getFailedCount(), allWarnings);
    }

    /**
     * Monthly means of the metering channels, summed into one total per month.
     */
    public List<SeriesPoint> monthlyTotals(TimeIndexedTable cleaned, List<ProcessingWarning> warnings) {
        TimeIndexedTable monthly = resamplingService.resample(cleaned.select(MeterChannel.METERS),
                ResampleFrequency.MONTHLY, warnings);
        List<SeriesPoint> totals = new ArrayList<>(monthly.size());
        for (int row = 0; row < monthly.size(); row++) {
            double total = 0.0;
            boolean any = false;
            for (MeterChannel channel : MeterChannel.METERS) {
                double v = monthly.value(row, channel);
                if (!Double.isNaN(v)) {
                    total += v;
                    any = true;
                }
            }
            if (any) {
                totals.add(new SeriesPoint(monthly.timestamp(row), total));
            }
        }
        return totals;
    }

    /**
     * Carry the last value forward over steps with no observation.
     */
    static List<SeriesPoint> fillGaps(List<SeriesPoint> series, ResampleFrequency step, List<ProcessingWarning> warnings) {
        List<SeriesPoint> regular = new ArrayList<>(series.size());
        regular.add(series.get(0));
        int filled = 0;
        for (int i = 1; i < series.size(); i++) {
            SeriesPoint previous = regular.get(regular.size() - 1);
            SeriesPoint current = series.get(i);
            long steps = step.stepsBetween(previous.getTimestamp(), current.getTimestamp());
            if (steps < 1) {
                throw new IllegalArgumentException("Series timestamps must increase by at least one "
                        + step.getAlias() + " step: " + previous.getTimestamp() + " then " + current.getTimestamp());
            }
            for (long s = 1; s < steps; s++) {
                regular.add(new SeriesPoint(step.advance(previous.getTimestamp(), s), previous.getValue()));
                filled++;
            }
            regular.add(current);
        }
        if (filled > 0) {
            ProcessingWarning warning = ProcessingWarning.of(WarningType.EMPTY_WINDOW,
                    filled + " missing " + step.getAlias() + " period(s) forward-filled before forecasting");
            logger.warn("{}", warning);
            warnings.add(warning);
        }
        return regular;
    }
}
