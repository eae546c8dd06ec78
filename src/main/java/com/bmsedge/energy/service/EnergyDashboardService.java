package com.bmsedge.energy.service;

import com.bmsedge.energy.config.EnergyEngineProperties;
import com.bmsedge.energy.dto.CleaningResult;
import com.bmsedge.energy.dto.DashboardView;
import com.bmsedge.energy.dto.ForecastResult;
import com.bmsedge.energy.dto.SeasonalAggregate;
import com.bmsedge.energy.dto.ViewRequest;
import com.bmsedge.energy.forecast.SearchBounds;
import com.bmsedge.energy.model.MeterSelection;
import com.bmsedge.energy.model.ProcessingWarning;
import com.bmsedge.energy.model.ResampleFrequency;
import com.bmsedge.energy.model.SeasonGrouping;
import com.bmsedge.energy.model.TimeIndexedTable;
import com.bmsedge.energy.model.ViewKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Holds the one cleaned table of the session and builds each dashboard view from it.
 * Views never replace the retained table, so they can be requested in any order.
 */
@Service
public class EnergyDashboardService {

    private static final Logger logger = LoggerFactory.getLogger(EnergyDashboardService.class);

    private final MeterDataCleaningService cleaningService;
    private final ResamplingService resamplingService;
    private final SeasonalAggregationService aggregationService;
    private final ForecastingService forecastingService;
    private final EnergyEngineProperties properties;
    private final Map<ViewKind, Function<ViewRequest, DashboardView>> viewBuilders = new EnumMap<>(ViewKind.class);

    private volatile CleaningResult original;

    public EnergyDashboardService(MeterDataCleaningService cleaningService,
                                  ResamplingService resamplingService,
                                  SeasonalAggregationService aggregationService,
                                  ForecastingService forecastingService,
                                  EnergyEngineProperties properties) {
        this.cleaningService = cleaningService;
        this.resamplingService = resamplingService;
        this.aggregationService = aggregationService;
        this.forecastingService = forecastingService;
        this.properties = properties;

        viewBuilders.put(ViewKind.ALL_DATA, this::allData);
        viewBuilders.put(ViewKind.BY_SEASON, this::bySeason);
        viewBuilders.put(ViewKind.PREDICTIONS, this::predictions);
        for (ViewKind kind : ViewKind.values()) {
            if (!viewBuilders.containsKey(kind)) {
                throw new IllegalStateException("No view builder registered for " + kind);
            }
        }
    }

    /**
     * Load and clean the meter file. A session loads exactly once.
     */
    public CleaningResult load(Path path) {
        return retain(cleaningService.clean(path));
    }

    public synchronized CleaningResult retain(CleaningResult cleaned) {
        if (original != null) {
            throw new IllegalStateException("Meter data is already loaded for this session");
        }
        original = cleaned;
        logger.info("Retained {} cleaned rows with {} warning(s)", cleaned.getTable().size(), cleaned.getWarnings().size());
        return cleaned;
    }

    public boolean isLoaded() {
        return original != null;
    }

    public TimeIndexedTable getOriginalTable() {
        return requireLoaded().getTable();
    }

    public DashboardView render(ViewRequest request) {
        if (request.getKind() == null) {
            throw new IllegalArgumentException("A view kind is required");
        }
        requireLoaded();
        logger.info("Rendering view '{}'", request.getKind().getLabel());
        return viewBuilders.get(request.getKind()).apply(request);
    }

    private DashboardView allData(ViewRequest request) {
        ResampleFrequency frequency = request.getFrequency() != null
                ? request.getFrequency()
                : ResampleFrequency.parse(properties.getView().getDefaultFrequency());
        MeterSelection selection = request.getSelection() != null ? request.getSelection() : MeterSelection.ALL_METERS;

        List<ProcessingWarning> warnings = new ArrayList<>();
        TimeIndexedTable resampled = resamplingService.resample(getOriginalTable(), frequency, warnings)
                .select(selection.getChannels());
        return DashboardView.ofTable(selection.getLabel() + " (" + frequency.getAlias() + ")", resampled, warnings);
    }

    private DashboardView bySeason(ViewRequest request) {
        SeasonGrouping grouping = request.getGrouping() != null
                ? request.getGrouping()
                : properties.getView().getDefaultGrouping();
        SeasonalAggregate aggregate = aggregationService.aggregate(getOriginalTable(), grouping);
        String title = grouping == SeasonGrouping.YEAR_SEASON ? "Consumption by year and season" : "Consumption by season";
        return DashboardView.ofSeasonal(title, aggregate);
    }

    private DashboardView predictions(ViewRequest request) {
        EnergyEngineProperties.Forecast settings = properties.getForecast();
        int horizon = request.getHorizon() != null ? request.getHorizon() : settings.getHorizon();
        SearchBounds bounds = settings.toSearchBounds();
        ForecastResult forecast = forecastingService.forecast(getOriginalTable(), horizon, bounds);
        return DashboardView.ofForecast("Monthly consumption forecast " + forecast.getOrder(), forecast);
    }

    private CleaningResult requireLoaded() {
        CleaningResult loaded = original;
        if (loaded == null) {
            throw new IllegalStateException("No meter data loaded");
        }
        return loaded;
    }
}
