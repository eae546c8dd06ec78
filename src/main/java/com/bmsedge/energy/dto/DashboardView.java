package com.bmsedge.energy.dto;

import com.bmsedge.energy.model.ProcessingWarning;
import com.bmsedge.energy.model.TimeIndexedTable;
import com.bmsedge.energy.model.ViewKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Typed result handed to the presentation layer. Exactly one of table, seasonal or forecast is set,
 * depending on the kind.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DashboardView {

    private final ViewKind kind;
    private final String title;
    private final TimeIndexedTable table;
    private final SeasonalAggregate seasonal;
    private final ForecastResult forecast;
    private final List<ProcessingWarning> warnings;
    private final LocalDateTime generatedAt;

    private DashboardView(ViewKind kind, String title, TimeIndexedTable table, SeasonalAggregate seasonal,
                          ForecastResult forecast, List<ProcessingWarning> warnings) {
        this.kind = kind;
        this.title = title;
        this.table = table;
        this.seasonal = seasonal;
        this.forecast = forecast;
        this.warnings = List.copyOf(warnings);
        this.generatedAt = LocalDateTime.now();
    }

    public static DashboardView ofTable(String title, TimeIndexedTable table, List<ProcessingWarning> warnings) {
        return new DashboardView(ViewKind.ALL_DATA, title, table, null, null, warnings);
    }

    public static DashboardView ofSeasonal(String title, SeasonalAggregate seasonal) {
        return new DashboardView(ViewKind.BY_SEASON, title, null, seasonal, null, seasonal.getWarnings());
    }

    public static DashboardView ofForecast(String title, ForecastResult forecast) {
        return new DashboardView(ViewKind.PREDICTIONS, title, null, null, forecast, forecast.getWarnings());
    }
}
