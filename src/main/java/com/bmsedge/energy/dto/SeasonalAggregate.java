package com.bmsedge.energy.dto;

import com.bmsedge.energy.model.MeterChannel;
import com.bmsedge.energy.model.ProcessingWarning;
import com.bmsedge.energy.model.Season;
import com.bmsedge.energy.model.SeasonGrouping;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-season or per-(year, season) channel sums in canonical order.
 */
@Getter
public class SeasonalAggregate {

    private final SeasonGrouping grouping;
    private final List<MeterChannel> channels;
    private final List<SeasonalRow> rows;
    private final List<ProcessingWarning> warnings;

    public SeasonalAggregate(SeasonGrouping grouping, List<MeterChannel> channels, List<SeasonalRow> rows,
                             List<ProcessingWarning> warnings) {
        this.grouping = grouping;
        this.channels = List.copyOf(channels);
        this.rows = List.copyOf(rows);
        this.warnings = List.copyOf(warnings);
    }

    /**
     * Sum of a channel across every group.
     */
    public double total(MeterChannel channel) {
        return rows.stream().mapToDouble(row -> row.getSum(channel)).sum();
    }

    @Getter
    public static class SeasonalRow {
        private final String label;
        private final Season season;
        /** Calendar year for year-season grouping, null for season-only grouping */
        private final Integer year;
        private final Map<MeterChannel, Double> sums;
        private final int rowCount;

        public SeasonalRow(String label, Season season, Integer year, Map<MeterChannel, Double> sums, int rowCount) {
            this.label = label;
            this.season = season;
            this.year = year;
            this.sums = Collections.unmodifiableMap(new LinkedHashMap<>(sums));
            this.rowCount = rowCount;
        }

        public double getSum(MeterChannel channel) {
            Double sum = sums.get(channel);
            if (sum == null) {
                throw new IllegalArgumentException("Channel " + channel.getColumnName() + " was not aggregated");
            }
            return sum;
        }
    }
}
