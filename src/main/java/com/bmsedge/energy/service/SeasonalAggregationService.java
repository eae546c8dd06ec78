package com.bmsedge.energy.service;

import com.bmsedge.energy.dto.SeasonalAggregate;
import com.bmsedge.energy.dto.SeasonalAggregate.SeasonalRow;
import com.bmsedge.energy.model.MeterChannel;
import com.bmsedge.energy.model.ProcessingWarning;
import com.bmsedge.energy.model.Season;
import com.bmsedge.energy.model.SeasonGrouping;
import com.bmsedge.energy.model.TimeIndexedTable;
import com.bmsedge.energy.model.WarningType;
import com.bmsedge.energy.model.YearSeason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Sums channels per season or per (year, season) bucket.
 */
@Service
public class SeasonalAggregationService {

    private static final Logger logger = LoggerFactory.getLogger(SeasonalAggregationService.class);

    private final SeasonClassifier seasonClassifier;

    public SeasonalAggregationService(SeasonClassifier seasonClassifier) {
        this.seasonClassifier = seasonClassifier;
    }

    public SeasonalAggregate aggregate(TimeIndexedTable table, SeasonGrouping grouping) {
        return grouping == SeasonGrouping.YEAR_SEASON
                ? aggregateByYearSeason(table)
                : aggregateBySeason(table);
    }

    public SeasonalAggregate aggregateBySeason(TimeIndexedTable table) {
        return aggregateBySeason(table, MeterChannel.METERS);
    }

    /**
     * Season-only sums in canonical season order (spring, summer, fall, winter).
     */
    public SeasonalAggregate aggregateBySeason(TimeIndexedTable table, List<MeterChannel> channels) {
        TreeMap<Season, Bucket> buckets = group(table, channels, seasonClassifier::seasonOf);

        List<ProcessingWarning> warnings = new ArrayList<>();
        List<SeasonalRow> rows = new ArrayList<>();
        for (Season season : Season.values()) {
            Bucket bucket = buckets.get(season);
            if (bucket == null) {
                warnings.add(emptyBucket(season.getLabel()));
                continue;
            }
            rows.add(new SeasonalRow(season.getLabel(), season, null, bucket.sums(channels), bucket.count));
        }
        return new SeasonalAggregate(SeasonGrouping.SEASON, channels, rows, warnings);
    }

    public SeasonalAggregate aggregateByYearSeason(TimeIndexedTable table) {
        return aggregateByYearSeason(table, MeterChannel.METERS);
    }

    /**
     * Sums keyed by season and calendar year, ordered by year and then season. Buckets between the first
     * and last key that received no rows are reported rather than emitted as zeros.
     */
    public SeasonalAggregate aggregateByYearSeason(TimeIndexedTable table, List<MeterChannel> channels) {
        TreeMap<YearSeason, Bucket> buckets = group(table, channels, seasonClassifier::yearSeasonOf);

        List<ProcessingWarning> warnings = new ArrayList<>();
        List<SeasonalRow> rows = new ArrayList<>();
        if (!buckets.isEmpty()) {
            YearSeason first = buckets.firstKey();
            YearSeason last = buckets.lastKey();
            for (int year = first.getYear(); year <= last.getYear(); year++) {
                for (Season season : Season.values()) {
                    YearSeason key = new YearSeason(season, year);
                    if (key.compareTo(first) < 0 || key.compareTo(last) > 0) {
                        continue;
                    }
                    Bucket bucket = buckets.get(key);
                    if (bucket == null) {
                        warnings.add(emptyBucket(key.getLabel()));
                        continue;
                    }
                    rows.add(new SeasonalRow(key.getLabel(), season, year, bucket.sums(channels), bucket.count));
                }
            }
        }
        return new SeasonalAggregate(SeasonGrouping.YEAR_SEASON, channels, rows, warnings);
    }

    private <K extends Comparable<K>> TreeMap<K, Bucket> group(TimeIndexedTable table, List<MeterChannel> channels,
                                                              Function<LocalDateTime, K> key) {
        double[][] columns = new double[channels.size()][];
        for (int c = 0; c < channels.size(); c++) {
            columns[c] = table.column(channels.get(c));
        }

        TreeMap<K, Bucket> buckets = new TreeMap<>();
        for (int row = 0; row < table.size(); row++) {
            Bucket bucket = buckets.computeIfAbsent(key.apply(table.timestamp(row)), k -> new Bucket(channels.size()));
            bucket.count++;
            for (int c = 0; c < columns.length; c++) {
                double v = columns[c][row];
                if (!Double.isNaN(v)) {
                    bucket.sums[c] += v;
                }
            }
        }
        logger.debug("Grouped {} rows into {} buckets", table.size(), buckets.size());
        return buckets;
    }

    private static ProcessingWarning emptyBucket(String label) {
        ProcessingWarning warning = ProcessingWarning.of(WarningType.EMPTY_WINDOW, label + " has no readings");
        logger.warn("{}", warning);
        return warning;
    }

    private static final class Bucket {
        private final double[] sums;
        private int count;

        private Bucket(int channels) {
            this.sums = new double[channels];
        }

        private Map<MeterChannel, Double> sums(List<MeterChannel> channels) {
            Map<MeterChannel, Double> result = new LinkedHashMap<>();
            for (int c = 0; c < channels.size(); c++) {
                result.put(channels.get(c), sums[c]);
            }
            return result;
        }
    }
}
