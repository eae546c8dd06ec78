package com.bmsedge.energy.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, timestamp-ordered table of meter channels.
 * Missing values are stored as {@link Double#NaN}. Every transform returns a new table.
 */
public final class TimeIndexedTable {

    private final List<LocalDateTime> index;
    private final EnumMap<MeterChannel, double[]> columns;

    private TimeIndexedTable(List<LocalDateTime> index, EnumMap<MeterChannel, double[]> columns) {
        this.index = Collections.unmodifiableList(index);
        this.columns = columns;
    }

    public static Builder builder(Collection<MeterChannel> channels) {
        return new Builder(channels);
    }

    public static TimeIndexedTable empty(Collection<MeterChannel> channels) {
        return builder(channels).build();
    }

    public int size() {
        return index.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return index.isEmpty();
    }

    public List<LocalDateTime> getIndex() {
        return index;
    }

    public LocalDateTime timestamp(int row) {
        return index.get(row);
    }

    public Set<MeterChannel> getChannels() {
        return columns.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(columns.keySet()));
    }

    public double value(int row, MeterChannel channel) {
        return requireColumn(channel)[row];
    }

    /**
     * @return a copy of the channel's values in index order
     */
    public double[] column(MeterChannel channel) {
        return requireColumn(channel).clone();
    }

    /**
     * Sum of the channel's non-missing values.
     */
    public double sum(MeterChannel channel) {
        double total = 0.0;
        for (double v : requireColumn(channel)) {
            if (!Double.isNaN(v)) {
                total += v;
            }
        }
        return total;
    }

    /**
     * Project the table onto the given channels, keeping the index.
     */
    public TimeIndexedTable select(Collection<MeterChannel> channels) {
        EnumMap<MeterChannel, double[]> selected = new EnumMap<>(MeterChannel.class);
        for (MeterChannel channel : channels) {
            selected.put(channel, requireColumn(channel));
        }
        return new TimeIndexedTable(new ArrayList<>(index), selected);
    }

    /**
     * Columns keyed by column name, in channel order. Used for the JSON hand-off.
     */
    @JsonProperty("columns")
    public Map<String, double[]> toColumnMap() {
        Map<String, double[]> map = new LinkedHashMap<>();
        for (Map.Entry<MeterChannel, double[]> entry : columns.entrySet()) {
            map.put(entry.getKey().getColumnName(), entry.getValue().clone());
        }
        return map;
    }

    private double[] requireColumn(MeterChannel channel) {
        double[] values = columns.get(channel);
        if (values == null) {
            throw new IllegalArgumentException("Table has no channel " + channel.getColumnName());
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeIndexedTable)) return false;
        TimeIndexedTable other = (TimeIndexedTable) o;
        if (!index.equals(other.index) || !columns.keySet().equals(other.columns.keySet())) {
            return false;
        }
        for (Map.Entry<MeterChannel, double[]> entry : columns.entrySet()) {
            if (!Arrays.equals(entry.getValue(), other.columns.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = index.hashCode();
        for (Map.Entry<MeterChannel, double[]> entry : columns.entrySet()) {
            result = 31 * result + entry.getKey().hashCode();
            result = 31 * result + Arrays.hashCode(entry.getValue());
        }
        return result;
    }

    @Override
    public String toString() {
        return "TimeIndexedTable{rows=" + index.size() + ", channels=" + columns.keySet() + "}";
    }

    /**
     * Row-wise builder. Values are passed in the order of the channels given to the builder.
     */
    public static final class Builder {

        private final List<MeterChannel> channels;
        private final List<LocalDateTime> index = new ArrayList<>();
        private final List<double[]> rows = new ArrayList<>();

        private Builder(Collection<MeterChannel> channels) {
            this.channels = new ArrayList<>(channels);
        }

        public Builder addRow(LocalDateTime timestamp, double... values) {
            if (values.length != channels.size()) {
                throw new IllegalArgumentException("Expected " + channels.size() + " values but got " + values.length);
            }
            if (!index.isEmpty() && timestamp.isBefore(index.get(index.size() - 1))) {
                throw new IllegalArgumentException("Rows must be added in timestamp order: " + timestamp
                        + " precedes " + index.get(index.size() - 1));
            }
            index.add(timestamp);
            rows.add(values.clone());
            return this;
        }

        public int size() {
            return index.size();
        }

        public TimeIndexedTable build() {
            EnumMap<MeterChannel, double[]> columns = new EnumMap<>(MeterChannel.class);
            for (int c = 0; c < channels.size(); c++) {
                double[] column = new double[rows.size()];
                for (int r = 0; r < rows.size(); r++) {
                    column[r] = rows.get(r)[c];
                }
                columns.put(channels.get(c), column);
            }
            return new TimeIndexedTable(new ArrayList<>(index), columns);
        }
    }
}
