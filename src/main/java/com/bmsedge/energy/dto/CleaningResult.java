package com.bmsedge.energy.dto;

import com.bmsedge.energy.model.MeterChannel;
import com.bmsedge.energy.model.ProcessingWarning;
import com.bmsedge.energy.model.TimeIndexedTable;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Output of ingestion: the cleaned table plus what happened to the raw rows on the way.
 */
@Getter
public class CleaningResult {

    private final TimeIndexedTable table;
    private final List<ProcessingWarning> warnings;
    private final int rowsRead;
    private final int duplicatesDropped;
    private final Map<MeterChannel, Integer> malformedValues;
    private final Map<MeterChannel, Integer> imputedValues;

    public CleaningResult(TimeIndexedTable table, List<ProcessingWarning> warnings, int rowsRead,
                          int duplicatesDropped, Map<MeterChannel, Integer> malformedValues,
                          Map<MeterChannel, Integer> imputedValues) {
        this.table = table;
        this.warnings = List.copyOf(warnings);
        this.rowsRead = rowsRead;
        this.duplicatesDropped = duplicatesDropped;
        this.malformedValues = Collections.unmodifiableMap(copy(malformedValues));
        this.imputedValues = Collections.unmodifiableMap(copy(imputedValues));
    }

    public int getImputedCount(MeterChannel channel) {
        return imputedValues.getOrDefault(channel, 0);
    }

    private static Map<MeterChannel, Integer> copy(Map<MeterChannel, Integer> counts) {
        return counts.isEmpty() ? new EnumMap<>(MeterChannel.class) : new EnumMap<>(counts);
    }
}
