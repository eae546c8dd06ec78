package com.bmsedge.energy.service;

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
 * Downsamples a table to calendar-aligned windows by arithmetic mean.
 * Windows without rows are left out of the result.
 */
@Service
public class ResamplingService {

    private static final Logger logger = LoggerFactory.getLogger(ResamplingService.class);

    public TimeIndexedTable resample(TimeIndexedTable table, ResampleFrequency frequency) {
        return resample(table, frequency, new ArrayList<>());
    }

    /**
     * Mean of every channel per window, ignoring missing values. Empty windows between the first and
     * last window are reported once to {@code warnings}.
     */
    public TimeIndexedTable resample(TimeIndexedTable table, ResampleFrequency frequency, List<ProcessingWarning> warnings) {
        List<MeterChannel> channels = new ArrayList<>(table.getChannels());
        TimeIndexedTable.Builder builder = TimeIndexedTable.builder(channels);
        if (table.isEmpty()) {
            return builder.build();
        }

        double[][] columns = new double[channels.size()][];
        for (int c = 0; c < channels.size(); c++) {
            columns[c] = table.column(channels.get(c));
        }

        LocalDateTime origin = table.timestamp(0);
        LocalDateTime currentLabel = null;
        int windowStart = 0;
        long emptyWindows = 0;

        for (int row = 0; row <= table.size(); row++) {
            LocalDateTime label = row < table.size() ? frequency.label(table.timestamp(row), origin) : null;
            if (currentLabel != null && !currentLabel.equals(label)) {
                builder.addRow(currentLabel, windowMeans(columns, windowStart, row));
                if (label != null) {
                    emptyWindows += Math.max(0, frequency.stepsBetween(currentLabel, label) - 1);
                }
                windowStart = row;
            }
            currentLabel = label;
        }

        TimeIndexedTable resampled = builder.build();
        if (emptyWindows > 0) {
            ProcessingWarning warning = ProcessingWarning.of(WarningType.EMPTY_WINDOW,
                    emptyWindows + " " + frequency.getAlias() + " window(s) had no readings and were skipped");
            logger.warn("{}", warning);
            warnings.add(warning);
        }
        logger.debug("Resampled {} rows to {} {} windows", table.size(), resampled.size(), frequency.getAlias());
        return resampled;
    }

    private static double[] windowMeans(double[][] columns, int from, int to) {
        double[] means = new double[columns.length];
        for (int c = 0; c < columns.length; c++) {
            double sum = 0.0;
            int count = 0;
            for (int r = from; r < to; r++) {
                double v = columns[c][r];
                if (!Double.isNaN(v)) {
                    sum += v;
                    count++;
                }
            }
            means[c] = count == 0 ? Double.NaN : sum / count;
        }
        return means;
    }
}
