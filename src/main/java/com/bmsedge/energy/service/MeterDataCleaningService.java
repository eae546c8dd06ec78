package com.bmsedge.energy.service;

import com.bmsedge.energy.config.EnergyEngineProperties;
import com.bmsedge.energy.dto.CleaningResult;
import com.bmsedge.energy.exception.MeterDataParseException;
import com.bmsedge.energy.model.MeterChannel;
import com.bmsedge.energy.model.ProcessingWarning;
import com.bmsedge.energy.model.TimeIndexedTable;
import com.bmsedge.energy.model.WarningType;
import com.bmsedge.energy.util.MeterTimestampParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Turns raw meter rows into the cleaned table every view is derived from.
 *
 * <p>Accepts either the raw {@code Date;Time;...} layout or a pre-parsed layout with a single
 * {@code Date_Time} column. Malformed numbers become missing instead of failing the load. Derived
 * channels are computed before imputation, then every column's gaps are filled with that column's mean.
 */
@Service
public class MeterDataCleaningService {

    private static final Logger logger = LoggerFactory.getLogger(MeterDataCleaningService.class);

    static final String DATE_COLUMN = "date";
    static final String TIME_COLUMN = "time";
    static final String DATE_TIME_COLUMN = "date_time";

    private final EnergyEngineProperties.Input settings;

    public MeterDataCleaningService(EnergyEngineProperties properties) {
        this.settings = properties.getInput();
    }

    public CleaningResult clean(Path path) {
        logger.info("Loading meter readings from {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return clean(reader);
        } catch (IOException e) {
            throw new MeterDataParseException("Cannot read meter file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Clean delimited text. The delimiter is taken from settings or sniffed from the header line.
     */
    public CleaningResult clean(Reader source) {
        BufferedReader reader = source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source);
        char separator = resolveSeparator(reader);

        try (CSVReader csvReader = new CSVReaderBuilder(reader)
                .withCSVParser(new CSVParserBuilder().withSeparator(separator).build())
                .build()) {
            return process(() -> {
                try {
                    return csvReader.readNext();
                } catch (CsvValidationException e) {
                    throw new MeterDataParseException("Malformed line " + csvReader.getLinesRead() + ": "
                            + e.getMessage(), e);
                }
            });
        } catch (IOException e) {
            throw new MeterDataParseException("Cannot read meter rows: " + e.getMessage(), e);
        }
    }

    /**
     * Clean rows that were already split into fields. The first row is the header.
     */
    public CleaningResult clean(List<String[]> rows) {
        Iterator<String[]> iterator = rows.iterator();
        try {
            return process(() -> iterator.hasNext() ? iterator.next() : null);
        } catch (IOException e) {
            throw new MeterDataParseException("Cannot read meter rows: " + e.getMessage(), e);
        }
    }

    private CleaningResult process(RowSource source) throws IOException {
        String[] header = source.next();
        if (header == null) {
            throw new MeterDataParseException("Input is empty", 1);
        }
        HeaderLayout layout = HeaderLayout.of(header);

        MeterTimestampParser timestampParser = new MeterTimestampParser(settings.getDatePatterns(), settings.getTimePatterns());
        Set<String> missingTokens = settings.getMissingTokens().stream()
                .map(String::trim)
                .collect(Collectors.toCollection(HashSet::new));

        List<MeterChannel> rawChannels = new ArrayList<>(MeterChannel.raw());
        List<LocalDateTime> timestamps = new ArrayList<>();
        List<double[]> values = new ArrayList<>();
        Map<MeterChannel, Integer> malformed = new EnumMap<>(MeterChannel.class);

        int line = 1;
        String[] row;
        while ((row = source.next()) != null) {
            line++;
            if (isBlank(row)) {
                continue;
            }
            timestamps.add(parseTimestamp(row, layout, timestampParser, line));
            double[] parsed = new double[rawChannels.size()];
            for (int c = 0; c < rawChannels.size(); c++) {
                MeterChannel channel = rawChannels.get(c);
                parsed[c] = coerce(field(row, layout.columnOf(channel)), missingTokens, channel, malformed);
            }
            values.add(parsed);
        }

        int rowsRead = timestamps.size();
        if (rowsRead == 0) {
            throw new MeterDataParseException("Input has a header but no data rows", line);
        }

        List<ProcessingWarning> warnings = new ArrayList<>();
        malformed.forEach((channel, count) -> warnings.add(warn(new ProcessingWarning(WarningType.MALFORMED_VALUE, channel,
                count + " malformed value(s) treated as missing"))));

        // order by timestamp, keeping the first reading of any duplicated timestamp
        List<Integer> order = IntStream.range(0, rowsRead).boxed()
                .sorted(Comparator.comparing(timestamps::get))
                .collect(Collectors.toList());
        List<Integer> kept = new ArrayList<>(rowsRead);
        for (Integer i : order) {
            if (kept.isEmpty() || !timestamps.get(kept.get(kept.size() - 1)).equals(timestamps.get(i))) {
                kept.add(i);
            }
        }
        int duplicates = rowsRead - kept.size();
        if (duplicates > 0) {
            warnings.add(warn(ProcessingWarning.of(WarningType.DUPLICATE_TIMESTAMP,
                    duplicates + " row(s) with an already-seen timestamp were dropped")));
        }

        int n = kept.size();
        Map<MeterChannel, double[]> columns = new EnumMap<>(MeterChannel.class);
        for (int c = 0; c < rawChannels.size(); c++) {
            double[] column = new double[n];
            for (int r = 0; r < n; r++) {
                column[r] = values.get(kept.get(r))[c];
            }
            columns.put(rawChannels.get(c), column);
        }
        addDerivedColumns(columns, n);

        Map<MeterChannel, Integer> imputed = new EnumMap<>(MeterChannel.class);
        for (Map.Entry<MeterChannel, double[]> entry : columns.entrySet()) {
            int filled = imputeWithMean(entry.getKey(), entry.getValue(), warnings);
            if (filled > 0) {
                imputed.put(entry.getKey(), filled);
            }
        }

        List<MeterChannel> channels = new ArrayList<>(columns.keySet());
        TimeIndexedTable.Builder builder = TimeIndexedTable.builder(channels);
        for (int r = 0; r < n; r++) {
            double[] cells = new double[channels.size()];
            for (int c = 0; c < channels.size(); c++) {
                cells[c] = columns.get(channels.get(c))[r];
            }
            builder.addRow(timestamps.get(kept.get(r)), cells);
        }
        TimeIndexedTable table = builder.build();

        logger.info("Cleaned {} rows ({} duplicates dropped, {} channels imputed) spanning {} to {}",
                rowsRead, duplicates, imputed.size(), table.timestamp(0), table.timestamp(n - 1));
        return new CleaningResult(table, warnings, rowsRead, duplicates, malformed, imputed);
    }

    /**
     * Derived channels. Missing inputs propagate as missing, so imputation of a derived channel uses only
     * rows where all of its inputs were present.
     */
    static void addDerivedColumns(Map<MeterChannel, double[]> columns, int rows) {
        double[] active = columns.get(MeterChannel.GLOBAL_ACTIVE_POWER);
        double[] reactive = columns.get(MeterChannel.GLOBAL_REACTIVE_POWER);
        double[] sub1 = columns.get(MeterChannel.SUB_METERING_1);
        double[] sub2 = columns.get(MeterChannel.SUB_METERING_2);
        double[] sub3 = columns.get(MeterChannel.SUB_METERING_3);

        double[] apparent = new double[rows];
        double[] notSub = new double[rows];
        double[] totalSub = new double[rows];
        double[] total = new double[rows];
        for (int r = 0; r < rows; r++) {
            apparent[r] = active[r] + reactive[r];
            // kW to watt-hours per minute; negative residuals are kept as-is
            notSub[r] = active[r] * 1000.0 / 60.0 - sub1[r] - sub2[r] - sub3[r];
            totalSub[r] = sub1[r] + sub2[r] + sub3[r];
            total[r] = totalSub[r] + notSub[r];
        }
        columns.put(MeterChannel.GLOBAL_APPARENT_POWER, apparent);
        columns.put(MeterChannel.NOT_SUB_METERING, notSub);
        columns.put(MeterChannel.TOTAL_SUB_METERING, totalSub);
        columns.put(MeterChannel.TOTAL_SUB_NO_SUB_METERING, total);
    }

    /**
     * Replace missing values with the mean of the column's valid values.
     *
     * @return number of values filled
     */
    static int imputeWithMean(MeterChannel channel, double[] column, List<ProcessingWarning> warnings) {
        double sum = 0.0;
        int valid = 0;
        for (double v : column) {
            if (!Double.isNaN(v)) {
                sum += v;
                valid++;
            }
        }
        int missing = column.length - valid;
        if (missing == 0) {
            return 0;
        }
        if (valid == 0) {
            warnings.add(warn(new ProcessingWarning(WarningType.IMPUTATION_IMPOSSIBLE, channel,
                    "no valid values, " + missing + " value(s) left missing")));
            return 0;
        }
        double mean = sum / valid;
        for (int i = 0; i < column.length; i++) {
            if (Double.isNaN(column[i])) {
                column[i] = mean;
            }
        }
        logger.debug("Imputed {} missing {} value(s) with mean {}", missing, channel.getColumnName(), mean);
        return missing;
    }

    private static LocalDateTime parseTimestamp(String[] row, HeaderLayout layout, MeterTimestampParser parser, int line) {
        try {
            if (layout.combined) {
                return parser.parseCombined(field(row, layout.dateTimeColumn));
            }
            return parser.parse(field(row, layout.dateColumn), field(row, layout.timeColumn));
        } catch (DateTimeParseException e) {
            throw new MeterDataParseException("Unparsable timestamp: " + e.getMessage(), line);
        }
    }

    private static double coerce(String token, Set<String> missingTokens, MeterChannel channel,
                                 Map<MeterChannel, Integer> malformed) {
        if (token == null) {
            malformed.merge(channel, 1, Integer::sum);
            return Double.NaN;
        }
        String trimmed = token.trim();
        if (trimmed.isEmpty() || missingTokens.contains(trimmed)) {
            return Double.NaN;
        }
        try {
            double value = Double.parseDouble(trimmed);
            if (Double.isFinite(value)) {
                return value;
            }
        } catch (NumberFormatException e) {
            logger.trace("Malformed {} value '{}'", channel.getColumnName(), trimmed);
        }
        malformed.merge(channel, 1, Integer::sum);
        return Double.NaN;
    }

    private char resolveSeparator(BufferedReader reader) {
        String configured = settings.getDelimiter();
        if (!"auto".equalsIgnoreCase(configured.trim())) {
            if (configured.length() != 1) {
                throw new IllegalArgumentException("Delimiter must be a single character or 'auto': '" + configured + "'");
            }
            return configured.charAt(0);
        }
        try {
            reader.mark(64 * 1024);
            String header = reader.readLine();
            reader.reset();
            return sniffSeparator(header);
        } catch (IOException e) {
            throw new MeterDataParseException("Cannot read header line: " + e.getMessage(), e);
        }
    }

    static char sniffSeparator(String headerLine) {
        if (headerLine == null) {
            return ';';
        }
        long semicolons = headerLine.chars().filter(ch -> ch == ';').count();
        long commas = headerLine.chars().filter(ch -> ch == ',').count();
        return commas > semicolons ? ',' : ';';
    }

    private static String field(String[] row, int column) {
        return column < row.length ? row[column] : null;
    }

    private static boolean isBlank(String[] row) {
        for (String cell : row) {
            if (cell != null && !cell.trim().isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static ProcessingWarning warn(ProcessingWarning warning) {
        logger.warn("{}", warning);
        return warning;
    }

    @FunctionalInterface
    private interface RowSource {
        String[] next() throws IOException;
    }

    /** Column positions resolved from the header, case-insensitively. */
    private static final class HeaderLayout {
        private final boolean combined;
        private final int dateColumn;
        private final int timeColumn;
        private final int dateTimeColumn;
        private final Map<MeterChannel, Integer> channelColumns;

        private HeaderLayout(boolean combined, int dateColumn, int timeColumn, int dateTimeColumn,
                             Map<MeterChannel, Integer> channelColumns) {
            this.combined = combined;
            this.dateColumn = dateColumn;
            this.timeColumn = timeColumn;
            this.dateTimeColumn = dateTimeColumn;
            this.channelColumns = channelColumns;
        }

        static HeaderLayout of(String[] header) {
            List<String> names = new ArrayList<>();
            for (String name : header) {
                // tolerate a UTF-8 byte order mark on the first column
                names.add(name == null ? "" : name.replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT));
            }

            int date = names.indexOf(DATE_COLUMN);
            int time = names.indexOf(TIME_COLUMN);
            int dateTime = names.indexOf(DATE_TIME_COLUMN);
            boolean combined;
            if (date >= 0 && time >= 0) {
                combined = false;
            } else if (dateTime >= 0) {
                combined = true;
            } else {
                throw new MeterDataParseException("Header has neither Date and Time columns nor a Date_Time column", 1);
            }

            Map<MeterChannel, Integer> channels = new EnumMap<>(MeterChannel.class);
            List<String> absent = new ArrayList<>();
            for (MeterChannel channel : MeterChannel.raw()) {
                int index = names.indexOf(channel.getColumnName());
                if (index < 0) {
                    absent.add(channel.getColumnName());
                } else {
                    channels.put(channel, index);
                }
            }
            if (!absent.isEmpty()) {
                throw new MeterDataParseException("Missing required column(s): " + String.join(", ", absent), 1);
            }
            return new HeaderLayout(combined, date, time, dateTime, channels);
        }

        int columnOf(MeterChannel channel) {
            return channelColumns.get(channel);
        }
    }
}
