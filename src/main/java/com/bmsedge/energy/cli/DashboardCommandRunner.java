package com.bmsedge.energy.cli;

import com.bmsedge.energy.config.EnergyEngineProperties;
import com.bmsedge.energy.dto.DashboardView;
import com.bmsedge.energy.dto.ViewRequest;
import com.bmsedge.energy.model.MeterSelection;
import com.bmsedge.energy.model.ResampleFrequency;
import com.bmsedge.energy.model.SeasonGrouping;
import com.bmsedge.energy.model.ViewKind;
import com.bmsedge.energy.service.EnergyDashboardService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Command-line entry point: loads the meter file once, renders the requested view and writes it as
 * JSON to standard output for the presentation layer.
 *
 * <pre>
 * --view=all|season|predictions  --frequency=D  --selection=SUB_METERING_1
 * --grouping=YEAR_SEASON  --horizon=12  --input=path/to/file.txt
 * </pre>
 */
@Component
@ConditionalOnProperty(prefix = "energy.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DashboardCommandRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DashboardCommandRunner.class);

    private final EnergyDashboardService dashboardService;
    private final EnergyEngineProperties properties;
    private final ObjectMapper objectMapper;
    private final PrintStream out;

    public DashboardCommandRunner(EnergyDashboardService dashboardService, EnergyEngineProperties properties,
                                  ObjectMapper objectMapper) {
        this(dashboardService, properties, objectMapper, System.out);
    }

    DashboardCommandRunner(EnergyDashboardService dashboardService, EnergyEngineProperties properties,
                           ObjectMapper objectMapper, PrintStream out) {
        this.dashboardService = dashboardService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        Path input = Paths.get(option(args, "input", properties.getInput().getPath()));
        ViewRequest request = toRequest(args);

        dashboardService.load(input);
        DashboardView view = dashboardService.render(request);
        out.println(objectMapper.writeValueAsString(view));
        logger.info("Wrote '{}' view with {} warning(s)", view.getTitle(), view.getWarnings().size());
    }

    ViewRequest toRequest(ApplicationArguments args) {
        ViewRequest.ViewRequestBuilder builder = ViewRequest.builder()
                .kind(parseKind(option(args, "view", "all")));
        String frequency = option(args, "frequency", null);
        if (frequency != null) {
            builder.frequency(ResampleFrequency.parse(frequency));
        }
        String selection = option(args, "selection", null);
        if (selection != null) {
            builder.selection(parseEnum(MeterSelection.class, selection, "selection"));
        }
        String grouping = option(args, "grouping", null);
        if (grouping != null) {
            builder.grouping(parseEnum(SeasonGrouping.class, grouping, "grouping"));
        }
        String horizon = option(args, "horizon", null);
        if (horizon != null) {
            builder.horizon(parseHorizon(horizon));
        }
        return builder.build();
    }

    static ViewKind parseKind(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "all", "all data", "all_data" -> ViewKind.ALL_DATA;
            case "season", "by season", "by_season" -> ViewKind.BY_SEASON;
            case "predictions", "run predictions", "forecast" -> ViewKind.PREDICTIONS;
            default -> throw new IllegalArgumentException("Unknown view '" + value + "', expected one of "
                    + Arrays.toString(ViewKind.values()));
        };
    }

    private static int parseHorizon(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Horizon must be a whole number: '" + value + "'", e);
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String option) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + option + " '" + value + "', expected one of "
                    + Arrays.toString(type.getEnumConstants()), e);
        }
    }

    private static String option(ApplicationArguments args, String name, String fallback) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? fallback : values.get(values.size() - 1);
    }
}
