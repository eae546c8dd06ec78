package com.bmsedge.energy.model;

import lombok.Getter;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Numeric channels of a household meter reading.
 * The first seven are read from the source file, the remaining four are derived at ingestion.
 */
@Getter
public enum MeterChannel {

    GLOBAL_ACTIVE_POWER("global_active_power", "Global active power", false),
    GLOBAL_REACTIVE_POWER("global_reactive_power", "Global reactive power", false),
    VOLTAGE("voltage", "Voltage", false),
    GLOBAL_INTENSITY("global_intensity", "Global intensity", false),
    SUB_METERING_1("sub_metering_1", "Dishwasher, oven and microwave", false),
    SUB_METERING_2("sub_metering_2", "Washing-machine, tumble-drier, refrigerator and one light", false),
    SUB_METERING_3("sub_metering_3", "Water-heater and air-conditioner", false),
    GLOBAL_APPARENT_POWER("global_apparent_power", "Global apparent power", true),
    NOT_SUB_METERING("not_sub_metering", "Other usage", true),
    TOTAL_SUB_METERING("total_sub_metering", "Total sub-metering", true),
    TOTAL_SUB_NO_SUB_METERING("total_sub_no_sub_metering", "Total sub-metering and other usage", true);

    /** The four metering channels charted and aggregated by the dashboard views. */
    public static final List<MeterChannel> METERS = Collections.unmodifiableList(Arrays.asList(
            SUB_METERING_1, SUB_METERING_2, SUB_METERING_3, NOT_SUB_METERING));

    private final String columnName;
    private final String legend;
    private final boolean derived;

    MeterChannel(String columnName, String legend, boolean derived) {
        this.columnName = columnName;
        this.legend = legend;
        this.derived = derived;
    }

    public static Set<MeterChannel> raw() {
        EnumSet<MeterChannel> raw = EnumSet.noneOf(MeterChannel.class);
        for (MeterChannel channel : values()) {
            if (!channel.derived) {
                raw.add(channel);
            }
        }
        return raw;
    }
}
