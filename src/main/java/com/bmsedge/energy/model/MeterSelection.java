package com.bmsedge.energy.model;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Channel subsets offered by the "All data" chart tabs.
 */
@Getter
public enum MeterSelection {

    ALL_METERS("All meters", MeterChannel.METERS),
    SUB_METERING_1(MeterChannel.SUB_METERING_1.getLegend(), List.of(MeterChannel.SUB_METERING_1)),
    SUB_METERING_2(MeterChannel.SUB_METERING_2.getLegend(), List.of(MeterChannel.SUB_METERING_2)),
    SUB_METERING_3(MeterChannel.SUB_METERING_3.getLegend(), List.of(MeterChannel.SUB_METERING_3)),
    NOT_SUB_METERING(MeterChannel.NOT_SUB_METERING.getLegend(), List.of(MeterChannel.NOT_SUB_METERING));

    private final String label;
    private final List<MeterChannel> channels;

    MeterSelection(String label, List<MeterChannel> channels) {
        this.label = label;
        this.channels = Collections.unmodifiableList(channels);
    }
}
