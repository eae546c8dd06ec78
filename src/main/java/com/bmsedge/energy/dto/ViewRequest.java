package com.bmsedge.energy.dto;

import com.bmsedge.energy.model.MeterSelection;
import com.bmsedge.energy.model.ResampleFrequency;
import com.bmsedge.energy.model.SeasonGrouping;
import com.bmsedge.energy.model.ViewKind;
import lombok.Builder;
import lombok.Getter;

/**
 * What the presentation layer asks for. Unset fields fall back to the configured defaults.
 */
@Getter
@Builder
public class ViewRequest {

    private final ViewKind kind;
    private final ResampleFrequency frequency;
    @Builder.Default
    private final MeterSelection selection = MeterSelection.ALL_METERS;
    private final SeasonGrouping grouping;
    private final Integer horizon;

    public static ViewRequest of(ViewKind kind) {
        return ViewRequest.builder().kind(kind).build();
    }
}
