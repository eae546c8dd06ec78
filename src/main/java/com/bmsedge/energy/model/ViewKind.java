package com.bmsedge.energy.model;

import lombok.Getter;

/**
 * Dashboard views. Each kind is served by exactly one view builder.
 */
@Getter
public enum ViewKind {

    ALL_DATA("All data"),
    BY_SEASON("By Season"),
    PREDICTIONS("Run predictions");

    private final String label;

    ViewKind(String label) {
        this.label = label;
    }
}
