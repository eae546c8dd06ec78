package com.bmsedge.energy.model;

public enum WarningType {
    /** A channel had no valid value at all, so no mean exists to fill it with. */
    IMPUTATION_IMPOSSIBLE,
    /** A resample window or seasonal bucket had no contributing rows and produced no output. */
    EMPTY_WINDOW,
    DUPLICATE_TIMESTAMP,
    MALFORMED_VALUE
}
