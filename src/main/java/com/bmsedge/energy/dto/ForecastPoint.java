package com.bmsedge.energy.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * One predicted period: the point forecast and its prediction bounds.
 */
@Getter
@AllArgsConstructor
public class ForecastPoint {
    private final LocalDateTime timestamp;
    private final double value;
    private final double lower;
    private final double upper;
}
