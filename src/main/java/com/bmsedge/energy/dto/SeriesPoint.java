package com.bmsedge.energy.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDateTime;

@Getter
@AllArgsConstructor
public class SeriesPoint {
    private final LocalDateTime timestamp;
    private final double value;
}
