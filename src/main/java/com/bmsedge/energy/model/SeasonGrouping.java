package com.bmsedge.energy.model;

public enum SeasonGrouping {
    SEASON,
    YEAR_SEASON
}
