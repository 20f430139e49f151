package com.salesforecast.engine.domain.model;

public enum SeasonalityMode {
    ADDITIVE,
    MULTIPLICATIVE
}
