package com.salesforecast.engine.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public class HyperparameterSet {

    public static final String DEFAULT_CATEGORY = "default";

    private final String category;

    @Builder.Default
    private final double trendFlexibility = 0.05;

    @Builder.Default
    private final double seasonalityStrength = 10.0;

    @Builder.Default
    private final double holidayStrength = 10.0;

    @Builder.Default
    private final SeasonalityMode seasonalityMode = SeasonalityMode.ADDITIVE;

    public HyperparameterSet validate() {
        requirePositive("trendFlexibility", trendFlexibility);
        requirePositive("seasonalityStrength", seasonalityStrength);
        requirePositive("holidayStrength", holidayStrength);
        if (seasonalityMode == null) {
            throw new IllegalArgumentException("seasonalityMode must not be null");
        }
        return this;
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0) || !Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be a positive finite number: " + value);
        }
    }
}
