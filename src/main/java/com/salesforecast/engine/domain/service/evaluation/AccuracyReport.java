package com.salesforecast.engine.domain.service.evaluation;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class AccuracyReport {

    private final double mape;
    private final double rmse;
    private final int holdoutSize;
    private final int evaluatedPoints;
    private final int excludedZeroActuals;

    public boolean isMapeDefined() {
        return !Double.isNaN(mape);
    }
}
