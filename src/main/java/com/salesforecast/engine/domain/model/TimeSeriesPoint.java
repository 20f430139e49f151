package com.salesforecast.engine.domain.model;

import java.time.LocalDate;

public record TimeSeriesPoint(LocalDate bucketDate, double value) {

    public TimeSeriesPoint {
        if (bucketDate == null) {
            throw new IllegalArgumentException("bucketDate must not be null");
        }
    }
}
