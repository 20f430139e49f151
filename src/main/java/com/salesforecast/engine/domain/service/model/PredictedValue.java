package com.salesforecast.engine.domain.service.model;

public record PredictedValue(double yhat, double yhatLower, double yhatUpper) {
}
