package com.salesforecast.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record ForecastPoint(
        @JsonProperty("ds") LocalDate date,
        @JsonProperty("yhat") double yhat,
        @JsonProperty("yhat_lower") double yhatLower,
        @JsonProperty("yhat_upper") double yhatUpper,
        @JsonProperty("is_historical") boolean historical) {
}
