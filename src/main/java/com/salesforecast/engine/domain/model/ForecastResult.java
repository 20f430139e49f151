package com.salesforecast.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.salesforecast.engine.domain.service.evaluation.AccuracyReport;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@JsonPropertyOrder({"forecast", "mape", "periods"})
@JsonInclude(JsonInclude.Include.ALWAYS)
public class ForecastResult {

    @JsonProperty("forecast")
    private final List<ForecastPoint> points;

    @JsonIgnore
    private final AccuracyReport accuracy;

    @JsonProperty("periods")
    private final int periods;

    @JsonIgnore
    private final String productId;

    @JsonIgnore
    private final Granularity granularity;

    @JsonIgnore
    private final HyperparameterSet parameters;

    @Builder
    private ForecastResult(List<ForecastPoint> points, AccuracyReport accuracy, int periods,
                           String productId, Granularity granularity, HyperparameterSet parameters) {
        this.points = points == null ? List.of() : List.copyOf(points);
        this.accuracy = accuracy;
        this.periods = periods;
        this.productId = productId;
        this.granularity = granularity;
        this.parameters = parameters;
    }

    @JsonProperty("mape")
    public Double getMape() {
        return accuracy != null && accuracy.isMapeDefined() ? accuracy.getMape() : null;
    }

    @JsonProperty("mape_excluded_points")
    public int getMapeExcludedPoints() {
        return accuracy != null ? accuracy.getExcludedZeroActuals() : 0;
    }

    @JsonIgnore
    public List<ForecastPoint> historicalPoints() {
        return points.stream().filter(ForecastPoint::historical).toList();
    }

    @JsonIgnore
    public List<ForecastPoint> futurePoints() {
        return points.stream().filter(p -> !p.historical()).toList();
    }
}
