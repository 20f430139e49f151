package com.salesforecast.engine.domain.service.model;

import com.salesforecast.engine.domain.model.Granularity;
import com.salesforecast.engine.domain.model.HyperparameterSet;
import com.salesforecast.engine.domain.model.SeasonalityMode;
import lombok.Getter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of one fit. Holds the trend, seasonal and holiday coefficients together with the
 * training bounds; it never references the input series, so it is safe to cache and to
 * share between threads.
 *
 * <p>The prediction interval is {@code yhat +/- z * sigma}, where {@code sigma} is the
 * in-sample residual standard deviation and {@code z} the normal quantile for the configured
 * interval width. This assumes roughly normal residuals and ignores the extra uncertainty of
 * trend extrapolation, so intervals far into the horizon are too narrow.
 */
@Getter
public class FittedModel {

    private final HyperparameterSet parameters;
    private final Granularity granularity;
    private final LocalDate firstBucket;
    private final LocalDate lastBucket;
    private final int trainingSize;
    private final double residualStdDev;
    private final double intervalZ;
    private final int iterations;

    @Getter(lombok.AccessLevel.NONE)
    private final FeatureLayout layout;
    @Getter(lombok.AccessLevel.NONE)
    private final double yScale;
    @Getter(lombok.AccessLevel.NONE)
    private final double[] trendCoefficients;
    @Getter(lombok.AccessLevel.NONE)
    private final double[] seasonalCoefficients;

    FittedModel(HyperparameterSet parameters, FeatureLayout layout, LocalDate firstBucket,
                LocalDate lastBucket, int trainingSize, double yScale, double[] trendCoefficients,
                double[] seasonalCoefficients, double residualStdDev, double intervalZ, int iterations) {
        this.parameters = parameters;
        this.granularity = layout.granularity();
        this.layout = layout;
        this.firstBucket = firstBucket;
        this.lastBucket = lastBucket;
        this.trainingSize = trainingSize;
        this.yScale = yScale;
        this.trendCoefficients = trendCoefficients.clone();
        this.seasonalCoefficients = seasonalCoefficients.clone();
        this.residualStdDev = residualStdDev;
        this.intervalZ = intervalZ;
        this.iterations = iterations;
    }

    public List<PredictedValue> predict(List<LocalDate> dates) {
        List<PredictedValue> out = new ArrayList<>(dates.size());
        double halfWidth = intervalZ * residualStdDev;
        for (LocalDate date : dates) {
            double yhat = rawValue(date);
            out.add(new PredictedValue(
                    Math.max(0.0, yhat),
                    Math.max(0.0, yhat - halfWidth),
                    Math.max(0.0, yhat + halfWidth)));
        }
        return out;
    }

    public List<LocalDate> futureBuckets(int count) {
        List<LocalDate> dates = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            dates.add(granularity.plusBuckets(lastBucket, i));
        }
        return dates;
    }

    public List<LocalDate> trainingBuckets() {
        List<LocalDate> dates = new ArrayList<>(trainingSize);
        for (int i = 0; i < trainingSize; i++) {
            dates.add(granularity.plusBuckets(firstBucket, i));
        }
        return dates;
    }

    public double trend(LocalDate date) {
        return dot(layout.trendRow(date), trendCoefficients) * yScale;
    }

    public List<String> holidayNames() {
        return layout.holidayNames();
    }

    public double[] changepoints() {
        return layout.changepoints();
    }

    public List<Double> changepointDeltas() {
        List<Double> deltas = new ArrayList<>(trendCoefficients.length - 2);
        for (int j = 2; j < trendCoefficients.length; j++) {
            deltas.add(trendCoefficients[j] * yScale);
        }
        return Collections.unmodifiableList(deltas);
    }

    double rawValue(LocalDate date) {
        double trend = dot(layout.trendRow(date), trendCoefficients);
        double seasonal = dot(layout.seasonalRow(date), seasonalCoefficients);
        double scaled = parameters.getSeasonalityMode() == SeasonalityMode.MULTIPLICATIVE
                ? trend * (1.0 + seasonal)
                : trend + seasonal;
        return scaled * yScale;
    }

    static double dot(double[] row, double[] coefficients) {
        double sum = 0.0;
        for (int j = 0; j < row.length; j++) {
            sum += row[j] * coefficients[j];
        }
        return sum;
    }
}
