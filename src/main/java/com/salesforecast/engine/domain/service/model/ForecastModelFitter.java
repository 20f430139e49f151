package com.salesforecast.engine.domain.service.model;

import com.salesforecast.engine.domain.exception.InsufficientHistoryException;
import com.salesforecast.engine.domain.exception.ModelFitException;
import com.salesforecast.engine.domain.model.Granularity;
import com.salesforecast.engine.domain.model.HolidayEvent;
import com.salesforecast.engine.domain.model.HyperparameterSet;
import com.salesforecast.engine.domain.model.SeasonalityMode;
import com.salesforecast.engine.domain.model.TimeSeriesPoint;
import com.salesforecast.engine.domain.service.ForecastProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Fits {@code y = trend + seasonal + holiday} (additive) or
 * {@code y = trend * (1 + seasonal + holiday)} (multiplicative) by penalised least squares.
 *
 * <p>Trend is piecewise linear with hinge columns at changepoints spread over the first part
 * of the history; seasonality is a yearly Fourier series; each holiday name gets one
 * indicator column. Each prior scale in {@link HyperparameterSet} maps to a ridge penalty of
 * {@code NOISE_PRIOR / scale^2} on its component. The additive model is a single joint solve;
 * the multiplicative model alternates between the trend and the seasonal block until the
 * objective stops improving.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ForecastModelFitter {

    static final double NOISE_PRIOR = 0.01;
    static final double UNPENALIZED = 1e-6;

    private final ForecastProperties properties;

    public FittedModel fit(List<TimeSeriesPoint> series, HyperparameterSet params,
                           Collection<HolidayEvent> holidays) {
        if (series == null || series.size() < 2) {
            throw new InsufficientHistoryException("At least 2 buckets are needed to fit a model, got "
                    + (series == null ? 0 : series.size()));
        }
        return fit(series, params, holidays, inferGranularity(series));
    }

    public FittedModel fit(List<TimeSeriesPoint> series, HyperparameterSet params,
                           Collection<HolidayEvent> holidays, Granularity granularity) {
        if (series == null || series.size() < 2) {
            throw new InsufficientHistoryException("At least 2 buckets are needed to fit a model, got "
                    + (series == null ? 0 : series.size()));
        }
        params.validate();
        requireContiguous(series, granularity);
        checkCancelled();

        long startNano = System.nanoTime();
        int n = series.size();
        FeatureLayout layout = FeatureLayout.build(series, granularity,
                holidays == null ? List.of() : holidays,
                properties.getChangepointCount(), properties.getChangepointRange(),
                properties.getHolidayWindowBuckets());

        double yScale = 0.0;
        for (TimeSeriesPoint p : series) {
            if (!Double.isFinite(p.value())) {
                throw new ModelFitException("Series contains a non-finite value at " + p.bucketDate());
            }
            yScale = Math.max(yScale, Math.abs(p.value()));
        }
        if (yScale == 0.0) yScale = 1.0;

        double[][] trendRows = new double[n][];
        double[][] seasonalRows = new double[n][];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            LocalDate date = series.get(i).bucketDate();
            trendRows[i] = layout.trendRow(date);
            seasonalRows[i] = layout.seasonalRow(date);
            y[i] = series.get(i).value() / yScale;
        }

        double[] trendPenalty = trendPenalties(layout, params);
        double[] seasonalPenalty = seasonalPenalties(layout, params);
        RidgeSolver solver = new RidgeSolver(
                properties.getSolver().getMaxIterations(), properties.getSolver().getTolerance());

        double[] trendCoef;
        double[] seasonalCoef;
        int iterations;
        if (params.getSeasonalityMode() == SeasonalityMode.MULTIPLICATIVE) {
            double[][] coefficients = new double[2][];
            iterations = fitMultiplicative(solver, trendRows, seasonalRows, y,
                    trendPenalty, seasonalPenalty, coefficients);
            trendCoef = coefficients[0];
            seasonalCoef = coefficients[1];
        } else {
            double[][] joint = new double[n][];
            for (int i = 0; i < n; i++) {
                joint[i] = concat(trendRows[i], seasonalRows[i]);
            }
            double[] all = solver.solve(joint, y, concat(trendPenalty, seasonalPenalty));
            trendCoef = Arrays.copyOfRange(all, 0, trendPenalty.length);
            seasonalCoef = Arrays.copyOfRange(all, trendPenalty.length, all.length);
            iterations = 1;
        }

        double sumSq = 0.0;
        for (int i = 0; i < n; i++) {
            double fitted = combine(params.getSeasonalityMode(),
                    FittedModel.dot(trendRows[i], trendCoef), FittedModel.dot(seasonalRows[i], seasonalCoef));
            double residual = (y[i] - fitted) * yScale;
            sumSq += residual * residual;
        }
        double residualStdDev = Math.sqrt(sumSq / Math.max(1, n - 1));

        FittedModel model = new FittedModel(params, layout,
                series.get(0).bucketDate(), series.get(n - 1).bucketDate(), n, yScale,
                trendCoef, seasonalCoef, residualStdDev, intervalZ(properties.getIntervalWidth()), iterations);

        log.debug("[Fit] n={}, granularity={}, mode={}, changepoints={}, holidays={}, sigma={}, iterations={}, took={}us",
                n, granularity, params.getSeasonalityMode(), layout.changepoints().length,
                layout.holidayNames().size(), String.format("%.4f", residualStdDev), iterations,
                (System.nanoTime() - startNano) / 1_000);
        return model;
    }

    private int fitMultiplicative(RidgeSolver solver, double[][] trendRows, double[][] seasonalRows,
                                  double[] y, double[] trendPenalty, double[] seasonalPenalty,
                                  double[][] out) {
        int n = y.length;
        int maxOuter = properties.getSolver().getMaxOuterIterations();
        double outerTolerance = properties.getSolver().getOuterTolerance();

        double[] seasonalCoef = new double[seasonalPenalty.length];
        double[] trendCoef = solver.solve(trendRows, y, trendPenalty);
        double previous = Double.POSITIVE_INFINITY;

        for (int iteration = 1; iteration <= maxOuter; iteration++) {
            checkCancelled();
            double[][] scaledSeasonal = new double[n][];
            double[] remainder = new double[n];
            for (int i = 0; i < n; i++) {
                double trend = FittedModel.dot(trendRows[i], trendCoef);
                scaledSeasonal[i] = scale(seasonalRows[i], trend);
                remainder[i] = y[i] - trend;
            }
            seasonalCoef = solver.solve(scaledSeasonal, remainder, seasonalPenalty);

            double[][] scaledTrend = new double[n][];
            for (int i = 0; i < n; i++) {
                scaledTrend[i] = scale(trendRows[i], 1.0 + FittedModel.dot(seasonalRows[i], seasonalCoef));
            }
            trendCoef = solver.solve(scaledTrend, y, trendPenalty);

            double objective = objective(trendRows, seasonalRows, y, trendCoef, seasonalCoef,
                    trendPenalty, seasonalPenalty);
            if (!Double.isFinite(objective)) {
                throw new ModelFitException("Multiplicative fit diverged at iteration " + iteration);
            }
            if (Math.abs(previous - objective) <= outerTolerance * Math.max(1.0, objective)) {
                out[0] = trendCoef;
                out[1] = seasonalCoef;
                return iteration;
            }
            previous = objective;
        }
        throw new ModelFitException("Multiplicative fit did not converge within " + maxOuter + " iterations");
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Fit cancelled");
        }
    }

    private static double objective(double[][] trendRows, double[][] seasonalRows, double[] y,
                                    double[] trendCoef, double[] seasonalCoef,
                                    double[] trendPenalty, double[] seasonalPenalty) {
        double sum = 0.0;
        for (int i = 0; i < y.length; i++) {
            double fitted = combine(SeasonalityMode.MULTIPLICATIVE,
                    FittedModel.dot(trendRows[i], trendCoef), FittedModel.dot(seasonalRows[i], seasonalCoef));
            double r = y[i] - fitted;
            sum += r * r;
        }
        for (int j = 0; j < trendCoef.length; j++) sum += trendPenalty[j] * trendCoef[j] * trendCoef[j];
        for (int j = 0; j < seasonalCoef.length; j++) sum += seasonalPenalty[j] * seasonalCoef[j] * seasonalCoef[j];
        return sum;
    }

    private static double[] trendPenalties(FeatureLayout layout, HyperparameterSet params) {
        double[] penalties = new double[layout.trendWidth()];
        penalties[0] = UNPENALIZED;
        penalties[1] = UNPENALIZED;
        double changepointPenalty = priorPenalty(params.getTrendFlexibility());
        for (int j = 2; j < penalties.length; j++) {
            penalties[j] = changepointPenalty;
        }
        return penalties;
    }

    private static double[] seasonalPenalties(FeatureLayout layout, HyperparameterSet params) {
        double[] penalties = new double[layout.seasonalWidth()];
        double fourier = priorPenalty(params.getSeasonalityStrength());
        double holiday = priorPenalty(params.getHolidayStrength());
        for (int j = 0; j < penalties.length; j++) {
            penalties[j] = j < layout.fourierWidth() ? fourier : holiday;
        }
        return penalties;
    }

    private static double priorPenalty(double priorScale) {
        return Math.max(UNPENALIZED, NOISE_PRIOR / (priorScale * priorScale));
    }

    static double combine(SeasonalityMode mode, double trend, double seasonal) {
        return mode == SeasonalityMode.MULTIPLICATIVE ? trend * (1.0 + seasonal) : trend + seasonal;
    }

    static double intervalZ(double intervalWidth) {
        if (!(intervalWidth > 0 && intervalWidth < 1)) {
            throw new IllegalArgumentException("interval width must be in (0, 1): " + intervalWidth);
        }
        return new NormalDistribution().inverseCumulativeProbability(0.5 + intervalWidth / 2.0);
    }

    private static void requireContiguous(List<TimeSeriesPoint> series, Granularity granularity) {
        for (int i = 0; i < series.size(); i++) {
            LocalDate date = series.get(i).bucketDate();
            if (!granularity.bucketStart(date).equals(date)) {
                throw new IllegalArgumentException("Bucket " + date + " is not a " + granularity + " bucket start");
            }
            if (i > 0 && !granularity.plusBuckets(series.get(i - 1).bucketDate(), 1).equals(date)) {
                throw new IllegalArgumentException("Series is not contiguous at " + date);
            }
        }
    }

    private static Granularity inferGranularity(List<TimeSeriesPoint> series) {
        LocalDate first = series.get(0).bucketDate();
        LocalDate second = series.get(1).bucketDate();
        if (ChronoUnit.DAYS.between(first, second) == 7 && first.getDayOfWeek() == DayOfWeek.MONDAY) {
            return Granularity.WEEKLY;
        }
        return Granularity.MONTHLY;
    }

    private static double[] scale(double[] row, double factor) {
        double[] out = new double[row.length];
        for (int j = 0; j < row.length; j++) {
            out[j] = row[j] * factor;
        }
        return out;
    }

    private static double[] concat(double[] a, double[] b) {
        double[] out = new double[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}
