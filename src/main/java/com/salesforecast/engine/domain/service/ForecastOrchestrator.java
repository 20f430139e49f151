package com.salesforecast.engine.domain.service;

import com.salesforecast.engine.domain.exception.ForecastException;
import com.salesforecast.engine.domain.exception.InsufficientHistoryException;
import com.salesforecast.engine.domain.exception.InvalidPeriodsException;
import com.salesforecast.engine.domain.model.ForecastPoint;
import com.salesforecast.engine.domain.model.ForecastResult;
import com.salesforecast.engine.domain.model.Granularity;
import com.salesforecast.engine.domain.model.HolidayEvent;
import com.salesforecast.engine.domain.model.HyperparameterSet;
import com.salesforecast.engine.domain.model.TimeSeriesPoint;
import com.salesforecast.engine.domain.model.TransactionLine;
import com.salesforecast.engine.domain.service.aggregation.TimeSeriesAggregator;
import com.salesforecast.engine.domain.service.cache.CachedFit;
import com.salesforecast.engine.domain.service.cache.FittedModelCache;
import com.salesforecast.engine.domain.service.cache.ModelCacheKey;
import com.salesforecast.engine.domain.service.evaluation.AccuracyReport;
import com.salesforecast.engine.domain.service.evaluation.ErrorEvaluator;
import com.salesforecast.engine.domain.service.history.TransactionHistorySource;
import com.salesforecast.engine.domain.service.holiday.HolidayCalendarProvider;
import com.salesforecast.engine.domain.service.model.FittedModel;
import com.salesforecast.engine.domain.service.model.ForecastModelFitter;
import com.salesforecast.engine.domain.service.model.PredictedValue;
import com.salesforecast.engine.domain.service.parameter.ParameterResolver;
import com.salesforecast.engine.infra.metrics.ForecastMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastOrchestrator {

    private final TransactionHistorySource historySource;
    private final TimeSeriesAggregator aggregator;
    private final HolidayCalendarProvider holidayProvider;
    private final ParameterResolver parameterResolver;
    private final ForecastModelFitter fitter;
    private final ErrorEvaluator evaluator;
    private final FittedModelCache cache;
    private final ForecastMetrics metrics;
    private final ForecastProperties properties;

    public ForecastResult forecast(String productId, String category, int periods, Granularity granularity) {
        return forecast(productId, null, category, periods, granularity, properties.getDefaultHoldoutSize());
    }

    public ForecastResult forecast(String productId, String category, int periods,
                                   Granularity granularity, int holdoutSize) {
        return forecast(productId, null, category, periods, granularity, holdoutSize);
    }

    public ForecastResult forecast(String productId, String customerId, String category, int periods,
                                   Granularity granularity, int holdoutSize) {
        if (!properties.getAllowedPeriods().contains(periods)) {
            InvalidPeriodsException e = new InvalidPeriodsException(periods, properties.getAllowedPeriods());
            metrics.recordFailure(e.reason());
            throw e;
        }
        String customer = customerId == null || customerId.isBlank() ? null : customerId;
        try {
            return metrics.timeForecast(() -> compute(productId, customer, category, periods, granularity, holdoutSize));
        } catch (ForecastException e) {
            metrics.recordFailure(e.reason());
            log.warn("[Forecast] product={}, customer={}, category={}, periods={}, granularity={} failed: {} ({})",
                    productId, customer, category, periods, granularity, e.reason(), e.getMessage());
            throw e;
        }
    }

    private ForecastResult compute(String productId, String customerId, String category, int periods,
                                   Granularity granularity, int holdoutSize) {
        long startNano = System.nanoTime();

        List<TransactionLine> lines = customerId == null
                ? historySource.findByProduct(productId)
                : historySource.findByProductAndCustomer(productId, customerId);
        if (lines.isEmpty() && customerId != null) {
            throw new InsufficientHistoryException(
                    "No sales data available for product " + productId + " and customer " + customerId);
        }
        List<TimeSeriesPoint> series = aggregator.aggregate(lines, productId, granularity);

        LocalDate first = series.get(0).bucketDate();
        LocalDate last = series.get(series.size() - 1).bucketDate();
        int window = properties.getHolidayWindowBuckets();
        Set<HolidayEvent> holidays = resolveHolidays(
                granularity.plusBuckets(first, -window).getYear(),
                granularity.plusBuckets(last, periods + window).getYear());

        String effectiveCategory = (category != null && !category.isBlank())
                ? category
                : historySource.categoryOf(productId).orElse(null);
        HyperparameterSet params = parameterResolver.resolve(effectiveCategory);

        ModelCacheKey key = new ModelCacheKey(productId, customerId, effectiveCategory, params, granularity,
                holdoutSize, holidays, FittedModelCache.fingerprint(series));
        CachedFit fit = cache.get(key).orElse(null);
        if (fit != null) {
            metrics.recordCacheHit();
        } else {
            metrics.recordCacheMiss();
            FittedModel model = fitter.fit(series, params, holidays, granularity);
            AccuracyReport accuracy = evaluator.evaluate(series, params, holidays, granularity, holdoutSize);
            fit = new CachedFit(model, accuracy);
            cache.put(key, fit);
        }

        List<ForecastPoint> points = assemble(fit.model(), periods);
        ForecastResult result = ForecastResult.builder()
                .points(points)
                .accuracy(fit.accuracy())
                .periods(periods)
                .productId(productId)
                .granularity(granularity)
                .parameters(params)
                .build();

        log.info("[Forecast] product={}, customer={}, category={}, granularity={}, history={}, periods={}, mape={}, params={}, took={}ms",
                productId, customerId, effectiveCategory, granularity, series.size(), periods,
                fit.accuracy().isMapeDefined() ? String.format("%.2f%%", fit.accuracy().getMape()) : "undefined",
                params.getCategory(), (System.nanoTime() - startNano) / 1_000_000);
        return result;
    }

    private Set<HolidayEvent> resolveHolidays(int yearFrom, int yearTo) {
        String region = properties.getHolidayRegion();
        if (!holidayProvider.supports(region)) {
            log.warn("[Forecast] holiday calendar unavailable for region={}, fitting without holiday effects", region);
            return Set.of();
        }
        return holidayProvider.holidaysFor(region, yearFrom, yearTo);
    }

    private static List<ForecastPoint> assemble(FittedModel model, int periods) {
        List<LocalDate> history = model.trainingBuckets();
        List<LocalDate> future = model.futureBuckets(periods);

        List<ForecastPoint> points = new ArrayList<>(history.size() + future.size());
        addPoints(points, history, model.predict(history), true);
        addPoints(points, future, model.predict(future), false);
        return points;
    }

    private static void addPoints(List<ForecastPoint> out, List<LocalDate> dates,
                                  List<PredictedValue> values, boolean historical) {
        for (int i = 0; i < dates.size(); i++) {
            PredictedValue v = values.get(i);
            out.add(new ForecastPoint(dates.get(i), v.yhat(), v.yhatLower(), v.yhatUpper(), historical));
        }
    }
}
