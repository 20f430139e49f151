package com.salesforecast.engine.domain.service.evaluation;

import com.salesforecast.engine.domain.exception.InsufficientHistoryException;
import com.salesforecast.engine.domain.model.Granularity;
import com.salesforecast.engine.domain.model.HolidayEvent;
import com.salesforecast.engine.domain.model.HyperparameterSet;
import com.salesforecast.engine.domain.model.TimeSeriesPoint;
import com.salesforecast.engine.domain.service.ForecastProperties;
import com.salesforecast.engine.domain.service.model.FittedModel;
import com.salesforecast.engine.domain.service.model.ForecastModelFitter;
import com.salesforecast.engine.domain.service.model.PredictedValue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class ErrorEvaluator {

    private final ForecastModelFitter fitter;
    private final ForecastProperties properties;

    public AccuracyReport evaluate(List<TimeSeriesPoint> series, HyperparameterSet params,
                                   Collection<HolidayEvent> holidays, Granularity granularity) {
        return evaluate(series, params, holidays, granularity, properties.getDefaultHoldoutSize());
    }

    public AccuracyReport evaluate(List<TimeSeriesPoint> series, HyperparameterSet params,
                                   Collection<HolidayEvent> holidays, int holdoutSize) {
        return evaluate(series, params, holidays, null, holdoutSize);
    }

    public AccuracyReport evaluate(List<TimeSeriesPoint> series, HyperparameterSet params,
                                   Collection<HolidayEvent> holidays, Granularity granularity,
                                   int holdoutSize) {
        if (holdoutSize <= 0) {
            throw new InsufficientHistoryException("holdoutSize must be positive, got " + holdoutSize);
        }
        if (holdoutSize >= series.size()) {
            throw new InsufficientHistoryException(String.format(
                    "holdoutSize=%d leaves nothing to train on (series has %d buckets)",
                    holdoutSize, series.size()));
        }

        List<TimeSeriesPoint> train = series.subList(0, series.size() - holdoutSize);
        List<TimeSeriesPoint> test = series.subList(series.size() - holdoutSize, series.size());

        FittedModel model = granularity == null
                ? fitter.fit(train, params, holidays)
                : fitter.fit(train, params, holidays, granularity);
        List<PredictedValue> predicted = model.predict(test.stream().map(TimeSeriesPoint::bucketDate).toList());

        return score(test, predicted);
    }

    static AccuracyReport score(List<TimeSeriesPoint> actual, List<PredictedValue> predicted) {
        SummaryStatistics percentageErrors = new SummaryStatistics();
        double sumSquared = 0.0;
        int excluded = 0;
        for (int i = 0; i < actual.size(); i++) {
            double a = actual.get(i).value();
            double p = predicted.get(i).yhat();
            sumSquared += (a - p) * (a - p);
            if (a == 0.0) {
                excluded++;
                continue;
            }
            percentageErrors.addValue(Math.abs(a - p) / Math.abs(a));
        }

        double mape = percentageErrors.getN() == 0 ? Double.NaN : percentageErrors.getMean() * 100.0;
        AccuracyReport report = AccuracyReport.builder()
                .mape(mape)
                .rmse(Math.sqrt(sumSquared / actual.size()))
                .holdoutSize(actual.size())
                .evaluatedPoints((int) percentageErrors.getN())
                .excludedZeroActuals(excluded)
                .build();

        if (!report.isMapeDefined()) {
            log.warn("[Backtest] MAPE undefined: all {} held-out actuals are zero", actual.size());
        } else {
            log.debug("[Backtest] mape={}%, rmse={}, evaluated={}, excludedZero={}",
                    String.format("%.3f", mape), String.format("%.3f", report.getRmse()),
                    report.getEvaluatedPoints(), excluded);
        }
        return report;
    }
}
