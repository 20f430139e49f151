package com.salesforecast.engine.domain.service.evaluation;

import com.salesforecast.engine.domain.exception.InsufficientHistoryException;
import com.salesforecast.engine.domain.model.Granularity;
import com.salesforecast.engine.domain.model.HyperparameterSet;
import com.salesforecast.engine.domain.model.TimeSeriesPoint;
import com.salesforecast.engine.domain.service.ForecastProperties;
import com.salesforecast.engine.domain.service.model.ForecastModelFitter;
import com.salesforecast.engine.domain.service.model.PredictedValue;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class ErrorEvaluatorTest {

    private final ForecastProperties properties = new ForecastProperties();
    private final ErrorEvaluator evaluator = new ErrorEvaluator(new ForecastModelFitter(properties), properties);
    private final HyperparameterSet params = properties.defaultParameters();

    @Test
    void nonPositiveHoldoutIsRejected() {
        assertThatThrownBy(() -> evaluator.evaluate(flat(24), params, Set.of(), Granularity.MONTHLY, 0))
                .isInstanceOf(InsufficientHistoryException.class);
    }

    @Test
    void holdoutCoveringWholeSeriesIsRejected() {
        assertThatThrownBy(() -> evaluator.evaluate(flat(6), params, Set.of(), Granularity.MONTHLY, 6))
                .isInstanceOf(InsufficientHistoryException.class)
                .hasMessageContaining("nothing to train on");
    }

    @Test
    void flatSeriesScoresNearZero() {
        AccuracyReport report = evaluator.evaluate(flat(24), params, Set.of(), Granularity.MONTHLY);

        assertEquals(3, report.getHoldoutSize());
        assertThat(report.getMape()).isBetween(0.0, 0.1);
        assertThat(report.getRmse()).isLessThan(0.1);
    }

    @Test
    void granularityCanBeInferred() {
        AccuracyReport report = evaluator.evaluate(flat(24), params, Set.of(), 4);

        assertEquals(4, report.getHoldoutSize());
        assertEquals(4, report.getEvaluatedPoints());
    }

    @Test
    void zeroActualsAreExcludedFromMape() {
        AccuracyReport report = ErrorEvaluator.score(
                points(0.0, 10.0, 20.0),
                List.of(new PredictedValue(5.0, 0.0, 9.0), new PredictedValue(12.0, 8.0, 16.0),
                        new PredictedValue(18.0, 14.0, 22.0)));

        assertThat(report.getMape()).isCloseTo(15.0, within(1e-9));
        assertThat(report.getRmse()).isCloseTo(Math.sqrt(33.0 / 3.0), within(1e-9));
        assertEquals(1, report.getExcludedZeroActuals());
        assertEquals(2, report.getEvaluatedPoints());
    }

    @Test
    void allZeroActualsLeaveMapeUndefined() {
        AccuracyReport report = ErrorEvaluator.score(
                points(0.0, 0.0),
                List.of(new PredictedValue(1.0, 0.0, 2.0), new PredictedValue(3.0, 2.0, 4.0)));

        assertFalse(report.isMapeDefined());
        assertThat(report.getRmse()).isCloseTo(Math.sqrt(5.0), within(1e-9));
        assertEquals(2, report.getExcludedZeroActuals());
    }

    private static List<TimeSeriesPoint> flat(int size) {
        List<TimeSeriesPoint> series = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            series.add(new TimeSeriesPoint(LocalDate.of(2022, 1, 1).plusMonths(i), 100.0));
        }
        return series;
    }

    private static List<TimeSeriesPoint> points(double... values) {
        List<TimeSeriesPoint> series = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            series.add(new TimeSeriesPoint(LocalDate.of(2024, 1, 1).plusMonths(i), values[i]));
        }
        return series;
    }
}
