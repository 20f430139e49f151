package com.salesforecast.engine.domain.service.model;

import com.salesforecast.engine.domain.model.Granularity;
import com.salesforecast.engine.domain.model.HolidayEvent;
import com.salesforecast.engine.domain.model.TimeSeriesPoint;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

final class FeatureLayout {

    static final double DAYS_PER_YEAR = 365.25;

    private final Granularity granularity;
    private final long startEpochDay;
    private final double spanDays;
    private final double[] changepoints;
    private final int fourierOrder;
    private final List<HolidayColumn> holidayColumns;
    private final int holidayWindow;

    private FeatureLayout(Granularity granularity, long startEpochDay, double spanDays,
                          double[] changepoints, int fourierOrder,
                          List<HolidayColumn> holidayColumns, int holidayWindow) {
        this.granularity = granularity;
        this.startEpochDay = startEpochDay;
        this.spanDays = spanDays;
        this.changepoints = changepoints;
        this.fourierOrder = fourierOrder;
        this.holidayColumns = holidayColumns;
        this.holidayWindow = holidayWindow;
    }

    static FeatureLayout build(List<TimeSeriesPoint> series, Granularity granularity,
                               Collection<HolidayEvent> holidays, int changepointCount,
                               double changepointRange, int holidayWindow) {
        int n = series.size();
        long start = series.get(0).bucketDate().toEpochDay();
        long end = series.get(n - 1).bucketDate().toEpochDay();
        double span = Math.max(1.0, end - start);

        int histSize = (int) Math.floor(n * changepointRange);
        int cpCount = Math.max(0, Math.min(changepointCount, histSize - 1));
        double[] cps = new double[cpCount];
        for (int j = 1; j <= cpCount; j++) {
            int idx = (int) Math.round((double) j * (histSize - 1) / cpCount);
            cps[j - 1] = (series.get(idx).bucketDate().toEpochDay() - start) / span;
        }

        Map<String, Set<LocalDate>> byName = new TreeMap<>();
        for (HolidayEvent h : holidays) {
            byName.computeIfAbsent(h.name(), k -> new TreeSet<>()).add(granularity.bucketStart(h.date()));
        }
        List<HolidayColumn> columns = new ArrayList<>();
        for (Map.Entry<String, Set<LocalDate>> e : byName.entrySet()) {
            HolidayColumn column = new HolidayColumn(e.getKey(), Set.copyOf(e.getValue()));
            boolean seenInTraining = series.stream()
                    .anyMatch(p -> column.isActive(p.bucketDate(), granularity, holidayWindow));
            if (seenInTraining) {
                columns.add(column);
            }
        }

        return new FeatureLayout(granularity, start, span, cps,
                granularity.yearlyFourierOrder(), List.copyOf(columns), holidayWindow);
    }

    int trendWidth() {
        return 2 + changepoints.length;
    }

    int seasonalWidth() {
        return 2 * fourierOrder + holidayColumns.size();
    }

    int fourierWidth() {
        return 2 * fourierOrder;
    }

    double scaledTime(LocalDate date) {
        return (date.toEpochDay() - startEpochDay) / spanDays;
    }

    double[] trendRow(LocalDate date) {
        double t = scaledTime(date);
        double[] row = new double[trendWidth()];
        row[0] = 1.0;
        row[1] = t;
        for (int j = 0; j < changepoints.length; j++) {
            row[2 + j] = Math.max(0.0, t - changepoints[j]);
        }
        return row;
    }

    double[] seasonalRow(LocalDate date) {
        double[] row = new double[seasonalWidth()];
        double day = date.toEpochDay();
        for (int k = 1; k <= fourierOrder; k++) {
            double x = 2.0 * Math.PI * k * day / DAYS_PER_YEAR;
            row[2 * (k - 1)] = Math.sin(x);
            row[2 * (k - 1) + 1] = Math.cos(x);
        }
        int offset = fourierWidth();
        for (int j = 0; j < holidayColumns.size(); j++) {
            row[offset + j] = holidayColumns.get(j).isActive(date, granularity, holidayWindow) ? 1.0 : 0.0;
        }
        return row;
    }

    Granularity granularity() {
        return granularity;
    }

    double[] changepoints() {
        return changepoints.clone();
    }

    List<String> holidayNames() {
        return holidayColumns.stream().map(HolidayColumn::name).toList();
    }

    record HolidayColumn(String name, Set<LocalDate> bucketStarts) {

        boolean isActive(LocalDate date, Granularity granularity, int window) {
            LocalDate bucket = granularity.bucketStart(date);
            for (LocalDate holidayBucket : bucketStarts) {
                if (Math.abs(granularity.bucketsBetween(holidayBucket, bucket)) <= window) {
                    return true;
                }
            }
            return false;
        }
    }
}
