package com.salesforecast.engine.domain.service.aggregation;

import com.salesforecast.engine.domain.exception.InsufficientHistoryException;
import com.salesforecast.engine.domain.model.Granularity;
import com.salesforecast.engine.domain.model.TimeSeriesPoint;
import com.salesforecast.engine.domain.model.TransactionLine;
import com.salesforecast.engine.domain.service.ForecastProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;

@Slf4j
@Component
@RequiredArgsConstructor
public class TimeSeriesAggregator {

    private final ForecastProperties properties;

    public List<TimeSeriesPoint> aggregate(Collection<TransactionLine> transactions,
                                           String productId,
                                           Granularity granularity) {
        Objects.requireNonNull(productId, "productId");
        List<TransactionLine> lines = transactions.stream()
                .filter(tx -> productId.equals(tx.productId()))
                .toList();
        if (lines.isEmpty()) {
            throw new InsufficientHistoryException("No sales data available for product " + productId);
        }
        return bucketize(lines, granularity, "product=" + productId);
    }

    public List<TimeSeriesPoint> aggregateAll(Collection<TransactionLine> transactions,
                                              Granularity granularity) {
        if (transactions.isEmpty()) {
            throw new InsufficientHistoryException("No sales data available");
        }
        return bucketize(transactions, granularity, "all");
    }

    private List<TimeSeriesPoint> bucketize(Collection<TransactionLine> lines,
                                            Granularity granularity,
                                            String label) {
        Objects.requireNonNull(granularity, "granularity");

        TreeMap<LocalDate, Double> sums = new TreeMap<>();
        for (TransactionLine tx : lines) {
            LocalDate bucket = granularity.bucketStart(tx.date());
            sums.merge(bucket, Math.max(0.0, tx.quantity()), Double::sum);
        }

        LocalDate first = sums.firstKey();
        LocalDate last = sums.lastKey();
        long bucketCount = granularity.bucketsBetween(first, last) + 1;

        // empty buckets stay in as zeros so the seasonal phase of later points holds
        List<TimeSeriesPoint> series = new ArrayList<>((int) bucketCount);
        int nonZero = 0;
        for (long i = 0; i < bucketCount; i++) {
            LocalDate bucket = granularity.plusBuckets(first, i);
            double value = sums.getOrDefault(bucket, 0.0);
            if (value != 0.0) nonZero++;
            series.add(new TimeSeriesPoint(bucket, value));
        }

        int required = properties.minNonZeroBuckets(granularity);
        if (nonZero < required) {
            throw new InsufficientHistoryException(String.format(
                    "Need at least %d non-zero %s buckets to forecast, found %d (%s)",
                    required, granularity.name().toLowerCase(), nonZero, label));
        }

        log.debug("[Aggregate] {} lines={}, buckets={}, nonZero={}, range={}..{}",
                label, lines.size(), bucketCount, nonZero, first, last);
        return List.copyOf(series);
    }
}
