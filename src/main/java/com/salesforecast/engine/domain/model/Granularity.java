package com.salesforecast.engine.domain.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

public enum Granularity {

    WEEKLY("W", 10) {
        @Override
        public LocalDate bucketStart(LocalDate date) {
            return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        }

        @Override
        public LocalDate plusBuckets(LocalDate bucketStart, long buckets) {
            return bucketStart.plusWeeks(buckets);
        }

        @Override
        public long bucketsBetween(LocalDate fromBucket, LocalDate toBucket) {
            return ChronoUnit.WEEKS.between(fromBucket, toBucket);
        }
    },

    MONTHLY("M", 5) {
        @Override
        public LocalDate bucketStart(LocalDate date) {
            return date.withDayOfMonth(1);
        }

        @Override
        public LocalDate plusBuckets(LocalDate bucketStart, long buckets) {
            return bucketStart.plusMonths(buckets);
        }

        @Override
        public long bucketsBetween(LocalDate fromBucket, LocalDate toBucket) {
            return ChronoUnit.MONTHS.between(fromBucket, toBucket);
        }
    };

    private final String code;
    private final int yearlyFourierOrder;

    Granularity(String code, int yearlyFourierOrder) {
        this.code = code;
        this.yearlyFourierOrder = yearlyFourierOrder;
    }

    public abstract LocalDate bucketStart(LocalDate date);

    public abstract LocalDate plusBuckets(LocalDate bucketStart, long buckets);

    public abstract long bucketsBetween(LocalDate fromBucket, LocalDate toBucket);

    public String code() {
        return code;
    }

    public int yearlyFourierOrder() {
        return yearlyFourierOrder;
    }

    public static Granularity fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("aggregation must be provided");
        }
        for (Granularity g : values()) {
            if (g.code.equalsIgnoreCase(code) || g.name().equalsIgnoreCase(code)) {
                return g;
            }
        }
        throw new IllegalArgumentException(
                "Invalid aggregation type '" + code + "'. Use 'W' for weekly or 'M' for monthly");
    }
}
