package com.salesforecast.engine.domain.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class GranularityTest {

    @Test
    void codesAreCaseInsensitive() {
        assertEquals(Granularity.WEEKLY, Granularity.fromCode("w"));
        assertEquals(Granularity.MONTHLY, Granularity.fromCode("M"));
        assertEquals(Granularity.MONTHLY, Granularity.fromCode("monthly"));
    }

    @Test
    void unknownCodeIsRejected() {
        assertThatThrownBy(() -> Granularity.fromCode("D"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid aggregation type");
    }

    @Test
    void weeklyBucketsCrossYearBoundaryOnMonday() {
        assertEquals(LocalDate.of(2024, 12, 30), Granularity.WEEKLY.bucketStart(LocalDate.of(2025, 1, 4)));
        assertEquals(1, Granularity.WEEKLY.bucketsBetween(LocalDate.of(2024, 12, 30), LocalDate.of(2025, 1, 6)));
    }

    @Test
    void monthlyBucketArithmetic() {
        LocalDate january = Granularity.MONTHLY.bucketStart(LocalDate.of(2024, 1, 31));

        assertEquals(LocalDate.of(2024, 1, 1), january);
        assertEquals(LocalDate.of(2024, 3, 1), Granularity.MONTHLY.plusBuckets(january, 2));
        assertEquals(-2, Granularity.MONTHLY.bucketsBetween(LocalDate.of(2024, 3, 1), january));
    }
}
