package com.salesforecast.engine.domain.service;

import com.salesforecast.engine.domain.model.Granularity;
import com.salesforecast.engine.domain.model.HyperparameterSet;
import com.salesforecast.engine.domain.model.SeasonalityMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "forecast")
public class ForecastProperties {

    private List<Integer> allowedPeriods = new ArrayList<>(List.of(3, 6));
    private int defaultHoldoutSize = 3;
    private int minWeeklyBuckets = 24;
    private int minMonthlyBuckets = 12;

    private String holidayRegion = "ID";
    private int holidayWindowBuckets = 1;

    private int changepointCount = 25;
    private double changepointRange = 0.8;
    private double intervalWidth = 0.95;

    private Defaults defaults = new Defaults();
    private Solver solver = new Solver();
    private Cache cache = new Cache();
    private Executor executor = new Executor();
    private Holidays holidays = new Holidays();
    private Tuning tuning = new Tuning();

    public int minNonZeroBuckets(Granularity granularity) {
        return granularity == Granularity.WEEKLY ? minWeeklyBuckets : minMonthlyBuckets;
    }

    public HyperparameterSet defaultParameters() {
        if (defaults == null || !defaults.isEnabled()) {
            return null;
        }
        return HyperparameterSet.builder()
                .category(HyperparameterSet.DEFAULT_CATEGORY)
                .trendFlexibility(defaults.getTrendFlexibility())
                .seasonalityStrength(defaults.getSeasonalityStrength())
                .holidayStrength(defaults.getHolidayStrength())
                .seasonalityMode(defaults.getSeasonalityMode())
                .build()
                .validate();
    }

    @Getter
    @Setter
    public static class Defaults {
        private boolean enabled = true;
        private double trendFlexibility = 0.05;
        private double seasonalityStrength = 10.0;
        private double holidayStrength = 10.0;
        private SeasonalityMode seasonalityMode = SeasonalityMode.ADDITIVE;
    }

    @Getter
    @Setter
    public static class Solver {
        private int maxIterations = 1_000;
        private double tolerance = 1e-10;
        private int maxOuterIterations = 200;
        private double outerTolerance = 1e-8;
    }

    @Getter
    @Setter
    public static class Cache {
        private boolean enabled = true;
        private int maxEntries = 256;
    }

    @Getter
    @Setter
    public static class Executor {
        private int coreThreads = 2;
        private int maxThreads = 4;
        private int queueCapacity = 32;
        private long requestTimeoutSeconds = 30;
    }

    @Getter
    @Setter
    public static class Tuning {
        private int parallelism = 4;
    }

    @Getter
    @Setter
    public static class Holidays {
        private List<ExtraEvent> extraEvents = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class ExtraEvent {
        private String region;
        private String date;
        private String name;
    }
}
