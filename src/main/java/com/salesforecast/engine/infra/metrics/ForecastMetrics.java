package com.salesforecast.engine.infra.metrics;

import com.salesforecast.engine.domain.exception.FailureReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadPoolExecutor;
import java.util.function.Supplier;

@Slf4j
@Component
public class ForecastMetrics {

    private final MeterRegistry meterRegistry;
    private final Timer forecastTimer;
    private final Timer tuningTimer;
    private final Counter cacheHits;
    private final Counter cacheMisses;

    public ForecastMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.forecastTimer = Timer.builder("forecast.request.duration")
                .description("End-to-end forecast computation time")
                .register(meterRegistry);
        this.tuningTimer = Timer.builder("forecast.tuning.duration")
                .description("Parameter tuning job duration")
                .register(meterRegistry);
        this.cacheHits = Counter.builder("forecast.cache.requests")
                .tag("result", "hit")
                .description("Fitted model cache lookups")
                .register(meterRegistry);
        this.cacheMisses = Counter.builder("forecast.cache.requests")
                .tag("result", "miss")
                .description("Fitted model cache lookups")
                .register(meterRegistry);
    }

    public <T> T timeForecast(Supplier<T> work) {
        return forecastTimer.record(work);
    }

    public <T> T timeTuning(Supplier<T> work) {
        return tuningTimer.record(work);
    }

    public void recordFailure(FailureReason reason) {
        Counter.builder("forecast.failures")
                .tag("reason", reason.name())
                .description("Forecast requests that ended with a reported failure")
                .register(meterRegistry)
                .increment();
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public void bindExecutor(String name, ThreadPoolExecutor executor) {
        Gauge.builder("forecast.executor.queue.size", executor, e -> (double) e.getQueue().size())
                .tag("pool", name)
                .description("Tasks waiting for a forecast worker")
                .register(meterRegistry);
        Gauge.builder("forecast.executor.active", executor, e -> (double) e.getActiveCount())
                .tag("pool", name)
                .description("Forecast workers currently busy")
                .register(meterRegistry);
        log.info("[Metrics] executor gauges registered: pool={}", name);
    }
}
