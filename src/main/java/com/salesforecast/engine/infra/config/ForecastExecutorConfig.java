package com.salesforecast.engine.infra.config;

import com.salesforecast.engine.domain.service.ForecastProperties;
import com.salesforecast.engine.infra.metrics.ForecastMetrics;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class ForecastExecutorConfig {

    private final ForecastProperties properties;
    private final ForecastMetrics metrics;

    private ThreadPoolExecutor executor;

    @Bean(name = "forecastExecutor")
    public ThreadPoolExecutor forecastExecutor() {
        ForecastProperties.Executor config = properties.getExecutor();
        int core = Math.max(1, config.getCoreThreads());
        int max = Math.max(core, config.getMaxThreads());

        executor = new ThreadPoolExecutor(
                core, max,
                60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, config.getQueueCapacity())),
                namedThreadFactory("forecast-worker"),
                new ThreadPoolExecutor.AbortPolicy());

        metrics.bindExecutor("forecast", executor);
        log.info("[Executor] forecast pool started: core={}, max={}, queue={}",
                core, max, config.getQueueCapacity());
        return executor;
    }

    @PreDestroy
    public void shutdown() {
        if (executor == null) return;
        log.info("[Executor] shutting down forecast pool...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
