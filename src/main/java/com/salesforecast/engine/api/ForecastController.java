package com.salesforecast.engine.api;

import com.salesforecast.engine.domain.model.ForecastResult;
import com.salesforecast.engine.domain.model.Granularity;
import com.salesforecast.engine.domain.service.ForecastOrchestrator;
import com.salesforecast.engine.domain.service.ForecastProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@RestController
@RequestMapping("/api/forecast")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ForecastController {

    private final ForecastOrchestrator orchestrator;
    private final ForecastProperties properties;

    @Qualifier("forecastExecutor")
    private final Executor forecastExecutor;

    @GetMapping("/sales_forecast")
    public CompletableFuture<ResponseEntity<ForecastResult>> salesForecast(
            @RequestParam("product_id") String productId,
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "customer_id", required = false) String customerId,
            @RequestParam(value = "periods", defaultValue = "3") int periods,
            @RequestParam(value = "aggregation", defaultValue = "W") String aggregation,
            @RequestParam(value = "holdout", required = false) Integer holdout) {
        if (productId.isBlank()) {
            throw new IllegalArgumentException("product_id must be provided");
        }
        Granularity granularity = Granularity.fromCode(aggregation);
        int holdoutSize = holdout != null ? holdout : properties.getDefaultHoldoutSize();

        log.info("[Forecast API] request: product={}, customer={}, category={}, periods={}, aggregation={}, holdout={}",
                productId, customerId, category, periods, granularity, holdoutSize);

        CompletableFuture<ForecastResult> result = new CompletableFuture<>();
        FutureTask<Void> task = new FutureTask<>(() -> {
            try {
                result.complete(orchestrator.forecast(productId, customerId, category, periods, granularity, holdoutSize));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        }, null);
        forecastExecutor.execute(task);

        // a timed-out fit is interrupted so it frees its worker
        return result
                .orTimeout(properties.getExecutor().getRequestTimeoutSeconds(), TimeUnit.SECONDS)
                .whenComplete((forecast, error) -> {
                    Throwable cause = error instanceof CompletionException ? error.getCause() : error;
                    if (cause instanceof TimeoutException) {
                        task.cancel(true);
                        log.warn("[Forecast API] request timed out, fit cancelled: product={}", productId);
                    }
                })
                .thenApply(ResponseEntity::ok);
    }
}
