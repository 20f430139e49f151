package com.salesforecast.engine.domain.service.cache;

import com.salesforecast.engine.domain.model.TimeSeriesPoint;
import com.salesforecast.engine.domain.service.ForecastProperties;
import com.salesforecast.engine.domain.service.history.SalesTransactionsRecordedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class FittedModelCache {

    private final boolean enabled;
    private final Map<ModelCacheKey, CachedFit> entries;

    public FittedModelCache(ForecastProperties properties) {
        this.enabled = properties.getCache().isEnabled();
        int maxEntries = Math.max(1, properties.getCache().getMaxEntries());
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<ModelCacheKey, CachedFit> eldest) {
                return size() > maxEntries;
            }
        };
    }

    public Optional<CachedFit> get(ModelCacheKey key) {
        if (!enabled) return Optional.empty();
        synchronized (entries) {
            return Optional.ofNullable(entries.get(key));
        }
    }

    public void put(ModelCacheKey key, CachedFit fit) {
        if (!enabled) return;
        synchronized (entries) {
            entries.put(key, fit);
        }
    }

    public int invalidateProduct(String productId) {
        int removed;
        synchronized (entries) {
            int before = entries.size();
            entries.keySet().removeIf(key -> key.productId().equals(productId));
            removed = before - entries.size();
        }
        if (removed > 0) {
            log.debug("[Cache] invalidated {} fits for product={}", removed, productId);
        }
        return removed;
    }

    @EventListener
    public void onTransactionsRecorded(SalesTransactionsRecordedEvent event) {
        event.productIds().forEach(this::invalidateProduct);
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public static String fingerprint(List<TimeSeriesPoint> series) {
        StringBuilder builder = new StringBuilder(series.size() * 24);
        for (TimeSeriesPoint p : series) {
            builder.append(p.bucketDate()).append('=').append(p.value()).append('|');
        }
        return DigestUtils.md5DigestAsHex(builder.toString().getBytes(StandardCharsets.UTF_8));
    }
}
