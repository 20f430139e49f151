package com.salesforecast.engine.domain.service.cache;

import com.salesforecast.engine.domain.model.Granularity;
import com.salesforecast.engine.domain.model.HolidayEvent;
import com.salesforecast.engine.domain.model.HyperparameterSet;

import java.util.Set;

public record ModelCacheKey(String productId,
                            String customerId,
                            String category,
                            HyperparameterSet parameters,
                            Granularity granularity,
                            int holdoutSize,
                            Set<HolidayEvent> holidays,
                            String seriesFingerprint) {
}
