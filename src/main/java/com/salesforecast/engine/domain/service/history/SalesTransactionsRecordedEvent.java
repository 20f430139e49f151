package com.salesforecast.engine.domain.service.history;

import java.util.Set;

public record SalesTransactionsRecordedEvent(Set<String> productIds) {

    public SalesTransactionsRecordedEvent {
        productIds = Set.copyOf(productIds);
    }
}
