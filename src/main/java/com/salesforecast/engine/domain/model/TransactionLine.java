package com.salesforecast.engine.domain.model;

import java.time.LocalDate;

public record TransactionLine(LocalDate date, String productId, String customerId, String category, double quantity) {

    public TransactionLine {
        if (date == null) {
            throw new IllegalArgumentException("date must not be null");
        }
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("productId must not be blank");
        }
        if (!Double.isFinite(quantity)) {
            throw new IllegalArgumentException("quantity must be finite");
        }
    }

    public TransactionLine(LocalDate date, String productId, String category, double quantity) {
        this(date, productId, null, category, quantity);
    }

    public TransactionLine(LocalDate date, String productId, double quantity) {
        this(date, productId, null, null, quantity);
    }
}
