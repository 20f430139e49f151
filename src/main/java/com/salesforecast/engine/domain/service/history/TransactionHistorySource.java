package com.salesforecast.engine.domain.service.history;

import com.salesforecast.engine.domain.model.TransactionLine;

import java.util.List;
import java.util.Optional;

public interface TransactionHistorySource {

    List<TransactionLine> findByProduct(String productId);

    List<TransactionLine> findByProductAndCustomer(String productId, String customerId);

    List<TransactionLine> findByCategory(String category);

    Optional<String> categoryOf(String productId);

    List<String> categories();
}
