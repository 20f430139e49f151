package com.salesforecast.engine.domain.service.history;

import com.salesforecast.engine.domain.model.SalesTransactionRecord;
import com.salesforecast.engine.domain.model.TransactionLine;
import com.salesforecast.engine.domain.repository.SalesTransactionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaTransactionHistorySource implements TransactionHistorySource {

    private final SalesTransactionRepository repository;

    @Override
    public List<TransactionLine> findByProduct(String productId) {
        return repository.findByProductIdOrderByInvoiceDateAsc(productId).stream()
                .map(SalesTransactionRecord::toLine)
                .toList();
    }

    @Override
    public List<TransactionLine> findByProductAndCustomer(String productId, String customerId) {
        return repository.findByProductIdAndCustomerIdOrderByInvoiceDateAsc(productId, customerId).stream()
                .map(SalesTransactionRecord::toLine)
                .toList();
    }

    @Override
    public List<TransactionLine> findByCategory(String category) {
        return repository.findByCategoryOrderByInvoiceDateAsc(category).stream()
                .map(SalesTransactionRecord::toLine)
                .toList();
    }

    @Override
    public Optional<String> categoryOf(String productId) {
        return repository.findFirstByProductIdAndCategoryIsNotNullOrderByInvoiceDateDesc(productId)
                .map(SalesTransactionRecord::getCategory);
    }

    @Override
    public List<String> categories() {
        return repository.findDistinctCategories();
    }
}
