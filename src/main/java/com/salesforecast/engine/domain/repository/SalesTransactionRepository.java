package com.salesforecast.engine.domain.repository;

import com.salesforecast.engine.domain.model.SalesTransactionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface SalesTransactionRepository extends JpaRepository<SalesTransactionRecord, Long> {

    List<SalesTransactionRecord> findByProductIdOrderByInvoiceDateAsc(String productId);

    List<SalesTransactionRecord> findByProductIdAndCustomerIdOrderByInvoiceDateAsc(String productId, String customerId);

    List<SalesTransactionRecord> findByCategoryOrderByInvoiceDateAsc(String category);

    Optional<SalesTransactionRecord> findFirstByProductIdAndCategoryIsNotNullOrderByInvoiceDateDesc(String productId);

    @Query("SELECT DISTINCT t.category FROM SalesTransactionRecord t " +
            "WHERE t.category IS NOT NULL AND t.category <> '' ORDER BY t.category")
    List<String> findDistinctCategories();
}
