package com.salesforecast.engine.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(name = "sales_transaction", indexes = {
        @Index(name = "idx_sales_tx_product_date", columnList = "productId, invoiceDate"),
        @Index(name = "idx_sales_tx_product_customer", columnList = "productId, customerId"),
        @Index(name = "idx_sales_tx_category", columnList = "category")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SalesTransactionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    private String productId;

    @Column(length = 50)
    private String customerId;

    @Column(length = 100)
    private String category;

    @Column(nullable = false)
    private LocalDate invoiceDate;

    private double quantity;

    public TransactionLine toLine() {
        return new TransactionLine(invoiceDate, productId, customerId, category, quantity);
    }
}
