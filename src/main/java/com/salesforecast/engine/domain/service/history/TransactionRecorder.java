package com.salesforecast.engine.domain.service.history;

import com.salesforecast.engine.domain.model.SalesTransactionRecord;
import com.salesforecast.engine.domain.repository.SalesTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionRecorder {

    private final SalesTransactionRepository repository;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public List<SalesTransactionRecord> record(Collection<SalesTransactionRecord> records) {
        if (records.isEmpty()) return List.of();

        List<SalesTransactionRecord> saved = repository.saveAll(records);
        Set<String> productIds = saved.stream()
                .map(SalesTransactionRecord::getProductId)
                .collect(Collectors.toSet());
        eventPublisher.publishEvent(new SalesTransactionsRecordedEvent(productIds));

        log.info("[History] recorded {} lines for products={}", saved.size(), productIds);
        return saved;
    }
}
