package com.salesforecast.engine;

import com.salesforecast.engine.domain.model.ForecastResult;
import com.salesforecast.engine.domain.model.Granularity;
import com.salesforecast.engine.domain.model.SalesTransactionRecord;
import com.salesforecast.engine.domain.model.TransactionLine;
import com.salesforecast.engine.domain.service.ForecastOrchestrator;
import com.salesforecast.engine.domain.service.cache.FittedModelCache;
import com.salesforecast.engine.domain.service.history.TransactionHistorySource;
import com.salesforecast.engine.domain.service.history.TransactionRecorder;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ForecastEngineApplicationTest {

    @Autowired
    private TransactionRecorder recorder;

    @Autowired
    private ForecastOrchestrator orchestrator;

    @Autowired
    private FittedModelCache cache;

    @Autowired
    private TransactionHistorySource historySource;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void recordedSalesCanBeForecastAndInvalidateCachedFits() throws Exception {
        List<SalesTransactionRecord> records = new ArrayList<>();
        for (int i = 0; i < 24; i++) {
            records.add(SalesTransactionRecord.builder()
                    .productId("SKU-1")
                    .customerId("C" + i)
                    .category("Stationery")
                    .invoiceDate(LocalDate.of(2022, 1, 12).plusMonths(i))
                    .quantity(50.0 + (i % 12))
                    .build());
        }
        recorder.record(records);

        ForecastResult result = orchestrator.forecast("SKU-1", null, 3, Granularity.MONTHLY);

        assertEquals(24, result.historicalPoints().size());
        assertEquals(3, result.futurePoints().size());
        assertThat(result.getMape()).isNotNull();
        assertThat(cache.size()).isPositive();

        recorder.record(List.of(SalesTransactionRecord.builder()
                .productId("SKU-1")
                .category("Stationery")
                .invoiceDate(LocalDate.of(2024, 1, 8))
                .quantity(55.0)
                .build()));

        assertEquals(0, cache.size());

        mockMvc.perform(get("/api/forecast/categories"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data[0]").value("Stationery"));
    }

    @Test
    void customerHistoryIsReadInDateOrder() {
        recorder.record(List.of(
                record("SKU-2", "C1", LocalDate.of(2023, 3, 1), 4.0),
                record("SKU-2", "C2", LocalDate.of(2023, 2, 1), 9.0),
                record("SKU-2", "C1", LocalDate.of(2023, 1, 1), 6.0)));

        List<TransactionLine> lines = historySource.findByProductAndCustomer("SKU-2", "C1");

        assertThat(lines).extracting(TransactionLine::quantity).containsExactly(6.0, 4.0);
        assertThat(lines).allSatisfy(line -> assertEquals("C1", line.customerId()));
    }

    private static SalesTransactionRecord record(String productId, String customerId, LocalDate date, double quantity) {
        return SalesTransactionRecord.builder()
                .productId(productId)
                .customerId(customerId)
                .category("Stationery")
                .invoiceDate(date)
                .quantity(quantity)
                .build();
    }
}
