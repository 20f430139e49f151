package com.salesforecast.engine.api;

import com.salesforecast.engine.domain.exception.InsufficientHistoryException;
import com.salesforecast.engine.domain.exception.InvalidPeriodsException;
import com.salesforecast.engine.domain.model.ForecastPoint;
import com.salesforecast.engine.domain.model.ForecastResult;
import com.salesforecast.engine.domain.model.Granularity;
import com.salesforecast.engine.domain.service.ForecastOrchestrator;
import com.salesforecast.engine.domain.service.ForecastProperties;
import com.salesforecast.engine.domain.service.evaluation.AccuracyReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ForecastControllerTest {

    private ForecastOrchestrator orchestrator;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        orchestrator = mock(ForecastOrchestrator.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ForecastController(orchestrator, new ForecastProperties(), Runnable::run))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void forecastIsSerialisedWithWireNames() throws Exception {
        ForecastResult result = ForecastResult.builder()
                .points(List.of(
                        new ForecastPoint(LocalDate.of(2024, 1, 1), 10.0, 8.0, 12.0, true),
                        new ForecastPoint(LocalDate.of(2024, 2, 1), 11.0, 9.0, 13.0, false)))
                .accuracy(AccuracyReport.builder().mape(4.5).rmse(1.0).holdoutSize(3).evaluatedPoints(3).build())
                .periods(3)
                .build();
        when(orchestrator.forecast("P1", null, null, 3, Granularity.MONTHLY, 3)).thenReturn(result);

        MvcResult started = mockMvc.perform(get("/api/forecast/sales_forecast")
                        .param("product_id", "P1").param("periods", "3").param("aggregation", "M"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.forecast[0].ds").value("2024-01-01"))
                .andExpect(jsonPath("$.forecast[0].yhat_lower").value(8.0))
                .andExpect(jsonPath("$.forecast[0].is_historical").value(true))
                .andExpect(jsonPath("$.forecast[1].is_historical").value(false))
                .andExpect(jsonPath("$.mape").value(4.5))
                .andExpect(jsonPath("$.periods").value(3));
    }

    @Test
    void undefinedMapeIsNull() throws Exception {
        ForecastResult result = ForecastResult.builder()
                .points(List.of())
                .accuracy(AccuracyReport.builder().mape(Double.NaN).rmse(2.0).holdoutSize(3).excludedZeroActuals(3).build())
                .periods(6)
                .build();
        when(orchestrator.forecast("P1", null, null, 6, Granularity.WEEKLY, 3)).thenReturn(result);

        MvcResult started = mockMvc.perform(get("/api/forecast/sales_forecast")
                        .param("product_id", "P1").param("periods", "6"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mape").value(nullValue()))
                .andExpect(jsonPath("$.mape_excluded_points").value(3));
    }

    @Test
    void invalidPeriodsIsBadRequest() throws Exception {
        when(orchestrator.forecast(eq("P1"), isNull(), isNull(), eq(12), eq(Granularity.WEEKLY), eq(3)))
                .thenThrow(new InvalidPeriodsException(12, List.of(3, 6)));

        MvcResult started = mockMvc.perform(get("/api/forecast/sales_forecast")
                        .param("product_id", "P1").param("periods", "12"))
                .andReturn();

        mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.reason").value("INVALID_PERIODS"));
    }

    @Test
    void insufficientHistoryIsUnprocessable() throws Exception {
        when(orchestrator.forecast(eq("P1"), isNull(), anyString(), eq(3), eq(Granularity.MONTHLY), eq(3)))
                .thenThrow(new InsufficientHistoryException("No sales data available for product P1"));

        MvcResult started = mockMvc.perform(get("/api/forecast/sales_forecast")
                        .param("product_id", "P1").param("category", "Snacks")
                        .param("periods", "3").param("aggregation", "M"))
                .andReturn();

        mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.reason").value("INSUFFICIENT_HISTORY"));
    }

    @Test
    void customerFilterIsPassedToOrchestrator() throws Exception {
        ForecastResult result = ForecastResult.builder()
                .points(List.of(new ForecastPoint(LocalDate.of(2024, 3, 4), 5.0, 4.0, 6.0, false)))
                .accuracy(AccuracyReport.builder().mape(2.0).rmse(0.5).holdoutSize(3).evaluatedPoints(3).build())
                .periods(3)
                .build();
        when(orchestrator.forecast("P1", "C9", "Snacks", 3, Granularity.WEEKLY, 3)).thenReturn(result);

        MvcResult started = mockMvc.perform(get("/api/forecast/sales_forecast")
                        .param("product_id", "P1").param("customer_id", "C9").param("category", "Snacks"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.forecast[0].ds").value("2024-03-04"));
        verify(orchestrator).forecast("P1", "C9", "Snacks", 3, Granularity.WEEKLY, 3);
    }

    @Test
    void timedOutRequestCancelsTheFit() throws Exception {
        ForecastProperties properties = new ForecastProperties();
        properties.getExecutor().setRequestTimeoutSeconds(1);
        AtomicReference<Runnable> queued = new AtomicReference<>();
        MockMvc stalled = MockMvcBuilders
                .standaloneSetup(new ForecastController(orchestrator, properties, queued::set))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();

        MvcResult started = stalled.perform(get("/api/forecast/sales_forecast").param("product_id", "P1"))
                .andExpect(request().asyncStarted())
                .andReturn();

        stalled.perform(asyncDispatch(started))
                .andExpect(status().isGatewayTimeout());
        assertThat(queued.get()).isInstanceOf(Future.class);
        assertThat(((Future<?>) queued.get()).isCancelled()).isTrue();
        verifyNoInteractions(orchestrator);
    }

    @Test
    void unknownAggregationIsRejectedBeforeForecasting() throws Exception {
        mockMvc.perform(get("/api/forecast/sales_forecast")
                        .param("product_id", "P1").param("aggregation", "Q"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("Invalid aggregation")));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void missingProductIsRejected() throws Exception {
        mockMvc.perform(get("/api/forecast/sales_forecast").param("periods", "3"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void saturatedPoolIsServiceUnavailable() throws Exception {
        MockMvc saturated = MockMvcBuilders
                .standaloneSetup(new ForecastController(orchestrator, new ForecastProperties(), task -> {
                    throw new RejectedExecutionException("queue full");
                }))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();

        saturated.perform(get("/api/forecast/sales_forecast").param("product_id", "P1").param("periods", "3"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.reason").value("OVERLOADED"));
    }
}
