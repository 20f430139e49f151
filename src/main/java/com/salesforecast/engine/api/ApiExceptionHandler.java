package com.salesforecast.engine.api;

import com.salesforecast.engine.domain.exception.FailureReason;
import com.salesforecast.engine.domain.exception.ForecastException;
import com.salesforecast.engine.domain.exception.TuningConflictException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    static HttpStatus statusOf(FailureReason reason) {
        return switch (reason) {
            case INSUFFICIENT_HISTORY, MODEL_FIT_FAILED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INVALID_PERIODS -> HttpStatus.BAD_REQUEST;
            case TUNING_CONFLICT -> HttpStatus.CONFLICT;
            case MISSING_DEFAULT_PARAMETERS, UNSUPPORTED_REGION -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    @ExceptionHandler(ForecastException.class)
    public ResponseEntity<Map<String, Object>> handleForecast(ForecastException ex, HttpServletRequest request) {
        Map<String, Object> body = body(ex.reason().name(), ex.getMessage(), request);
        if (ex instanceof TuningConflictException conflict) {
            body.put("job_id", conflict.runningJobId());
        }
        return respond(statusOf(ex.reason()), ex, body, request);
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ex, body("INVALID_REQUEST", ex.getMessage(), request), request);
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NoSuchElementException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, ex, body("NOT_FOUND", ex.getMessage(), request), request);
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<Map<String, Object>> handleRejected(RejectedExecutionException ex,
                                                              HttpServletRequest request) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex,
                body("OVERLOADED", "Forecast workers are saturated, retry later", request), request);
    }

    @ExceptionHandler(TimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleTimeout(TimeoutException ex, HttpServletRequest request) {
        return respond(HttpStatus.GATEWAY_TIMEOUT, ex,
                body("TIMEOUT", "Forecast did not complete in time", request), request);
    }

    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<Map<String, Object>> handleCompletion(CompletionException ex, HttpServletRequest request) {
        Throwable cause = ex.getCause();
        if (cause instanceof ForecastException forecast) {
            return handleForecast(forecast, request);
        }
        if (cause instanceof IllegalArgumentException illegal) {
            return handleBadRequest(illegal, request);
        }
        if (cause instanceof TimeoutException timeout) {
            return handleTimeout(timeout, request);
        }
        if (cause instanceof RejectedExecutionException rejected) {
            return handleRejected(rejected, request);
        }
        return handleUnexpected(ex, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex,
                body("INTERNAL_ERROR", "Unexpected error", request), request);
    }

    private ResponseEntity<Map<String, Object>> respond(HttpStatus status, Exception ex,
                                                        Map<String, Object> body, HttpServletRequest request) {
        if (status.is5xxServerError()) {
            log.error("[API] {} {} -> {}: {}", request.getMethod(), request.getRequestURI(), status.value(),
                    ex.getMessage(), ex);
        } else {
            log.warn("[API] {} {} -> {}: {}", request.getMethod(), request.getRequestURI(), status.value(),
                    ex.getMessage());
        }
        return ResponseEntity.status(status).body(body);
    }

    private Map<String, Object> body(String reason, String message, HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("reason", reason);
        body.put("message", message);
        body.put("path", request.getRequestURI());
        return body;
    }
}
