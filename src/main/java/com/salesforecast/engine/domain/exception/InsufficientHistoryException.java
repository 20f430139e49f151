package com.salesforecast.engine.domain.exception;

public class InsufficientHistoryException extends ForecastException {

    public InsufficientHistoryException(String message) {
        super(FailureReason.INSUFFICIENT_HISTORY, message);
    }
}
