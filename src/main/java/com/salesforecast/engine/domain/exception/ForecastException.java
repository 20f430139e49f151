package com.salesforecast.engine.domain.exception;

public abstract class ForecastException extends RuntimeException {

    private final FailureReason reason;

    protected ForecastException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected ForecastException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FailureReason reason() {
        return reason;
    }
}
