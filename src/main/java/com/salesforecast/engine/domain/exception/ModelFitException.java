package com.salesforecast.engine.domain.exception;

public class ModelFitException extends ForecastException {

    public ModelFitException(String message) {
        super(FailureReason.MODEL_FIT_FAILED, message);
    }

    public ModelFitException(String message, Throwable cause) {
        super(FailureReason.MODEL_FIT_FAILED, message, cause);
    }
}
