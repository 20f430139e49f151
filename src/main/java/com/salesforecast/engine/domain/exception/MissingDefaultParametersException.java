package com.salesforecast.engine.domain.exception;

public class MissingDefaultParametersException extends ForecastException {

    public MissingDefaultParametersException(String category) {
        super(FailureReason.MISSING_DEFAULT_PARAMETERS,
                "No hyperparameters for category '" + category + "' and no default set is configured");
    }
}
