package com.salesforecast.engine.domain.exception;

public enum FailureReason {
    INSUFFICIENT_HISTORY,
    UNSUPPORTED_REGION,
    MISSING_DEFAULT_PARAMETERS,
    MODEL_FIT_FAILED,
    INVALID_PERIODS,
    TUNING_CONFLICT
}
