package com.salesforecast.engine.domain.exception;

public class TuningConflictException extends ForecastException {

    private final long runningJobId;

    public TuningConflictException(String category, long runningJobId) {
        super(FailureReason.TUNING_CONFLICT,
                "A tuning job is already running for category '" + category + "' (job " + runningJobId + ")");
        this.runningJobId = runningJobId;
    }

    public long runningJobId() {
        return runningJobId;
    }
}
