package com.salesforecast.engine.domain.exception;

import java.util.Collection;

public class InvalidPeriodsException extends ForecastException {

    public InvalidPeriodsException(int periods, Collection<Integer> allowed) {
        super(FailureReason.INVALID_PERIODS,
                "periods=" + periods + " is not supported, allowed values: " + allowed);
    }
}
