package com.salesforecast.engine.domain.exception;

public class UnsupportedRegionException extends ForecastException {

    private final String region;

    public UnsupportedRegionException(String region) {
        super(FailureReason.UNSUPPORTED_REGION, "No holiday calendar for region: " + region);
        this.region = region;
    }

    public String region() {
        return region;
    }
}
