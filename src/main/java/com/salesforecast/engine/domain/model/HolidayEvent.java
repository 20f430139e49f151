package com.salesforecast.engine.domain.model;

import java.time.LocalDate;

public record HolidayEvent(LocalDate date, String name) {

    public HolidayEvent {
        if (date == null) {
            throw new IllegalArgumentException("date must not be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }
}
