package com.salesforecast.engine.domain.service.holiday;

import com.salesforecast.engine.domain.model.HolidayEvent;

import java.util.Set;

public interface HolidayCalendarProvider {

    Set<HolidayEvent> holidaysFor(String region, int yearFrom, int yearTo);

    boolean supports(String region);
}
