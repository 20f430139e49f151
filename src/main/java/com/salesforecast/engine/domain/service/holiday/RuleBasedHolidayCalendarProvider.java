package com.salesforecast.engine.domain.service.holiday;

import com.salesforecast.engine.domain.exception.UnsupportedRegionException;
import com.salesforecast.engine.domain.model.HolidayEvent;
import com.salesforecast.engine.domain.service.ForecastProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.IntFunction;

@Slf4j
@Component
public class RuleBasedHolidayCalendarProvider implements HolidayCalendarProvider {

    private final Map<String, IntFunction<List<HolidayEvent>>> rules = new TreeMap<>();
    private final Map<String, List<HolidayEvent>> extraEvents = new TreeMap<>();

    public RuleBasedHolidayCalendarProvider(ForecastProperties properties) {
        rules.put("ID", RuleBasedHolidayCalendarProvider::indonesia);
        rules.put("US", RuleBasedHolidayCalendarProvider::unitedStates);

        for (ForecastProperties.ExtraEvent extra : properties.getHolidays().getExtraEvents()) {
            String region = normalize(extra.getRegion());
            try {
                HolidayEvent event = new HolidayEvent(LocalDate.parse(extra.getDate()), extra.getName());
                extraEvents.computeIfAbsent(region, k -> new ArrayList<>()).add(event);
                rules.putIfAbsent(region, year -> List.of());
            } catch (DateTimeParseException | IllegalArgumentException e) {
                throw new IllegalStateException("Invalid holiday extra event: region=" + extra.getRegion()
                        + ", date=" + extra.getDate() + ", name=" + extra.getName(), e);
            }
        }
        log.info("[Holiday] calendars loaded: regions={}, extraEvents={}",
                rules.keySet(), extraEvents.values().stream().mapToInt(List::size).sum());
    }

    @Override
    public Set<HolidayEvent> holidaysFor(String region, int yearFrom, int yearTo) {
        if (yearFrom > yearTo) {
            throw new IllegalArgumentException("yearFrom must be <= yearTo: " + yearFrom + " > " + yearTo);
        }
        String key = normalize(region);
        IntFunction<List<HolidayEvent>> rule = rules.get(key);
        if (rule == null) {
            throw new UnsupportedRegionException(region);
        }

        List<HolidayEvent> events = new ArrayList<>();
        for (int year = yearFrom; year <= yearTo; year++) {
            events.addAll(rule.apply(year));
        }
        for (HolidayEvent extra : extraEvents.getOrDefault(key, List.of())) {
            int year = extra.date().getYear();
            if (year >= yearFrom && year <= yearTo) {
                events.add(extra);
            }
        }
        events.sort(Comparator.comparing(HolidayEvent::date).thenComparing(HolidayEvent::name));
        return Collections.unmodifiableSet(new LinkedHashSet<>(events));
    }

    @Override
    public boolean supports(String region) {
        return region != null && rules.containsKey(normalize(region));
    }

    private static String normalize(String region) {
        return region == null ? "" : region.trim().toUpperCase(Locale.ROOT);
    }

    private static List<HolidayEvent> indonesia(int year) {
        LocalDate easter = easterSunday(year);
        return List.of(
                new HolidayEvent(LocalDate.of(year, Month.JANUARY, 1), "New Year's Day"),
                new HolidayEvent(easter.minusDays(2), "Good Friday"),
                new HolidayEvent(easter, "Easter Sunday"),
                new HolidayEvent(LocalDate.of(year, Month.MAY, 1), "International Labour Day"),
                new HolidayEvent(easter.plusDays(39), "Ascension Day of Jesus Christ"),
                new HolidayEvent(LocalDate.of(year, Month.JUNE, 1), "Pancasila Day"),
                new HolidayEvent(LocalDate.of(year, Month.AUGUST, 17), "Independence Day"),
                new HolidayEvent(LocalDate.of(year, Month.DECEMBER, 25), "Christmas Day"));
    }

    private static List<HolidayEvent> unitedStates(int year) {
        return List.of(
                new HolidayEvent(LocalDate.of(year, Month.JANUARY, 1), "New Year's Day"),
                new HolidayEvent(nthWeekday(year, Month.JANUARY, DayOfWeek.MONDAY, 3), "Martin Luther King Jr. Day"),
                new HolidayEvent(nthWeekday(year, Month.FEBRUARY, DayOfWeek.MONDAY, 3), "Washington's Birthday"),
                new HolidayEvent(LocalDate.of(year, Month.MAY, 1)
                        .with(TemporalAdjusters.lastInMonth(DayOfWeek.MONDAY)), "Memorial Day"),
                new HolidayEvent(LocalDate.of(year, Month.JULY, 4), "Independence Day"),
                new HolidayEvent(nthWeekday(year, Month.SEPTEMBER, DayOfWeek.MONDAY, 1), "Labor Day"),
                new HolidayEvent(nthWeekday(year, Month.OCTOBER, DayOfWeek.MONDAY, 2), "Columbus Day"),
                new HolidayEvent(LocalDate.of(year, Month.NOVEMBER, 11), "Veterans Day"),
                new HolidayEvent(nthWeekday(year, Month.NOVEMBER, DayOfWeek.THURSDAY, 4), "Thanksgiving"),
                new HolidayEvent(LocalDate.of(year, Month.DECEMBER, 25), "Christmas Day"));
    }

    private static LocalDate nthWeekday(int year, Month month, DayOfWeek day, int n) {
        return LocalDate.of(year, month, 1).with(TemporalAdjusters.dayOfWeekInMonth(n, day));
    }

    static LocalDate easterSunday(int year) {
        int a = year % 19;
        int b = year / 100;
        int c = year % 100;
        int d = b / 4;
        int e = b % 4;
        int f = (b + 8) / 25;
        int g = (b - f + 1) / 3;
        int h = (19 * a + b - d - g + 15) % 30;
        int i = c / 4;
        int k = c % 4;
        int l = (32 + 2 * e + 2 * i - h - k) % 7;
        int m = (a + 11 * h + 22 * l) / 451;
        int month = (h + l - 7 * m + 114) / 31;
        int day = ((h + l - 7 * m + 114) % 31) + 1;
        return LocalDate.of(year, month, day);
    }
}
