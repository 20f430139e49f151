package com.salesforecast.engine.domain.service.holiday;

import com.salesforecast.engine.domain.exception.UnsupportedRegionException;
import com.salesforecast.engine.domain.model.HolidayEvent;
import com.salesforecast.engine.domain.service.ForecastProperties;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class RuleBasedHolidayCalendarProviderTest {

    private final RuleBasedHolidayCalendarProvider provider =
            new RuleBasedHolidayCalendarProvider(new ForecastProperties());

    @Test
    void easterDatesMatchKnownYears() {
        assertEquals(LocalDate.of(2019, 4, 21), RuleBasedHolidayCalendarProvider.easterSunday(2019));
        assertEquals(LocalDate.of(2024, 3, 31), RuleBasedHolidayCalendarProvider.easterSunday(2024));
        assertEquals(LocalDate.of(2025, 4, 20), RuleBasedHolidayCalendarProvider.easterSunday(2025));
    }

    @Test
    void indonesianCalendarContainsFixedAndMovableHolidays() {
        Set<HolidayEvent> holidays = provider.holidaysFor("ID", 2024, 2024);

        assertThat(holidays).contains(
                new HolidayEvent(LocalDate.of(2024, 1, 1), "New Year's Day"),
                new HolidayEvent(LocalDate.of(2024, 3, 29), "Good Friday"),
                new HolidayEvent(LocalDate.of(2024, 5, 9), "Ascension Day of Jesus Christ"),
                new HolidayEvent(LocalDate.of(2024, 8, 17), "Independence Day"));
        assertThat(holidays).allSatisfy(h -> assertEquals(2024, h.date().getYear()));
    }

    @Test
    void sameRequestGivesSameOrderedSet() {
        List<HolidayEvent> first = List.copyOf(provider.holidaysFor("id", 2021, 2023));
        List<HolidayEvent> second = List.copyOf(provider.holidaysFor("ID", 2021, 2023));

        assertEquals(first, second);
        for (int i = 1; i < first.size(); i++) {
            assertThat(first.get(i).date()).isAfterOrEqualTo(first.get(i - 1).date());
        }
    }

    @Test
    void unknownRegionIsRejected() {
        assertThat(provider.supports("XX")).isFalse();
        assertThatThrownBy(() -> provider.holidaysFor("XX", 2024, 2024))
                .isInstanceOf(UnsupportedRegionException.class)
                .satisfies(e -> assertEquals("XX", ((UnsupportedRegionException) e).region()));
    }

    @Test
    void reversedYearRangeIsRejected() {
        assertThatThrownBy(() -> provider.holidaysFor("ID", 2025, 2024))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void extraEventsAreMergedAndCanDefineNewRegions() {
        ForecastProperties properties = new ForecastProperties();
        properties.getHolidays().getExtraEvents().add(extra("ID", "2024-04-10", "Eid al-Fitr"));
        properties.getHolidays().getExtraEvents().add(extra("SG", "2024-02-10", "Chinese New Year"));
        RuleBasedHolidayCalendarProvider withExtras = new RuleBasedHolidayCalendarProvider(properties);

        assertThat(withExtras.holidaysFor("ID", 2024, 2024))
                .contains(new HolidayEvent(LocalDate.of(2024, 4, 10), "Eid al-Fitr"));
        assertThat(withExtras.holidaysFor("ID", 2023, 2023))
                .doesNotContain(new HolidayEvent(LocalDate.of(2024, 4, 10), "Eid al-Fitr"));
        assertThat(withExtras.supports("sg")).isTrue();
        assertThat(withExtras.holidaysFor("SG", 2024, 2024))
                .containsExactly(new HolidayEvent(LocalDate.of(2024, 2, 10), "Chinese New Year"));
    }

    @Test
    void malformedExtraEventFailsAtStartup() {
        ForecastProperties properties = new ForecastProperties();
        properties.getHolidays().getExtraEvents().add(extra("ID", "2024-13-40", "Broken"));

        assertThatThrownBy(() -> new RuleBasedHolidayCalendarProvider(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Broken");
    }

    private static ForecastProperties.ExtraEvent extra(String region, String date, String name) {
        ForecastProperties.ExtraEvent event = new ForecastProperties.ExtraEvent();
        event.setRegion(region);
        event.setDate(date);
        event.setName(name);
        return event;
    }
}
