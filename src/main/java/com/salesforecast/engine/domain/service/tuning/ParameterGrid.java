package com.salesforecast.engine.domain.service.tuning;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.salesforecast.engine.domain.model.HyperparameterSet;
import com.salesforecast.engine.domain.model.SeasonalityMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParameterGrid {

    @JsonProperty("trend_flexibility")
    private List<Double> trendFlexibility;

    @JsonProperty("seasonality_strength")
    private List<Double> seasonalityStrength;

    @JsonProperty("holiday_strength")
    private List<Double> holidayStrength;

    @JsonProperty("seasonality_mode")
    private List<SeasonalityMode> seasonalityMode;

    @JsonIgnore
    public boolean isEmpty() {
        return isBlank(trendFlexibility) && isBlank(seasonalityStrength)
                && isBlank(holidayStrength) && isBlank(seasonalityMode);
    }

    public List<HyperparameterSet> combinations(String category, HyperparameterSet base) {
        List<Double> trends = orElse(trendFlexibility, base.getTrendFlexibility());
        List<Double> seasonals = orElse(seasonalityStrength, base.getSeasonalityStrength());
        List<Double> holidays = orElse(holidayStrength, base.getHolidayStrength());
        List<SeasonalityMode> modes = orElse(seasonalityMode, base.getSeasonalityMode());

        List<HyperparameterSet> out = new ArrayList<>(trends.size() * seasonals.size() * holidays.size() * modes.size());
        for (Double trend : trends) {
            for (Double seasonal : seasonals) {
                for (Double holiday : holidays) {
                    for (SeasonalityMode mode : modes) {
                        out.add(HyperparameterSet.builder()
                                .category(category)
                                .trendFlexibility(trend)
                                .seasonalityStrength(seasonal)
                                .holidayStrength(holiday)
                                .seasonalityMode(mode)
                                .build()
                                .validate());
                    }
                }
            }
        }
        return out;
    }

    private static <T> List<T> orElse(List<T> values, T fallback) {
        return isBlank(values) ? List.of(fallback) : values;
    }

    private static boolean isBlank(List<?> values) {
        return values == null || values.isEmpty();
    }
}
