package com.salesforecast.engine.domain.service.tuning;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.salesforecast.engine.domain.model.HyperparameterSet;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class TuningOutcome {

    @JsonProperty("best_parameters")
    private final HyperparameterSet bestParameters;

    private final double mape;
    private final double rmse;

    @JsonProperty("all_results")
    private final List<CandidateScore> allResults;

    @JsonProperty("total_combinations_tested")
    private final int totalCombinationsTested;

    @JsonProperty("successful_combinations")
    private final int successfulCombinations;

    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CandidateScore {
        private final HyperparameterSet parameters;
        private final Double mape;
        private final Double rmse;
        private final boolean success;
        private final String error;
    }
}
