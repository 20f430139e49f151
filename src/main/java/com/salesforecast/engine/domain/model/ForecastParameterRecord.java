package com.salesforecast.engine.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "forecast_parameter", uniqueConstraints = {
        @UniqueConstraint(name = "uk_forecast_parameter_category", columnNames = "category")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastParameterRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String category;

    private double trendFlexibility;
    private double seasonalityStrength;
    private double holidayStrength;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SeasonalityMode seasonalityMode;

    private Double mape;
    private Double rmse;

    private Instant createdAt;
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    public HyperparameterSet toHyperparameterSet() {
        return HyperparameterSet.builder()
                .category(category)
                .trendFlexibility(trendFlexibility)
                .seasonalityStrength(seasonalityStrength)
                .holidayStrength(holidayStrength)
                .seasonalityMode(seasonalityMode)
                .build();
    }

    public void apply(HyperparameterSet params) {
        this.trendFlexibility = params.getTrendFlexibility();
        this.seasonalityStrength = params.getSeasonalityStrength();
        this.holidayStrength = params.getHolidayStrength();
        this.seasonalityMode = params.getSeasonalityMode();
    }
}
