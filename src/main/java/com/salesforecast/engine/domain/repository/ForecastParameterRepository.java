package com.salesforecast.engine.domain.repository;

import com.salesforecast.engine.domain.model.ForecastParameterRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ForecastParameterRepository extends JpaRepository<ForecastParameterRecord, Long> {

    Optional<ForecastParameterRecord> findByCategory(String category);

    List<ForecastParameterRecord> findAllByOrderByCategoryAsc();
}
