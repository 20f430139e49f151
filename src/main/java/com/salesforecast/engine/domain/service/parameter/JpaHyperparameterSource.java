package com.salesforecast.engine.domain.service.parameter;

import com.salesforecast.engine.domain.model.ForecastParameterRecord;
import com.salesforecast.engine.domain.model.HyperparameterSet;
import com.salesforecast.engine.domain.repository.ForecastParameterRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaHyperparameterSource implements HyperparameterSource {

    private final ForecastParameterRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<HyperparameterSet> lookup(String category) {
        if (category == null) return Optional.empty();
        return repository.findByCategory(category).map(ForecastParameterRecord::toHyperparameterSet);
    }
}
