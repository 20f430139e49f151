package com.salesforecast.engine.domain.service.parameter;

import com.salesforecast.engine.domain.model.HyperparameterSet;

import java.util.Map;
import java.util.Optional;

@FunctionalInterface
public interface HyperparameterSource {

    Optional<HyperparameterSet> lookup(String category);

    static HyperparameterSource empty() {
        return category -> Optional.empty();
    }

    static HyperparameterSource of(Map<String, HyperparameterSet> byCategory) {
        Map<String, HyperparameterSet> copy = Map.copyOf(byCategory);
        return category -> Optional.ofNullable(category == null ? null : copy.get(category));
    }
}
