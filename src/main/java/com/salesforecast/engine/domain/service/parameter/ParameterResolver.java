package com.salesforecast.engine.domain.service.parameter;

import com.salesforecast.engine.domain.exception.MissingDefaultParametersException;
import com.salesforecast.engine.domain.model.HyperparameterSet;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

@Slf4j
public class ParameterResolver {

    private final HyperparameterSource source;
    private final HyperparameterSet configuredDefault;

    public ParameterResolver(HyperparameterSource source, HyperparameterSet configuredDefault) {
        this.source = Objects.requireNonNull(source, "source");
        this.configuredDefault = configuredDefault;
    }

    public HyperparameterSet resolve(String category) {
        if (category != null && !category.isBlank()) {
            Optional<HyperparameterSet> exact = source.lookup(category);
            if (exact.isPresent()) {
                log.debug("[Params] category={} resolved to tuned set {}", category, exact.get());
                return exact.get().validate();
            }
        }

        Optional<HyperparameterSet> storedDefault = source.lookup(HyperparameterSet.DEFAULT_CATEGORY);
        if (storedDefault.isPresent()) {
            log.debug("[Params] category={} falls back to stored default", category);
            return storedDefault.get().validate();
        }
        if (configuredDefault != null) {
            log.debug("[Params] category={} falls back to configured default", category);
            return configuredDefault;
        }
        throw new MissingDefaultParametersException(category);
    }
}
