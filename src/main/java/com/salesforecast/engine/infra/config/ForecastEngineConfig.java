package com.salesforecast.engine.infra.config;

import com.salesforecast.engine.domain.service.ForecastProperties;
import com.salesforecast.engine.domain.service.parameter.HyperparameterSource;
import com.salesforecast.engine.domain.service.parameter.ParameterResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class ForecastEngineConfig {

    @Bean
    public ParameterResolver parameterResolver(HyperparameterSource hyperparameterSource,
                                               ForecastProperties properties) {
        var defaults = properties.defaultParameters();
        if (defaults == null) {
            log.warn("[Config] no default hyperparameters configured; categories without tuned "
                    + "parameters will fail unless the store holds a 'default' entry");
        } else {
            log.info("[Config] default hyperparameters: {}", defaults);
        }
        return new ParameterResolver(hyperparameterSource, defaults);
    }
}
