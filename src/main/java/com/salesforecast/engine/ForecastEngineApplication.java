package com.salesforecast.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ForecastEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForecastEngineApplication.class, args);
    }
}
