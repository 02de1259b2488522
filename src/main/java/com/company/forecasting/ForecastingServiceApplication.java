package com.company.forecasting;

import com.company.forecasting.config.ForecastingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableCaching
@EnableScheduling
@EnableAsync
@EnableConfigurationProperties(ForecastingProperties.class)
public class ForecastingServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForecastingServiceApplication.class, args);
    }
}
