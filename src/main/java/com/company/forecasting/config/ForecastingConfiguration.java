package com.company.forecasting.config;

import com.company.forecasting.domain.HyperparameterGrid;
import com.company.forecasting.engine.ForecastingEngine;
import com.company.forecasting.engine.SeasonalRegressionEngine;
import com.company.forecasting.service.FeatureAugmenter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;

/**
 * Forecasting engine, search grid and the worker pools training runs execute on.
 */
@Configuration
@Slf4j
public class ForecastingConfiguration {

    @Bean
    public ForecastingEngine forecastingEngine(FeatureAugmenter featureAugmenter, ForecastingProperties properties) {
        return new SeasonalRegressionEngine(featureAugmenter, properties.getTraining().getMinPoints());
    }

    @Bean
    public HyperparameterGrid hyperparameterGrid(ForecastingProperties properties) {
        ForecastingProperties.Tuning tuning = properties.getTuning();
        ForecastingProperties.Grid options = tuning.getGrid();

        HyperparameterGrid full = HyperparameterGrid.cartesian(
                options.getSeasonalityModes(),
                options.getChangepointPriorScales(),
                options.getSeasonalityPriorScales(),
                options.getHolidayPriorScales(),
                options.getChangepointRanges(),
                options.getChangepointCounts(),
                options.getDailySeasonality(),
                options.getWeeklySeasonality(),
                tuning.getDefaults().toHyperparameterSet());

        HyperparameterGrid limited = full.limitTo(tuning.getMaxCombinations());
        log.info("Hyperparameter grid: {} combinations, searching {}", full.size(), limited.size());
        return limited;
    }

    /**
     * Runs whole training jobs (fetch, tune, train, persist).
     */
    @Bean(name = "trainingExecutor")
    public ThreadPoolTaskExecutor trainingExecutor(ForecastingProperties properties) {
        return executor("forecast-train-", properties.getTraining().getPoolSize());
    }

    /**
     * Evaluates tuning candidates. Separate from the training pool, whose threads block on these tasks.
     */
    @Bean(name = "tuningExecutor")
    public ThreadPoolTaskExecutor tuningExecutor(ForecastingProperties properties) {
        return executor("forecast-tune-", properties.getTuning().getPoolSize());
    }

    private static ThreadPoolTaskExecutor executor(String prefix, int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix(prefix);
        executor.setTaskDecorator(mdcPropagation());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    // Carries the caller's MDC (series key) onto pool threads
    private static TaskDecorator mdcPropagation() {
        return runnable -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    runnable.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        };
    }
}
