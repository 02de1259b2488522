package com.company.forecasting.engine;

/**
 * Engine-specific fitted state. Only the engine that produced it can interpret it.
 */
public interface FittedModel {

    String getEngineName();

    int getTrainingPoints();
}
