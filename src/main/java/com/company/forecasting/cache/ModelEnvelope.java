package com.company.forecasting.cache;

import com.company.forecasting.domain.HyperparameterSet;
import com.company.forecasting.domain.QualityMetrics;
import com.company.forecasting.domain.SeriesKey;
import com.company.forecasting.domain.TrainingWindow;
import com.company.forecasting.domain.enums.EvaluationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Stored form of a trained model: metadata as JSON fields plus the engine's own bytes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelEnvelope {

    static final int CURRENT_FORMAT = 1;

    private int formatVersion;
    private SeriesKey key;
    private String engineName;
    private HyperparameterSet hyperparameters;
    private Instant trainedAt;
    private TrainingWindow trainingWindow;
    private int pointCount;
    private QualityMetrics qualityMetrics;
    private boolean tuned;
    private EvaluationType tuningEvaluation;

    // Base64 in JSON
    private byte[] model;
}
