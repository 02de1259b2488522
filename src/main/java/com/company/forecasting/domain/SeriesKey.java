package com.company.forecasting.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import lombok.experimental.NonFinal;

import java.io.Serializable;

/**
 * Identifies one tracked series: an entity (e.g. a virtual machine) and one of its metrics.
 * Not final so cached key lists keep their type information.
 */
@Value
@NonFinal
public class SeriesKey implements Serializable {
    private static final long serialVersionUID = 1L;

    String entity;
    String metric;

    @JsonCreator
    public SeriesKey(@JsonProperty("entity") String entity,
                     @JsonProperty("metric") String metric) {
        if (entity == null || entity.isBlank()) {
            throw new IllegalArgumentException("Entity is required");
        }
        if (metric == null || metric.isBlank()) {
            throw new IllegalArgumentException("Metric is required");
        }
        this.entity = entity.strip();
        this.metric = metric.strip();
    }

    public static SeriesKey of(String entity, String metric) {
        return new SeriesKey(entity, metric);
    }

    /**
     * Storage-safe identifier, e.g. {@code vm-01:cpu.usage.average}
     */
    public String asStorageId() {
        return entity + ":" + metric;
    }

    @Override
    public String toString() {
        return entity + "/" + metric;
    }
}
