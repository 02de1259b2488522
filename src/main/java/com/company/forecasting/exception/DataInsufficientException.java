package com.company.forecasting.exception;

import com.company.forecasting.domain.SeriesKey;
import lombok.Getter;

@Getter
public class DataInsufficientException extends ForecastingException {

    private final int requiredPoints;
    private final int availablePoints;

    public DataInsufficientException(SeriesKey key, int requiredPoints, int availablePoints) {
        super(key, "train", String.format("Insufficient data: %d points required, %d available",
                requiredPoints, availablePoints));
        this.requiredPoints = requiredPoints;
        this.availablePoints = availablePoints;
    }
}
