package com.company.forecasting.repository;

import com.company.forecasting.domain.ForecastPoint;
import com.company.forecasting.domain.ForecastResult;
import com.company.forecasting.domain.SeriesKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes forecasts to {@code server_metrics_predictions}. Re-running a forecast overwrites the
 * previous values for the same timestamps.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcPredictionsSink implements PredictionsSink {

    private static final String UPSERT_SQL = """
        INSERT INTO server_metrics_predictions (
            vm, metric, timestamp, value_predicted, lower_bound, upper_bound, created_at
        ) VALUES (?, ?, ?, ?, ?, ?, NOW())
        ON CONFLICT (vm, timestamp, metric) DO UPDATE SET
            value_predicted = EXCLUDED.value_predicted,
            lower_bound = EXCLUDED.lower_bound,
            upper_bound = EXCLUDED.upper_bound,
            created_at = EXCLUDED.created_at
        """;

    private final JdbcTemplate jdbcTemplate;

    @Override
    @Transactional
    public int upsertPredictions(SeriesKey key, ForecastResult result) {
        if (result.getPoints().isEmpty()) {
            return 0;
        }

        List<Object[]> batchArgs = new ArrayList<>(result.size());
        for (ForecastPoint point : result.getPoints()) {
            batchArgs.add(new Object[]{
                    key.getEntity(),
                    key.getMetric(),
                    Timestamp.from(point.getTimestamp()),
                    point.getPredicted(),
                    point.getLower(),
                    point.getUpper()
            });
        }

        int[] updateCounts = jdbcTemplate.batchUpdate(UPSERT_SQL, batchArgs);

        int written = 0;
        for (int count : updateCounts) {
            // Drivers may report SUCCESS_NO_INFO (-2) for batched statements
            written += count > 0 || count == Statement.SUCCESS_NO_INFO ? 1 : 0;
        }

        log.debug("Upserted {} predictions for {}", written, key);
        return written;
    }
}
