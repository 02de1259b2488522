package com.company.forecasting.repository;

import com.company.forecasting.config.RedisCacheConfig;
import com.company.forecasting.domain.DataPoint;
import com.company.forecasting.domain.MetricSeries;
import com.company.forecasting.domain.SeriesKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Reads samples from {@code server_metrics_fact}.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcSeriesSource implements SeriesSource {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public MetricSeries getHistoricalSeries(SeriesKey key, Instant start, Instant end) {
        String sql = """
            SELECT timestamp, value
            FROM server_metrics_fact
            WHERE vm = ?
            AND metric = ?
            AND timestamp >= ?
            AND timestamp <= ?
            AND value IS NOT NULL
            ORDER BY timestamp
            """;

        List<DataPoint> points = jdbcTemplate.query(sql, new DataPointRowMapper(),
                key.getEntity(), key.getMetric(), Timestamp.from(start), Timestamp.from(end));

        log.debug("Loaded {} points for {} between {} and {}", points.size(), key, start, end);
        return MetricSeries.of(key, points);
    }

    @Override
    public List<Instant> findTimestamps(SeriesKey key, Instant start, Instant end) {
        String sql = """
            SELECT timestamp
            FROM server_metrics_fact
            WHERE vm = ?
            AND metric = ?
            AND timestamp >= ?
            AND timestamp <= ?
            ORDER BY timestamp
            """;

        return jdbcTemplate.query(sql,
                (rs, rowNum) -> getInstant(rs, "timestamp"),
                key.getEntity(), key.getMetric(), Timestamp.from(start), Timestamp.from(end));
    }

    @Override
    @Cacheable(value = RedisCacheConfig.TRACKED_SERIES_CACHE, unless = "#result.isEmpty()")
    public List<SeriesKey> findTrackedKeys() {
        String sql = """
            SELECT DISTINCT vm, metric
            FROM server_metrics_fact
            ORDER BY vm, metric
            """;

        List<SeriesKey> keys = jdbcTemplate.query(sql,
                (rs, rowNum) -> SeriesKey.of(rs.getString("vm"), rs.getString("metric")));

        log.debug("Found {} tracked series", keys.size());
        return keys;
    }

    private static class DataPointRowMapper implements RowMapper<DataPoint> {
        @Override
        public DataPoint mapRow(ResultSet rs, int rowNum) throws SQLException {
            return DataPoint.of(getInstant(rs, "timestamp"), rs.getDouble("value"));
        }
    }

    private static Instant getInstant(ResultSet rs, String columnName) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(columnName);
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
