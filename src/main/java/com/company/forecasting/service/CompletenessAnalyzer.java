package com.company.forecasting.service;

import com.company.forecasting.domain.CompletenessReport;
import com.company.forecasting.domain.MissingInterval;
import com.company.forecasting.exception.ValidationException;
import com.company.forecasting.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Measures how many expected sample slots in a range actually have data and where the gaps are.
 *
 * <p>A gap is any step between consecutive samples longer than {@code interval * tolerance}.
 * The range edges are measured the same way: from the range start to the first sample, and from
 * the last sample to the range end.
 */
@Component
public class CompletenessAnalyzer {

    public static final double DEFAULT_TOLERANCE = 1.5;

    public CompletenessReport analyze(Collection<Instant> timestamps, Instant rangeStart, Instant rangeEnd,
                                      Duration expectedInterval) {
        return analyze(timestamps, rangeStart, rangeEnd, expectedInterval, DEFAULT_TOLERANCE);
    }

    public CompletenessReport analyze(Collection<Instant> timestamps, Instant rangeStart, Instant rangeEnd,
                                      Duration expectedInterval, double tolerance) {
        validate(rangeStart, rangeEnd, expectedInterval, tolerance);

        NavigableSet<Instant> samples = new TreeSet<>();
        if (timestamps != null) {
            for (Instant timestamp : timestamps) {
                if (timestamp != null && !timestamp.isBefore(rangeStart) && !timestamp.isAfter(rangeEnd)) {
                    samples.add(timestamp);
                }
            }
        }

        long expected = TimeUtils.intervalsBetween(rangeStart, rangeEnd, expectedInterval) + 1;
        long actual = samples.size();

        List<MissingInterval> missing = new ArrayList<>();
        if (samples.isEmpty()) {
            missing.add(interval(rangeStart, rangeEnd, rangeStart, rangeEnd, expectedInterval));
        } else {
            long gapThresholdNanos = (long) (expectedInterval.toNanos() * tolerance);

            Instant first = samples.first();
            if (exceeds(rangeStart, first, gapThresholdNanos)) {
                missing.add(interval(rangeStart, first.minus(expectedInterval), rangeStart, rangeEnd,
                        expectedInterval));
            }

            Instant previous = null;
            for (Instant current : samples) {
                if (previous != null && exceeds(previous, current, gapThresholdNanos)) {
                    missing.add(interval(previous.plus(expectedInterval), current.minus(expectedInterval),
                            rangeStart, rangeEnd, expectedInterval));
                }
                previous = current;
            }

            if (exceeds(previous, rangeEnd, gapThresholdNanos)) {
                missing.add(interval(previous.plus(expectedInterval), rangeEnd, rangeStart, rangeEnd,
                        expectedInterval));
            }
        }

        double percentage = Math.min(100.0, Math.max(0.0, (double) actual / expected * 100.0));

        return CompletenessReport.builder()
                .rangeStart(rangeStart)
                .rangeEnd(rangeEnd)
                .expectedInterval(expectedInterval)
                .expectedPoints(expected)
                .actualPoints(actual)
                .missingPoints(Math.max(0, expected - actual))
                .completenessPercentage(TimeUtils.round2(percentage))
                .missingIntervals(List.copyOf(missing))
                .build();
    }

    private static boolean exceeds(Instant from, Instant to, long gapThresholdNanos) {
        return Duration.between(from, to).toNanos() > gapThresholdNanos;
    }

    private static MissingInterval interval(Instant start, Instant end, Instant rangeStart, Instant rangeEnd,
                                            Duration interval) {
        Instant clampedStart = start.isBefore(rangeStart) ? rangeStart : start;
        if (clampedStart.isAfter(rangeEnd)) {
            clampedStart = rangeEnd;
        }
        Instant clampedEnd = end.isAfter(rangeEnd) ? rangeEnd : end;
        if (clampedEnd.isBefore(clampedStart)) {
            clampedEnd = clampedStart;
        }
        long slots = TimeUtils.intervalsBetween(clampedStart, clampedEnd, interval) + 1;
        return new MissingInterval(clampedStart, clampedEnd, slots);
    }

    private static void validate(Instant rangeStart, Instant rangeEnd, Duration interval, double tolerance) {
        if (rangeStart == null || rangeEnd == null) {
            throw new ValidationException("completeness", "Range start and end are required");
        }
        if (!rangeEnd.isAfter(rangeStart)) {
            throw new ValidationException("completeness",
                    "Range end " + rangeEnd + " must be after start " + rangeStart);
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new ValidationException("completeness", "Expected interval must be positive: " + interval);
        }
        if (!(tolerance >= 1.0) || !Double.isFinite(tolerance)) {
            throw new ValidationException("completeness", "Tolerance must be at least 1: " + tolerance);
        }
    }
}
