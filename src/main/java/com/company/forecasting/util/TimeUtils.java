package com.company.forecasting.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class TimeUtils {

    private static final Pattern FREQUENCY_PATTERN =
            Pattern.compile("^(\\d+)\\s*(s|sec|min|m|h|hour|d|day)s?$");

    /**
     * Parse a sampling frequency such as {@code 30min}, {@code 1h}, {@code 15s} or an ISO-8601
     * duration ({@code PT30M}).
     *
     * @throws IllegalArgumentException for an unknown or non-positive frequency
     */
    public static Duration parseFrequency(String frequency) {
        if (frequency == null || frequency.isBlank()) {
            throw new IllegalArgumentException("Frequency is required");
        }

        String normalized = frequency.trim().toLowerCase(Locale.ROOT);
        Duration duration;

        if (normalized.startsWith("p")) {
            duration = Duration.parse(normalized.toUpperCase(Locale.ROOT));
        } else {
            Matcher matcher = FREQUENCY_PATTERN.matcher(normalized);
            if (!matcher.matches()) {
                throw new IllegalArgumentException("Unsupported frequency: " + frequency);
            }
            long amount = Long.parseLong(matcher.group(1));
            String unit = matcher.group(2);
            if (unit.startsWith("s")) {
                duration = Duration.ofSeconds(amount);
            } else if (unit.startsWith("m")) {
                duration = Duration.ofMinutes(amount);
            } else if (unit.startsWith("h")) {
                duration = Duration.ofHours(amount);
            } else {
                duration = Duration.ofDays(amount);
            }
        }

        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("Frequency must be positive: " + frequency);
        }
        return duration;
    }

    /**
     * Round half-up to 2 decimal places
     */
    public static double round2(double value) {
        if (!Double.isFinite(value)) return value;
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Median spacing between consecutive timestamps, in seconds. Returns 0 for fewer than two.
     */
    public static long medianStepSeconds(List<Instant> timestamps) {
        if (timestamps.size() < 2) return 0;

        long[] steps = new long[timestamps.size() - 1];
        for (int i = 1; i < timestamps.size(); i++) {
            steps[i - 1] = Duration.between(timestamps.get(i - 1), timestamps.get(i)).getSeconds();
        }
        Arrays.sort(steps);
        return steps[steps.length / 2];
    }

    /**
     * Number of whole intervals between two instants (floor), never negative.
     */
    public static long intervalsBetween(Instant from, Instant to, Duration interval) {
        long nanos = Duration.between(from, to).toNanos();
        if (nanos <= 0) return 0;
        return nanos / interval.toNanos();
    }
}
