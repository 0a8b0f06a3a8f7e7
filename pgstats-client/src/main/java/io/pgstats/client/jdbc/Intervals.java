package io.pgstats.client.jdbc;

import org.postgresql.util.PGInterval;

import java.sql.SQLException;
import java.time.Duration;

/**
 * Converts interval text to a {@link Duration}, whatever {@code IntervalStyle} the server renders
 * it in: {@code 1 day 00:00:05}, {@code @ 1 day 5 secs} or {@code P1DT5S}.
 * Replication lag columns never carry months or years, and such intervals are rejected since
 * they have no fixed length.
 */
public final class Intervals {

    private static final long NANOS_PER_MICRO = 1_000L;

    private Intervals() {}

    public static Duration parse(String text) throws SQLException {
        if (text == null || text.isBlank()) {
            throw new SQLException("Empty interval");
        }
        PGInterval interval;
        try {
            interval = new PGInterval(text.trim());
        } catch (NumberFormatException e) {
            throw new SQLException("Unsupported interval: '" + text + "'", e);
        }
        if (interval.getYears() != 0 || interval.getMonths() != 0) {
            throw new SQLException("Interval has no fixed length: '" + text + "'");
        }
        return Duration.ofDays(interval.getDays())
                .plusHours(interval.getHours())
                .plusMinutes(interval.getMinutes())
                .plusSeconds(interval.getWholeSeconds())
                .plusNanos(interval.getMicroSeconds() * NANOS_PER_MICRO);
    }
}
