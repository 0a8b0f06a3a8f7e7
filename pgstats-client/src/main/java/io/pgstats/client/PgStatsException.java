package io.pgstats.client;

/**
 * Base type of every failure reported by {@link StatsClient}.
 */
public class PgStatsException extends Exception {

    public PgStatsException(String message) {
        super(message);
    }

    public PgStatsException(String message, Throwable cause) {
        super(message, cause);
    }
}
