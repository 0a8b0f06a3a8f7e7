package io.pgstats.client;

/**
 * The connection handed to the client is not usable, or a configured connection could not be opened.
 */
public class ConnectionException extends PgStatsException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
