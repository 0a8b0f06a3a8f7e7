package io.pgstats.client;

import java.sql.SQLException;

/**
 * A statistics query or the scan of one of its rows failed. The driver error is kept as the cause.
 */
public class QueryException extends PgStatsException {

    private final String view;

    public QueryException(String view, SQLException cause) {
        super("Failed to read " + view + ": " + cause.getMessage(), cause);
        this.view = view;
    }

    public QueryException(String view, String message) {
        super("Failed to read " + view + ": " + message);
        this.view = view;
    }

    public String getView() {
        return view;
    }
}
