package io.pgstats.client;

/**
 * The connected server is too old (or otherwise unsupported) for the requested view.
 * Raised before the view is queried.
 */
public class UnsupportedVersionException extends PgStatsException {

    private final String view;
    private final ServerVersion version;

    public UnsupportedVersionException(String view, ServerVersion version) {
        super("Unsupported PostgreSQL version " + version + " for " + view);
        this.view = view;
        this.version = version;
    }

    public String getView() {
        return view;
    }

    public ServerVersion getVersion() {
        return version;
    }
}
