package io.pgstats.client.query;

/**
 * Column sets of {@code pg_stat_activity}.
 * <ul>
 *     <li>{@link #OLD}: up to 9.5, lock waits reported by the boolean {@code waiting}</li>
 *     <li>{@link #MID}: 9.6, {@code wait_event_type} and {@code wait_event} replace {@code waiting}</li>
 *     <li>{@link #NEW}: 10 and later, adds {@code backend_type}</li>
 * </ul>
 */
public enum ActivityQuery implements QueryVariant {
    OLD(Queries.select(ActivityQuery.VIEW,
            "datid",
            "datname",
            "pid",
            "usesysid",
            "usename",
            "application_name",
            "client_addr",
            "client_hostname",
            "client_port",
            "backend_start",
            "xact_start",
            "query_start",
            "state_change",
            "waiting",
            "state",
            "backend_xid",
            "backend_xmin",
            "query")),
    MID(Queries.select(ActivityQuery.VIEW,
            "datid",
            "datname",
            "pid",
            "usesysid",
            "usename",
            "application_name",
            "client_addr",
            "client_hostname",
            "client_port",
            "backend_start",
            "xact_start",
            "query_start",
            "state_change",
            "wait_event_type",
            "wait_event",
            "state",
            "backend_xid",
            "backend_xmin",
            "query")),
    NEW(Queries.select(ActivityQuery.VIEW,
            "datid",
            "datname",
            "pid",
            "usesysid",
            "usename",
            "application_name",
            "client_addr",
            "client_hostname",
            "client_port",
            "backend_start",
            "xact_start",
            "query_start",
            "state_change",
            "wait_event_type",
            "wait_event",
            "state",
            "backend_xid",
            "backend_xmin",
            "query",
            "backend_type"));

    public static final String VIEW = "pg_stat_activity";

    private final String sql;

    ActivityQuery(String sql) {
        this.sql = sql;
    }

    @Override
    public String view() {
        return VIEW;
    }

    @Override
    public String sql() {
        return sql;
    }
}
