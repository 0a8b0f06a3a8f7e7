package io.pgstats.client.query;

/**
 * Column sets of {@code pg_stat_replication}. Before 10 the WAL positions are named
 * {@code *_location}; they are aliased to the {@code *_lsn} names so both variants share a mapper.
 * Lag columns exist from 10 onwards.
 */
public enum ReplicationQuery implements QueryVariant {
    OLD(Queries.select(ReplicationQuery.VIEW,
            "pid",
            "usesysid",
            "usename",
            "application_name",
            "client_addr",
            "client_hostname",
            "client_port",
            "backend_start",
            "backend_xmin",
            "state",
            "sent_location AS sent_lsn",
            "write_location AS write_lsn",
            "flush_location AS flush_lsn",
            "replay_location AS replay_lsn",
            "sync_priority",
            "sync_state")),
    NEW(Queries.select(ReplicationQuery.VIEW,
            "pid",
            "usesysid",
            "usename",
            "application_name",
            "client_addr",
            "client_hostname",
            "client_port",
            "backend_start",
            "backend_xmin",
            "state",
            "sent_lsn",
            "write_lsn",
            "flush_lsn",
            "replay_lsn",
            "write_lag",
            "flush_lag",
            "replay_lag",
            "sync_priority",
            "sync_state"));

    public static final String VIEW = "pg_stat_replication";

    private final String sql;

    ReplicationQuery(String sql) {
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
