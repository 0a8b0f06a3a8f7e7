package io.pgstats.client.query;

/**
 * Column sets of the {@code pg_stat_statements} extension view. The timing columns
 * ({@code total_time} through {@code stddev_time}) are only read from servers newer than 9.4.
 */
public enum StatementsQuery implements QueryVariant {
    OLD(Queries.select(StatementsQuery.VIEW,
            "userid",
            "dbid",
            "queryid",
            "query",
            "calls",
            "rows",
            "shared_blks_hit",
            "shared_blks_read",
            "shared_blks_dirtied",
            "shared_blks_written",
            "local_blks_hit",
            "local_blks_read",
            "local_blks_dirtied",
            "local_blks_written",
            "temp_blks_read",
            "temp_blks_written",
            "blk_read_time",
            "blk_write_time")),
    NEW(Queries.select(StatementsQuery.VIEW,
            "userid",
            "dbid",
            "queryid",
            "query",
            "calls",
            "total_time",
            "min_time",
            "max_time",
            "mean_time",
            "stddev_time",
            "rows",
            "shared_blks_hit",
            "shared_blks_read",
            "shared_blks_dirtied",
            "shared_blks_written",
            "local_blks_hit",
            "local_blks_read",
            "local_blks_dirtied",
            "local_blks_written",
            "temp_blks_read",
            "temp_blks_written",
            "blk_read_time",
            "blk_write_time"));

    public static final String VIEW = "pg_stat_statements";

    private final String sql;

    StatementsQuery(String sql) {
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
