package io.pgstats.client.query;

import java.util.List;

/**
 * SQL text of the statistics views whose columns do not change across supported server versions.
 */
public final class Queries {

    public static final String ARCHIVER_VIEW = "pg_stat_archiver";
    public static final String BGWRITER_VIEW = "pg_stat_bgwriter";
    public static final String DATABASE_VIEW = "pg_stat_database";
    public static final String DATABASE_CONFLICTS_VIEW = "pg_stat_database_conflicts";
    public static final String USER_FUNCTIONS_VIEW = "pg_stat_user_functions";
    public static final String XACT_USER_FUNCTIONS_VIEW = "pg_stat_xact_user_functions";
    public static final String PROGRESS_VACUUM_VIEW = "pg_stat_progress_vacuum";
    public static final String SSL_VIEW = "pg_stat_ssl";
    public static final String SUBSCRIPTION_VIEW = "pg_stat_subscription";

    public static final String TABLES_PATTERN = "pg_stat_%s_tables";
    public static final String XACT_TABLES_PATTERN = "pg_stat_xact_%s_tables";
    public static final String INDEXES_PATTERN = "pg_stat_%s_indexes";
    public static final String IO_TABLES_PATTERN = "pg_statio_%s_tables";
    public static final String IO_INDEXES_PATTERN = "pg_statio_%s_indexes";
    public static final String IO_SEQUENCES_PATTERN = "pg_statio_%s_sequences";

    public static final String ARCHIVER = select(ARCHIVER_VIEW,
            "archived_count",
            "last_archived_wal",
            "last_archived_time",
            "failed_count",
            "last_failed_wal",
            "last_failed_time",
            "stats_reset");

    public static final String BGWRITER = select(BGWRITER_VIEW,
            "checkpoints_timed",
            "checkpoints_req",
            "checkpoint_write_time",
            "checkpoint_sync_time",
            "buffers_checkpoint",
            "buffers_clean",
            "maxwritten_clean",
            "buffers_backend",
            "buffers_backend_fsync",
            "buffers_alloc",
            "stats_reset");

    public static final String DATABASE = select(DATABASE_VIEW,
            "datid",
            "datname",
            "numbackends",
            "xact_commit",
            "xact_rollback",
            "blks_read",
            "blks_hit",
            "tup_returned",
            "tup_fetched",
            "tup_inserted",
            "tup_updated",
            "tup_deleted",
            "conflicts",
            "temp_files",
            "temp_bytes",
            "deadlocks",
            "blk_read_time",
            "blk_write_time",
            "stats_reset");

    public static final String DATABASE_CONFLICTS = select(DATABASE_CONFLICTS_VIEW,
            "datid",
            "datname",
            "confl_tablespace",
            "confl_lock",
            "confl_snapshot",
            "confl_bufferpin",
            "confl_deadlock");

    public static final String PROGRESS_VACUUM = select(PROGRESS_VACUUM_VIEW,
            "pid",
            "datid",
            "datname",
            "relid",
            "phase",
            "heap_blks_total",
            "heap_blks_scanned",
            "heap_blks_vacuumed",
            "index_vacuum_count",
            "max_dead_tuples",
            "num_dead_tuples");

    public static final String SSL = select(SSL_VIEW,
            "pid",
            "ssl",
            "version",
            "cipher",
            "bits",
            "compression",
            "clientdn");

    public static final String SUBSCRIPTION = select(SUBSCRIPTION_VIEW,
            "subid",
            "subname",
            "pid",
            "relid",
            "received_lsn",
            "last_msg_send_time",
            "last_msg_receipt_time",
            "latest_end_lsn",
            "latest_end_time");

    private static final List<String> FUNCTION_COLUMNS = List.of(
            "funcid",
            "schemaname",
            "funcname",
            "calls",
            "total_time",
            "self_time");

    private static final List<String> TABLE_COLUMNS = List.of(
            "relid",
            "schemaname",
            "relname",
            "seq_scan",
            "seq_tup_read",
            "idx_scan",
            "idx_tup_fetch",
            "n_tup_ins",
            "n_tup_upd",
            "n_tup_del",
            "n_tup_hot_upd",
            "n_live_tup",
            "n_dead_tup",
            "n_mod_since_analyze",
            "last_vacuum",
            "last_autovacuum",
            "last_analyze",
            "last_autoanalyze",
            "vacuum_count",
            "autovacuum_count",
            "analyze_count",
            "autoanalyze_count");

    private static final List<String> XACT_TABLE_COLUMNS = List.of(
            "relid",
            "schemaname",
            "relname",
            "seq_scan",
            "seq_tup_read",
            "idx_scan",
            "idx_tup_fetch",
            "n_tup_ins",
            "n_tup_upd",
            "n_tup_del",
            "n_tup_hot_upd");

    private static final List<String> INDEX_COLUMNS = List.of(
            "relid",
            "indexrelid",
            "schemaname",
            "relname",
            "indexrelname",
            "idx_scan",
            "idx_tup_read",
            "idx_tup_fetch");

    private static final List<String> IO_TABLE_COLUMNS = List.of(
            "relid",
            "schemaname",
            "relname",
            "heap_blks_read",
            "heap_blks_hit",
            "idx_blks_read",
            "idx_blks_hit",
            "toast_blks_read",
            "toast_blks_hit",
            "tidx_blks_read",
            "tidx_blks_hit");

    private static final List<String> IO_INDEX_COLUMNS = List.of(
            "relid",
            "indexrelid",
            "schemaname",
            "relname",
            "indexrelname",
            "idx_blks_read",
            "idx_blks_hit");

    private static final List<String> IO_SEQUENCE_COLUMNS = List.of(
            "relid",
            "schemaname",
            "relname",
            "blks_read",
            "blks_hit");

    private Queries() {}

    public static String userFunctions() {
        return select(USER_FUNCTIONS_VIEW, FUNCTION_COLUMNS);
    }

    public static String xactUserFunctions() {
        return select(XACT_USER_FUNCTIONS_VIEW, FUNCTION_COLUMNS);
    }

    public static String tables(Scope scope) {
        return select(scope.view(TABLES_PATTERN), TABLE_COLUMNS);
    }

    public static String xactTables(Scope scope) {
        return select(scope.view(XACT_TABLES_PATTERN), XACT_TABLE_COLUMNS);
    }

    public static String indexes(Scope scope) {
        return select(scope.view(INDEXES_PATTERN), INDEX_COLUMNS);
    }

    public static String ioTables(Scope scope) {
        return select(scope.view(IO_TABLES_PATTERN), IO_TABLE_COLUMNS);
    }

    public static String ioIndexes(Scope scope) {
        return select(scope.view(IO_INDEXES_PATTERN), IO_INDEX_COLUMNS);
    }

    public static String ioSequences(Scope scope) {
        return select(scope.view(IO_SEQUENCES_PATTERN), IO_SEQUENCE_COLUMNS);
    }

    static String select(String view, String... columns) {
        return select(view, List.of(columns));
    }

    static String select(String view, List<String> columns) {
        return "SELECT\n    " + String.join(",\n    ", columns) + "\nFROM " + view;
    }
}
