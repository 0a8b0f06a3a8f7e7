package io.pgstats.client.model;

import io.pgstats.client.jdbc.RowReader;

import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Access statistics of one table from {@code pg_stat_*_tables}.
 */
public record TablesRow(
        long relid,
        String schemaname,
        String relname,
        OptionalLong seqScan,
        OptionalLong seqTupRead,
        OptionalLong idxScan,
        OptionalLong idxTupFetch,
        OptionalLong nTupIns,
        OptionalLong nTupUpd,
        OptionalLong nTupDel,
        OptionalLong nTupHotUpd,
        OptionalLong nLiveTup,
        OptionalLong nDeadTup,
        OptionalLong nModSinceAnalyze,
        Optional<Instant> lastVacuum,
        Optional<Instant> lastAutovacuum,
        Optional<Instant> lastAnalyze,
        Optional<Instant> lastAutoanalyze,
        OptionalLong vacuumCount,
        OptionalLong autovacuumCount,
        OptionalLong analyzeCount,
        OptionalLong autoanalyzeCount
) {
    public static TablesRow from(RowReader row) throws SQLException {
        return new TablesRow(
                row.getLong("relid"),
                row.getString("schemaname"),
                row.getString("relname"),
                row.getOptionalLong("seq_scan"),
                row.getOptionalLong("seq_tup_read"),
                row.getOptionalLong("idx_scan"),
                row.getOptionalLong("idx_tup_fetch"),
                row.getOptionalLong("n_tup_ins"),
                row.getOptionalLong("n_tup_upd"),
                row.getOptionalLong("n_tup_del"),
                row.getOptionalLong("n_tup_hot_upd"),
                row.getOptionalLong("n_live_tup"),
                row.getOptionalLong("n_dead_tup"),
                row.getOptionalLong("n_mod_since_analyze"),
                row.getOptionalInstant("last_vacuum"),
                row.getOptionalInstant("last_autovacuum"),
                row.getOptionalInstant("last_analyze"),
                row.getOptionalInstant("last_autoanalyze"),
                row.getOptionalLong("vacuum_count"),
                row.getOptionalLong("autovacuum_count"),
                row.getOptionalLong("analyze_count"),
                row.getOptionalLong("autoanalyze_count")
        );
    }
}
