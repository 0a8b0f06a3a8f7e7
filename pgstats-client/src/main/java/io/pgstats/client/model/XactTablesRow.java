package io.pgstats.client.model;

import io.pgstats.client.jdbc.RowReader;

import java.sql.SQLException;
import java.util.OptionalLong;

/**
 * Table access counted within the current transaction only, from {@code pg_stat_xact_*_tables}.
 */
public record XactTablesRow(
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
        OptionalLong nTupHotUpd
) {
    public static XactTablesRow from(RowReader row) throws SQLException {
        return new XactTablesRow(
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
                row.getOptionalLong("n_tup_hot_upd")
        );
    }
}
