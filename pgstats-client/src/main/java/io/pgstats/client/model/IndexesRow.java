package io.pgstats.client.model;

import io.pgstats.client.jdbc.RowReader;

import java.sql.SQLException;
import java.util.OptionalLong;

public record IndexesRow(
        long relid,
        long indexrelid,
        String schemaname,
        String relname,
        String indexrelname,
        OptionalLong idxScan,
        OptionalLong idxTupRead,
        OptionalLong idxTupFetch
) {
    public static IndexesRow from(RowReader row) throws SQLException {
        return new IndexesRow(
                row.getLong("relid"),
                row.getLong("indexrelid"),
                row.getString("schemaname"),
                row.getString("relname"),
                row.getString("indexrelname"),
                row.getOptionalLong("idx_scan"),
                row.getOptionalLong("idx_tup_read"),
                row.getOptionalLong("idx_tup_fetch")
        );
    }
}
