package io.pgstats.client.model;

import io.pgstats.client.jdbc.RowReader;

import java.sql.SQLException;
import java.util.OptionalLong;

/**
 * Block I/O of a table, its indexes and its TOAST table. The {@code tidx} columns cover the
 * TOAST table's indexes.
 */
public record IoTablesRow(
        long relid,
        String schemaname,
        String relname,
        OptionalLong heapBlksRead,
        OptionalLong heapBlksHit,
        OptionalLong idxBlksRead,
        OptionalLong idxBlksHit,
        OptionalLong toastBlksRead,
        OptionalLong toastBlksHit,
        OptionalLong tidxBlksRead,
        OptionalLong tidxBlksHit
) {
    public static IoTablesRow from(RowReader row) throws SQLException {
        return new IoTablesRow(
                row.getLong("relid"),
                row.getString("schemaname"),
                row.getString("relname"),
                row.getOptionalLong("heap_blks_read"),
                row.getOptionalLong("heap_blks_hit"),
                row.getOptionalLong("idx_blks_read"),
                row.getOptionalLong("idx_blks_hit"),
                row.getOptionalLong("toast_blks_read"),
                row.getOptionalLong("toast_blks_hit"),
                row.getOptionalLong("tidx_blks_read"),
                row.getOptionalLong("tidx_blks_hit")
        );
    }
}
