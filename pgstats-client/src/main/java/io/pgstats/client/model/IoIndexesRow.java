package io.pgstats.client.model;

import io.pgstats.client.jdbc.RowReader;

import java.sql.SQLException;
import java.util.OptionalLong;

public record IoIndexesRow(
        long relid,
        long indexrelid,
        String schemaname,
        String relname,
        String indexrelname,
        OptionalLong idxBlksRead,
        OptionalLong idxBlksHit
) {
    public static IoIndexesRow from(RowReader row) throws SQLException {
        return new IoIndexesRow(
                row.getLong("relid"),
                row.getLong("indexrelid"),
                row.getString("schemaname"),
                row.getString("relname"),
                row.getString("indexrelname"),
                row.getOptionalLong("idx_blks_read"),
                row.getOptionalLong("idx_blks_hit")
        );
    }
}
