package io.pgstats.client.model;

import io.pgstats.client.jdbc.RowReader;

import java.sql.SQLException;
import java.util.OptionalLong;

public record IoSequencesRow(
        long relid,
        String schemaname,
        String relname,
        OptionalLong blksRead,
        OptionalLong blksHit
) {
    public static IoSequencesRow from(RowReader row) throws SQLException {
        return new IoSequencesRow(
                row.getLong("relid"),
                row.getString("schemaname"),
                row.getString("relname"),
                row.getOptionalLong("blks_read"),
                row.getOptionalLong("blks_hit")
        );
    }
}
