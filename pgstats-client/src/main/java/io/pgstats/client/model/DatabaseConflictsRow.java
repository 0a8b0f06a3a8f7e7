package io.pgstats.client.model;

import io.pgstats.client.jdbc.RowReader;

import java.sql.SQLException;
import java.util.OptionalLong;

/**
 * Queries canceled on a standby because of recovery conflicts, per database.
 */
public record DatabaseConflictsRow(
        long datid,
        String datname,
        OptionalLong conflTablespace,
        OptionalLong conflLock,
        OptionalLong conflSnapshot,
        OptionalLong conflBufferpin,
        OptionalLong conflDeadlock
) {
    public static DatabaseConflictsRow from(RowReader row) throws SQLException {
        return new DatabaseConflictsRow(
                row.getLong("datid"),
                row.getString("datname"),
                row.getOptionalLong("confl_tablespace"),
                row.getOptionalLong("confl_lock"),
                row.getOptionalLong("confl_snapshot"),
                row.getOptionalLong("confl_bufferpin"),
                row.getOptionalLong("confl_deadlock")
        );
    }
}
