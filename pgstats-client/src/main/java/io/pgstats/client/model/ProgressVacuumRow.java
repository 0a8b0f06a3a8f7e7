package io.pgstats.client.model;

import io.pgstats.client.jdbc.RowReader;

import java.sql.SQLException;
import java.util.OptionalLong;

/**
 * Progress of one running VACUUM, including autovacuum workers.
 */
public record ProgressVacuumRow(
        long pid,
        long datid,
        String datname,
        long relid,
        String phase,
        OptionalLong heapBlksTotal,
        OptionalLong heapBlksScanned,
        OptionalLong heapBlksVacuumed,
        OptionalLong indexVacuumCount,
        OptionalLong maxDeadTuples,
        OptionalLong numDeadTuples
) {
    public static ProgressVacuumRow from(RowReader row) throws SQLException {
        return new ProgressVacuumRow(
                row.getLong("pid"),
                row.getLong("datid"),
                row.getString("datname"),
                row.getLong("relid"),
                row.getString("phase"),
                row.getOptionalLong("heap_blks_total"),
                row.getOptionalLong("heap_blks_scanned"),
                row.getOptionalLong("heap_blks_vacuumed"),
                row.getOptionalLong("index_vacuum_count"),
                row.getOptionalLong("max_dead_tuples"),
                row.getOptionalLong("num_dead_tuples")
        );
    }
}
