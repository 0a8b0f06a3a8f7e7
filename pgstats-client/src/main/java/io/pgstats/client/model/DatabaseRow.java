package io.pgstats.client.model;

import io.pgstats.client.jdbc.RowReader;

import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Database-wide statistics, one row per database in {@code pg_stat_database}.
 * <p>
 * From PostgreSQL 12 the view also has a row for shared objects, with {@code datid} 0 and no
 * {@code datname}.
 */
public record DatabaseRow(
        long datid,
        Optional<String> datname,
        long numbackends,
        OptionalLong xactCommit,
        OptionalLong xactRollback,
        OptionalLong blksRead,
        OptionalLong blksHit,
        OptionalLong tupReturned,
        OptionalLong tupFetched,
        OptionalLong tupInserted,
        OptionalLong tupUpdated,
        OptionalLong tupDeleted,
        OptionalLong conflicts,
        OptionalLong tempFiles,
        OptionalLong tempBytes,
        OptionalLong deadlocks,
        OptionalDouble blkReadTime,
        OptionalDouble blkWriteTime,
        Optional<Instant> statsReset
) {
    public static DatabaseRow from(RowReader row) throws SQLException {
        return new DatabaseRow(
                row.getLong("datid"),
                row.getOptionalString("datname"),
                row.getLong("numbackends"),
                row.getOptionalLong("xact_commit"),
                row.getOptionalLong("xact_rollback"),
                row.getOptionalLong("blks_read"),
                row.getOptionalLong("blks_hit"),
                row.getOptionalLong("tup_returned"),
                row.getOptionalLong("tup_fetched"),
                row.getOptionalLong("tup_inserted"),
                row.getOptionalLong("tup_updated"),
                row.getOptionalLong("tup_deleted"),
                row.getOptionalLong("conflicts"),
                row.getOptionalLong("temp_files"),
                row.getOptionalLong("temp_bytes"),
                row.getOptionalLong("deadlocks"),
                row.getOptionalDouble("blk_read_time"),
                row.getOptionalDouble("blk_write_time"),
                row.getOptionalInstant("stats_reset")
        );
    }
}
