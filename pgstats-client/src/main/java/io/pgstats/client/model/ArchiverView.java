package io.pgstats.client.model;

import io.pgstats.client.jdbc.RowReader;

import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * The single row of {@code pg_stat_archiver}: WAL archiver activity.
 */
public record ArchiverView(
        OptionalLong archivedCount,
        Optional<String> lastArchivedWal,
        Optional<Instant> lastArchivedTime,
        OptionalLong failedCount,
        Optional<String> lastFailedWal,
        Optional<Instant> lastFailedTime,
        Optional<Instant> statsReset
) {
    public static ArchiverView from(RowReader row) throws SQLException {
        return new ArchiverView(
                row.getOptionalLong("archived_count"),
                row.getOptionalString("last_archived_wal"),
                row.getOptionalInstant("last_archived_time"),
                row.getOptionalLong("failed_count"),
                row.getOptionalString("last_failed_wal"),
                row.getOptionalInstant("last_failed_time"),
                row.getOptionalInstant("stats_reset")
        );
    }
}
