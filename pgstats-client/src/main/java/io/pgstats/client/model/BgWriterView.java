package io.pgstats.client.model;

import io.pgstats.client.jdbc.RowReader;

import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * The single row of {@code pg_stat_bgwriter}. Write and sync times are in milliseconds.
 */
public record BgWriterView(
        OptionalLong checkpointsTimed,
        OptionalLong checkpointsReq,
        OptionalDouble checkpointWriteTime,
        OptionalDouble checkpointSyncTime,
        OptionalLong buffersCheckpoint,
        OptionalLong buffersClean,
        OptionalLong maxwrittenClean,
        OptionalLong buffersBackend,
        OptionalLong buffersBackendFsync,
        OptionalLong buffersAlloc,
        Optional<Instant> statsReset
) {
    public static BgWriterView from(RowReader row) throws SQLException {
        return new BgWriterView(
                row.getOptionalLong("checkpoints_timed"),
                row.getOptionalLong("checkpoints_req"),
                row.getOptionalDouble("checkpoint_write_time"),
                row.getOptionalDouble("checkpoint_sync_time"),
                row.getOptionalLong("buffers_checkpoint"),
                row.getOptionalLong("buffers_clean"),
                row.getOptionalLong("maxwritten_clean"),
                row.getOptionalLong("buffers_backend"),
                row.getOptionalLong("buffers_backend_fsync"),
                row.getOptionalLong("buffers_alloc"),
                row.getOptionalInstant("stats_reset")
        );
    }
}
