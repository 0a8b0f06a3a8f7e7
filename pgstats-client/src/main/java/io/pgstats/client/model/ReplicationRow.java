package io.pgstats.client.model;

import io.pgstats.client.jdbc.RowReader;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * One WAL sender process from {@code pg_stat_replication}.
 * <p>
 * WAL positions are decoded to their 64-bit value. The lag columns are only read from
 * servers 10 and later and stay empty otherwise.
 * <p>
 * A WAL position is an unsigned 64-bit number carried in a signed {@code long}: positions from
 * {@code 80000000/0} upwards are negative. Order them with {@link Long#compareUnsigned(long, long)}
 * and subtract them only for byte distances.
 */
public record ReplicationRow(
        long pid,
        OptionalLong usesysid,
        Optional<String> usename,
        Optional<String> applicationName,
        Optional<String> clientAddr,
        Optional<String> clientHostname,
        OptionalLong clientPort,
        Optional<Instant> backendStart,
        OptionalLong backendXmin,
        Optional<String> state,
        OptionalLong sentLsn,
        OptionalLong writeLsn,
        OptionalLong flushLsn,
        OptionalLong replayLsn,
        Optional<Duration> writeLag,
        Optional<Duration> flushLag,
        Optional<Duration> replayLag,
        OptionalLong syncPriority,
        Optional<String> syncState
) {
    public static ReplicationRow from(RowReader row) throws SQLException {
        return new ReplicationRow(
                row.getLong("pid"),
                row.getOptionalLong("usesysid"),
                row.getOptionalString("usename"),
                row.getOptionalString("application_name"),
                row.getOptionalString("client_addr"),
                row.getOptionalString("client_hostname"),
                row.getOptionalLong("client_port"),
                row.getOptionalInstant("backend_start"),
                row.getOptionalLong("backend_xmin"),
                row.getOptionalString("state"),
                row.getOptionalLsn("sent_lsn"),
                row.getOptionalLsn("write_lsn"),
                row.getOptionalLsn("flush_lsn"),
                row.getOptionalLsn("replay_lsn"),
                row.getOptionalInterval("write_lag"),
                row.getOptionalInterval("flush_lag"),
                row.getOptionalInterval("replay_lag"),
                row.getOptionalLong("sync_priority"),
                row.getOptionalString("sync_state")
        );
    }
}
