package io.pgstats.client.model;

import io.pgstats.client.jdbc.RowReader;

import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * One server process from {@code pg_stat_activity}.
 *
 * @param waitEventType type of event the backend is waiting for; read from 9.6 onwards
 * @param waitEvent     name of that wait event; read from 9.6 onwards
 * @param waiting       whether the backend waits on a lock; only read up to 9.5
 * @param backendType   type of the backend; read from 10 onwards
 */
public record ActivityRow(
        OptionalLong datid,
        Optional<String> datname,
        long pid,
        OptionalLong usesysid,
        Optional<String> usename,
        Optional<String> applicationName,
        Optional<String> clientAddr,
        Optional<String> clientHostname,
        OptionalLong clientPort,
        Optional<Instant> backendStart,
        Optional<Instant> xactStart,
        Optional<Instant> queryStart,
        Optional<Instant> stateChange,
        Optional<String> waitEventType,
        Optional<String> waitEvent,
        Optional<Boolean> waiting,
        Optional<String> state,
        OptionalLong backendXid,
        OptionalLong backendXmin,
        Optional<String> query,
        Optional<String> backendType
) {
    public static ActivityRow from(RowReader row) throws SQLException {
        return new ActivityRow(
                row.getOptionalLong("datid"),
                row.getOptionalString("datname"),
                row.getLong("pid"),
                row.getOptionalLong("usesysid"),
                row.getOptionalString("usename"),
                row.getOptionalString("application_name"),
                row.getOptionalString("client_addr"),
                row.getOptionalString("client_hostname"),
                row.getOptionalLong("client_port"),
                row.getOptionalInstant("backend_start"),
                row.getOptionalInstant("xact_start"),
                row.getOptionalInstant("query_start"),
                row.getOptionalInstant("state_change"),
                row.getOptionalString("wait_event_type"),
                row.getOptionalString("wait_event"),
                row.getOptionalBoolean("waiting"),
                row.getOptionalString("state"),
                row.getOptionalLong("backend_xid"),
                row.getOptionalLong("backend_xmin"),
                row.getOptionalString("query"),
                row.getOptionalString("backend_type")
        );
    }
}
