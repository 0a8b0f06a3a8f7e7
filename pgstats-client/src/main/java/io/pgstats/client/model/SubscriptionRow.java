package io.pgstats.client.model;

import io.pgstats.client.jdbc.RowReader;

import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * One logical replication subscription worker. {@code relid} is empty for the main apply worker.
 * {@code receivedLsn} and {@code latestEndLsn} are unsigned WAL positions held in a signed
 * {@code long}, compared with {@link Long#compareUnsigned(long, long)}.
 */
public record SubscriptionRow(
        OptionalLong subid,
        Optional<String> subname,
        OptionalLong pid,
        OptionalLong relid,
        OptionalLong receivedLsn,
        Optional<Instant> lastMsgSendTime,
        Optional<Instant> lastMsgReceiptTime,
        OptionalLong latestEndLsn,
        Optional<Instant> latestEndTime
) {
    public static SubscriptionRow from(RowReader row) throws SQLException {
        return new SubscriptionRow(
                row.getOptionalLong("subid"),
                row.getOptionalString("subname"),
                row.getOptionalLong("pid"),
                row.getOptionalLong("relid"),
                row.getOptionalLsn("received_lsn"),
                row.getOptionalInstant("last_msg_send_time"),
                row.getOptionalInstant("last_msg_receipt_time"),
                row.getOptionalLsn("latest_end_lsn"),
                row.getOptionalInstant("latest_end_time")
        );
    }
}
