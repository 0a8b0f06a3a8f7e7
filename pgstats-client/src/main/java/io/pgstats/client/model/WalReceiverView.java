package io.pgstats.client.model;

import io.pgstats.client.jdbc.RowReader;

import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * The WAL receiver of a standby server. {@code senderHost} and {@code senderPort} are read from
 * servers newer than 10.
 * <p>
 * The {@code *Lsn} components are unsigned 64-bit WAL positions held in a signed {@code long};
 * compare them with {@link Long#compareUnsigned(long, long)}.
 */
public record WalReceiverView(
        long pid,
        String status,
        OptionalLong receiveStartLsn,
        OptionalLong receiveStartTli,
        OptionalLong receivedLsn,
        OptionalLong receivedTli,
        Optional<Instant> lastMsgSendTime,
        Optional<Instant> lastMsgReceiptTime,
        OptionalLong latestEndLsn,
        Optional<Instant> latestEndTime,
        Optional<String> slotName,
        Optional<String> senderHost,
        OptionalLong senderPort,
        Optional<String> conninfo
) {
    public static WalReceiverView from(RowReader row) throws SQLException {
        return new WalReceiverView(
                row.getLong("pid"),
                row.getString("status"),
                row.getOptionalLsn("receive_start_lsn"),
                row.getOptionalLong("receive_start_tli"),
                row.getOptionalLsn("received_lsn"),
                row.getOptionalLong("received_tli"),
                row.getOptionalInstant("last_msg_send_time"),
                row.getOptionalInstant("last_msg_receipt_time"),
                row.getOptionalLsn("latest_end_lsn"),
                row.getOptionalInstant("latest_end_time"),
                row.getOptionalString("slot_name"),
                row.getOptionalString("sender_host"),
                row.getOptionalLong("sender_port"),
                row.getOptionalString("conninfo")
        );
    }
}
