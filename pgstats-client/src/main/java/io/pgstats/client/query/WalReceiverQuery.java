package io.pgstats.client.query;

/**
 * Column sets of {@code pg_stat_wal_receiver}: 9.6 and 10 share one; 11 adds the sender host and port.
 */
public enum WalReceiverQuery implements QueryVariant {
    MID(Queries.select(WalReceiverQuery.VIEW,
            "pid",
            "status",
            "receive_start_lsn",
            "receive_start_tli",
            "received_lsn",
            "received_tli",
            "last_msg_send_time",
            "last_msg_receipt_time",
            "latest_end_lsn",
            "latest_end_time",
            "slot_name",
            "conninfo")),
    NEWEST(Queries.select(WalReceiverQuery.VIEW,
            "pid",
            "status",
            "receive_start_lsn",
            "receive_start_tli",
            "received_lsn",
            "received_tli",
            "last_msg_send_time",
            "last_msg_receipt_time",
            "latest_end_lsn",
            "latest_end_time",
            "slot_name",
            "sender_host",
            "sender_port",
            "conninfo"));

    public static final String VIEW = "pg_stat_wal_receiver";

    private final String sql;

    WalReceiverQuery(String sql) {
        this.sql = sql;
    }

    @Override
    public String view() {
        return VIEW;
    }

    @Override
    public String sql() {
        return sql;
    }
}
