package io.pgstats.client;

public class ClientClosedException extends PgStatsException {

    public ClientClosedException() {
        super("StatsClient is closed");
    }
}
