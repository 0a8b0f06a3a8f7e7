package io.pgstats.example;

import io.pgstats.client.PgStatsException;
import io.pgstats.client.StatsClient;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command-line names of the view families a {@link StatsClient} can read.
 */
public final class ViewCatalog {

    @FunctionalInterface
    public interface ViewReader {
        Object read(StatsClient client) throws PgStatsException;
    }

    private static final Map<String, ViewReader> READERS;

    static {
        Map<String, ViewReader> readers = new LinkedHashMap<>();
        readers.put("server_version", StatsClient::serverVersion);
        readers.put("activity", StatsClient::activity);
        readers.put("archiver", StatsClient::archiver);
        readers.put("bgwriter", StatsClient::bgWriter);
        readers.put("database", StatsClient::database);
        readers.put("database_conflicts", StatsClient::databaseConflicts);
        readers.put("user_functions", StatsClient::userFunctions);
        readers.put("xact_user_functions", StatsClient::xactUserFunctions);
        readers.put("all_indexes", StatsClient::allIndexes);
        readers.put("sys_indexes", StatsClient::systemIndexes);
        readers.put("user_indexes", StatsClient::userIndexes);
        readers.put("statio_all_indexes", StatsClient::ioAllIndexes);
        readers.put("statio_sys_indexes", StatsClient::ioSystemIndexes);
        readers.put("statio_user_indexes", StatsClient::ioUserIndexes);
        readers.put("statio_all_tables", StatsClient::ioAllTables);
        readers.put("statio_sys_tables", StatsClient::ioSystemTables);
        readers.put("statio_user_tables", StatsClient::ioUserTables);
        readers.put("statio_all_sequences", StatsClient::ioAllSequences);
        readers.put("statio_sys_sequences", StatsClient::ioSystemSequences);
        readers.put("statio_user_sequences", StatsClient::ioUserSequences);
        readers.put("progress_vacuum", StatsClient::progressVacuum);
        readers.put("replication", StatsClient::replication);
        readers.put("ssl", StatsClient::ssl);
        readers.put("statements", StatsClient::statements);
        readers.put("subscription", StatsClient::subscription);
        readers.put("all_tables", StatsClient::allTables);
        readers.put("sys_tables", StatsClient::systemTables);
        readers.put("user_tables", StatsClient::userTables);
        readers.put("wal_receiver", StatsClient::walReceiver);
        readers.put("xact_all_tables", StatsClient::xactAllTables);
        readers.put("xact_sys_tables", StatsClient::xactSystemTables);
        readers.put("xact_user_tables", StatsClient::xactUserTables);
        READERS = Collections.unmodifiableMap(readers);
    }

    private ViewCatalog() {}

    public static Set<String> names() {
        return READERS.keySet();
    }

    public static Optional<ViewReader> lookup(String name) {
        return Optional.ofNullable(READERS.get(name));
    }
}
