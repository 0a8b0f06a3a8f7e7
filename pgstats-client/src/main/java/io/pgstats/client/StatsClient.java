package io.pgstats.client;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import io.pgstats.client.jdbc.RowMapper;
import io.pgstats.client.jdbc.RowReader;
import io.pgstats.client.model.*;
import io.pgstats.client.query.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Read-only access to the PostgreSQL cumulative statistics and progress views.
 * <p>
 * Every accessor issues one fixed query on the wrapped connection and maps each returned row to an
 * immutable record, in the order the server returned them. Views whose columns differ between server
 * versions first query the server version (one extra round-trip, never cached) and pick the matching
 * column set through {@link VariantSelector}.
 * <p>
 * The client adds no locking: concurrent use is as safe as the wrapped {@link Connection}. Nothing is
 * retried; driver errors surface as {@link QueryException} with the driver exception as cause.
 * <p>
 * {@link #close()} closes the connection and is idempotent. Any accessor called afterwards fails with
 * {@link ClientClosedException} without touching the connection.
 */
public class StatsClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StatsClient.class);

    public static final Duration DEFAULT_VALIDATION_TIMEOUT = Duration.ofSeconds(5);
    public static final String QUERY_TIMER = "pgstats.query";

    private static final String DEFAULT_VARIANT = "DEFAULT";

    private final Connection connection;
    private final MeterRegistry registry;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public StatsClient(Connection connection) throws ConnectionException {
        this(connection, Metrics.globalRegistry, DEFAULT_VALIDATION_TIMEOUT);
    }

    public StatsClient(Connection connection, MeterRegistry registry) throws ConnectionException {
        this(connection, registry, DEFAULT_VALIDATION_TIMEOUT);
    }

    /**
     * @param validationTimeout how long the liveness check may take; rounded up to whole seconds
     * @throws ConnectionException if the connection is closed or does not answer the liveness check
     */
    public StatsClient(Connection connection, MeterRegistry registry, Duration validationTimeout)
            throws ConnectionException {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.registry = Objects.requireNonNull(registry, "registry");
        int timeoutSeconds = (int) Math.max(1, (validationTimeout.toMillis() + 999) / 1000);
        boolean valid;
        try {
            valid = connection.isValid(timeoutSeconds);
        } catch (SQLException e) {
            throw new ConnectionException("Connection liveness check failed", e);
        }
        if (!valid) {
            throw new ConnectionException("Connection is closed or not reachable");
        }
        log.info("StatsClient opened");
    }

    /**
     * Major version of the connected server, as used to pick query variants.
     */
    public ServerVersion serverVersion() throws PgStatsException {
        ensureOpen();
        return VersionProbe.probe(connection);
    }

    /** Rows of {@code pg_stat_activity}; columns depend on the server version. */
    public List<ActivityRow> activity() throws PgStatsException {
        ActivityQuery variant = VariantSelector.activity(serverVersion());
        return fetchRows(variant.view(), variant.name(), variant.sql(), ActivityRow::from);
    }

    public ArchiverView archiver() throws PgStatsException {
        return fetchSingle(Queries.ARCHIVER_VIEW, Queries.ARCHIVER, ArchiverView::from);
    }

    public BgWriterView bgWriter() throws PgStatsException {
        return fetchSingle(Queries.BGWRITER_VIEW, Queries.BGWRITER, BgWriterView::from);
    }

    public List<DatabaseRow> database() throws PgStatsException {
        return fetchRows(Queries.DATABASE_VIEW, DEFAULT_VARIANT, Queries.DATABASE, DatabaseRow::from);
    }

    public List<DatabaseConflictsRow> databaseConflicts() throws PgStatsException {
        return fetchRows(Queries.DATABASE_CONFLICTS_VIEW, DEFAULT_VARIANT, Queries.DATABASE_CONFLICTS,
                DatabaseConflictsRow::from);
    }

    public List<FunctionsRow> userFunctions() throws PgStatsException {
        return fetchRows(Queries.USER_FUNCTIONS_VIEW, DEFAULT_VARIANT, Queries.userFunctions(), FunctionsRow::from);
    }

    /**
     * Like {@link #userFunctions()}, but only counts calls made in the current transaction.
     */
    public List<FunctionsRow> xactUserFunctions() throws PgStatsException {
        return fetchRows(Queries.XACT_USER_FUNCTIONS_VIEW, DEFAULT_VARIANT, Queries.xactUserFunctions(),
                FunctionsRow::from);
    }

    public List<IndexesRow> allIndexes() throws PgStatsException {
        return indexes(Scope.ALL);
    }

    public List<IndexesRow> systemIndexes() throws PgStatsException {
        return indexes(Scope.SYSTEM);
    }

    public List<IndexesRow> userIndexes() throws PgStatsException {
        return indexes(Scope.USER);
    }

    public List<IoIndexesRow> ioAllIndexes() throws PgStatsException {
        return ioIndexes(Scope.ALL);
    }

    public List<IoIndexesRow> ioSystemIndexes() throws PgStatsException {
        return ioIndexes(Scope.SYSTEM);
    }

    public List<IoIndexesRow> ioUserIndexes() throws PgStatsException {
        return ioIndexes(Scope.USER);
    }

    public List<IoTablesRow> ioAllTables() throws PgStatsException {
        return ioTables(Scope.ALL);
    }

    public List<IoTablesRow> ioSystemTables() throws PgStatsException {
        return ioTables(Scope.SYSTEM);
    }

    public List<IoTablesRow> ioUserTables() throws PgStatsException {
        return ioTables(Scope.USER);
    }

    public List<IoSequencesRow> ioAllSequences() throws PgStatsException {
        return ioSequences(Scope.ALL);
    }

    public List<IoSequencesRow> ioSystemSequences() throws PgStatsException {
        return ioSequences(Scope.SYSTEM);
    }

    public List<IoSequencesRow> ioUserSequences() throws PgStatsException {
        return ioSequences(Scope.USER);
    }

    /**
     * One row per backend currently running VACUUM.
     *
     * @throws UnsupportedVersionException for servers older than 9.6
     */
    public List<ProgressVacuumRow> progressVacuum() throws PgStatsException {
        VariantSelector.requireAtLeast(Queries.PROGRESS_VACUUM_VIEW, serverVersion(),
                VariantSelector.PROGRESS_VACUUM_MIN_VERSION);
        return fetchRows(Queries.PROGRESS_VACUUM_VIEW, DEFAULT_VARIANT, Queries.PROGRESS_VACUUM,
                ProgressVacuumRow::from);
    }

    /** One row per WAL sender; before 10 the lag columns are not read. */
    public List<ReplicationRow> replication() throws PgStatsException {
        ReplicationQuery variant = VariantSelector.replication(serverVersion());
        return fetchRows(variant.view(), variant.name(), variant.sql(), ReplicationRow::from);
    }

    /**
     * @throws UnsupportedVersionException for servers older than 9.5
     */
    public List<SslRow> ssl() throws PgStatsException {
        VariantSelector.requireAtLeast(Queries.SSL_VIEW, serverVersion(), VariantSelector.SSL_MIN_VERSION);
        return fetchRows(Queries.SSL_VIEW, DEFAULT_VARIANT, Queries.SSL, SslRow::from);
    }

    /**
     * Requires the {@code pg_stat_statements} extension; without it the query fails with a
     * {@link QueryException}.
     */
    public List<StatementsRow> statements() throws PgStatsException {
        StatementsQuery variant = VariantSelector.statements(serverVersion());
        return fetchRows(variant.view(), variant.name(), variant.sql(), StatementsRow::from);
    }

    /**
     * @throws UnsupportedVersionException for servers older than 10
     */
    public List<SubscriptionRow> subscription() throws PgStatsException {
        VariantSelector.requireAtLeast(Queries.SUBSCRIPTION_VIEW, serverVersion(),
                VariantSelector.SUBSCRIPTION_MIN_VERSION);
        return fetchRows(Queries.SUBSCRIPTION_VIEW, DEFAULT_VARIANT, Queries.SUBSCRIPTION, SubscriptionRow::from);
    }

    public List<TablesRow> allTables() throws PgStatsException {
        return tables(Scope.ALL);
    }

    public List<TablesRow> systemTables() throws PgStatsException {
        return tables(Scope.SYSTEM);
    }

    public List<TablesRow> userTables() throws PgStatsException {
        return tables(Scope.USER);
    }

    /**
     * The WAL receiver of a standby. Empty when the server runs no WAL receiver, e.g. on a primary.
     *
     * @throws UnsupportedVersionException for servers other than 9.6 and 10 onwards
     */
    public Optional<WalReceiverView> walReceiver() throws PgStatsException {
        WalReceiverQuery variant = VariantSelector.walReceiver(serverVersion());
        List<WalReceiverView> rows = fetchRows(variant.view(), variant.name(), variant.sql(), WalReceiverView::from);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<XactTablesRow> xactAllTables() throws PgStatsException {
        return xactTables(Scope.ALL);
    }

    public List<XactTablesRow> xactSystemTables() throws PgStatsException {
        return xactTables(Scope.SYSTEM);
    }

    public List<XactTablesRow> xactUserTables() throws PgStatsException {
        return xactTables(Scope.USER);
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Closes the connection. Calling it again does nothing.
     *
     * @throws ConnectionException if the driver fails to close the connection
     */
    @Override
    public void close() throws ConnectionException {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection", e);
            throw new ConnectionException("Failed to close connection", e);
        }
        log.info("StatsClient closed");
    }

    private List<TablesRow> tables(Scope scope) throws PgStatsException {
        return fetchRows(scope.view(Queries.TABLES_PATTERN), DEFAULT_VARIANT, Queries.tables(scope), TablesRow::from);
    }

    private List<XactTablesRow> xactTables(Scope scope) throws PgStatsException {
        return fetchRows(scope.view(Queries.XACT_TABLES_PATTERN), DEFAULT_VARIANT, Queries.xactTables(scope),
                XactTablesRow::from);
    }

    private List<IndexesRow> indexes(Scope scope) throws PgStatsException {
        return fetchRows(scope.view(Queries.INDEXES_PATTERN), DEFAULT_VARIANT, Queries.indexes(scope),
                IndexesRow::from);
    }

    private List<IoTablesRow> ioTables(Scope scope) throws PgStatsException {
        return fetchRows(scope.view(Queries.IO_TABLES_PATTERN), DEFAULT_VARIANT, Queries.ioTables(scope),
                IoTablesRow::from);
    }

    private List<IoIndexesRow> ioIndexes(Scope scope) throws PgStatsException {
        return fetchRows(scope.view(Queries.IO_INDEXES_PATTERN), DEFAULT_VARIANT, Queries.ioIndexes(scope),
                IoIndexesRow::from);
    }

    private List<IoSequencesRow> ioSequences(Scope scope) throws PgStatsException {
        return fetchRows(scope.view(Queries.IO_SEQUENCES_PATTERN), DEFAULT_VARIANT, Queries.ioSequences(scope),
                IoSequencesRow::from);
    }

    private <T> T fetchSingle(String view, String sql, RowMapper<T> mapper) throws PgStatsException {
        List<T> rows = fetchRows(view, DEFAULT_VARIANT, sql, mapper);
        if (rows.isEmpty()) {
            throw new QueryException(view, "expected one row, got none");
        }
        return rows.get(0);
    }

    private <T> List<T> fetchRows(String view, String variant, String sql, RowMapper<T> mapper)
            throws PgStatsException {
        ensureOpen();
        Timer.Sample sample = Timer.start(registry);
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            RowReader reader = new RowReader(rs);
            List<T> rows = new ArrayList<>();
            while (rs.next()) {
                rows.add(mapper.map(reader));
            }
            log.debug("Read {} rows from {} ({} variant)", rows.size(), view, variant);
            return Collections.unmodifiableList(rows);
        } catch (SQLException e) {
            throw new QueryException(view, e);
        } finally {
            sample.stop(Timer.builder(QUERY_TIMER)
                    .description("Time spent reading a statistics view")
                    .tag("view", view)
                    .tag("variant", variant)
                    .register(registry));
        }
    }

    private void ensureOpen() throws ClientClosedException {
        if (closed.get()) {
            throw new ClientClosedException();
        }
    }
}
