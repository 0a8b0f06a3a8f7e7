package io.pgstats.client.config;

import com.typesafe.config.Config;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.pgstats.client.ConnectionException;
import io.pgstats.client.StatsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens a JDBC connection from configuration and wraps it in a {@link StatsClient}.
 */
public final class StatsClientFactory {

    private static final Logger log = LoggerFactory.getLogger(StatsClientFactory.class);

    private StatsClientFactory() {}

    public static StatsClient create() throws ConnectionException {
        return create(StatsClientConfigFactory.createConfig(), Metrics.globalRegistry);
    }

    public static StatsClient create(Config root) throws ConnectionException {
        return create(StatsClientConfigFactory.fromRoot(root), Metrics.globalRegistry);
    }

    public static StatsClient create(StatsClientConfig config, MeterRegistry registry) throws ConnectionException {
        log.info("Connecting to {}", config.jdbcUrl());
        Connection connection;
        try {
            connection = DriverManager.getConnection(config.jdbcUrl(), config.connectionProperties());
        } catch (SQLException e) {
            throw new ConnectionException("Failed to connect to " + config.jdbcUrl(), e);
        }
        try {
            return new StatsClient(connection, registry, config.validationTimeout());
        } catch (ConnectionException e) {
            try {
                connection.close();
            } catch (SQLException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }
}
