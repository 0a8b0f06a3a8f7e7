package io.pgstats.client.config;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.pgstats.client.ConnectionException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class StatsClientConfigFactoryTest {

    @Test
    void testDefaultsFromReferenceConf() {
        StatsClientConfig config = StatsClientConfigFactory.fromRoot(ConfigFactory.defaultReference());

        assertEquals("disable", config.sslMode());
        assertEquals(Duration.ofSeconds(5), config.validationTimeout());
        assertTrue(config.jdbcUrl().startsWith("jdbc:postgresql://"));
    }

    @Test
    void testOverridesFallBackToDefaults() {
        var root = ConfigFactory.parseString("""
                pgstats {
                  jdbc_url = "jdbc:postgresql://db.internal:6432/metrics"
                  username = "monitor"
                  validation_timeout_ms = 1500
                }
                """).withFallback(ConfigFactory.defaultReference()).resolve();

        StatsClientConfig config = StatsClientConfigFactory.fromRoot(root);

        assertEquals("jdbc:postgresql://db.internal:6432/metrics", config.jdbcUrl());
        assertEquals("monitor", config.username());
        assertEquals(Duration.ofMillis(1500), config.validationTimeout());
        assertEquals("disable", config.sslMode());
    }

    @Test
    void testMissingKeyRejected() {
        var block = ConfigFactory.parseString("""
                jdbc_url = "jdbc:postgresql://localhost/db"
                """);

        assertThrows(ConfigException.Missing.class, () -> StatsClientConfigFactory.buildConfig(block));
    }

    @Test
    void testConnectionProperties() {
        StatsClientConfig config = new StatsClientConfig("jdbc:postgresql://localhost/db",
                "monitor", "secret", "require", Duration.ofSeconds(1));

        Properties props = config.connectionProperties();

        assertEquals("monitor", props.getProperty("user"));
        assertEquals("secret", props.getProperty("password"));
        assertEquals("require", props.getProperty("sslmode"));
        assertFalse(config.toString().contains("secret"));
    }

    @Test
    void testBlankSslModeLeftToDriver() {
        StatsClientConfig config = new StatsClientConfig("jdbc:postgresql://localhost/db",
                "", null, "", Duration.ofSeconds(1));

        assertTrue(config.connectionProperties().isEmpty());
    }

    @Test
    void testInvalidTimeoutRejected() {
        assertThrows(IllegalArgumentException.class, () -> new StatsClientConfig("jdbc:postgresql://localhost/db",
                "u", "p", "disable", Duration.ZERO));
    }

    @Test
    void testFactoryOpensConnection() throws Exception {
        StatsClientConfig config = new StatsClientConfig("jdbc:duckdb:", "", null, "", Duration.ofSeconds(1));

        try (var client = StatsClientFactory.create(config, new SimpleMeterRegistry())) {
            assertFalse(client.isClosed());
        }
    }

    @Test
    void testFactoryWrapsConnectFailure() {
        StatsClientConfig config = new StatsClientConfig("jdbc:nosuchdriver://localhost/db",
                "u", "p", "", Duration.ofSeconds(1));

        ConnectionException e = assertThrows(ConnectionException.class,
                () -> StatsClientFactory.create(config, new SimpleMeterRegistry()));
        assertNotNull(e.getCause());
    }
}
