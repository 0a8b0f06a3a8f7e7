package io.pgstats.client.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection settings for a {@link io.pgstats.client.StatsClient}.
 *
 * @param sslMode value of the PostgreSQL driver's {@code sslmode} property; blank leaves the driver default
 */
public record StatsClientConfig(String jdbcUrl,
                                String username,
                                String password,
                                String sslMode,
                                Duration validationTimeout) {

    public StatsClientConfig {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        Objects.requireNonNull(validationTimeout, "validationTimeout");
        if (jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("jdbcUrl must not be blank");
        }
        if (validationTimeout.isNegative() || validationTimeout.isZero()) {
            throw new IllegalArgumentException("validationTimeout must be positive: " + validationTimeout);
        }
    }

    /**
     * Driver properties for {@link java.sql.DriverManager#getConnection(String, Properties)}.
     */
    public Properties connectionProperties() {
        Properties props = new Properties();
        if (username != null && !username.isBlank()) {
            props.setProperty("user", username);
        }
        if (password != null) {
            props.setProperty("password", password);
        }
        if (sslMode != null && !sslMode.isBlank()) {
            props.setProperty("sslmode", sslMode);
        }
        return props;
    }

    @Override
    public String toString() {
        return "StatsClientConfig[jdbcUrl=" + jdbcUrl + ", username=" + username
                + ", sslMode=" + sslMode + ", validationTimeout=" + validationTimeout + "]";
    }
}
