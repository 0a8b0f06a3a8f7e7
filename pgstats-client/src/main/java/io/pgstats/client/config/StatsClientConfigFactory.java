package io.pgstats.client.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.time.Duration;

/**
 * Factory for creating StatsClientConfig instances configured from application.conf
 * or from a dedicated conf file.
 *
 * <p>Expected configuration format:</p>
 * <pre>{@code
 * pgstats {
 *   jdbc_url = "jdbc:postgresql://127.0.0.1:5432/postgres_db"
 *   username = "postgres_user"
 *   password = "postgres_pass"
 *   ssl_mode = "disable"
 *   validation_timeout_ms = 5000
 * }
 * }</pre>
 *
 * <p>Keys missing from application.conf or the dedicated file fall back to reference.conf.</p>
 */
public final class StatsClientConfigFactory {

    private StatsClientConfigFactory() {}

    /**
     * Create a StatsClientConfig from the default application configuration
     * (application.conf / reference.conf on the classpath).
     */
    public static StatsClientConfig createConfig() {
        return fromRoot(ConfigFactory.load());
    }

    /**
     * Create a StatsClientConfig by reading a dedicated conf file containing a {@code pgstats} block.
     *
     * @param configFilePath path to a .conf file on the filesystem or on the classpath
     *                       (classpath resources are resolved first)
     */
    public static StatsClientConfig createConfig(String configFilePath) {
        Config fallback = ConfigFactory.load();
        Config fileConfig;

        File file = new File(configFilePath);
        if (file.isAbsolute() || file.exists()) {
            fileConfig = ConfigFactory.parseFile(file).withFallback(fallback);
        } else {
            fileConfig = ConfigFactory.parseResources(configFilePath).withFallback(fallback);
            if (!fileConfig.hasPath(ConfigConstants.CONFIG_ROOT)) {
                fileConfig = ConfigFactory.parseFile(file).withFallback(fallback);
            }
        }
        return fromRoot(fileConfig.resolve());
    }

    /**
     * Create a StatsClientConfig from a config tree holding a {@code pgstats} block.
     */
    public static StatsClientConfig fromRoot(Config root) {
        return buildConfig(root.getConfig(ConfigConstants.CONFIG_ROOT));
    }

    /**
     * Create a StatsClientConfig from the contents of a {@code pgstats} block.
     */
    public static StatsClientConfig buildConfig(Config config) {
        return new StatsClientConfig(
                config.getString(ConfigConstants.JDBC_URL_KEY),
                config.getString(ConfigConstants.USERNAME_KEY),
                config.getString(ConfigConstants.PASSWORD_KEY),
                config.getString(ConfigConstants.SSL_MODE_KEY),
                Duration.ofMillis(config.getLong(ConfigConstants.VALIDATION_TIMEOUT_MS_KEY)));
    }
}
