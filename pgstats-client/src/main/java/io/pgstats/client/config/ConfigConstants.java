package io.pgstats.client.config;

public final class ConfigConstants {

    public static final String CONFIG_ROOT = "pgstats";

    public static final String JDBC_URL_KEY = "jdbc_url";
    public static final String USERNAME_KEY = "username";
    public static final String PASSWORD_KEY = "password";
    public static final String SSL_MODE_KEY = "ssl_mode";
    public static final String VALIDATION_TIMEOUT_MS_KEY = "validation_timeout_ms";

    private ConfigConstants() {}
}
