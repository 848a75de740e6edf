package com.userservice.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Runtime settings for the service, read from environment variables.
 *
 * <p>Database location is resolved in this order:</p>
 * <ol>
 *   <li>{@code DB_URL}, used verbatim as the JDBC URL</li>
 *   <li>{@code DB_HOST} (+ {@code DB_PORT}, {@code DB_NAME}), turned into a PostgreSQL URL</li>
 *   <li>otherwise an embedded H2 in-memory database</li>
 * </ol>
 *
 * <p>Pool bounds, the command timeout and the HTTP listener are validated when the
 * configuration is built, so a bad value stops startup before any connection is opened.</p>
 */
public final class ServiceConfig {
    public static final String DEFAULT_H2_URL = "jdbc:h2:mem:users;DB_CLOSE_DELAY=-1";

    private final String jdbcUrl;
    private final String dbUser;
    private final String dbPassword;
    private final int poolMinSize;
    private final int poolMaxSize;
    private final int commandTimeoutSeconds;
    private final int maxInactiveSeconds;
    private final int httpPort;
    private final int httpThreads;

    private ServiceConfig(Builder builder) {
        this.jdbcUrl = builder.jdbcUrl;
        this.dbUser = builder.dbUser;
        this.dbPassword = builder.dbPassword;
        this.poolMinSize = builder.poolMinSize;
        this.poolMaxSize = builder.poolMaxSize;
        this.commandTimeoutSeconds = builder.commandTimeoutSeconds;
        this.maxInactiveSeconds = builder.maxInactiveSeconds;
        this.httpPort = builder.httpPort;
        this.httpThreads = builder.httpThreads;
    }

    /**
     * Build the configuration from the process environment. A {@code .env} file in
     * the working directory is read first; real environment variables override it.
     *
     * @return the validated configuration
     * @throws IOException if the {@code .env} file exists but cannot be read
     */
    public static ServiceConfig fromEnvironment() throws IOException {
        Map<String, String> values = new HashMap<>(DotEnv.loadIfExists(Path.of(".env")));
        values.putAll(System.getenv());
        return fromMap(values);
    }

    /**
     * Build the configuration from an explicit key/value map.
     *
     * @param env the settings, keyed like the environment variables
     * @return the validated configuration
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public static ServiceConfig fromMap(Map<String, String> env) {
        Builder builder = builder()
                .dbUser(env.getOrDefault("DB_USER", "sa"))
                .dbPassword(env.getOrDefault("DB_PASS", ""))
                .poolMinSize(intValue(env, "POOL_MIN_SIZE", 2))
                .poolMaxSize(intValue(env, "POOL_MAX_SIZE", 10))
                .commandTimeoutSeconds(intValue(env, "COMMAND_TIMEOUT", 30))
                .maxInactiveSeconds(intValue(env, "POOL_MAX_INACTIVE_SECONDS", 300))
                .httpPort(intValue(env, "HTTP_PORT", 8000))
                .httpThreads(intValue(env, "HTTP_THREADS", 4));

        String url = blankToNull(env.get("DB_URL"));
        String host = blankToNull(env.get("DB_HOST"));
        if (url != null) {
            builder.jdbcUrl(url);
        } else if (host != null) {
            int port = checkPort("DB_PORT", intValue(env, "DB_PORT", 5432));
            String name = env.getOrDefault("DB_NAME", "users");
            builder.jdbcUrl("jdbc:postgresql://" + host + ":" + port + "/" + name);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int intValue(Map<String, String> env, String key, int defaultValue) {
        String raw = blankToNull(env.get(key));
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + raw + "'", e);
        }
    }

    private static int checkPort(String key, int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(key + " must be in 0..65535, got " + port);
        }
        return port;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public String getDbUser() {
        return dbUser;
    }

    public String getDbPassword() {
        return dbPassword;
    }

    public int getPoolMinSize() {
        return poolMinSize;
    }

    public int getPoolMaxSize() {
        return poolMaxSize;
    }

    public int getCommandTimeoutSeconds() {
        return commandTimeoutSeconds;
    }

    public int getMaxInactiveSeconds() {
        return maxInactiveSeconds;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public int getHttpThreads() {
        return httpThreads;
    }

    // Never includes the password
    @Override
    public String toString() {
        return "ServiceConfig{url='" + jdbcUrl + "', user='" + dbUser + "', pool=" + poolMinSize + ".." + poolMaxSize
                + ", commandTimeout=" + commandTimeoutSeconds + "s, maxInactive=" + maxInactiveSeconds
                + "s, httpPort=" + httpPort + "}";
    }

    public static final class Builder {
        private String jdbcUrl = DEFAULT_H2_URL;
        private String dbUser = "sa";
        private String dbPassword = "";
        private int poolMinSize = 2;
        private int poolMaxSize = 10;
        private int commandTimeoutSeconds = 30;
        private int maxInactiveSeconds = 300;
        private int httpPort = 8000;
        private int httpThreads = 4;

        private Builder() {}

        public Builder jdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
            return this;
        }

        public Builder dbUser(String dbUser) {
            this.dbUser = dbUser;
            return this;
        }

        public Builder dbPassword(String dbPassword) {
            this.dbPassword = dbPassword;
            return this;
        }

        public Builder poolMinSize(int poolMinSize) {
            this.poolMinSize = poolMinSize;
            return this;
        }

        public Builder poolMaxSize(int poolMaxSize) {
            this.poolMaxSize = poolMaxSize;
            return this;
        }

        public Builder commandTimeoutSeconds(int commandTimeoutSeconds) {
            this.commandTimeoutSeconds = commandTimeoutSeconds;
            return this;
        }

        public Builder maxInactiveSeconds(int maxInactiveSeconds) {
            this.maxInactiveSeconds = maxInactiveSeconds;
            return this;
        }

        public Builder httpPort(int httpPort) {
            this.httpPort = httpPort;
            return this;
        }

        public Builder httpThreads(int httpThreads) {
            this.httpThreads = httpThreads;
            return this;
        }

        public ServiceConfig build() {
            if (jdbcUrl == null || jdbcUrl.isBlank()) {
                throw new IllegalArgumentException("DB_URL must not be blank");
            }
            if (poolMinSize < 0) {
                throw new IllegalArgumentException("POOL_MIN_SIZE must be >= 0, got " + poolMinSize);
            }
            if (poolMaxSize < 1) {
                throw new IllegalArgumentException("POOL_MAX_SIZE must be >= 1, got " + poolMaxSize);
            }
            if (poolMinSize > poolMaxSize) {
                throw new IllegalArgumentException("POOL_MIN_SIZE (" + poolMinSize
                        + ") must not exceed POOL_MAX_SIZE (" + poolMaxSize + ")");
            }
            if (commandTimeoutSeconds <= 0) {
                throw new IllegalArgumentException("COMMAND_TIMEOUT must be > 0, got " + commandTimeoutSeconds);
            }
            if (maxInactiveSeconds <= 0) {
                throw new IllegalArgumentException("POOL_MAX_INACTIVE_SECONDS must be > 0, got " + maxInactiveSeconds);
            }
            checkPort("HTTP_PORT", httpPort);
            if (httpThreads < 1) {
                throw new IllegalArgumentException("HTTP_THREADS must be >= 1, got " + httpThreads);
            }
            return new ServiceConfig(this);
        }
    }
}
