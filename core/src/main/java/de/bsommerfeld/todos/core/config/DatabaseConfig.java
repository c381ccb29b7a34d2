package de.bsommerfeld.todos.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Location and locking settings for the SQLite database file.
 *
 * @param location          path of the database file; the parent directory is
 *                          created on first use if missing
 * @param busyTimeoutMillis how long a writer waits on a locked database before
 *                          SQLite gives up with {@code SQLITE_BUSY}
 */
public record DatabaseConfig(Path location, int busyTimeoutMillis) {

    public static final String LOCATION_PROPERTY = "sqlite.db.location";
    public static final String LOCATION_ENV = "SQLITE_DB_LOCATION";
    public static final String DEFAULT_LOCATION = "/etc/todos/todo.db";
    public static final int DEFAULT_BUSY_TIMEOUT_MILLIS = 5000;

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseConfig.class);

    public DatabaseConfig {
        Objects.requireNonNull(location, "location");
        if (busyTimeoutMillis < 0) {
            throw new IllegalArgumentException("busyTimeoutMillis must not be negative: " + busyTimeoutMillis);
        }
    }

    public static DatabaseConfig at(Path location) {
        return new DatabaseConfig(location, DEFAULT_BUSY_TIMEOUT_MILLIS);
    }

    /**
     * Resolves the database location from the system property
     * {@value #LOCATION_PROPERTY}, then the environment variable
     * {@value #LOCATION_ENV}. Falls back to {@value #DEFAULT_LOCATION} when
     * neither is set or both are blank.
     */
    public static DatabaseConfig fromEnvironment() {
        String location = System.getProperty(LOCATION_PROPERTY);
        if (location == null || location.isBlank()) {
            location = System.getenv(LOCATION_ENV);
        }

        if (location == null || location.isBlank()) {
            LOG.debug("No database location configured, using default {}", DEFAULT_LOCATION);
            location = DEFAULT_LOCATION;
        }
        return at(Paths.get(location.trim()));
    }

    /** JDBC URL understood by the xerial SQLite driver. */
    public String jdbcUrl() {
        return "jdbc:sqlite:" + location.toAbsolutePath();
    }
}
