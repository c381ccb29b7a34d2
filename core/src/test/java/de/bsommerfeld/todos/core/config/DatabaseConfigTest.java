package de.bsommerfeld.todos.core.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseConfigTest {

    private String original;

    @BeforeEach
    void rememberProperty() {
        original = System.getProperty(DatabaseConfig.LOCATION_PROPERTY);
    }

    @AfterEach
    void restoreProperty() {
        if (original != null)
            System.setProperty(DatabaseConfig.LOCATION_PROPERTY, original);
        else
            System.clearProperty(DatabaseConfig.LOCATION_PROPERTY);
    }

    @Test
    void fromEnvironment_shouldResolveFromSystemProperty() {
        System.setProperty(DatabaseConfig.LOCATION_PROPERTY, "/tmp/todos/custom.db");
        DatabaseConfig config = DatabaseConfig.fromEnvironment();
        assertEquals(Paths.get("/tmp/todos/custom.db"), config.location());
    }

    @Test
    void fromEnvironment_shouldFallBackWhenPropertyIsBlank() {
        System.setProperty(DatabaseConfig.LOCATION_PROPERTY, "   ");
        DatabaseConfig config = DatabaseConfig.fromEnvironment();
        String env = System.getenv(DatabaseConfig.LOCATION_ENV);
        if (env == null || env.isBlank()) {
            assertEquals(Paths.get(DatabaseConfig.DEFAULT_LOCATION), config.location());
        } else {
            assertEquals(Paths.get(env.trim()), config.location());
        }
    }

    @Test
    void fromEnvironment_shouldUseDefaultBusyTimeout() {
        System.setProperty(DatabaseConfig.LOCATION_PROPERTY, "/tmp/todos/custom.db");
        assertEquals(5000, DatabaseConfig.fromEnvironment().busyTimeoutMillis());
    }

    @Test
    void jdbcUrl_shouldPointAtAbsoluteLocation() {
        Path path = Paths.get("relative", "todo.db");
        DatabaseConfig config = DatabaseConfig.at(path);
        assertEquals("jdbc:sqlite:" + path.toAbsolutePath(), config.jdbcUrl());
    }

    @Test
    void constructor_shouldRejectNegativeTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> new DatabaseConfig(Paths.get("todo.db"), -1));
    }

    @Test
    void constructor_shouldRejectNullLocation() {
        assertThrows(NullPointerException.class, () -> DatabaseConfig.at(null));
    }
}
