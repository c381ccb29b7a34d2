package de.bsommerfeld.todos.db;

import com.google.inject.AbstractModule;
import de.bsommerfeld.todos.core.config.DatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice module wiring the SQLite {@link TodoStore}.
 *
 * <p>
 * Without an explicit {@link DatabaseConfig} the database location is resolved
 * from the environment (see {@link DatabaseConfig#fromEnvironment()}).
 */
public class TodoStoreModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(TodoStoreModule.class);

    private final DatabaseConfig config;

    public TodoStoreModule() {
        this(DatabaseConfig.fromEnvironment());
    }

    public TodoStoreModule(DatabaseConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        LOG.info("Todo database location: {}", config.location().toAbsolutePath());
        bind(DatabaseConfig.class).toInstance(config);
        // SqlTodoStore is @Singleton, so every injection point shares one connection
        bind(TodoStore.class).to(SqlTodoStore.class);
    }
}
