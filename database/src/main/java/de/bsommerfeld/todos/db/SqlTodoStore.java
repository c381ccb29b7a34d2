package de.bsommerfeld.todos.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.todos.core.config.DatabaseConfig;
import de.bsommerfeld.todos.core.domain.Completion;
import de.bsommerfeld.todos.core.domain.TodoItem;
import de.bsommerfeld.todos.core.domain.TodoPatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * SQLite-backed {@link TodoStore}.
 *
 * <p>
 * All SQL lives in external {@code .sql} files resolved through
 * {@link TodoSql}. The schema comes from {@code schema.sql}, whose only
 * statement is a {@code CREATE TABLE IF NOT EXISTS}, so it is safe to apply to
 * an existing file.
 *
 * <h3>Connection strategy</h3>
 * One {@link Connection} is opened on first use and shared by every operation
 * until {@link #shutdown()}. Opening is guarded by a lock so that concurrent
 * first callers run the setup sequence exactly once and all observe the same
 * connection. A failed setup leaves the store uninitialized; the next call
 * starts over.
 *
 * <h3>Contention</h3>
 * There is no locking on the Java side. SQLite serializes writers at the file
 * level, and {@code PRAGMA busy_timeout} makes a blocked writer wait (5s by
 * default) instead of failing with {@code SQLITE_BUSY} straight away. Every
 * statement runs in auto-commit mode.
 */
@Singleton
public class SqlTodoStore implements TodoStore {

    private static final Logger LOG = LoggerFactory.getLogger(SqlTodoStore.class);

    private final DatabaseConfig config;
    private final Object initLock = new Object();
    private volatile Connection connection;

    @Inject
    public SqlTodoStore(DatabaseConfig config) {
        this.config = config;
    }

    Connection openConnection() throws SQLException {
        return DriverManager.getConnection(config.jdbcUrl());
    }

    @Override
    public void initialize() {
        connection();
    }

    /** Returns the shared connection, opening it on first use. */
    Connection connection() {
        Connection conn = connection;
        if (conn != null)
            return conn;

        synchronized (initLock) {
            if (connection == null) {
                connection = open();
            }
            return connection;
        }
    }

    private Connection open() {
        Path location = config.location().toAbsolutePath();
        LOG.info("Initializing database at {}", location);
        createParentDirectory(location);

        Connection conn = null;
        try {
            conn = openConnection();
            applyPragmas(conn);
            applySchema(conn);
            return conn;
        } catch (SQLException | RuntimeException e) {
            closeAfterFailure(conn, e);
            LOG.error("Database initialization failed for {}", location, e);
            throw new ConnectionException("Database initialization failed: " + location, e);
        }
    }

    private void createParentDirectory(Path location) {
        Path parent = location.getParent();
        if (parent == null || Files.isDirectory(parent))
            return;
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            LOG.error("Failed to create database directory {}", parent, e);
            throw new ConnectionException("Cannot create database directory: " + parent, e);
        }
    }

    private void applyPragmas(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA busy_timeout = " + config.busyTimeoutMillis());
        }
    }

    /**
     * Executes every statement of {@code schema.sql}. A failing statement
     * aborts initialization.
     */
    private void applySchema(Connection conn) throws SQLException {
        List<String> statements = SqlLoader.script("schema.sql");
        try (Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        }
        LOG.info("Database schema applied ({} statement(s)).", statements.size());
    }

    private void closeAfterFailure(Connection conn, Exception failure) {
        if (conn == null)
            return;
        try {
            conn.close();
        } catch (SQLException closeFailure) {
            failure.addSuppressed(closeFailure);
        }
    }

    @Override
    public void shutdown() {
        synchronized (initLock) {
            Connection conn = connection;
            if (conn == null)
                return;
            connection = null;
            try {
                conn.close();
                LOG.info("Database connection closed.");
            } catch (SQLException e) {
                throw new ConnectionException("Failed to close database connection", e);
            }
        }
    }

    // =====================================================================
    // Queries
    // =====================================================================

    @Override
    public List<TodoItem> list() {
        Connection conn = connection();
        List<TodoItem> items = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(TodoSql.SELECT_ALL.sql());
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                items.add(mapItem(rs));
            }
        } catch (SQLException e) {
            throw new ConnectionException("Failed to list todos", e);
        }
        return items;
    }

    private TodoItem findById(Connection conn, long id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(TodoSql.SELECT_BY_ID.sql())) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? mapItem(rs) : null;
            }
        }
    }

    // =====================================================================
    // Writes
    // =====================================================================

    @Override
    public TodoItem add(String title, Object completed) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("title is required");
        }
        boolean done = Completion.coerce(completed).orElse(false);

        Connection conn = connection();
        try (PreparedStatement ps = conn.prepareStatement(TodoSql.INSERT.sql())) {
            ps.setString(1, title);
            ps.setInt(2, Completion.of(done).toStored());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Insert returned no generated id");
                }
                TodoItem item = new TodoItem(rs.getLong(1), title, done);
                LOG.debug("[DB] Added todo {}", item.id());
                return item;
            }
        } catch (SQLException e) {
            throw new ConnectionException("Failed to add todo", e);
        }
    }

    /**
     * Reads the current row, merges the patch into it and writes the result
     * back. A blank patch title counts as absent so the stored title never
     * becomes empty.
     *
     * <p>
     * The read and the write are separate statements. If the row is deleted
     * in between, the write affects nothing; that case is logged as a warning
     * and reported as {@code false}, same as an id that never existed.
     */
    @Override
    public boolean update(Long id, TodoPatch patch) {
        if (id == null)
            return false;

        Connection conn = connection();
        try {
            TodoItem existing = findById(conn, id);
            if (existing == null) {
                LOG.debug("[DB] No todo {} to update", id);
                return false;
            }

            String title = existing.title();
            boolean completed = existing.completed();
            if (patch != null) {
                if (patch.hasTitle())
                    title = patch.title();
                completed = patch.completion().orElse(completed);
            }

            int changed;
            try (PreparedStatement ps = conn.prepareStatement(TodoSql.UPDATE.sql())) {
                ps.setString(1, title);
                ps.setInt(2, Completion.of(completed).toStored());
                ps.setLong(3, id);
                changed = ps.executeUpdate();
            }

            if (changed == 0) {
                LOG.warn("Todo {} was removed between read and write, update not applied", id);
                return false;
            }
            LOG.debug("[DB] Updated todo {}", id);
            return true;
        } catch (SQLException e) {
            throw new ConnectionException("Failed to update todo " + id, e);
        }
    }

    @Override
    public boolean delete(Long id) {
        if (id == null)
            return false;

        Connection conn = connection();
        try (PreparedStatement ps = conn.prepareStatement(TodoSql.DELETE.sql())) {
            ps.setLong(1, id);
            boolean removed = ps.executeUpdate() > 0;
            if (removed)
                LOG.debug("[DB] Deleted todo {}", id);
            return removed;
        } catch (SQLException e) {
            throw new ConnectionException("Failed to delete todo " + id, e);
        }
    }

    // =====================================================================
    // ResultSet → Domain Mapping
    // =====================================================================

    /**
     * Maps a {@code todos} row. {@code completed} is read as an object so that
     * legacy rows holding something other than 0/1 still normalize to a strict
     * boolean.
     */
    private TodoItem mapItem(ResultSet rs) throws SQLException {
        return new TodoItem(
                rs.getLong("id"),
                rs.getString("title"),
                Completion.fromStored(rs.getObject("completed")));
    }
}
