package de.bsommerfeld.todos.db;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests SqlLoader against the statement files shipped in {@code sql/} and the
 * {@code schema.sql} script at the classpath root.
 */
class SqlLoaderTest {

    @Test
    void load_shouldResolveEveryTodoStatement() {
        for (TodoSql statement : TodoSql.values()) {
            String sql = statement.sql();
            assertNotNull(sql, statement.name());
            assertFalse(sql.isBlank(), statement.name());
        }
    }

    @Test
    void load_shouldReturnInsertWithReturningClause() {
        String sql = SqlLoader.load("insert-todo").toLowerCase();
        assertTrue(sql.startsWith("insert"));
        assertTrue(sql.contains("returning id"));
    }

    @Test
    void load_shouldOrderSelectAllById() {
        assertTrue(TodoSql.SELECT_ALL.sql().toLowerCase().contains("order by id asc"));
    }

    @Test
    void load_shouldCacheRepeatCalls() {
        String first = SqlLoader.load("select-all-todos");
        String second = SqlLoader.load("select-all-todos");
        assertSame(first, second, "Cached calls should return the same String reference");
    }

    @Test
    void load_shouldThrowForNonexistentFile() {
        assertThrows(IllegalStateException.class,
                () -> SqlLoader.load("nonexistent-sql-file"));
    }

    @Test
    void script_shouldSplitSchemaAndDropComments() {
        List<String> statements = SqlLoader.script("schema.sql");
        assertEquals(1, statements.size());
        String create = statements.get(0);
        assertTrue(create.startsWith("CREATE TABLE IF NOT EXISTS todos"));
        assertFalse(create.contains("--"));
    }

    @Test
    void script_shouldThrowForNonexistentFile() {
        assertThrows(IllegalStateException.class,
                () -> SqlLoader.script("missing-schema.sql"));
    }
}
