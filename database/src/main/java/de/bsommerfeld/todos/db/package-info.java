/**
 * Persistence layer for to-do items, backed by a single SQLite file.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Request handlers]
 *         │  (injected via TodoStoreModule)
 *         ▼
 *     TodoStore       ← interface, the only thing consumers see
 *         │
 *         ▼
 *    SqlTodoStore     ← one shared JDBC connection, lazily opened
 *         │
 *         ▼
 *   TodoSql / SqlLoader ← statements from classpath .sql files
 * </pre>
 *
 * <h2>Database Schema</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ todos                                                            │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │ AUTOINCREMENT, never reused after a delete    │
 * │ title            │ TEXT NOT NULL, never blank                    │
 * │ completed        │ INTEGER NOT NULL DEFAULT 0, always 0 or 1     │
 * └──────────────────┴────────────────────────────────────────────────┘
 * </pre>
 *
 * No other tables and no schema version metadata. {@code schema.sql} is
 * applied on every start; it only creates the table when it is missing.
 *
 * <h2>Errors</h2>
 * <ul>
 * <li>{@link de.bsommerfeld.todos.db.ValidationException}: bad input, thrown
 * before the database is touched</li>
 * <li>{@link de.bsommerfeld.todos.db.ConnectionException}: anything the
 * database itself reports</li>
 * </ul>
 * Missing ids are not errors; update and delete return {@code false}.
 *
 * @see de.bsommerfeld.todos.db.SqlTodoStore
 */
package de.bsommerfeld.todos.db;
