package de.bsommerfeld.todos.db;

import de.bsommerfeld.todos.core.domain.TodoItem;
import de.bsommerfeld.todos.core.domain.TodoPatch;

import java.util.List;

/**
 * Persistence contract for to-do items. Implementations must be thread-safe:
 * request handlers call into the same instance concurrently.
 *
 * <p>
 * The store is handed to consumers through Guice (see
 * {@link TodoStoreModule}); there is no static accessor. "Not found" is never
 * an exception here. {@link #update} and {@link #delete} report it as
 * {@code false} and leave it to the caller how to surface it.
 */
public interface TodoStore {

    /**
     * Opens the shared connection and makes sure the {@code todos} table
     * exists. Idempotent: only the first successful call does any work, and a
     * failed attempt is not remembered, so the next call tries again. Every
     * other operation initializes implicitly, so calling this up front is
     * only needed to fail fast at startup.
     *
     * @throws ConnectionException if the database cannot be opened or the
     *                             schema cannot be applied
     */
    void initialize();

    /**
     * Returns all items ordered by ascending id, which is insertion order.
     * Returns an empty list for an empty table.
     */
    List<TodoItem> list();

    /**
     * Creates a new item.
     *
     * @param title     required, must contain non-whitespace characters
     * @param completed raw completion flag (see
     *                  {@link de.bsommerfeld.todos.core.domain.Completion#coerce});
     *                  {@code null} or an unparseable value stores {@code false}
     * @return the stored item, including its database-assigned id
     * @throws ValidationException if the title is missing or blank; raised
     *                             before the database is touched
     */
    TodoItem add(String title, Object completed);

    default TodoItem add(String title) {
        return add(title, null);
    }

    /**
     * Applies a partial update. Fields absent from the patch keep their stored
     * value.
     *
     * @return {@code true} if the item existed and was written, {@code false}
     *         for a {@code null} id or an unknown one
     */
    boolean update(Long id, TodoPatch patch);

    /**
     * Permanently removes an item. Its id is never handed out again.
     *
     * @return {@code true} if a row was removed, {@code false} if there was
     *         none with that id
     */
    boolean delete(Long id);

    /**
     * Closes the shared connection if it is open. The next operation opens a
     * fresh one. Normally only needed in tests; the process exit closes the
     * connection otherwise.
     */
    void shutdown();
}
