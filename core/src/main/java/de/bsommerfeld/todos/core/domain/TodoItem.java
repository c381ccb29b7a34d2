package de.bsommerfeld.todos.core.domain;

/**
 * A single to-do entry as stored in the {@code todos} table.
 *
 * <p>
 * The {@code id} is assigned by the database on insert and never changes or
 * gets reused afterwards. {@code completed} is the strict boolean view of the
 * stored 0/1 column.
 */
public record TodoItem(long id, String title, boolean completed) {
}
