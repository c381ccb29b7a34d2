package de.bsommerfeld.todos.core.domain;

/**
 * Partial update for an existing {@link TodoItem}. A {@code null} field keeps
 * the stored value.
 *
 * <p>
 * {@code completed} is the raw input as received from the request layer
 * ({@link Boolean}, {@link Number} or {@link String}); it is run through
 * {@link Completion#coerce(Object)} before it reaches the database, so an
 * unparseable value behaves like an absent one.
 *
 * @param title     replacement title, or {@code null}/blank to keep the current
 * @param completed raw completion flag, or {@code null} to keep the current
 */
public record TodoPatch(String title, Object completed) {

    public static TodoPatch title(String title) {
        return new TodoPatch(title, null);
    }

    public static TodoPatch completed(Object completed) {
        return new TodoPatch(null, completed);
    }

    /** Returns true if the patch carries a usable (non-blank) title. */
    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }

    public Completion completion() {
        return Completion.coerce(completed);
    }
}
