package de.bsommerfeld.todos.db;

/**
 * Input rejected before any database access, e.g. a blank title on
 * {@link TodoStore#add(String, Object)}.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
