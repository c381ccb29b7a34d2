package de.bsommerfeld.todos.db;

/**
 * The database could not be reached or a statement against it failed: the file
 * could not be opened, the schema could not be applied, or a query raised an
 * {@link java.sql.SQLException}. The store never retries on its own.
 */
public class ConnectionException extends RuntimeException {

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
