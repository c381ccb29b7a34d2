package de.bsommerfeld.todos.db;

/**
 * Statements run by {@link SqlTodoStore}, one resource file each.
 */
enum TodoSql {

    SELECT_ALL("select-all-todos"),
    SELECT_BY_ID("select-todo"),
    INSERT("insert-todo"),
    UPDATE("update-todo"),
    DELETE("delete-todo");

    private final String resource;

    TodoSql(String resource) {
        this.resource = resource;
    }

    String resource() {
        return resource;
    }

    String sql() {
        return SqlLoader.load(resource);
    }
}
