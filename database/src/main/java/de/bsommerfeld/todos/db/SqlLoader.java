package de.bsommerfeld.todos.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads SQL from classpath resources and caches it for the lifetime of the
 * JVM.
 *
 * <p>
 * Single statements live under {@code sql/<name>.sql} and are resolved through
 * {@link TodoSql}. Multi-statement scripts such as {@code schema.sql} sit at the
 * classpath root and are split into individual statements by
 * {@link #script(String)}.
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the statement stored in {@code sql/<name>.sql}, trimmed.
     *
     * @param name the file stem, e.g. {@code "insert-todo"}
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent("sql/" + name + ".sql", SqlLoader::readResource);
    }

    /**
     * Returns the non-empty statements of a script resource, split on
     * semicolons at line ends. Lines starting with {@code --} are dropped.
     *
     * @param path classpath location, e.g. {@code "schema.sql"}
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static List<String> script(String path) {
        String text = CACHE.computeIfAbsent(path, SqlLoader::readResource);
        List<String> statements = new ArrayList<>();
        for (String chunk : text.split(";\\s*(\\r?\\n|$)")) {
            String sql = stripComments(chunk);
            if (!sql.isEmpty())
                statements.add(sql);
        }
        return statements;
    }

    private static String stripComments(String chunk) {
        StringBuilder sb = new StringBuilder();
        for (String line : chunk.split("\\r?\\n")) {
            if (line.trim().startsWith("--"))
                continue;
            sb.append(line).append('\n');
        }
        return sb.toString().trim();
    }

    private static String readResource(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
