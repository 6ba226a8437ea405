package de.bsommerfeld.labreport.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Loads and caches SQL statements from classpath resource files under
 * {@code sql/}. The only place {@link SqlDatabaseService} gets its SQL from.
 *
 * <p>
 * Each file is read exactly once and cached for the lifetime of the JVM.
 * The naming convention is {@code sql/<operation>-<entity>.sql},
 * e.g. {@code insert-question.sql}, {@code select-subtopics-for-question.sql}.
 * {@code schema.sql} lives at the classpath root and is read separately
 * through {@link #loadScript(String)}.
 *
 * @see SqlDatabaseService
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the statement from {@code sql/<name>.sql}, trimmed and cached.
     *
     * @param name the file stem without path prefix or extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, n -> read("sql/" + n + ".sql"));
    }

    /**
     * Loads every named statement up front so a missing file fails startup
     * instead of the first request that needs it.
     *
     * @return the number of statements now cached
     */
    public static int preload(List<String> names) {
        names.forEach(SqlLoader::load);
        return CACHE.size();
    }

    /**
     * Reads a multi-statement script from the classpath root and splits it
     * into individual statements on {@code ;} followed by a line break or end
     * of input. Not cached: scripts run once per store.
     */
    public static List<String> loadScript(String resource) {
        String script = read(resource);
        return Arrays.stream(script.split(";\\s*(\\r?\\n|$)"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static String read(String path) {
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
