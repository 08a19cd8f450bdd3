package de.bsommerfeld.liteguard.db;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.Maps;
import com.google.common.io.Resources;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Fixed statements {@link SqliteDatabase} issues on its own behalf (catalog
 * lookup, pragmas, transaction control), kept as classpath resources under
 * {@code sql/}. Everything shaped by caller input is assembled by
 * {@link de.bsommerfeld.liteguard.db.query.QueryBuilder} instead.
 *
 * <p>
 * A file holds exactly one statement. Whole-line {@code --} comments and a
 * trailing {@code ;} are removed, so the files can carry a header and be run
 * as-is from a SQLite shell. The cleaned text is kept for the lifetime of the
 * JVM.
 */
public final class SqlLoader {

    private static final String DIRECTORY = "sql/";
    private static final String SUFFIX = ".sql";

    private static final ConcurrentMap<String, String> STATEMENTS = Maps.newConcurrentMap();
    private static final Splitter LINES = Splitter.on('\n').trimResults(CharMatcher.whitespace());

    private SqlLoader() {
    }

    /**
     * @param name statement name, i.e. the file stem under {@code sql/}
     * @return the statement text without comments or terminator
     * @throws IllegalStateException if there is no such resource or it cannot
     *                               be read
     */
    public static String load(String name) {
        return STATEMENTS.computeIfAbsent(name, SqlLoader::read);
    }

    private static String read(String name) {
        String path = DIRECTORY + name + SUFFIX;
        URL url = SqlLoader.class.getClassLoader().getResource(path);
        if (url == null) {
            throw new IllegalStateException("No SQL statement named '" + name + "' (" + path + ")");
        }
        try {
            return clean(Resources.toString(url, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read SQL statement '" + name + "' from " + url, e);
        }
    }

    static String clean(String text) {
        String body = StreamSupport.stream(LINES.split(text).spliterator(), false)
                .filter(line -> !line.isEmpty() && !line.startsWith("--"))
                .collect(Collectors.joining("\n"));
        return CharMatcher.is(';').trimTrailingFrom(body).trim();
    }
}
