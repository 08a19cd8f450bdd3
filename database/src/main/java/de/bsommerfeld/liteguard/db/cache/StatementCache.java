package de.bsommerfeld.liteguard.db.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

/**
 * Prepared statements keyed by their exact SQL text.
 *
 * <h3>Eviction</h3>
 * There is no recency tracking. When a new statement would push the cache
 * past {@code maxEntries}, every resident statement is closed and the map is
 * cleared before the new one is recorded. The resident count therefore never
 * exceeds {@code maxEntries}, at the price of a cold cache after each flush.
 *
 * <h3>Ownership</h3>
 * Recorded statements belong to the cache and are closed only by
 * {@link #evictAll()}. Callers must not close a statement they obtained from
 * {@link #get(String)}.
 *
 * <p>
 * Not thread-safe; the owning database serializes access.
 */
public class StatementCache {

    private static final Logger LOG = LoggerFactory.getLogger(StatementCache.class);

    private final int maxEntries;
    private final Map<String, PreparedStatement> statements = new HashMap<>();
    private long evictions;

    /**
     * @param maxEntries resident statement bound, must be positive
     */
    public StatementCache(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, was " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    /** @return the statement prepared for {@code sql}, or {@code null} */
    public PreparedStatement get(String sql) {
        return statements.get(sql);
    }

    /**
     * Records a freshly prepared statement, flushing the cache first if it is
     * full. A statement already cached under the same text is replaced and
     * closed.
     */
    public void put(String sql, PreparedStatement statement) {
        if (!statements.containsKey(sql) && statements.size() >= maxEntries) {
            LOG.info("Statement cache reached {} entries, flushing.", statements.size());
            evictAll();
        }
        PreparedStatement previous = statements.put(sql, statement);
        if (previous != null && previous != statement) {
            close(previous, sql);
        }
    }

    /**
     * Closes every cached statement and empties the cache. A statement that
     * fails to close is logged; the remaining ones are still closed.
     *
     * @return number of statements that closed cleanly
     */
    public int evictAll() {
        int closed = 0;
        for (Map.Entry<String, PreparedStatement> entry : statements.entrySet()) {
            if (close(entry.getValue(), entry.getKey()))
                closed++;
        }
        statements.clear();
        evictions++;
        return closed;
    }

    private boolean close(PreparedStatement statement, String sql) {
        try {
            statement.close();
            return true;
        } catch (SQLException e) {
            LOG.warn("Failed to finalize cached statement [{}]: {}", sql, e.getMessage());
            return false;
        }
    }

    public int size() {
        return statements.size();
    }

    public int maxEntries() {
        return maxEntries;
    }

    /** How many times the cache has been flushed. */
    public long evictionCount() {
        return evictions;
    }
}
