package de.bsommerfeld.liteguard.db;

import de.bsommerfeld.liteguard.core.config.DatabaseConfig;
import de.bsommerfeld.liteguard.core.lifecycle.ShutdownRegistrar;
import de.bsommerfeld.liteguard.db.cache.StatementCache;
import de.bsommerfeld.liteguard.db.query.Condition;
import de.bsommerfeld.liteguard.db.query.ConflictClause;
import de.bsommerfeld.liteguard.db.query.IdentifierValidator;
import de.bsommerfeld.liteguard.db.query.QueryBuilder;
import de.bsommerfeld.liteguard.db.query.SqlStatement;
import de.bsommerfeld.liteguard.db.schema.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Access point for one SQLite database file, {@code <directory>/<name>.db}.
 *
 * <p>
 * Owns the single {@link Connection}, the {@link StatementCache} and the
 * registry of tables created through {@link #prepareTable}. Instances are
 * independent of each other; nothing is shared across files.
 *
 * <h3>Execution model</h3>
 * Row and schema operations return a {@link CompletableFuture}, but the work
 * runs synchronously on the caller's thread and the future is already
 * complete on return. Failures are never thrown from these methods: they
 * complete the future exceptionally with a {@link DatabaseException} and are
 * logged. The object stays usable after any failure.
 *
 * <p>
 * There is no locking here. SQLite serializes writes itself; callers that
 * invoke one instance from several threads at once must synchronize
 * externally, since the statement cache is not thread-safe.
 *
 * <h3>Table existence</h3>
 * {@link #select} and {@link #delete} ask the engine catalog before running.
 * {@link #insert}, {@link #update} and {@link #deleteTable} only consult the
 * in-memory registry, which does not notice tables dropped through another
 * connection. That window is accepted; the registry is never resynchronized.
 *
 * <h3>Transactions</h3>
 * {@link #beginTransaction}, {@link #commitTransaction} and
 * {@link #rollbackTransaction} forward straight to the engine without
 * tracking nesting. Pair them at the call site, or use
 * {@link #inTransaction}.
 *
 * <h3>Lifecycle</h3>
 * The constructor opens the connection, enables foreign keys and registers
 * {@link #close()} with the given {@link ShutdownRegistrar}. Closing is
 * single-shot: only the first call touches the connection.
 */
public class SqliteDatabase {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteDatabase.class);

    private final String name;
    private final Path file;
    private final Connection connection;
    private final StatementCache statementCache;
    private final Map<String, TableSchema> tables = new ConcurrentHashMap<>();

    private Boolean closeOutcome;

    public SqliteDatabase(String name, Path directory, ShutdownRegistrar registrar) {
        this(name, directory, DatabaseConfig.DEFAULT_STATEMENT_CACHE_LIMIT, registrar);
    }

    public SqliteDatabase(DatabaseConfig config, ShutdownRegistrar registrar) {
        this(config.getName(), Path.of(config.getDirectory()), config.getStatementCacheLimit(), registrar);
    }

    /**
     * @param name               file stem: letters, digits, underscore and
     *                           whitespace only
     * @param directory          directory of the database file, created if
     *                           missing
     * @param statementCacheSize prepared statements kept before a flush
     * @param registrar          receives the close job
     * @throws ValidationException if {@code name} is not a safe identifier
     * @throws DatabaseException   if the directory or connection cannot be
     *                             opened
     */
    public SqliteDatabase(String name, Path directory, int statementCacheSize, ShutdownRegistrar registrar) {
        this.name = IdentifierValidator.requirePlain(name, "database name");
        this.file = directory.resolve(name + ".db");
        this.statementCache = new StatementCache(statementCacheSize);

        try {
            if (!Files.exists(directory))
                Files.createDirectories(directory);
        } catch (IOException e) {
            LOG.error("Failed to create database directory {}", directory, e);
            throw new DatabaseException("Failed to create database directory: " + directory, e);
        }

        try {
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath());
        } catch (SQLException e) {
            LOG.error("Failed to prepare database at {}: {}", file, e.getMessage());
            throw new EngineException("Open database", null, e);
        }
        LOG.info("Prepared database at {}", file);

        enableForeignKeys();
        registrar.addJob(this::close, "Close DB '" + name + "'");
    }

    private void enableForeignKeys() {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(SqlLoader.load("enable-foreign-keys"));
            LOG.info("Foreign keys are enabled.");
        } catch (SQLException e) {
            LOG.error("Failed to enable foreign keys: {}", e.getMessage());
            try {
                connection.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw new EngineException("Enable foreign keys", null, e);
        }
    }

    // =====================================================================
    // Schema
    // =====================================================================

    /**
     * Creates the table if it does not exist and registers its schema. Calling
     * this again for an existing table changes nothing in the engine; the
     * schema registered first is kept.
     */
    public CompletableFuture<Void> prepareTable(String table, TableSchema schema) {
        try {
            SqlStatement create = QueryBuilder.createTable(table, schema);
            execute(create.sql());

            TableSchema previous = tables.putIfAbsent(table, schema);
            if (previous != null && !previous.equals(schema)) {
                LOG.warn("Table \"{}\" already registered with a different schema, keeping the original.", table);
            }
            LOG.info("Table \"{}\" ready", table);
            return CompletableFuture.completedFuture(null);
        } catch (SQLException e) {
            return failed(new EngineException("Prepare table", table, e));
        } catch (DatabaseException e) {
            return failed(e);
        }
    }

    /**
     * Drops a table created through {@link #prepareTable} and forgets its
     * schema.
     */
    public CompletableFuture<Void> deleteTable(String table) {
        try {
            SqlStatement drop = QueryBuilder.dropTable(table);
            if (!tables.containsKey(table))
                return failed(new SchemaException(table, "Table " + table + " does not exist"));

            execute(drop.sql());
            tables.remove(table);
            LOG.info("Table \"{}\" deleted", table);
            return CompletableFuture.completedFuture(null);
        } catch (SQLException e) {
            return failed(new EngineException("Delete table", table, e));
        } catch (DatabaseException e) {
            return failed(e);
        }
    }

    /** Asks the engine catalog whether {@code table} exists right now. */
    public CompletableFuture<Boolean> isTableExist(String table) {
        try {
            return CompletableFuture.completedFuture(tableExists(table));
        } catch (SQLException e) {
            return failed(new EngineException("Check table", table, e));
        }
    }

    private boolean tableExists(String table) throws SQLException {
        List<Map<String, Object>> rows = runQuery(
                new SqlStatement(SqlLoader.load("table-exists"), List.of(table)));
        if (rows.isEmpty())
            return false;
        Object flag = rows.get(0).values().iterator().next();
        return flag instanceof Number && ((Number) flag).intValue() == 1;
    }

    /** Names of the tables currently in the registry. */
    public Set<String> registeredTables() {
        return Set.copyOf(tables.keySet());
    }

    public Optional<TableSchema> schemaOf(String table) {
        return Optional.ofNullable(tables.get(table));
    }

    // =====================================================================
    // Rows
    // =====================================================================

    public CompletableFuture<List<Map<String, Object>>> select(String table, List<String> columns) {
        return select(table, columns, List.of(), 0, 0);
    }

    public CompletableFuture<List<Map<String, Object>>> select(String table, List<String> columns,
            List<Condition> conditions) {
        return select(table, columns, conditions, 0, 0);
    }

    /**
     * Fetches rows matching {@code conditions}.
     *
     * @param limit  maximum rows, {@code <= 0} for no limit
     * @param offset rows to skip, {@code <= 0} for none
     * @return rows as column label to value maps, in result order
     */
    public CompletableFuture<List<Map<String, Object>>> select(String table, List<String> columns,
            List<Condition> conditions, int limit, int offset) {
        try {
            SqlStatement select = QueryBuilder.select(table, columns, conditions, limit, offset);
            if (!tableExists(table))
                return failed(new SchemaException(table, "Table " + table + " not found."));
            return CompletableFuture.completedFuture(runQuery(select));
        } catch (SQLException e) {
            return failed(new EngineException("Select", table, e));
        } catch (DatabaseException e) {
            return failed(e);
        }
    }

    public CompletableFuture<RunResult> insert(String table, List<Map<String, Object>> rows) {
        return insert(table, rows, null);
    }

    /**
     * Inserts all rows in one statement. Every row must have the key set of
     * the first one.
     *
     * @param conflict conflict policy, {@code null} for none
     */
    public CompletableFuture<RunResult> insert(String table, List<Map<String, Object>> rows,
            ConflictClause conflict) {
        try {
            SqlStatement insert = QueryBuilder.insert(table, rows, conflict);
            requireRegistered(table);
            return CompletableFuture.completedFuture(runCommand(insert));
        } catch (SQLException e) {
            return failed(new EngineException("Insert", table, e));
        } catch (DatabaseException e) {
            return failed(e);
        }
    }

    /** Sets the columns of {@code row} on every row matching {@code conditions}. */
    public CompletableFuture<RunResult> update(String table, Map<String, Object> row, List<Condition> conditions) {
        try {
            SqlStatement update = QueryBuilder.update(table, row, conditions);
            requireRegistered(table);
            return CompletableFuture.completedFuture(runCommand(update));
        } catch (SQLException e) {
            return failed(new EngineException("Update", table, e));
        } catch (DatabaseException e) {
            return failed(e);
        }
    }

    /** Deletes rows matching {@code conditions}; an empty list deletes all rows. */
    public CompletableFuture<RunResult> delete(String table, List<Condition> conditions) {
        try {
            SqlStatement delete = QueryBuilder.delete(table, conditions);
            if (!tableExists(table))
                return failed(new SchemaException(table, "Table " + table + " does not exist"));
            return CompletableFuture.completedFuture(runCommand(delete));
        } catch (SQLException e) {
            return failed(new EngineException("Delete", table, e));
        } catch (DatabaseException e) {
            return failed(e);
        }
    }

    private void requireRegistered(String table) {
        if (!tables.containsKey(table))
            throw new SchemaException(table, "Table " + table + " does not exist");
    }

    // =====================================================================
    // Transactions
    // =====================================================================

    /** @throws TransactionStateException if a transaction is already open */
    public void beginTransaction() {
        transactionControl("begin-transaction", "begin");
    }

    /** @throws TransactionStateException if no transaction is open */
    public void commitTransaction() {
        transactionControl("commit-transaction", "commit");
    }

    /** @throws TransactionStateException if no transaction is open */
    public void rollbackTransaction() {
        transactionControl("rollback-transaction", "rollback");
    }

    private void transactionControl(String resource, String verb) {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(SqlLoader.load(resource));
            LOG.debug("Transaction {} on '{}'", verb, name);
        } catch (SQLException e) {
            LOG.error("Failed to {} transaction: {}", verb, e.getMessage());
            throw new TransactionStateException("Failed to " + verb + " transaction: " + e.getMessage(), e);
        }
    }

    /**
     * Runs {@code work} between {@code BEGIN} and {@code COMMIT}. If the work
     * fails, or the commit does, the transaction is rolled back and the
     * returned future carries the original failure. A failing rollback is
     * attached to it as suppressed.
     */
    public <T> CompletableFuture<T> inTransaction(Function<SqliteDatabase, CompletableFuture<T>> work) {
        try {
            beginTransaction();
        } catch (TransactionStateException e) {
            return CompletableFuture.failedFuture(e);
        }

        try {
            T result = work.apply(this).join();
            commitTransaction();
            return CompletableFuture.completedFuture(result);
        } catch (RuntimeException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            try {
                rollbackTransaction();
            } catch (TransactionStateException rollbackFailure) {
                cause.addSuppressed(rollbackFailure);
            }
            return CompletableFuture.failedFuture(cause);
        }
    }

    // =====================================================================
    // Execution
    // =====================================================================

    private void execute(String sql) throws SQLException {
        LOG.debug("Executing: {}", sql);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
        }
    }

    /**
     * Returns the cached statement for {@code sql}, or prepares and caches a
     * new one.
     */
    private PreparedStatement prepared(String sql) throws SQLException {
        PreparedStatement cached = statementCache.get(sql);
        if (cached != null) {
            cached.clearParameters();
            return cached;
        }
        PreparedStatement statement = connection.prepareStatement(sql);
        statementCache.put(sql, statement);
        return statement;
    }

    private List<Map<String, Object>> runQuery(SqlStatement query) throws SQLException {
        LOG.debug("Query: {} {}", query.sql(), query.parameters());
        PreparedStatement ps = prepared(query.sql());
        bind(ps, query.parameters());
        try (ResultSet rs = ps.executeQuery()) {
            return mapRows(rs);
        }
    }

    private RunResult runCommand(SqlStatement command) throws SQLException {
        LOG.debug("Command: {} {}", command.sql(), command.parameters());
        PreparedStatement ps = prepared(command.sql());
        bind(ps, command.parameters());
        int changes = ps.executeUpdate();
        return new RunResult(changes, lastInsertRowId());
    }

    private long lastInsertRowId() throws SQLException {
        try (Statement stmt = connection.createStatement();
                ResultSet rs = stmt.executeQuery(SqlLoader.load("last-insert-rowid"))) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    /**
     * Binds parameters by type. Integral numbers bind as 64-bit integers
     * ({@link BigInteger} range is checked when the statement is built),
     * {@link Double} and {@link Float} as REAL. A {@link BigDecimal} binds as
     * its plain decimal text, so no digits are lost before the column
     * affinity decides how to store it.
     */
    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            int index = i + 1;
            Object value = params.get(i);
            if (value == null) {
                ps.setNull(index, Types.NULL);
            } else if (value instanceof Boolean) {
                ps.setBoolean(index, (Boolean) value);
            } else if (value instanceof BigInteger) {
                ps.setLong(index, ((BigInteger) value).longValueExact());
            } else if (value instanceof Long || value instanceof Integer || value instanceof Short
                    || value instanceof Byte) {
                ps.setLong(index, ((Number) value).longValue());
            } else if (value instanceof BigDecimal) {
                ps.setString(index, ((BigDecimal) value).toPlainString());
            } else if (value instanceof Number) {
                ps.setDouble(index, ((Number) value).doubleValue());
            } else {
                ps.setString(index, value.toString());
            }
        }
    }

    private static List<Map<String, Object>> mapRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>(columnCount * 2);
            for (int i = 1; i <= columnCount; i++) {
                row.put(meta.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }

    private <T> CompletableFuture<T> failed(DatabaseException e) {
        LOG.error("{}", e.getMessage());
        return CompletableFuture.failedFuture(e);
    }

    // =====================================================================
    // Lifecycle
    // =====================================================================

    /**
     * Finalizes every cached statement and closes the connection. Only the
     * first call does any work; later calls return its outcome.
     *
     * @return {@code true} if the connection closed cleanly
     */
    public synchronized boolean close() {
        if (closeOutcome != null)
            return closeOutcome;

        boolean ok;
        try {
            statementCache.evictAll();
            connection.close();
            LOG.info("Database '{}' closed.", name);
            ok = true;
        } catch (SQLException e) {
            LOG.error("Failed to close database: {}", e.getMessage());
            ok = false;
        }
        closeOutcome = ok;
        return ok;
    }

    public synchronized boolean isClosed() {
        return closeOutcome != null;
    }

    public String getName() {
        return name;
    }

    public Path getFile() {
        return file;
    }

    /** Prepared statements currently held by the cache. */
    public int statementCacheSize() {
        return statementCache.size();
    }

    /** How many times the statement cache has been flushed. */
    public long statementCacheFlushes() {
        return statementCache.evictionCount();
    }
}
