package de.bsommerfeld.liteguard.db;

import java.sql.SQLException;

/**
 * Wraps a failure reported by SQLite (constraint violation, syntax, I/O)
 * together with the operation and table it happened in.
 */
public class EngineException extends DatabaseException {

    private final String operation;
    private final String table;

    public EngineException(String operation, String table, SQLException cause) {
        super(describe(operation, table, cause), cause);
        this.operation = operation;
        this.table = table;
    }

    public String getOperation() {
        return operation;
    }

    /** Table involved, {@code null} for database-wide operations. */
    public String getTable() {
        return table;
    }

    private static String describe(String operation, String table, SQLException cause) {
        String target = table == null ? "" : " on \"" + table + "\"";
        return operation + " failed" + target + ": " + cause.getMessage();
    }
}
