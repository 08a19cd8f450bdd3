package de.bsommerfeld.liteguard.db;

/**
 * Outcome of a data-changing statement.
 *
 * @param changes         rows inserted, updated or deleted
 * @param lastInsertRowId rowid of the most recent successful insert on the
 *                        connection; unchanged by updates and deletes
 */
public record RunResult(int changes, long lastInsertRowId) {
}
