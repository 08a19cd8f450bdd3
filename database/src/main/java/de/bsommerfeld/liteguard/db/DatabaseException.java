package de.bsommerfeld.liteguard.db;

/**
 * Base of every failure raised by {@link SqliteDatabase}. Row and schema
 * operations deliver it through a failed future; constructors and
 * transaction control throw it directly.
 */
public class DatabaseException extends RuntimeException {

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
