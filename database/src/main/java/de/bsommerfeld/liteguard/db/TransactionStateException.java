package de.bsommerfeld.liteguard.db;

import java.sql.SQLException;

/**
 * Raised when {@code BEGIN}, {@code COMMIT} or {@code ROLLBACK} is rejected
 * by the engine, typically because a transaction is already open or none is.
 */
public class TransactionStateException extends DatabaseException {

    public TransactionStateException(String message, SQLException cause) {
        super(message, cause);
    }
}
