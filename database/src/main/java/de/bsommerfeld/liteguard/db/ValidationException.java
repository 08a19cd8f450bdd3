package de.bsommerfeld.liteguard.db;

/**
 * Thrown when input cannot be turned into safe SQL: an identifier fails the
 * character check, a value has an unsupported type, or the row shape is
 * inconsistent. Nothing has been sent to the engine when this is raised.
 */
public class ValidationException extends DatabaseException {

    public ValidationException(String message) {
        super(message);
    }
}
