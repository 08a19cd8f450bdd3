package de.bsommerfeld.liteguard.db;

/**
 * Thrown when an operation targets a table that is unknown to the schema
 * registry or, for reads and deletes, missing from the engine catalog.
 */
public class SchemaException extends DatabaseException {

    private final String table;

    public SchemaException(String table, String message) {
        super(message);
        this.table = table;
    }

    public String getTable() {
        return table;
    }
}
