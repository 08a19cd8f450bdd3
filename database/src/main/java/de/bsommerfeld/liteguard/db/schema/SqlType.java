package de.bsommerfeld.liteguard.db.schema;

/**
 * Column types accepted in a {@link TableSchema}. SQLite maps
 * {@code BOOLEAN} to numeric affinity, stored as {@code 0}/{@code 1}.
 */
public enum SqlType {
    NULL,
    INTEGER,
    REAL,
    TEXT,
    BOOLEAN
}
