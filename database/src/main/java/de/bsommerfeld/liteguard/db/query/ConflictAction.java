package de.bsommerfeld.liteguard.db.query;

/**
 * What an insert does when it violates a uniqueness constraint.
 *
 * <p>
 * {@link #NOTHING} and {@link #UPDATE} are rendered as an upsert clause
 * ({@code ON CONFLICT ... DO ...}); the others select SQLite's conflict
 * resolution algorithm ({@code INSERT OR <action>}).
 */
public enum ConflictAction {

    ROLLBACK(false),
    FAIL(false),
    NOTHING(true),
    UPDATE(true),
    IGNORE(false),
    REPLACE(false);

    private final boolean upsert;

    ConflictAction(boolean upsert) {
        this.upsert = upsert;
    }

    /** Whether the action is expressed as {@code ON CONFLICT ... DO}. */
    public boolean isUpsert() {
        return upsert;
    }
}
