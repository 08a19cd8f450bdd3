package de.bsommerfeld.liteguard.db.schema;

/**
 * Action taken on referencing rows when the referenced row is deleted or its
 * key updated.
 */
public enum ReferentialAction {

    CASCADE("CASCADE"),
    SET_NULL("SET NULL"),
    NO_ACTION("NO ACTION"),
    RESTRICT("RESTRICT");

    private final String sql;

    ReferentialAction(String sql) {
        this.sql = sql;
    }

    /** The keyword sequence as it appears in DDL. */
    public String sql() {
        return sql;
    }
}
