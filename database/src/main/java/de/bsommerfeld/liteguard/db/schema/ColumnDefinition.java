package de.bsommerfeld.liteguard.db.schema;

import java.util.Objects;
import java.util.Optional;

/**
 * Definition of one column in a {@link TableSchema}.
 *
 * <p>
 * Instances are immutable; the {@code as...} and other modifier methods
 * return copies, so a base definition can be shared:
 *
 * <pre>
 * ColumnDefinition id = ColumnDefinition.of(SqlType.INTEGER).asPrimaryKey();
 * ColumnDefinition owner = ColumnDefinition.of(SqlType.INTEGER).asNotNull()
 *         .references(new ForeignKey("users", "id").onDelete(ReferentialAction.CASCADE));
 * </pre>
 *
 * <p>
 * "No default" and "default {@code NULL}" are different states:
 * {@link #hasDefault()} separates them.
 *
 * @param type         declared column type
 * @param primaryKey   whether the column is the primary key
 * @param notNull      whether {@code NULL} is rejected
 * @param hasDefault   whether a {@code DEFAULT} clause is emitted
 * @param defaultValue literal for the {@code DEFAULT} clause, may be
 *                     {@code null} when {@code hasDefault} is set
 * @param foreignKey   reference constraint, {@code null} if none
 */
public record ColumnDefinition(SqlType type, boolean primaryKey, boolean notNull, boolean hasDefault,
        Object defaultValue, ForeignKey foreignKey) {

    public ColumnDefinition {
        Objects.requireNonNull(type, "type");
        if (!hasDefault && defaultValue != null) {
            throw new IllegalArgumentException("defaultValue given without hasDefault");
        }
    }

    public static ColumnDefinition of(SqlType type) {
        return new ColumnDefinition(type, false, false, false, null, null);
    }

    public ColumnDefinition asPrimaryKey() {
        return new ColumnDefinition(type, true, notNull, hasDefault, defaultValue, foreignKey);
    }

    public ColumnDefinition asNotNull() {
        return new ColumnDefinition(type, primaryKey, true, hasDefault, defaultValue, foreignKey);
    }

    /**
     * @param value {@code null}, a {@link String}, {@link Number} or
     *              {@link Boolean}; validated when the DDL is built
     */
    public ColumnDefinition defaultValue(Object value) {
        return new ColumnDefinition(type, primaryKey, notNull, true, value, foreignKey);
    }

    public ColumnDefinition references(ForeignKey reference) {
        return new ColumnDefinition(type, primaryKey, notNull, hasDefault, defaultValue, reference);
    }

    public Optional<ForeignKey> reference() {
        return Optional.ofNullable(foreignKey);
    }
}
