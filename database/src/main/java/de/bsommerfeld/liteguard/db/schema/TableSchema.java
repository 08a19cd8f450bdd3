package de.bsommerfeld.liteguard.db.schema;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered column layout of a table. Column order is declaration order and is
 * kept in the generated {@code CREATE TABLE} statement.
 */
public final class TableSchema {

    private final ImmutableMap<String, ColumnDefinition> columns;

    private TableSchema(ImmutableMap<String, ColumnDefinition> columns) {
        this.columns = columns;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, ColumnDefinition> columns() {
        return columns;
    }

    public Set<String> columnNames() {
        return columns.keySet();
    }

    public Optional<ColumnDefinition> column(String name) {
        return Optional.ofNullable(columns.get(name));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TableSchema))
            return false;
        TableSchema other = (TableSchema) o;
        // ImmutableMap equality ignores order, the layout does not
        return columns.equals(other.columns)
                && columns.keySet().asList().equals(other.columns.keySet().asList());
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "TableSchema" + columns;
    }

    public static final class Builder {

        private final ImmutableMap.Builder<String, ColumnDefinition> columns = ImmutableMap.builder();
        private int count;

        private Builder() {
        }

        public Builder column(String name, ColumnDefinition definition) {
            columns.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(definition, "definition"));
            count++;
            return this;
        }

        public Builder column(String name, SqlType type) {
            return column(name, ColumnDefinition.of(type));
        }

        /**
         * @throws IllegalStateException if no column was added
         * @throws IllegalArgumentException if a column name was added twice
         */
        public TableSchema build() {
            if (count == 0) {
                throw new IllegalStateException("A table needs at least one column");
            }
            return new TableSchema(columns.buildOrThrow());
        }
    }
}
