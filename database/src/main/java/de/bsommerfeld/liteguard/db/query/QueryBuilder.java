package de.bsommerfeld.liteguard.db.query;

import com.google.common.base.Joiner;
import de.bsommerfeld.liteguard.db.ValidationException;
import de.bsommerfeld.liteguard.db.schema.ColumnDefinition;
import de.bsommerfeld.liteguard.db.schema.ForeignKey;
import de.bsommerfeld.liteguard.db.schema.TableSchema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static de.bsommerfeld.liteguard.db.query.IdentifierValidator.requireValid;

/**
 * Turns structured descriptions into {@link SqlStatement}s.
 *
 * <p>
 * Identifiers are checked with {@link IdentifierValidator} before they are
 * concatenated; values always become placeholders, except column defaults,
 * which SQLite only accepts as literals and which are encoded by
 * {@link #literal(Object)}. Every builder method fails with a
 * {@link ValidationException} before producing any text when its input is
 * unsafe or inconsistent.
 */
public final class QueryBuilder {

    private static final Joiner COMMA = Joiner.on(", ");

    private QueryBuilder() {
    }

    // =====================================================================
    // Schema
    // =====================================================================

    /**
     * {@code CREATE TABLE IF NOT EXISTS}. Each column renders as
     * {@code name TYPE [NOT NULL] [PRIMARY KEY] [DEFAULT lit] [REFERENCES ...]}
     * in exactly that order.
     */
    public static SqlStatement createTable(String table, TableSchema schema) {
        requireValid(table, "table name");

        List<String> definitions = new ArrayList<>();
        for (Map.Entry<String, ColumnDefinition> entry : schema.columns().entrySet()) {
            definitions.add(columnDefinition(entry.getKey(), entry.getValue()));
        }
        return SqlStatement.of("CREATE TABLE IF NOT EXISTS " + table + " (" + COMMA.join(definitions) + ")");
    }

    private static String columnDefinition(String name, ColumnDefinition column) {
        StringBuilder sb = new StringBuilder(requireValid(name, "column name"))
                .append(' ').append(column.type().name());
        if (column.notNull())
            sb.append(" NOT NULL");
        if (column.primaryKey())
            sb.append(" PRIMARY KEY");
        if (column.hasDefault())
            sb.append(" DEFAULT ").append(literal(column.defaultValue()));
        if (column.foreignKey() != null) {
            ForeignKey fk = column.foreignKey();
            sb.append(" REFERENCES ")
                    .append(requireValid(fk.references(), "foreign key table"))
                    .append('(').append(requireValid(fk.column(), "foreign key column")).append(')')
                    .append(" ON DELETE ").append(fk.onDelete().sql())
                    .append(" ON UPDATE ").append(fk.onUpdate().sql());
        }
        return sb.toString();
    }

    public static SqlStatement dropTable(String table) {
        return SqlStatement.of("DROP TABLE IF EXISTS " + requireValid(table, "table name"));
    }

    // =====================================================================
    // Rows
    // =====================================================================

    /**
     * {@code SELECT cols FROM table [WHERE ...] [LIMIT ?] [OFFSET ?]}.
     *
     * <p>
     * A {@code limit} or {@code offset} of zero or less means "not set" and
     * emits no clause. SQLite has no standalone {@code OFFSET}, so an offset
     * without a limit is written as {@code LIMIT -1 OFFSET ?}.
     */
    public static SqlStatement select(String table, List<String> columns, List<Condition> conditions,
            int limit, int offset) {
        requireValid(table, "table name");
        if (columns.isEmpty()) {
            throw new ValidationException("No columns selected from " + table);
        }
        for (String column : columns)
            requireValid(column, "column name");

        SqlStatement where = whereClause(conditions);
        List<Object> params = new ArrayList<>(where.parameters());
        StringBuilder sql = new StringBuilder("SELECT ").append(COMMA.join(columns))
                .append(" FROM ").append(table).append(where.sql());

        if (limit > 0) {
            sql.append(" LIMIT ?");
            params.add(limit);
        } else if (offset > 0) {
            sql.append(" LIMIT -1");
        }
        if (offset > 0) {
            sql.append(" OFFSET ?");
            params.add(offset);
        }
        return new SqlStatement(sql.toString(), params);
    }

    /**
     * One {@code INSERT} with a {@code VALUES} tuple per row. The column list
     * comes from the first row; every other row must carry the same key set.
     *
     * @param conflict conflict policy, {@code null} for none
     */
    public static SqlStatement insert(String table, List<Map<String, Object>> rows, ConflictClause conflict) {
        requireValid(table, "table name");
        if (rows.isEmpty()) {
            throw new ValidationException("Cannot insert an empty row set into " + table);
        }
        Map<String, Object> first = rows.get(0);
        if (first.isEmpty()) {
            throw new ValidationException("Cannot insert a row without columns into " + table);
        }
        List<String> columns = new ArrayList<>(first.keySet());
        for (String column : columns)
            requireValid(column, "column name");

        Set<String> expected = first.keySet();
        String tuple = "(" + COMMA.join(Collections.nCopies(columns.size(), "?")) + ")";
        List<String> tuples = new ArrayList<>(rows.size());
        List<Object> params = new ArrayList<>(rows.size() * columns.size());
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            if (!row.keySet().equals(expected)) {
                throw new ValidationException("Row " + i + " of insert into " + table
                        + " has columns " + row.keySet() + ", expected " + expected);
            }
            for (String column : columns)
                params.add(value(row.get(column), column));
            tuples.add(tuple);
        }

        String verb = conflict != null && !conflict.action().isUpsert()
                ? "INSERT OR " + conflict.action().name() + " INTO "
                : "INSERT INTO ";
        String sql = verb + table + " (" + COMMA.join(columns) + ") VALUES " + COMMA.join(tuples)
                + upsertClause(conflict, columns);
        return new SqlStatement(sql, params);
    }

    private static String upsertClause(ConflictClause conflict, List<String> columns) {
        if (conflict == null || !conflict.action().isUpsert())
            return "";

        for (String column : conflict.target())
            requireValid(column, "conflict target");
        String target = conflict.target().isEmpty() ? "" : " (" + COMMA.join(conflict.target()) + ")";

        if (conflict.action() == ConflictAction.NOTHING)
            return " ON CONFLICT" + target + " DO NOTHING";

        List<String> assignments = columns.stream()
                .filter(c -> !conflict.target().contains(c))
                .map(c -> c + " = excluded." + c)
                .collect(Collectors.toList());
        // every inserted column is part of the target, nothing left to update
        if (assignments.isEmpty())
            return " ON CONFLICT" + target + " DO NOTHING";
        return " ON CONFLICT" + target + " DO UPDATE SET " + COMMA.join(assignments);
    }

    /**
     * {@code UPDATE table SET a = ?, ... [WHERE ...]}. Parameters are the SET
     * values followed by the condition values, matching placeholder order.
     */
    public static SqlStatement update(String table, Map<String, Object> row, List<Condition> conditions) {
        requireValid(table, "table name");
        if (row.isEmpty()) {
            throw new ValidationException("Nothing to update in " + table);
        }
        List<String> assignments = new ArrayList<>(row.size());
        List<Object> params = new ArrayList<>(row.size() + conditions.size());
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            assignments.add(requireValid(entry.getKey(), "column name") + " = ?");
            params.add(value(entry.getValue(), entry.getKey()));
        }
        SqlStatement where = whereClause(conditions);
        params.addAll(where.parameters());
        return new SqlStatement("UPDATE " + table + " SET " + COMMA.join(assignments) + where.sql(), params);
    }

    /** {@code DELETE FROM table [WHERE ...]}; no conditions deletes every row. */
    public static SqlStatement delete(String table, List<Condition> conditions) {
        requireValid(table, "table name");
        SqlStatement where = whereClause(conditions);
        return new SqlStatement("DELETE FROM " + table + where.sql(), where.parameters());
    }

    /**
     * {@code " WHERE (c1 op ?) CONN (c2 op ?) ..."}, or the empty string for no
     * conditions. The connective of element <i>i</i> joins it to element
     * <i>i-1</i>; the first element's connective is dropped.
     */
    public static SqlStatement whereClause(List<Condition> conditions) {
        if (conditions.isEmpty())
            return SqlStatement.of("");

        StringBuilder sql = new StringBuilder(" WHERE ");
        List<Object> params = new ArrayList<>(conditions.size());
        for (int i = 0; i < conditions.size(); i++) {
            Condition condition = conditions.get(i);
            requireValid(condition.column(), "column name");
            if (i > 0)
                sql.append(' ').append(condition.connective().name()).append(' ');
            sql.append('(').append(condition.column()).append(' ')
                    .append(condition.operator().symbol()).append(" ?)");
            params.add(value(condition.value(), condition.column()));
        }
        return new SqlStatement(sql.toString(), params);
    }

    // =====================================================================
    // Values
    // =====================================================================

    /**
     * Encodes a scalar as a SQL literal for {@code DEFAULT} clauses. Strings
     * are single-quoted with embedded quotes doubled; booleans become
     * {@code TRUE}/{@code FALSE}; non-finite numbers are rejected.
     */
    public static String literal(Object value) {
        if (value == null)
            return "NULL";
        if (value instanceof Boolean)
            return ((Boolean) value) ? "TRUE" : "FALSE";
        if (value instanceof String)
            return "'" + ((String) value).replace("'", "''") + "'";
        if (value instanceof BigDecimal)
            return ((BigDecimal) value).toPlainString();
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new ValidationException("Default value is not a finite number: " + value);
            }
            return Double.toString(d);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte)
            return value.toString();
        if (value instanceof BigInteger)
            return requireInt64((BigInteger) value, "default value").toString();
        throw new ValidationException("Unsupported default value type: " + value.getClass().getName());
    }

    /**
     * Accepts {@code null}, strings, booleans and the numeric types the binder
     * knows: the boxed primitives, {@link BigInteger} within 64 bits and
     * {@link BigDecimal}. Other {@link Number} implementations are rejected.
     */
    private static Object value(Object value, String column) {
        if (value == null || value instanceof String || value instanceof Boolean
                || value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof Double || value instanceof Float
                || value instanceof BigDecimal)
            return value;
        if (value instanceof BigInteger)
            return requireInt64((BigInteger) value, "value for column " + column);
        throw new ValidationException("Unsupported value type for column " + column + ": "
                + value.getClass().getName());
    }

    private static BigInteger requireInt64(BigInteger value, String what) {
        if (value.bitLength() > 63) {
            throw new ValidationException("Integer " + what + " exceeds 64 bits: " + value);
        }
        return value;
    }
}
