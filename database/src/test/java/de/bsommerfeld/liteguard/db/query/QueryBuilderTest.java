package de.bsommerfeld.liteguard.db.query;

import de.bsommerfeld.liteguard.db.ValidationException;
import de.bsommerfeld.liteguard.db.schema.ColumnDefinition;
import de.bsommerfeld.liteguard.db.schema.ForeignKey;
import de.bsommerfeld.liteguard.db.schema.ReferentialAction;
import de.bsommerfeld.liteguard.db.schema.SqlType;
import de.bsommerfeld.liteguard.db.schema.TableSchema;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class QueryBuilderTest {

    // -- WHERE --

    @Test
    void whereClause_shouldBeEmptyForNoConditions() {
        SqlStatement where = QueryBuilder.whereClause(List.of());

        assertEquals("", where.sql());
        assertTrue(where.parameters().isEmpty());
    }

    @Test
    void whereClause_shouldIgnoreConnectiveOfFirstCondition() {
        SqlStatement where = QueryBuilder.whereClause(List.of(Condition.or("a", Operator.EQ, 1)));

        assertEquals(" WHERE (a = ?)", where.sql());
        assertEquals(List.of(1), where.parameters());
    }

    @Test
    void whereClause_shouldTakeConnectiveFromTheJoinedCondition() {
        SqlStatement where = QueryBuilder.whereClause(List.of(
                Condition.where("a", Operator.EQ, 1),
                Condition.or("b", Operator.GT, 2),
                Condition.and("c", Operator.LIKE, "x%")));

        assertEquals(" WHERE (a = ?) OR (b > ?) AND (c LIKE ?)", where.sql());
        assertEquals(List.of(1, 2, "x%"), where.parameters());
    }

    @Test
    void whereClause_shouldRejectUnsafeColumn() {
        assertThrows(ValidationException.class,
                () -> QueryBuilder.whereClause(List.of(Condition.where("a = 1 OR 1", Operator.EQ, 1))));
    }

    @Test
    void whereClause_shouldRejectUnsupportedValueType() {
        assertThrows(ValidationException.class,
                () -> QueryBuilder.whereClause(List.of(Condition.where("a", Operator.EQ, new Object()))));
    }

    @Test
    void whereClause_shouldAcceptBigIntegerWithinLongRange() {
        BigInteger max = BigInteger.valueOf(Long.MAX_VALUE);
        BigInteger min = BigInteger.valueOf(Long.MIN_VALUE);

        SqlStatement where = QueryBuilder.whereClause(List.of(
                Condition.where("a", Operator.LE, max), Condition.and("a", Operator.GE, min)));

        assertEquals(List.of(max, min), where.parameters());
    }

    @Test
    void whereClause_shouldRejectBigIntegerBeyond64Bits() {
        BigInteger tooLarge = BigInteger.TWO.pow(64).add(BigInteger.ONE);

        ValidationException e = assertThrows(ValidationException.class,
                () -> QueryBuilder.whereClause(List.of(Condition.where("a", Operator.EQ, tooLarge))));
        assertTrue(e.getMessage().contains("exceeds 64 bits"));
    }

    @Test
    void whereClause_shouldRejectUnknownNumberType() {
        assertThrows(ValidationException.class,
                () -> QueryBuilder.whereClause(List.of(Condition.where("a", Operator.EQ, new AtomicLong(1)))));
    }

    @Test
    void whereClause_shouldPassBigDecimalThrough() {
        BigDecimal amount = new BigDecimal("0.1000000000000000055511151231257827");

        assertEquals(List.of(amount),
                QueryBuilder.whereClause(List.of(Condition.where("a", Operator.EQ, amount))).parameters());
    }

    // -- SELECT --

    @Test
    void select_shouldOmitLimitAndOffsetWhenNotPositive() {
        SqlStatement select = QueryBuilder.select("t", List.of("*"), List.of(), 0, -5);

        assertEquals("SELECT * FROM t", select.sql());
        assertTrue(select.parameters().isEmpty());
    }

    @Test
    void select_shouldOmitNegativeLimit() {
        SqlStatement select = QueryBuilder.select("t", List.of("a"), List.of(), -1, 0);

        assertFalse(select.sql().contains("LIMIT"));
        assertFalse(select.sql().contains("OFFSET"));
    }

    @Test
    void select_shouldBindLimitAndOffsetAfterConditions() {
        SqlStatement select = QueryBuilder.select("t", List.of("a", "b"),
                List.of(Condition.where("a", Operator.GE, 3)), 10, 20);

        assertEquals("SELECT a, b FROM t WHERE (a >= ?) LIMIT ? OFFSET ?", select.sql());
        assertEquals(List.of(3, 10, 20), select.parameters());
    }

    @Test
    void select_shouldUseUnboundedLimitForOffsetAlone() {
        SqlStatement select = QueryBuilder.select("t", List.of("a"), List.of(), 0, 5);

        assertEquals("SELECT a FROM t LIMIT -1 OFFSET ?", select.sql());
        assertEquals(List.of(5), select.parameters());
    }

    @Test
    void select_shouldRejectEmptyColumnList() {
        assertThrows(ValidationException.class, () -> QueryBuilder.select("t", List.of(), List.of(), 0, 0));
    }

    @Test
    void select_shouldRejectInjectedTableName() {
        assertThrows(ValidationException.class,
                () -> QueryBuilder.select("t; DROP TABLE t", List.of("*"), List.of(), 0, 0));
    }

    // -- INSERT --

    @Test
    void insert_shouldEmitOneTuplePerRow() {
        SqlStatement insert = QueryBuilder.insert("t",
                List.of(row("id", 1, "v", "a"), row("id", 2, "v", "b")), null);

        assertEquals("INSERT INTO t (id, v) VALUES (?, ?), (?, ?)", insert.sql());
        assertEquals(List.of(1, "a", 2, "b"), insert.parameters());
    }

    @Test
    void insert_shouldFollowFirstRowColumnOrderForEveryRow() {
        Map<String, Object> reversed = row("v", "b", "id", 2);
        SqlStatement insert = QueryBuilder.insert("t", List.of(row("id", 1, "v", "a"), reversed), null);

        assertEquals(List.of(1, "a", 2, "b"), insert.parameters());
    }

    @Test
    void insert_shouldRejectEmptyRowSet() {
        assertThrows(ValidationException.class, () -> QueryBuilder.insert("t", List.of(), null));
    }

    @Test
    void insert_shouldRejectHeterogeneousRows() {
        assertThrows(ValidationException.class,
                () -> QueryBuilder.insert("t", List.of(row("id", 1, "v", "a"), row("id", 2, "w", "b")), null));
    }

    @Test
    void insert_shouldAllowNullValues() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", 1);
        row.put("note", null);

        SqlStatement insert = QueryBuilder.insert("t", List.of(row), null);

        assertEquals(2, insert.parameters().size());
        assertNull(insert.parameters().get(1));
    }

    @Test
    void insert_shouldRejectBigIntegerBeyond64Bits() {
        BigInteger tooSmall = BigInteger.TWO.pow(63).negate().subtract(BigInteger.ONE);

        assertThrows(ValidationException.class,
                () -> QueryBuilder.insert("t", List.of(row("id", tooSmall)), null));
    }

    @Test
    void insert_shouldUseResolutionAlgorithmForIgnore() {
        SqlStatement insert = QueryBuilder.insert("t", List.of(row("id", 1)),
                ConflictClause.of(ConflictAction.IGNORE));

        assertEquals("INSERT OR IGNORE INTO t (id) VALUES (?)", insert.sql());
    }

    @Test
    void insert_shouldUseResolutionAlgorithmForReplace() {
        SqlStatement insert = QueryBuilder.insert("t", List.of(row("id", 1)),
                ConflictClause.on(ConflictAction.REPLACE, "id"));

        assertEquals("INSERT OR REPLACE INTO t (id) VALUES (?)", insert.sql());
    }

    @Test
    void insert_shouldRenderDoNothingWithTarget() {
        SqlStatement insert = QueryBuilder.insert("t", List.of(row("id", 1, "v", "a")),
                ConflictClause.on(ConflictAction.NOTHING, "id"));

        assertEquals("INSERT INTO t (id, v) VALUES (?, ?) ON CONFLICT (id) DO NOTHING", insert.sql());
    }

    @Test
    void insert_shouldRenderDoUpdateForNonTargetColumns() {
        SqlStatement insert = QueryBuilder.insert("t", List.of(row("id", 1, "v", "a", "w", 2)),
                ConflictClause.on(ConflictAction.UPDATE, "id"));

        assertEquals("INSERT INTO t (id, v, w) VALUES (?, ?, ?) ON CONFLICT (id) DO UPDATE SET "
                + "v = excluded.v, w = excluded.w", insert.sql());
    }

    @Test
    void insert_shouldRejectUnsafeConflictTarget() {
        assertThrows(ValidationException.class, () -> QueryBuilder.insert("t", List.of(row("id", 1)),
                ConflictClause.on(ConflictAction.NOTHING, "id) DO NOTHING; --")));
    }

    // -- UPDATE / DELETE --

    @Test
    void update_shouldOrderSetValuesBeforeConditionValues() {
        SqlStatement update = QueryBuilder.update("t", row("v", "new", "w", 7),
                List.of(Condition.where("id", Operator.EQ, 1), Condition.or("id", Operator.EQ, 2)));

        assertEquals("UPDATE t SET v = ?, w = ? WHERE (id = ?) OR (id = ?)", update.sql());
        assertEquals(List.of("new", 7, 1, 2), update.parameters());
    }

    @Test
    void update_shouldRejectEmptyRow() {
        assertThrows(ValidationException.class, () -> QueryBuilder.update("t", Map.of(), List.of()));
    }

    @Test
    void delete_shouldAppendWhereClause() {
        SqlStatement delete = QueryBuilder.delete("t", List.of(Condition.where("id", Operator.NE, 3)));

        assertEquals("DELETE FROM t WHERE (id != ?)", delete.sql());
        assertEquals(List.of(3), delete.parameters());
    }

    // -- DDL --

    @Test
    void createTable_shouldRenderModifiersInFixedOrder() {
        TableSchema schema = TableSchema.builder()
                .column("id", ColumnDefinition.of(SqlType.INTEGER).asPrimaryKey().asNotNull())
                .column("name", ColumnDefinition.of(SqlType.TEXT).asNotNull().defaultValue("it's"))
                .column("owner", ColumnDefinition.of(SqlType.INTEGER)
                        .references(new ForeignKey("users", "id").onDelete(ReferentialAction.CASCADE)))
                .build();

        SqlStatement create = QueryBuilder.createTable("items", schema);

        assertEquals("CREATE TABLE IF NOT EXISTS items ("
                + "id INTEGER NOT NULL PRIMARY KEY, "
                + "name TEXT NOT NULL DEFAULT 'it''s', "
                + "owner INTEGER REFERENCES users(id) ON DELETE CASCADE ON UPDATE NO ACTION)",
                create.sql());
        assertTrue(create.parameters().isEmpty());
    }

    @Test
    void createTable_shouldRejectUnsafeForeignKeyTarget() {
        TableSchema schema = TableSchema.builder()
                .column("owner", ColumnDefinition.of(SqlType.INTEGER)
                        .references(new ForeignKey("users(id); --", "id")))
                .build();

        assertThrows(ValidationException.class, () -> QueryBuilder.createTable("items", schema));
    }

    @Test
    void dropTable_shouldUseIfExists() {
        assertEquals("DROP TABLE IF EXISTS items", QueryBuilder.dropTable("items").sql());
    }

    @Test
    void literal_shouldEncodeScalars() {
        assertEquals("NULL", QueryBuilder.literal(null));
        assertEquals("TRUE", QueryBuilder.literal(true));
        assertEquals("42", QueryBuilder.literal(42L));
        assertEquals("1.5", QueryBuilder.literal(1.5));
        assertEquals("'a''b'", QueryBuilder.literal("a'b"));
    }

    @Test
    void literal_shouldEncodeBigNumbersInFull() {
        assertEquals("9223372036854775807", QueryBuilder.literal(BigInteger.valueOf(Long.MAX_VALUE)));
        assertEquals("0.00000001", QueryBuilder.literal(new BigDecimal("1E-8")));
    }

    @Test
    void literal_shouldRejectBigIntegerBeyond64Bits() {
        assertThrows(ValidationException.class, () -> QueryBuilder.literal(BigInteger.TWO.pow(64)));
    }

    @Test
    void literal_shouldRejectNonFiniteNumbers() {
        assertThrows(ValidationException.class, () -> QueryBuilder.literal(Double.NaN));
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
