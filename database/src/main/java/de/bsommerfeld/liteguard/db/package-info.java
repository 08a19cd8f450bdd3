/**
 * Injection-safe access layer over a single SQLite file.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Application code]
 *          │  structured input (TableSchema, Condition, row maps)
 *          ▼
 *   SqliteDatabase      ← schema registry, lifecycle, CompletableFuture results
 *     │        │
 *     ▼        ▼
 *   QueryBuilder    StatementCache   ← exact-text keyed, full flush when full
 *     │
 *     ▼
 *   IdentifierValidator              ← every identifier, before concatenation
 * </pre>
 *
 * <h2>Safety model</h2>
 * Identifiers (tables, columns, foreign key targets, conflict targets) are the
 * only caller input that reaches SQL text, and only after passing
 * {@link de.bsommerfeld.liteguard.db.query.IdentifierValidator}. Operators,
 * connectives and conflict actions are enums and cannot carry text. Values
 * are bound as parameters; column defaults, which SQLite only accepts as
 * literals, are encoded by
 * {@link de.bsommerfeld.liteguard.db.query.QueryBuilder#literal(Object)}.
 *
 * <h2>Failure taxonomy</h2>
 * <ul>
 * <li>{@link de.bsommerfeld.liteguard.db.ValidationException}: unsafe or
 * inconsistent input, nothing sent to the engine</li>
 * <li>{@link de.bsommerfeld.liteguard.db.SchemaException}: unknown
 * table</li>
 * <li>{@link de.bsommerfeld.liteguard.db.EngineException}: SQLite rejected
 * the statement</li>
 * <li>{@link de.bsommerfeld.liteguard.db.TransactionStateException}:
 * {@code BEGIN}/{@code COMMIT}/{@code ROLLBACK} in the wrong state</li>
 * </ul>
 *
 * <h2>SQL File Inventory</h2>
 * Fixed statements live in {@code sql/*.sql}, loaded via
 * {@link de.bsommerfeld.liteguard.db.SqlLoader}:
 * <ul>
 * <li>{@code table-exists.sql}: catalog lookup in {@code sqlite_master}</li>
 * <li>{@code enable-foreign-keys.sql}: pragma run once per connection</li>
 * <li>{@code last-insert-rowid.sql}: rowid reported in
 * {@link de.bsommerfeld.liteguard.db.RunResult}</li>
 * <li>{@code begin-transaction.sql}, {@code commit-transaction.sql},
 * {@code rollback-transaction.sql}: transaction control</li>
 * </ul>
 */
package de.bsommerfeld.liteguard.db;
