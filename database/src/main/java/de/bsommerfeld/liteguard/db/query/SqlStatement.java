package de.bsommerfeld.liteguard.db.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * SQL text plus the values for its placeholders, in placeholder order.
 * Parameters may contain {@code null}.
 */
public record SqlStatement(String sql, List<Object> parameters) {

    public SqlStatement {
        Objects.requireNonNull(sql, "sql");
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public static SqlStatement of(String sql) {
        return new SqlStatement(sql, List.of());
    }
}
