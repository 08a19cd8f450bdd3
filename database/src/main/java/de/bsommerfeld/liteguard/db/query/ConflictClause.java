package de.bsommerfeld.liteguard.db.query;

import java.util.List;
import java.util.Objects;

/**
 * Conflict policy of an insert.
 *
 * @param action what to do on conflict
 * @param target conflict target columns; only used by upsert actions, empty
 *               to match any uniqueness constraint
 */
public record ConflictClause(ConflictAction action, List<String> target) {

    public ConflictClause {
        Objects.requireNonNull(action, "action");
        target = target == null ? List.of() : List.copyOf(target);
    }

    public static ConflictClause of(ConflictAction action) {
        return new ConflictClause(action, List.of());
    }

    public static ConflictClause on(ConflictAction action, String... columns) {
        return new ConflictClause(action, List.of(columns));
    }
}
