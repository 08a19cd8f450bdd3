package de.bsommerfeld.liteguard.db.query;

import java.util.Objects;

/**
 * One predicate of a {@code WHERE} chain: {@code (column operator ?)} with
 * {@code value} bound to the placeholder.
 *
 * <p>
 * The connective links this condition to the previous one and is ignored on
 * the first condition of a chain. Chains are evaluated left to right with no
 * grouping beyond the parentheses around each predicate, so
 * {@code [a, OR b, AND c]} reads as {@code (a) OR (b) AND (c)} with SQL's
 * usual precedence.
 *
 * @param column     column name, validated before use
 * @param operator   comparison operator
 * @param value      compared value: {@code null}, {@link String},
 *                   {@link Number} or {@link Boolean}
 * @param connective link to the previous condition
 */
public record Condition(String column, Operator operator, Object value, Connective connective) {

    public Condition {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(connective, "connective");
    }

    /** Condition meant to open a chain; its connective is irrelevant. */
    public static Condition where(String column, Operator operator, Object value) {
        return new Condition(column, operator, value, Connective.AND);
    }

    public static Condition and(String column, Operator operator, Object value) {
        return new Condition(column, operator, value, Connective.AND);
    }

    public static Condition or(String column, Operator operator, Object value) {
        return new Condition(column, operator, value, Connective.OR);
    }
}
