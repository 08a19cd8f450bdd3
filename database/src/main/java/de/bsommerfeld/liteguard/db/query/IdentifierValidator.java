package de.bsommerfeld.liteguard.db.query;

import de.bsommerfeld.liteguard.db.ValidationException;

import java.util.regex.Pattern;

/**
 * Character check for identifiers that end up verbatim in SQL text. Values
 * never pass through here; they are always bound as parameters.
 *
 * <p>
 * Three shapes are accepted:
 * <ul>
 * <li>letters, digits, underscore and whitespace ({@code user_id})</li>
 * <li>the same, followed by exactly one trailing {@code *} ({@code *})</li>
 * <li>a parenthesized, comma-separated list ({@code (a, b)})</li>
 * </ul>
 * Quotes, semicolons, comment markers, dots and operators never pass.
 */
public final class IdentifierValidator {

    private static final Pattern PLAIN = Pattern.compile("^[a-zA-Z0-9_\\s]+$");
    private static final Pattern STAR = Pattern.compile("^[a-zA-Z0-9_\\s]*\\*$");
    private static final Pattern TUPLE = Pattern.compile("^\\([a-zA-Z0-9_,\\s]+\\)$");

    private IdentifierValidator() {
    }

    public static boolean isValidIdentifier(String text) {
        if (text == null || text.isEmpty())
            return false;
        return PLAIN.matcher(text).matches()
                || STAR.matcher(text).matches()
                || TUPLE.matcher(text).matches();
    }

    /**
     * Letters, digits, underscore and whitespace only. Used where a star or a
     * column list makes no sense, such as a database file stem.
     */
    public static boolean isPlainIdentifier(String text) {
        return text != null && PLAIN.matcher(text).matches();
    }

    /**
     * Like {@link #requireValid(String, String)}, restricted to
     * {@link #isPlainIdentifier(String)}.
     */
    public static String requirePlain(String text, String kind) {
        if (!isPlainIdentifier(text)) {
            throw new ValidationException("Invalid characters in " + kind + ": " + text);
        }
        return text;
    }

    /**
     * @param text identifier to check
     * @param kind what the identifier names, used in the error message
     *             (e.g. {@code "table name"})
     * @return {@code text}, unchanged
     * @throws ValidationException if the identifier is not safe
     */
    public static String requireValid(String text, String kind) {
        if (!isValidIdentifier(text)) {
            throw new ValidationException("Invalid characters in " + kind + ": " + text);
        }
        return text;
    }
}
