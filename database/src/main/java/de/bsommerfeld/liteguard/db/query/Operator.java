package de.bsommerfeld.liteguard.db.query;

/** Comparison operators allowed in a {@link Condition}. */
public enum Operator {

    EQ("="),
    GT(">"),
    LT("<"),
    GE(">="),
    LE("<="),
    NE("!="),
    LIKE("LIKE");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Resolves the textual form ({@code ">="}, {@code "like"}, ...).
     *
     * @throws IllegalArgumentException for anything outside the set
     */
    public static Operator fromSymbol(String symbol) {
        for (Operator op : values()) {
            if (op.symbol.equalsIgnoreCase(symbol))
                return op;
        }
        throw new IllegalArgumentException("Unsupported comparison operator: " + symbol);
    }
}
