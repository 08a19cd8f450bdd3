package de.bsommerfeld.liteguard.db.query;

/** Logical link between a condition and the one before it. */
public enum Connective {
    AND,
    OR
}
