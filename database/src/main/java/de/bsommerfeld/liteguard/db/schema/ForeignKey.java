package de.bsommerfeld.liteguard.db.schema;

import java.util.Objects;

/**
 * {@code REFERENCES} constraint of a single column.
 *
 * @param references referenced table
 * @param column     referenced column in {@code references}
 * @param onDelete   action when the referenced row is deleted
 * @param onUpdate   action when the referenced key changes
 */
public record ForeignKey(String references, String column, ReferentialAction onDelete,
        ReferentialAction onUpdate) {

    public ForeignKey {
        Objects.requireNonNull(references, "references");
        Objects.requireNonNull(column, "column");
        onDelete = onDelete == null ? ReferentialAction.NO_ACTION : onDelete;
        onUpdate = onUpdate == null ? ReferentialAction.NO_ACTION : onUpdate;
    }

    /** Reference with {@code NO ACTION} on both delete and update. */
    public ForeignKey(String references, String column) {
        this(references, column, ReferentialAction.NO_ACTION, ReferentialAction.NO_ACTION);
    }

    public ForeignKey onDelete(ReferentialAction action) {
        return new ForeignKey(references, column, action, onUpdate);
    }

    public ForeignKey onUpdate(ReferentialAction action) {
        return new ForeignKey(references, column, onDelete, action);
    }
}
