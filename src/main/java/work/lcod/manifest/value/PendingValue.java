package work.lcod.manifest.value;

import java.util.Objects;
import work.lcod.manifest.schema.FieldSchema;

/**
 * Value not known yet. Stands for the whole subtree of its schema; it never has children.
 */
public record PendingValue(FieldSchema type) implements TypedValue {
    public PendingValue {
        Objects.requireNonNull(type, "type");
    }
}
