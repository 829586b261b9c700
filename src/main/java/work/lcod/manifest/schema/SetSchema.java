package work.lcod.manifest.schema;

import java.util.Objects;

/**
 * Unordered collection whose elements share one schema.
 */
public record SetSchema(FieldSchema element) implements FieldSchema {
    public SetSchema {
        Objects.requireNonNull(element, "element");
    }
}
