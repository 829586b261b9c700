package work.lcod.manifest.schema;

import java.util.Objects;

/**
 * Ordered sequence whose elements share one schema.
 */
public record ListSchema(FieldSchema element) implements FieldSchema {
    public ListSchema {
        Objects.requireNonNull(element, "element");
    }
}
