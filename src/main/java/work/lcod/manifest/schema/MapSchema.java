package work.lcod.manifest.schema;

import java.util.Objects;

/**
 * String-keyed mapping whose values share one schema.
 */
public record MapSchema(FieldSchema value) implements FieldSchema {
    public MapSchema {
        Objects.requireNonNull(value, "value");
    }
}
