package work.lcod.manifest.value;

import java.util.Objects;
import work.lcod.manifest.schema.FieldSchema;

/**
 * Explicitly unset value.
 */
public record NullValue(FieldSchema type) implements TypedValue {
    public NullValue {
        Objects.requireNonNull(type, "type");
    }
}
