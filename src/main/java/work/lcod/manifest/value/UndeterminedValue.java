package work.lcod.manifest.value;

import java.util.Objects;
import work.lcod.manifest.schema.FieldSchema;

/**
 * Placeholder left by the converter where the live object carried no data for a schema position.
 */
public record UndeterminedValue(FieldSchema type) implements TypedValue {
    public UndeterminedValue {
        Objects.requireNonNull(type, "type");
    }
}
