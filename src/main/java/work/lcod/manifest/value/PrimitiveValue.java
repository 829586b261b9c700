package work.lcod.manifest.value;

import java.math.BigDecimal;
import java.util.Objects;
import work.lcod.manifest.schema.FieldSchema;
import work.lcod.manifest.schema.ScalarSchema;

/**
 * Scalar holding a {@link String}, {@link BigDecimal} or {@link Boolean} matching its kind.
 */
public record PrimitiveValue(ScalarSchema type, Object value) implements TypedValue {
    public PrimitiveValue {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
        boolean matches = switch (type.kind()) {
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof BigDecimal;
            case BOOL -> value instanceof Boolean;
        };
        if (!matches) {
            throw new IllegalArgumentException(
                "Value of type " + value.getClass().getSimpleName() + " does not fit scalar kind " + type.kind().id()
            );
        }
    }

    public static PrimitiveValue of(String value) {
        return new PrimitiveValue(FieldSchema.string(), value);
    }

    public static PrimitiveValue of(BigDecimal value) {
        return new PrimitiveValue(FieldSchema.number(), value);
    }

    public static PrimitiveValue of(boolean value) {
        return new PrimitiveValue(FieldSchema.bool(), value);
    }
}
