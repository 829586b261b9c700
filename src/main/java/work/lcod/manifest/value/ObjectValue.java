package work.lcod.manifest.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.manifest.schema.ObjectSchema;

public record ObjectValue(ObjectSchema type, Map<String, TypedValue> attributes) implements TypedValue {
    public ObjectValue {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(attributes, "attributes");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static ObjectValue empty() {
        return new ObjectValue(ObjectSchema.empty(), Map.of());
    }

    public TypedValue attribute(String name) {
        return attributes.get(name);
    }
}
