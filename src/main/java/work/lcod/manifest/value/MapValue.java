package work.lcod.manifest.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.manifest.schema.MapSchema;

public record MapValue(MapSchema type, Map<String, TypedValue> entries) implements TypedValue {
    public MapValue {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(entries, "entries");
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }
}
