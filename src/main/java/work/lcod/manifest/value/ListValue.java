package work.lcod.manifest.value;

import java.util.List;
import java.util.Objects;
import work.lcod.manifest.schema.ListSchema;

public record ListValue(ListSchema type, List<TypedValue> elements) implements TypedValue {
    public ListValue {
        Objects.requireNonNull(type, "type");
        elements = List.copyOf(elements);
    }
}
