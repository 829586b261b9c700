package work.lcod.manifest.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fixed set of named attributes. Attributes listed in {@code optional} may be absent or null in configuration.
 */
public record ObjectSchema(Map<String, FieldSchema> attributes, Set<String> optional) implements FieldSchema {
    public ObjectSchema {
        Objects.requireNonNull(attributes, "attributes");
        Objects.requireNonNull(optional, "optional");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        optional = Collections.unmodifiableSet(new LinkedHashSet<>(optional));
        for (String name : optional) {
            if (!attributes.containsKey(name)) {
                throw new IllegalArgumentException("Optional attribute '" + name + "' is not declared");
            }
        }
    }

    public static ObjectSchema empty() {
        return new ObjectSchema(Map.of(), Set.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public FieldSchema attribute(String name) {
        return attributes.get(name);
    }

    public boolean isOptional(String name) {
        return optional.contains(name);
    }

    public static final class Builder {
        private final Map<String, FieldSchema> attributes = new LinkedHashMap<>();
        private final Set<String> optional = new LinkedHashSet<>();

        public Builder required(String name, FieldSchema schema) {
            attributes.put(name, schema);
            optional.remove(name);
            return this;
        }

        public Builder optional(String name, FieldSchema schema) {
            attributes.put(name, schema);
            optional.add(name);
            return this;
        }

        public ObjectSchema build() {
            return new ObjectSchema(attributes, optional);
        }
    }
}
