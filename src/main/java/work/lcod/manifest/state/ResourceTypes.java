package work.lcod.manifest.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.manifest.schema.FieldSchema;
import work.lcod.manifest.schema.ObjectSchema;

/**
 * Resource type names an object can be imported into, with the type of their auxiliary {@code wait_for} slot.
 */
public final class ResourceTypes {
    public static final String MANIFEST = "kubernetes_manifest";

    private final Map<String, ResourceType> types;

    public ResourceTypes(Map<String, ResourceType> types) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
    }

    public static ResourceTypes defaults() {
        var waitFor = ObjectSchema.builder()
            .optional("fields", FieldSchema.map(FieldSchema.string()))
            .build();
        return new ResourceTypes(Map.of(MANIFEST, new ResourceType(MANIFEST, waitFor)));
    }

    public Optional<ResourceType> lookup(String typeName) {
        return Optional.ofNullable(types.get(typeName));
    }

    public record ResourceType(String name, FieldSchema waitForSchema) {
        public ResourceType {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(waitForSchema, "waitForSchema");
        }
    }
}
