package work.lcod.manifest.schema;

import java.io.IOException;
import java.util.Optional;
import work.lcod.manifest.identity.GroupVersionKind;

/**
 * Remote type-description service. An empty result means the registry has no definition for the type.
 */
@FunctionalInterface
public interface SchemaRegistry {
    Optional<FieldSchema> schemaFor(GroupVersionKind gvk) throws IOException;
}
