package work.lcod.manifest.schema;

import java.io.IOException;
import java.util.Objects;
import org.tinylog.Logger;
import work.lcod.manifest.identity.ResourceIdentity;
import work.lcod.manifest.pipeline.ErrorKind;
import work.lcod.manifest.pipeline.ImportException;

/**
 * Looks up the typed schema of a resource type, going through the shared {@link SchemaCache}.
 */
public final class SchemaResolver {
    private final SchemaRegistry registry;
    private final SchemaCache cache;

    public SchemaResolver(SchemaRegistry registry, SchemaCache cache) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    public FieldSchema schemaFor(ResourceIdentity identity) {
        var gvk = identity.gvk();
        try {
            return cache.getOrLoad(gvk, key -> {
                    Logger.debug("Loading schema for {}", key);
                    return registry.schemaFor(key);
                })
                .orElseThrow(() -> new ImportException(
                    ErrorKind.SCHEMA,
                    "no schema definition found for " + gvk
                ));
        } catch (IOException ex) {
            throw new ImportException(ErrorKind.SCHEMA, "unable to load schema for " + gvk, ex);
        }
    }
}
