package work.lcod.manifest.pipeline;

import java.util.Objects;

/**
 * What the operator asked for: the resource type name to import into and the import ID.
 */
public record ImportRequest(String typeName, String id) {
    public ImportRequest {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(id, "id");
    }
}
