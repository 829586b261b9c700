package work.lcod.manifest.state;

import java.util.Objects;

/**
 * Imported state tagged with the resource type name the caller asked for, plus its serialized form.
 */
public record ImportedResource(String typeName, ImportedState state, String serialized) {
    public ImportedResource {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(serialized, "serialized");
    }
}
