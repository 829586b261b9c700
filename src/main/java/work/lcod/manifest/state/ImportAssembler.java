package work.lcod.manifest.state;

import java.util.Objects;
import org.tinylog.Logger;
import work.lcod.manifest.pipeline.ErrorKind;
import work.lcod.manifest.pipeline.ImportException;
import work.lcod.manifest.value.NullValue;
import work.lcod.manifest.value.ObjectValue;
import work.lcod.manifest.value.TypedValue;
import work.lcod.manifest.value.TypedValues;

/**
 * Packages a backfilled object into the state recorded for an imported resource.
 */
public final class ImportAssembler {
    private final ResourceTypes resourceTypes;
    private final StateSerializer serializer;

    public ImportAssembler(ResourceTypes resourceTypes, StateSerializer serializer) {
        this.resourceTypes = Objects.requireNonNull(resourceTypes, "resourceTypes");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
    }

    public ResourceTypes.ResourceType resourceType(String typeName) {
        return resourceTypes.lookup(typeName).orElseThrow(() -> new ImportException(
            ErrorKind.UNKNOWN_RESOURCE_TYPE,
            "resource type '" + typeName + "' does not support import"
        ));
    }

    public ImportedState assemble(ResourceTypes.ResourceType type, TypedValue object) {
        if (TypedValues.containsUndetermined(object)) {
            throw new ImportException(ErrorKind.ASSEMBLY, "object still holds undetermined values after backfill");
        }
        return new ImportedState(ObjectValue.empty(), object, new NullValue(type.waitForSchema()));
    }

    public ImportedResource export(ResourceTypes.ResourceType type, ImportedState state) {
        var serialized = serializer.toJson(state);
        Logger.trace("Imported state for {}: {}", type.name(), serialized);
        return new ImportedResource(type.name(), state, serialized);
    }
}
