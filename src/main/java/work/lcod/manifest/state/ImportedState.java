package work.lcod.manifest.state;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.manifest.schema.ObjectSchema;
import work.lcod.manifest.value.ObjectValue;
import work.lcod.manifest.value.TypedValue;

/**
 * State recorded for an imported object: no manifest yet, the observed object, and no wait condition.
 */
public record ImportedState(ObjectValue manifest, TypedValue object, TypedValue waitFor) {
    public static final String MANIFEST = "manifest";
    public static final String OBJECT = "object";
    public static final String WAIT_FOR = "wait_for";

    public ImportedState {
        Objects.requireNonNull(manifest, "manifest");
        Objects.requireNonNull(object, "object");
        Objects.requireNonNull(waitFor, "waitFor");
    }

    public ObjectSchema type() {
        return ObjectSchema.builder()
            .optional(MANIFEST, manifest.type())
            .required(OBJECT, object.type())
            .optional(WAIT_FOR, waitFor.type())
            .build();
    }

    public ObjectValue toValue() {
        Map<String, TypedValue> attributes = new LinkedHashMap<>();
        attributes.put(MANIFEST, manifest);
        attributes.put(OBJECT, object);
        attributes.put(WAIT_FOR, waitFor);
        return new ObjectValue(type(), attributes);
    }
}
