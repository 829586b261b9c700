package work.lcod.manifest.convert;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.manifest.schema.FieldSchema;
import work.lcod.manifest.schema.ListSchema;
import work.lcod.manifest.schema.MapSchema;
import work.lcod.manifest.schema.ObjectSchema;
import work.lcod.manifest.schema.SetSchema;
import work.lcod.manifest.value.ListValue;
import work.lcod.manifest.value.MapValue;
import work.lcod.manifest.value.NullValue;
import work.lcod.manifest.value.ObjectValue;
import work.lcod.manifest.value.PendingValue;
import work.lcod.manifest.value.SetValue;
import work.lcod.manifest.value.TypedValue;
import work.lcod.manifest.value.UndeterminedValue;

/**
 * Marks the positions an import could not observe as pending so the next plan computes them.
 *
 * <p>{@link #backfill} walks schema and value together. A placeholder becomes a single {@link PendingValue} for the
 * whole subtree, never a collection with some pending children. {@link #narrowTopLevel} then turns pending outermost
 * attributes into nulls: those are operator settings that an import leaves unconfigured.
 */
public final class UnknownBackfill {
    private UnknownBackfill() {}

    public static TypedValue backfill(FieldSchema schema, TypedValue value) {
        if (value == null || value instanceof UndeterminedValue) {
            return new PendingValue(schema);
        }
        if (value instanceof ObjectValue object) {
            var declared = schema instanceof ObjectSchema objectSchema ? objectSchema : object.type();
            return backfillObject(declared, object);
        }
        if (value instanceof ListValue list) {
            var element = schema instanceof ListSchema listSchema ? listSchema.element() : list.type().element();
            return new ListValue(list.type(), backfillElements(element, list.elements()));
        }
        if (value instanceof SetValue set) {
            var element = schema instanceof SetSchema setSchema ? setSchema.element() : set.type().element();
            return new SetValue(set.type(), backfillElements(element, set.elements()));
        }
        if (value instanceof MapValue map) {
            var valueSchema = schema instanceof MapSchema mapSchema ? mapSchema.value() : map.type().value();
            Map<String, TypedValue> entries = new LinkedHashMap<>();
            map.entries().forEach((key, entry) -> entries.put(key, backfill(valueSchema, entry)));
            return new MapValue(map.type(), entries);
        }
        // primitives, nulls and pending values are already final
        return value;
    }

    public static TypedValue narrowTopLevel(TypedValue value) {
        if (value instanceof PendingValue pending) {
            return new NullValue(pending.type());
        }
        if (!(value instanceof ObjectValue object)) {
            return value;
        }
        Map<String, TypedValue> attributes = new LinkedHashMap<>();
        object.attributes().forEach((name, attribute) -> attributes.put(
            name,
            attribute instanceof PendingValue pending ? new NullValue(pending.type()) : attribute
        ));
        return new ObjectValue(object.type(), attributes);
    }

    private static ObjectValue backfillObject(ObjectSchema schema, ObjectValue object) {
        Map<String, TypedValue> attributes = new LinkedHashMap<>();
        for (var entry : schema.attributes().entrySet()) {
            attributes.put(entry.getKey(), backfill(entry.getValue(), object.attribute(entry.getKey())));
        }
        return new ObjectValue(schema, attributes);
    }

    private static List<TypedValue> backfillElements(FieldSchema element, List<TypedValue> elements) {
        List<TypedValue> out = new ArrayList<>(elements.size());
        for (TypedValue item : elements) {
            out.add(backfill(element, item));
        }
        return out;
    }
}
