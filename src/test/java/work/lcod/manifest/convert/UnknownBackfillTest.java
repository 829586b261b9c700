package work.lcod.manifest.convert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.manifest.schema.FieldSchema;
import work.lcod.manifest.schema.ListSchema;
import work.lcod.manifest.schema.ObjectSchema;
import work.lcod.manifest.support.ImportTestSupport;
import work.lcod.manifest.value.ListValue;
import work.lcod.manifest.value.NullValue;
import work.lcod.manifest.value.ObjectValue;
import work.lcod.manifest.value.PendingValue;
import work.lcod.manifest.value.PrimitiveValue;
import work.lcod.manifest.value.TypedValue;
import work.lcod.manifest.value.TypedValues;
import work.lcod.manifest.value.UndeterminedValue;

class UnknownBackfillTest {
    @Test
    void placeholdersBecomePending() {
        var schema = ImportTestSupport.serviceSchema();
        var converted = TypedConverter.convert(Map.of("name", "web"), schema);

        var backfilled = (ObjectValue) UnknownBackfill.backfill(schema, converted);

        assertFalse(TypedValues.containsUndetermined(backfilled));
        assertEquals(PrimitiveValue.of("web"), backfilled.attribute("name"));
        assertEquals(new PendingValue(schema.attribute("spec")), backfilled.attribute("spec"));
        assertEquals(new PendingValue(FieldSchema.number()), backfilled.attribute("replicas"));
    }

    @Test
    void missingCollectionIsPendingAsAWhole() {
        var schema = ImportTestSupport.serviceSchema();
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("name", "web");
        raw.put("spec", Map.of("selector", Map.of("app", "web")));

        var backfilled = (ObjectValue) UnknownBackfill.backfill(schema, TypedConverter.convert(raw, schema));

        var spec = (ObjectValue) backfilled.attribute("spec");
        var ports = assertInstanceOf(PendingValue.class, spec.attribute("ports"));
        assertInstanceOf(ListSchema.class, ports.type());
        assertTrue(TypedValues.children(ports).isEmpty());
    }

    @Test
    void recursesIntoCollections() {
        var schema = ImportTestSupport.serviceSchema();
        var port = Map.of("name", "http");
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("name", "web");
        raw.put("spec", Map.of("selector", Map.of(), "ports", List.of(port)));

        var backfilled = (ObjectValue) UnknownBackfill.backfill(schema, TypedConverter.convert(raw, schema));

        var spec = (ObjectValue) backfilled.attribute("spec");
        var first = (ObjectValue) ((ListValue) spec.attribute("ports")).elements().get(0);
        assertEquals(PrimitiveValue.of("http"), first.attribute("name"));
        assertEquals(new PendingValue(FieldSchema.number()), first.attribute("port"));
    }

    @Test
    void concreteValuesAreUnchanged() {
        var schema = ImportTestSupport.serviceSchema();
        var converted = TypedConverter.convert(ImportTestSupport.serviceObject(), schema);

        assertEquals(converted, UnknownBackfill.backfill(schema, converted));
        var explicitNull = new NullValue(FieldSchema.string());
        assertEquals(explicitNull, UnknownBackfill.backfill(FieldSchema.string(), explicitNull));
    }

    @Test
    void backfillFillsAttributesMissingFromTheValue() {
        var schema = FieldSchema.object()
            .required("a", FieldSchema.string())
            .required("b", FieldSchema.bool())
            .build();
        var partial = new ObjectValue(schema, Map.of("a", PrimitiveValue.of("x")));

        var backfilled = (ObjectValue) UnknownBackfill.backfill(schema, partial);

        assertEquals(new PendingValue(FieldSchema.bool()), backfilled.attribute("b"));
        assertEquals(new PendingValue(schema), UnknownBackfill.backfill(schema, new UndeterminedValue(schema)));
    }

    @Test
    void narrowingNullsOnlyOutermostPending() {
        var schema = ImportTestSupport.serviceSchema();
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("name", "web");
        raw.put("spec", Map.of("selector", Map.of("app", "web"), "ports", List.of()));

        var backfilled = UnknownBackfill.backfill(schema, TypedConverter.convert(raw, schema));
        var narrowed = (ObjectValue) UnknownBackfill.narrowTopLevel(backfilled);

        assertEquals(new NullValue(FieldSchema.number()), narrowed.attribute("replicas"));
        assertEquals(new NullValue(FieldSchema.bool()), narrowed.attribute("enabled"));
        var spec = (ObjectValue) narrowed.attribute("spec");
        assertEquals(new PendingValue(FieldSchema.string()), spec.attribute("clusterIP"));
        assertEquals(new PendingValue(FieldSchema.set(FieldSchema.string())), spec.attribute("tags"));
        assertEquals(schema, narrowed.type());
    }

    @Test
    void narrowingHandlesNonObjectRoots() {
        TypedValue pending = new PendingValue(FieldSchema.list(FieldSchema.string()));
        assertEquals(new NullValue(FieldSchema.list(FieldSchema.string())), UnknownBackfill.narrowTopLevel(pending));

        var number = PrimitiveValue.of(BigDecimal.ONE);
        assertEquals(number, UnknownBackfill.narrowTopLevel(number));
        assertEquals(ObjectValue.empty(), UnknownBackfill.narrowTopLevel(ObjectValue.empty()));
        assertEquals(ObjectSchema.empty(), ObjectValue.empty().type());
    }
}
