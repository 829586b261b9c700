package work.lcod.manifest.state;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.manifest.convert.TypedConverter;
import work.lcod.manifest.schema.FieldSchema;
import work.lcod.manifest.value.ListValue;
import work.lcod.manifest.value.MapValue;
import work.lcod.manifest.value.NullValue;
import work.lcod.manifest.value.PendingValue;
import work.lcod.manifest.value.PrimitiveValue;
import work.lcod.manifest.value.SetValue;

class StateSerializerTest {
    @Test
    void writesScalarsAndMarkers() {
        assertEquals("\"web\"", StateSerializer.toNode(PrimitiveValue.of("web")).toString());
        assertEquals("2.5", StateSerializer.toNode(PrimitiveValue.of(new BigDecimal("2.5"))).toString());
        assertEquals("300", StateSerializer.toNode(PrimitiveValue.of(new BigDecimal("3E+2"))).toString());
        assertEquals("true", StateSerializer.toNode(PrimitiveValue.of(true)).toString());
        assertEquals("null", StateSerializer.toNode(new NullValue(FieldSchema.string())).toString());
        assertEquals("{\"$pending\":true}", StateSerializer.toNode(new PendingValue(FieldSchema.bool())).toString());
    }

    @Test
    void writesCollections() {
        var tags = new SetValue(FieldSchema.set(FieldSchema.string()), List.of(PrimitiveValue.of("a"), PrimitiveValue.of("b")));
        var ports = new ListValue(
            FieldSchema.list(FieldSchema.number()),
            List.of(PrimitiveValue.of(BigDecimal.valueOf(80)), new PendingValue(FieldSchema.number()))
        );
        var labels = new MapValue(FieldSchema.map(FieldSchema.string()), Map.of("app", PrimitiveValue.of("web")));

        assertEquals("[\"a\",\"b\"]", StateSerializer.toNode(tags).toString());
        assertEquals("[80,{\"$pending\":true}]", StateSerializer.toNode(ports).toString());
        assertEquals("{\"app\":\"web\"}", StateSerializer.toNode(labels).toString());
    }

    @Test
    void largeExponentsStayInScientificNotation() {
        var schema = FieldSchema.object().required("n", FieldSchema.number()).build();
        var converted = TypedConverter.convert(Map.of("n", "1e2000000000"), schema);

        assertEquals("{\"n\":1E+2000000000}", StateSerializer.toNode(converted).toString());
        assertEquals("1" + "0".repeat(63), StateSerializer.toNode(PrimitiveValue.of(new BigDecimal("1e63"))).toString());
        assertEquals("1E+64", StateSerializer.toNode(PrimitiveValue.of(new BigDecimal("1e64"))).toString());
    }

    @Test
    void serializedStateKeepsLargeExponents() {
        var assembler = new ImportAssembler(ResourceTypes.defaults(), new StateSerializer());
        var type = assembler.resourceType(ResourceTypes.MANIFEST);
        var schema = FieldSchema.object().required("n", FieldSchema.number()).build();
        var state = assembler.assemble(type, TypedConverter.convert(Map.of("n", "-2.5e999999999"), schema));

        var serialized = assembler.export(type, state).serialized();

        assertEquals(true, serialized.contains("\"n\":-2.5E+999999999"), serialized);
    }
}
