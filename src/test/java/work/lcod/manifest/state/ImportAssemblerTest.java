package work.lcod.manifest.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.manifest.pipeline.ErrorKind;
import work.lcod.manifest.pipeline.ImportException;
import work.lcod.manifest.schema.FieldSchema;
import work.lcod.manifest.value.NullValue;
import work.lcod.manifest.value.ObjectValue;
import work.lcod.manifest.value.PendingValue;
import work.lcod.manifest.value.PrimitiveValue;
import work.lcod.manifest.value.TypedValue;
import work.lcod.manifest.value.UndeterminedValue;

class ImportAssemblerTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final ImportAssembler assembler = new ImportAssembler(ResourceTypes.defaults(), new StateSerializer());

    @Test
    void onlyManifestResourcesSupportImport() {
        var type = assembler.resourceType(ResourceTypes.MANIFEST);
        assertEquals("kubernetes_manifest", type.name());

        var error = assertThrows(ImportException.class, () -> assembler.resourceType("helm_release"));
        assertEquals(ErrorKind.UNKNOWN_RESOURCE_TYPE, error.kind());
        assertEquals("Failed to determine resource type", error.summary());
        assertTrue(error.getMessage().contains("'helm_release'"));
    }

    @Test
    void assemblesObjectWithEmptyManifestAndNoWaitCondition() {
        var type = assembler.resourceType(ResourceTypes.MANIFEST);
        var object = secret(new PendingValue(FieldSchema.string()));

        var state = assembler.assemble(type, object);

        assertEquals(ObjectValue.empty(), state.manifest());
        assertEquals(object, state.object());
        assertEquals(new NullValue(type.waitForSchema()), state.waitFor());
        assertEquals(
            List.of(ImportedState.MANIFEST, ImportedState.OBJECT, ImportedState.WAIT_FOR),
            List.copyOf(state.toValue().attributes().keySet())
        );
    }

    @Test
    void refusesUndeterminedValues() {
        var type = assembler.resourceType(ResourceTypes.MANIFEST);

        var error = assertThrows(
            ImportException.class,
            () -> assembler.assemble(type, secret(new UndeterminedValue(FieldSchema.string())))
        );

        assertEquals(ErrorKind.ASSEMBLY, error.kind());
    }

    @Test
    void exportsSerializedState() throws Exception {
        var type = assembler.resourceType(ResourceTypes.MANIFEST);
        var state = assembler.assemble(type, secret(new PendingValue(FieldSchema.string())));

        var imported = assembler.export(type, state);

        assertEquals("kubernetes_manifest", imported.typeName());
        assertEquals(state, imported.state());
        var root = JSON.readTree(imported.serialized());
        assertEquals(JSON.readTree("{}"), root.at("/value/manifest"));
        assertTrue(root.at("/value/wait_for").isNull());
        assertEquals("Secret", root.at("/value/object/kind").asText());
        assertTrue(root.at("/value/object/uid/$pending").asBoolean());
        assertEquals(JSON.readTree("[\"manifest\",\"wait_for\"]"), root.at("/type/optional"));
        assertEquals("string", root.at("/type/object/object/object/kind").asText());
    }

    private static ObjectValue secret(TypedValue uid) {
        var schema = FieldSchema.object()
            .required("kind", FieldSchema.string())
            .required("uid", FieldSchema.string())
            .build();
        return new ObjectValue(schema, Map.of(
            "kind", PrimitiveValue.of("Secret"),
            "uid", uid
        ));
    }
}
