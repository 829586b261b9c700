package work.lcod.manifest.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Textual form of {@link FieldSchema}, shared by catalog files and serialized state:
 * <pre>
 * "string" | "number" | "bool" | "dynamic"
 * {"object": {"name": &lt;schema&gt;, ...}, "optional": ["name", ...]}
 * {"list": &lt;schema&gt;} | {"set": &lt;schema&gt;} | {"map": &lt;schema&gt;}
 * </pre>
 */
public final class SchemaDocuments {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private SchemaDocuments() {}

    public static FieldSchema read(JsonNode node) {
        return read(node, "$");
    }

    public static JsonNode write(FieldSchema schema) {
        if (schema instanceof ScalarSchema scalar) {
            return NODES.textNode(scalar.kind().id());
        }
        if (schema instanceof DynamicSchema) {
            return NODES.textNode("dynamic");
        }
        if (schema instanceof ListSchema list) {
            return NODES.objectNode().set("list", write(list.element()));
        }
        if (schema instanceof SetSchema set) {
            return NODES.objectNode().set("set", write(set.element()));
        }
        if (schema instanceof MapSchema map) {
            return NODES.objectNode().set("map", write(map.value()));
        }
        if (schema instanceof ObjectSchema object) {
            ObjectNode attributes = NODES.objectNode();
            object.attributes().forEach((name, attribute) -> attributes.set(name, write(attribute)));
            ObjectNode out = NODES.objectNode();
            out.set("object", attributes);
            if (!object.optional().isEmpty()) {
                ArrayNode optional = out.putArray("optional");
                object.optional().forEach(optional::add);
            }
            return out;
        }
        throw new IllegalArgumentException("Unsupported schema: " + schema);
    }

    private static FieldSchema read(JsonNode node, String location) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new IllegalArgumentException("Missing schema at " + location);
        }
        if (node.isTextual()) {
            return switch (node.asText()) {
                case "string" -> FieldSchema.string();
                case "number" -> FieldSchema.number();
                case "bool" -> FieldSchema.bool();
                case "dynamic" -> FieldSchema.dynamic();
                default -> throw new IllegalArgumentException("Unknown scalar type '" + node.asText() + "' at " + location);
            };
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Schema at " + location + " must be a string or an object");
        }
        if (node.has("list")) {
            return FieldSchema.list(read(node.get("list"), location + ".list"));
        }
        if (node.has("set")) {
            return FieldSchema.set(read(node.get("set"), location + ".set"));
        }
        if (node.has("map")) {
            return FieldSchema.map(read(node.get("map"), location + ".map"));
        }
        if (node.has("object")) {
            return readObject(node, location);
        }
        throw new IllegalArgumentException("Schema at " + location + " must declare one of object, list, set or map");
    }

    private static ObjectSchema readObject(JsonNode node, String location) {
        JsonNode attributes = node.get("object");
        if (!attributes.isObject()) {
            throw new IllegalArgumentException("'object' at " + location + " must map attribute names to schemas");
        }
        Set<String> optionalNames = new LinkedHashSet<>();
        JsonNode optional = node.get("optional");
        if (optional != null && !optional.isNull()) {
            if (!optional.isArray()) {
                throw new IllegalArgumentException("'optional' at " + location + " must be a list of attribute names");
            }
            optional.forEach(name -> optionalNames.add(name.asText()));
        }
        var builder = ObjectSchema.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = attributes.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var schema = read(field.getValue(), location + "." + field.getKey());
            if (optionalNames.remove(field.getKey())) {
                builder.optional(field.getKey(), schema);
            } else {
                builder.required(field.getKey(), schema);
            }
        }
        if (!optionalNames.isEmpty()) {
            throw new IllegalArgumentException("Optional attributes " + optionalNames + " at " + location + " are not declared");
        }
        return builder.build();
    }
}
