package work.lcod.manifest.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.manifest.discovery.EndpointDescriptor;
import work.lcod.manifest.discovery.TypeRegistry;
import work.lcod.manifest.identity.GroupVersionKind;
import work.lcod.manifest.schema.FieldSchema;
import work.lcod.manifest.schema.SchemaDocuments;
import work.lcod.manifest.schema.SchemaRegistry;
import work.lcod.manifest.store.ObjectStore;

/**
 * Offline snapshot of a cluster read from a YAML or JSON document: the resource types it serves, their schemas,
 * and a set of live objects.
 *
 * <pre>
 * types:
 *   - apiVersion: apps/v1
 *     kind: Deployment
 *     resource: deployments
 *     namespaced: true
 *     schema: {object: {...}, optional: [...]}
 * objects:
 *   - apiVersion: apps/v1
 *     kind: Deployment
 *     metadata: {name: my-app, namespace: default}
 * </pre>
 */
public final class ClusterCatalog implements TypeRegistry, SchemaRegistry, ObjectStore {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private final Map<GroupVersionKind, TypeEntry> types;
    private final List<Map<String, Object>> objects;

    public ClusterCatalog(Map<GroupVersionKind, TypeEntry> types, List<Map<String, Object>> objects) {
        this.types = Map.copyOf(types);
        this.objects = List.copyOf(objects);
    }

    public static ClusterCatalog load(Path path) {
        try (var in = Files.newInputStream(path)) {
            return parse(in);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read catalog: " + path, ex);
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("Invalid catalog " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static ClusterCatalog parse(InputStream in) throws IOException {
        JsonNode root = YAML_MAPPER.readTree(in);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("catalog root must be a mapping");
        }
        Map<GroupVersionKind, TypeEntry> types = new LinkedHashMap<>();
        for (JsonNode node : elements(root.get("types"), "types")) {
            var entry = readType(node);
            types.put(gvkOf(entry.endpoint()), entry);
        }
        List<Map<String, Object>> objects = new ArrayList<>();
        for (JsonNode node : elements(root.get("objects"), "objects")) {
            if (!node.isObject()) {
                throw new IllegalArgumentException("objects must be mappings");
            }
            objects.add(YAML_MAPPER.convertValue(node, MAP_REF));
        }
        return new ClusterCatalog(types, objects);
    }

    @Override
    public Optional<EndpointDescriptor> lookupEndpoint(GroupVersionKind gvk) {
        return Optional.ofNullable(types.get(gvk)).map(TypeEntry::endpoint);
    }

    @Override
    public Optional<Boolean> isNamespaceScoped(GroupVersionKind gvk) {
        return Optional.ofNullable(types.get(gvk)).map(TypeEntry::namespaced);
    }

    @Override
    public Optional<FieldSchema> schemaFor(GroupVersionKind gvk) {
        return Optional.ofNullable(types.get(gvk)).flatMap(TypeEntry::schema);
    }

    @Override
    public Optional<Map<String, Object>> get(EndpointDescriptor endpoint, String namespace, String name) {
        var gvk = gvkOf(endpoint);
        String wantedNamespace = namespace == null ? "" : namespace;
        for (var object : objects) {
            if (!gvk.apiVersion().equals(object.get("apiVersion")) || !gvk.kind().equals(object.get("kind"))) {
                continue;
            }
            Map<?, ?> metadata = object.get("metadata") instanceof Map<?, ?> map ? map : Map.of();
            var objectNamespace = metadata.get("namespace") == null ? "" : String.valueOf(metadata.get("namespace"));
            if (name.equals(metadata.get("name")) && wantedNamespace.equals(objectNamespace)) {
                return Optional.of(new LinkedHashMap<>(object));
            }
        }
        return Optional.empty();
    }

    private static TypeEntry readType(JsonNode node) {
        var apiVersion = requiredText(node, "apiVersion");
        var kind = requiredText(node, "kind");
        var resource = requiredText(node, "resource");
        int slash = apiVersion.indexOf('/');
        var group = slash < 0 ? "" : apiVersion.substring(0, slash);
        var version = slash < 0 ? apiVersion : apiVersion.substring(slash + 1);
        var endpoint = new EndpointDescriptor(group, version, resource, kind);
        boolean namespaced = node.path("namespaced").asBoolean(true);
        JsonNode schemaNode = node.get("schema");
        Optional<FieldSchema> schema = schemaNode == null || schemaNode.isNull()
            ? Optional.empty()
            : Optional.of(SchemaDocuments.read(schemaNode));
        return new TypeEntry(endpoint, namespaced, schema);
    }

    private static GroupVersionKind gvkOf(EndpointDescriptor endpoint) {
        return new GroupVersionKind(endpoint.group(), endpoint.version(), endpoint.kind());
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException("type entry requires '" + field + "'");
        }
        return value.asText();
    }

    private static List<JsonNode> elements(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("'" + field + "' must be a list");
        }
        List<JsonNode> out = new ArrayList<>();
        node.forEach(out::add);
        return out;
    }

    /**
     * Resource type served by the catalog. A type without schema resolves but cannot be converted.
     */
    public record TypeEntry(EndpointDescriptor endpoint, boolean namespaced, Optional<FieldSchema> schema) {
        public TypeEntry {
            Objects.requireNonNull(endpoint, "endpoint");
            Objects.requireNonNull(schema, "schema");
        }
    }
}
