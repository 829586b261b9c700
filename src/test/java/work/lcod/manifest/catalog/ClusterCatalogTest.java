package work.lcod.manifest.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import work.lcod.manifest.discovery.EndpointDescriptor;
import work.lcod.manifest.identity.GroupVersionKind;
import work.lcod.manifest.schema.ObjectSchema;
import work.lcod.manifest.support.ImportTestSupport;

class ClusterCatalogTest {
    private static final GroupVersionKind NAMESPACE = new GroupVersionKind("", "v1", "Namespace");
    private static final GroupVersionKind WIDGET = new GroupVersionKind("example.com", "v1", "Widget");

    @Test
    void servesTypesFromTheCatalog() {
        var catalog = ImportTestSupport.catalog();

        assertEquals(ImportTestSupport.SECRETS, catalog.lookupEndpoint(ImportTestSupport.SECRET).orElseThrow());
        assertEquals(true, catalog.isNamespaceScoped(ImportTestSupport.SECRET).orElseThrow());
        assertEquals(false, catalog.isNamespaceScoped(NAMESPACE).orElseThrow());
        assertEquals(new EndpointDescriptor("example.com", "v1", "widgets", "Widget"), catalog.lookupEndpoint(WIDGET).orElseThrow());
        assertTrue(catalog.lookupEndpoint(new GroupVersionKind("", "v1", "Pod")).isEmpty());
    }

    @Test
    void servesSchemasWhenDeclared() {
        var catalog = ImportTestSupport.catalog();

        var secret = (ObjectSchema) catalog.schemaFor(ImportTestSupport.SECRET).orElseThrow();
        assertTrue(secret.isOptional("data"));
        assertFalse(secret.isOptional("type"));
        assertTrue(catalog.schemaFor(WIDGET).isEmpty());
    }

    @Test
    void findsObjectsByScopeAndName() {
        var catalog = ImportTestSupport.catalog();
        var namespaces = catalog.lookupEndpoint(NAMESPACE).orElseThrow();

        var secret = catalog.get(ImportTestSupport.SECRETS, "default", "default-token-qgm6s").orElseThrow();
        assertEquals("kubernetes.io/service-account-token", secret.get("type"));
        assertTrue(catalog.get(ImportTestSupport.SECRETS, "kube-system", "default-token-qgm6s").isEmpty());
        assertTrue(catalog.get(namespaces, null, "team-a").isPresent());
        assertTrue(catalog.get(namespaces, null, "team-b").isEmpty());
    }

    @Test
    void rejectsInvalidCatalogs() {
        var missingResource = "types:\n  - apiVersion: v1\n    kind: Secret\n";
        var error = assertThrows(
            IllegalArgumentException.class,
            () -> ClusterCatalog.parse(new ByteArrayInputStream(missingResource.getBytes(StandardCharsets.UTF_8)))
        );
        assertEquals("type entry requires 'resource'", error.getMessage());

        var unreadable = assertThrows(IllegalStateException.class, () -> ClusterCatalog.load(Path.of("does-not-exist.yaml")));
        assertTrue(unreadable.getMessage().startsWith("Failed to read catalog"));
    }
}
