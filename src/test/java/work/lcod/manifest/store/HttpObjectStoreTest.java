package work.lcod.manifest.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.lcod.manifest.discovery.EndpointDescriptor;
import work.lcod.manifest.support.ImportTestSupport;

class HttpObjectStoreTest {
    private HttpServer server;
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final List<String> authorizations = new CopyOnWriteArrayList<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void readsObjectAsJson() throws Exception {
        var store = new HttpObjectStore(baseUri(), Optional.of("s3cr3t"), Duration.ofSeconds(5));

        var object = store.get(ImportTestSupport.SECRETS, "default", "token").orElseThrow();

        assertEquals("Secret", object.get("kind"));
        assertEquals(Map.of("name", "token", "namespace", "default"), object.get("metadata"));
        assertEquals(List.of("/api/v1/namespaces/default/secrets/token"), requests);
        assertEquals(List.of("Bearer s3cr3t"), authorizations);
    }

    @Test
    void clusterScopedPathHasNoNamespace() throws Exception {
        var store = new HttpObjectStore(URI.create(baseUri() + "/"), Optional.empty(), Duration.ofSeconds(5));
        var namespaces = new EndpointDescriptor("", "v1", "namespaces", "Namespace");

        var object = store.get(namespaces, null, "team-a").orElseThrow();

        assertEquals("Namespace", object.get("kind"));
        assertEquals(List.of("/api/v1/namespaces/team-a"), requests);
        assertEquals(List.of(""), authorizations);
    }

    @Test
    void notFoundIsEmpty() throws Exception {
        var store = new HttpObjectStore(baseUri(), Optional.empty(), Duration.ofSeconds(5));

        assertTrue(store.get(ImportTestSupport.SECRETS, "default", "missing").isEmpty());
    }

    @Test
    void serverErrorsAreReported() {
        var store = new HttpObjectStore(baseUri(), Optional.empty(), Duration.ofSeconds(5));

        var error = assertThrows(IOException.class, () -> store.get(ImportTestSupport.SECRETS, "default", "broken"));

        assertTrue(error.getMessage().startsWith("HTTP 500 while reading"), error.getMessage());
        assertTrue(error.getMessage().endsWith("etcd unavailable"), error.getMessage());
    }

    @Test
    void rejectsNonObjectBodies() {
        var store = new HttpObjectStore(baseUri(), Optional.empty(), Duration.ofSeconds(5));

        var error = assertThrows(IOException.class, () -> store.get(ImportTestSupport.SECRETS, "default", "garbled"));

        assertTrue(error.getMessage().startsWith("Invalid JSON object"), error.getMessage());
    }

    private URI baseUri() {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    }

    private void handle(HttpExchange exchange) throws IOException {
        var path = exchange.getRequestURI().getPath();
        requests.add(path);
        var auth = exchange.getRequestHeaders().getFirst("Authorization");
        authorizations.add(auth == null ? "" : auth);
        switch (path) {
            case "/api/v1/namespaces/default/secrets/token" -> respond(exchange, 200,
                "{\"apiVersion\":\"v1\",\"kind\":\"Secret\",\"metadata\":{\"name\":\"token\",\"namespace\":\"default\"}}");
            case "/api/v1/namespaces/team-a" -> respond(exchange, 200,
                "{\"apiVersion\":\"v1\",\"kind\":\"Namespace\",\"metadata\":{\"name\":\"team-a\"}}");
            case "/api/v1/namespaces/default/secrets/broken" -> respond(exchange, 500, "etcd unavailable");
            case "/api/v1/namespaces/default/secrets/garbled" -> respond(exchange, 200, "[1, 2, 3]");
            default -> respond(exchange, 404, "{\"kind\":\"Status\",\"code\":404}");
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        var bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (var out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
