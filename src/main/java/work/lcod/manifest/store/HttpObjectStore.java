package work.lcod.manifest.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.tinylog.Logger;
import work.lcod.manifest.discovery.EndpointDescriptor;

/**
 * Reads objects from a Kubernetes-style REST API ({@code GET /api/v1/namespaces/<ns>/secrets/<name>}).
 */
public final class HttpObjectStore implements ObjectStore {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};
    private static final int MAX_ERROR_BODY = 512;

    private final URI server;
    private final Optional<String> bearerToken;
    private final Duration requestTimeout;
    private final HttpClient client;

    public HttpObjectStore(URI server, Optional<String> bearerToken, Duration requestTimeout) {
        this(server, bearerToken, requestTimeout, HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(requestTimeout)
            .build());
    }

    HttpObjectStore(URI server, Optional<String> bearerToken, Duration requestTimeout, HttpClient client) {
        this.server = Objects.requireNonNull(server, "server");
        this.bearerToken = Objects.requireNonNull(bearerToken, "bearerToken");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public Optional<Map<String, Object>> get(EndpointDescriptor endpoint, String namespace, String name)
        throws IOException, InterruptedException {
        var uri = resolve(endpoint.objectPath(namespace, name));
        var request = HttpRequest.newBuilder(uri)
            .GET()
            .timeout(requestTimeout)
            .header("Accept", "application/json");
        bearerToken.ifPresent(token -> request.header("Authorization", "Bearer " + token));

        Logger.trace("GET {}", uri);
        var response = client.send(request.build(), HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status == 404) {
            return Optional.empty();
        }
        if (status >= 400) {
            throw new IOException("HTTP " + status + " while reading " + uri + ": " + abbreviate(response.body()));
        }
        try {
            return Optional.of(new LinkedHashMap<>(JSON.readValue(response.body(), MAP_REF)));
        } catch (IOException ex) {
            throw new IOException("Invalid JSON object returned by " + uri, ex);
        }
    }

    private URI resolve(String path) {
        var base = server.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        var trimmed = body.strip();
        return trimmed.length() <= MAX_ERROR_BODY ? trimmed : trimmed.substring(0, MAX_ERROR_BODY) + "...";
    }
}
