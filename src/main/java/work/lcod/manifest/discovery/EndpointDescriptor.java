package work.lcod.manifest.discovery;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Where objects of a resource type live on the API server: group, version and the plural resource name.
 */
public record EndpointDescriptor(String group, String version, String resource, String kind) {
    public EndpointDescriptor {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(kind, "kind");
        if (resource.isBlank()) {
            throw new IllegalArgumentException("resource must not be blank");
        }
    }

    /**
     * REST path of a single object. A {@code null} or empty namespace addresses the cluster scope.
     */
    public String objectPath(String namespace, String name) {
        var path = new StringBuilder(group.isEmpty() ? "/api/" + version : "/apis/" + group + "/" + version);
        if (namespace != null && !namespace.isEmpty()) {
            path.append("/namespaces/").append(encode(namespace));
        }
        path.append('/').append(resource).append('/').append(encode(name));
        return path.toString();
    }

    @Override
    public String toString() {
        return (group.isEmpty() ? "" : group + "/") + version + ", Resource=" + resource;
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
