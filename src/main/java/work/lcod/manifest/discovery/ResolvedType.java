package work.lcod.manifest.discovery;

import java.util.Objects;

public record ResolvedType(EndpointDescriptor endpoint, boolean namespaced) {
    public ResolvedType {
        Objects.requireNonNull(endpoint, "endpoint");
    }
}
