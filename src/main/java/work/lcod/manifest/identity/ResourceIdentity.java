package work.lcod.manifest.identity;

import java.util.Objects;

/**
 * Fully qualified identity of the object to import. {@code namespace} is empty for cluster-scoped identifiers.
 */
public record ResourceIdentity(GroupVersionKind gvk, String namespace, String name) {
    public ResourceIdentity {
        Objects.requireNonNull(gvk, "gvk");
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
    }

    public String group() {
        return gvk.group();
    }

    public String version() {
        return gvk.version();
    }

    public String kind() {
        return gvk.kind();
    }

    public String apiVersion() {
        return gvk.apiVersion();
    }

    public boolean hasNamespace() {
        return !namespace.isEmpty();
    }

    public String display() {
        var target = hasNamespace() ? namespace + "/" + name : name;
        return apiVersion() + "/" + kind() + " " + target;
    }
}
