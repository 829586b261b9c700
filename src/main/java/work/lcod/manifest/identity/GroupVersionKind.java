package work.lcod.manifest.identity;

import java.util.Objects;

/**
 * API group, version and kind of a resource type. The core group is the empty string.
 */
public record GroupVersionKind(String group, String version, String kind) {
    public GroupVersionKind {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(kind, "kind");
    }

    /**
     * Rejoins group and version the way manifests spell them: {@code v1} or {@code apps/v1}.
     */
    public String apiVersion() {
        return group.isEmpty() ? version : group + "/" + version;
    }

    @Override
    public String toString() {
        return apiVersion() + ", Kind=" + kind;
    }
}
