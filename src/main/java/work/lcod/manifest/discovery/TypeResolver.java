package work.lcod.manifest.discovery;

import java.io.IOException;
import java.util.Objects;
import org.tinylog.Logger;
import work.lcod.manifest.identity.GroupVersionKind;
import work.lcod.manifest.identity.ResourceIdentity;
import work.lcod.manifest.pipeline.ErrorKind;
import work.lcod.manifest.pipeline.ImportContext;
import work.lcod.manifest.pipeline.ImportException;

/**
 * Resolves the endpoint of a resource type and whether its objects live in a namespace.
 *
 * <p>A namespace given for a cluster-scoped type, or missing for a namespaced one, only produces a warning;
 * the fetch that follows reports the actual failure.
 */
public final class TypeResolver {
    private final TypeRegistry registry;

    public TypeResolver(TypeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public ResolvedType resolve(ResourceIdentity identity, ImportContext context) {
        var gvk = identity.gvk();
        var endpoint = call(gvk, "endpoint", () -> registry.lookupEndpoint(gvk))
            .orElseThrow(() -> unknown(gvk));
        boolean namespaced = call(gvk, "scope", () -> registry.isNamespaceScoped(gvk))
            .orElseThrow(() -> unknown(gvk));
        Logger.debug("Resolved {} to {} (namespaced={})", gvk, endpoint, namespaced);

        if (namespaced && !identity.hasNamespace()) {
            context.warn(
                "Namespace missing from import ID",
                identity.kind() + " is namespace-scoped but the import ID names no namespace"
            );
        } else if (!namespaced && identity.hasNamespace()) {
            context.warn(
                "Namespace ignored for cluster-scoped resource",
                identity.kind() + " is cluster-scoped; namespace '" + identity.namespace() + "' will not be used"
            );
        }
        return new ResolvedType(endpoint, namespaced);
    }

    private static <T> T call(GroupVersionKind gvk, String what, RegistryCall<T> call) {
        try {
            return call.run();
        } catch (IOException ex) {
            throw new ImportException(
                ErrorKind.RESOLUTION_UNREACHABLE,
                "unable to query " + what + " of " + gvk + " from the type registry",
                ex
            );
        }
    }

    private static ImportException unknown(GroupVersionKind gvk) {
        return new ImportException(ErrorKind.RESOLUTION_UNKNOWN_TYPE, "no resource type registered for " + gvk);
    }

    @FunctionalInterface
    private interface RegistryCall<T> {
        T run() throws IOException;
    }
}
