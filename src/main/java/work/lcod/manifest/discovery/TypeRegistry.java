package work.lcod.manifest.discovery;

import java.io.IOException;
import java.util.Optional;
import work.lcod.manifest.identity.GroupVersionKind;

/**
 * Maps resource kinds to API endpoints. Empty results mean the type is unknown; {@link IOException} means the
 * registry could not be reached.
 */
public interface TypeRegistry {
    Optional<EndpointDescriptor> lookupEndpoint(GroupVersionKind gvk) throws IOException;

    Optional<Boolean> isNamespaceScoped(GroupVersionKind gvk) throws IOException;
}
