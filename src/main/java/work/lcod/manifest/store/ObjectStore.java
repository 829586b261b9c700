package work.lcod.manifest.store;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import work.lcod.manifest.discovery.EndpointDescriptor;

/**
 * Dynamic read access to live objects.
 */
@FunctionalInterface
public interface ObjectStore {
    /**
     * @param namespace namespace of the object, {@code null} for cluster-scoped reads
     * @return the object, or empty when it does not exist
     * @throws IOException when the store cannot be reached or rejects the read
     * @throws InterruptedException when the calling thread is interrupted while waiting on the store
     */
    Optional<Map<String, Object>> get(EndpointDescriptor endpoint, String namespace, String name)
        throws IOException, InterruptedException;
}
