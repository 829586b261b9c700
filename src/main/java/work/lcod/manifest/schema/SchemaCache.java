package work.lcod.manifest.schema;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import work.lcod.manifest.identity.GroupVersionKind;

/**
 * Process-wide schema cache shared by concurrent imports. Entries are populated on miss and never evicted:
 * the schema of a type does not change while the process runs.
 *
 * <p>Loads are serialized per type only. Reads of cached types, and loads of other types, never wait on a load
 * in progress.
 */
public final class SchemaCache {
    private final Map<GroupVersionKind, FieldSchema> entries = new ConcurrentHashMap<>();
    private final Map<GroupVersionKind, Object> loadLocks = new ConcurrentHashMap<>();

    public Optional<FieldSchema> get(GroupVersionKind gvk) {
        return Optional.ofNullable(entries.get(gvk));
    }

    /**
     * Returns the cached schema or loads it. Empty loader results are not cached so a later import can retry.
     */
    public Optional<FieldSchema> getOrLoad(GroupVersionKind gvk, Loader loader) throws IOException {
        var cached = entries.get(gvk);
        if (cached != null) {
            return Optional.of(cached);
        }
        var lock = loadLocks.computeIfAbsent(gvk, key -> new Object());
        synchronized (lock) {
            var existing = entries.get(gvk);
            if (existing != null) {
                return Optional.of(existing);
            }
            var loaded = loader.load(gvk);
            loaded.ifPresent(schema -> entries.put(gvk, schema));
            return loaded;
        }
    }

    public int size() {
        return entries.size();
    }

    @FunctionalInterface
    public interface Loader {
        Optional<FieldSchema> load(GroupVersionKind gvk) throws IOException;
    }
}
