package work.lcod.manifest.filter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drops the fields the API server owns so they never end up in operator configuration.
 *
 * <p>Only the top-level {@code status} block and a fixed set of {@code metadata} keys are touched; the object body
 * is copied as is. The input map is left unchanged.
 */
public final class ServerFieldFilter {
    public static final String STATUS = "status";
    public static final String METADATA = "metadata";
    public static final Set<String> SERVER_METADATA = Set.of(
        "uid",
        "creationTimestamp",
        "resourceVersion",
        "generation",
        "selfLink",
        "managedFields"
    );

    private ServerFieldFilter() {}

    public static Map<String, Object> filter(Map<String, Object> object) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (object == null) {
            return out;
        }
        for (var entry : object.entrySet()) {
            String key = entry.getKey();
            if (STATUS.equals(key)) {
                continue;
            }
            if (METADATA.equals(key) && entry.getValue() instanceof Map<?, ?> metadata) {
                out.put(key, filterMetadata(metadata));
            } else {
                out.put(key, deepCopy(entry.getValue()));
            }
        }
        return out;
    }

    private static Map<String, Object> filterMetadata(Map<?, ?> metadata) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (var entry : metadata.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (!SERVER_METADATA.contains(key)) {
                out.put(key, deepCopy(entry.getValue()));
            }
        }
        return out;
    }

    private static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        return value;
    }
}
