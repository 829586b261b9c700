package work.lcod.manifest.schema;

import java.util.Locale;

/**
 * Primitive kinds a scalar schema position can declare.
 */
public enum ScalarKind {
    STRING,
    NUMBER,
    BOOL;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
