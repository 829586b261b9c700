package work.lcod.manifest.schema;

import java.util.Objects;

public record ScalarSchema(ScalarKind kind) implements FieldSchema {
    static final ScalarSchema STRING = new ScalarSchema(ScalarKind.STRING);
    static final ScalarSchema NUMBER = new ScalarSchema(ScalarKind.NUMBER);
    static final ScalarSchema BOOL = new ScalarSchema(ScalarKind.BOOL);

    public ScalarSchema {
        Objects.requireNonNull(kind, "kind");
    }
}
