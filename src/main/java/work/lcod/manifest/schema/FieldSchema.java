package work.lcod.manifest.schema;

/**
 * Shape expected at one position of an imported object, as described by the schema registry.
 *
 * <p>Schemas are immutable values; the same instance may be shared by every import of the same type.
 */
public interface FieldSchema {

    static ScalarSchema string() {
        return ScalarSchema.STRING;
    }

    static ScalarSchema number() {
        return ScalarSchema.NUMBER;
    }

    static ScalarSchema bool() {
        return ScalarSchema.BOOL;
    }

    static DynamicSchema dynamic() {
        return DynamicSchema.INSTANCE;
    }

    static ListSchema list(FieldSchema element) {
        return new ListSchema(element);
    }

    static SetSchema set(FieldSchema element) {
        return new SetSchema(element);
    }

    static MapSchema map(FieldSchema value) {
        return new MapSchema(value);
    }

    static ObjectSchema.Builder object() {
        return ObjectSchema.builder();
    }
}
